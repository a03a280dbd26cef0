package reference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable table of countries and their ISO 3166 alpha-3 and alpha-2 codes, keyed by
 * alpha-3 code in load order.
 */
public final class CountryReference {

    /** One country row. */
    public record Country(String iso3, String iso2, String name) {
        public Country {
            Objects.requireNonNull(iso3, "iso3 must not be null");
            Objects.requireNonNull(iso2, "iso2 must not be null");
            if (iso3.isBlank() || iso2.isBlank()) {
                throw new IllegalArgumentException("Country codes must not be blank");
            }
            name = (name == null) ? "" : name;
        }
    }

    private final Map<String, Country> countries;

    public CountryReference(List<Country> countries) {
        Objects.requireNonNull(countries, "countries must not be null");
        Map<String, Country> byIso3 = new LinkedHashMap<>();
        for (Country country : countries) {
            byIso3.put(country.iso3(), country);
        }
        this.countries = Collections.unmodifiableMap(byIso3);
    }

    public Map<String, Country> asMap() {
        return countries;
    }

    public Optional<Country> byIso3(String iso3) {
        return Optional.ofNullable(countries.get(iso3));
    }

    public List<String> iso3Codes() {
        List<String> codes = new ArrayList<>(countries.size());
        countries.values().forEach(c -> codes.add(c.iso3()));
        return codes;
    }

    public List<String> iso2Codes() {
        List<String> codes = new ArrayList<>(countries.size());
        countries.values().forEach(c -> codes.add(c.iso2()));
        return codes;
    }

    public int size() {
        return countries.size();
    }

    public boolean isEmpty() {
        return countries.isEmpty();
    }
}
