package tabular;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Samples read from one resource, keyed by a fresh random identifier per table so that
 * sibling sheets never collide. Iteration follows insertion order.
 */
public final class SampleSet {

    private final Map<String, Table> samples = new LinkedHashMap<>();

    public static SampleSet of(Table... tables) {
        SampleSet set = new SampleSet();
        for (Table table : tables) {
            set.add(table);
        }
        return set;
    }

    /** @return the key the table was stored under */
    public String add(Table table) {
        Objects.requireNonNull(table, "table must not be null");
        String key = UUID.randomUUID().toString();
        samples.put(key, table);
        return key;
    }

    public void addAll(SampleSet other) {
        samples.putAll(other.samples);
    }

    public Table get(String key) {
        return samples.get(key);
    }

    public Map<String, Table> asMap() {
        return Collections.unmodifiableMap(samples);
    }

    public Collection<Table> tables() {
        return Collections.unmodifiableCollection(samples.values());
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    /** New set with every table mapped, keys preserved. */
    public SampleSet map(UnaryOperator<Table> mapper) {
        SampleSet mapped = new SampleSet();
        samples.forEach((key, table) -> mapped.samples.put(key, mapper.apply(table)));
        return mapped;
    }

    @Override
    public String toString() {
        return "SampleSet{keys=" + samples.keySet() + '}';
    }
}
