package classify;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import tabular.SampleSet;
import tabular.Table;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LatLongClassifierTest {

    private final LatLongClassifier classifier = new LatLongClassifier();

    /** Two columns, each with {@code valid} coordinates followed by {@code garbage} junk values. */
    private static Table coordinates(String latHeader, int latValid, String lonHeader, int lonValid, int rows) {
        List<List<Object>> data = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            Object lat = i < latValid ? "-1.29" + i : "n/a";
            Object lon = i < lonValid ? "36.8" + i : "n/a";
            data.add(List.of(lat, lon));
        }
        return Table.fromRows(List.of(latHeader, lonHeader), data);
    }

    @Test
    @DisplayName("18/20 latitudes and 19/20 longitudes confirm both roles")
    void hasLatLong_WithinTolerance_True() {
        assertTrue(classifier.hasLatLong(SampleSet.of(coordinates("Latitude", 18, "Longitude", 19, 20))));
    }

    @Test
    @DisplayName("A latitude column alone is not enough")
    void hasLatLong_LatitudeOnly_False() {
        List<List<Object>> rows = List.of(List.of("-1.5", "Nairobi"), List.of("0.3", "Kisumu"));
        Table table = Table.fromRows(List.of("lat", "Town"), rows);
        assertFalse(classifier.hasLatLong(SampleSet.of(table)));
    }

    @Test
    @DisplayName("Six junk latitudes reject the latitude column")
    void hasLatLong_TooManyMismatches_False() {
        assertFalse(classifier.hasLatLong(SampleSet.of(coordinates("lat", 14, "lon", 20, 20))));
    }

    @Test
    @DisplayName("Numeric coordinate columns are read through their text form")
    void hasLatLong_NumericColumns_True() {
        List<List<Object>> rows = List.of(List.of(-1.2921, 36.8219), List.of(0.5, 35.0));
        Table table = Table.fromRows(List.of("y", "x"), rows);
        assertTrue(classifier.hasLatLong(SampleSet.of(table)));
    }

    @Test
    @DisplayName("HXL geo tags in merged headers are recognized")
    void hasLatLong_MergedTagHeaders_True() {
        assertTrue(classifier.hasLatLong(SampleSet.of(
                coordinates("Lat||#geo+lat", 3, "Long||#geo+lon", 3, 3))));
    }

    @Test
    @DisplayName("One column matching both headers can fill both roles")
    void hasLatLong_SingleColumnBothRoles_True() {
        List<List<Object>> rows = List.of(List.of("12.5"), List.of("13.25"));
        Table table = Table.fromRows(List.of("lat||lon"), rows);
        assertTrue(classifier.hasLatLong(SampleSet.of(table)));
    }

    @Test
    @DisplayName("A rejected latitude candidate leaves room for a later one")
    void hasLatLong_SecondLatitudeCandidate_True() {
        List<List<Object>> rows = List.of(
                List.of("north", "10.5", "40.1"),
                List.of("south", "11.5", "41.1"));
        Table table = Table.fromRows(List.of("Latitude label", "LAT_DD", "LON_DD"), rows);
        assertTrue(classifier.hasLatLong(SampleSet.of(table)));
    }

    @Test
    @DisplayName("Roles must be confirmed in the same sample")
    void hasLatLong_RolesInDifferentSamples_False() {
        Table latitudes = Table.fromRows(List.of("lat"), List.of(List.of("1.5")));
        Table longitudes = Table.fromRows(List.of("lon"), List.of(List.of("2.5")));
        assertFalse(classifier.hasLatLong(SampleSet.of(latitudes, longitudes)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Latitude", "latitud", "lat", "LAT_DD", "y", "Point_Y", "#geo+lat", "# geo +lat", "Site||#geo+lat"})
    @DisplayName("headerMatches: latitude headers")
    void headerMatches_Latitude(String label) {
        assertTrue(LatLongClassifier.headerMatches(LatLongClassifier.LATITUDE_HEADER, label));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Longitude", "long", "lon", "x", "POINT_X", "#geo+lon", "Site||#geo+lon"})
    @DisplayName("headerMatches: longitude headers")
    void headerMatches_Longitude(String label) {
        assertTrue(LatLongClassifier.headerMatches(LatLongClassifier.LONGITUDE_HEADER, label));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Name", "population", "#adm1+code"})
    @DisplayName("headerMatches: other headers match neither role")
    void headerMatches_Other(String label) {
        assertFalse(LatLongClassifier.headerMatches(LatLongClassifier.LATITUDE_HEADER, label));
        assertFalse(LatLongClassifier.headerMatches(LatLongClassifier.LONGITUDE_HEADER, label));
    }
}
