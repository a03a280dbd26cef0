package tabular;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SampleSetTest {

    private static Table table(String column) {
        return Table.fromRows(List.of(column), List.of(List.of("v")));
    }

    @Test
    @DisplayName("Sibling tables never collide and keep insertion order")
    void add_FreshKeysInOrder() {
        SampleSet set = new SampleSet();
        String first = set.add(table("a"));
        String second = set.add(table("a"));

        assertNotEquals(first, second);
        assertEquals(2, set.size());
        assertEquals(List.of(first, second), List.copyOf(set.asMap().keySet()));
    }

    @Test
    @DisplayName("map keeps the keys and replaces the tables")
    void map_PreservesKeys() {
        SampleSet set = SampleSet.of(table("a"), table("b"));
        SampleSet mapped = set.map(Table::markHeaderResolved);

        assertEquals(set.asMap().keySet(), mapped.asMap().keySet());
        mapped.tables().forEach(t -> assertTrue(t.isHeaderResolved()));
        set.tables().forEach(t -> assertFalse(t.isHeaderResolved()));
    }

    @Test
    @DisplayName("addAll merges another set")
    void addAll_Merges() {
        SampleSet set = SampleSet.of(table("a"));
        set.addAll(SampleSet.of(table("b"), table("c")));
        assertEquals(3, set.size());
        assertFalse(set.isEmpty());
    }
}
