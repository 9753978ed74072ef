package com.specunit.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.specunit.core.Metadata.metadata;
import static org.junit.jupiter.api.Assertions.*;

class MetadataTest {

    @Test
    void buildsFromKeyValuePairsInOrder() {
        Metadata metadata = metadata("b", 1, "a", 2, "c", null);

        assertEquals(List.of("b", "a", "c"), List.copyOf(metadata.keySet()));
        assertTrue(metadata.containsKey("c"));
        assertNull(metadata.get("c"));
    }

    @Test
    void rejectsOddArguments() {
        assertThrows(IllegalArgumentException.class, () -> metadata("a", 1, "b"));
    }

    @Test
    void rejectsNonStringKeys() {
        assertThrows(IllegalArgumentException.class, () -> metadata(1, "a"));
    }

    @Test
    void readsNestedRecords() {
        Metadata inner = metadata("description", "Foo");
        Metadata outer = metadata("example_group", inner, "test_unit", true);

        assertSame(inner, outer.nested("example_group"));
        assertNull(outer.nested("missing"));
        assertThrows(IllegalStateException.class, () -> outer.nested("test_unit"));
    }

    @Test
    void getStringRendersValues() {
        Metadata metadata = metadata("line_number", 12, "empty", null);

        assertEquals("12", metadata.getString("line_number"));
        assertNull(metadata.getString("empty"));
    }

    @Test
    void mergeAbsentKeepsExistingValues() {
        Metadata metadata = metadata("speed", "fast");

        metadata.mergeAbsent(Map.of("speed", "slow", "suite", "unit"));

        assertEquals("fast", metadata.get("speed"));
        assertEquals("unit", metadata.get("suite"));
    }

    @Test
    void copyDoesNotFollowLaterWrites() {
        Metadata inner = metadata("description", "Foo");
        Metadata outer = metadata("example_group", inner);

        Metadata copy = outer.copy();
        inner.put("added", true);
        outer.put("other", 1);

        assertEquals(outer.nested("example_group").size() - 1, copy.nested("example_group").size());
        assertFalse(copy.containsKey("other"));
        assertEquals("Foo", copy.nested("example_group").get("description"));
    }
}
