package org.csu.reldb.common.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ValueTest {

    @Test
    void testNumericComparisonAcrossIntAndFloat() {
        assertEquals(0, new Value(1L).compareTo(new Value(1.0)));
        assertTrue(new Value(2L).compareTo(new Value(2.5)) < 0);
        assertTrue(new Value(3.5).compareTo(new Value(3L)) > 0);
        assertTrue(new Value(1L).isComparableWith(new Value(1.5)));
    }

    @Test
    void testNumericEqualityAndHashCode() {
        // 1 与 1.0 相等，哈希一致，因此落在同一个哈希桶
        assertEquals(new Value(1L), new Value(1.0));
        assertEquals(new Value(1L).hashCode(), new Value(1.0).hashCode());
        assertNotEquals(new Value(1L), new Value("1"));
    }

    @Test
    void testNullSortsFirst() {
        List<Value> values = new ArrayList<>(List.of(new Value("b"), Value.NULL, new Value(3L), new Value(true)));
        Collections.sort(values);
        assertTrue(values.get(0).isNull());
        assertEquals(0, Value.NULL.compareTo(Value.NULL));
    }

    @Test
    void testIncomparableTypes() {
        assertFalse(new Value("abc").isComparableWith(new Value(1L)));
        assertFalse(new Value(true).isComparableWith(new Value(1L)));
        assertFalse(Value.NULL.isComparableWith(new Value(1L)));
        // 全序仍然成立，按类型等级比较
        assertNotEquals(0, new Value("abc").compareTo(new Value(1L)));
    }

    @Test
    void testTimestampComparesWithParsableText() {
        Value timestamp = new Value(LocalDateTime.of(2024, 1, 15, 10, 30, 0));
        assertTrue(timestamp.isComparableWith(new Value("2024-01-15 10:30:00")));
        assertEquals(0, timestamp.compareTo(new Value("2024-01-15 10:30:00")));
        assertTrue(timestamp.compareTo(new Value("2024-01-15")) > 0);
        assertTrue(new Value("2023-12-31").compareTo(timestamp) < 0);
        assertFalse(timestamp.isComparableWith(new Value("yesterday")));
    }

    @Test
    void testParseTimestampFormats() {
        assertEquals(LocalDateTime.of(2024, 3, 1, 8, 0, 5), Value.parseTimestamp("2024-03-01 08:00:05"));
        assertEquals(LocalDateTime.of(2024, 3, 1, 0, 0), Value.parseTimestamp("2024-03-01"));
        assertEquals(LocalDateTime.of(2024, 3, 1, 8, 0, 5), Value.parseTimestamp("2024-03-01T08:00:05"));
        assertNull(Value.parseTimestamp("2024-02-30"));
        assertNull(Value.parseTimestamp("not a date"));
    }

    @Test
    void testRender() {
        assertEquals("NULL", Value.NULL.render());
        assertEquals("42", new Value(42L).render());
        assertEquals("45000.0", new Value(45000.0).render());
        assertEquals("true", new Value(true).render());
        assertEquals("2024-01-15 10:30:00", new Value(LocalDateTime.of(2024, 1, 15, 10, 30)).render());
    }

    @Test
    void testAccessorsRejectWrongType() {
        assertThrows(IllegalStateException.class, () -> new Value("x").asTimestamp());
        assertEquals(7.0, new Value(7L).asDouble());
        assertEquals(7L, new Value(7.9).asLong());
    }
}
