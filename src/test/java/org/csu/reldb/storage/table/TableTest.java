package org.csu.reldb.storage.table;

import org.csu.reldb.common.exception.ConstraintException;
import org.csu.reldb.common.exception.ExecutionException;
import org.csu.reldb.common.exception.SchemaException;
import org.csu.reldb.common.model.Column;
import org.csu.reldb.common.model.DataType;
import org.csu.reldb.common.model.Value;
import org.csu.reldb.storage.index.BTreeIndex;
import org.csu.reldb.storage.index.HashIndex;
import org.csu.reldb.storage.index.IndexType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 表的约束、墓碑与索引维护
 */
public class TableTest {

    private Table users;

    @BeforeEach
    void setUp() {
        users = new Table("users", List.of(
                new Column("id", DataType.INT, null, false, true, false, Value.NULL),
                new Column("name", DataType.VARCHAR, 20, false, false, false, Value.NULL),
                new Column("email", DataType.VARCHAR, 50, true, false, true, Value.NULL),
                new Column("age", DataType.INT, null, true, false, false, new Value(18L))
        ));
    }

    private static Map<String, Value> row(Object... pairs) {
        Map<String, Value> data = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            Object v = pairs[i + 1];
            Value value;
            if (v == null) {
                value = Value.NULL;
            } else if (v instanceof Integer n) {
                value = new Value((long) n);
            } else {
                value = new Value((String) v);
            }
            data.put((String) pairs[i], value);
        }
        return data;
    }

    private List<Long> ids(List<RowSlot> slots) {
        return slots.stream().map(slot -> slot.row().get("id").asLong()).collect(Collectors.toList());
    }

    @Test
    void testConstraintColumnsGetBTreeIndexes() {
        assertEquals(2, users.getIndexes().size());
        assertInstanceOf(BTreeIndex.class, users.getIndex("id"));
        assertInstanceOf(BTreeIndex.class, users.getIndex("email"));
        assertNull(users.getIndex("name"));
    }

    @Test
    void testInsertAssignsRowIdsAndDefaults() {
        Row first = users.insert(row("id", 1, "name", "Alice"));
        Row second = users.insert(row("id", "2", "name", "Bob", "age", 40));
        assertEquals(0, first.rowId());
        assertEquals(1, second.rowId());
        assertEquals(18L, first.get("age").asLong(), "未提供的列取默认值");
        assertTrue(first.get("email").isNull());
        assertEquals(2L, second.get("id").asLong(), "文本 '2' 转换为 INT");
        assertEquals(List.of("id", "name", "email", "age"), List.copyOf(first.data().keySet()));
        assertEquals(2, users.getRowCount());
        assertEquals(2, users.getNextRowId());
    }

    @Test
    void testPrimaryKeyAndUniqueViolations() {
        users.insert(row("id", 1, "name", "Alice", "email", "a@x.com"));

        ConstraintException pk = assertThrows(ConstraintException.class,
                () -> users.insert(row("id", 1, "name", "Other")));
        assertEquals("Duplicate value '1' for PRIMARY KEY column 'id'", pk.getMessage());

        ConstraintException unique = assertThrows(ConstraintException.class,
                () -> users.insert(row("id", 2, "name", "Bob", "email", "a@x.com")));
        assertEquals("Duplicate value 'a@x.com' for UNIQUE column 'email'", unique.getMessage());

        // 失败的插入不改变表，也不消耗 rowId
        assertEquals(1, users.getRowCount());
        assertEquals(1, users.getNextRowId());
        assertEquals(1, users.getIndex("id").size());
    }

    @Test
    void testUniqueAllowsMultipleNulls() {
        users.insert(row("id", 1, "name", "A"));
        users.insert(row("id", 2, "name", "B"));
        assertEquals(2, users.getRowCount());
        assertEquals(0, users.getIndex("email").size());
    }

    @Test
    void testNotNullAndUnknownColumn() {
        assertThrows(ConstraintException.class, () -> users.insert(row("id", 1)));
        assertThrows(ConstraintException.class, () -> users.insert(row("id", null, "name", "A")));
        SchemaException e = assertThrows(SchemaException.class,
                () -> users.insert(row("id", 1, "name", "A", "salary", 10)));
        assertEquals("Unknown column 'salary' in table 'users'", e.getMessage());
    }

    @Test
    void testDeleteLeavesTombstone() {
        users.insert(row("id", 1, "name", "A"));
        users.insert(row("id", 2, "name", "B"));
        users.insert(row("id", 3, "name", "C"));

        users.delete(1);
        assertEquals(2, users.getRowCount());
        assertEquals(3, users.getSlotCount());
        assertTrue(users.getSlots().get(1).isTombstone());
        assertEquals(List.of(1L, 3L), ids(users.scan()));
        assertTrue(users.findByColumn("id", new Value(2L)).isEmpty());

        ExecutionException deleted = assertThrows(ExecutionException.class, () -> users.delete(1));
        assertEquals("Row slot 1 in table 'users' has been deleted", deleted.getMessage());
        assertThrows(ExecutionException.class, () -> users.delete(10));

        // 删除后主键值可以复用，新行追加在末尾
        Row reused = users.insert(row("id", 2, "name", "B2"));
        assertEquals(3, reused.rowId());
        assertEquals(4, users.getSlotCount());
    }

    @Test
    void testUpdateMaintainsIndexes() {
        users.insert(row("id", 1, "name", "A", "email", "a@x.com"));
        users.insert(row("id", 2, "name", "B", "email", "b@x.com"));

        Row updated = users.update(0, row("id", 10, "email", "new@x.com"));
        assertEquals(0, updated.rowId(), "rowId 保持不变");
        assertEquals("A", updated.get("name").asText());
        assertTrue(users.findByColumn("id", new Value(1L)).isEmpty());
        assertEquals(1, users.findByColumn("id", new Value(10L)).size());
        assertEquals(1, users.findByColumn("email", new Value("new@x.com")).size());

        // 更新为自己当前的值不算冲突
        users.update(1, row("id", 2));
        assertThrows(ConstraintException.class, () -> users.update(1, row("id", 10)));
        assertThrows(ConstraintException.class, () -> users.update(1, row("name", null)));
        assertEquals("B", users.getSlots().get(1).row().get("name").asText());
    }

    @Test
    void testFindByColumnWithAndWithoutIndex() {
        users.insert(row("id", 1, "name", "A", "age", 30));
        users.insert(row("id", 2, "name", "B", "age", 40));
        users.insert(row("id", 3, "name", "C", "age", 30));

        List<Long> scanned = ids(users.findByColumn("age", new Value(30L)));
        assertTrue(users.createIndex("age"));
        List<Long> indexed = ids(users.findByColumn("age", new Value(30L)));
        assertEquals(List.of(1L, 3L), scanned);
        assertEquals(scanned, indexed);
        assertTrue(users.findByColumn("age", Value.NULL).isEmpty());
    }

    @Test
    void testFindByRangeIndexMatchesScan() {
        for (int i = 1; i <= 20; i++) {
            users.insert(row("id", i, "name", "n" + i, "age", 20 + (i % 7)));
        }
        users.delete(2);
        users.insert(row("id", 21, "name", "nobody", "age", null));

        // 年龄取值 20..26；包括开放端点、lo > hi 以及完全落在数据之外的区间
        Long[][] bounds = {
                {22L, 24L}, {20L, 26L}, {23L, 23L}, {null, 22L}, {24L, null}, {null, null},
                {25L, 21L}, {0L, 10L}, {40L, 50L}, {0L, 100L}, {26L, 1000L}, {null, 19L}
        };
        List<List<Long>> scanned = new ArrayList<>();
        for (Long[] bound : bounds) {
            scanned.add(sorted(ids(users.findByRange("age", toValue(bound[0]), toValue(bound[1])))));
        }
        users.createIndex("age", IndexType.BTREE);
        for (int i = 0; i < bounds.length; i++) {
            List<Long> indexed = sorted(ids(users.findByRange("age", toValue(bounds[i][0]), toValue(bounds[i][1]))));
            assertEquals(scanned.get(i), indexed, "区间 [" + bounds[i][0] + ", " + bounds[i][1] + "]");
            assertFalse(indexed.contains(3L), "墓碑行不应出现");
            assertFalse(indexed.contains(21L), "Null 不参与范围查找");
        }
        assertEquals(List.of(10L, 17L), scanned.get(2));
        assertEquals(19, scanned.get(5).size());
        assertTrue(scanned.get(6).isEmpty());
        assertTrue(scanned.get(7).isEmpty());
        assertTrue(scanned.get(8).isEmpty());
    }

    private static Value toValue(Long n) {
        return n == null ? null : new Value(n);
    }

    private static List<Long> sorted(List<Long> ids) {
        return ids.stream().sorted().collect(Collectors.toList());
    }

    @Test
    void testRestoreRejectsIndexEntryWithoutLiveRow() {
        users.insert(row("id", 1, "name", "A", "age", 30));
        users.insert(row("id", 2, "name", "B", "age", 40));
        users.delete(1);
        List<RowSlot> slots = users.getSlots();

        BTreeIndex pastEnd = new BTreeIndex("age", 3);
        pastEnd.insert(new Value(30L), 0);
        pastEnd.insert(new Value(50L), 7);
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> Table.restore("users", users.getColumns(), 3, slots, List.of(pastEnd), 2));
        assertTrue(e.getMessage().contains("users.age points to slot 7"), e.getMessage());

        HashIndex onTombstone = new HashIndex("age");
        onTombstone.insert(new Value(40L), 1);
        assertThrows(ExecutionException.class,
                () -> Table.restore("users", users.getColumns(), 3, slots, List.of(onTombstone), 2));

        BTreeIndex valid = new BTreeIndex("age", 3);
        valid.insert(new Value(30L), 0);
        Table restored = Table.restore("users", users.getColumns(), 3, slots, List.of(valid), 2);
        assertEquals(List.of(1L), ids(restored.findByColumn("age", new Value(30L))));
    }

    @Test
    void testCreateIndexBackfillsAndRejectsDuplicates() {
        users.insert(row("id", 1, "name", "A", "age", 30));
        users.insert(row("id", 2, "name", "B"));
        assertTrue(users.createIndex("name", IndexType.HASH));
        assertInstanceOf(HashIndex.class, users.getIndex("name"));
        assertEquals(2, users.getIndex("name").size());
        assertFalse(users.createIndex("name", IndexType.BTREE));
        assertFalse(users.createIndex("id"), "主键列已有索引");
        assertThrows(SchemaException.class, () -> users.createIndex("salary"));
    }

    @Test
    void testDuplicateColumnNames() {
        assertThrows(SchemaException.class, () -> new Table("t", List.of(
                new Column("a", DataType.INT), new Column("a", DataType.VARCHAR))));
    }

    @Test
    void testDescribe() {
        assertEquals("id INT PRIMARY KEY NOT NULL\nname VARCHAR(20) NOT NULL\nemail VARCHAR(50) UNIQUE\nage INT DEFAULT 18",
                users.describe());
    }
}
