package org.csu.reldb.storage.snapshot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.csu.reldb.common.exception.ExecutionException;
import org.csu.reldb.common.model.Column;
import org.csu.reldb.common.model.DataType;
import org.csu.reldb.common.model.Value;
import org.csu.reldb.common.model.ValueType;
import org.csu.reldb.storage.index.BTreeIndex;
import org.csu.reldb.storage.index.HashIndex;
import org.csu.reldb.storage.index.IndexType;
import org.csu.reldb.storage.table.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SnapshotCodecTest {

    private final SnapshotCodec codec = new SnapshotCodec();
    private Table events;

    @BeforeEach
    void setUp() {
        events = new Table("events", List.of(
                new Column("id", DataType.INT, null, false, true, false, Value.NULL),
                new Column("title", DataType.VARCHAR, 40, true, false, false, new Value("untitled")),
                new Column("score", DataType.FLOAT),
                new Column("public", DataType.BOOLEAN),
                new Column("starts_at", DataType.DATETIME)
        ));
        events.insert(event(1, "Launch", 9.5, true, "2024-01-15 10:30:00"));
        events.insert(event(2, "Review", 7.0, false, "2024-02-01 09:00:00"));
        events.insert(event(3, "Retro", 8.25, true, "2024-03-10"));
        events.delete(1);
        events.createIndex("title", IndexType.HASH);
        events.createIndex("score", IndexType.BTREE);
    }

    private static Map<String, Value> event(long id, String title, double score, boolean isPublic, String startsAt) {
        Map<String, Value> data = new LinkedHashMap<>();
        data.put("id", new Value(id));
        data.put("title", new Value(title));
        data.put("score", new Value(score));
        data.put("public", new Value(isPublic));
        data.put("starts_at", new Value(startsAt));
        return data;
    }

    @Test
    void testEncodedDocumentShape() {
        ObjectNode root = codec.encode("demo", LocalDateTime.of(2024, 5, 1, 12, 0), List.of(events));
        assertEquals("demo", root.get("name").asText());
        assertEquals("2024-05-01T12:00", root.get("created_at").asText());

        JsonNode table = root.get("tables").get("events");
        assertEquals(5, table.get("columns").size());
        assertEquals("VARCHAR", table.get("columns").get(1).get("data_type").asText());
        assertEquals(40, table.get("columns").get(1).get("length").asInt());
        assertEquals("untitled", table.get("columns").get(1).get("default").asText());
        assertTrue(table.get("columns").get(2).get("length").isNull());
        assertEquals("starts_at", table.get("column_order").get(4).asText());

        JsonNode rows = table.get("rows");
        assertEquals(3, rows.size());
        assertTrue(rows.get(1).isNull(), "墓碑写作 null");
        assertEquals(2, rows.get(2).get("row_id").asInt());
        assertEquals("2024-03-10 00:00:00", rows.get(2).get("data").get("starts_at").asText());
        assertEquals(3, table.get("next_row_id").asInt());

        JsonNode pkIndex = table.get("indexes").get("id");
        assertEquals(3, pkIndex.get("order").asInt());
        assertEquals(2, pkIndex.get("size").asInt());
        assertEquals(1, pkIndex.get("entries").get(0).get(0).asInt());
        assertEquals(0, pkIndex.get("entries").get(0).get(1).asInt());

        JsonNode hashIndex = table.get("indexes").get("title");
        assertFalse(hashIndex.has("order"));
        assertEquals(2, hashIndex.get("index").get("Retro").get(0).asInt());
    }

    @Test
    void testDecodeRestoresTablesAndIndexes() {
        ObjectNode root = codec.encode("demo", LocalDateTime.now(), List.of(events));
        DatabaseSnapshot snapshot = codec.decode(root, 3);
        assertEquals("demo", snapshot.name());
        Table restored = snapshot.tables().get(0);

        assertEquals("events", restored.getName());
        assertEquals(events.getColumnOrder(), restored.getColumnOrder());
        assertEquals(3, restored.getSlotCount());
        assertEquals(2, restored.getRowCount());
        assertTrue(restored.getSlots().get(1).isTombstone());
        assertEquals(3, restored.getNextRowId());

        Value startsAt = restored.getSlots().get(0).row().get("starts_at");
        assertEquals(ValueType.TIMESTAMP, startsAt.getType());
        assertEquals(LocalDateTime.of(2024, 1, 15, 10, 30), startsAt.asTimestamp());
        assertEquals(ValueType.FLOAT, restored.getSlots().get(2).row().get("score").getType());
        assertEquals("untitled", restored.getColumn("title").getDefaultValue().asText());
        assertEquals(Integer.valueOf(40), restored.getColumn("title").getLength());

        assertInstanceOf(HashIndex.class, restored.getIndex("title"));
        assertInstanceOf(BTreeIndex.class, restored.getIndex("score"));
        assertEquals(List.of(2), restored.getIndex("title").search(new Value("Retro")));
        assertEquals(1, restored.findByRange("score", new Value(9.0), null).size());
        assertEquals(1, restored.findByColumn("id", new Value(3L)).size());
    }

    @Test
    void testRoundTripThroughJsonText() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode root = codec.encode("demo", LocalDateTime.now(), List.of(events));
        JsonNode reparsed = mapper.readTree(mapper.writeValueAsString(root));
        Table restored = codec.decode(reparsed, 3).tables().get(0);
        assertEquals(codec.encodeTable(events), codec.encodeTable(restored));
    }

    @Test
    void testMissingPrimaryKeyIndexIsRebuilt() {
        ObjectNode root = codec.encode("demo", LocalDateTime.now(), List.of(events));
        ((ObjectNode) root.get("tables").get("events").get("indexes")).remove("id");
        Table restored = codec.decode(root, 3).tables().get(0);
        assertEquals(2, restored.getIndex("id").size());
        assertEquals(1, restored.findByColumn("id", new Value(1L)).size());
    }

    @Test
    void testCorruptSnapshot() {
        ObjectNode root = codec.encode("demo", LocalDateTime.now(), List.of(events));
        ((ObjectNode) root.get("tables").get("events")).remove("columns");
        ExecutionException e = assertThrows(ExecutionException.class, () -> codec.decode(root, 3));
        assertTrue(e.getMessage().startsWith("Corrupt snapshot"), e.getMessage());
    }

    @Test
    void testValueEncoding() {
        assertTrue(codec.encodeValue(Value.NULL).isNull());
        assertTrue(codec.encodeValue(new Value(5L)).isIntegralNumber());
        assertTrue(codec.encodeValue(new Value(5.0)).isFloatingPointNumber());
        assertEquals(ValueType.INT, codec.decodeValue(codec.encodeValue(new Value(5L))).getType());
        assertEquals(ValueType.FLOAT, codec.decodeValue(codec.encodeValue(new Value(5.0))).getType());
        assertTrue(codec.decodeValue(null).isNull());
    }
}
