package org.csu.reldb.storage.snapshot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.csu.reldb.common.exception.ExecutionException;
import org.csu.reldb.common.model.Column;
import org.csu.reldb.common.model.DataType;
import org.csu.reldb.common.model.Value;
import org.csu.reldb.storage.index.BTreeIndex;
import org.csu.reldb.storage.index.HashIndex;
import org.csu.reldb.storage.index.Index;
import org.csu.reldb.storage.table.Row;
import org.csu.reldb.storage.table.RowSlot;
import org.csu.reldb.storage.table.Table;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 数据库快照与 JSON 树之间的转换。
 *
 * 文档结构：{@code {name, created_at, tables: {表名: 表}}}；
 * 表为 {@code {name, columns, column_order, rows, indexes, next_row_id}}，rows 中墓碑写作 null；
 * B 树索引为 {@code {column_name, order, size, entries: [[key, slot], ...]}}，
 * 哈希索引为 {@code {column_name, index: {key文本: [slot, ...]}}}，读取时以是否有 order 字段区分。
 * 读取时所有值都经过所在列的 convert 重新确定类型。
 */
public class SnapshotCodec {

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public ObjectNode encode(String databaseName, LocalDateTime createdAt, Iterable<Table> tables) {
        ObjectNode root = nodes.objectNode();
        root.put("name", databaseName);
        root.put("created_at", createdAt.toString());
        ObjectNode tablesNode = root.putObject("tables");
        for (Table table : tables) {
            tablesNode.set(table.getName(), encodeTable(table));
        }
        return root;
    }

    public ObjectNode encodeTable(Table table) {
        ObjectNode node = nodes.objectNode();
        node.put("name", table.getName());
        ArrayNode columns = node.putArray("columns");
        for (Column column : table.getColumns()) {
            columns.add(encodeColumn(column));
        }
        ArrayNode order = node.putArray("column_order");
        table.getColumnOrder().forEach(order::add);

        ArrayNode rows = node.putArray("rows");
        for (RowSlot slot : table.getSlots()) {
            if (slot.isTombstone()) {
                rows.addNull();
                continue;
            }
            ObjectNode rowNode = rows.addObject();
            rowNode.put("row_id", slot.row().rowId());
            ObjectNode data = rowNode.putObject("data");
            slot.row().data().forEach((key, value) -> data.set(key, encodeValue(value)));
        }

        ObjectNode indexes = node.putObject("indexes");
        for (Index index : table.getIndexes().values()) {
            indexes.set(index.getColumnName(), encodeIndex(index));
        }
        node.put("next_row_id", table.getNextRowId());
        return node;
    }

    private ObjectNode encodeColumn(Column column) {
        ObjectNode node = nodes.objectNode();
        node.put("name", column.getName());
        node.put("data_type", column.getDataType().name());
        if (column.getLength() == null) {
            node.putNull("length");
        } else {
            node.put("length", column.getLength());
        }
        node.put("nullable", column.isNullable());
        node.put("primary_key", column.isPrimaryKey());
        node.put("unique", column.isUnique());
        node.set("default", encodeValue(column.getDefaultValue()));
        return node;
    }

    private ObjectNode encodeIndex(Index index) {
        ObjectNode node = nodes.objectNode();
        node.put("column_name", index.getColumnName());
        if (index instanceof BTreeIndex btree) {
            node.put("order", btree.getOrder());
            node.put("size", btree.size());
            ArrayNode entries = node.putArray("entries");
            for (Map.Entry<Value, Integer> entry : btree.entries()) {
                ArrayNode pair = entries.addArray();
                pair.add(encodeValue(entry.getKey()));
                pair.add(entry.getValue());
            }
        } else if (index instanceof HashIndex hash) {
            ObjectNode buckets = node.putObject("index");
            hash.getBuckets().forEach((key, slots) -> {
                ArrayNode slotArray = buckets.putArray(key.render());
                slots.forEach(slotArray::add);
            });
        } else {
            throw new IllegalArgumentException("Unsupported index type: " + index.getClass().getName());
        }
        return node;
    }

    JsonNode encodeValue(Value value) {
        return switch (value.getType()) {
            case NULL -> nodes.nullNode();
            case INT -> nodes.numberNode(value.asLong());
            case FLOAT -> nodes.numberNode(value.asDouble());
            case BOOL -> nodes.booleanNode(value.asBoolean());
            case TEXT -> nodes.textNode(value.asText());
            case TIMESTAMP -> nodes.textNode(value.render());
        };
    }

    // ------------------------------------------------------------------ 读取

    /**
     * 把快照文档还原为表。
     * @param btreeOrder 恢复后的表新建索引时使用的阶数
     * @throws ExecutionException 文档结构不完整时
     */
    public DatabaseSnapshot decode(JsonNode root, int btreeOrder) {
        String name = requireField(root, "name", "snapshot").asText();
        String createdAt = root.path("created_at").asText(null);
        List<Table> tables = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.path("tables").fields();
        while (fields.hasNext()) {
            tables.add(decodeTable(fields.next().getValue(), btreeOrder));
        }
        return new DatabaseSnapshot(name, createdAt, tables);
    }

    private Table decodeTable(JsonNode node, int btreeOrder) {
        String tableName = requireField(node, "name", "table").asText();
        List<Column> columns = new ArrayList<>();
        for (JsonNode columnNode : requireField(node, "columns", "table '" + tableName + "'")) {
            columns.add(decodeColumn(columnNode));
        }
        Map<String, Column> byName = new LinkedHashMap<>();
        columns.forEach(column -> byName.put(column.getName(), column));

        List<RowSlot> slots = new ArrayList<>();
        for (JsonNode rowNode : node.path("rows")) {
            int position = slots.size();
            if (rowNode.isNull()) {
                slots.add(RowSlot.tombstone(position));
                continue;
            }
            Map<String, Value> data = new LinkedHashMap<>();
            JsonNode dataNode = rowNode.path("data");
            for (Column column : columns) {
                data.put(column.getName(), column.convert(decodeValue(dataNode.path(column.getName()))));
            }
            slots.add(RowSlot.occupied(position, new Row(rowNode.path("row_id").asLong(), data)));
        }

        List<Index> indexes = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> indexFields = node.path("indexes").fields();
        while (indexFields.hasNext()) {
            Map.Entry<String, JsonNode> entry = indexFields.next();
            Column column = byName.get(entry.getKey());
            if (column == null) {
                throw new ExecutionException("Corrupt snapshot: index on unknown column '"
                        + entry.getKey() + "' in table '" + tableName + "'");
            }
            indexes.add(decodeIndex(entry.getValue(), column));
        }
        long nextRowId = node.path("next_row_id").asLong(slots.size());
        return Table.restore(tableName, columns, btreeOrder, slots, indexes, nextRowId);
    }

    private Column decodeColumn(JsonNode node) {
        String name = requireField(node, "name", "column").asText();
        DataType dataType = DataType.fromSqlName(requireField(node, "data_type", "column '" + name + "'").asText());
        JsonNode lengthNode = node.path("length");
        Integer length = lengthNode.isNumber() ? lengthNode.asInt() : null;
        Column bare = new Column(name, dataType);
        Value defaultValue = bare.convert(decodeValue(node.path("default")));
        return new Column(name, dataType, length,
                node.path("nullable").asBoolean(true),
                node.path("primary_key").asBoolean(false),
                node.path("unique").asBoolean(false),
                defaultValue);
    }

    private Index decodeIndex(JsonNode node, Column column) {
        // 有 order 字段的是 B 树
        if (node.has("order")) {
            BTreeIndex btree = new BTreeIndex(column.getName(), node.get("order").asInt());
            for (JsonNode pair : node.path("entries")) {
                btree.insert(column.convert(decodeValue(pair.get(0))), pair.get(1).asInt());
            }
            return btree;
        }
        HashIndex hash = new HashIndex(column.getName());
        Iterator<Map.Entry<String, JsonNode>> buckets = node.path("index").fields();
        while (buckets.hasNext()) {
            Map.Entry<String, JsonNode> bucket = buckets.next();
            Value key = column.convert(new Value(bucket.getKey()));
            for (JsonNode slot : bucket.getValue()) {
                hash.insert(key, slot.asInt());
            }
        }
        return hash;
    }

    Value decodeValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Value.NULL;
        }
        if (node.isBoolean()) {
            return new Value(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return new Value(node.longValue());
        }
        if (node.isNumber()) {
            return new Value(node.doubleValue());
        }
        return new Value(node.asText());
    }

    private JsonNode requireField(JsonNode node, String field, String owner) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new ExecutionException("Corrupt snapshot: " + owner + " is missing '" + field + "'");
        }
        return value;
    }
}
