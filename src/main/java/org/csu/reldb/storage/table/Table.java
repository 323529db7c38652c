package org.csu.reldb.storage.table;

import lombok.Getter;
import org.csu.reldb.common.exception.ConstraintException;
import org.csu.reldb.common.exception.ExecutionException;
import org.csu.reldb.common.exception.SchemaException;
import org.csu.reldb.common.model.Column;
import org.csu.reldb.common.model.Value;
import org.csu.reldb.storage.index.BTreeIndex;
import org.csu.reldb.storage.index.HashIndex;
import org.csu.reldb.storage.index.Index;
import org.csu.reldb.storage.index.IndexType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 表：模式、行存储、约束检查与索引维护。
 *
 * 行存放在只追加的槽位列表中，删除只把槽位标记为墓碑，槽位位置因此可以作为索引记录的稳定引用。
 * 每个 PRIMARY KEY 和 UNIQUE 列在建表时各自拥有一个 B 树索引。
 */
public class Table {

    private static final Logger log = LoggerFactory.getLogger(Table.class);

    @Getter
    private final String name;
    private final List<Column> columns;
    private final Map<String, Column> columnMap = new LinkedHashMap<>();
    private final List<RowSlot> slots = new ArrayList<>();
    private final Map<String, Index> indexes = new LinkedHashMap<>();
    @Getter
    private final int btreeOrder;
    @Getter
    private long nextRowId = 0;

    public Table(String name, List<Column> columns) {
        this(name, columns, BTreeIndex.DEFAULT_ORDER);
    }

    public Table(String name, List<Column> columns, int btreeOrder) {
        this.name = name;
        this.columns = List.copyOf(columns);
        this.btreeOrder = btreeOrder;
        for (Column column : columns) {
            if (columnMap.put(column.getName(), column) != null) {
                throw new SchemaException("Duplicate column name '" + column.getName() + "' in table '" + name + "'");
            }
        }
        for (Column column : columns) {
            if (column.requiresUniqueness()) {
                indexes.put(column.getName(), new BTreeIndex(column.getName(), btreeOrder));
            }
        }
    }

    /**
     * 从快照恢复一张表：槽位、索引与 rowId 计数器原样还原，不重新校验行数据。
     * @throws ExecutionException 索引记录指向不存在或已删除的槽位时
     */
    public static Table restore(String name, List<Column> columns, int btreeOrder,
                                List<RowSlot> slots, Collection<Index> indexes, long nextRowId) {
        Table table = new Table(name, columns, btreeOrder);
        table.slots.addAll(slots);
        Map<String, Index> automatic = new LinkedHashMap<>(table.indexes);
        for (Index index : indexes) {
            table.checkIndexPositions(index);
            table.indexes.put(index.getColumnName(), index);
            automatic.remove(index.getColumnName());
        }
        // 快照中缺失的主键 / 唯一索引按行数据重建
        for (Index index : automatic.values()) {
            for (RowSlot slot : table.scan()) {
                Value value = slot.row().get(index.getColumnName());
                if (!value.isNull()) {
                    index.insert(value, slot.position());
                }
            }
        }
        table.nextRowId = nextRowId;
        return table;
    }

    private void checkIndexPositions(Index index) {
        for (Map.Entry<Value, Integer> entry : index.entries()) {
            int position = entry.getValue();
            if (position < 0 || position >= slots.size() || slots.get(position).isTombstone()) {
                throw new ExecutionException(String.format(
                        "Corrupt snapshot: index on %s.%s points to slot %d, which holds no live row (%d slots)",
                        name, index.getColumnName(), position, slots.size()));
            }
        }
    }

    // ------------------------------------------------------------------ 模式

    public List<Column> getColumns() {
        return columns;
    }

    /**
     * @return 列定义，不存在时返回 null
     */
    public Column getColumn(String columnName) {
        return columnMap.get(columnName);
    }

    public boolean hasColumn(String columnName) {
        return columnMap.containsKey(columnName);
    }

    public List<String> getColumnOrder() {
        return columns.stream().map(Column::getName).collect(Collectors.toList());
    }

    public Map<String, Index> getIndexes() {
        return Collections.unmodifiableMap(indexes);
    }

    public Index getIndex(String columnName) {
        return indexes.get(columnName);
    }

    /**
     * 每列一行的模式描述，例如 {@code id INT PRIMARY KEY}。
     */
    public String describe() {
        return columns.stream().map(Column::describe).collect(Collectors.joining("\n"));
    }

    private Column requireColumn(String columnName) {
        Column column = columnMap.get(columnName);
        if (column == null) {
            throw new SchemaException("Unknown column '" + columnName + "' in table '" + name + "'");
        }
        return column;
    }

    // ------------------------------------------------------------------ 索引

    public boolean createIndex(String columnName) {
        return createIndex(columnName, IndexType.BTREE);
    }

    /**
     * 在列上建立索引，并用所有存活行的非空值一次性填充。
     * @return 列上已有索引时返回 false
     */
    public boolean createIndex(String columnName, IndexType type) {
        requireColumn(columnName);
        if (indexes.containsKey(columnName)) {
            return false;
        }
        Index index = type == IndexType.HASH
                ? new HashIndex(columnName)
                : new BTreeIndex(columnName, btreeOrder);
        for (RowSlot slot : scan()) {
            Value value = slot.row().get(columnName);
            if (!value.isNull()) {
                index.insert(value, slot.position());
            }
        }
        indexes.put(columnName, index);
        log.info("Created {} index on {}.{} with {} entries", type, name, columnName, index.size());
        return true;
    }

    // ------------------------------------------------------------------ 写入

    /**
     * 插入一行。未提供的列取默认值，没有默认值则为 Null。校验失败时表不做任何改动。
     */
    public Row insert(Map<String, Value> data) {
        Map<String, Value> full = new LinkedHashMap<>();
        for (String key : data.keySet()) {
            requireColumn(key);
        }
        for (Column column : columns) {
            full.put(column.getName(), data.containsKey(column.getName())
                    ? data.get(column.getName())
                    : column.getDefaultValue());
        }
        Map<String, Value> converted = validateRow(full, false, -1);

        Row row = new Row(nextRowId++, converted);
        int position = slots.size();
        slots.add(RowSlot.occupied(position, row));
        for (Index index : indexes.values()) {
            Value value = row.get(index.getColumnName());
            if (!value.isNull()) {
                index.insert(value, position);
            }
        }
        return row;
    }

    /**
     * 校验并转换一行数据。
     * @param updateMode 为 true 时只校验提供的列
     * @param excludeSlot 唯一性检查时忽略的槽位（正在更新的行自身），插入时传 -1
     * @return 转换后的列值，按列顺序排列
     */
    public Map<String, Value> validateRow(Map<String, Value> data, boolean updateMode, int excludeSlot) {
        for (String key : data.keySet()) {
            requireColumn(key);
        }
        Map<String, Value> converted = new LinkedHashMap<>();
        for (Column column : columns) {
            if (updateMode && !data.containsKey(column.getName())) {
                continue;
            }
            Value value = column.validate(data.getOrDefault(column.getName(), Value.NULL));
            if (column.requiresUniqueness() && !value.isNull()) {
                for (RowSlot holder : findByColumn(column.getName(), value)) {
                    if (holder.position() != excludeSlot) {
                        throw new ConstraintException(String.format("Duplicate value '%s' for %s column '%s'",
                                value.render(), column.isPrimaryKey() ? "PRIMARY KEY" : "UNIQUE", column.getName()));
                    }
                }
            }
            converted.put(column.getName(), value);
        }
        return converted;
    }

    /**
     * 更新指定槽位的行，只转换并校验变化的列，索引随之调整。
     */
    public Row update(int slot, Map<String, Value> updates) {
        Row oldRow = requireLiveRow(slot);
        Map<String, Value> converted = validateRow(updates, true, slot);

        for (Map.Entry<String, Value> entry : converted.entrySet()) {
            Index index = indexes.get(entry.getKey());
            if (index == null) {
                continue;
            }
            Value oldValue = oldRow.get(entry.getKey());
            if (!oldValue.isNull()) {
                index.delete(oldValue, slot);
            }
            if (!entry.getValue().isNull()) {
                index.insert(entry.getValue(), slot);
            }
        }
        Map<String, Value> newData = new LinkedHashMap<>(oldRow.data());
        newData.putAll(converted);
        Row newRow = new Row(oldRow.rowId(), newData);
        slots.set(slot, RowSlot.occupied(slot, newRow));
        return newRow;
    }

    /**
     * 删除指定槽位的行：先从所有索引中移除，再把槽位标记为墓碑。
     */
    public void delete(int slot) {
        Row row = requireLiveRow(slot);
        for (Index index : indexes.values()) {
            Value value = row.get(index.getColumnName());
            if (!value.isNull()) {
                index.delete(value, slot);
            }
        }
        slots.set(slot, RowSlot.tombstone(slot));
    }

    private Row requireLiveRow(int slot) {
        if (slot < 0 || slot >= slots.size()) {
            throw new ExecutionException("Row slot " + slot + " is out of range for table '" + name + "'");
        }
        RowSlot rowSlot = slots.get(slot);
        if (rowSlot.isTombstone()) {
            throw new ExecutionException("Row slot " + slot + " in table '" + name + "' has been deleted");
        }
        return rowSlot.row();
    }

    // ------------------------------------------------------------------ 读取

    /**
     * 按槽位顺序返回所有存活行。
     */
    public List<RowSlot> scan() {
        List<RowSlot> live = new ArrayList<>();
        for (RowSlot slot : slots) {
            if (slot.isOccupied()) {
                live.add(slot);
            }
        }
        return live;
    }

    /**
     * 等值查找，列上有索引时走索引，否则全表扫描。Null 不与任何值相等。
     */
    public List<RowSlot> findByColumn(String columnName, Value value) {
        requireColumn(columnName);
        if (value.isNull()) {
            return new ArrayList<>();
        }
        Index index = indexes.get(columnName);
        if (index != null) {
            return toRowSlots(index.search(value));
        }
        List<RowSlot> result = new ArrayList<>();
        for (RowSlot slot : scan()) {
            Value current = slot.row().get(columnName);
            if (!current.isNull() && current.isComparableWith(value) && current.compareTo(value) == 0) {
                result.add(slot);
            }
        }
        return result;
    }

    /**
     * 范围查找，lo 与 hi 均包含在内，为 null 的一端不设界。
     * 只有 B 树索引会被使用，否则全表扫描；两种方式得到相同的行集合，Null 值不参与。
     */
    public List<RowSlot> findByRange(String columnName, Value lo, Value hi) {
        requireColumn(columnName);
        if (indexes.get(columnName) instanceof BTreeIndex btree) {
            return toRowSlots(btree.rangeSearch(lo, hi));
        }
        List<RowSlot> result = new ArrayList<>();
        for (RowSlot slot : scan()) {
            Value current = slot.row().get(columnName);
            if (current.isNull()) {
                continue;
            }
            if ((lo == null || current.compareTo(lo) >= 0) && (hi == null || current.compareTo(hi) <= 0)) {
                result.add(slot);
            }
        }
        return result;
    }

    private List<RowSlot> toRowSlots(List<Integer> positions) {
        List<RowSlot> result = new ArrayList<>(positions.size());
        for (int position : positions) {
            RowSlot slot = slots.get(position);
            if (slot.isOccupied()) {
                result.add(slot);
            }
        }
        return result;
    }

    /**
     * 包括墓碑在内的所有槽位，供快照使用。
     */
    public List<RowSlot> getSlots() {
        return Collections.unmodifiableList(slots);
    }

    /**
     * 存活行数。
     */
    public int getRowCount() {
        int count = 0;
        for (RowSlot slot : slots) {
            if (slot.isOccupied()) {
                count++;
            }
        }
        return count;
    }

    public int getSlotCount() {
        return slots.size();
    }
}
