package org.csu.reldb.storage.index;

import org.csu.reldb.common.model.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 哈希索引，只支持等值查找。值为空的桶会被移除。
 */
public class HashIndex implements Index {

    private final String columnName;
    private final Map<Value, List<Integer>> buckets = new LinkedHashMap<>();
    private int size = 0;

    public HashIndex(String columnName) {
        this.columnName = columnName;
    }

    @Override
    public void insert(Value key, int slot) {
        buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(slot);
        size++;
    }

    @Override
    public List<Integer> search(Value key) {
        List<Integer> slots = buckets.get(key);
        return slots == null ? new ArrayList<>() : new ArrayList<>(slots);
    }

    @Override
    public boolean delete(Value key, int slot) {
        List<Integer> slots = buckets.get(key);
        if (slots == null || !slots.remove(Integer.valueOf(slot))) {
            return false;
        }
        if (slots.isEmpty()) {
            buckets.remove(key);
        }
        size--;
        return true;
    }

    @Override
    public String getColumnName() {
        return columnName;
    }

    @Override
    public IndexType getType() {
        return IndexType.HASH;
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * 按桶分组的视图，用于快照。
     */
    public Map<Value, List<Integer>> getBuckets() {
        return buckets;
    }

    @Override
    public List<Map.Entry<Value, Integer>> entries() {
        List<Map.Entry<Value, Integer>> result = new ArrayList<>(size);
        buckets.forEach((key, slots) -> slots.forEach(slot -> result.add(Map.entry(key, slot))));
        return result;
    }
}
