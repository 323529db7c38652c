package org.csu.reldb.common.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 执行算子之间传递的一条记录。
 * 键为列名，连接后同时带有 {@code 表.列} 和不带限定的列名两种键。
 */
public class Tuple {
    private final int slot;                 // 来源行槽位，连接产生的元组为 -1
    private final Map<String, Value> values;

    public Tuple(int slot, Map<String, Value> values) {
        this.slot = slot;
        this.values = new LinkedHashMap<>(values);
    }

    public int getSlot() {
        return slot;
    }

    public Map<String, Value> getValues() {
        return values;
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Value get(String key) {
        return values.get(key);
    }

    /**
     * 先按完整键查找，再按不带限定的列名查找。
     * @return 找不到时返回 null
     */
    public Value resolve(String fullName, String bareName) {
        Value value = values.get(fullName);
        if (value == null) {
            value = values.get(bareName);
        }
        return value;
    }

    @Override
    public String toString() {
        return "Tuple{slot=" + slot + ", values=" + values + "}";
    }
}
