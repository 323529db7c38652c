package org.csu.reldb.storage.table;

import org.csu.reldb.common.model.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一行数据。rowId 在表内严格递增，删除后也不会复用。
 *
 * @param data 列名到值的映射，按列顺序排列，不可修改
 */
public record Row(long rowId, Map<String, Value> data) {

    public Row {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public Value get(String column) {
        return data.getOrDefault(column, Value.NULL);
    }
}
