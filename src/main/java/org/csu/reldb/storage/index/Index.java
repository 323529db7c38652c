package org.csu.reldb.storage.index;

import org.csu.reldb.common.model.Value;

import java.util.List;
import java.util.Map;

/**
 * 单列索引：把列值映射到当前持有该值的行槽位。
 */
public interface Index {

    void insert(Value key, int slot);

    /**
     * 等值查找。
     * @return 持有该值的所有槽位，没有时返回空列表
     */
    List<Integer> search(Value key);

    /**
     * 删除一条 (key, slot) 记录。
     * @return 找到并删除时返回 true
     */
    boolean delete(Value key, int slot);

    String getColumnName();

    IndexType getType();

    /**
     * 当前记录数。
     */
    int size();

    /**
     * 所有 (key, slot) 记录，用于快照。
     */
    List<Map.Entry<Value, Integer>> entries();

    default boolean supportsRange() {
        return getType() == IndexType.BTREE;
    }
}
