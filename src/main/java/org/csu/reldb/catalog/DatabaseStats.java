package org.csu.reldb.catalog;

import java.util.Map;

/**
 * 数据库统计信息，供前端的统计命令展示。
 *
 * @param tables 表名到单表统计，按建表顺序排列
 */
public record DatabaseStats(String name, int tableCount, Map<String, TableStats> tables) {

    /**
     * @param sizeKb 该表序列化后的大致大小 (KB)
     */
    public record TableStats(int columns, int rows, int indexes, double sizeKb) {
    }
}
