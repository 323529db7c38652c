package org.csu.reldb.engine;

import org.csu.reldb.common.model.Value;

import java.util.List;
import java.util.Map;

/**
 * 封装一次语句执行的结果。
 *
 * @param columns  结果列名，按输出顺序
 * @param rows     结果行，每行是列名到值的有序映射
 * @param rowCount SELECT 为返回行数，写语句为影响的行数
 * @param message  状态信息，SELECT 时为 null
 */
public record QueryResult(
        List<String> columns,
        List<Map<String, Value>> rows,
        int rowCount,
        String message
) {
    // SELECT 语句的返回
    public static QueryResult ofRows(List<String> columns, List<Map<String, Value>> rows) {
        return new QueryResult(List.copyOf(columns), List.copyOf(rows), rows.size(), null);
    }

    // 非 SELECT 语句的返回
    public static QueryResult ofMessage(String message, int affectedRows) {
        return new QueryResult(List.of(), List.of(), affectedRows, message);
    }

    /**
     * 取第 rowIndex 行 column 列的值。
     */
    public Value getValue(int rowIndex, String column) {
        Map<String, Value> row = rows.get(rowIndex);
        if (!row.containsKey(column)) {
            throw new IllegalArgumentException("Result has no column '" + column + "'");
        }
        return row.get(column);
    }
}
