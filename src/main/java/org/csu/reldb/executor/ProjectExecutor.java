package org.csu.reldb.executor;

import org.csu.reldb.common.exception.SchemaException;
import org.csu.reldb.common.model.Tuple;
import org.csu.reldb.common.model.Value;
import org.csu.reldb.compiler.parser.ast.expression.IdentifierNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 投影执行器，按 SELECT 列表挑选并命名输出列。
 *
 * {@code SELECT *} 没有 JOIN 时按表的列顺序输出；有 JOIN 时输出第一条结果的全部键（原样命名）。
 * 显式列先按完整键再按列名查找，输出名去掉表限定，除非去掉后与另一个选择列重名。
 */
public class ProjectExecutor implements TupleIterator {

    private final TupleIterator child;
    private final List<IdentifierNode> selectList;   // SELECT * 时为 null
    private List<String> outputColumns;

    private ProjectExecutor(TupleIterator child, List<IdentifierNode> selectList, List<String> outputColumns) {
        this.child = child;
        this.selectList = selectList;
        this.outputColumns = outputColumns;
    }

    /**
     * 显式列投影。
     */
    public static ProjectExecutor columns(TupleIterator child, List<IdentifierNode> selectList) {
        return new ProjectExecutor(child, selectList, outputNames(selectList));
    }

    /**
     * {@code SELECT *} 投影。
     * @param baseColumns 表的列顺序；为 null 表示发生过 JOIN，列集合取自第一条结果
     */
    public static ProjectExecutor selectAll(TupleIterator child, List<String> baseColumns) {
        return new ProjectExecutor(child, null, baseColumns);
    }

    private static List<String> outputNames(List<IdentifierNode> selectList) {
        Map<String, Integer> bareCounts = new HashMap<>();
        for (IdentifierNode column : selectList) {
            bareCounts.merge(column.name(), 1, Integer::sum);
        }
        List<String> names = new ArrayList<>();
        for (IdentifierNode column : selectList) {
            names.add(bareCounts.get(column.name()) > 1 ? column.getFullName() : column.name());
        }
        return names;
    }

    /**
     * 输出列名。有 JOIN 的 {@code SELECT *} 在取到第一条元组之前为空列表。
     */
    public List<String> getOutputColumns() {
        return outputColumns == null ? List.of() : outputColumns;
    }

    @Override
    public Tuple next() {
        if (!hasNext()) {
            return null;
        }
        Tuple tuple = child.next();
        Map<String, Value> projected = new LinkedHashMap<>();
        if (selectList == null) {
            if (outputColumns == null) {
                outputColumns = new ArrayList<>(tuple.getValues().keySet());
            }
            for (String column : outputColumns) {
                Value value = tuple.get(column);
                projected.put(column, value == null ? Value.NULL : value);
            }
        } else {
            for (int i = 0; i < selectList.size(); i++) {
                IdentifierNode column = selectList.get(i);
                Value value = tuple.resolve(column.getFullName(), column.name());
                if (value == null) {
                    throw new SchemaException("Unknown column '" + column.getFullName() + "'");
                }
                projected.put(outputColumns.get(i), value);
            }
        }
        return new Tuple(tuple.getSlot(), projected);
    }

    @Override
    public boolean hasNext() {
        return child.hasNext();
    }
}
