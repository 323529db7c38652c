package org.csu.reldb.executor;

import org.csu.reldb.common.exception.SchemaException;
import org.csu.reldb.common.model.Tuple;
import org.csu.reldb.common.model.Value;
import org.csu.reldb.compiler.parser.ast.expression.OrderByClauseNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 排序执行器。
 * 这是一个阻塞执行器，它会先拉取所有子节点的元组，在内存中完成稳定排序，然后再向上层返回。
 * 比较时 Null 用空字符串代替。
 */
public class SortExecutor implements TupleIterator {

    private static final Value NULL_SENTINEL = new Value("");

    private final TupleIterator child;
    private final OrderByClauseNode orderBy;
    private List<Tuple> sortedTuples;
    private int cursor = 0;

    public SortExecutor(TupleIterator child, OrderByClauseNode orderBy) {
        this.child = child;
        this.orderBy = orderBy;
    }

    private void init() {
        if (sortedTuples != null) {
            return;
        }
        sortedTuples = new ArrayList<>();
        while (child.hasNext()) {
            sortedTuples.add(child.next());
        }

        Comparator<Tuple> comparator = Comparator.comparing(this::sortKey);
        if (!orderBy.isAscending()) {
            comparator = comparator.reversed();
        }
        sortedTuples.sort(comparator);
    }

    private Value sortKey(Tuple tuple) {
        Value value = tuple.resolve(orderBy.column().getFullName(), orderBy.column().name());
        if (value == null) {
            throw new SchemaException("Unknown column '" + orderBy.column().getFullName() + "' in ORDER BY");
        }
        return value.isNull() ? NULL_SENTINEL : value;
    }

    @Override
    public Tuple next() {
        if (hasNext()) {
            return sortedTuples.get(cursor++);
        }
        return null;
    }

    @Override
    public boolean hasNext() {
        init();
        return cursor < sortedTuples.size();
    }
}
