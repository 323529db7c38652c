package org.csu.reldb.executor;

import org.csu.reldb.common.model.Tuple;

/**
 * Limit 执行器，限制从子执行器返回的元组数量。
 */
public class LimitExecutor implements TupleIterator {

    private final TupleIterator child;
    private final int limit;
    private int count = 0;

    public LimitExecutor(TupleIterator child, int limit) {
        this.child = child;
        this.limit = limit;
    }

    @Override
    public Tuple next() {
        if (hasNext()) {
            count++;
            return child.next();
        }
        return null;
    }

    @Override
    public boolean hasNext() {
        return count < limit && child.hasNext();
    }
}
