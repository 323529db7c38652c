package org.csu.reldb.executor;

import org.csu.reldb.common.model.Tuple;
import org.csu.reldb.compiler.parser.ast.expression.ConditionNode;
import org.csu.reldb.engine.ConditionEvaluator;

/**
 * 过滤执行器，根据 WHERE 条件过滤来自子执行器的元组。
 */
public class FilterExecutor implements TupleIterator {
    private final TupleIterator child;
    private final ConditionNode condition;
    private Tuple nextTuple;

    public FilterExecutor(TupleIterator child, ConditionNode condition) {
        this.child = child;
        this.condition = condition;
    }

    @Override
    public Tuple next() {
        if (!hasNext()) {
            return null;
        }
        Tuple result = nextTuple;
        nextTuple = null;
        return result;
    }

    @Override
    public boolean hasNext() {
        if (nextTuple != null) {
            return true;
        }
        // 不断从子执行器获取元组，直到找到一个匹配的或子执行器结束
        while (child.hasNext()) {
            Tuple tuple = child.next();
            if (ConditionEvaluator.evaluate(condition, tuple)) {
                nextTuple = tuple;
                return true;
            }
        }
        return false;
    }
}
