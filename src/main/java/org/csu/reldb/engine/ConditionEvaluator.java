package org.csu.reldb.engine;

import org.csu.reldb.common.exception.SchemaException;
import org.csu.reldb.common.model.Tuple;
import org.csu.reldb.common.model.Value;
import org.csu.reldb.compiler.parser.ast.expression.ComparisonConditionNode;
import org.csu.reldb.compiler.parser.ast.expression.ConditionNode;
import org.csu.reldb.compiler.parser.ast.expression.IdentifierNode;
import org.csu.reldb.compiler.parser.ast.expression.LogicalConditionNode;

/**
 * WHERE 条件求值器。
 */
public final class ConditionEvaluator {

    private ConditionEvaluator() {
    }

    /**
     * 在一条元组上对条件树求值。
     * AND / OR 两侧都会求值（不短路）。列先按完整键、再按列名查找。
     * {@code =} 与 {@code !=} 中 Null 等于 Null；大小比较遇到 Null 或不可比较的类型时为 false。
     * @throws SchemaException 条件引用了元组中不存在的列
     */
    public static boolean evaluate(ConditionNode condition, Tuple tuple) {
        if (condition instanceof LogicalConditionNode logical) {
            boolean left = evaluate(logical.left(), tuple);
            boolean right = evaluate(logical.right(), tuple);
            return switch (logical.operator()) {
                case AND -> left && right;
                case OR -> left || right;
            };
        }
        if (condition instanceof ComparisonConditionNode comparison) {
            Value actual = resolve(comparison.column(), tuple);
            return compare(actual, comparison);
        }
        throw new IllegalArgumentException("Unsupported condition node: " + condition);
    }

    private static Value resolve(IdentifierNode column, Tuple tuple) {
        Value value = tuple.resolve(column.getFullName(), column.name());
        if (value == null) {
            throw new SchemaException("Unknown column '" + column.getFullName() + "' in WHERE clause");
        }
        return value;
    }

    private static boolean compare(Value actual, ComparisonConditionNode comparison) {
        Value expected = comparison.value().value();
        return switch (comparison.operator()) {
            case EQUAL -> valuesEqual(actual, expected);
            case NOT_EQUAL -> !valuesEqual(actual, expected);
            case LESS -> ordered(actual, expected) && actual.compareTo(expected) < 0;
            case LESS_EQUAL -> ordered(actual, expected) && actual.compareTo(expected) <= 0;
            case GREATER -> ordered(actual, expected) && actual.compareTo(expected) > 0;
            case GREATER_EQUAL -> ordered(actual, expected) && actual.compareTo(expected) >= 0;
        };
    }

    static boolean valuesEqual(Value left, Value right) {
        return left.isComparableWith(right) && left.compareTo(right) == 0;
    }

    private static boolean ordered(Value left, Value right) {
        return !left.isNull() && !right.isNull() && left.isComparableWith(right);
    }
}
