package org.csu.reldb.compiler.parser.ast.expression;

/**
 * 比较运算符。{@code <>} 与 {@code !=} 都解析为 NOT_EQUAL。
 */
public enum ComparisonOperator {
    EQUAL("="),
    NOT_EQUAL("!="),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
