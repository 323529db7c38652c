package org.csu.reldb.compiler.parser;

import org.csu.reldb.common.exception.ParseException;
import org.csu.reldb.common.model.DataType;
import org.csu.reldb.common.model.Value;
import org.csu.reldb.compiler.lexer.Token;
import org.csu.reldb.compiler.lexer.TokenType;
import org.csu.reldb.compiler.parser.ast.StatementNode;
import org.csu.reldb.compiler.parser.ast.ddl.CreateIndexStatementNode;
import org.csu.reldb.compiler.parser.ast.ddl.CreateTableStatementNode;
import org.csu.reldb.compiler.parser.ast.ddl.DropTableStatementNode;
import org.csu.reldb.compiler.parser.ast.dml.DeleteStatementNode;
import org.csu.reldb.compiler.parser.ast.dml.InsertStatementNode;
import org.csu.reldb.compiler.parser.ast.dml.SelectStatementNode;
import org.csu.reldb.compiler.parser.ast.dml.UpdateStatementNode;
import org.csu.reldb.compiler.parser.ast.expression.ColumnDefinitionNode;
import org.csu.reldb.compiler.parser.ast.expression.ComparisonConditionNode;
import org.csu.reldb.compiler.parser.ast.expression.ComparisonOperator;
import org.csu.reldb.compiler.parser.ast.expression.ConditionNode;
import org.csu.reldb.compiler.parser.ast.expression.IdentifierNode;
import org.csu.reldb.compiler.parser.ast.expression.JoinClauseNode;
import org.csu.reldb.compiler.parser.ast.expression.JoinType;
import org.csu.reldb.compiler.parser.ast.expression.LimitClauseNode;
import org.csu.reldb.compiler.parser.ast.expression.LiteralNode;
import org.csu.reldb.compiler.parser.ast.expression.LogicalConditionNode;
import org.csu.reldb.compiler.parser.ast.expression.LogicalOperator;
import org.csu.reldb.compiler.parser.ast.expression.OrderByClauseNode;
import org.csu.reldb.compiler.parser.ast.expression.SetClauseNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)。
 * 解析过程不依赖任何外部状态，相同的输入总是得到结构相同的 AST。
 */
public class Parser {

    private final List<Token> tokens;
    private int position = 0;

    private static final Set<TokenType> DATA_TYPES = Set.of(
            TokenType.INT, TokenType.INTEGER, TokenType.VARCHAR, TokenType.FLOAT,
            TokenType.BOOLEAN, TokenType.DATETIME, TokenType.TIMESTAMP
    );

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * 解析一条语句。末尾的分号可选，分号之后不允许再有任何内容。
     * @throws ParseException 语法错误
     */
    public StatementNode parse() {
        StatementNode statement = parseStatement();
        match(TokenType.SEMICOLON);
        if (!isAtEnd()) {
            throw new ParseException(peek(), "end of statement");
        }
        return statement;
    }

    private StatementNode parseStatement() {
        if (match(TokenType.SELECT)) {
            return parseSelectStatement();
        }
        if (match(TokenType.INSERT)) {
            return parseInsertStatement();
        }
        if (match(TokenType.UPDATE)) {
            return parseUpdateStatement();
        }
        if (match(TokenType.DELETE)) {
            return parseDeleteStatement();
        }
        if (match(TokenType.CREATE)) {
            if (match(TokenType.TABLE)) {
                return parseCreateTableStatement();
            }
            if (match(TokenType.INDEX)) {
                return parseCreateIndexStatement();
            }
            throw new ParseException(peek(), "'TABLE' or 'INDEX' after 'CREATE'");
        }
        if (match(TokenType.DROP)) {
            return parseDropTableStatement();
        }
        throw new ParseException(peek(), "a statement (SELECT, INSERT, UPDATE, DELETE, CREATE, DROP)");
    }

    private SelectStatementNode parseSelectStatement() {
        List<IdentifierNode> selectList = new ArrayList<>();
        boolean isSelectAll = false;
        if (match(TokenType.ASTERISK)) {
            isSelectAll = true;
        } else {
            do {
                selectList.add(parseColumnReference("column name"));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.FROM, "'FROM'");
        IdentifierNode fromTable = parseTableName();

        List<JoinClauseNode> joins = new ArrayList<>();
        ConditionNode whereClause = null;
        OrderByClauseNode orderByClause = null;
        LimitClauseNode limitClause = null;
        // 可选子句按出现顺序解析，重复出现的 WHERE / ORDER BY / LIMIT 以后者为准
        while (true) {
            if (check(TokenType.JOIN) || check(TokenType.INNER) || check(TokenType.LEFT) || check(TokenType.RIGHT)) {
                joins.add(parseJoinClause());
            } else if (match(TokenType.WHERE)) {
                whereClause = parseCondition();
            } else if (match(TokenType.ORDER)) {
                orderByClause = parseOrderByClause();
            } else if (match(TokenType.LIMIT)) {
                limitClause = parseLimitClause();
            } else {
                break;
            }
        }
        return new SelectStatementNode(selectList, isSelectAll, fromTable, joins,
                whereClause, orderByClause, limitClause);
    }

    private JoinClauseNode parseJoinClause() {
        JoinType joinType = JoinType.INNER;
        if (match(TokenType.LEFT)) {
            joinType = JoinType.LEFT;
            match(TokenType.OUTER);
        } else if (match(TokenType.RIGHT)) {
            joinType = JoinType.RIGHT;
            match(TokenType.OUTER);
        } else {
            match(TokenType.INNER);
        }
        consume(TokenType.JOIN, "'JOIN'");
        IdentifierNode table = parseTableName();
        consume(TokenType.ON, "'ON' after JOIN table");
        IdentifierNode left = parseColumnReference("column name in JOIN condition");
        consume(TokenType.EQUAL, "'=' in JOIN condition");
        IdentifierNode right = parseColumnReference("column name in JOIN condition");
        return new JoinClauseNode(joinType, table, left, right);
    }

    private InsertStatementNode parseInsertStatement() {
        consume(TokenType.INTO, "'INTO' after 'INSERT'");
        IdentifierNode tableName = parseTableName();
        List<IdentifierNode> columns = new ArrayList<>();
        if (match(TokenType.LPAREN)) {
            do {
                columns.add(new IdentifierNode(consume(TokenType.IDENTIFIER, "column name").lexeme()));
            } while (match(TokenType.COMMA));
            consume(TokenType.RPAREN, "')' after column list");
        }
        consume(TokenType.VALUES, "'VALUES'");
        consume(TokenType.LPAREN, "'(' before value list");
        List<LiteralNode> values = new ArrayList<>();
        do {
            values.add(parseLiteral());
        } while (match(TokenType.COMMA));
        consume(TokenType.RPAREN, "')' after value list");
        return new InsertStatementNode(tableName, columns, values);
    }

    private UpdateStatementNode parseUpdateStatement() {
        IdentifierNode tableName = parseTableName();
        consume(TokenType.SET, "'SET'");
        List<SetClauseNode> setClauses = new ArrayList<>();
        do {
            IdentifierNode column = new IdentifierNode(consume(TokenType.IDENTIFIER, "column name in SET clause").lexeme());
            consume(TokenType.EQUAL, "'=' after column name");
            setClauses.add(new SetClauseNode(column, parseLiteral()));
        } while (match(TokenType.COMMA));
        ConditionNode whereClause = null;
        if (match(TokenType.WHERE)) {
            whereClause = parseCondition();
        }
        return new UpdateStatementNode(tableName, setClauses, whereClause);
    }

    private DeleteStatementNode parseDeleteStatement() {
        consume(TokenType.FROM, "'FROM' after 'DELETE'");
        IdentifierNode tableName = parseTableName();
        ConditionNode whereClause = null;
        if (match(TokenType.WHERE)) {
            whereClause = parseCondition();
        }
        return new DeleteStatementNode(tableName, whereClause);
    }

    private CreateTableStatementNode parseCreateTableStatement() {
        IdentifierNode tableName = parseTableName();
        consume(TokenType.LPAREN, "'(' after table name");
        List<ColumnDefinitionNode> columns = new ArrayList<>();
        do {
            columns.add(parseColumnDefinition());
        } while (match(TokenType.COMMA));
        consume(TokenType.RPAREN, "')' after column definitions");
        return new CreateTableStatementNode(tableName, columns);
    }

    private ColumnDefinitionNode parseColumnDefinition() {
        IdentifierNode columnName = new IdentifierNode(consume(TokenType.IDENTIFIER, "column name").lexeme());
        Token dataTypeToken = peek();
        if (!DATA_TYPES.contains(dataTypeToken.type())) {
            throw new ParseException(dataTypeToken, "data type (INT, FLOAT, VARCHAR, BOOLEAN, DATETIME)");
        }
        advance();
        DataType dataType = DataType.fromSqlName(dataTypeToken.lexeme());

        Integer length = null;
        if (match(TokenType.LPAREN)) {
            length = parseInteger(consume(TokenType.INTEGER_CONST, "length"));
            consume(TokenType.RPAREN, "')' after length");
        }

        // 约束可以任意顺序出现
        boolean primaryKey = false;
        boolean unique = false;
        boolean notNull = false;
        LiteralNode defaultValue = null;
        while (true) {
            if (match(TokenType.PRIMARY)) {
                consume(TokenType.KEY, "'KEY' after 'PRIMARY'");
                primaryKey = true;
            } else if (match(TokenType.UNIQUE)) {
                unique = true;
            } else if (match(TokenType.NOT)) {
                consume(TokenType.NULL, "'NULL' after 'NOT'");
                notNull = true;
            } else if (match(TokenType.DEFAULT)) {
                defaultValue = parseLiteral();
            } else {
                break;
            }
        }
        return new ColumnDefinitionNode(columnName, dataType, length, primaryKey, unique, notNull, defaultValue);
    }

    private CreateIndexStatementNode parseCreateIndexStatement() {
        IdentifierNode indexName = new IdentifierNode(consume(TokenType.IDENTIFIER, "index name").lexeme());
        consume(TokenType.ON, "'ON' after index name");
        IdentifierNode tableName = parseTableName();
        consume(TokenType.LPAREN, "'(' before column name");
        IdentifierNode column = new IdentifierNode(consume(TokenType.IDENTIFIER, "column name").lexeme());
        consume(TokenType.RPAREN, "')' after column name");
        return new CreateIndexStatementNode(indexName, tableName, column);
    }

    private DropTableStatementNode parseDropTableStatement() {
        consume(TokenType.TABLE, "'TABLE' after 'DROP'");
        return new DropTableStatementNode(parseTableName());
    }

    private OrderByClauseNode parseOrderByClause() {
        consume(TokenType.BY, "'BY' after 'ORDER'");
        IdentifierNode column = parseColumnReference("column name for ORDER BY");
        boolean isAscending = true;
        if (match(TokenType.DESC)) {
            isAscending = false;
        } else {
            match(TokenType.ASC);
        }
        return new OrderByClauseNode(column, isAscending);
    }

    private LimitClauseNode parseLimitClause() {
        return new LimitClauseNode(parseInteger(consume(TokenType.INTEGER_CONST, "integer value for LIMIT")));
    }

    /**
     * 条件树，AND 与 OR 优先级相同，左结合。
     */
    private ConditionNode parseCondition() {
        ConditionNode left = parseComparison();
        while (check(TokenType.AND) || check(TokenType.OR)) {
            LogicalOperator operator = advance().type() == TokenType.AND ? LogicalOperator.AND : LogicalOperator.OR;
            ConditionNode right = parseComparison();
            left = new LogicalConditionNode(operator, left, right);
        }
        return left;
    }

    private ComparisonConditionNode parseComparison() {
        IdentifierNode column = parseColumnReference("column name in WHERE clause");
        Token operatorToken = peek();
        ComparisonOperator operator = switch (operatorToken.type()) {
            case EQUAL -> ComparisonOperator.EQUAL;
            case NOT_EQUAL -> ComparisonOperator.NOT_EQUAL;
            case LESS -> ComparisonOperator.LESS;
            case LESS_EQUAL -> ComparisonOperator.LESS_EQUAL;
            case GREATER -> ComparisonOperator.GREATER;
            case GREATER_EQUAL -> ComparisonOperator.GREATER_EQUAL;
            default -> throw new ParseException(operatorToken, "comparison operator (=, !=, <>, <, >, <=, >=)");
        };
        advance();
        return new ComparisonConditionNode(column, operator, parseLiteral());
    }

    private LiteralNode parseLiteral() {
        Token token = peek();
        Value value = switch (token.type()) {
            case STRING_CONST -> new Value(token.lexeme());
            case INTEGER_CONST -> {
                try {
                    yield new Value(Long.parseLong(token.lexeme()));
                } catch (NumberFormatException e) {
                    throw new ParseException(token, "an integer within range");
                }
            }
            case DECIMAL_CONST -> new Value(Double.parseDouble(token.lexeme()));
            case NULL -> Value.NULL;
            case TRUE -> new Value(true);
            case FALSE -> new Value(false);
            default -> throw new ParseException(token, "a literal value");
        };
        advance();
        return new LiteralNode(value);
    }

    private IdentifierNode parseTableName() {
        return new IdentifierNode(consume(TokenType.IDENTIFIER, "table name").lexeme());
    }

    /**
     * 列引用，可带表限定，如 {@code users.id}。
     */
    private IdentifierNode parseColumnReference(String expected) {
        Token first = consume(TokenType.IDENTIFIER, expected);
        if (match(TokenType.DOT)) {
            Token second = consume(TokenType.IDENTIFIER, "column name after '.'");
            return new IdentifierNode(first.lexeme(), second.lexeme());
        }
        return new IdentifierNode(first.lexeme());
    }

    private int parseInteger(Token token) {
        try {
            int parsed = Integer.parseInt(token.lexeme());
            if (parsed >= 0) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            throw new ParseException(token, "a non-negative integer");
        }
        throw new ParseException(token, "a non-negative integer");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        throw new ParseException(peek(), expected);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
