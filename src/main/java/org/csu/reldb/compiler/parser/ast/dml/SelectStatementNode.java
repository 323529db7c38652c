package org.csu.reldb.compiler.parser.ast.dml;

import org.csu.reldb.compiler.parser.ast.StatementKind;
import org.csu.reldb.compiler.parser.ast.StatementNode;
import org.csu.reldb.compiler.parser.ast.expression.ConditionNode;
import org.csu.reldb.compiler.parser.ast.expression.IdentifierNode;
import org.csu.reldb.compiler.parser.ast.expression.JoinClauseNode;
import org.csu.reldb.compiler.parser.ast.expression.LimitClauseNode;
import org.csu.reldb.compiler.parser.ast.expression.OrderByClauseNode;

import java.util.List;

/**
 * 表示一个 SELECT 语句
 *
 * @param selectList    查询的列列表，SELECT * 时为空
 * @param isSelectAll   是否为 SELECT *
 * @param fromTable     查询的表
 * @param joins         按出现顺序排列的 JOIN 子句
 * @param whereClause   WHERE 条件 (可以为 null)
 * @param orderByClause ORDER BY 子句 (可以为 null)
 * @param limitClause   LIMIT 子句 (可以为 null)
 */
public record SelectStatementNode(
        List<IdentifierNode> selectList,
        boolean isSelectAll,
        IdentifierNode fromTable,
        List<JoinClauseNode> joins,
        ConditionNode whereClause,
        OrderByClauseNode orderByClause,
        LimitClauseNode limitClause
) implements StatementNode {

    @Override
    public StatementKind kind() {
        return StatementKind.SELECT;
    }
}
