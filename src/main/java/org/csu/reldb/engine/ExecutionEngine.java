package org.csu.reldb.engine;

import org.csu.reldb.catalog.Database;
import org.csu.reldb.common.exception.DatabaseException;
import org.csu.reldb.common.exception.ExecutionException;
import org.csu.reldb.common.exception.SchemaException;
import org.csu.reldb.common.model.Column;
import org.csu.reldb.common.model.DataType;
import org.csu.reldb.common.model.Tuple;
import org.csu.reldb.common.model.Value;
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
import org.csu.reldb.compiler.parser.ast.expression.ConditionNode;
import org.csu.reldb.compiler.parser.ast.expression.IdentifierNode;
import org.csu.reldb.compiler.parser.ast.expression.JoinClauseNode;
import org.csu.reldb.compiler.parser.ast.expression.LogicalConditionNode;
import org.csu.reldb.compiler.parser.ast.expression.SetClauseNode;
import org.csu.reldb.executor.FilterExecutor;
import org.csu.reldb.executor.JoinExecutor;
import org.csu.reldb.executor.LimitExecutor;
import org.csu.reldb.executor.ProjectExecutor;
import org.csu.reldb.executor.SeqScanExecutor;
import org.csu.reldb.executor.SortExecutor;
import org.csu.reldb.executor.TupleIterator;
import org.csu.reldb.storage.table.Row;
import org.csu.reldb.storage.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 执行引擎，按语句类型把 AST 分派到数据库、表与执行算子上。
 *
 * SELECT 组装为火山模型的算子链：
 * SeqScan -> Join* -> Filter -> Sort -> Limit -> Project。
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final Database database;

    public ExecutionEngine(Database database) {
        this.database = database;
    }

    public QueryResult execute(StatementNode statement) {
        if (statement instanceof SelectStatementNode select) {
            return executeSelect(select);
        }
        if (statement instanceof InsertStatementNode insert) {
            return executeInsert(insert);
        }
        if (statement instanceof UpdateStatementNode update) {
            return executeUpdate(update);
        }
        if (statement instanceof DeleteStatementNode delete) {
            return executeDelete(delete);
        }
        if (statement instanceof CreateTableStatementNode createTable) {
            return executeCreateTable(createTable);
        }
        if (statement instanceof CreateIndexStatementNode createIndex) {
            return executeCreateIndex(createIndex);
        }
        if (statement instanceof DropTableStatementNode dropTable) {
            return executeDropTable(dropTable);
        }
        throw new UnsupportedOperationException("Unsupported statement type: " + statement.getClass().getSimpleName());
    }

    // ------------------------------------------------------------------ SELECT

    private QueryResult executeSelect(SelectStatementNode select) {
        Table base = database.requireTable(select.fromTable().name());
        boolean joined = !select.joins().isEmpty();

        // 当前算子链输出的全部键，用于提前检查列引用
        Set<String> knownKeys = new LinkedHashSet<>();
        for (String column : base.getColumnOrder()) {
            if (joined) {
                knownKeys.add(base.getName() + "." + column);
            }
            knownKeys.add(column);
        }

        TupleIterator iterator = new SeqScanExecutor(base, joined);
        for (JoinClauseNode join : select.joins()) {
            Table right = database.requireTable(join.table().name());
            IdentifierNode leftOperand = join.left();
            IdentifierNode rightOperand = join.right();
            // 按表限定把条件两侧对应到左右输入上，如 ON orders.user_id = users.id 写反的情况
            if (refersTo(leftOperand, right) && !refersTo(rightOperand, right)) {
                leftOperand = join.right();
                rightOperand = join.left();
            }
            requireKnown(leftOperand, knownKeys, "JOIN condition");
            if (!right.hasColumn(rightOperand.name())) {
                throw new SchemaException("Unknown column '" + rightOperand.getFullName() + "' in JOIN condition");
            }
            iterator = new JoinExecutor(iterator, right, join.joinType(),
                    leftOperand.getFullName(), leftOperand.name(), rightOperand.name(), new ArrayList<>(knownKeys));
            for (String column : right.getColumnOrder()) {
                knownKeys.add(right.getName() + "." + column);
                knownKeys.add(column);
            }
        }

        if (select.whereClause() != null) {
            requireKnown(select.whereClause(), knownKeys);
            iterator = new FilterExecutor(iterator, select.whereClause());
        }
        if (select.orderByClause() != null) {
            requireKnown(select.orderByClause().column(), knownKeys, "ORDER BY");
            iterator = new SortExecutor(iterator, select.orderByClause());
        }
        if (select.limitClause() != null) {
            iterator = new LimitExecutor(iterator, select.limitClause().limit());
        }

        ProjectExecutor project;
        if (select.isSelectAll()) {
            project = ProjectExecutor.selectAll(iterator, joined ? null : base.getColumnOrder());
        } else {
            for (IdentifierNode column : select.selectList()) {
                requireKnown(column, knownKeys, "field list");
            }
            project = ProjectExecutor.columns(iterator, select.selectList());
        }

        List<Map<String, Value>> rows = new ArrayList<>();
        while (project.hasNext()) {
            rows.add(project.next().getValues());
        }
        return QueryResult.ofRows(project.getOutputColumns(), rows);
    }

    private boolean refersTo(IdentifierNode column, Table table) {
        return column.isQualified() && column.tableQualifier().equals(table.getName());
    }

    private void requireKnown(ConditionNode condition, Set<String> knownKeys) {
        if (condition instanceof LogicalConditionNode logical) {
            requireKnown(logical.left(), knownKeys);
            requireKnown(logical.right(), knownKeys);
        } else if (condition instanceof ComparisonConditionNode comparison) {
            requireKnown(comparison.column(), knownKeys, "WHERE clause");
        }
    }

    private void requireKnown(IdentifierNode column, Set<String> knownKeys, String clause) {
        if (!knownKeys.contains(column.getFullName()) && !knownKeys.contains(column.name())) {
            throw new SchemaException("Unknown column '" + column.getFullName() + "' in " + clause);
        }
    }

    /**
     * 扫描并过滤出要修改的行的槽位，按槽位顺序。
     */
    private List<Integer> matchingSlots(Table table, ConditionNode where) {
        TupleIterator iterator = new SeqScanExecutor(table);
        if (where != null) {
            requireKnown(where, new LinkedHashSet<>(table.getColumnOrder()));
            iterator = new FilterExecutor(iterator, where);
        }
        List<Integer> slots = new ArrayList<>();
        while (iterator.hasNext()) {
            Tuple tuple = iterator.next();
            slots.add(tuple.getSlot());
        }
        return slots;
    }

    // ------------------------------------------------------------------ DML

    private QueryResult executeInsert(InsertStatementNode insert) {
        Table table = database.requireTable(insert.tableName().name());
        List<String> columns = new ArrayList<>();
        if (insert.columns().isEmpty()) {
            columns.addAll(table.getColumnOrder());
        } else {
            insert.columns().forEach(column -> columns.add(column.name()));
        }
        if (columns.size() != insert.values().size()) {
            throw new ExecutionException(String.format("Column count (%d) does not match value count (%d)",
                    columns.size(), insert.values().size()));
        }
        Map<String, Value> data = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            data.put(columns.get(i), insert.values().get(i).value());
        }
        Row row = table.insert(data);
        database.save();
        return QueryResult.ofMessage("Inserted 1 row (row_id=" + row.rowId() + ")", 1);
    }

    private QueryResult executeUpdate(UpdateStatementNode update) {
        Table table = database.requireTable(update.tableName().name());
        Map<String, Value> changes = new LinkedHashMap<>();
        for (SetClauseNode setClause : update.setClauses()) {
            if (!table.hasColumn(setClause.column().name())) {
                throw new SchemaException("Unknown column '" + setClause.column().name()
                        + "' in table '" + table.getName() + "'");
            }
            changes.put(setClause.column().name(), setClause.value().value());
        }
        // 逐行修改，没有语句级原子性：中途失败时之前的行已经修改，快照不会写入
        int updated = 0;
        try {
            for (int slot : matchingSlots(table, update.whereClause())) {
                table.update(slot, changes);
                updated++;
            }
        } catch (DatabaseException e) {
            if (updated > 0) {
                log.warn("UPDATE on '{}' failed after {} row(s) were already modified: {}",
                        table.getName(), updated, e.getMessage());
            }
            throw e;
        }
        database.save();
        return QueryResult.ofMessage("Updated " + updated + " row(s)", updated);
    }

    private QueryResult executeDelete(DeleteStatementNode delete) {
        Table table = database.requireTable(delete.tableName().name());
        int deleted = 0;
        try {
            for (int slot : matchingSlots(table, delete.whereClause())) {
                table.delete(slot);
                deleted++;
            }
        } catch (DatabaseException e) {
            if (deleted > 0) {
                log.warn("DELETE on '{}' failed after {} row(s) were already removed: {}",
                        table.getName(), deleted, e.getMessage());
            }
            throw e;
        }
        database.save();
        return QueryResult.ofMessage("Deleted " + deleted + " row(s)", deleted);
    }

    // ------------------------------------------------------------------ DDL

    private QueryResult executeCreateTable(CreateTableStatementNode createTable) {
        List<Column> columns = new ArrayList<>();
        for (ColumnDefinitionNode definition : createTable.columns()) {
            columns.add(toColumn(definition));
        }
        String tableName = createTable.tableName().name();
        database.createTable(tableName, columns);
        return QueryResult.ofMessage("Created table '" + tableName + "'", 0);
    }

    private Column toColumn(ColumnDefinitionNode definition) {
        String name = definition.columnName().name();
        DataType dataType = definition.dataType();
        Integer length = dataType == DataType.VARCHAR ? definition.length() : null;
        Value defaultValue = Value.NULL;
        if (definition.defaultValue() != null) {
            // 默认值按列类型转换后保存
            defaultValue = new Column(name, dataType).convert(definition.defaultValue().value());
        }
        return new Column(name, dataType, length, !definition.notNull(),
                definition.primaryKey(), definition.unique(), defaultValue);
    }

    private QueryResult executeCreateIndex(CreateIndexStatementNode createIndex) {
        Table table = database.requireTable(createIndex.tableName().name());
        String column = createIndex.columnName().name();
        if (!table.hasColumn(column)) {
            throw new SchemaException("Unknown column '" + column + "' in table '" + table.getName() + "'");
        }
        String target = table.getName() + "." + column;
        if (!table.createIndex(column, database.getConfig().getDefaultIndexType())) {
            return QueryResult.ofMessage("Index on " + target + " already exists", 0);
        }
        database.save();
        return QueryResult.ofMessage("Created index on " + target, 0);
    }

    private QueryResult executeDropTable(DropTableStatementNode dropTable) {
        String tableName = dropTable.tableName().name();
        database.dropTable(tableName);
        return QueryResult.ofMessage("Dropped table '" + tableName + "'", 0);
    }
}
