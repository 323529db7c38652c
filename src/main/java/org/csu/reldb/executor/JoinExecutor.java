package org.csu.reldb.executor;

import org.csu.reldb.common.model.Tuple;
import org.csu.reldb.common.model.Value;
import org.csu.reldb.compiler.parser.ast.expression.JoinType;
import org.csu.reldb.storage.table.Row;
import org.csu.reldb.storage.table.RowSlot;
import org.csu.reldb.storage.table.Table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 使用嵌套循环连接算法执行 JOIN 操作，连接条件为两列相等。
 *
 * 输出元组带有右表每列的 {@code 表.列} 键和不带限定的键；不带限定的列名冲突时后合并的表覆盖先前的值。
 * LEFT JOIN 未匹配的左元组只补右表的键（不覆盖已有的键），RIGHT JOIN 未匹配的右行把左侧所有键补为 Null。
 * Null 与任何值都不相等。
 */
public class JoinExecutor implements TupleIterator {

    private final TupleIterator leftChild;
    private final Table rightTable;
    private final JoinType joinType;
    private final String leftFullName;
    private final String leftBareName;
    private final String rightColumn;
    private final List<String> leftKeys;    // 左侧元组的全部键，RIGHT JOIN 补空时使用

    private List<RowSlot> rightRows;        // 内存中缓存的右表所有行
    private Tuple leftTuple;                // 当前外层循环的元组
    private boolean leftMatched;
    private int rightIndex;
    private Tuple nextTuple;
    private List<Tuple> rightJoinResult;    // RIGHT JOIN 一次性算出全部结果
    private int rightJoinCursor;

    /**
     * @param leftFullName 左侧连接列的完整键（带限定时为 {@code 表.列}）
     * @param leftBareName 左侧连接列不带限定的列名
     * @param rightColumn 右表中的连接列
     */
    public JoinExecutor(TupleIterator leftChild, Table rightTable, JoinType joinType,
                        String leftFullName, String leftBareName, String rightColumn, List<String> leftKeys) {
        this.leftChild = leftChild;
        this.rightTable = rightTable;
        this.joinType = joinType;
        this.leftFullName = leftFullName;
        this.leftBareName = leftBareName;
        this.rightColumn = rightColumn;
        this.leftKeys = leftKeys;
    }

    // 初始化，将右表全部加载到内存
    private void init() {
        if (rightRows == null) {
            rightRows = rightTable.scan();
        }
    }

    @Override
    public Tuple next() {
        if (!hasNext()) {
            return null;
        }
        if (joinType == JoinType.RIGHT) {
            return rightJoinResult.get(rightJoinCursor++);
        }
        Tuple result = nextTuple;
        nextTuple = null;
        return result;
    }

    @Override
    public boolean hasNext() {
        init();
        if (joinType == JoinType.RIGHT) {
            if (rightJoinResult == null) {
                rightJoinResult = computeRightJoin();
            }
            return rightJoinCursor < rightJoinResult.size();
        }
        if (nextTuple != null) {
            return true;
        }
        while (true) {
            // 如果当前左元组为空，就从左边的子执行器获取下一个
            if (leftTuple == null) {
                if (!leftChild.hasNext()) {
                    return false;
                }
                leftTuple = leftChild.next();
                leftMatched = false;
                rightIndex = 0;
            }
            while (rightIndex < rightRows.size()) {
                Row rightRow = rightRows.get(rightIndex++).row();
                if (matches(leftTuple, rightRow)) {
                    leftMatched = true;
                    nextTuple = merge(leftTuple.getSlot(), leftTuple.getValues(), rightRow);
                    return true;
                }
            }
            Tuple finished = leftTuple;
            leftTuple = null;
            if (joinType == JoinType.LEFT && !leftMatched) {
                nextTuple = padRight(finished);
                return true;
            }
        }
    }

    private List<Tuple> computeRightJoin() {
        List<Tuple> lefts = new ArrayList<>();
        while (leftChild.hasNext()) {
            lefts.add(leftChild.next());
        }
        List<Tuple> result = new ArrayList<>();
        for (RowSlot rightSlot : rightRows) {
            boolean matched = false;
            for (Tuple left : lefts) {
                if (matches(left, rightSlot.row())) {
                    matched = true;
                    result.add(merge(left.getSlot(), left.getValues(), rightSlot.row()));
                }
            }
            if (!matched) {
                Map<String, Value> padded = new LinkedHashMap<>();
                leftKeys.forEach(key -> padded.put(key, Value.NULL));
                result.add(merge(-1, padded, rightSlot.row()));
            }
        }
        return result;
    }

    private boolean matches(Tuple left, Row rightRow) {
        Value leftValue = left.resolve(leftFullName, leftBareName);
        Value rightValue = rightRow.get(rightColumn);
        if (leftValue == null || leftValue.isNull() || rightValue.isNull()) {
            return false;
        }
        return leftValue.isComparableWith(rightValue) && leftValue.compareTo(rightValue) == 0;
    }

    private Tuple merge(int slot, Map<String, Value> left, Row rightRow) {
        Map<String, Value> merged = new LinkedHashMap<>(left);
        rightRow.data().forEach((column, value) -> {
            merged.put(rightTable.getName() + "." + column, value);
            merged.put(column, value);
        });
        return new Tuple(slot, merged);
    }

    private Tuple padRight(Tuple left) {
        Map<String, Value> merged = new LinkedHashMap<>(left.getValues());
        for (String column : rightTable.getColumnOrder()) {
            merged.put(rightTable.getName() + "." + column, Value.NULL);
            merged.putIfAbsent(column, Value.NULL);
        }
        return new Tuple(left.getSlot(), merged);
    }
}
