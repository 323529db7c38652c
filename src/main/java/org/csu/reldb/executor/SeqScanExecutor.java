package org.csu.reldb.executor;

import org.csu.reldb.common.model.Tuple;
import org.csu.reldb.common.model.Value;
import org.csu.reldb.storage.table.RowSlot;
import org.csu.reldb.storage.table.Table;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 顺序扫描执行器，按槽位顺序输出表中的存活行。
 * qualified 为 true 时，每列同时输出 {@code 表.列} 与不带限定的两个键（后面跟着 JOIN 时使用）。
 */
public class SeqScanExecutor implements TupleIterator {

    private final Table table;
    private final boolean qualified;
    private Iterator<RowSlot> iterator;

    public SeqScanExecutor(Table table) {
        this(table, false);
    }

    public SeqScanExecutor(Table table, boolean qualified) {
        this.table = table;
        this.qualified = qualified;
    }

    private void init() {
        if (iterator == null) {
            iterator = table.scan().iterator();
        }
    }

    @Override
    public Tuple next() {
        if (!hasNext()) {
            return null;
        }
        RowSlot slot = iterator.next();
        if (!qualified) {
            return new Tuple(slot.position(), slot.row().data());
        }
        Map<String, Value> values = new LinkedHashMap<>();
        slot.row().data().forEach((column, value) -> {
            values.put(table.getName() + "." + column, value);
            values.put(column, value);
        });
        return new Tuple(slot.position(), values);
    }

    @Override
    public boolean hasNext() {
        init();
        return iterator.hasNext();
    }
}
