package org.csu.reldb.storage.table;

/**
 * 行存储中的一个槽位。槽位只追加不复用，删除后成为墓碑但位置保留，索引记录引用的就是这个位置。
 *
 * @param position 槽位在表中的位置
 * @param row 槽中的行，墓碑时为 null
 */
public record RowSlot(int position, Row row) {

    public static RowSlot occupied(int position, Row row) {
        return new RowSlot(position, row);
    }

    public static RowSlot tombstone(int position) {
        return new RowSlot(position, null);
    }

    public boolean isOccupied() {
        return row != null;
    }

    public boolean isTombstone() {
        return row == null;
    }
}
