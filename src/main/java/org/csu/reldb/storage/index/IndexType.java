package org.csu.reldb.storage.index;

public enum IndexType {
    /** 有序索引，支持范围查询 */
    BTREE,
    /** 只支持等值查询 */
    HASH
}
