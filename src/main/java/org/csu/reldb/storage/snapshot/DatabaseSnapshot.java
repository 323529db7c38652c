package org.csu.reldb.storage.snapshot;

import org.csu.reldb.storage.table.Table;

import java.util.List;

/**
 * 从快照读出的数据库内容。
 *
 * @param createdAt 快照写入时间（ISO 文本），旧快照可能没有
 */
public record DatabaseSnapshot(String name, String createdAt, List<Table> tables) {
}
