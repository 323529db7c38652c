package org.csu.reldb.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import org.csu.reldb.common.exception.ExecutionException;
import org.csu.reldb.common.exception.SchemaException;
import org.csu.reldb.common.model.Column;
import org.csu.reldb.common.model.Value;
import org.csu.reldb.config.DatabaseConfig;
import org.csu.reldb.storage.snapshot.DatabaseSnapshot;
import org.csu.reldb.storage.snapshot.SnapshotCodec;
import org.csu.reldb.storage.snapshot.SnapshotStore;
import org.csu.reldb.storage.table.RowSlot;
import org.csu.reldb.storage.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一个命名数据库：表目录加快照持久化。
 * 每次建表、删表以及成功的写语句之后都会把整个目录重新写入快照。
 */
public class Database {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private String name;
    private final DatabaseConfig config;
    private final SnapshotStore store;
    private final SnapshotCodec codec = new SnapshotCodec();
    private final Map<String, Table> tables = new LinkedHashMap<>();

    public Database(String name, DatabaseConfig config, SnapshotStore store) {
        this.name = name;
        this.config = config;
        this.store = store;
    }

    /**
     * 打开数据库：创建数据目录，快照存在时加载。
     */
    public static Database open(String name, DatabaseConfig config) {
        try {
            Files.createDirectories(config.getDataDir());
        } catch (IOException e) {
            throw new ExecutionException("Failed to create data directory " + config.getDataDir(), e);
        }
        Database database = new Database(name, config,
                new SnapshotStore(config.getDataDir(), name, config.isPrettySnapshot()));
        database.load();
        log.info("Opened database '{}' with {} table(s)", name, database.tables.size());
        return database;
    }

    public String getName() {
        return name;
    }

    public DatabaseConfig getConfig() {
        return config;
    }

    // ------------------------------------------------------------------ 表目录

    public Table createTable(String tableName, List<Column> columns) {
        if (tables.containsKey(tableName)) {
            throw new SchemaException("Table '" + tableName + "' already exists");
        }
        if (columns == null || columns.isEmpty()) {
            throw new SchemaException("Table must have at least one column");
        }
        Table table = new Table(tableName, columns, config.getBtreeOrder());
        tables.put(tableName, table);
        try {
            save();
        } catch (ExecutionException e) {
            tables.remove(tableName);
            throw e;
        }
        log.info("Created table '{}' with {} column(s)", tableName, columns.size());
        return table;
    }

    public void dropTable(String tableName) {
        Table table = requireTable(tableName);
        Map<String, Table> before = new LinkedHashMap<>(tables);
        tables.remove(tableName);
        try {
            save();
        } catch (ExecutionException e) {
            tables.clear();
            tables.putAll(before);
            throw e;
        }
        log.info("Dropped table '{}' ({} row(s))", tableName, table.getRowCount());
    }

    /**
     * @return 表，不存在时返回 null
     */
    public Table getTable(String tableName) {
        return tables.get(tableName);
    }

    /**
     * @throws SchemaException 表不存在时
     */
    public Table requireTable(String tableName) {
        Table table = tables.get(tableName);
        if (table == null) {
            throw new SchemaException("Table '" + tableName + "' does not exist");
        }
        return table;
    }

    public List<String> listTables() {
        return new ArrayList<>(tables.keySet());
    }

    public boolean tableExists(String tableName) {
        return tables.containsKey(tableName);
    }

    // ------------------------------------------------------------------ 持久化

    /**
     * 把整个目录写入快照（先写暂存文件再原子替换）。
     * @throws ExecutionException 写入失败时，旧快照保持不变
     */
    public void save() {
        store.write(codec.encode(name, LocalDateTime.now(), tables.values()));
    }

    /**
     * 从快照还原目录，是 {@link #save()} 的逆操作。快照不存在时什么也不做。
     */
    public void load() {
        JsonNode document = store.read();
        if (document == null) {
            return;
        }
        DatabaseSnapshot snapshot = codec.decode(document, config.getBtreeOrder());
        tables.clear();
        for (Table table : snapshot.tables()) {
            tables.put(table.getName(), table);
        }
        this.name = snapshot.name();
        log.info("Loaded database '{}' from {} ({} table(s), written at {})",
                name, store.getSnapshotPath(), tables.size(), snapshot.createdAt());
    }

    // ------------------------------------------------------------------ 统计与导出

    public DatabaseStats getStats() {
        Map<String, DatabaseStats.TableStats> tableStats = new LinkedHashMap<>();
        for (Table table : tables.values()) {
            int serializedLength = codec.encodeTable(table).toString().getBytes(StandardCharsets.UTF_8).length;
            tableStats.put(table.getName(), new DatabaseStats.TableStats(
                    table.getColumns().size(),
                    table.getRowCount(),
                    table.getIndexes().size(),
                    serializedLength / 1024.0));
        }
        return new DatabaseStats(name, tables.size(), tableStats);
    }

    /**
     * 把表导出为 CSV：第一行为按列顺序排列的表头，随后是每一条存活行。
     * Null 写作空字段，含逗号、引号或换行的字段按 RFC 4180 加引号。
     * @return 导出的行数
     */
    public int exportTableCsv(String tableName, Path output) {
        Table table = requireTable(tableName);
        List<String> columnOrder = table.getColumnOrder();
        int rows = 0;
        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            writeCsvLine(writer, columnOrder);
            for (RowSlot slot : table.scan()) {
                List<String> fields = new ArrayList<>(columnOrder.size());
                for (String column : columnOrder) {
                    Value value = slot.row().get(column);
                    fields.add(value.isNull() ? "" : value.render());
                }
                writeCsvLine(writer, fields);
                rows++;
            }
        } catch (IOException e) {
            throw new ExecutionException("Failed to export table '" + tableName + "' to " + output, e);
        }
        log.info("Exported {} row(s) of table '{}' to {}", rows, tableName, output);
        return rows;
    }

    private void writeCsvLine(BufferedWriter writer, List<String> fields) throws IOException {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(quoteCsv(fields.get(i)));
        }
        writer.write("\r\n");
    }

    static String quoteCsv(String field) {
        if (field.contains(",") || field.contains("\"") || field.contains("\n") || field.contains("\r")) {
            return "\"" + field.replace("\"", "\"\"") + "\"";
        }
        return field;
    }

    @Override
    public String toString() {
        return "Database(name=" + name + ", tables=" + tables.size() + ")";
    }
}
