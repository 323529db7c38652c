package org.csu.reldb.config;

import lombok.Getter;
import org.csu.reldb.storage.index.BTreeIndex;
import org.csu.reldb.storage.index.IndexType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 数据库配置。
 * {@link #load()} 先读取 classpath 上可选的 reldb.properties，再用同名的 JVM 系统属性覆盖。
 */
@Getter
public class DatabaseConfig {

    private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

    public static final String PROPERTIES_FILE = "reldb.properties";

    public static final String DATA_DIR_KEY = "reldb.data-dir";
    public static final String BTREE_ORDER_KEY = "reldb.btree-order";
    public static final String INDEX_TYPE_KEY = "reldb.index-type";
    public static final String PRETTY_SNAPSHOT_KEY = "reldb.snapshot.pretty";

    public static final String DEFAULT_DATA_DIR = "data";
    public static final int DEFAULT_BTREE_ORDER = BTreeIndex.DEFAULT_ORDER;
    public static final IndexType DEFAULT_INDEX_TYPE = IndexType.BTREE;
    public static final boolean DEFAULT_PRETTY_SNAPSHOT = true;

    private final Path dataDir;
    private final int btreeOrder;
    private final IndexType defaultIndexType;   // CREATE INDEX 建立的索引类型
    private final boolean prettySnapshot;

    public DatabaseConfig(Path dataDir, int btreeOrder, IndexType defaultIndexType, boolean prettySnapshot) {
        if (btreeOrder < 2) {
            throw new IllegalArgumentException("B-tree order must be at least 2, got " + btreeOrder);
        }
        this.dataDir = dataDir;
        this.btreeOrder = btreeOrder;
        this.defaultIndexType = defaultIndexType;
        this.prettySnapshot = prettySnapshot;
    }

    public static DatabaseConfig defaults() {
        return new DatabaseConfig(Paths.get(DEFAULT_DATA_DIR), DEFAULT_BTREE_ORDER, DEFAULT_INDEX_TYPE,
                DEFAULT_PRETTY_SNAPSHOT);
    }

    /**
     * 读取 reldb.properties 与系统属性。
     */
    public static DatabaseConfig load() {
        Properties properties = new Properties();
        try (InputStream in = DatabaseConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
            if (in != null) {
                properties.load(in);
                log.debug("Loaded configuration from classpath resource {}", PROPERTIES_FILE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + PROPERTIES_FILE, e);
        }
        for (String key : new String[]{DATA_DIR_KEY, BTREE_ORDER_KEY, INDEX_TYPE_KEY, PRETTY_SNAPSHOT_KEY}) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return fromProperties(properties);
    }

    /**
     * 从属性集合构造配置，缺失的键取默认值。
     * @throws IllegalArgumentException 属性值非法时
     */
    public static DatabaseConfig fromProperties(Properties properties) {
        String dataDir = properties.getProperty(DATA_DIR_KEY, DEFAULT_DATA_DIR).trim();
        String order = properties.getProperty(BTREE_ORDER_KEY, String.valueOf(DEFAULT_BTREE_ORDER)).trim();
        String indexType = properties.getProperty(INDEX_TYPE_KEY, DEFAULT_INDEX_TYPE.name()).trim();
        String pretty = properties.getProperty(PRETTY_SNAPSHOT_KEY, String.valueOf(DEFAULT_PRETTY_SNAPSHOT)).trim();

        int btreeOrder;
        try {
            btreeOrder = Integer.parseInt(order);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + BTREE_ORDER_KEY + ": " + order, e);
        }
        IndexType type;
        try {
            type = IndexType.valueOf(indexType.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + INDEX_TYPE_KEY + ": " + indexType, e);
        }
        return new DatabaseConfig(Paths.get(dataDir), btreeOrder, type, Boolean.parseBoolean(pretty));
    }

    public DatabaseConfig withDataDir(Path newDataDir) {
        return new DatabaseConfig(newDataDir, btreeOrder, defaultIndexType, prettySnapshot);
    }
}
