package org.csu.reldb.storage.snapshot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.csu.reldb.common.exception.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 快照文件的读写。
 *
 * 写入时先完整写到暂存文件 {@code <name>.tmp}，再原子地替换 {@code <name>.json}，
 * 读者看到的总是旧的或新的完整快照。
 */
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private final Path snapshotPath;
    private final Path stagingPath;
    private final ObjectMapper objectMapper;

    public SnapshotStore(Path dataDir, String databaseName, boolean pretty) {
        this.snapshotPath = dataDir.resolve(databaseName + ".json");
        this.stagingPath = dataDir.resolve(databaseName + ".tmp");
        this.objectMapper = new ObjectMapper();
        if (pretty) {
            objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    public Path getSnapshotPath() {
        return snapshotPath;
    }

    public Path getStagingPath() {
        return stagingPath;
    }

    public boolean exists() {
        return Files.exists(snapshotPath);
    }

    /**
     * 写入快照。
     * @throws ExecutionException 发生 IO 错误时，原快照保持不变
     */
    public void write(JsonNode document) {
        long start = System.nanoTime();
        try {
            Files.createDirectories(snapshotPath.getParent());
            objectMapper.writeValue(stagingPath.toFile(), document);
            Files.move(stagingPath, snapshotPath,
                    StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new ExecutionException("Failed to persist database to " + snapshotPath + ": " + e.getMessage(), e);
        }
        log.debug("Snapshot written to {} in {} ms", snapshotPath, (System.nanoTime() - start) / 1_000_000);
    }

    /**
     * 读取快照。
     * @return 快照文档，文件不存在时返回 null
     */
    public JsonNode read() {
        if (!exists()) {
            return null;
        }
        try {
            return objectMapper.readTree(snapshotPath.toFile());
        } catch (IOException e) {
            throw new ExecutionException("Failed to load database from " + snapshotPath + ": " + e.getMessage(), e);
        }
    }
}
