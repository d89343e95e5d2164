package com.interaction.clustering.store;

import org.rocksdb.CompressionType;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A RocksDB database holding both the adjacency mappings and the assignment snapshots
 * of one clustering run. The stores it hands out share the handle; closing the storage
 * closes the database.
 *
 * <p>Data survives a restart: reopening the same directory restores the frozen adjacency
 * and every committed snapshot.</p>
 */
public class RocksDbStorage implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RocksDbStorage.class);

    static {
        RocksDB.loadLibrary();
    }

    private final Path path;
    private final Options options;
    private final RocksDB db;
    private final WriteOptions writeOptions;
    private final WriteOptions syncWriteOptions;
    private final StorageRetry retry;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private RocksDbAdjacencyStore adjacencyStore;
    private RocksDbAssignmentStore assignmentStore;

    private RocksDbStorage(Path path, Options options, RocksDB db, StorageRetry retry) {
        this.path = path;
        this.options = options;
        this.db = db;
        this.retry = retry;
        this.writeOptions = new WriteOptions();
        this.syncWriteOptions = new WriteOptions().setSync(true);
    }

    /**
     * Opens (or creates) the database in {@code path}.
     */
    public static RocksDbStorage open(Path path, StorageRetry retry) {
        Options options = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setMaxWriteBufferNumber(4)
                .setWriteBufferSize(64L * 1024 * 1024)
                .setMaxBackgroundJobs(4);
        try {
            RocksDB db = retry.call("storage.open", () -> {
                Files.createDirectories(path);
                return RocksDB.open(options, path.toString());
            });
            log.info("RocksDbStorage opened at {}", path);
            return new RocksDbStorage(path, options, db, retry);
        } catch (RuntimeException e) {
            options.close();
            throw e;
        }
    }

    public static RocksDbStorage open(Path path) {
        return open(path, StorageRetry.defaults());
    }

    public synchronized RocksDbAdjacencyStore adjacencyStore() {
        if (adjacencyStore == null) {
            adjacencyStore = new RocksDbAdjacencyStore(this);
        }
        return adjacencyStore;
    }

    public synchronized RocksDbAssignmentStore assignmentStore() {
        if (assignmentStore == null) {
            assignmentStore = new RocksDbAssignmentStore(this);
        }
        return assignmentStore;
    }

    public Path getPath() {
        return path;
    }

    RocksDB db() {
        if (closed.get()) {
            throw new IllegalStateException("RocksDbStorage at " + path + " is closed");
        }
        return db;
    }

    WriteOptions writeOptions() {
        return writeOptions;
    }

    WriteOptions syncWriteOptions() {
        return syncWriteOptions;
    }

    StorageRetry retry() {
        return retry;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            writeOptions.close();
            syncWriteOptions.close();
            db.close();
            options.close();
            log.info("RocksDbStorage closed at {}", path);
        }
    }
}
