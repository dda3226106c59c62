package com.bit.bchpool.database.rocksDb;

import com.bit.bchpool.database.DataBase;
import com.bit.bchpool.database.KeyValueHandler;
import com.bit.bchpool.exception.ErrorType;
import com.bit.bchpool.exception.PoolException;
import com.bit.bchpool.util.ByteUtils;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.InfoLogLevel;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;


/**
 * RocksDB 实现，每张表一个列族，读路径带 Caffeine 缓存
 */
@Slf4j
public class RocksDb implements DataBase {

    // 按表隔离的读缓存 hex(key) -> value
    private final Map<TableEnum, Cache<String, byte[]>> tableCaches = new ConcurrentHashMap<>();

    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();
    private final RTable rTable = new RTable();
    private RocksDB db;
    private DBOptions dbOptions;
    private ColumnFamilyOptions defaultOptions;
    private ColumnFamilyHandle defaultHandle;
    private String dbPath;

    @Override
    public boolean createDatabase(String path) {
        if (path == null) {
            return false;
        }
        dbPath = path;

        for (TableEnum table : TableEnum.values()) {
            Cache<String, byte[]> cache = Caffeine.newBuilder()
                    .maximumSize(table.getCacheSize())
                    .expireAfterWrite(table.getCacheTL(), TimeUnit.SECONDS)
                    .build();
            tableCaches.put(table, cache);
        }

        rwLock.writeLock().lock();
        try {
            File dbDir = new File(dbPath);
            if (!dbDir.exists() && !dbDir.mkdirs()) {
                log.error("创建数据库目录失败: {}", dbPath);
                return false;
            }

            List<ColumnFamilyDescriptor> cfDescriptors = new ArrayList<>();
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();

            // 默认列族（索引0）
            defaultOptions = new ColumnFamilyOptions();
            cfDescriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, defaultOptions));

            Map<TableEnum, ColumnFamilyDescriptor> customDescriptors = rTable.getColumnFamilyDescriptors();
            List<TableEnum> tableEnums = new ArrayList<>(customDescriptors.keySet());
            for (TableEnum table : tableEnums) {
                cfDescriptors.add(customDescriptors.get(table));
            }

            dbOptions = new DBOptions()
                    .setCreateIfMissing(true)
                    .setCreateMissingColumnFamilies(true)
                    .setInfoLogLevel(InfoLogLevel.ERROR_LEVEL);

            db = RocksDB.open(dbOptions, dbPath, cfDescriptors, cfHandles);

            if (cfHandles.size() != cfDescriptors.size()) {
                throw new PoolException(ErrorType.PERSISTENCE_FAILED, "列族句柄数量与描述符不匹配，初始化失败");
            }
            // 自定义列族从索引1开始绑定
            defaultHandle = cfHandles.get(0);
            for (int i = 0; i < tableEnums.size(); i++) {
                rTable.setColumnFamilyHandle(tableEnums.get(i), cfHandles.get(i + 1));
                log.debug("绑定表[{}]的列族句柄，索引: {}", tableEnums.get(i), i + 1);
            }

            log.info("RocksDB创建成功，路径: {}，列族总数: {}", dbPath, cfDescriptors.size());
            return true;
        } catch (RocksDBException e) {
            log.error("创建RocksDB失败", e);
            return false;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public boolean closeDatabase() {
        rwLock.writeLock().lock();
        try {
            if (db != null) {
                rTable.closeHandles();
                defaultHandle.close();
                db.close();
                db = null;
                rTable.closeOptions();
                dbOptions.close();
                defaultOptions.close();
                log.info("RocksDB连接已关闭: {}", dbPath);
            }
            clearCaches();
            return true;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void insert(TableEnum table, byte[] key, byte[] value) {
        rwLock.writeLock().lock();
        try {
            db.put(requireHandle(table), key, value);
            tableCaches.get(table).put(ByteUtils.bytesToHex(key), value);
        } catch (RocksDBException e) {
            log.error("插入数据失败, table={}", table, e);
            throw new PoolException(ErrorType.PERSISTENCE_FAILED, "插入数据失败: " + table, e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void update(TableEnum table, byte[] key, byte[] value) {
        // RocksDB的更新就是覆盖写入
        insert(table, key, value);
    }

    @Override
    public byte[] get(TableEnum table, byte[] key) {
        String cacheKey = ByteUtils.bytesToHex(key);
        byte[] cached = tableCaches.get(table).getIfPresent(cacheKey);
        if (cached != null) {
            return cached;
        }
        rwLock.readLock().lock();
        try {
            byte[] value = db.get(requireHandle(table), key);
            if (value != null) {
                tableCaches.get(table).put(cacheKey, value);
            }
            return value;
        } catch (RocksDBException e) {
            log.error("获取数据失败, table={}", table, e);
            throw new PoolException(ErrorType.PERSISTENCE_FAILED, "获取数据失败: " + table, e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public int count(TableEnum table) {
        int[] count = {0};
        iterate(table, false, (key, value) -> {
            count[0]++;
            return true;
        });
        return count[0];
    }

    @Override
    public void iterate(TableEnum table, boolean reverse, KeyValueHandler handler) {
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(requireHandle(table))) {
            if (reverse) {
                iterator.seekToLast();
            } else {
                iterator.seekToFirst();
            }
            while (iterator.isValid()) {
                if (!handler.handle(iterator.key(), iterator.value())) {
                    break;
                }
                if (reverse) {
                    iterator.prev();
                } else {
                    iterator.next();
                }
            }
        } finally {
            rwLock.readLock().unlock();
        }
    }

    private void clearCaches() {
        tableCaches.values().forEach(Cache::invalidateAll);
    }

    private ColumnFamilyHandle requireHandle(TableEnum table) {
        if (db == null) {
            throw new PoolException(ErrorType.PERSISTENCE_FAILED, "数据库未打开");
        }
        ColumnFamilyHandle handle = rTable.getColumnFamilyHandle(table);
        if (handle == null) {
            throw new PoolException(ErrorType.PERSISTENCE_FAILED, "表不存在: " + table);
        }
        return handle;
    }
}
