package com.bit.vault.database.rocksDb;

import com.bit.vault.config.VaultProperties;
import com.bit.vault.database.DataBase;
import com.bit.vault.database.KeyValueHandler;
import com.bit.vault.database.TableEnum;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.*;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "vault.storage", name = "type", havingValue = "rocksdb")
public class RocksDb implements DataBase {

    // 按表隔离的读缓存；键包装为 ByteBuffer 以按内容比较
    private final Map<TableEnum, Cache<ByteBuffer, byte[]>> tableCaches = new ConcurrentHashMap<>();

    private final RTable rTable = new RTable();
    private RocksDB db;
    private DBOptions options;
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    @Override
    public boolean createDatabase(VaultProperties.Storage config) {
        String dbPath = config.getPath();
        if (dbPath == null) {
            return false;
        }
        for (TableEnum table : TableEnum.values()) {
            tableCaches.put(table, Caffeine.newBuilder()
                    .maximumSize(config.getCacheSize())
                    .build());
        }

        try {
            File dbDir = new File(dbPath);
            if (!dbDir.exists() && !dbDir.mkdirs()) {
                log.error("创建数据库目录失败: {}", dbPath);
                return false;
            }

            List<ColumnFamilyDescriptor> cfDescriptors = new ArrayList<>();
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
            // 默认列族（索引0）
            cfDescriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, new ColumnFamilyOptions()));
            Map<TableEnum, ColumnFamilyDescriptor> customDescriptors = RTable.getColumnFamilyDescriptors();
            List<TableEnum> tableEnums = new ArrayList<>(customDescriptors.keySet());
            for (TableEnum table : tableEnums) {
                cfDescriptors.add(customDescriptors.get(table));
            }

            options = new DBOptions()
                    .setCreateIfMissing(true)
                    .setCreateMissingColumnFamilies(true)
                    .setInfoLogLevel(InfoLogLevel.ERROR_LEVEL);
            db = RocksDB.open(options, dbPath, cfDescriptors, cfHandles);

            if (cfHandles.size() != cfDescriptors.size()) {
                throw new VaultException(ErrorType.STORAGE_FAILURE, "列族句柄数量与描述符不匹配，初始化失败");
            }
            // 自定义列族从索引1开始绑定
            for (int i = 0; i < tableEnums.size(); i++) {
                rTable.setColumnFamilyHandle(tableEnums.get(i), cfHandles.get(i + 1));
            }
            log.info("RocksDB创建成功，路径: {}，列族总数: {}", dbPath, cfDescriptors.size());
            return true;
        } catch (RocksDBException e) {
            log.error("创建RocksDB失败", e);
            return false;
        }
    }

    @Override
    public boolean isExist(TableEnum table, byte[] key) {
        return get(table, key) != null;
    }

    @Override
    public void insert(TableEnum table, byte[] key, byte[] value) {
        rwLock.writeLock().lock();
        try {
            db.put(handle(table), key, value);
            tableCaches.get(table).put(ByteBuffer.wrap(key.clone()), value);
        } catch (RocksDBException e) {
            log.error("插入数据失败, table={}", table, e);
            throw new VaultException(ErrorType.STORAGE_FAILURE, "插入数据失败: " + e.getMessage());
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public byte[] get(TableEnum table, byte[] key) {
        Cache<ByteBuffer, byte[]> cache = tableCaches.get(table);
        byte[] cached = cache.getIfPresent(ByteBuffer.wrap(key));
        if (cached != null) {
            return cached;
        }
        rwLock.readLock().lock();
        try {
            byte[] value = db.get(handle(table), key);
            if (value != null) {
                cache.put(ByteBuffer.wrap(key.clone()), value);
            }
            return value;
        } catch (RocksDBException e) {
            log.error("获取数据失败, table={}", table, e);
            throw new VaultException(ErrorType.STORAGE_FAILURE, "获取数据失败: " + e.getMessage());
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public int count(TableEnum table) {
        int[] count = {0};
        iterate(table, (key, value) -> {
            count[0]++;
            return true;
        });
        return count[0];
    }

    @Override
    public void iterate(TableEnum table, KeyValueHandler handler) {
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(handle(table))) {
            iterator.seekToFirst();
            while (iterator.isValid()) {
                if (!handler.handle(iterator.key(), iterator.value())) {
                    break;
                }
                iterator.next();
            }
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        rwLock.writeLock().lock();
        try {
            if (db != null) {
                rTable.closeAll();
                db.close();
                db = null;
                options.close();
                tableCaches.values().forEach(Cache::invalidateAll);
                log.info("RocksDB连接已关闭");
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    private ColumnFamilyHandle handle(TableEnum table) {
        ColumnFamilyHandle cfHandle = rTable.getColumnFamilyHandle(table);
        if (cfHandle == null) {
            throw new IllegalArgumentException("表不存在: " + table);
        }
        return cfHandle;
    }
}
