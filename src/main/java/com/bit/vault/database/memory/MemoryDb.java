package com.bit.vault.database.memory;

import com.bit.vault.config.VaultProperties;
import com.bit.vault.database.DataBase;
import com.bit.vault.database.KeyValueHandler;
import com.bit.vault.database.TableEnum;
import com.google.common.primitives.UnsignedBytes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 内存数据库，进程退出即丢失，用于测试与单机演示
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "vault.storage", name = "type", havingValue = "memory", matchIfMissing = true)
public class MemoryDb implements DataBase {

    private final Map<TableEnum, ConcurrentSkipListMap<byte[], byte[]>> tables = new EnumMap<>(TableEnum.class);

    @Override
    public boolean createDatabase(VaultProperties.Storage config) {
        for (TableEnum table : TableEnum.values()) {
            tables.put(table, new ConcurrentSkipListMap<>(UnsignedBytes.lexicographicalComparator()));
        }
        log.info("内存数据库创建成功，表数量: {}", tables.size());
        return true;
    }

    @Override
    public boolean isExist(TableEnum table, byte[] key) {
        return tables.get(table).containsKey(key);
    }

    @Override
    public void insert(TableEnum table, byte[] key, byte[] value) {
        tables.get(table).put(key.clone(), value.clone());
    }

    @Override
    public byte[] get(TableEnum table, byte[] key) {
        byte[] value = tables.get(table).get(key);
        return value == null ? null : value.clone();
    }

    @Override
    public int count(TableEnum table) {
        return tables.get(table).size();
    }

    @Override
    public void iterate(TableEnum table, KeyValueHandler handler) {
        // 快照后遍历，处理器内允许写入
        List<Map.Entry<byte[], byte[]>> entries = new ArrayList<>(tables.get(table).entrySet());
        for (Map.Entry<byte[], byte[]> entry : entries) {
            if (!handler.handle(entry.getKey().clone(), entry.getValue().clone())) {
                break;
            }
        }
    }

    @Override
    public void close() {
        tables.clear();
    }
}
