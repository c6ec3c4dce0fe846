package com.bit.vault.journal;

import com.bit.vault.config.VaultProperties;
import com.bit.vault.database.DataBase;
import com.bit.vault.database.TableEnum;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.util.ByteUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * 只追加的操作日志，键为8字节大端序号，值为 JSON
 * 调用方须在持有被记录状态的锁时写入，日志顺序即串行化顺序
 */
@Slf4j
@Component
@DependsOn("dbConfig")
public class VaultJournal {

    @Autowired
    private DataBase dataBase;

    @Autowired
    private VaultProperties properties;

    @Autowired
    private ObjectMapper objectMapper;

    private long nextSequence;
    private volatile boolean replaying;

    @PostConstruct
    public void init() {
        nextSequence = dataBase.count(TableEnum.JOURNAL);
        log.info("操作日志已加载，记录数: {}，启用: {}", nextSequence, properties.getJournal().isEnabled());
    }

    public synchronized void record(JournalEntry entry) {
        if (replaying || !properties.getJournal().isEnabled()) {
            return;
        }
        byte[] value;
        try {
            value = objectMapper.writeValueAsBytes(entry);
        } catch (JsonProcessingException e) {
            log.error("序列化操作日志失败: {}", entry, e);
            throw new VaultException(ErrorType.STORAGE_FAILURE, "序列化操作日志失败", e);
        }
        dataBase.insert(TableEnum.JOURNAL, ByteUtils.longToBytes(nextSequence), value);
        nextSequence++;
    }

    /**
     * 按序号顺序重放，重放期间 {@link #record} 不再写入
     * @return 重放条数
     */
    public int replay(Consumer<JournalEntry> consumer) {
        if (!properties.getJournal().isEnabled()) {
            return 0;
        }
        int[] replayed = {0};
        replaying = true;
        try {
            dataBase.iterate(TableEnum.JOURNAL, (key, value) -> {
                JournalEntry entry;
                try {
                    entry = objectMapper.readValue(value, JournalEntry.class);
                } catch (IOException e) {
                    log.error("解析操作日志失败，序号: {}", ByteUtils.bytesToLong(key), e);
                    throw new VaultException(ErrorType.STORAGE_FAILURE,
                            "解析操作日志失败，序号: " + ByteUtils.bytesToLong(key), e);
                }
                consumer.accept(entry);
                replayed[0]++;
                return true;
            });
        } finally {
            replaying = false;
        }
        return replayed[0];
    }

    public synchronized long size() {
        return nextSequence;
    }
}
