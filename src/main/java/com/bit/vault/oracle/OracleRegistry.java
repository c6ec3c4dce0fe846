package com.bit.vault.oracle;

import com.bit.vault.common.Address;
import com.bit.vault.config.VaultProperties;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.journal.JournalEntry;
import com.bit.vault.journal.VaultJournal;
import com.bit.vault.util.ByteUtils;
import com.bit.vault.util.CallerSignatures;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 预言机签名者集合与法定人数（minOracles）
 * 变更只接受管理员（vault.keeper.owner）；签名入口按 adminNonce 防重放
 */
@Slf4j
@Component
public class OracleRegistry {

    @Autowired
    private VaultProperties properties;

    @Autowired
    private VaultJournal journal;

    private final Set<Address> oracles = new TreeSet<>();
    private int minOracles;
    private Address owner;
    private long adminNonce;

    @PostConstruct
    public void init() {
        for (String oracle : properties.getKeeper().getOracles()) {
            oracles.add(Address.fromHex(oracle));
        }
        minOracles = properties.getKeeper().getMinOracles();
        if (!oracles.isEmpty() && (minOracles <= 0 || minOracles > oracles.size())) {
            throw new VaultException(ErrorType.INVALID_ORACLES,
                    "初始预言机数量 " + oracles.size() + "，法定人数 " + minOracles);
        }
        String configuredOwner = properties.getKeeper().getOwner();
        owner = StringUtils.hasText(configuredOwner) ? Address.fromHex(configuredOwner) : null;
        if (owner == null) {
            log.warn("未配置预言机管理员，预言机集合不可变更");
        }
        log.info("预言机集合初始化完成，签名者数量: {}，法定人数: {}，管理员: {}", oracles.size(), minOracles, owner);
    }

    public synchronized void addOracle(Address caller, Address oracle) {
        checkOwner(caller);
        if (oracles.contains(oracle)) {
            throw new VaultException(ErrorType.INVALID_ORACLES, "预言机已存在: " + oracle);
        }
        journal.record(new JournalEntry.OracleAdded(oracle));
        oracles.add(oracle);
        adminNonce++;
        log.info("添加预言机: {}", oracle);
    }

    public synchronized void addOracle(Address oracle, byte[] ownerSignature) {
        addOracle(recoverCaller("addOracle", CallerSignatures.word(oracle), ownerSignature), oracle);
    }

    public synchronized void removeOracle(Address caller, Address oracle) {
        checkOwner(caller);
        if (!oracles.contains(oracle)) {
            throw new VaultException(ErrorType.INVALID_ORACLES, "预言机不存在: " + oracle);
        }
        if (oracles.size() - 1 < minOracles) {
            throw new VaultException(ErrorType.INVALID_ORACLES, "移除后签名者数量低于法定人数 " + minOracles);
        }
        journal.record(new JournalEntry.OracleRemoved(oracle));
        oracles.remove(oracle);
        adminNonce++;
        log.info("移除预言机: {}", oracle);
    }

    public synchronized void removeOracle(Address oracle, byte[] ownerSignature) {
        removeOracle(recoverCaller("removeOracle", CallerSignatures.word(oracle), ownerSignature), oracle);
    }

    public synchronized void setMinOracles(Address caller, int min) {
        checkOwner(caller);
        if (min <= 0 || min > oracles.size()) {
            throw new VaultException(ErrorType.INVALID_ORACLES,
                    "法定人数 " + min + " 不在 [1, " + oracles.size() + "] 范围内");
        }
        journal.record(new JournalEntry.MinOraclesUpdated(min));
        minOracles = min;
        adminNonce++;
        log.info("法定人数更新为: {}", min);
    }

    public synchronized void setMinOracles(int min, byte[] ownerSignature) {
        setMinOracles(recoverCaller("setMinOracles", ByteUtils.toWord(min), ownerSignature), min);
    }

    /**
     * 管理签名的摘要，包含当前 adminNonce，每次成功变更后旧签名失效
     */
    public synchronized byte[] adminDigest(String action, byte[] argument) {
        return CallerSignatures.digest(properties.getKeeper().getChainId(), action, argument, ByteUtils.toWord(adminNonce));
    }

    public synchronized long getAdminNonce() {
        return adminNonce;
    }

    public Address getOwner() {
        return owner;
    }

    public synchronized int getMinOracles() {
        return minOracles;
    }

    /**
     * 签名者集合快照
     */
    public synchronized Set<Address> getOracles() {
        return Collections.unmodifiableSet(new TreeSet<>(oracles));
    }

    private Address recoverCaller(String action, byte[] argument, byte[] signature) {
        return CallerSignatures.recover(adminDigest(action, argument), signature);
    }

    private void checkOwner(Address caller) {
        if (owner == null || !owner.equals(caller)) {
            throw new VaultException(ErrorType.ACCESS_DENIED, "调用者 " + caller + " 不是预言机管理员");
        }
    }
}
