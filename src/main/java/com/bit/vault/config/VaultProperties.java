package com.bit.vault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "vault")
public class VaultProperties {

    private Keeper keeper = new Keeper();
    private ExitQueue exitQueue = new ExitQueue();
    private Storage storage = new Storage();
    private Journal journal = new Journal();

    // 创建金库时铸造给金库自身的份额/资产，防止首个存款人操纵份额价格
    private BigInteger securityDeposit = BigInteger.valueOf(1_000_000_000L);

    @Data
    public static class Keeper {
        private long updateDelay = 43_200;//秒
        private BigInteger maxAvgRewardPerSecond = BigInteger.valueOf(6_341_958_396L);
        private long chainId = 1;
        private List<String> oracles = new ArrayList<>();
        private int minOracles;
        // 预言机集合管理员地址，为空时拒绝所有管理操作
        private String owner;
    }

    @Data
    public static class ExitQueue {
        private long claimDelay = 86_400;//秒
        private long updateDelay = 86_400;//两个检查点之间的最小间隔 0表示不限制
    }

    @Data
    public static class Storage {
        private String type = "memory";// memory | rocksdb
        private String path = "./data/vault";
        private int cacheSize = 10_000;
    }

    @Data
    public static class Journal {
        private boolean enabled = true;
    }
}
