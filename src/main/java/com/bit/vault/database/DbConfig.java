package com.bit.vault.database;

import com.bit.vault.config.VaultProperties;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class DbConfig {

    @Autowired
    private VaultProperties properties;

    @Autowired
    private DataBase dataBase;

    @PostConstruct
    public void init() {
        VaultProperties.Storage storage = properties.getStorage();
        log.info("存储类型:{} 数据路径:{}", storage.getType(), storage.getPath());
        if (!dataBase.createDatabase(storage)) {
            throw new VaultException(ErrorType.STORAGE_FAILURE, "数据库创建失败");
        }
    }

    @PreDestroy
    public void shutdown() {
        dataBase.close();
    }

    public DataBase getDataBase() {
        return dataBase;
    }
}
