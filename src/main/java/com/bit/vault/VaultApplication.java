package com.bit.vault;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.vault")
public class VaultApplication {
    public static void main(String[] args) {
        long start = System.currentTimeMillis();
        SpringApplication.run(VaultApplication.class, args);
        log.info("启动耗时{}ms", System.currentTimeMillis() - start);
    }
    //二进制统一大端
}
