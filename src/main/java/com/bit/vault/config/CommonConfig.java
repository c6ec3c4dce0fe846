package com.bit.vault.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class CommonConfig {

    /**
     * 接口层取当前时间（秒）的时钟，测试中可替换
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
