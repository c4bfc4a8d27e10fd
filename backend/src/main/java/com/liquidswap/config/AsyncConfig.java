package com.liquidswap.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Recovery pool: one handler task per active swap id.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String RECOVERY_EXECUTOR = "recovery-executor";

    @Bean(name = RECOVERY_EXECUTOR)
    public Executor recoveryExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(8);
        e.setThreadNamePrefix("recovery-");
        e.initialize();
        return e;
    }
}
