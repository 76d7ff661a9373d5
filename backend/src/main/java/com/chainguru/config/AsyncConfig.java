package com.chainguru.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: measurement-executor runs one sampling task per target. The dispatcher coordinator runs on the
 * caller (scheduler) thread and keeps at most {@code concurrency} tasks in flight. The pool holds twice that many
 * threads so workers that ignore the timeout interrupt do not leave later targets waiting for a thread.
 */
@Configuration
public class AsyncConfig {

    public static final String MEASUREMENT_EXECUTOR = "measurement-executor";

    @Bean(name = MEASUREMENT_EXECUTOR)
    public Executor measurementExecutor(@Value("${chainguru.measurement.concurrency:50}") int concurrency) {
        int size = Math.max(1, concurrency) * 2;
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size);
        e.setThreadNamePrefix("measure-");
        // cancelled tasks must not keep the JVM alive on shutdown
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        return e;
    }
}
