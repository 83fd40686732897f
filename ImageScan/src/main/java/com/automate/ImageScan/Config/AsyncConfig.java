package com.automate.ImageScan.Config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    // stdout + stderr of every running scan need a reader each
    @Bean(name = "scanOutputExecutor")
    public Executor scanOutputExecutor(ScannerProperties properties) {
        int readers = properties.getMaxConcurrentScans() * 2;
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(readers);
        ex.setMaxPoolSize(readers);
        ex.setQueueCapacity(readers);
        ex.setThreadNamePrefix("scan-output-");
        ex.initialize();
        return ex;
    }
}
