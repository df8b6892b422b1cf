package com.reelhub.discovery.execution;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DiscoveryExecutionConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService discoveryExecutor(@Value("${discovery.execution.pool-size:16}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(2, poolSize));
    }
}
