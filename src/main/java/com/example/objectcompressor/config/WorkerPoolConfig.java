package com.example.objectcompressor.config;

import com.example.objectcompressor.worker.JobQueue;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "compressor", name = "subscription")
public class WorkerPoolConfig {

    @Bean
    public JobQueue jobQueue(CompressorProperties properties) {
        return new JobQueue(properties.resolvedQueueCapacity());
    }
}
