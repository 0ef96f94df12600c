package com.example.objectcompressor.runner;

import com.example.objectcompressor.config.CompressorProperties;
import com.example.objectcompressor.exception.CompressionException;
import com.example.objectcompressor.model.TransferDescriptor;
import com.example.objectcompressor.scope.ProcessScopes;
import com.example.objectcompressor.service.CompressionPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Compresses the single object named by {@code compressor.source-object-name}, then deletes it.
 * Any failure propagates, so the process exits non-zero.
 */
@Component
@ConditionalOnProperty(prefix = "compressor", name = "source-object-name")
@RequiredArgsConstructor
@Slf4j
public class DirectCompressionRunner implements ApplicationRunner {

    static final String WORKER_NAME = "[default]";

    private final CompressionPipeline pipeline;
    private final CompressorProperties properties;
    private final ProcessScopes scopes;

    @Override
    public void run(ApplicationArguments args) {
        TransferDescriptor descriptor = TransferDescriptor.of(
                properties.getSourceBucket(), properties.getSourceObjectName(),
                properties.getDestinationBucket(), properties.resolvedDestinationObjectName(),
                properties.getCompressionLevel());

        try {
            pipeline.transfer(WORKER_NAME, descriptor, scopes.getRoot());
        } catch (CompressionException e) {
            log.error("error compressing object: {}", e.getMessage(), e);
            throw e;
        }

        try {
            pipeline.deleteSource(WORKER_NAME, descriptor, scopes.getRoot());
        } catch (CompressionException e) {
            log.error("error deleting source object: {}", e.getMessage(), e);
            throw e;
        }
    }
}
