package com.example.objectcompressor.config;

import lombok.Data;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings shared by both entry modes. Exactly one of {@code sourceObjectName} (direct mode)
 * and {@code subscription} (event-driven mode) must be set.
 */
@Data
@ConfigurationProperties(prefix = "compressor")
public class CompressorProperties implements InitializingBean {

    public static final int DEFAULT_COMPRESSION = -1;
    public static final int HUFFMAN_ONLY = -2;
    public static final int BEST_COMPRESSION = 9;

    /**
     * NoCompression = 0, BestSpeed = 1, BestCompression = 9, DefaultCompression = -1, HuffmanOnly = -2.
     */
    private int compressionLevel = DEFAULT_COMPRESSION;

    private String sourceBucket;

    private String destinationBucket;

    /**
     * Name of the uncompressed source object [direct mode].
     */
    private String sourceObjectName;

    /**
     * Name of the compressed destination object, defaults to the source name [direct mode].
     */
    private String destinationObjectName;

    /**
     * Topic carrying storage notifications [event-driven].
     */
    private String subscription;

    /**
     * Topic used to republish notifications interrupted by a shutdown [event-driven].
     */
    private String recoveryTopic;

    private String projectId = "object-compressor";

    /**
     * Objects whose name contains this marker are transient and never compressed.
     */
    private String tempObjectMarker = "dax-tmp";

    /**
     * Worker count; zero or less means available processors minus one.
     */
    private int workers;

    /**
     * Job queue capacity; zero or less means the worker count.
     */
    private int queueCapacity;

    private Duration jobTimeout = Duration.ofMinutes(60);

    private Duration republishTimeout = Duration.ofSeconds(5);

    /**
     * Time between a shutdown signal and cancelling the root scope; sized to fit inside the
     * usual 10s container kill grace period.
     */
    private Duration drainGracePeriod = Duration.ofSeconds(7);

    @Override
    public void afterPropertiesSet() {
        validate();
    }

    public void validate() {
        if (isBlank(sourceBucket) || isBlank(destinationBucket)) {
            throw new IllegalStateException("compressor.source-bucket and compressor.destination-bucket are required");
        }
        if (isBlank(sourceObjectName) == isBlank(subscription)) {
            throw new IllegalStateException(
                    "provide either compressor.source-object-name for direct mode xor compressor.subscription");
        }
        if (!isBlank(subscription) && isBlank(recoveryTopic)) {
            throw new IllegalStateException("compressor.recovery-topic is required with compressor.subscription");
        }
        if (isDirect() && sourceBucket.equals(destinationBucket)
                && sourceObjectName.equals(resolvedDestinationObjectName())) {
            throw new IllegalStateException(
                    "when source and destination bucket are the same, the destination object name must differ");
        }
        if (compressionLevel < HUFFMAN_ONLY || compressionLevel > BEST_COMPRESSION) {
            throw new IllegalStateException("compressor.compression-level must be between -2 and 9");
        }
        requirePositive("job-timeout", jobTimeout);
        requirePositive("republish-timeout", republishTimeout);
        requirePositive("drain-grace-period", drainGracePeriod);
    }

    public boolean isDirect() {
        return !isBlank(sourceObjectName);
    }

    public String resolvedDestinationObjectName() {
        return isBlank(destinationObjectName) ? sourceObjectName : destinationObjectName;
    }

    public int resolvedWorkers() {
        return resolveWorkers(workers, Runtime.getRuntime().availableProcessors());
    }

    public int resolvedQueueCapacity() {
        return queueCapacity > 0 ? queueCapacity : resolvedWorkers();
    }

    static int resolveWorkers(int configured, int availableProcessors) {
        if (configured > 0) {
            return configured;
        }
        return Math.max(1, availableProcessors - 1);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalStateException("compressor." + name + " must be positive");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
