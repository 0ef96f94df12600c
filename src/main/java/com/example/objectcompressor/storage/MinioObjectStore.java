package com.example.objectcompressor.storage;

import com.example.objectcompressor.exception.CompressionException;
import com.example.objectcompressor.exception.ObjectNotFoundException;
import com.example.objectcompressor.model.ObjectAttributes;
import io.minio.GetObjectArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.StatObjectArgs;
import io.minio.StatObjectResponse;
import io.minio.errors.ErrorResponseException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Service
@Slf4j
public class MinioObjectStore implements ObjectStore {

    // multipart uploads need a part size when the object length is unknown up front
    static final long PART_SIZE = 10L * 1024 * 1024;

    private static final Set<String> NOT_FOUND_CODES = Set.of("NoSuchKey", "NoSuchBucket", "NoSuchObject");

    private final MinioClient minioClient;
    private final ExecutorService uploads;

    public MinioObjectStore(MinioClient minioClient) {
        this.minioClient = minioClient;
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("minio-upload-");
        threadFactory.setDaemon(true);
        this.uploads = Executors.newCachedThreadPool(threadFactory);
    }

    @Override
    public InputStream openReader(String bucket, String objectName) {
        try {
            return minioClient.getObject(GetObjectArgs.builder()
                    .bucket(bucket)
                    .object(objectName)
                    .build());
        } catch (ErrorResponseException e) {
            throw translate(e, bucket, objectName, "open");
        } catch (Exception e) {
            throw new CompressionException("Failed to open '%s/%s'".formatted(bucket, objectName), e);
        }
    }

    @Override
    public ObjectAttributes attrs(String bucket, String objectName) {
        try {
            StatObjectResponse stat = minioClient.statObject(StatObjectArgs.builder()
                    .bucket(bucket)
                    .object(objectName)
                    .build());
            return new ObjectAttributes(stat.size(), stat.contentType(), stat.userMetadata());
        } catch (ErrorResponseException e) {
            throw translate(e, bucket, objectName, "stat");
        } catch (Exception e) {
            throw new CompressionException("Failed to stat '%s/%s'".formatted(bucket, objectName), e);
        }
    }

    @Override
    public ObjectWriter openWriter(String bucket, String objectName, String contentType, String contentEncoding,
                                   Map<String, String> userMetadata) {
        return new PipedUploadWriter(uploads, bucket + "/" + objectName, stream -> {
            PutObjectArgs.Builder args = PutObjectArgs.builder()
                    .bucket(bucket)
                    .object(objectName)
                    .stream(stream, -1, PART_SIZE)
                    .headers(Map.of("Content-Encoding", contentEncoding))
                    .userMetadata(userMetadata);
            if (contentType != null && !contentType.isBlank()) {
                args.contentType(contentType);
            }
            minioClient.putObject(args.build());
            log.debug("Uploaded {}/{}", bucket, objectName);
        });
    }

    @Override
    public void delete(String bucket, String objectName) {
        try {
            minioClient.removeObject(RemoveObjectArgs.builder()
                    .bucket(bucket)
                    .object(objectName)
                    .build());
        } catch (ErrorResponseException e) {
            throw translate(e, bucket, objectName, "delete");
        } catch (Exception e) {
            throw new CompressionException("Failed to delete '%s/%s'".formatted(bucket, objectName), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        uploads.shutdownNow();
    }

    private CompressionException translate(ErrorResponseException e, String bucket, String objectName,
                                           String operation) {
        if (e.errorResponse() != null && NOT_FOUND_CODES.contains(e.errorResponse().code())) {
            return new ObjectNotFoundException(bucket, objectName, e);
        }
        return new CompressionException("Failed to %s '%s/%s'".formatted(operation, bucket, objectName), e);
    }
}
