package com.example.objectcompressor.storage;

import com.example.objectcompressor.exception.CompressionException;
import com.example.objectcompressor.exception.ObjectNotFoundException;
import com.example.objectcompressor.model.ObjectAttributes;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.StatObjectArgs;
import io.minio.StatObjectResponse;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.ErrorResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MinioObjectStoreTest {

    @Mock
    private MinioClient minioClient;

    private MinioObjectStore objectStore;

    @BeforeEach
    void setUp() {
        objectStore = new MinioObjectStore(minioClient);
    }

    @AfterEach
    void tearDown() {
        objectStore.shutdown();
    }

    @Test
    void attrs_ReadsSizeTypeAndMetadata() throws Exception {
        StatObjectResponse stat = mock(StatObjectResponse.class);
        when(stat.size()).thenReturn(10_000L);
        when(stat.contentType()).thenReturn("text/csv");
        when(stat.userMetadata()).thenReturn(Map.of("compressed-from", "src-bucket/report.csv"));
        when(minioClient.statObject(any(StatObjectArgs.class))).thenReturn(stat);

        ObjectAttributes attrs = objectStore.attrs("dst-bucket", "report.csv");

        assertEquals(10_000L, attrs.size());
        assertEquals("text/csv", attrs.contentType());
        assertEquals("src-bucket/report.csv", attrs.userMetadata().get("compressed-from"));
    }

    @Test
    void attrs_NoSuchKeyIsNotFound() throws Exception {
        ErrorResponseException notFound = errorResponse("NoSuchKey");
        when(minioClient.statObject(any(StatObjectArgs.class))).thenThrow(notFound);

        assertThrows(ObjectNotFoundException.class, () -> objectStore.attrs("dst-bucket", "report.csv"));
    }

    @Test
    void delete_OtherErrorsAreNotNotFound() throws Exception {
        ErrorResponseException denied = errorResponse("AccessDenied");
        doThrow(denied).when(minioClient).removeObject(any(RemoveObjectArgs.class));

        CompressionException e = assertThrows(CompressionException.class, () -> objectStore.delete("src-bucket", "a.txt"));
        assertFalse(e instanceof ObjectNotFoundException);
    }

    @Test
    void delete_NoSuchBucketIsNotFound() throws Exception {
        ErrorResponseException noBucket = errorResponse("NoSuchBucket");
        doThrow(noBucket).when(minioClient).removeObject(any(RemoveObjectArgs.class));

        assertThrows(ObjectNotFoundException.class, () -> objectStore.delete("missing", "a.txt"));
    }

    @Test
    void openWriter_CloseCommitsStreamedBytes() throws Exception {
        AtomicReference<byte[]> uploaded = new AtomicReference<>();
        AtomicReference<String> target = new AtomicReference<>();
        when(minioClient.putObject(any(PutObjectArgs.class))).thenAnswer(invocation -> {
            PutObjectArgs args = invocation.getArgument(0);
            target.set(args.bucket() + "/" + args.object());
            uploaded.set(args.stream().readAllBytes());
            return null;
        });
        byte[] data = "compressed bytes".repeat(10_000).getBytes(StandardCharsets.UTF_8);

        ObjectWriter writer = objectStore.openWriter("dst-bucket", "a.txt", "text/plain", "gzip", Map.of());
        writer.write(data);
        writer.close();

        assertEquals("dst-bucket/a.txt", target.get());
        assertArrayEquals(data, uploaded.get());
    }

    @Test
    void openWriter_AbortFailsTheUpload() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch failed = new CountDownLatch(1);
        AtomicBoolean committed = new AtomicBoolean();
        when(minioClient.putObject(any(PutObjectArgs.class))).thenAnswer(invocation -> {
            started.countDown();
            try {
                PutObjectArgs args = invocation.getArgument(0);
                args.stream().readAllBytes();
                committed.set(true);
            } catch (IOException e) {
                failed.countDown();
                throw e;
            }
            return null;
        });

        ObjectWriter writer = objectStore.openWriter("dst-bucket", "a.txt", null, "gzip", Map.of());
        writer.write(new byte[1024]);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        writer.abort(new IOException("cancelled"));

        assertTrue(failed.await(5, TimeUnit.SECONDS));
        assertFalse(committed.get());
        assertThrows(IOException.class, () -> writer.write(1));
        assertDoesNotThrow(writer::close);
    }

    @Test
    void openWriter_EarlyUploadFailureSurfacesOnClose() throws Exception {
        ErrorResponseException denied = errorResponse("AccessDenied");
        when(minioClient.putObject(any(PutObjectArgs.class))).thenThrow(denied);

        ObjectWriter writer = objectStore.openWriter("dst-bucket", "a.txt", null, "gzip", Map.of());

        assertThrows(IOException.class, () -> {
            writer.write(new byte[16]);
            writer.close();
        });
    }

    private static ErrorResponseException errorResponse(String code) {
        ErrorResponse response = mock(ErrorResponse.class);
        lenient().when(response.code()).thenReturn(code);
        ErrorResponseException exception = mock(ErrorResponseException.class);
        lenient().when(exception.errorResponse()).thenReturn(response);
        return exception;
    }
}
