package com.example.objectcompressor.storage;

import com.example.objectcompressor.exception.ObjectNotFoundException;
import com.example.objectcompressor.model.ObjectAttributes;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * Object store keeping everything in memory, with the same commit-on-close semantics as the
 * MinIO implementation.
 */
public class InMemoryObjectStore implements ObjectStore {

    public record StoredObject(byte[] data, String contentType, String contentEncoding, Map<String, String> userMetadata) {
    }

    private final Map<String, StoredObject> objects = new ConcurrentHashMap<>();
    private final AtomicInteger openedWriters = new AtomicInteger();
    private volatile UnaryOperator<InputStream> readerDecorator = UnaryOperator.identity();

    public void put(String bucket, String objectName, byte[] data, String contentType) {
        objects.put(key(bucket, objectName), new StoredObject(data.clone(), contentType, null, Map.of()));
    }

    public void put(String bucket, String objectName, StoredObject object) {
        objects.put(key(bucket, objectName), object);
    }

    public StoredObject get(String bucket, String objectName) {
        return objects.get(key(bucket, objectName));
    }

    public boolean exists(String bucket, String objectName) {
        return objects.containsKey(key(bucket, objectName));
    }

    public int openedWriters() {
        return openedWriters.get();
    }

    public void decorateReaders(UnaryOperator<InputStream> decorator) {
        this.readerDecorator = decorator;
    }

    @Override
    public InputStream openReader(String bucket, String objectName) {
        StoredObject object = require(bucket, objectName);
        return readerDecorator.apply(new ByteArrayInputStream(object.data()));
    }

    @Override
    public ObjectAttributes attrs(String bucket, String objectName) {
        StoredObject object = require(bucket, objectName);
        return new ObjectAttributes(object.data().length, object.contentType(), object.userMetadata());
    }

    @Override
    public ObjectWriter openWriter(String bucket, String objectName, String contentType, String contentEncoding,
                                   Map<String, String> userMetadata) {
        openedWriters.incrementAndGet();
        return new ObjectWriter() {
            private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            private boolean done;

            @Override
            public void write(int b) throws IOException {
                ensureOpen();
                buffer.write(b);
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                ensureOpen();
                buffer.write(b, off, len);
            }

            @Override
            public void abort(Throwable cause) {
                done = true;
            }

            @Override
            public void close() {
                if (done) {
                    return;
                }
                done = true;
                objects.put(key(bucket, objectName),
                        new StoredObject(buffer.toByteArray(), contentType, contentEncoding, userMetadata));
            }

            private void ensureOpen() throws IOException {
                if (done) {
                    throw new IOException("writer closed");
                }
            }
        };
    }

    @Override
    public void delete(String bucket, String objectName) {
        if (objects.remove(key(bucket, objectName)) == null) {
            throw new ObjectNotFoundException(bucket, objectName);
        }
    }

    private StoredObject require(String bucket, String objectName) {
        StoredObject object = objects.get(key(bucket, objectName));
        if (object == null) {
            throw new ObjectNotFoundException(bucket, objectName);
        }
        return object;
    }

    private static String key(String bucket, String objectName) {
        return bucket + "/" + objectName;
    }
}
