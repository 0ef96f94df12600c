package com.example.objectcompressor.service;

import com.example.objectcompressor.exception.CompressionException;
import com.example.objectcompressor.exception.DeletionFailedException;
import com.example.objectcompressor.exception.DestinationAlreadyExistsException;
import com.example.objectcompressor.exception.MetadataException;
import com.example.objectcompressor.exception.ObjectNotFoundException;
import com.example.objectcompressor.exception.SourceUnavailableException;
import com.example.objectcompressor.exception.TransferFailedException;
import com.example.objectcompressor.model.ObjectAttributes;
import com.example.objectcompressor.model.ObjectLocation;
import com.example.objectcompressor.model.TransferDescriptor;
import com.example.objectcompressor.model.TransferResult;
import com.example.objectcompressor.scope.ExecutionScope;
import com.example.objectcompressor.scope.ScopeCancelledException;
import com.example.objectcompressor.storage.ObjectStore;
import com.example.objectcompressor.storage.ObjectWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

/**
 * Streams one source object through gzip into one destination object, then (as a separate
 * step) removes the source.
 * <p>
 * The pipeline never retries. An existing destination is treated as the result of an earlier
 * run and is never overwritten.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompressionPipeline {

    /**
     * User metadata key recording which source an object was compressed from.
     */
    public static final String SOURCE_MARKER = "compressed-from";

    private static final int COPY_BUFFER_SIZE = 32 * 1024;

    private final ObjectStore objectStore;

    public TransferResult transfer(String workerName, TransferDescriptor descriptor, ExecutionScope scope) {
        ObjectLocation source = descriptor.getSource();
        ObjectLocation destination = descriptor.getDestination();

        if (scope.isCancelled()) {
            throw new TransferFailedException("transfer of '%s' not started".formatted(source), scope.cancellationException());
        }

        InputStream reader = openSource(source);
        try (ExecutionScope.Registration closeOnCancel = scope.onCancel(() -> closeReader(reader, source))) {
            ObjectAttributes sourceAttrs = sourceAttributes(source);
            ensureDestinationAbsent(source, destination);

            log.info("{} - '{}' reading file from bucket '{}' and writing compressed to '{}'",
                    workerName, source.objectName(), source.bucket(), destination);
            long bytesProcessed = compress(descriptor, sourceAttrs, reader, scope);

            ObjectAttributes destinationAttrs;
            try {
                destinationAttrs = objectStore.attrs(destination.bucket(), destination.objectName());
            } catch (CompressionException e) {
                throw new MetadataException("failed to read destination object metadata of '%s'".formatted(destination), e);
            }

            TransferResult result = new TransferResult(bytesProcessed, sourceAttrs.size(), destinationAttrs.size());
            log.info("{} - '{}' compressed {} bytes (source size {}) to {} bytes in {}. Compression ratio {}",
                    workerName, source.objectName(), bytesProcessed, sourceAttrs.size(), destinationAttrs.size(),
                    destination, String.format("%.2f", result.compressionRatio()));
            return result;
        } finally {
            closeReader(reader, source);
        }
    }

    public void deleteSource(String workerName, TransferDescriptor descriptor, ExecutionScope scope) {
        ObjectLocation source = descriptor.getSource();
        log.info("{} - '{}' initiating deletion of source file in bucket {}", workerName, source.objectName(), source.bucket());
        try {
            scope.throwIfCancelled();
            objectStore.delete(source.bucket(), source.objectName());
        } catch (CompressionException e) {
            throw new DeletionFailedException("error deleting source file '%s'".formatted(source), e);
        }
        log.info("{} - '{}' source file in bucket {} successfully deleted", workerName, source.objectName(), source.bucket());
    }

    private InputStream openSource(ObjectLocation source) {
        try {
            return objectStore.openReader(source.bucket(), source.objectName());
        } catch (CompressionException e) {
            throw new SourceUnavailableException("failed to open source object '%s'".formatted(source), e);
        }
    }

    private ObjectAttributes sourceAttributes(ObjectLocation source) {
        try {
            return objectStore.attrs(source.bucket(), source.objectName());
        } catch (CompressionException e) {
            throw new MetadataException("cannot determine source object size of '%s'".formatted(source), e);
        }
    }

    private void ensureDestinationAbsent(ObjectLocation source, ObjectLocation destination) {
        ObjectAttributes existing;
        try {
            existing = objectStore.attrs(destination.bucket(), destination.objectName());
        } catch (ObjectNotFoundException e) {
            return;
        } catch (CompressionException e) {
            throw new MetadataException("cannot check whether '%s' exists".formatted(destination), e);
        }
        boolean priorRun = source.toString().equals(existing.userMetadata().get(SOURCE_MARKER));
        throw new DestinationAlreadyExistsException(destination.bucket(), destination.objectName(), priorRun);
    }

    private long compress(TransferDescriptor descriptor, ObjectAttributes sourceAttrs, InputStream reader,
                          ExecutionScope scope) {
        ObjectLocation destination = descriptor.getDestination();
        ObjectWriter writer = objectStore.openWriter(destination.bucket(), destination.objectName(),
                sourceAttrs.contentType(), Compressors.GZIP_ENCODING,
                Map.of(SOURCE_MARKER, descriptor.getSource().toString()));

        GZIPOutputStream compressor = null;
        try (ExecutionScope.Registration abortOnCancel = scope.onCancel(() -> writer.abort(scope.cancellationException()))) {
            compressor = Compressors.gzip(writer, descriptor.getCompressionLevel());
            long bytesProcessed = copy(reader, compressor, scope);
            // writes the gzip trailer, then closes the writer which commits the destination
            compressor.close();
            return bytesProcessed;
        } catch (IOException | RuntimeException e) {
            writer.abort(e);
            closeAfterFailure(compressor, writer, e);
            throw new TransferFailedException("failed to compress and upload object to '%s'".formatted(destination),
                    failureCause(scope, e));
        }
    }

    private long copy(InputStream in, GZIPOutputStream out, ExecutionScope scope) throws IOException {
        byte[] buffer = new byte[COPY_BUFFER_SIZE];
        long total = 0;
        while (true) {
            scope.throwIfCancelled();
            int read = in.read(buffer);
            if (read == -1) {
                return total;
            }
            out.write(buffer, 0, read);
            total += read;
        }
    }

    private static Throwable failureCause(ExecutionScope scope, Exception failure) {
        if (failure instanceof ScopeCancelledException || !scope.isCancelled()) {
            return failure;
        }
        // the copy failed because cancellation closed its streams
        ScopeCancelledException cancelled = scope.cancellationException();
        cancelled.addSuppressed(failure);
        return cancelled;
    }

    private static void closeAfterFailure(GZIPOutputStream compressor, ObjectWriter writer, Exception failure) {
        if (compressor != null) {
            try {
                compressor.close();
            } catch (IOException e) {
                failure.addSuppressed(e);
            }
        }
        try {
            writer.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private static void closeReader(InputStream reader, ObjectLocation source) {
        try {
            reader.close();
        } catch (IOException e) {
            log.debug("closing reader of '{}' failed", source, e);
        }
    }
}
