package com.example.objectcompressor.storage;

import com.example.objectcompressor.exception.ObjectNotFoundException;
import com.example.objectcompressor.model.ObjectAttributes;

import java.io.InputStream;
import java.util.Map;

/**
 * Narrow view of the object store used by the compression pipeline. Implementations must be
 * safe for concurrent use by several workers.
 */
public interface ObjectStore {

    /**
     * @throws ObjectNotFoundException if the object does not exist
     */
    InputStream openReader(String bucket, String objectName);

    /**
     * @throws ObjectNotFoundException if the object does not exist
     */
    ObjectAttributes attrs(String bucket, String objectName);

    /**
     * Opens a streaming upload. Nothing becomes visible until {@link ObjectWriter#close()}
     * succeeds, and nothing at all after {@link ObjectWriter#abort(Throwable)}.
     */
    ObjectWriter openWriter(String bucket, String objectName, String contentType, String contentEncoding,
                            Map<String, String> userMetadata);

    /**
     * @throws ObjectNotFoundException if the object does not exist
     */
    void delete(String bucket, String objectName);
}
