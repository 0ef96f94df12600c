package com.example.objectcompressor.storage;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Write side of an object upload.
 * <p>
 * {@link #close()} commits the object and reports upload failures. {@link #abort(Throwable)}
 * discards it; a later {@code close()} is then a no-op.
 */
public abstract class ObjectWriter extends OutputStream {

    public abstract void abort(Throwable cause);

    @Override
    public abstract void close() throws IOException;
}
