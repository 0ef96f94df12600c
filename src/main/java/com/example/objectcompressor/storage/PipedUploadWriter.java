package com.example.objectcompressor.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Turns an upload API that consumes an {@link InputStream} into an {@link ObjectWriter}.
 * <p>
 * Bytes written here are piped to an upload task running on {@code executor}. Aborting makes the
 * upload's reads fail, so the store never sees a clean end of stream and never commits a
 * truncated object.
 */
class PipedUploadWriter extends ObjectWriter {

    private static final int PIPE_BUFFER = 256 * 1024;

    @FunctionalInterface
    interface Upload {
        void run(InputStream stream) throws Exception;
    }

    private final String target;
    private final PipedOutputStream sink;
    private final AbortableInput source;
    private final Future<?> upload;
    private volatile boolean closed;

    PipedUploadWriter(ExecutorService executor, String target, Upload upload) {
        this.target = target;
        this.source = new AbortableInput(PIPE_BUFFER);
        try {
            this.sink = new PipedOutputStream(source);
        } catch (IOException e) {
            throw new IllegalStateException("unable to connect upload pipe", e);
        }
        this.upload = executor.submit(() -> {
            try (InputStream in = source) {
                upload.run(in);
            }
            return null;
        });
    }

    @Override
    public void write(int b) throws IOException {
        ensureWritable();
        sink.write(b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        ensureWritable();
        sink.write(b, off, len);
    }

    @Override
    public void flush() throws IOException {
        ensureWritable();
        sink.flush();
    }

    @Override
    public void abort(Throwable cause) {
        if (closed) {
            return;
        }
        closed = true;
        source.abort(cause);
        upload.cancel(true);
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        sink.close();
        try {
            upload.get();
        } catch (InterruptedException e) {
            source.abort(e);
            upload.cancel(true);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while committing " + target);
        } catch (CancellationException e) {
            throw new IOException("upload of " + target + " was cancelled", e);
        } catch (ExecutionException e) {
            throw new IOException("upload of " + target + " failed", e.getCause());
        }
    }

    private void ensureWritable() throws IOException {
        if (closed) {
            throw new IOException("writer for " + target + " is closed");
        }
        if (upload.isDone()) {
            // surfaces an early upload failure instead of blocking on a pipe nobody drains
            throw new IOException("upload of " + target + " stopped before all data was written");
        }
    }

    private static final class AbortableInput extends PipedInputStream {

        private volatile Throwable abortCause;

        AbortableInput(int pipeSize) {
            super(pipeSize);
        }

        void abort(Throwable cause) {
            Throwable recorded = cause == null ? new IOException("aborted") : cause;
            abortCause = recorded;
            try {
                close();
            } catch (IOException e) {
                recorded.addSuppressed(e);
            }
        }

        @Override
        public synchronized int read() throws IOException {
            checkAborted();
            return super.read();
        }

        @Override
        public synchronized int read(byte[] b, int off, int len) throws IOException {
            checkAborted();
            return super.read(b, off, len);
        }

        private void checkAborted() throws IOException {
            Throwable cause = abortCause;
            if (cause != null) {
                throw new IOException("upload aborted", cause);
            }
        }
    }
}
