package com.sourcemanager.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reads and writes whole JSON documents.
 * <p>
 * Writes go to a temporary file in the target's directory which is then
 * renamed over the target, so readers see either the old or the new document.
 * Every call runs on a daemon I/O thread and is abandoned after the configured
 * timeout; expiry surfaces as a {@link DocumentIoException}.
 */
public class JsonDocumentFiles {

    private static final Logger log = LoggerFactory.getLogger(JsonDocumentFiles.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
    private static final ExecutorService IO_EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "document-io-" + THREAD_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @FunctionalInterface
    public interface IoCall<T> {
        T call() throws IOException;
    }

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;
    private final Duration timeout;

    public JsonDocumentFiles(ObjectMapper objectMapper, Duration timeout) {
        this.objectMapper = objectMapper;
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
        this.timeout = timeout;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Reads {@code path} as {@code type}. Empty when the file does not exist.
     *
     * @throws DocumentParseException if the file exists but is not valid JSON for {@code type}
     * @throws DocumentIoException    on any other read failure or timeout
     */
    public <T> Optional<T> read(Path path, Class<T> type) throws DocumentIoException {
        return bounded(path, "read", () -> {
            if (!Files.exists(path)) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(path.toFile(), type));
        });
    }

    /** Reads {@code path} as a JSON tree; the file must exist. */
    public JsonNode readTree(Path path) throws DocumentIoException {
        return bounded(path, "read", () -> {
            JsonNode node = objectMapper.readTree(path.toFile());
            if (node == null || node.isMissingNode()) {
                throw new DocumentParseException(path, new IOException("document is empty"));
            }
            return node;
        });
    }

    /** Serializes {@code value} and atomically replaces {@code path} with it. */
    public void write(Path path, Object value) throws DocumentIoException {
        bounded(path, "write", () -> {
            writeAtomically(path, writer.writeValueAsBytes(value));
            return null;
        });
    }

    /** Copies {@code path} next to itself as {@code <name><suffix>}, replacing an older copy. */
    public Path backup(Path path, String suffix) throws DocumentIoException {
        Path target = path.resolveSibling(path.getFileName() + suffix);
        return bounded(path, "backup", () -> Files.copy(path, target, StandardCopyOption.REPLACE_EXISTING));
    }

    /**
     * Runs {@code call} on an I/O thread, waiting at most the configured timeout.
     */
    public <T> T bounded(Path document, String action, IoCall<T> call) throws DocumentIoException {
        Future<T> future = IO_EXECUTOR.submit(call::call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DocumentIoException(document,
                    action + " of " + document + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DocumentIoException(document, action + " of " + document + " interrupted", e);
        } catch (ExecutionException e) {
            throw translate(document, action, e.getCause());
        }
    }

    private static DocumentIoException translate(Path document, String action, Throwable cause) {
        if (cause instanceof DocumentIoException die) {
            return die;
        }
        if (cause instanceof JsonProcessingException jpe) {
            return new DocumentParseException(document, jpe);
        }
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new DocumentIoException(document, action + " of " + document + " failed: " + detail, cause);
    }

    private static void writeAtomically(Path target, byte[] content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, "." + target.getFileName() + ".", ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic rename not supported for {}; replacing non-atomically", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
