package work.lcod.tester.runtime.fs;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;

/**
 * Open text file produced by {@code fs/open}. Lives in the step state as a plain object reference.
 */
public final class FileHandle implements AutoCloseable {
    private final Path path;
    private final Mode mode;
    private final BufferedWriter writer;
    private boolean closed = false;

    private FileHandle(Path path, Mode mode, BufferedWriter writer) {
        this.path = path;
        this.mode = mode;
        this.writer = writer;
    }

    public static FileHandle open(Path path, Mode mode) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        var writer = mode == Mode.APPEND
            ? Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND)
            : Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        return new FileHandle(path, mode, writer);
    }

    public Path path() {
        return path;
    }

    public synchronized boolean isOpen() {
        return !closed;
    }

    public synchronized void write(String text) throws IOException {
        if (closed) {
            throw new IOException("File is closed: " + path);
        }
        writer.write(text);
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        writer.close();
    }

    @Override
    public String toString() {
        return "FileHandle[" + path + ", " + mode.name().toLowerCase(Locale.ROOT) + (closed ? ", closed" : "") + "]";
    }

    public enum Mode {
        WRITE,
        APPEND;

        public static Mode from(Object raw) {
            if (raw == null || raw.toString().isBlank()) {
                return WRITE;
            }
            return switch (raw.toString().trim().toLowerCase(Locale.ROOT)) {
                case "w", "write" -> WRITE;
                case "a", "append" -> APPEND;
                default -> throw new IllegalArgumentException("Unsupported file mode: " + raw);
            };
        }
    }
}
