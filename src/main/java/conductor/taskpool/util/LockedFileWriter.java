package conductor.taskpool.util;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Appends lines to a file so that concurrent writers never interleave.
 * Each call opens, appends and closes the file under the writer's lock.
 */
public final class LockedFileWriter {

    private final Path path;
    private final ReentrantLock lock = new ReentrantLock();

    public LockedFileWriter(Path path) {
        this.path = Objects.requireNonNull(path, "path is required");
    }

    public Path path() {
        return path;
    }

    /**
     * Append {@code data} followed by a line separator.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public void write(String data) {
        lock.lock();
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
            out.write(data);
            out.newLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing to file " + path, e);
        } finally {
            lock.unlock();
        }
    }
}
