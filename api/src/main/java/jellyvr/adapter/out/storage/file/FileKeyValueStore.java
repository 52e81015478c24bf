package jellyvr.adapter.out.storage.file;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Base64;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import jellyvr.adapter.out.storage.StoreTimeoutHelper;
import jellyvr.core.model.common.StoreUnavailableException;
import jellyvr.core.model.store.StoreKey;
import jellyvr.core.port.out.KeyValueStore;

/**
 * Durable KeyValueStore keeping one file per record.
 *
 * <p>Layout: {@code <root>/<entity>/<base64url(id)>.json}. A write goes to a
 * temporary file in the same directory, is forced to disk and then atomically
 * renamed over the record, so readers and a restarted process only ever see a
 * complete old or new value. Mutations of one key are serialized by a striped
 * lock, which makes {@link #compareAndSwap} atomic within this process. The
 * directory must not be shared between processes.
 *
 * <p>All file I/O runs on the supplied executor.
 */
public class FileKeyValueStore implements KeyValueStore {

    private static final Logger LOG = Logger.getLogger(FileKeyValueStore.class);

    private static final String SUFFIX = ".json";
    private static final String TEMP_PREFIX = ".tmp-";
    private static final int LOCK_STRIPES = 64;

    private final Path root;
    private final Executor executor;
    private final StoreTimeoutHelper timeoutHelper;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    /**
     * Open (creating if needed) a store rooted at {@code root}.
     *
     * @param root data directory
     * @param executor executor for blocking file I/O
     * @param timeoutHelper timeout and failure translation
     * @throws UncheckedIOException if the directory cannot be created
     */
    public FileKeyValueStore(Path root, Executor executor, StoreTimeoutHelper timeoutHelper) {
        this.root = root.toAbsolutePath().normalize();
        this.executor = executor;
        this.timeoutHelper = timeoutHelper;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create store directory " + this.root, e);
        }
    }

    @Override
    public Uni<Optional<String>> get(StoreKey key) {
        return blocking("get", () -> read(pathOf(key)));
    }

    @Override
    public Uni<Void> put(StoreKey key, String value) {
        return blocking("put", () -> locked(key, () -> {
            write(pathOf(key), value);
            return null;
        }));
    }

    @Override
    public Uni<Void> delete(StoreKey key) {
        return blocking("delete", () -> locked(key, () -> {
            Path path = pathOf(key);
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return null;
        }));
    }

    @Override
    public Uni<Boolean> compareAndSwap(StoreKey key, Optional<String> expected, String newValue) {
        return blocking("compareAndSwap", () -> locked(key, () -> {
            Path path = pathOf(key);
            Optional<String> current = read(path);
            if (!current.equals(expected)) {
                return false;
            }
            write(path, newValue);
            return true;
        }));
    }

    /**
     * Remove temporary files left behind by an interrupted write.
     *
     * @return number of files removed
     */
    public int removeStaleTempFiles() {
        int removed = 0;
        try (DirectoryStream<Path> entities = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path entity : entities) {
                try (DirectoryStream<Path> temps = Files.newDirectoryStream(entity, TEMP_PREFIX + "*")) {
                    for (Path temp : temps) {
                        Files.deleteIfExists(temp);
                        removed++;
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot clean store directory " + root, e);
        }
        if (removed > 0) {
            LOG.infof("Removed %d interrupted writes from %s", removed, root);
        }
        return removed;
    }

    public Path getRoot() {
        return root;
    }

    Path pathOf(StoreKey key) {
        String fileName =
                Base64.getUrlEncoder().withoutPadding().encodeToString(key.id().getBytes(StandardCharsets.UTF_8));
        return root.resolve(key.entity()).resolve(fileName + SUFFIX);
    }

    private <T> Uni<T> blocking(String operation, Supplier<T> action) {
        Uni<T> uni = Uni.createFrom().item(() -> {
                    try {
                        return action.get();
                    } catch (UncheckedIOException e) {
                        throw new StoreUnavailableException(
                                operation, "File store " + operation + " failed", e.getCause());
                    }
                })
                .runSubscriptionOn(executor);
        return timeoutHelper.withTimeout(uni, operation);
    }

    private <T> T locked(StoreKey key, Supplier<T> action) {
        ReentrantLock lock = locks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private Optional<String> read(Path path) {
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void write(Path target, String value) {
        Path directory = target.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, TEMP_PREFIX, SUFFIX);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(value.getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            temp = null;
            syncDirectory(directory);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private void syncDirectory(Path directory) {
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            // Not every platform can open a directory for syncing; the rename itself is still atomic.
            LOG.debugf("Directory sync not supported for %s: %s", directory, e.getMessage());
        }
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warnf("Could not remove temporary file %s: %s", temp, e.getMessage());
        }
    }
}
