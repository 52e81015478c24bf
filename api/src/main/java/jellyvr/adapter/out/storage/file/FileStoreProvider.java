package jellyvr.adapter.out.storage.file;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import jellyvr.adapter.out.storage.StoreTimeoutHelper;
import jellyvr.core.config.StoreConfig;
import jellyvr.core.port.out.KeyValueStore;
import jellyvr.spi.KeyValueStoreProvider;
import jellyvr.spi.StorageProviderException;

/**
 * File-based store provider, the default.
 *
 * <p>Keeps all state in {@code jellyvr.store.file.directory}; needs nothing but
 * a writable, persistent directory.
 */
@ApplicationScoped
public class FileStoreProvider implements KeyValueStoreProvider {

    private static final Logger LOG = Logger.getLogger(FileStoreProvider.class);

    private final StoreConfig config;

    private volatile FileKeyValueStore store;

    @Inject
    public FileStoreProvider(StoreConfig config) {
        this.config = config;
    }

    @Override
    public String name() {
        return "file";
    }

    @Override
    public boolean isAvailable() {
        Path directory = directory();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            LOG.warnf("Store directory %s cannot be created: %s", directory, e.getMessage());
            return false;
        }
        return Files.isWritable(directory);
    }

    @Override
    public synchronized KeyValueStore createStore() {
        if (store == null) {
            try {
                store = new FileKeyValueStore(
                        directory(),
                        Infrastructure.getDefaultWorkerPool(),
                        new StoreTimeoutHelper(config.timeout(), name()));
                store.removeStaleTempFiles();
            } catch (UncheckedIOException e) {
                throw new StorageProviderException(name(), "Cannot open file store in " + directory(), e);
            }
            LOG.infof("Created file store in %s", store.getRoot());
        }
        return store;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        Path directory = directory();
        boolean writable = Files.isDirectory(directory) && Files.isWritable(directory);
        return Optional.of(HealthCheckResponse.named("store-file")
                .status(writable)
                .withData("type", "file")
                .withData("directory", directory.toAbsolutePath().toString())
                .build());
    }

    private Path directory() {
        return Path.of(config.file().directory());
    }
}
