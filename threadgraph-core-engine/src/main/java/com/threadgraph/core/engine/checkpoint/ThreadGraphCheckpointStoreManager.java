package com.threadgraph.core.engine.checkpoint;

import com.threadgraph.core.engine.checkpoint.impl.FileBasedCheckpointStore;
import com.threadgraph.core.engine.checkpoint.impl.InMemoryCheckpointStore;
import com.threadgraph.core.engine.config.ThreadGraphEngineConfig;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Creates the checkpoint store selected by {@link ThreadGraphEngineConfig} and owns its lifecycle.
 */
@Slf4j
public class ThreadGraphCheckpointStoreManager {

    private final ThreadGraphEngineConfig config;
    private volatile IThreadGraphCheckpointStore activeStore;

    public ThreadGraphCheckpointStoreManager(ThreadGraphEngineConfig config) {
        this.config = config;
    }

    public Mono<IThreadGraphCheckpointStore> initialize() {
        return Mono.defer(() -> {
            if (activeStore != null) {
                return Mono.just(activeStore);
            }
            IThreadGraphCheckpointStore store = createStore(config.getCheckpointStoreType());
            log.info("Initializing checkpoint store with type: {}", config.getCheckpointStoreType());
            return store.initialize()
                    .then(Mono.fromCallable(() -> {
                        activeStore = store;
                        return store;
                    }))
                    .doOnError(e -> log.error("Failed to initialize checkpoint store", e));
        });
    }

    private IThreadGraphCheckpointStore createStore(ThreadGraphEngineConfig.CheckpointStoreType type) {
        return switch (type) {
            case MEMORY -> new InMemoryCheckpointStore();
            case FILE -> new FileBasedCheckpointStore(config.getCheckpointStorePath());
        };
    }

    public Mono<Void> shutdown() {
        return Mono.defer(() -> {
            IThreadGraphCheckpointStore store = activeStore;
            if (store == null) {
                return Mono.empty();
            }
            log.info("Shutting down checkpoint store");
            return store.shutdown().doFinally(signal -> activeStore = null);
        });
    }

    public Mono<Boolean> healthCheck() {
        IThreadGraphCheckpointStore store = activeStore;
        return store == null ? Mono.just(false) : store.healthCheck();
    }
}
