package com.threadgraph.core.engine.checkpoint.impl;

import com.threadgraph.core.engine.checkpoint.IThreadGraphCheckpointStore;
import com.threadgraph.core.exception.ThreadGraphCheckpointStoreException;
import com.threadgraph.core.exception.ThreadGraphRuntimeException;
import com.threadgraph.integration.enumerations.ThreadGraphExecutionState;
import com.threadgraph.integration.models.state.ThreadState;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Checkpoints serialized one file per thread under a base directory, fronted by an in-memory cache.
 *
 * <pre>
 * {baseDir}/
 *   threads/
 *     {base64url(threadId)}.checkpoint
 *     {sha256(threadId)}.h.checkpoint      (ids whose encoding would exceed the file name limit)
 * </pre>
 *
 * A save writes a temporary file next to the target and moves it into place, so a crash never leaves
 * a half-written checkpoint behind.
 */
@Slf4j
public class FileBasedCheckpointStore implements IThreadGraphCheckpointStore {

    private static final String THREADS_DIR = "threads";
    private static final String CHECKPOINT_EXTENSION = ".checkpoint";
    private static final String TEMP_EXTENSION = ".tmp";
    private static final String HASHED_SUFFIX = ".h";
    // leaves room for the extensions within the usual 255-byte file name limit
    static final int MAX_ENCODED_NAME_LENGTH = 200;

    private final Path baseDir;
    private final Path threadsDir;
    private final Map<String, ThreadState> cache = new ConcurrentHashMap<>();

    private volatile boolean initialized = false;

    public FileBasedCheckpointStore(Path baseDir) {
        this.baseDir = baseDir;
        this.threadsDir = baseDir.resolve(THREADS_DIR);
    }

    @Override
    public Mono<Void> initialize() {
        return Mono.fromCallable(() -> {
            log.info("Initializing file-based checkpoint store at: {}", baseDir);
            Files.createDirectories(threadsDir);
            loadExistingCheckpoints();
            initialized = true;
            log.info("File-based checkpoint store initialized. Loaded {} threads.", cache.size());
            return null;
        }).subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof ThreadGraphRuntimeException),
                        e -> new ThreadGraphCheckpointStoreException("initialize", null, e))
                .then();
    }

    /**
     * Unreadable files are skipped so that the other threads stay available; loading such a thread
     * explicitly still fails.
     */
    private void loadExistingCheckpoints() throws IOException {
        try (Stream<Path> files = Files.list(threadsDir)) {
            files.filter(path -> path.toString().endsWith(CHECKPOINT_EXTENSION))
                    .forEach(file -> {
                        try {
                            ThreadState state = readCheckpoint(file);
                            cache.put(state.getThreadId(), state);
                        } catch (IOException | ClassNotFoundException | ClassCastException e) {
                            log.warn("Could not load checkpoint file {}, skipping it: {}", file.getFileName(), e.toString());
                        }
                    });
        }
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            log.info("Shutting down file-based checkpoint store");
            cache.clear();
            initialized = false;
        });
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.fromCallable(() -> initialized && Files.isWritable(threadsDir));
    }

    @Override
    public Mono<ThreadState> load(String threadId) {
        return Mono.fromCallable(() -> {
            ensureInitialized();
            ThreadState cached = cache.get(threadId);
            if (cached != null) {
                return cached;
            }
            Path file = checkpointPath(threadId);
            if (!Files.exists(file)) {
                return null;
            }
            ThreadState state = readCheckpoint(file);
            cache.put(threadId, state);
            return state;
        }).subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof ThreadGraphRuntimeException),
                        e -> new ThreadGraphCheckpointStoreException("load", threadId, e));
    }

    @Override
    public Mono<ThreadState> save(ThreadState state) {
        return Mono.fromCallable(() -> {
            ensureInitialized();
            cache.compute(state.getThreadId(), (threadId, stored) -> {
                IThreadGraphCheckpointStore.assertNextVersion(stored, state);
                writeCheckpoint(state);
                return state;
            });
            log.debug("Saved checkpoint: threadId={}, version={}, state={}",
                    state.getThreadId(), state.getVersion(), state.getExecutionState());
            return state;
        }).subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof ThreadGraphRuntimeException),
                        e -> new ThreadGraphCheckpointStoreException("save", state.getThreadId(), e));
    }

    @Override
    public Mono<Boolean> delete(String threadId) {
        return Mono.fromCallable(() -> {
            ensureInitialized();
            cache.remove(threadId);
            boolean deleted = Files.deleteIfExists(checkpointPath(threadId));
            if (deleted) {
                log.debug("Deleted checkpoint: {}", threadId);
            }
            return deleted;
        }).subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof ThreadGraphRuntimeException),
                        e -> new ThreadGraphCheckpointStoreException("delete", threadId, e));
    }

    @Override
    public Mono<Boolean> exists(String threadId) {
        return Mono.fromCallable(() -> {
            ensureInitialized();
            return cache.containsKey(threadId) || Files.exists(checkpointPath(threadId));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<ThreadState> findByExecutionState(ThreadGraphExecutionState executionState) {
        return Flux.defer(() -> {
            ensureInitialized();
            return Flux.fromIterable(cache.values());
        }).filter(state -> state.getExecutionState() == executionState);
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Checkpoint store not initialized. Call initialize() first.");
        }
    }

    Path checkpointPath(String threadId) {
        byte[] idBytes = threadId.getBytes(StandardCharsets.UTF_8);
        String encoded = Base64.getUrlEncoder().withoutPadding().encodeToString(idBytes);
        if (encoded.length() <= MAX_ENCODED_NAME_LENGTH) {
            return threadsDir.resolve(encoded + CHECKPOINT_EXTENSION);
        }
        // base64url never contains '.', so hashed names cannot collide with encoded ones
        return threadsDir.resolve(sha256Hex(idBytes) + HASHED_SUFFIX + CHECKPOINT_EXTENSION);
    }

    private static String sha256Hex(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private void writeCheckpoint(ThreadState state) {
        Path target = checkpointPath(state.getThreadId());
        Path temp = target.resolveSibling(target.getFileName() + TEMP_EXTENSION);
        try {
            try (ObjectOutputStream oos = new ObjectOutputStream(new BufferedOutputStream(Files.newOutputStream(temp)))) {
                oos.writeObject(state);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, falling back to replace", threadsDir);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private ThreadState readCheckpoint(Path file) throws IOException, ClassNotFoundException {
        try (ObjectInputStream ois = new ObjectInputStream(new BufferedInputStream(Files.newInputStream(file)))) {
            return (ThreadState) ois.readObject();
        }
    }
}
