package com.threadgraph.core.engine.config;

import com.threadgraph.core.exception.ThreadGraphConfigurationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Engine settings. Built programmatically or read from system properties and environment variables.
 *
 * <table>
 *   <tr><td>threadgraph.checkpoint.store.type</td><td>MEMORY | FILE</td><td>MEMORY</td></tr>
 *   <tr><td>threadgraph.checkpoint.store.path</td><td>directory</td><td>~/.threadgraph/checkpoints</td></tr>
 *   <tr><td>threadgraph.lock.duration</td><td>ISO-8601</td><td>PT10M</td></tr>
 *   <tr><td>threadgraph.lock.wait-timeout</td><td>ISO-8601</td><td>PT0S</td></tr>
 *   <tr><td>threadgraph.max-steps-per-invocation</td><td>int</td><td>50</td></tr>
 * </table>
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ThreadGraphEngineConfig {

    public static final String STORE_TYPE_PROPERTY = "threadgraph.checkpoint.store.type";
    public static final String STORE_PATH_PROPERTY = "threadgraph.checkpoint.store.path";
    public static final String LOCK_DURATION_PROPERTY = "threadgraph.lock.duration";
    public static final String LOCK_WAIT_TIMEOUT_PROPERTY = "threadgraph.lock.wait-timeout";
    public static final String MAX_STEPS_PROPERTY = "threadgraph.max-steps-per-invocation";

    public enum CheckpointStoreType {
        MEMORY,
        FILE
    }

    @Builder.Default
    private final CheckpointStoreType checkpointStoreType = CheckpointStoreType.MEMORY;
    @Builder.Default
    private final Path checkpointStorePath = defaultStorePath();
    @Builder.Default
    private final Duration lockDuration = Duration.ofMinutes(10);
    /**
     * Zero rejects a concurrent call on a busy thread immediately.
     */
    @Builder.Default
    private final Duration lockWaitTimeout = Duration.ZERO;
    @Builder.Default
    private final int maxStepsPerInvocation = 50;

    public static ThreadGraphEngineConfig defaults() {
        return ThreadGraphEngineConfig.builder().build();
    }

    public static ThreadGraphEngineConfig fromEnvironment() {
        return from(new ThreadGraphConfigResolver());
    }

    public static ThreadGraphEngineConfig from(ThreadGraphConfigResolver resolver) {
        ThreadGraphEngineConfig defaults = defaults();
        int maxSteps = resolver.getInt(MAX_STEPS_PROPERTY, defaults.getMaxStepsPerInvocation());
        if (maxSteps < 1) {
            throw new ThreadGraphConfigurationException(MAX_STEPS_PROPERTY, "must be at least 1");
        }
        return ThreadGraphEngineConfig.builder()
                .checkpointStoreType(resolver.getEnum(STORE_TYPE_PROPERTY, CheckpointStoreType.class, defaults.getCheckpointStoreType()))
                .checkpointStorePath(resolver.resolve(STORE_PATH_PROPERTY).map(Paths::get).orElse(defaults.getCheckpointStorePath()))
                .lockDuration(resolver.getDuration(LOCK_DURATION_PROPERTY, defaults.getLockDuration()))
                .lockWaitTimeout(resolver.getDuration(LOCK_WAIT_TIMEOUT_PROPERTY, defaults.getLockWaitTimeout()))
                .maxStepsPerInvocation(maxSteps)
                .build();
    }

    private static Path defaultStorePath() {
        return Paths.get(System.getProperty("user.home"), ".threadgraph", "checkpoints");
    }
}
