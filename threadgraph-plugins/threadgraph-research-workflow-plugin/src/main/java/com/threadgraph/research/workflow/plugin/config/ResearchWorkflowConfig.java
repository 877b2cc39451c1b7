package com.threadgraph.research.workflow.plugin.config;

import com.threadgraph.core.engine.config.ThreadGraphConfigResolver;
import com.threadgraph.core.exception.ThreadGraphConfigurationException;
import com.threadgraph.integration.contract.IThreadGraphRetryPolicy;
import com.threadgraph.integration.models.commons.ThreadGraphRetryPolicy;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Settings of the research workflow and of its reasoning backend.
 *
 * <table>
 *   <tr><td>gemini.api.key</td><td>GEMINI_API_KEY</td><td>required</td></tr>
 *   <tr><td>threadgraph.reasoning.base-url</td><td>URL</td><td>https://generativelanguage.googleapis.com</td></tr>
 *   <tr><td>threadgraph.reasoning.model.fast</td><td>model name</td><td>gemini-2.0-flash</td></tr>
 *   <tr><td>threadgraph.reasoning.model.grounded</td><td>model name</td><td>gemini-2.5-flash</td></tr>
 *   <tr><td>threadgraph.reasoning.timeout</td><td>ISO-8601</td><td>PT60S</td></tr>
 *   <tr><td>threadgraph.reasoning.retry.max-attempts</td><td>int</td><td>2</td></tr>
 * </table>
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "apiKey")
public class ResearchWorkflowConfig {

    public static final String API_KEY_PROPERTY = "gemini.api.key";
    public static final String BASE_URL_PROPERTY = "threadgraph.reasoning.base-url";
    public static final String FAST_MODEL_PROPERTY = "threadgraph.reasoning.model.fast";
    public static final String GROUNDED_MODEL_PROPERTY = "threadgraph.reasoning.model.grounded";
    public static final String TIMEOUT_PROPERTY = "threadgraph.reasoning.timeout";
    public static final String RETRY_ATTEMPTS_PROPERTY = "threadgraph.reasoning.retry.max-attempts";

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com";

    private final String apiKey;
    @Builder.Default
    private final String baseUrl = DEFAULT_BASE_URL;
    /**
     * Used for the clarity, confidence, validation and synthesis calls.
     */
    @Builder.Default
    private final String fastModel = "gemini-2.0-flash";
    /**
     * Used for the search-grounded research call.
     */
    @Builder.Default
    private final String groundedModel = "gemini-2.5-flash";
    @Builder.Default
    private final double clarityTemperature = 0.0;
    @Builder.Default
    private final double confidenceTemperature = 0.0;
    @Builder.Default
    private final double validationTemperature = 0.1;
    @Builder.Default
    private final double synthesisTemperature = 0.3;
    @Builder.Default
    private final Duration requestTimeout = Duration.ofSeconds(60);
    @Builder.Default
    private final IThreadGraphRetryPolicy retryPolicy = ThreadGraphRetryPolicy.builder().build();

    public static ResearchWorkflowConfig fromEnvironment() {
        return from(new ThreadGraphConfigResolver());
    }

    public static ResearchWorkflowConfig from(ThreadGraphConfigResolver resolver) {
        String apiKey = resolver.resolve(API_KEY_PROPERTY)
                .orElseThrow(() -> new ThreadGraphConfigurationException(API_KEY_PROPERTY,
                        "no API key configured, set " + ThreadGraphConfigResolver.toEnvironmentName(API_KEY_PROPERTY)));
        IThreadGraphRetryPolicy retryPolicy;
        try {
            retryPolicy = defaultRetryPolicy(resolver.getInt(RETRY_ATTEMPTS_PROPERTY, ThreadGraphRetryPolicy.DEFAULT_MAX_ATTEMPTS));
        } catch (IllegalArgumentException e) {
            throw new ThreadGraphConfigurationException(RETRY_ATTEMPTS_PROPERTY, e.getMessage(), e);
        }
        ResearchWorkflowConfig defaults = ResearchWorkflowConfig.builder().build();
        return ResearchWorkflowConfig.builder()
                .apiKey(apiKey)
                .baseUrl(resolver.getString(BASE_URL_PROPERTY, defaults.getBaseUrl()))
                .fastModel(resolver.getString(FAST_MODEL_PROPERTY, defaults.getFastModel()))
                .groundedModel(resolver.getString(GROUNDED_MODEL_PROPERTY, defaults.getGroundedModel()))
                .requestTimeout(resolver.getDuration(TIMEOUT_PROPERTY, defaults.getRequestTimeout()))
                .retryPolicy(retryPolicy)
                .build();
    }

    private static IThreadGraphRetryPolicy defaultRetryPolicy(int maxAttempts) {
        return ThreadGraphRetryPolicy.builder().maxAttempts(maxAttempts).build();
    }
}
