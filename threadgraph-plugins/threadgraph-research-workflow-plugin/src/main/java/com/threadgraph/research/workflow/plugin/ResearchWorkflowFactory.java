package com.threadgraph.research.workflow.plugin;

import com.threadgraph.core.engine.checkpoint.IThreadGraphCheckpointStore;
import com.threadgraph.core.engine.checkpoint.ThreadGraphCheckpointStoreManager;
import com.threadgraph.core.engine.config.ThreadGraphEngineConfig;
import com.threadgraph.core.engine.error.RetryingStage;
import com.threadgraph.core.engine.graph.ThreadGraphDefinition;
import com.threadgraph.core.engine.lock.IThreadGraphLockService;
import com.threadgraph.core.engine.lock.impl.InMemoryThreadLockService;
import com.threadgraph.core.engine.node.IThreadGraphExecutor;
import com.threadgraph.core.engine.node.impl.DefaultResumeHandler;
import com.threadgraph.core.engine.node.impl.ThreadGraphExecutor;
import com.threadgraph.integration.contract.IThreadGraphStage;
import com.threadgraph.research.workflow.plugin.config.ResearchWorkflowConfig;
import com.threadgraph.research.workflow.plugin.prompt.ResearchPromptSource;
import com.threadgraph.research.workflow.plugin.reasoning.IReasoningClient;
import com.threadgraph.research.workflow.plugin.reasoning.StructuredOutputParser;
import com.threadgraph.research.workflow.plugin.reasoning.impl.GeminiReasoningClient;
import com.threadgraph.research.workflow.plugin.routing.ResearchWorkflowRouters;
import com.threadgraph.research.workflow.plugin.stages.AwaitInputStage;
import com.threadgraph.research.workflow.plugin.stages.ComposeStage;
import com.threadgraph.research.workflow.plugin.stages.GatherStage;
import com.threadgraph.research.workflow.plugin.stages.ResolveStage;
import com.threadgraph.research.workflow.plugin.stages.ValidateStage;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import static com.threadgraph.research.workflow.plugin.ResearchWorkflowStages.AWAIT_INPUT;
import static com.threadgraph.research.workflow.plugin.ResearchWorkflowStages.COMPOSE;
import static com.threadgraph.research.workflow.plugin.ResearchWorkflowStages.GATHER;
import static com.threadgraph.research.workflow.plugin.ResearchWorkflowStages.RESOLVE;
import static com.threadgraph.research.workflow.plugin.ResearchWorkflowStages.VALIDATE;

/**
 * Wires the research workflow: stages, routers, reasoning client, checkpoint store and lock service.
 *
 * <pre>
 * resolve ─→ await-input ─(resume)─→ resolve
 *    └──→ gather ─→ validate ─→ gather (while insufficient and attempts &lt; 3)
 *            │          └──→ compose ─→ END
 *            └──→ compose (confidence &gt;= 6)
 * </pre>
 */
@Slf4j
public final class ResearchWorkflowFactory {

    public static final String GRAPH_NAME = "research-workflow";

    private ResearchWorkflowFactory() {
    }

    public static ThreadGraphDefinition createDefinition(IReasoningClient reasoningClient,
                                                         ResearchPromptSource prompts,
                                                         ResearchWorkflowConfig config) {
        StructuredOutputParser parser = new StructuredOutputParser();
        return ThreadGraphDefinition.builder(GRAPH_NAME)
                .stage(RESOLVE, retrying(RESOLVE, new ResolveStage(reasoningClient, prompts, parser, config), config),
                        ResearchWorkflowRouters.AFTER_RESOLVE, AWAIT_INPUT, GATHER)
                .stage(AWAIT_INPUT, new AwaitInputStage(prompts),
                        ResearchWorkflowRouters.AFTER_AWAIT_INPUT, RESOLVE)
                .stage(GATHER, retrying(GATHER, new GatherStage(reasoningClient, prompts, parser, config), config),
                        ResearchWorkflowRouters.AFTER_GATHER, VALIDATE, COMPOSE)
                .stage(VALIDATE, retrying(VALIDATE, new ValidateStage(reasoningClient, prompts, parser, config), config),
                        ResearchWorkflowRouters.AFTER_VALIDATE, GATHER, COMPOSE)
                .terminalStage(COMPOSE, retrying(COMPOSE, new ComposeStage(reasoningClient, prompts, parser, config), config))
                .entry(RESOLVE)
                .build();
    }

    public static IThreadGraphExecutor createExecutor(IReasoningClient reasoningClient,
                                                      ResearchWorkflowConfig config,
                                                      IThreadGraphCheckpointStore checkpointStore,
                                                      IThreadGraphLockService lockService,
                                                      ThreadGraphEngineConfig engineConfig) {
        return ThreadGraphExecutor.builder()
                .definition(createDefinition(reasoningClient, new ResearchPromptSource(), config))
                .checkpointStore(checkpointStore)
                .lockService(lockService)
                .resumeHandler(new DefaultResumeHandler())
                .config(engineConfig)
                .build();
    }

    /**
     * Builds an executor backed by the Gemini client from system properties and environment variables.
     * Fails with a configuration error when no API key is set. The executor owns its lock service and
     * checkpoint store; call {@link IThreadGraphExecutor#shutdown()} to release them.
     */
    public static Mono<IThreadGraphExecutor> createFromEnvironment() {
        return Mono.defer(() -> {
            ThreadGraphEngineConfig engineConfig = ThreadGraphEngineConfig.fromEnvironment();
            ResearchWorkflowConfig config = ResearchWorkflowConfig.fromEnvironment();
            log.info("Creating research workflow: engine={}, reasoning={}", engineConfig, config);
            return new ThreadGraphCheckpointStoreManager(engineConfig).initialize()
                    .map(store -> createExecutor(new GeminiReasoningClient(config), config, store,
                            new InMemoryThreadLockService(), engineConfig));
        });
    }

    private static IThreadGraphStage retrying(String stageName, IThreadGraphStage stage, ResearchWorkflowConfig config) {
        return new RetryingStage(stageName, stage, config.getRetryPolicy());
    }
}
