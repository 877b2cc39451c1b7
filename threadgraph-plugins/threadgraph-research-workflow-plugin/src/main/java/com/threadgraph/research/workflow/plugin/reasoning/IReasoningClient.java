package com.threadgraph.research.workflow.plugin.reasoning;

import reactor.core.publisher.Mono;

/**
 * Text generation backend used by the research stages.
 *
 * <p>Emits the generated text, possibly empty. Transport problems surface as
 * {@link com.threadgraph.research.workflow.plugin.exception.ReasoningTransportException}.
 */
public interface IReasoningClient {
    Mono<String> generate(ReasoningRequest request);
}
