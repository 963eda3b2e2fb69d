package com.payerdesk.chatbot.service.pipeline;

/**
 * Work done while the pipeline sits in one stage. The returned event drives the next transition.
 */
public interface StageHandler {

    PipelineStage stage();

    PipelineEvent handle(PipelineContext context);
}
