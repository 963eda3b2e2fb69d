package com.payerdesk.chatbot.service.pipeline;

import org.springframework.context.annotation.Configuration;
import org.springframework.statemachine.config.EnableStateMachineFactory;
import org.springframework.statemachine.config.EnumStateMachineConfigurerAdapter;
import org.springframework.statemachine.config.builders.StateMachineStateConfigurer;
import org.springframework.statemachine.config.builders.StateMachineTransitionConfigurer;

import java.util.EnumSet;

/**
 * Strict stage order for one request. CLARIFY may exit early; any stage may fail straight to PUBLISH.
 */
@Configuration
@EnableStateMachineFactory
public class PipelineStateMachineConfig extends EnumStateMachineConfigurerAdapter<PipelineStage, PipelineEvent> {

    @Override
    public void configure(StateMachineStateConfigurer<PipelineStage, PipelineEvent> states) throws Exception {
        states.withStates()
                .initial(PipelineStage.STATE_LOAD)
                .states(EnumSet.allOf(PipelineStage.class));
    }

    @Override
    public void configure(StateMachineTransitionConfigurer<PipelineStage, PipelineEvent> transitions) throws Exception {
        transitions
                .withExternal()
                    .source(PipelineStage.STATE_LOAD)
                    .target(PipelineStage.CLASSIFY)
                    .event(PipelineEvent.ADVANCE)
                .and()
                .withExternal()
                    .source(PipelineStage.CLASSIFY)
                    .target(PipelineStage.PLAN)
                    .event(PipelineEvent.ADVANCE)
                .and()
                .withExternal()
                    .source(PipelineStage.PLAN)
                    .target(PipelineStage.CLARIFY)
                    .event(PipelineEvent.ADVANCE)
                .and()
                .withExternal()
                    .source(PipelineStage.CLARIFY)
                    .target(PipelineStage.RESOLVE)
                    .event(PipelineEvent.ADVANCE)
                .and()
                .withExternal()
                    .source(PipelineStage.CLARIFY)
                    .target(PipelineStage.PUBLISH)
                    .event(PipelineEvent.EARLY_EXIT)
                .and()
                .withExternal()
                    .source(PipelineStage.RESOLVE)
                    .target(PipelineStage.INTEGRATE)
                    .event(PipelineEvent.ADVANCE)
                .and()
                .withExternal()
                    .source(PipelineStage.INTEGRATE)
                    .target(PipelineStage.PUBLISH)
                    .event(PipelineEvent.ADVANCE);

        for (PipelineStage stage : EnumSet.range(PipelineStage.STATE_LOAD, PipelineStage.INTEGRATE)) {
            transitions.withExternal()
                    .source(stage)
                    .target(PipelineStage.PUBLISH)
                    .event(PipelineEvent.FAIL);
        }
    }
}
