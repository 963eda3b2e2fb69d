package com.payerdesk.chatbot.service.pipeline;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineFactory;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;

@SpringJUnitConfig(PipelineStateMachineConfig.class)
class PipelineStateMachineConfigTest {

    @Autowired
    private StateMachineFactory<PipelineStage, PipelineEvent> factory;

    @Test
    void advancesThroughEveryStageInOrder() {
        StateMachine<PipelineStage, PipelineEvent> machine = started("full");

        for (PipelineStage expected : new PipelineStage[]{PipelineStage.CLASSIFY, PipelineStage.PLAN,
                PipelineStage.CLARIFY, PipelineStage.RESOLVE, PipelineStage.INTEGRATE, PipelineStage.PUBLISH}) {
            assertThat(send(machine, PipelineEvent.ADVANCE)).isEqualTo(StateMachineEventResult.ResultType.ACCEPTED);
            assertThat(machine.getState().getId()).isEqualTo(expected);
        }
        machine.stopReactively().block();
    }

    @Test
    void clarifyMayExitEarly() {
        StateMachine<PipelineStage, PipelineEvent> machine = started("early");
        send(machine, PipelineEvent.ADVANCE);
        send(machine, PipelineEvent.ADVANCE);
        send(machine, PipelineEvent.ADVANCE);

        assertThat(send(machine, PipelineEvent.EARLY_EXIT)).isEqualTo(StateMachineEventResult.ResultType.ACCEPTED);
        assertThat(machine.getState().getId()).isEqualTo(PipelineStage.PUBLISH);
        machine.stopReactively().block();
    }

    @Test
    void earlyExitIsRejectedOutsideClarify() {
        StateMachine<PipelineStage, PipelineEvent> machine = started("denied");

        assertThat(send(machine, PipelineEvent.EARLY_EXIT)).isEqualTo(StateMachineEventResult.ResultType.DENIED);
        assertThat(machine.getState().getId()).isEqualTo(PipelineStage.STATE_LOAD);
        machine.stopReactively().block();
    }

    @Test
    void anyStageCanFailStraightToPublish() {
        StateMachine<PipelineStage, PipelineEvent> machine = started("fail");
        send(machine, PipelineEvent.ADVANCE);
        send(machine, PipelineEvent.ADVANCE);

        assertThat(send(machine, PipelineEvent.FAIL)).isEqualTo(StateMachineEventResult.ResultType.ACCEPTED);
        assertThat(machine.getState().getId()).isEqualTo(PipelineStage.PUBLISH);
        machine.stopReactively().block();
    }

    private StateMachine<PipelineStage, PipelineEvent> started(String id) {
        StateMachine<PipelineStage, PipelineEvent> machine = factory.getStateMachine(id);
        machine.startReactively().block();
        return machine;
    }

    private static StateMachineEventResult.ResultType send(StateMachine<PipelineStage, PipelineEvent> machine,
                                                           PipelineEvent event) {
        StateMachineEventResult<PipelineStage, PipelineEvent> result = machine
                .sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
                .blockLast();
        return result == null ? null : result.getResultType();
    }
}
