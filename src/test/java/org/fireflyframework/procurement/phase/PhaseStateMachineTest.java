/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.procurement.phase;

import org.fireflyframework.procurement.event.OrchestrationEventType;
import org.fireflyframework.procurement.exception.NoTransitionDefinitionException;
import org.fireflyframework.procurement.exception.UnknownPhaseException;
import org.fireflyframework.procurement.exception.WorkflowNotFoundException;
import org.fireflyframework.procurement.model.PhaseTransitionRecord;
import org.fireflyframework.procurement.model.TransitionKind;
import org.fireflyframework.procurement.model.WorkflowPhaseState;
import org.fireflyframework.procurement.model.WorkflowStatus;
import org.fireflyframework.procurement.support.OrchestrationFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PhaseStateMachine}.
 */
class PhaseStateMachineTest {

    private static final String TEST_PROCESS = "classpath:procurement/test-process.json";

    private OrchestrationFixture fixture;
    private PhaseStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        fixture = new OrchestrationFixture(TEST_PROCESS);
        stateMachine = fixture.stateMachine;
    }

    private void useDefaultProcess() {
        fixture = new OrchestrationFixture();
        stateMachine = fixture.stateMachine;
    }

    // ========================================================================
    // Creation
    // ========================================================================

    @Nested
    @DisplayName("create")
    class CreateTests {

        @Test
        @DisplayName("should start pending in the initial phase with a creation record")
        void create_shouldStartInInitialPhase() {
            WorkflowPhaseState state = stateMachine.create("wf-1", Map.of("agency", "GSA"));

            assertThat(state.currentPhase()).isEqualTo("intake");
            assertThat(state.status()).isEqualTo(WorkflowStatus.PENDING);
            assertThat(state.canTransitionTo()).containsExactly("review", "cancelled");
            assertThat(state.phaseHistory()).hasSize(1);
            assertThat(state.metadata()).containsEntry("agency", "GSA").containsKey("createdAt");
            assertThat(fixture.eventTypes()).containsExactly(OrchestrationEventType.WORKFLOW_CREATED);
        }

        @Test
        @DisplayName("should reject duplicate ids and unknown phases")
        void create_shouldRejectDuplicatesAndUnknownPhases() {
            stateMachine.create("wf-1", Map.of());

            assertThatThrownBy(() -> stateMachine.create("wf-1", Map.of()))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> stateMachine.create("wf-2", "negotiation", Map.of()))
                    .isInstanceOf(UnknownPhaseException.class);
        }

        @Test
        @DisplayName("should lift child workflow ids from the context")
        void create_shouldLiftChildWorkflowIds() {
            WorkflowPhaseState state = stateMachine.create("wf-1",
                    Map.of(PhaseStateMachine.CHILD_WORKFLOW_IDS_KEY, List.of("child-1", "child-2")));

            assertThat(state.childWorkflowIds()).containsExactly("child-1", "child-2");
        }

        @Test
        @DisplayName("should report unknown workflows")
        void getState_shouldThrowForUnknownWorkflow() {
            assertThatThrownBy(() -> stateMachine.getState("missing")).isInstanceOf(WorkflowNotFoundException.class);
            assertThat(stateMachine.transition("missing", "review", "tester").outcome())
                    .isEqualTo(TransitionOutcome.WORKFLOW_NOT_FOUND);
        }
    }

    // ========================================================================
    // Guarded transitions
    // ========================================================================

    @Nested
    @DisplayName("transition")
    class TransitionTests {

        @Test
        @DisplayName("should block on unmet conditions, then succeed once they hold")
        void transition_shouldEvaluateEdgeConditions() {
            useDefaultProcess();
            stateMachine.create("W1", Map.of());

            TransitionResult blocked = stateMachine.transition("W1", "analysis", "analyst",
                    TransitionKind.MANUAL, null, Map.of("rfpCount", 0));

            assertThat(blocked.outcome()).isEqualTo(TransitionOutcome.CONDITIONS_NOT_MET);
            assertThat(blocked.unmetConditions()).anySatisfy(reason -> assertThat(reason).contains("rfpCount"));
            WorkflowPhaseState afterBlock = stateMachine.getState("W1");
            assertThat(afterBlock.currentPhase()).isEqualTo("discovery");
            assertThat(afterBlock.blockedReasons()).isNotEmpty();

            TransitionResult advanced = stateMachine.transition("W1", "analysis", "analyst",
                    TransitionKind.MANUAL, null, Map.of("rfpCount", 3));

            assertThat(advanced.isSuccess()).isTrue();
            WorkflowPhaseState state = stateMachine.getState("W1");
            assertThat(state.currentPhase()).isEqualTo("analysis");
            assertThat(state.status()).isEqualTo(WorkflowStatus.IN_PROGRESS);
            assertThat(state.phaseHistory()).hasSize(2);
            assertThat(state.blockedReasons()).isEmpty();
            assertThat(state.canTransitionTo()).containsExactly("proposal_generation", "discovery", "cancelled");
        }

        @Test
        @DisplayName("should check required fields on the discovery edge")
        void transition_shouldCheckRequiredFields() {
            useDefaultProcess();
            stateMachine.create("W1", Map.of());

            TransitionResult result = stateMachine.transition("W1", "analysis", "analyst", TransitionKind.MANUAL, null,
                    Map.of("rfpCount", 2, "requiredFields", List.of("title", "agency")));

            assertThat(result.outcome()).isEqualTo(TransitionOutcome.CONDITIONS_NOT_MET);
            assertThat(result.unmetConditions()).singleElement().asString().contains("deadline");
        }

        @Test
        @DisplayName("should reject targets outside canTransitionTo without touching state")
        void transition_shouldRejectIllegalTarget() {
            WorkflowPhaseState before = stateMachine.create("wf-1", Map.of());

            TransitionResult result = stateMachine.transition("wf-1", "completed", "tester");

            assertThat(result.outcome()).isEqualTo(TransitionOutcome.INVALID_TRANSITION);
            assertThat(stateMachine.getState("wf-1")).isEqualTo(before);
        }

        @Test
        @DisplayName("should throw when an allowed target has no declared edge")
        void transition_shouldThrowForMissingEdge() {
            stateMachine.create("wf-1", Map.of());

            assertThatThrownBy(() -> stateMachine.transition("wf-1", "cancelled", "tester"))
                    .isInstanceOf(NoTransitionDefinitionException.class);
        }

        @Test
        @DisplayName("should record the transition with its duration and publish an event")
        void transition_shouldRecordHistory() {
            stateMachine.create("wf-1", Map.of("documentCount", 2));
            fixture.clock.advance(Duration.ofMinutes(5));

            TransitionResult result = stateMachine.transition("wf-1", "review", "reviewer",
                    TransitionKind.MANUAL, "ready", Map.of());

            PhaseTransitionRecord record = result.record();
            assertThat(record.fromPhase()).isEqualTo("intake");
            assertThat(record.toPhase()).isEqualTo("review");
            assertThat(record.triggeredBy()).isEqualTo("reviewer");
            assertThat(record.reason()).isEqualTo("ready");
            assertThat(record.durationSeconds()).isEqualTo(300);
            assertThat(result.state().phaseEnteredAt()).isEqualTo(fixture.clock.instant());
            assertThat(result.state().metadata()).containsKeys("lastTransitionAt", "reviewStartedAt");
            assertThat(fixture.eventTypes()).contains(OrchestrationEventType.PHASE_TRANSITIONED);
            assertThat(fixture.counter("procurement.transitions", "outcome", "success")).isEqualTo(1.0);
            StepVerifier.create(fixture.store.getPhaseTransitionRecords("wf-1").count())
                    .expectNext(2L)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should let exactly one of two concurrent transitions win")
        void transition_shouldSerializeConcurrentTransitions() throws Exception {
            stateMachine.create("wf-1", Map.of("documentCount", 1));
            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            Callable<TransitionResult> attempt = () -> {
                start.await();
                return stateMachine.transition("wf-1", "review", "racer");
            };

            try {
                List<Future<TransitionResult>> futures = List.of(executor.submit(attempt), executor.submit(attempt));
                start.countDown();
                List<TransitionOutcome> outcomes = new ArrayList<>();
                for (Future<TransitionResult> future : futures) {
                    outcomes.add(future.get(5, TimeUnit.SECONDS).outcome());
                }

                assertThat(outcomes).containsExactlyInAnyOrder(
                        TransitionOutcome.SUCCESS, TransitionOutcome.INVALID_TRANSITION);
                assertThat(stateMachine.getState("wf-1").phaseHistory()).hasSize(2);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    // ========================================================================
    // Hooks and rollback
    // ========================================================================

    @Nested
    @DisplayName("hooks and rollback")
    class HookTests {

        @Test
        @DisplayName("should run exit, entry and edge hooks and merge their metadata")
        void transition_shouldRunHooks() {
            List<String> calls = new ArrayList<>();
            fixture.hookRegistry.register("on_intake_exit", context -> {
                calls.add(context.stage() + ":" + context.phase());
                return Map.of("exitChecked", true);
            });
            fixture.hookRegistry.register("on_review_entry", context -> {
                calls.add(context.stage() + ":" + context.phase());
                return Map.of("reviewersAllocated", 2);
            });
            fixture.hookRegistry.register("on_review_edge", context -> {
                calls.add(context.stage() + ":" + context.phase());
                return Map.of();
            });
            stateMachine.create("wf-1", Map.of("documentCount", 1));

            TransitionResult result = stateMachine.transition("wf-1", "review", "tester");

            assertThat(calls).containsExactly("EXIT:intake", "ENTRY:review", "TRANSITION:review");
            assertThat(result.state().metadata())
                    .containsEntry("exitChecked", true)
                    .containsEntry("reviewersAllocated", 2);
            assertThat(stateMachine.getState("wf-1").metadata()).containsEntry("reviewersAllocated", 2);
        }

        @Test
        @DisplayName("should not let a failing hook abort the transition")
        void transition_shouldIsolateHookFailures() {
            fixture.hookRegistry.register("on_review_entry", context -> {
                throw new IllegalStateException("hook exploded");
            });
            stateMachine.create("wf-1", Map.of("documentCount", 1));

            TransitionResult result = stateMachine.transition("wf-1", "review", "tester");

            assertThat(result.isSuccess()).isTrue();
            assertThat(stateMachine.getState("wf-1").currentPhase()).isEqualTo("review");
        }

        @Test
        @DisplayName("should roll back a failed commit and leave only cancellation reachable")
        void transition_shouldRollBackOnCommitFailure() {
            PhaseTransitionListener failing = new PhaseTransitionListener() {
                @Override
                public void beforeCommit(WorkflowPhaseState current, WorkflowPhaseState next) {
                    throw new IllegalStateException("storage unavailable");
                }
            };
            stateMachine.addListener(failing);
            stateMachine.create("wf-1", Map.of("documentCount", 1));

            TransitionResult result = stateMachine.transition("wf-1", "review", "tester");

            assertThat(result.outcome()).isEqualTo(TransitionOutcome.TRANSITION_FAILED);
            WorkflowPhaseState state = stateMachine.getState("wf-1");
            assertThat(state.currentPhase()).isEqualTo("intake");
            assertThat(state.status()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(state.canTransitionTo()).containsExactly("cancelled");
            assertThat(state.metadata())
                    .containsEntry("lastTransitionError", "storage unavailable")
                    .containsEntry("failedTransitionTo", "review");
            assertThat(state.lastTransition()).get()
                    .extracting(PhaseTransitionRecord::kind)
                    .isEqualTo(TransitionKind.ROLLBACK);
            assertThat(fixture.eventTypes()).contains(OrchestrationEventType.TRANSITION_ROLLED_BACK);

            stateMachine.removeListener(failing);
            TransitionResult cancelled = stateMachine.transition("wf-1", "cancelled", "operator");

            assertThat(cancelled.isSuccess()).isTrue();
            assertThat(stateMachine.getState("wf-1").status()).isEqualTo(WorkflowStatus.CANCELLED);
        }
    }

    // ========================================================================
    // Automatic transitions and failure
    // ========================================================================

    @Nested
    @DisplayName("attemptAutomaticTransition and fail")
    class AutomaticTransitionTests {

        @Test
        @DisplayName("should follow nextPhase, then the sole non-failure successor")
        void attemptAutomaticTransition_shouldResolveTarget() {
            stateMachine.create("wf-1", Map.of());
            stateMachine.activate("wf-1", "tester");

            TransitionResult toReview = stateMachine.attemptAutomaticTransition("wf-1", Map.of("documentCount", 4));
            TransitionResult toCompleted = stateMachine.attemptAutomaticTransition("wf-1", Map.of());

            assertThat(toReview.isSuccess()).isTrue();
            assertThat(toReview.record().kind()).isEqualTo(TransitionKind.AUTOMATIC);
            assertThat(toCompleted.isSuccess()).isTrue();
            WorkflowPhaseState state = stateMachine.getState("wf-1");
            assertThat(state.currentPhase()).isEqualTo("completed");
            assertThat(state.status()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(state.canTransitionTo()).isEmpty();
            assertThat(stateMachine.getActiveWorkflows()).isEmpty();
        }

        @Test
        @DisplayName("should only advance in-progress workflows")
        void attemptAutomaticTransition_shouldRequireInProgress() {
            stateMachine.create("wf-1", Map.of("documentCount", 4));

            TransitionResult result = stateMachine.attemptAutomaticTransition("wf-1", Map.of());

            assertThat(result.outcome()).isEqualTo(TransitionOutcome.INVALID_STATE);
            assertThat(stateMachine.getState("wf-1").currentPhase()).isEqualTo("intake");
        }

        @Test
        @DisplayName("should force the failed phase and refuse to fail twice")
        void fail_shouldEnterFailedPhase() {
            stateMachine.create("wf-1", Map.of());

            TransitionResult result = stateMachine.fail("wf-1", "system", "Critical failure", Map.of("criticalFailure", true));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.record().kind()).isEqualTo(TransitionKind.ESCALATION);
            WorkflowPhaseState state = stateMachine.getState("wf-1");
            assertThat(state.currentPhase()).isEqualTo("failed");
            assertThat(state.status()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(state.metadata())
                    .containsEntry("failureReason", "Critical failure")
                    .containsEntry("criticalFailure", true);
            assertThat(fixture.eventTypes()).contains(OrchestrationEventType.WORKFLOW_FAILED);

            assertThat(stateMachine.fail("wf-1", "system", "again", Map.of()).outcome())
                    .isEqualTo(TransitionOutcome.INVALID_STATE);
        }
    }

    // ========================================================================
    // Pause, resume and cancel
    // ========================================================================

    @Nested
    @DisplayName("pause, resume and cancel")
    class LifecycleTests {

        @Test
        @DisplayName("should suspend and resume without changing the phase")
        void pauseAndResume_shouldKeepPhase() {
            stateMachine.create("wf-1", Map.of("documentCount", 1));
            stateMachine.activate("wf-1", "tester");

            TransitionResult paused = stateMachine.pause("wf-1", "ops", "vendor outage");

            assertThat(paused.state().status()).isEqualTo(WorkflowStatus.SUSPENDED);
            assertThat(paused.state().metadata()).containsEntry("suspensionReason", "vendor outage");
            assertThat(stateMachine.transition("wf-1", "review", "tester").outcome())
                    .isEqualTo(TransitionOutcome.INVALID_STATE);
            assertThat(stateMachine.pause("wf-1", "ops", "again").outcome())
                    .isEqualTo(TransitionOutcome.INVALID_STATE);

            TransitionResult resumed = stateMachine.resume("wf-1", "ops");

            assertThat(resumed.state().status()).isEqualTo(WorkflowStatus.IN_PROGRESS);
            assertThat(resumed.state().currentPhase()).isEqualTo("intake");
            assertThat(resumed.state().metadata()).doesNotContainKey("suspendedAt").containsKey("resumedAt");
            assertThat(fixture.eventTypes())
                    .contains(OrchestrationEventType.WORKFLOW_PAUSED, OrchestrationEventType.WORKFLOW_RESUMED);
        }

        @Test
        @DisplayName("should refuse to pause a pending workflow or resume a running one")
        void pauseAndResume_shouldRequireMatchingStatus() {
            stateMachine.create("wf-1", Map.of());

            assertThat(stateMachine.pause("wf-1", "ops", null).outcome()).isEqualTo(TransitionOutcome.INVALID_STATE);
            assertThat(stateMachine.resume("wf-1", "ops").outcome()).isEqualTo(TransitionOutcome.INVALID_STATE);
        }

        @Test
        @DisplayName("should cancel from any phase, bypassing edges")
        void cancel_shouldBypassEdges() {
            stateMachine.create("wf-1", Map.of());

            TransitionResult result = stateMachine.cancel("wf-1", "ops", "RFP withdrawn", false);

            assertThat(result.isSuccess()).isTrue();
            WorkflowPhaseState state = stateMachine.getState("wf-1");
            assertThat(state.currentPhase()).isEqualTo("cancelled");
            assertThat(state.status()).isEqualTo(WorkflowStatus.CANCELLED);
            assertThat(state.metadata()).containsEntry("cancellationReason", "RFP withdrawn");
            assertThat(stateMachine.cancel("wf-1", "ops", "again", false).outcome())
                    .isEqualTo(TransitionOutcome.INVALID_STATE);
        }

        @Test
        @DisplayName("should cascade cancellation to descendants")
        void cancel_shouldCascadeToChildren() {
            stateMachine.create("parent", Map.of());
            stateMachine.create("child", Map.of());
            stateMachine.create("grandchild", Map.of());
            stateMachine.addChildWorkflow("parent", "child");
            stateMachine.addChildWorkflow("child", "grandchild");

            stateMachine.cancel("parent", "ops", "RFP withdrawn", false);

            assertThat(stateMachine.getState("child").status()).isEqualTo(WorkflowStatus.CANCELLED);
            WorkflowPhaseState grandchild = stateMachine.getState("grandchild");
            assertThat(grandchild.status()).isEqualTo(WorkflowStatus.CANCELLED);
            assertThat(grandchild.lastTransition()).get()
                    .satisfies(record -> assertThat(record.metadata()).containsEntry("cascading", true));
        }

        @Test
        @DisplayName("should visit each workflow once when child links form a cycle")
        void cancel_shouldTerminateOnCyclicLinks() {
            stateMachine.create("a", Map.of(PhaseStateMachine.CHILD_WORKFLOW_IDS_KEY, List.of("b")));
            stateMachine.create("b", Map.of(PhaseStateMachine.CHILD_WORKFLOW_IDS_KEY, List.of("a", "missing")));

            TransitionResult result = stateMachine.cancel("a", "ops", "stop", false);

            assertThat(result.isSuccess()).isTrue();
            assertThat(stateMachine.getState("b").status()).isEqualTo(WorkflowStatus.CANCELLED);
            assertThat(stateMachine.getState("a").phaseHistory()).hasSize(2);
        }

        @Test
        @DisplayName("should refuse links that would make a workflow its own ancestor")
        void addChildWorkflow_shouldRejectCycles() {
            stateMachine.create("parent", Map.of());
            stateMachine.create("child", Map.of());
            stateMachine.addChildWorkflow("parent", "child");

            assertThatThrownBy(() -> stateMachine.addChildWorkflow("child", "parent"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> stateMachine.addChildWorkflow("parent", "parent"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(stateMachine.addChildWorkflow("parent", "child").childWorkflowIds()).containsExactly("child");
        }
    }

    // ========================================================================
    // Blocking and timeouts
    // ========================================================================

    @Nested
    @DisplayName("markBlocked and checkPhaseTimeouts")
    class BlockingTests {

        @Test
        @DisplayName("should collect distinct blocked reasons and failure details")
        void markBlocked_shouldAccumulateFailures() {
            stateMachine.create("wf-1", Map.of());

            stateMachine.markBlocked("wf-1", "Blocking work item 'parse' failed", Map.of("workItemId", "i-1"));
            WorkflowPhaseState state = stateMachine.markBlocked("wf-1", "Blocking work item 'parse' failed",
                    Map.of("workItemId", "i-2"));

            assertThat(state.blockedReasons()).containsExactly("Blocking work item 'parse' failed");
            assertThat(state.isBlocked()).isTrue();
            assertThat((List<?>) state.metadata().get("blockedByFailures")).hasSize(2);
            assertThat(state.currentPhase()).isEqualTo("intake");
        }

        @Test
        @DisplayName("should flag an overdue in-progress phase once")
        void checkPhaseTimeouts_shouldFlagOncePerPhase() {
            stateMachine.create("running", Map.of());
            stateMachine.activate("running", "tester");
            stateMachine.create("pending", Map.of());

            assertThat(stateMachine.checkPhaseTimeouts(fixture.clock.instant().plus(Duration.ofMinutes(29))))
                    .isEmpty();

            fixture.clock.advance(Duration.ofMinutes(31));
            List<String> flagged = stateMachine.checkPhaseTimeouts(fixture.clock.instant());

            assertThat(flagged).containsExactly("running");
            WorkflowPhaseState state = stateMachine.getState("running");
            assertThat(state.metadata()).containsEntry("timedOutPhase", "intake");
            assertThat(state.blockedReasons()).singleElement().asString().contains("30 minutes");
            assertThat(state.currentPhase()).isEqualTo("intake");
            assertThat(fixture.eventTypes()).contains(OrchestrationEventType.PHASE_TIMED_OUT);

            fixture.clock.advance(Duration.ofMinutes(31));
            assertThat(stateMachine.checkPhaseTimeouts(fixture.clock.instant())).isEmpty();
        }
    }
}
