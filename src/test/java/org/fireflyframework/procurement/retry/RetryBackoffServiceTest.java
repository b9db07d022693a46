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

package org.fireflyframework.procurement.retry;

import org.fireflyframework.procurement.dlq.DeadLetterEntry;
import org.fireflyframework.procurement.dlq.DeadLetterService;
import org.fireflyframework.procurement.model.RetryAttempt;
import org.fireflyframework.procurement.model.WorkItem;
import org.fireflyframework.procurement.model.WorkItemStatus;
import org.fireflyframework.procurement.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RetryBackoffService}.
 */
@ExtendWith(MockitoExtension.class)
class RetryBackoffServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");

    @Mock
    private DeadLetterService deadLetterService;

    private MutableClock clock;
    private RetryBackoffService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        service = new RetryBackoffService(
                RetryPolicyRegistry.withDefaults(RetryPolicy.DEFAULT),
                deadLetterService,
                List.of("VENDOR_BLACKLISTED"),
                5,
                clock);
    }

    // ========================================================================
    // Classification
    // ========================================================================

    @Nested
    @DisplayName("shouldRetry")
    class ShouldRetryTests {

        @Test
        @DisplayName("should schedule a retry with the policy's delay for a retryable error")
        void shouldRetry_shouldScheduleRetry() {
            RetryDecision decision = service.shouldRetry("item-1", "portal_scan", "NETWORK_ERROR", 0, Map.of());

            assertThat(decision.disposition()).isEqualTo(FailureDisposition.RETRY);
            assertThat(decision.attempt()).isEqualTo(1);
            assertThat(decision.delay()).isEqualTo(Duration.ofSeconds(2));
            assertThat(decision.nextRetryAt()).isEqualTo(NOW.plusSeconds(2));
            assertThat(service.getRetryHistory("item-1")).hasSize(1);
        }

        @Test
        @DisplayName("should grow the delay with each attempt")
        void shouldRetry_shouldBackOffMonotonically() {
            RetryDecision first = service.shouldRetry("item-1", "portal_scan", "TIMEOUT", 0, Map.of());
            RetryDecision second = service.shouldRetry("item-1", "portal_scan", "TIMEOUT", 1, Map.of());
            RetryDecision third = service.shouldRetry("item-1", "portal_scan", "TIMEOUT", 2, Map.of());

            assertThat(second.delay()).isGreaterThan(first.delay());
            assertThat(third.delay()).isGreaterThan(second.delay());
            assertThat(service.getRetryHistory("item-1")).extracting(RetryAttempt::attempt).containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("should never retry a globally permanent error")
        void shouldRetry_shouldClassifyGlobalPermanentErrors() {
            RetryDecision decision = service.shouldRetry("item-1", "text_extraction", "MALFORMED_DATA", 0, Map.of());

            assertThat(decision.disposition()).isEqualTo(FailureDisposition.PERMANENT);
            assertThat(decision.shouldRetry()).isFalse();
            assertThat(decision.moveToDeadLetter()).isFalse();
            assertThat(service.getRetryHistory("item-1")).isEmpty();
        }

        @Test
        @DisplayName("should drop the history of an item that failed permanently")
        void shouldRetry_shouldForgetHistoryOnPermanentFailure() {
            service.shouldRetry("item-1", "portal_scan", "TIMEOUT", 0, Map.of());
            assertThat(service.getRetryHistory("item-1")).hasSize(1);

            service.shouldRetry("item-1", "portal_scan", "MALFORMED_DATA", 1, Map.of());

            assertThat(service.getRetryHistory("item-1")).isEmpty();
        }

        @Test
        @DisplayName("should honour configured and policy-level permanent errors")
        void shouldRetry_shouldClassifyAdditionalPermanentErrors() {
            assertThat(service.shouldRetry("i", "portal_scan", "VENDOR_BLACKLISTED", 0, Map.of()).disposition())
                    .isEqualTo(FailureDisposition.PERMANENT);
            assertThat(service.shouldRetry("i", "portal_scan", "PORTAL_NOT_FOUND", 0, Map.of()).disposition())
                    .isEqualTo(FailureDisposition.PERMANENT);
        }

        @Test
        @DisplayName("should dead-letter once the retry budget is used up")
        void shouldRetry_shouldDeadLetterAtCeiling() {
            RetryDecision decision = service.shouldRetry("item-1", "portal_scan", "NETWORK_ERROR", 5, Map.of());

            assertThat(decision.disposition()).isEqualTo(FailureDisposition.DEAD_LETTER);
            assertThat(decision.attempt()).isEqualTo(6);
        }

        @Test
        @DisplayName("should dead-letter errors outside the retryable list")
        void shouldRetry_shouldDeadLetterUnrecognizedErrors() {
            RetryDecision decision = service.shouldRetry("item-1", "portal_scan", "SOMETHING_ODD", 0, Map.of());

            assertThat(decision.disposition()).isEqualTo(FailureDisposition.DEAD_LETTER);
            assertThat(decision.reason()).contains("not retryable");
        }

        @Test
        @DisplayName("should forget history on clear")
        void clearRetryHistory_shouldRemoveHistory() {
            service.shouldRetry("item-1", "portal_scan", "TIMEOUT", 0, Map.of());

            service.clearRetryHistory("item-1");

            assertThat(service.getRetryHistory("item-1")).isEmpty();
        }
    }

    // ========================================================================
    // Dead-lettering
    // ========================================================================

    @Nested
    @DisplayName("moveToDeadLetterQueue")
    class MoveToDeadLetterQueueTests {

        @Test
        @DisplayName("should quarantine a snapshot carrying the retry history")
        void moveToDeadLetterQueue_shouldQuarantineSnapshot() {
            when(deadLetterService.quarantine(any())).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
            service.shouldRetry("item-1", "portal_scan", "TIMEOUT", 0, Map.of());
            WorkItem item = WorkItem.builder()
                    .id("item-1")
                    .workflowId("wf-1")
                    .phase("discovery")
                    .sequenceId("scan")
                    .taskType("portal_scan")
                    .status(WorkItemStatus.DLQ)
                    .lastErrorMessage("portal down")
                    .createdAt(NOW)
                    .updatedAt(NOW)
                    .build();

            StepVerifier.create(service.moveToDeadLetterQueue("item-1", item, "TIMEOUT", 6, true,
                            Map.of("phase", "discovery")))
                    .assertNext(entry -> {
                        assertThat(entry.workItemId()).isEqualTo("item-1");
                        assertThat(entry.workflowId()).isEqualTo("wf-1");
                        assertThat(entry.failureReason()).isEqualTo("TIMEOUT");
                        assertThat(entry.failureMessage()).isEqualTo("portal down");
                        assertThat(entry.failureCount()).isEqualTo(6);
                        assertThat(entry.retryHistory()).hasSize(1);
                        assertThat(entry.maxReprocessAttempts()).isEqualTo(5);
                        assertThat(entry.metadata()).containsKeys("phase", "movedToDLQAt");
                    })
                    .verifyComplete();

            ArgumentCaptor<DeadLetterEntry> captor = ArgumentCaptor.forClass(DeadLetterEntry.class);
            verify(deadLetterService).quarantine(captor.capture());
            assertThat(captor.getValue().workItem()).isSameAs(item);
            assertThat(service.getRetryHistory("item-1")).isEmpty();
        }

        @Test
        @DisplayName("should give unrecoverable entries no reprocess budget")
        void moveToDeadLetterQueue_shouldNotAllowReprocessingUnrecoverable() {
            when(deadLetterService.quarantine(any())).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
            WorkItem item = WorkItem.builder()
                    .id("item-2").workflowId("wf-1").sequenceId("s").taskType("portal_scan")
                    .status(WorkItemStatus.DLQ).createdAt(NOW).updatedAt(NOW)
                    .build();

            StepVerifier.create(service.moveToDeadLetterQueue("item-2", item, "ODD", 1, false, Map.of()))
                    .assertNext(entry -> {
                        assertThat(entry.recoverable()).isFalse();
                        assertThat(entry.canReprocess()).isFalse();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should not touch the store until subscribed")
        void moveToDeadLetterQueue_shouldBeLazy() {
            WorkItem item = WorkItem.builder()
                    .id("item-3").workflowId("wf-1").sequenceId("s").taskType("portal_scan")
                    .status(WorkItemStatus.DLQ).createdAt(NOW).updatedAt(NOW)
                    .build();

            service.moveToDeadLetterQueue("item-3", item, "ODD", 1, false, Map.of());

            verifyNoInteractions(deadLetterService);
        }
    }

    // ========================================================================
    // Policies
    // ========================================================================

    @Test
    @DisplayName("should apply an updated policy to later decisions")
    void updateRetryPolicy_shouldReplacePolicy() {
        service.updateRetryPolicy(new RetryPolicy("portal_scan", 1, Duration.ofSeconds(10),
                Duration.ofSeconds(10), 1.0, List.of("NETWORK_ERROR"), List.of()));

        RetryDecision first = service.shouldRetry("item-9", "portal_scan", "NETWORK_ERROR", 0, Map.of());
        RetryDecision second = service.shouldRetry("item-9", "portal_scan", "NETWORK_ERROR", 1, Map.of());

        assertThat(first.delay()).isEqualTo(Duration.ofSeconds(10));
        assertThat(second.moveToDeadLetter()).isTrue();
        assertThat(service.getAllRetryPolicies())
                .filteredOn(policy -> policy.taskType().equals("portal_scan"))
                .singleElement()
                .satisfies(policy -> assertThat(policy.maxRetries()).isEqualTo(1));
    }
}
