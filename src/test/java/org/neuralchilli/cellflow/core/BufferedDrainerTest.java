package org.neuralchilli.cellflow.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BufferedDrainerTest {

    private final BufferedDrainer drainer = new BufferedDrainer();

    @Test
    void shouldNotDrainBelowThreshold() throws Exception {
        // Given: Two handles, threshold three
        List<String> results = new ArrayList<>();
        List<CompletableFuture<String>> buffer = new ArrayList<>(List.of(
                CompletableFuture.completedFuture("a"),
                CompletableFuture.completedFuture("b")
        ));

        // When
        boolean drained = drainer.drain(results, buffer, 3, Function.identity());

        // Then
        assertThat(drained).isFalse();
        assertThat(results).isEmpty();
        assertThat(buffer).hasSize(2);
    }

    @Test
    void shouldDrainInSubmissionOrderAtThreshold() throws Exception {
        // Given: Handles completing out of order
        CompletableFuture<Integer> slow = new CompletableFuture<>();
        CompletableFuture<Integer> fast = CompletableFuture.completedFuture(2);
        List<CompletableFuture<Integer>> buffer = new ArrayList<>(List.of(slow, fast));
        List<String> results = new ArrayList<>();

        CompletableFuture.runAsync(() -> slow.complete(1));

        // When
        boolean drained = drainer.drain(results, buffer, 2, value -> "ch" + value);

        // Then
        assertThat(drained).isTrue();
        assertThat(results).containsExactly("ch1", "ch2");
        assertThat(buffer).isEmpty();
    }

    @Test
    void shouldFlushRemainderWithZeroThreshold() throws Exception {
        // Given: Threshold six over eight submissions
        List<Integer> results = new ArrayList<>();
        List<CompletableFuture<Integer>> buffer = new ArrayList<>();
        int drains = 0;

        for (int i = 0; i < 8; i++) {
            buffer.add(CompletableFuture.completedFuture(i));
            if (drainer.drain(results, buffer, 6, Function.identity())) {
                drains++;
            }
        }

        // When: Final flush
        drainer.drain(results, buffer, 0, Function.identity());

        // Then
        assertThat(drains).isEqualTo(1);
        assertThat(results).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
        assertThat(buffer).isEmpty();
    }

    @Test
    void shouldKeepUncollectedHandlesWhenTaskFails() {
        // Given: Second of three handles failed
        List<String> results = new ArrayList<>();
        CompletableFuture<String> failed = new CompletableFuture<>();
        failed.completeExceptionally(new StageExecutionException("detect[c1]:img02", "model crashed"));
        CompletableFuture<String> third = CompletableFuture.completedFuture("c");
        List<CompletableFuture<String>> buffer = new ArrayList<>(List.of(
                CompletableFuture.completedFuture("a"), failed, third));

        // When/Then: Original failure surfaces
        assertThatThrownBy(() -> drainer.drain(results, buffer, 3, Function.identity()))
                .isInstanceOf(StageExecutionException.class)
                .hasMessage("model crashed");

        // And: Collected prefix is moved out, the rest stays
        assertThat(results).containsExactly("a");
        assertThat(buffer).containsExactly(failed, third);
    }

    @Test
    void shouldWrapInsertionFailure() {
        // Given
        List<String> results = new ArrayList<>();
        List<CompletableFuture<String>> buffer = new ArrayList<>(List.of(
                CompletableFuture.completedFuture("a")));

        // Then
        assertThatThrownBy(() -> drainer.drain(results, buffer, 1, value -> {
            throw new IllegalStateException("bad row");
        }))
                .isInstanceOf(StageExecutionException.class)
                .hasMessageContaining("insertion failed")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRejectNegativeThreshold() {
        assertThatThrownBy(() -> drainer.drain(new ArrayList<String>(),
                new ArrayList<CompletableFuture<String>>(), -1, Function.identity()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
