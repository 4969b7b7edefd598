package org.neuralchilli.cellflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Caps the number of outstanding task handles.
 * <p>
 * Callers submit a task, append its handle to the buffer and call
 * {@link #drain}. Once the buffer holds {@code maxBufferLength} handles they
 * are awaited in submission order, mapped through the insertion function and
 * appended to the results; the buffer is then cleared. A final call with
 * {@code maxBufferLength = 0} flushes whatever is left.
 */
@ApplicationScoped
public class BufferedDrainer {

    private static final Logger log = LoggerFactory.getLogger(BufferedDrainer.class);

    /**
     * Drain {@code buffer} into {@code results} if it has reached
     * {@code maxBufferLength}.
     *
     * @return true if the buffer was drained
     * @throws StageExecutionException if a buffered task failed or the
     *                                 insertion function raised; the buffer
     *                                 keeps the handles not yet collected
     * @throws InterruptedException    if interrupted while awaiting a task
     */
    public <T, R> boolean drain(
            List<R> results,
            List<? extends Future<T>> buffer,
            int maxBufferLength,
            Function<? super T, ? extends R> insertFn
    ) throws InterruptedException {
        if (maxBufferLength < 0) {
            throw new IllegalArgumentException("Max buffer length cannot be negative: " + maxBufferLength);
        }
        if (buffer.size() < maxBufferLength) {
            return false;
        }

        log.debug("Draining {} buffered tasks (threshold {})", buffer.size(), maxBufferLength);

        List<R> collected = new ArrayList<>(buffer.size());
        int position = 0;
        try {
            for (Future<T> handle : buffer) {
                T value = await(handle, position);
                collected.add(insert(insertFn, value, position));
                position++;
            }
        } finally {
            // Keep submission order: whatever was collected goes out first
            results.addAll(collected);
            buffer.subList(0, collected.size()).clear();
        }

        return true;
    }

    private <T> T await(Future<T> handle, int position) throws InterruptedException {
        try {
            return handle.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StageExecutionException stageFailure) {
                throw stageFailure;
            }
            throw new StageExecutionException(
                    null, "Buffered task at position " + position + " failed: " + cause.getMessage(), cause);
        }
    }

    private <T, R> R insert(Function<? super T, ? extends R> insertFn, T value, int position) {
        try {
            return insertFn.apply(value);
        } catch (RuntimeException e) {
            throw new StageExecutionException(
                    null, "Result insertion failed for buffered task at position " + position, e);
        }
    }
}
