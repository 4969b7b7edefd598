package org.neuralchilli.cellflow.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Counting gate around a scarce shared resource (typically the one
 * accelerator of a node).
 * <p>
 * One instance lives for one flow invocation and is handed by reference to
 * every task that needs the resource. Callers should use {@link #enter()} in a
 * try-with-resources block or {@link #callWithPermit(Callable)} so the permit
 * is returned on every exit path.
 */
public final class ResourceGate {

    private static final Logger log = LoggerFactory.getLogger(ResourceGate.class);

    private final String name;
    private final int capacity;
    private final Semaphore semaphore;

    public ResourceGate(String name, int capacity) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Gate name cannot be null or empty");
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("Gate capacity must be >= 1, got: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.semaphore = new Semaphore(capacity);
    }

    /**
     * Gate admitting one holder at a time.
     */
    public static ResourceGate exclusive(String name) {
        return new ResourceGate(name, 1);
    }

    /**
     * Block until a permit is available.
     * Prefer {@link #enter()}; a bare acquire must be paired with
     * {@link #release()} in a finally block.
     */
    public void acquire() throws InterruptedException {
        log.trace("[{}] Waiting for permit ({} available)", name, semaphore.availablePermits());
        semaphore.acquire();
        log.trace("[{}] Permit acquired", name);
    }

    public void release() {
        semaphore.release();
        log.trace("[{}] Permit released", name);
    }

    /**
     * Acquire a permit scoped to a try-with-resources block.
     */
    public Permit enter() throws InterruptedException {
        acquire();
        return new Permit(this);
    }

    /**
     * Run {@code work} while holding a permit. The permit is released whether
     * the work returns or throws.
     */
    public <T> T callWithPermit(Callable<T> work) throws Exception {
        try (Permit ignored = enter()) {
            return work.call();
        }
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }

    @Nonnull
    @Override
    public String toString() {
        return "ResourceGate[" + name + ", " + availablePermits() + "/" + capacity + " free]";
    }

    /**
     * A held permit. Closing it more than once releases only once.
     */
    public static final class Permit implements AutoCloseable {

        private final ResourceGate gate;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit(ResourceGate gate) {
            this.gate = gate;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                gate.release();
            }
        }
    }
}
