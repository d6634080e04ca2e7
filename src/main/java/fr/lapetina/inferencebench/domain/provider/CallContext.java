package fr.lapetina.inferencebench.domain.provider;

import fr.lapetina.inferencebench.domain.model.ErrorType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation and deadline scope for a backend call.
 *
 * <p>Contexts form a tree: cancelling a parent cancels every child, and a child's deadline
 * never extends past its parent's. A deadline expiring cancels the context with
 * {@link Cause#DEADLINE_EXCEEDED}. Listeners registered with {@link #onCancel(Runnable)}
 * abort in-flight I/O.
 *
 * <p>Derived contexts should be closed when the call they scope is over, which detaches
 * them from their parent.
 *
 * <pre>{@code
 * try (CallContext call = ctx.withTimeout(Duration.ofSeconds(30))) {
 *     provider.stream(call, request, callbacks);
 * }
 * }</pre>
 */
public final class CallContext implements AutoCloseable {

    /**
     * Why a context ended.
     */
    public enum Cause {
        CANCELLED,
        DEADLINE_EXCEEDED
    }

    private static final ScheduledThreadPoolExecutor DEADLINES = createDeadlineScheduler();

    private final CallContext parent;
    private final Instant deadline;
    private final AtomicReference<Cause> cause = new AtomicReference<>();
    private final CountDownLatch done = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final Registration parentRegistration;
    private final ScheduledFuture<?> deadlineTimer;

    private CallContext(CallContext parent, Instant deadline) {
        this.parent = parent;
        this.deadline = deadline;
        this.parentRegistration = parent != null
                ? parent.onCancel(() -> cancel(parent.cause()))
                : null;
        if (deadline != null && !isDone()) {
            long delayNanos = Duration.between(Instant.now(), deadline).toNanos();
            this.deadlineTimer = DEADLINES.schedule(
                    () -> cancel(Cause.DEADLINE_EXCEEDED), Math.max(0, delayNanos), TimeUnit.NANOSECONDS);
        } else {
            this.deadlineTimer = null;
        }
    }

    /**
     * Creates a root context with no deadline.
     */
    public static CallContext background() {
        return new CallContext(null, null);
    }

    /**
     * Creates a child context that inherits cancellation and has no deadline of its own.
     */
    public CallContext child() {
        return new CallContext(this, deadline);
    }

    /**
     * Creates a child context that expires after {@code timeout}, or at this context's
     * deadline if that comes first. A null or non-positive timeout adds no deadline.
     */
    public CallContext withTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return child();
        }
        Instant candidate = Instant.now().plus(timeout);
        Instant effective = deadline != null && deadline.isBefore(candidate) ? deadline : candidate;
        return new CallContext(this, effective);
    }

    /**
     * Cancels this context and every context derived from it.
     */
    public void cancel() {
        cancel(Cause.CANCELLED);
    }

    private void cancel(Cause reason) {
        if (!cause.compareAndSet(null, reason == null ? Cause.CANCELLED : reason)) {
            return;
        }
        done.countDown();
        if (deadlineTimer != null) {
            deadlineTimer.cancel(false);
        }
        for (Runnable listener : listeners) {
            listener.run();
        }
    }

    public boolean isDone() {
        return cause.get() != null;
    }

    /**
     * Returns why this context ended, or null while it is still live.
     */
    public Cause cause() {
        return cause.get();
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Time left before the deadline, empty when there is none.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Registers a listener run once when this context ends.
     * Runs immediately on the calling thread if the context has already ended.
     */
    public Registration onCancel(Runnable listener) {
        AtomicBoolean ran = new AtomicBoolean();
        Runnable once = () -> {
            if (ran.compareAndSet(false, true)) {
                listener.run();
            }
        };
        listeners.add(once);
        if (isDone()) {
            once.run();
        }
        return () -> listeners.remove(once);
    }

    /**
     * Waits up to {@code timeout} for this context to end.
     *
     * @return true if the context ended during the wait
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return done.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Throws the exception describing why this context ended, if it has.
     */
    public void throwIfDone(String operation) {
        if (isDone()) {
            throw doneException(operation, null);
        }
    }

    /**
     * Builds the exception describing why this context ended.
     */
    public ProviderException doneException(String operation, Throwable cause) {
        if (cause() == Cause.DEADLINE_EXCEEDED) {
            return new ProviderException(ErrorType.TIMEOUT, operation + ": deadline exceeded", cause);
        }
        return new ProviderException(ErrorType.CANCELLED, operation + ": cancelled", cause);
    }

    /**
     * Detaches this context from its parent and releases its deadline timer.
     * The context counts as cancelled afterwards.
     */
    @Override
    public void close() {
        if (parentRegistration != null) {
            parentRegistration.close();
        }
        cancel(Cause.CANCELLED);
    }

    /**
     * Handle for removing a cancellation listener.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private static ScheduledThreadPoolExecutor createDeadlineScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "call-deadlines");
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
