package fr.lapetina.inferencebench.domain.provider;

import fr.lapetina.inferencebench.domain.model.ErrorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallContextTest {

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("should propagate cancellation to children")
        void shouldPropagateToChildren() {
            CallContext root = CallContext.background();
            CallContext child = root.child();
            CallContext grandChild = child.withTimeout(Duration.ofMinutes(1));

            root.cancel();

            assertThat(child.isDone()).isTrue();
            assertThat(grandChild.isDone()).isTrue();
            assertThat(grandChild.cause()).isEqualTo(CallContext.Cause.CANCELLED);
        }

        @Test
        @DisplayName("should not propagate cancellation to the parent")
        void shouldNotPropagateUpwards() {
            CallContext root = CallContext.background();
            CallContext child = root.child();

            child.cancel();

            assertThat(child.isDone()).isTrue();
            assertThat(root.isDone()).isFalse();
        }

        @Test
        @DisplayName("should run each listener exactly once")
        void shouldRunListenersOnce() {
            CallContext ctx = CallContext.background();
            AtomicInteger calls = new AtomicInteger();
            ctx.onCancel(calls::incrementAndGet);

            ctx.cancel();
            ctx.cancel();

            assertThat(calls).hasValue(1);
        }

        @Test
        @DisplayName("should run a listener immediately on an ended context")
        void shouldRunListenerImmediatelyWhenDone() {
            CallContext ctx = CallContext.background();
            ctx.cancel();
            AtomicInteger calls = new AtomicInteger();

            ctx.onCancel(calls::incrementAndGet);

            assertThat(calls).hasValue(1);
        }

        @Test
        @DisplayName("should not run a removed listener")
        void shouldNotRunRemovedListener() {
            CallContext ctx = CallContext.background();
            AtomicInteger calls = new AtomicInteger();
            CallContext.Registration registration = ctx.onCancel(calls::incrementAndGet);

            registration.close();
            ctx.cancel();

            assertThat(calls).hasValue(0);
        }

        @Test
        @DisplayName("should create already ended children from an ended parent")
        void shouldCreateEndedChildFromEndedParent() {
            CallContext root = CallContext.background();
            root.cancel();

            assertThat(root.child().isDone()).isTrue();
        }
    }

    @Nested
    @DisplayName("Deadlines")
    class Deadlines {

        @Test
        @DisplayName("should end with DEADLINE_EXCEEDED when the timeout elapses")
        void shouldExpire() throws InterruptedException {
            CallContext ctx = CallContext.background().withTimeout(Duration.ofMillis(50));

            assertThat(ctx.await(Duration.ofSeconds(5))).isTrue();
            assertThat(ctx.cause()).isEqualTo(CallContext.Cause.DEADLINE_EXCEEDED);
        }

        @Test
        @DisplayName("should never extend past the parent deadline")
        void shouldNotExtendParentDeadline() {
            CallContext parent = CallContext.background().withTimeout(Duration.ofSeconds(1));
            CallContext child = parent.withTimeout(Duration.ofHours(1));

            assertThat(child.deadline()).isEqualTo(parent.deadline());
            assertThat(child.remaining().orElseThrow()).isLessThanOrEqualTo(Duration.ofSeconds(1));
        }

        @Test
        @DisplayName("should propagate the parent's expiry cause")
        void shouldPropagateExpiryCause() throws InterruptedException {
            CallContext parent = CallContext.background().withTimeout(Duration.ofMillis(30));
            CallContext child = parent.child();

            assertThat(child.await(Duration.ofSeconds(5))).isTrue();
            assertThat(child.cause()).isEqualTo(CallContext.Cause.DEADLINE_EXCEEDED);
        }

        @Test
        @DisplayName("should treat a non-positive timeout as no deadline")
        void shouldIgnoreNonPositiveTimeout() {
            CallContext ctx = CallContext.background();

            assertThat(ctx.withTimeout(Duration.ZERO).deadline()).isEmpty();
            assertThat(ctx.withTimeout(null).deadline()).isEmpty();
            assertThat(ctx.remaining()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("should map cancellation to CANCELLED")
        void shouldMapCancellation() {
            CallContext ctx = CallContext.background();
            ctx.cancel();

            assertThatThrownBy(() -> ctx.throwIfDone("ollama: chat"))
                    .isInstanceOf(ProviderException.class)
                    .hasMessageContaining("ollama: chat")
                    .extracting(e -> ((ProviderException) e).getErrorType())
                    .isEqualTo(ErrorType.CANCELLED);
        }

        @Test
        @DisplayName("should map expiry to TIMEOUT")
        void shouldMapExpiry() throws InterruptedException {
            CallContext ctx = CallContext.background().withTimeout(Duration.ofMillis(10));
            ctx.await(Duration.ofSeconds(5));

            assertThat(ctx.doneException("llama.cpp: chat", null).getErrorType()).isEqualTo(ErrorType.TIMEOUT);
        }

        @Test
        @DisplayName("should not throw while live")
        void shouldNotThrowWhileLive() {
            CallContext ctx = CallContext.background();

            ctx.throwIfDone("noop");

            assertThat(ctx.isDone()).isFalse();
            assertThat(ctx.cause()).isNull();
        }
    }

    @Test
    @DisplayName("should detach from the parent on close")
    void shouldDetachOnClose() {
        CallContext root = CallContext.background();
        AtomicInteger childCancellations = new AtomicInteger();
        CallContext child = root.child();
        child.onCancel(childCancellations::incrementAndGet);

        child.close();
        root.cancel();

        assertThat(child.isDone()).isTrue();
        assertThat(childCancellations).hasValue(1);
        assertThat(root.isDone()).isTrue();
    }
}
