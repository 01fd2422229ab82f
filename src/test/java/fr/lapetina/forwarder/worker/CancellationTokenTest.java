package fr.lapetina.forwarder.worker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTokenTest {

    @Test
    @DisplayName("should run callbacks once even if cancelled twice")
    void shouldRunCallbacksOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.cancel();
        token.cancel();

        assertThat(token.isCancelled()).isTrue();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(token.whenCancelled()).isCompleted();
    }

    @Test
    @DisplayName("should run callback immediately when registered after cancel")
    void shouldRunLateCallbackImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("should not run withdrawn callbacks")
    void shouldNotRunWithdrawnCallbacks() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();

        try (CancellationToken.Registration ignored = token.onCancel(calls::incrementAndGet)) {
            assertThat(token.isCancelled()).isFalse();
        }
        token.cancel();

        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("should keep running callbacks when one of them fails")
    void shouldSurviveFailingCallback() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(calls::incrementAndGet);

        token.cancel();

        assertThat(calls.get()).isEqualTo(1);
        assertThat(token.whenCancelled()).isCompleted();
    }
}
