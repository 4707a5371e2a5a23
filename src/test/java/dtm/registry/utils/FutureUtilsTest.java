package dtm.registry.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class FutureUtilsTest {

    @Test
    void successReturnsNull() {
        assertThat(FutureUtils.awaitFailure(() -> CompletableFuture.completedFuture(null), null)).isNull();
    }

    @Test
    void failedFutureReturnsUnwrappedCause() {
        IllegalStateException cause = new IllegalStateException("falhou");

        Throwable failure = FutureUtils.awaitFailure(() -> CompletableFuture.failedFuture(cause), null);

        assertThat(failure).isSameAs(cause);
    }

    @Test
    void synchronousThrowCountsAsFailure() {
        Throwable failure = FutureUtils.awaitFailure(() -> {
            throw new IllegalArgumentException("síncrono");
        }, null);

        assertThat(failure).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nullFutureCountsAsFailure() {
        assertThat(FutureUtils.awaitFailure(() -> null, null)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void timeoutCancelsTheFuture() {
        CompletableFuture<Void> never = new CompletableFuture<>();

        Throwable failure = FutureUtils.awaitFailure(() -> never, Duration.ofMillis(50));

        assertThat(failure).isInstanceOf(TimeoutException.class);
        assertThat(never).isCancelled();
    }

    @Test
    void unwrapStripsNestedWrappers() {
        IllegalStateException root = new IllegalStateException("raiz");

        Throwable wrapped = new CompletionException(new ExecutionException(root));

        assertThat(FutureUtils.unwrap(wrapped)).isSameAs(root);
        assertThat(FutureUtils.unwrap(root)).isSameAs(root);
    }
}
