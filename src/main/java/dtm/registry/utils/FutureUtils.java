package dtm.registry.utils;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

public final class FutureUtils {

    private FutureUtils() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Executa a ação e aguarda o futuro retornado.
     *
     * @param action  ação assíncrona; exceções lançadas de forma síncrona também contam como falha
     * @param timeout espera máxima, ou {@code null} para esperar indefinidamente
     * @return {@code null} em caso de sucesso, ou a causa da falha já desembrulhada
     */
    public static Throwable awaitFailure(Supplier<? extends CompletableFuture<?>> action, Duration timeout) {
        CompletableFuture<?> future;
        try {
            future = action.get();
        } catch (RuntimeException e) {
            return e;
        }

        if (future == null) {
            return new IllegalStateException("Operação assíncrona retornou futuro nulo");
        }

        try {
            if (timeout != null) {
                future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                future.get();
            }
            return null;
        } catch (ExecutionException e) {
            return unwrap(e);
        } catch (TimeoutException e) {
            future.cancel(true);
            return new TimeoutException("Tempo esgotado após " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return e;
        } catch (CancellationException e) {
            return e;
        }
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
