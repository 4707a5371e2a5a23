package dtm.registry.prototypes;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AbstractManagedServiceTest {

    static class CountingService extends AbstractManagedService {
        final AtomicInteger inits = new AtomicInteger();
        final AtomicInteger cleanups = new AtomicInteger();
        Exception initFailure;
        Exception cleanupFailure;
        CountDownLatch entered;
        CountDownLatch release;

        CountingService() {
            super("counting");
        }

        @Override
        protected void doInit() throws Exception {
            inits.incrementAndGet();
            if (entered != null) {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
            }
            if (initFailure != null) throw initFailure;
        }

        @Override
        protected void doCleanup() throws Exception {
            cleanups.incrementAndGet();
            if (cleanupFailure != null) throw cleanupFailure;
        }

        @Override
        protected Map<String, Object> statusDetails() {
            return Map.of("inits", inits.get());
        }
    }

    @Test
    void initIsIdempotent() {
        CountingService service = new CountingService();

        service.init().join();
        service.init().join();

        assertThat(service.inits).hasValue(1);
        assertThat(service.isInitialized()).isTrue();
    }

    @Test
    void concurrentInitRunsDoInitOnce() throws Exception {
        CountingService service = new CountingService();
        service.entered = new CountDownLatch(1);
        service.release = new CountDownLatch(1);

        CompletableFuture<CompletableFuture<Void>> first = CompletableFuture.supplyAsync(service::init);
        assertThat(service.entered.await(5, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<Void> second = service.init();

        assertThat(second).isNotDone();
        assertThat(service.isInitialized()).isFalse();

        service.release.countDown();
        first.get(5, TimeUnit.SECONDS).get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);

        assertThat(service.inits).hasValue(1);
        assertThat(service.isInitialized()).isTrue();
    }

    @Test
    void initCanBeRetriedAfterFailure() {
        CountingService service = new CountingService();
        service.initFailure = new IllegalStateException("porta ocupada");
        assertThat(service.init()).isCompletedExceptionally();

        service.initFailure = null;
        service.init().join();

        assertThat(service.inits).hasValue(2);
        assertThat(service.isInitialized()).isTrue();
    }

    @Test
    void initRunsAgainAfterCleanup() {
        CountingService service = new CountingService();
        service.init().join();
        service.cleanup().join();

        service.init().join();

        assertThat(service.inits).hasValue(2);
        assertThat(service.isInitialized()).isTrue();
    }

    @Test
    void failedInitLeavesServiceUninitialized() {
        CountingService service = new CountingService();
        service.initFailure = new IllegalStateException("porta ocupada");

        CompletableFuture<Void> result = service.init();

        assertThatThrownBy(result::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(service.isInitialized()).isFalse();
    }

    @Test
    void cleanupResetsFlagEvenWhenTeardownFails() {
        CountingService service = new CountingService();
        service.init().join();
        service.cleanupFailure = new IllegalStateException("arquivo travado");

        CompletableFuture<Void> result = service.cleanup();

        assertThat(result).isCompletedExceptionally();
        assertThat(service.isInitialized()).isFalse();
    }

    @Test
    void cleanupOfUninitializedServiceDoesNothing() {
        CountingService service = new CountingService();

        service.cleanup().join();

        assertThat(service.cleanups).hasValue(0);
    }

    @Test
    void statusReflectsInitializationAndDetails() {
        CountingService service = new CountingService();

        ServiceStatus before = service.getStatus().join();
        service.init().join();
        ServiceStatus after = service.getStatus().join();

        assertThat(before.isHealthy()).isFalse();
        assertThat(before.getStatusCode()).isEqualTo(503);
        assertThat(after.isHealthy()).isTrue();
        assertThat(after.getStatusCode()).isEqualTo(200);
        assertThat(after.getDetails())
                .containsEntry("name", "counting")
                .containsEntry("initialized", true)
                .containsEntry("inits", 1);
    }
}
