package dtm.registry.storage.status;

import dtm.registry.fixtures.RecordingService;
import dtm.registry.prototypes.ManagedService;
import dtm.registry.prototypes.ServiceStatus;
import dtm.registry.storage.ServiceKey;
import dtm.registry.storage.ServiceRegistrationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceStatusAggregatorTest {

    private ServiceRegistrationStore store;
    private ServiceStatusAggregator aggregator;

    @BeforeEach
    void setUp() {
        store = new ServiceRegistrationStore();
        aggregator = new ServiceStatusAggregator(store, Duration.ofMillis(200));
    }

    private RecordingService service(String name) {
        return new RecordingService(name, new ArrayList<>());
    }

    @Test
    void globalEntriesComeBeforeWorkspaceEntries() {
        store.putInstance(ServiceKey.workspace("ws1", "worker"), service("worker"), null);
        store.putInstance(ServiceKey.global("core"), service("core"), null);

        Map<String, ServiceStatus> statuses = aggregator.collectAll();

        assertThat(statuses.keySet()).containsExactly("core", "ws1:worker");
    }

    @Test
    void factoriesAreNotChecked() {
        store.putFactory(ServiceKey.global("lazy"), () -> service("lazy"), null);

        assertThat(aggregator.collectAll()).isEmpty();
    }

    @Test
    void failedCheckIsUnhealthy() {
        ServiceKey key = ServiceKey.global("bad");

        ServiceStatus status = aggregator.check(key, service("bad").failingStatusWith(new IllegalStateException("caiu")));

        assertThat(status.isHealthy()).isFalse();
        assertThat(status.getStatusCode()).isEqualTo(500);
        assertThat(status.getDetails()).containsEntry("error", IllegalStateException.class.getName());
    }

    @Test
    void hangingCheckTimesOutAsUnhealthy() {
        ManagedService hanging = new RecordingService("hanging", new ArrayList<>()) {
            @Override
            public CompletableFuture<ServiceStatus> getStatus() {
                return new CompletableFuture<>();
            }
        };

        ServiceStatus status = aggregator.check(ServiceKey.global("hanging"), hanging);

        assertThat(status.isHealthy()).isFalse();
        assertThat(status.getStatusCode()).isEqualTo(500);
    }

    @Test
    void nullStatusIsUnhealthy() {
        ManagedService silent = new RecordingService("silent", new ArrayList<>()) {
            @Override
            public CompletableFuture<ServiceStatus> getStatus() {
                return CompletableFuture.completedFuture(null);
            }
        };

        ServiceStatus status = aggregator.check(ServiceKey.global("silent"), silent);

        assertThat(status.isHealthy()).isFalse();
        assertThat(status.getStatusCode()).isEqualTo(503);
    }

    @Test
    void reportSplitsWorkspaceFromType() {
        store.putInstance(ServiceKey.global("core"), service("core"), null);
        store.putInstance(ServiceKey.workspace("tenant:7", "worker"), service("worker"), null);

        ServiceStatusReport report = ServiceStatusReport.from(aggregator.collectAll());

        assertThat(report.rows()).hasSize(2);
        assertThat(report.rows().get(1).workspaceId()).isEqualTo("tenant:7");
        assertThat(report.rows().get(1).type()).isEqualTo("worker");
        assertThat(report.allHealthy()).isFalse();
        assertThat(report.unhealthyCount()).isEqualTo(2);
    }
}
