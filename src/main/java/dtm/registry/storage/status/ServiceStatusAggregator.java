package dtm.registry.storage.status;

import dtm.registry.prototypes.ManagedService;
import dtm.registry.prototypes.ServiceStatus;
import dtm.registry.storage.ServiceKey;
import dtm.registry.storage.ServiceRegistrationStore;
import dtm.registry.utils.FutureUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Consulta o status dos serviços vivos. Nunca propaga falhas: uma consulta que falha vira
 * um {@link ServiceStatus} não saudável.
 */
@Slf4j
public class ServiceStatusAggregator {

    private final ServiceRegistrationStore store;
    private final Duration checkTimeout;

    public ServiceStatusAggregator(ServiceRegistrationStore store, Duration checkTimeout) {
        this.store = store;
        this.checkTimeout = checkTimeout;
    }

    public ServiceStatus check(ServiceKey key, ManagedService service) {
        if (service == null) {
            return null;
        }

        AtomicReference<ServiceStatus> result = new AtomicReference<>();
        Throwable failure = FutureUtils.awaitFailure(() -> {
            CompletableFuture<ServiceStatus> status = service.getStatus();
            return status == null ? null : status.thenAccept(result::set);
        }, checkTimeout);

        if (failure != null) {
            log.warn("Falha ao consultar status do serviço {}: {}", key, failure.getMessage());
            return ServiceStatus.failed(failure);
        }
        if (result.get() == null) {
            log.warn("Serviço {} retornou status nulo", key);
            return ServiceStatus.unhealthy("Serviço " + key + " não informou status");
        }
        return result.get();
    }

    /**
     * Status de todas as instâncias vivas, globais primeiro, depois as de workspace.
     */
    public Map<String, ServiceStatus> collectAll() {
        Map<ServiceKey, ManagedService> instances = store.snapshot().instances();
        Map<String, ServiceStatus> statuses = new LinkedHashMap<>();

        instances.forEach((key, service) -> {
            if (key.isGlobal()) {
                statuses.put(key.toString(), check(key, service));
            }
        });
        instances.forEach((key, service) -> {
            if (key.isWorkspace()) {
                statuses.put(key.toString(), check(key, service));
            }
        });

        return statuses;
    }
}
