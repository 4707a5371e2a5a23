package dtm.registry.storage.lifecycle;

import dtm.registry.exceptions.CompositeCleanupException;
import dtm.registry.exceptions.DependencyCycleException;
import dtm.registry.exceptions.RegistryStateException;
import dtm.registry.exceptions.ServiceInitializationException;
import dtm.registry.prototypes.ManagedService;
import dtm.registry.sort.TopologicalSorter;
import dtm.registry.storage.RegistrationSnapshot;
import dtm.registry.storage.ServiceKey;
import dtm.registry.storage.ServiceRegistrationStore;
import dtm.registry.storage.ServiceRegistryConfigurations;
import dtm.registry.storage.graph.ServiceDependencyGraphBuilder;
import dtm.registry.storage.graph.ServiceGraph;
import dtm.registry.utils.FutureUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Executa as varreduras de inicialização e limpeza sobre a ordem topológica.
 * <p>
 * Inicialização: globais primeiro, depois cada workspace; a primeira falha aborta.
 * Limpeza: ordem inversa, workspaces primeiro, depois globais; falhas são acumuladas
 * e lançadas juntas ao final.
 */
@Slf4j
public class ServiceLifecycleDriver {

    private final ServiceRegistrationStore store;
    private final ServiceRegistryConfigurations configurations;
    private final AtomicBoolean started;

    public ServiceLifecycleDriver(ServiceRegistrationStore store, ServiceRegistryConfigurations configurations) {
        this.store = store;
        this.configurations = configurations;
        this.started = new AtomicBoolean(false);
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * Calcula a ordem de inicialização do estado atual do registro.
     *
     * @throws DependencyCycleException se houver ciclo
     */
    public List<ServiceKey> computeOrder(RegistrationSnapshot snapshot) {
        ServiceGraph graph = new ServiceDependencyGraphBuilder(snapshot).buildGraph();
        return TopologicalSorter.sort(graph);
    }

    public List<ServiceKey> computeOrder() {
        return computeOrder(store.snapshot());
    }

    public void initializeServices() {
        if (started.get()) {
            throw new RegistryStateException("Serviços já inicializados");
        }

        log.info("Iniciando inicialização dos serviços");

        RegistrationSnapshot snapshot = store.snapshot();
        List<ServiceKey> order = computeOrder(snapshot);
        if (configurations.isLogInitializationOrder()) {
            log.info("Ordem de inicialização: {}", describe(order));
        }

        SweepTimings timings = new SweepTimings("initializeServices");

        for (ServiceKey key : order) {
            if (!key.isGlobal()) continue;
            initializeNode(key, snapshot.instances().get(key), timings);
        }

        for (String workspaceId : snapshot.workspaceIds()) {
            for (ServiceKey key : order) {
                if (!key.belongsTo(workspaceId)) continue;
                initializeNode(key, snapshot.instances().get(key), timings);
            }
        }

        started.set(true);
        if (log.isDebugEnabled()) {
            log.debug(timings.summary());
        }
        log.info("Todos os serviços inicializados com sucesso em {} ms", String.format("%.3f", timings.totalMillis()));
    }

    public void cleanupServices() {
        if (!started.get()) {
            log.warn("Serviços não inicializados, nada a limpar");
            return;
        }

        log.info("Iniciando limpeza dos serviços");

        RegistrationSnapshot snapshot = store.snapshot();
        List<ServiceKey> cleanupOrder = new ArrayList<>(cleanupOrderOf(snapshot));
        Collections.reverse(cleanupOrder);
        log.debug("Ordem de limpeza: {}", describe(cleanupOrder));

        SweepTimings timings = new SweepTimings("cleanupServices");

        CompositeCleanupException failures = new CompositeCleanupException();
        try {
            for (String workspaceId : snapshot.workspaceIds()) {
                for (ServiceKey key : cleanupOrder) {
                    if (!key.belongsTo(workspaceId)) continue;
                    cleanupNode(key, snapshot.instances().get(key), failures, timings);
                }
            }

            for (ServiceKey key : cleanupOrder) {
                if (!key.isGlobal()) continue;
                cleanupNode(key, snapshot.instances().get(key), failures, timings);
            }
        } finally {
            started.set(false);
        }

        if (log.isDebugEnabled()) {
            log.debug(timings.summary());
        }

        if (failures.hasErrors()) {
            log.error("Alguns serviços falharam durante a limpeza: {} erro(s)", failures.getErrorsSize());
            throw failures;
        }

        log.info("Todos os serviços limpos com sucesso");
    }

    private List<ServiceKey> cleanupOrderOf(RegistrationSnapshot snapshot) {
        try {
            return computeOrder(snapshot);
        } catch (DependencyCycleException e) {
            log.error("Ciclo de dependência surgiu após a inicialização; limpando na ordem de registro. {}", e.getMessage());
            return new ArrayList<>(snapshot.instances().keySet());
        }
    }

    private void initializeNode(ServiceKey key, ManagedService service, SweepTimings timings) {
        if (service == null) return;

        log.debug("Inicializando serviço: {}", key);
        long startedAt = System.nanoTime();
        Throwable failure = FutureUtils.awaitFailure(service::init,
                configurations.hasInitTimeout() ? configurations.getInitTimeout() : null);
        timings.record(key, startedAt, failure != null);

        if (failure != null) {
            log.error("Falha ao inicializar serviço {}: {}", key, failure.getMessage());
            if (log.isDebugEnabled()) {
                log.debug(timings.summary());
            }
            throw new ServiceInitializationException(key, failure);
        }
        log.debug("Serviço inicializado: {}", key);
    }

    private void cleanupNode(ServiceKey key, ManagedService service, CompositeCleanupException failures, SweepTimings timings) {
        if (service == null) return;

        log.debug("Limpando serviço: {}", key);
        long startedAt = System.nanoTime();
        Throwable failure = FutureUtils.awaitFailure(service::cleanup,
                configurations.hasCleanupTimeout() ? configurations.getCleanupTimeout() : null);
        timings.record(key, startedAt, failure != null);

        if (failure != null) {
            log.error("Falha ao limpar serviço {}: {}", key, failure.getMessage());
            failures.addError(key, failure);
            return;
        }
        log.debug("Serviço limpo: {}", key);
    }

    private static String describe(List<ServiceKey> order) {
        return order.stream().map(ServiceKey::toString).collect(Collectors.joining(", "));
    }
}
