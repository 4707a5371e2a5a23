package dtm.registry.storage.containers;

import dtm.registry.core.ServiceRegistry;
import dtm.registry.exceptions.InvalidServiceRegistrationException;
import dtm.registry.prototypes.ManagedService;
import dtm.registry.prototypes.ServiceOptions;
import dtm.registry.prototypes.ServiceStatus;
import dtm.registry.storage.ServiceKey;
import dtm.registry.storage.ServiceRegistrationStore;
import dtm.registry.storage.ServiceRegistryConfigurations;
import dtm.registry.storage.lazy.LazyServiceResolver;
import dtm.registry.storage.lifecycle.ServiceLifecycleDriver;
import dtm.registry.storage.status.ServiceStatusAggregator;
import dtm.registry.storage.status.ServiceStatusReport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Implementação padrão de {@link ServiceRegistry}.
 * <p>
 * Cada instância é um registro isolado: não há estado estático compartilhado, então
 * consumidores recebem o registro por referência e testes criam um por caso.
 */
@Slf4j
public class ServiceRegistryStorage implements ServiceRegistry {

    private final ServiceRegistrationStore store;
    private final ServiceLifecycleDriver lifecycleDriver;
    private final LazyServiceResolver lazyResolver;
    private final ServiceStatusAggregator statusAggregator;

    @Getter
    private final ServiceRegistryConfigurations configurations;

    private final ExecutorService lazyInitExecutor;
    private final boolean ownsExecutor;

    public ServiceRegistryStorage() {
        this(ServiceRegistryConfigurations.defaults());
    }

    public ServiceRegistryStorage(ServiceRegistryConfigurations configurations) {
        this.configurations = configurations != null ? configurations : ServiceRegistryConfigurations.defaults();
        this.ownsExecutor = this.configurations.getLazyInitExecutor() == null;
        this.lazyInitExecutor = ownsExecutor
                ? newLazyInitExecutor()
                : this.configurations.getLazyInitExecutor();

        this.store = new ServiceRegistrationStore();
        this.lifecycleDriver = new ServiceLifecycleDriver(store, this.configurations);
        this.lazyResolver = new LazyServiceResolver(store, lifecycleDriver::isStarted, lazyInitExecutor);
        this.statusAggregator = new ServiceStatusAggregator(store, this.configurations.getStatusTimeout());
    }

    @Override
    public void registerService(String type, ManagedService instance, ServiceOptions options) throws InvalidServiceRegistrationException {
        store.putInstance(ServiceKey.global(requireType(type)), instance, options);
    }

    @Override
    public void registerWorkspaceService(String workspaceId, String type, ManagedService instance, ServiceOptions options) throws InvalidServiceRegistrationException {
        store.putInstance(ServiceKey.workspace(requireWorkspaceId(workspaceId, type), requireType(type)), instance, options);
    }

    @Override
    public void registerServiceFactory(String type, Supplier<? extends ManagedService> factory, ServiceOptions options) throws InvalidServiceRegistrationException {
        store.putFactory(ServiceKey.global(requireType(type)), factory, options);
    }

    @Override
    public void registerWorkspaceServiceFactory(String workspaceId, String type, Supplier<? extends ManagedService> factory, ServiceOptions options) throws InvalidServiceRegistrationException {
        store.putFactory(ServiceKey.workspace(requireWorkspaceId(workspaceId, type), requireType(type)), factory, options);
    }

    @Override
    public void registerWorkspaceFactoryFunction(String type, Function<String, ? extends ManagedService> factoryFn, ServiceOptions options) throws InvalidServiceRegistrationException {
        store.putWorkspaceFactoryFunction(requireType(type), factoryFn, options);
    }

    @Override
    public ManagedService getService(String type) {
        if (type == null) return null;
        return lazyResolver.resolveGlobal(type);
    }

    @Override
    public <T extends ManagedService> T getService(String type, Class<T> reference) {
        return castOrNull(type, getService(type), reference);
    }

    @Override
    public ManagedService getWorkspaceService(String workspaceId, String type) {
        if (workspaceId == null || type == null) return null;
        return lazyResolver.resolveWorkspace(workspaceId, type);
    }

    @Override
    public <T extends ManagedService> T getWorkspaceService(String workspaceId, String type, Class<T> reference) {
        return castOrNull(type, getWorkspaceService(workspaceId, type), reference);
    }

    @Override
    public void initializeServices() {
        lifecycleDriver.initializeServices();
    }

    @Override
    public void cleanupServices() {
        lifecycleDriver.cleanupServices();
    }

    @Override
    public boolean isStarted() {
        return lifecycleDriver.isStarted();
    }

    @Override
    public ServiceStatus getServiceStatus(String type) {
        return getServiceStatus(type, null);
    }

    @Override
    public ServiceStatus getServiceStatus(String type, String workspaceId) {
        if (workspaceId != null) {
            ManagedService service = getWorkspaceService(workspaceId, type);
            return service != null ? statusAggregator.check(ServiceKey.workspace(workspaceId, type), service) : null;
        }

        ManagedService service = getService(type);
        return service != null ? statusAggregator.check(ServiceKey.global(type), service) : null;
    }

    @Override
    public Map<String, ServiceStatus> getAllServiceStatuses() {
        return statusAggregator.collectAll();
    }

    public ServiceStatusReport getStatusReport() {
        return ServiceStatusReport.from(getAllServiceStatuses());
    }

    /**
     * Ordem em que {@link #initializeServices()} visitaria os serviços no estado atual.
     */
    public List<ServiceKey> getInitializationOrder() {
        return lifecycleDriver.computeOrder();
    }

    @Override
    public void close() {
        if (!ownsExecutor) return;

        lazyInitExecutor.shutdown();
        try {
            if (!lazyInitExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Executor de inicialização em segundo plano não terminou a tempo, forçando parada");
                lazyInitExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lazyInitExecutor.shutdownNow();
        }
    }

    private <T extends ManagedService> T castOrNull(String type, ManagedService service, Class<T> reference) {
        if (service == null) return null;
        if (!reference.isInstance(service)) {
            log.warn("Serviço '{}' é do tipo {}, esperado {}", type, service.getClass().getName(), reference.getName());
            return null;
        }
        return reference.cast(service);
    }

    private static String requireType(String type) {
        if (type == null || type.isBlank()) {
            throw new InvalidServiceRegistrationException("Tipo de serviço vazio", type);
        }
        return type;
    }

    private static String requireWorkspaceId(String workspaceId, String type) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new InvalidServiceRegistrationException("Id de workspace vazio para o serviço: " + type, type);
        }
        return workspaceId;
    }

    private static ExecutorService newLazyInitExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread t = new Thread(runnable);
            t.setName("ServiceRegistry-LazyInit-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
