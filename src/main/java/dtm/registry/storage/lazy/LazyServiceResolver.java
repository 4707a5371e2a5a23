package dtm.registry.storage.lazy;

import dtm.registry.exceptions.ServiceCreationException;
import dtm.registry.prototypes.ManagedService;
import dtm.registry.prototypes.ServiceOptions;
import dtm.registry.storage.ServiceKey;
import dtm.registry.storage.ServiceRegistrationStore;
import dtm.registry.utils.FutureUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Resolve serviços por chave, materializando-os a partir das fábricas quando ainda
 * não existe instância viva.
 * <p>
 * Depois que o registro partiu, a instância recém-criada tem o {@code init()} disparado no
 * executor sem que quem consultou espere por ele: o serviço fica disponível antes de estar
 * pronto, e uma falha nessa inicialização só aparece no log.
 */
@Slf4j
public class LazyServiceResolver {

    private final ServiceRegistrationStore store;
    private final BooleanSupplier started;
    private final Executor lazyInitExecutor;

    public LazyServiceResolver(ServiceRegistrationStore store, BooleanSupplier started, Executor lazyInitExecutor) {
        this.store = store;
        this.started = started;
        this.lazyInitExecutor = lazyInitExecutor;
    }

    public ManagedService resolveGlobal(String type) {
        ServiceKey key = ServiceKey.global(type);
        ManagedService service = store.getInstance(key);
        if (service != null) {
            return service;
        }

        Supplier<? extends ManagedService> factory = store.getFactory(key);
        if (factory == null) {
            return null;
        }

        return materialize(key, factory, store.getFactoryOptions(key));
    }

    /**
     * Ordem de consulta: instância viva, fábrica específica da workspace, função de fábrica genérica.
     */
    public ManagedService resolveWorkspace(String workspaceId, String type) {
        ServiceKey key = ServiceKey.workspace(workspaceId, type);
        ManagedService service = store.getInstance(key);
        if (service != null) {
            return service;
        }

        Supplier<? extends ManagedService> factory = store.getFactory(key);
        if (factory != null) {
            return materialize(key, factory, store.getFactoryOptions(key));
        }

        Function<String, ? extends ManagedService> factoryFn = store.getWorkspaceFactoryFunction(type);
        if (factoryFn != null) {
            return materialize(key, () -> factoryFn.apply(workspaceId), store.getWorkspaceFactoryFunctionOptions(type));
        }

        return null;
    }

    private ManagedService materialize(ServiceKey key, Supplier<? extends ManagedService> factory, ServiceOptions options) {
        ManagedService created;
        try {
            log.debug("Criando serviço {} a partir da fábrica", key);
            created = factory.get();
            if (created == null) {
                throw new ServiceCreationException("Fábrica retornou instância nula para: " + key, key);
            }
        } catch (Exception e) {
            log.error("Falha ao criar serviço {}: {}", key, e.getMessage(), e);
            return null;
        }

        ManagedService registered = store.putMaterialized(key, created, options);
        if (registered != created) {
            log.debug("Serviço {} criado concorrentemente, usando a instância já registrada", key);
            return registered;
        }

        if (started.getAsBoolean()) {
            initializeInBackground(key, created);
        }
        return created;
    }

    private void initializeInBackground(ServiceKey key, ManagedService service) {
        log.debug("Disparando inicialização em segundo plano: {}", key);
        CompletableFuture
                .supplyAsync(service::init, lazyInitExecutor)
                .thenCompose(Function.identity())
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        Throwable cause = FutureUtils.unwrap(error);
                        log.error("Falha ao inicializar serviço {} em segundo plano: {}", key, cause.getMessage(), cause);
                    } else {
                        log.debug("Serviço {} inicializado em segundo plano", key);
                    }
                });
    }
}
