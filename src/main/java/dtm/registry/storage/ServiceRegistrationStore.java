package dtm.registry.storage;

import dtm.registry.exceptions.InvalidServiceRegistrationException;
import dtm.registry.prototypes.ManagedService;
import dtm.registry.prototypes.ServiceOptions;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Armazena instâncias vivas, fábricas e opções, particionadas por {@link ServiceKey}.
 * <p>
 * É mutado apenas pelos registros e pela materialização preguiçosa; as varreduras de
 * ciclo de vida trabalham sobre um {@link RegistrationSnapshot}.
 */
@Slf4j
public class ServiceRegistrationStore {

    private final Map<ServiceKey, ManagedService> instances = new LinkedHashMap<>();
    private final Map<ServiceKey, ServiceOptions> instanceOptions = new LinkedHashMap<>();

    private final Map<ServiceKey, Supplier<? extends ManagedService>> factories = new LinkedHashMap<>();
    private final Map<ServiceKey, ServiceOptions> factoryOptions = new LinkedHashMap<>();

    private final Map<String, Function<String, ? extends ManagedService>> workspaceFactoryFunctions = new LinkedHashMap<>();
    private final Map<String, ServiceOptions> workspaceFactoryFunctionOptions = new LinkedHashMap<>();

    public synchronized void putInstance(ServiceKey key, ManagedService instance, ServiceOptions options) {
        validateKey(key);
        if (instance == null) {
            throw new InvalidServiceRegistrationException("Instância nula para o serviço: " + key, key.type());
        }
        validateDependencies(key, options);

        if (instances.containsKey(key)) {
            log.warn("Serviço já registrado, sobrescrevendo: {}", key);
        }

        instances.put(key, instance);
        instanceOptions.put(key, options != null ? options : ServiceOptions.DEFAULT);
        log.debug("Serviço registrado: {}", key);
    }

    public synchronized void putFactory(ServiceKey key, Supplier<? extends ManagedService> factory, ServiceOptions options) {
        validateKey(key);
        if (factory == null) {
            throw new InvalidServiceRegistrationException("Fábrica nula para o serviço: " + key, key.type());
        }
        validateDependencies(key, options);

        if (factories.containsKey(key)) {
            log.warn("Fábrica de serviço já registrada, sobrescrevendo: {}", key);
        }

        factories.put(key, factory);
        factoryOptions.put(key, options != null ? options : ServiceOptions.DEFAULT);
        log.debug("Fábrica de serviço registrada: {}", key);
    }

    public synchronized void putWorkspaceFactoryFunction(String type, Function<String, ? extends ManagedService> factoryFn, ServiceOptions options) {
        validateType(type);
        if (factoryFn == null) {
            throw new InvalidServiceRegistrationException("Função de fábrica nula para o tipo: " + type, type);
        }
        validateDependencies(null, options);

        if (workspaceFactoryFunctions.containsKey(type)) {
            log.warn("Função de fábrica de workspace já registrada, sobrescrevendo: {}", type);
        }

        workspaceFactoryFunctions.put(type, factoryFn);
        workspaceFactoryFunctionOptions.put(type, options != null ? options : ServiceOptions.DEFAULT);
        log.debug("Função de fábrica de workspace registrada: {}", type);
    }

    public synchronized ManagedService getInstance(ServiceKey key) {
        return instances.get(key);
    }

    public synchronized Supplier<? extends ManagedService> getFactory(ServiceKey key) {
        return factories.get(key);
    }

    public synchronized ServiceOptions getFactoryOptions(ServiceKey key) {
        return factoryOptions.get(key);
    }

    public synchronized Function<String, ? extends ManagedService> getWorkspaceFactoryFunction(String type) {
        return workspaceFactoryFunctions.get(type);
    }

    public synchronized ServiceOptions getWorkspaceFactoryFunctionOptions(String type) {
        return workspaceFactoryFunctionOptions.get(type);
    }

    /**
     * Registra uma instância criada por fábrica, a menos que outra chamada concorrente
     * já tenha registrado a mesma chave; nesse caso devolve a instância existente.
     */
    public synchronized ManagedService putMaterialized(ServiceKey key, ManagedService instance, ServiceOptions options) {
        ManagedService existing = instances.get(key);
        if (existing != null) {
            return existing;
        }
        putInstance(key, instance, options);
        return instance;
    }

    public synchronized RegistrationSnapshot snapshot() {
        Set<String> workspaceIds = new LinkedHashSet<>();
        for (ServiceKey key : instances.keySet()) {
            if (key.isWorkspace()) {
                workspaceIds.add(key.workspaceId());
            }
        }

        return new RegistrationSnapshot(
                Collections.unmodifiableMap(new LinkedHashMap<>(instances)),
                Collections.unmodifiableMap(new LinkedHashMap<>(instanceOptions)),
                Collections.unmodifiableSet(new LinkedHashSet<>(factories.keySet())),
                Collections.unmodifiableMap(new LinkedHashMap<>(factoryOptions)),
                Collections.unmodifiableSet(workspaceIds)
        );
    }

    private void validateKey(ServiceKey key) {
        if (key == null) {
            throw new InvalidServiceRegistrationException("Chave de serviço nula", null);
        }
        validateType(key.type());
        if (key.isWorkspace() && key.workspaceId().isBlank()) {
            throw new InvalidServiceRegistrationException("Id de workspace vazio para o serviço: " + key.type(), key.type());
        }
    }

    /**
     * Uma dependência qualificada {@code workspace:tipo} só vale para a própria workspace do nó.
     * Globais são inicializados antes de qualquer workspace e cada workspace é varrida em
     * separado, então apontar para outro escopo inverteria a ordem. Funções de fábrica
     * genéricas ({@code key} nulo) servem a qualquer workspace e não aceitam a forma qualificada.
     */
    private void validateDependencies(ServiceKey key, ServiceOptions options) {
        if (options == null) return;

        for (String dependency : options.getDependencies()) {
            if (dependency == null || dependency.isBlank()) {
                throw new InvalidServiceRegistrationException(
                        "Dependência vazia declarada por: " + describe(key), key != null ? key.type() : null);
            }

            ServiceKey target = ServiceKey.parseQualified(dependency);
            if (target != null && (key == null || !target.workspaceId().equals(key.workspaceId()))) {
                throw new InvalidServiceRegistrationException(
                        "Dependência qualificada " + dependency + " de " + describe(key) + " aponta para outro escopo",
                        key != null ? key.type() : null);
            }
        }
    }

    private static String describe(ServiceKey key) {
        return key != null ? key.toString() : "função de fábrica de workspace";
    }

    private void validateType(String type) {
        if (type == null || type.isBlank()) {
            throw new InvalidServiceRegistrationException("Tipo de serviço vazio", type);
        }
        if (type.contains(ServiceKey.SCOPE_SEPARATOR)) {
            throw new InvalidServiceRegistrationException(
                    "Tipo de serviço não pode conter '" + ServiceKey.SCOPE_SEPARATOR + "': " + type, type);
        }
    }
}
