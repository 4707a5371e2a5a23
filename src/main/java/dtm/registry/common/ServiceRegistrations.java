package dtm.registry.common;

import dtm.registry.core.ServiceRegistryRegistor;
import dtm.registry.exceptions.InvalidServiceRegistrationException;
import dtm.registry.prototypes.ManagedService;
import dtm.registry.prototypes.ServiceOptions;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.function.BiFunction;

/**
 * Atalhos para criar um adaptador e registrá-lo em uma única chamada.
 */
@Slf4j
public final class ServiceRegistrations {

    private ServiceRegistrations() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Cria o adaptador com {@code adapterFactory} e o registra. Se {@code creationOptions}
     * trouxer um {@code workspaceId}, o registro é no escopo daquela workspace; senão, global.
     *
     * @param registry        registro de destino
     * @param type            tipo do serviço
     * @param adapterFactory  recebe o objeto envolvido e as opções mescladas
     * @param creationOptions objeto envolvido, opções, metadados e workspace
     * @param options         opções de registro; pode ser {@code null}
     * @return o adaptador registrado
     */
    public static <U, T extends ManagedService> T createAndRegisterService(
            @NonNull ServiceRegistryRegistor registry,
            String type,
            @NonNull BiFunction<? super U, Map<String, Object>, T> adapterFactory,
            @NonNull ServiceCreationOptions<U> creationOptions,
            ServiceOptions options
    ) {
        T adapter = adapterFactory.apply(creationOptions.getInstance(), creationOptions.adapterOptions());
        if (adapter == null) {
            throw new InvalidServiceRegistrationException("Fábrica de adaptador retornou nulo para o serviço: " + type, type);
        }

        if (creationOptions.hasWorkspaceId()) {
            log.debug("Registrando adaptador {} para {}:{}", adapter.getClass().getSimpleName(), creationOptions.getWorkspaceId(), type);
            registry.registerWorkspaceService(creationOptions.getWorkspaceId(), type, adapter, options);
        } else {
            log.debug("Registrando adaptador {} para {}", adapter.getClass().getSimpleName(), type);
            registry.registerService(type, adapter, options);
        }

        return adapter;
    }

    public static <U, T extends ManagedService> T createAndRegisterWorkspaceService(
            @NonNull ServiceRegistryRegistor registry,
            String workspaceId,
            String type,
            @NonNull BiFunction<? super U, Map<String, Object>, T> adapterFactory,
            @NonNull ServiceCreationOptions<U> creationOptions,
            ServiceOptions options
    ) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new InvalidServiceRegistrationException("Id de workspace vazio para o serviço: " + type, type);
        }
        return createAndRegisterService(registry, type, adapterFactory, creationOptions.withWorkspaceId(workspaceId), options);
    }
}
