package dtm.registry.standard;

import dtm.registry.core.ServiceRegistry;
import dtm.registry.exceptions.ServiceCreationException;
import dtm.registry.prototypes.ManagedService;
import dtm.registry.storage.ServiceKey;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import static dtm.registry.standard.StandardService.*;

/**
 * Registra as fábricas dos serviços padrão: fábricas globais para o sistema e funções de
 * fábrica genéricas para qualquer workspace.
 * <p>
 * Cada fábrica busca no registro o serviço de que depende; se ele não existir, a criação
 * falha com {@link ServiceCreationException}, que o registro registra em log e converte
 * em consulta sem resultado.
 */
@Slf4j
public final class StandardServiceFactories {

    private StandardServiceFactories() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static void register(@NonNull ServiceRegistry registry, @NonNull StandardServiceProviders providers) {
        log.info("Registrando fábricas dos serviços padrão");

        registry.registerServiceFactory(MANDRAKE_MANAGER.getType(),
                providers::createMandrakeManager,
                MANDRAKE_MANAGER.globalOptions());

        registry.registerServiceFactory(MCP_MANAGER.getType(),
                () -> providers.createSystemMcpManager(requireGlobal(registry, MANDRAKE_MANAGER, MCP_MANAGER)),
                MCP_MANAGER.globalOptions());

        registry.registerServiceFactory(SESSION_COORDINATOR.getType(),
                () -> providers.createSystemSessionCoordinator(requireGlobal(registry, MANDRAKE_MANAGER, SESSION_COORDINATOR)),
                SESSION_COORDINATOR.globalOptions());

        registry.registerWorkspaceFactoryFunction(WORKSPACE_MANAGER.getType(),
                workspaceId -> providers.createWorkspaceManager(workspaceId,
                        requireGlobal(registry, MANDRAKE_MANAGER, WORKSPACE_MANAGER)),
                WORKSPACE_MANAGER.workspaceOptions());

        registry.registerWorkspaceFactoryFunction(MCP_MANAGER.getType(),
                workspaceId -> providers.createWorkspaceMcpManager(workspaceId,
                        requireWorkspace(registry, workspaceId, WORKSPACE_MANAGER, MCP_MANAGER)),
                MCP_MANAGER.workspaceOptions());

        registry.registerWorkspaceFactoryFunction(SESSION_COORDINATOR.getType(),
                workspaceId -> providers.createSessionCoordinator(workspaceId,
                        requireWorkspace(registry, workspaceId, WORKSPACE_MANAGER, SESSION_COORDINATOR)),
                SESSION_COORDINATOR.workspaceOptions());

        log.debug("Fábricas padrão registradas: {}", StandardService.values().length);
    }

    private static ManagedService requireGlobal(ServiceRegistry registry, StandardService dependency, StandardService dependent) {
        ManagedService service = registry.getService(dependency.getType());
        if (service == null) {
            throw new ServiceCreationException(
                    "Não é possível criar " + dependent.getType() + ": " + dependency.getType() + " indisponível",
                    ServiceKey.global(dependent.getType())
            );
        }
        return service;
    }

    private static ManagedService requireWorkspace(ServiceRegistry registry, String workspaceId, StandardService dependency, StandardService dependent) {
        ManagedService service = registry.getWorkspaceService(workspaceId, dependency.getType());
        if (service == null) {
            throw new ServiceCreationException(
                    "Não é possível criar " + dependent.getType() + ": " + dependency.getType() + " da workspace " + workspaceId + " indisponível",
                    ServiceKey.workspace(workspaceId, dependent.getType())
            );
        }
        return service;
    }
}
