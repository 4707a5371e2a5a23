package dtm.registry.standard;

import dtm.registry.prototypes.ManagedService;

/**
 * Construtores dos serviços padrão. Os gerenciadores concretos ficam fora do registro;
 * quem os conhece implementa esta interface e entrega os adaptadores prontos.
 * <p>
 * As dependências já chegam resolvidas pelo registro e nunca são nulas.
 */
public interface StandardServiceProviders {

    ManagedService createMandrakeManager();

    ManagedService createSystemMcpManager(ManagedService mandrakeManager);

    ManagedService createSystemSessionCoordinator(ManagedService mandrakeManager);

    ManagedService createWorkspaceManager(String workspaceId, ManagedService mandrakeManager);

    ManagedService createWorkspaceMcpManager(String workspaceId, ManagedService workspaceManager);

    ManagedService createSessionCoordinator(String workspaceId, ManagedService workspaceManager);
}
