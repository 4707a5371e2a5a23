package dtm.registry.standard;

import dtm.registry.prototypes.ServiceOptions;
import lombok.Getter;

import java.util.List;

/**
 * Serviços padrão da plataforma, com dependências e prioridades de inicialização.
 * <p>
 * As dependências de workspace são resolvidas primeiro contra a própria workspace, então
 * {@code workspace-manager} de uma workspace que depende de {@code mandrake-manager} cai no global.
 */
@Getter
public enum StandardService {

    MANDRAKE_MANAGER("mandrake-manager", 100, List.of(), List.of()),
    WORKSPACE_MANAGER("workspace-manager", 50, List.of("mandrake-manager"), List.of("mandrake-manager")),
    MCP_MANAGER("mcp-manager", 25, List.of("mandrake-manager"), List.of("workspace-manager")),
    SESSION_COORDINATOR("session-coordinator", 10,
            List.of("mandrake-manager", "mcp-manager"),
            List.of("workspace-manager", "mcp-manager"));

    private final String type;
    private final int priority;
    private final List<String> globalDependencies;
    private final List<String> workspaceDependencies;

    StandardService(String type, int priority, List<String> globalDependencies, List<String> workspaceDependencies) {
        this.type = type;
        this.priority = priority;
        this.globalDependencies = globalDependencies;
        this.workspaceDependencies = workspaceDependencies;
    }

    public ServiceOptions globalOptions() {
        return ServiceOptions.builder()
                .dependencies(globalDependencies)
                .initializationPriority(priority)
                .metadataEntry("standard", true)
                .build();
    }

    public ServiceOptions workspaceOptions() {
        return ServiceOptions.builder()
                .dependencies(workspaceDependencies)
                .initializationPriority(priority)
                .metadataEntry("standard", true)
                .build();
    }

    public static StandardService fromType(String type) {
        for (StandardService service : values()) {
            if (service.type.equals(type)) {
                return service;
            }
        }
        return null;
    }
}
