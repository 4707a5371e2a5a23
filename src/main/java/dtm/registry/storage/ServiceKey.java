package dtm.registry.storage;

import lombok.NonNull;

import java.util.Objects;

/**
 * Chave de um serviço no registro: escopo, workspace (apenas no escopo
 * {@link ServiceScope#WORKSPACE}) e tipo.
 * <p>
 * A igualdade é estrutural. A forma textual ({@code tipo} ou {@code workspace:tipo})
 * aparece nos logs, nas chaves do mapa de status e nas dependências qualificadas.
 * Tipos não podem conter {@code ':'}; ids de workspace podem.
 */
public record ServiceKey(ServiceScope scope, String workspaceId, String type) {

    public static final String SCOPE_SEPARATOR = ":";

    public ServiceKey {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(type, "type");
        if (scope == ServiceScope.GLOBAL && workspaceId != null) {
            throw new IllegalArgumentException("Chave global não aceita workspaceId: " + workspaceId);
        }
        if (scope == ServiceScope.WORKSPACE && workspaceId == null) {
            throw new IllegalArgumentException("Chave de workspace exige workspaceId para o tipo: " + type);
        }
    }

    public static ServiceKey global(@NonNull String type) {
        return new ServiceKey(ServiceScope.GLOBAL, null, type);
    }

    public static ServiceKey workspace(@NonNull String workspaceId, @NonNull String type) {
        return new ServiceKey(ServiceScope.WORKSPACE, workspaceId, type);
    }

    /**
     * Lê uma dependência qualificada {@code workspace:tipo}. Tipos nunca contêm o separador,
     * então o último {@code ':'} separa workspace e tipo mesmo que o id contenha {@code ':'}.
     *
     * @return a chave de workspace, ou {@code null} se a dependência não for qualificada
     */
    public static ServiceKey parseQualified(String dependency) {
        int separator = dependency.lastIndexOf(SCOPE_SEPARATOR);
        if (separator <= 0 || separator == dependency.length() - 1) {
            return null;
        }
        return workspace(dependency.substring(0, separator), dependency.substring(separator + 1));
    }

    public boolean isGlobal() {
        return scope == ServiceScope.GLOBAL;
    }

    public boolean isWorkspace() {
        return scope == ServiceScope.WORKSPACE;
    }

    public boolean belongsTo(String otherWorkspaceId) {
        return isWorkspace() && workspaceId.equals(otherWorkspaceId);
    }

    /**
     * Mesma workspace, outro tipo. Usado na resolução de alias das dependências.
     */
    public ServiceKey sibling(String otherType) {
        return isGlobal() ? global(otherType) : workspace(workspaceId, otherType);
    }

    @Override
    public String toString() {
        return isGlobal() ? type : workspaceId + SCOPE_SEPARATOR + type;
    }
}
