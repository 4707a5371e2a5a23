package dtm.registry.common;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dados para montar um adaptador a partir do objeto que ele envolve.
 *
 * @param <U> tipo do objeto envolvido
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ServiceCreationOptions<U> {

    private final U instance;

    @Singular("option")
    private final Map<String, Object> options;

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;

    /**
     * Se presente, o adaptador é registrado no escopo desta workspace.
     */
    private final String workspaceId;

    public boolean hasWorkspaceId() {
        return workspaceId != null && !workspaceId.isBlank();
    }

    /**
     * Opções, metadados e {@code workspaceId}, nessa ordem; chaves repetidas ficam com o último valor.
     */
    public Map<String, Object> adapterOptions() {
        Map<String, Object> merged = new LinkedHashMap<>(options);
        merged.putAll(metadata);
        if (hasWorkspaceId()) {
            merged.put("workspaceId", workspaceId);
        }
        return merged;
    }

    public ServiceCreationOptions<U> withWorkspaceId(String workspaceId) {
        return this.toBuilder().workspaceId(workspaceId).build();
    }
}
