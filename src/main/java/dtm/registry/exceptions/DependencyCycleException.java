package dtm.registry.exceptions;

import dtm.registry.storage.ServiceKey;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Lançada quando o grafo de dependências contém um ciclo.
 * <p>
 * É sempre um erro de configuração: o ciclo é detectado antes de qualquer
 * chamada a {@code init()} e nunca é resolvido silenciosamente.
 */
@Getter
public class DependencyCycleException extends ServiceRegistryException {

    private final ServiceKey offendingKey;
    private final List<ServiceKey> cyclePath;

    public DependencyCycleException(ServiceKey offendingKey, List<ServiceKey> cyclePath) {
        super(buildMessage(offendingKey, cyclePath));
        this.offendingKey = offendingKey;
        this.cyclePath = List.copyOf(cyclePath);
    }

    private static String buildMessage(ServiceKey offendingKey, List<ServiceKey> cyclePath) {
        String path = cyclePath.stream()
                .map(ServiceKey::toString)
                .collect(Collectors.joining(" → "));
        return "Ciclo de dependência detectado em: " + offendingKey + " (caminho: " + path + ")";
    }
}
