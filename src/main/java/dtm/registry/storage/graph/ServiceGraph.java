package dtm.registry.storage.graph;

import dtm.registry.prototypes.ServiceOptions;
import dtm.registry.storage.ServiceKey;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Grafo de dependências dos serviços: cada nó é uma {@link ServiceKey} e aponta para a
 * lista de tipos declarados em {@link ServiceOptions#getDependencies()}.
 * <p>
 * As arestas guardam o tipo declarado, não a chave de destino: a resolução acontece
 * aresta a aresta durante a travessia, via {@link #resolveDependency(ServiceKey, String)}.
 */
@Getter
public class ServiceGraph {

    private final Map<ServiceKey, List<String>> dependencies;
    private final Map<ServiceKey, ServiceOptions> options;

    public ServiceGraph(Map<ServiceKey, List<String>> dependencies, Map<ServiceKey, ServiceOptions> options) {
        this.dependencies = Collections.unmodifiableMap(dependencies);
        this.options = Collections.unmodifiableMap(options);
    }

    public Set<ServiceKey> nodes() {
        return dependencies.keySet();
    }

    public boolean contains(ServiceKey key) {
        return dependencies.containsKey(key);
    }

    public List<String> dependenciesOf(ServiceKey key) {
        return dependencies.getOrDefault(key, List.of());
    }

    public int priorityOf(ServiceKey key) {
        ServiceOptions nodeOptions = options.get(key);
        return nodeOptions != null ? nodeOptions.getInitializationPriority() : 0;
    }

    /**
     * Resolve a dependência {@code dependency} declarada por {@code node}.
     * <ul>
     *     <li>{@code workspace:tipo} explícito aponta sempre para aquela chave (o registro só
     *     aceita a forma qualificada para a própria workspace do nó);</li>
     *     <li>em um nó de workspace, {@code tipo} aponta para o serviço da mesma workspace
     *     se ele existir no grafo, senão para o serviço global;</li>
     *     <li>em um nó global, {@code tipo} aponta para o serviço global.</li>
     * </ul>
     * O destino pode não existir no grafo; quem percorre decide o que fazer.
     */
    public ServiceKey resolveDependency(ServiceKey node, String dependency) {
        ServiceKey explicit = ServiceKey.parseQualified(dependency);
        if (explicit != null) {
            return explicit;
        }

        if (node.isWorkspace()) {
            ServiceKey alias = node.sibling(dependency);
            if (contains(alias)) {
                return alias;
            }
        }
        return ServiceKey.global(dependency);
    }
}
