package dtm.registry.storage.graph;

import dtm.registry.prototypes.ServiceOptions;
import dtm.registry.storage.RegistrationSnapshot;
import dtm.registry.storage.ServiceKey;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Monta o {@link ServiceGraph} a partir de um {@link RegistrationSnapshot}.
 * <p>
 * Os nós são a união das instâncias vivas com as fábricas registradas (globais e específicas
 * de workspace), na ordem de registro. Chaves que aparecem apenas como dependência declarada
 * não viram nós; o {@link dtm.registry.sort.TopologicalSorter} avisa no log e ignora a aresta.
 */
@Slf4j
public class ServiceDependencyGraphBuilder {

    private final RegistrationSnapshot snapshot;
    private final Map<ServiceKey, List<String>> dependencies;
    private final Map<ServiceKey, ServiceOptions> options;

    public ServiceDependencyGraphBuilder(RegistrationSnapshot snapshot) {
        this.snapshot = snapshot;
        this.dependencies = new LinkedHashMap<>();
        this.options = new LinkedHashMap<>();
    }

    public ServiceGraph buildGraph() {
        extractLiveNodes();
        extractFactoryNodes();
        ServiceGraph graph = new ServiceGraph(dependencies, options);

        if (log.isDebugEnabled()) {
            graph.getDependencies().forEach((key, deps) ->
                    log.debug("  ✓ {} → {}", key, deps.isEmpty() ? "[SEM DEPENDÊNCIAS]" : deps));
        }
        return graph;
    }

    private void extractLiveNodes() {
        for (ServiceKey key : snapshot.instances().keySet()) {
            addNode(key);
        }
    }

    private void extractFactoryNodes() {
        for (ServiceKey key : snapshot.factoryKeys()) {
            if (!dependencies.containsKey(key)) {
                addNode(key);
            }
        }
    }

    private void addNode(ServiceKey key) {
        ServiceOptions nodeOptions = snapshot.optionsOf(key);
        dependencies.put(key, List.copyOf(nodeOptions.getDependencies()));
        options.put(key, nodeOptions);
    }
}
