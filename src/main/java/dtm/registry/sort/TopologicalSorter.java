package dtm.registry.sort;

import dtm.registry.exceptions.DependencyCycleException;
import dtm.registry.storage.ServiceKey;
import dtm.registry.storage.graph.ServiceGraph;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Ordenação topológica do {@link ServiceGraph}.
 * <p>
 * Primeiro uma DFS com três estados detecta ciclos e gera uma ordem válida; depois a ordem
 * é reordenada por prioridade decrescente, de forma estável e sem nunca colocar um serviço
 * antes de uma das suas dependências.
 */
@Slf4j
public class TopologicalSorter {

    private enum VisitState { VISITING, RESOLVED }

    private TopologicalSorter() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static List<ServiceKey> sort(ServiceGraph graph) {
        List<ServiceKey> dfsOrder = depthFirstOrder(graph);
        return applyPriority(graph, dfsOrder);
    }

    /**
     * Ordem topológica pura, sem prioridade.
     *
     * @throws DependencyCycleException se algum nó depender, direta ou indiretamente, de si mesmo
     */
    public static List<ServiceKey> depthFirstOrder(ServiceGraph graph) {
        Map<ServiceKey, VisitState> states = new HashMap<>();
        Deque<ServiceKey> path = new ArrayDeque<>();
        List<ServiceKey> ordered = new ArrayList<>();

        for (ServiceKey node : graph.nodes()) {
            if (!states.containsKey(node)) {
                topologicalSortVisit(node, graph, states, path, ordered);
            }
        }

        return ordered;
    }

    private static void topologicalSortVisit(ServiceKey node,
                                             ServiceGraph graph,
                                             Map<ServiceKey, VisitState> states,
                                             Deque<ServiceKey> path,
                                             List<ServiceKey> ordered) {
        VisitState state = states.get(node);
        if (state == VisitState.VISITING) {
            throw new DependencyCycleException(node, cyclePath(path, node));
        }

        if (state == VisitState.RESOLVED) return;

        states.put(node, VisitState.VISITING);
        path.addLast(node);

        for (String dependency : graph.dependenciesOf(node)) {
            ServiceKey target = graph.resolveDependency(node, dependency);
            if (!graph.contains(target)) {
                log.warn("Serviço {} depende de serviço não registrado: {}", node, dependency);
                continue;
            }
            topologicalSortVisit(target, graph, states, path, ordered);
        }

        path.removeLast();
        states.put(node, VisitState.RESOLVED);
        ordered.add(node);
    }

    private static List<ServiceKey> cyclePath(Deque<ServiceKey> path, ServiceKey repeated) {
        List<ServiceKey> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (ServiceKey key : path) {
            if (key.equals(repeated)) inCycle = true;
            if (inCycle) cycle.add(key);
        }
        cycle.add(repeated);
        return cycle;
    }

    /**
     * Ordenação estável por prioridade decrescente restrita às dependências: a cada passo
     * entra o nó de maior prioridade cujas dependências já foram colocadas; empates seguem
     * a ordem da DFS.
     */
    private static List<ServiceKey> applyPriority(ServiceGraph graph, List<ServiceKey> dfsOrder) {
        Map<ServiceKey, Integer> dfsIndex = new HashMap<>();
        for (int i = 0; i < dfsOrder.size(); i++) {
            dfsIndex.put(dfsOrder.get(i), i);
        }

        Map<ServiceKey, Set<ServiceKey>> dependents = new HashMap<>();
        Map<ServiceKey, Integer> pending = new HashMap<>();

        for (ServiceKey node : dfsOrder) {
            Set<ServiceKey> targets = new LinkedHashSet<>();
            for (String dependency : graph.dependenciesOf(node)) {
                ServiceKey target = graph.resolveDependency(node, dependency);
                if (graph.contains(target) && !target.equals(node)) {
                    targets.add(target);
                }
            }
            pending.put(node, targets.size());
            for (ServiceKey target : targets) {
                dependents.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(node);
            }
        }

        PriorityQueue<ServiceKey> ready = new PriorityQueue<>(
                Comparator.comparingInt((ServiceKey key) -> graph.priorityOf(key)).reversed()
                        .thenComparingInt(dfsIndex::get)
        );

        for (ServiceKey node : dfsOrder) {
            if (pending.get(node) == 0) {
                ready.add(node);
            }
        }

        List<ServiceKey> ordered = new ArrayList<>(dfsOrder.size());
        while (!ready.isEmpty()) {
            ServiceKey next = ready.poll();
            ordered.add(next);

            for (ServiceKey dependent : dependents.getOrDefault(next, Set.of())) {
                int remaining = pending.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        return ordered;
    }

}
