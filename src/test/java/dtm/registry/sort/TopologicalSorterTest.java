package dtm.registry.sort;

import dtm.registry.exceptions.DependencyCycleException;
import dtm.registry.fixtures.RecordingService;
import dtm.registry.prototypes.ServiceOptions;
import dtm.registry.storage.ServiceKey;
import dtm.registry.storage.ServiceRegistrationStore;
import dtm.registry.storage.graph.ServiceDependencyGraphBuilder;
import dtm.registry.storage.graph.ServiceGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopologicalSorterTest {

    private ServiceRegistrationStore store;

    @BeforeEach
    void setUp() {
        store = new ServiceRegistrationStore();
    }

    private void global(String type, ServiceOptions options) {
        store.putInstance(ServiceKey.global(type), new RecordingService(type, new ArrayList<>()), options);
    }

    private List<ServiceKey> sort() {
        ServiceGraph graph = new ServiceDependencyGraphBuilder(store.snapshot()).buildGraph();
        return TopologicalSorter.sort(graph);
    }

    private static ServiceKey key(String type) {
        return ServiceKey.global(type);
    }

    @Test
    void diamondPutsSharedDependencyFirstAndJoinLast() {
        global("d", ServiceOptions.dependsOn("b", "c"));
        global("b", ServiceOptions.dependsOn("a"));
        global("c", ServiceOptions.dependsOn("a"));
        global("a", null);

        List<ServiceKey> order = sort();

        assertThat(order).hasSize(4);
        assertThat(order.get(0)).isEqualTo(key("a"));
        assertThat(order.get(3)).isEqualTo(key("d"));
    }

    @Test
    void priorityNeverOvertakesADependency() {
        global("c", ServiceOptions.withPriority(10));
        global("b", ServiceOptions.withPriority(50, "a"));
        global("a", ServiceOptions.withPriority(0));

        assertThat(sort()).containsExactly(key("c"), key("a"), key("b"));
    }

    @Test
    void higherPriorityDependentJumpsAheadOnceUnblocked() {
        global("a", ServiceOptions.withPriority(2));
        global("y", ServiceOptions.withPriority(1));
        global("b", ServiceOptions.withPriority(50, "a"));

        assertThat(sort()).containsExactly(key("a"), key("b"), key("y"));
    }

    @Test
    void negativePrioritiesSortLast() {
        global("late", ServiceOptions.withPriority(-1));
        global("normal", null);

        assertThat(sort()).containsExactly(key("normal"), key("late"));
    }

    @Test
    void depthFirstOrderIgnoresPriority() {
        global("p1", ServiceOptions.withPriority(1));
        global("p3", ServiceOptions.withPriority(3));
        ServiceGraph graph = new ServiceDependencyGraphBuilder(store.snapshot()).buildGraph();

        assertThat(TopologicalSorter.depthFirstOrder(graph)).containsExactly(key("p1"), key("p3"));
    }

    @Test
    void cycleReportsThePath() {
        global("a", ServiceOptions.dependsOn("b"));
        global("b", ServiceOptions.dependsOn("a"));

        assertThatThrownBy(this::sort)
                .isInstanceOfSatisfying(DependencyCycleException.class, e -> {
                    assertThat(e.getOffendingKey()).isEqualTo(key("a"));
                    assertThat(e.getCyclePath()).containsExactly(key("a"), key("b"), key("a"));
                    assertThat(e.getMessage()).contains("a → b → a");
                });
    }

    @Test
    void workspaceCycleThroughAliasIsDetected() {
        store.putInstance(ServiceKey.workspace("ws1", "a"), new RecordingService("ws1:a", new ArrayList<>()), ServiceOptions.dependsOn("b"));
        store.putInstance(ServiceKey.workspace("ws1", "b"), new RecordingService("ws1:b", new ArrayList<>()), ServiceOptions.dependsOn("a"));

        assertThatThrownBy(this::sort).isInstanceOf(DependencyCycleException.class);
    }

    @Test
    void emptyGraphSortsToEmptyList() {
        assertThat(sort()).isEmpty();
    }
}
