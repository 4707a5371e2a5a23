package dtm.registry.storage.graph;

import dtm.registry.fixtures.RecordingService;
import dtm.registry.prototypes.ServiceOptions;
import dtm.registry.storage.ServiceKey;
import dtm.registry.storage.ServiceRegistrationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceGraphTest {

    private ServiceRegistrationStore store;

    @BeforeEach
    void setUp() {
        store = new ServiceRegistrationStore();
    }

    private ServiceGraph build() {
        return new ServiceDependencyGraphBuilder(store.snapshot()).buildGraph();
    }

    private RecordingService service(String name) {
        return new RecordingService(name, new ArrayList<>());
    }

    @Test
    void workspaceDependencyPrefersSameWorkspace() {
        ServiceKey worker = ServiceKey.workspace("ws1", "worker");
        store.putInstance(worker, service("worker"), ServiceOptions.dependsOn("config"));
        store.putInstance(ServiceKey.workspace("ws1", "config"), service("ws-config"), null);
        store.putInstance(ServiceKey.global("config"), service("config"), null);

        assertThat(build().resolveDependency(worker, "config")).isEqualTo(ServiceKey.workspace("ws1", "config"));
    }

    @Test
    void workspaceDependencyFallsBackToGlobal() {
        ServiceKey worker = ServiceKey.workspace("ws1", "worker");
        store.putInstance(worker, service("worker"), ServiceOptions.dependsOn("config"));
        store.putInstance(ServiceKey.workspace("ws2", "config"), service("ws2-config"), null);
        store.putInstance(ServiceKey.global("config"), service("config"), null);

        assertThat(build().resolveDependency(worker, "config")).isEqualTo(ServiceKey.global("config"));
    }

    @Test
    void aliasingAlsoSeesWorkspaceFactories() {
        ServiceKey worker = ServiceKey.workspace("ws1", "worker");
        store.putInstance(worker, service("worker"), ServiceOptions.dependsOn("config"));
        store.putFactory(ServiceKey.workspace("ws1", "config"), () -> service("ws-config"), null);

        ServiceGraph graph = build();

        assertThat(graph.resolveDependency(worker, "config")).isEqualTo(ServiceKey.workspace("ws1", "config"));
        assertThat(graph.contains(ServiceKey.workspace("ws1", "config"))).isTrue();
    }

    @Test
    void globalNodeNeverAliases() {
        ServiceKey core = ServiceKey.global("core");
        store.putInstance(core, service("core"), ServiceOptions.dependsOn("config"));
        store.putInstance(ServiceKey.workspace("ws1", "config"), service("ws-config"), null);

        assertThat(build().resolveDependency(core, "config")).isEqualTo(ServiceKey.global("config"));
    }

    @Test
    void qualifiedDependencyIsUsedAsGiven() {
        ServiceKey worker = ServiceKey.workspace("ws1", "worker");
        store.putInstance(worker, service("worker"), ServiceOptions.dependsOn("ws1:config"));
        store.putInstance(ServiceKey.global("config"), service("config"), null);

        assertThat(build().resolveDependency(worker, "ws1:config")).isEqualTo(ServiceKey.workspace("ws1", "config"));
    }

    @Test
    void unknownDependenciesDoNotBecomeNodes() {
        store.putInstance(ServiceKey.global("core"), service("core"), ServiceOptions.dependsOn("ghost"));

        ServiceGraph graph = build();

        assertThat(graph.nodes()).containsExactly(ServiceKey.global("core"));
        assertThat(graph.contains(graph.resolveDependency(ServiceKey.global("core"), "ghost"))).isFalse();
    }

    @Test
    void liveInstanceOptionsOverrideFactoryOptions() {
        ServiceKey db = ServiceKey.global("db");
        store.putFactory(db, () -> service("db"), ServiceOptions.withPriority(1, "a"));
        store.putInstance(db, service("db"), ServiceOptions.withPriority(9));

        ServiceGraph graph = build();

        assertThat(graph.nodes()).containsExactly(db);
        assertThat(graph.priorityOf(db)).isEqualTo(9);
        assertThat(graph.dependenciesOf(db)).isEmpty();
    }
}
