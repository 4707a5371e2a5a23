package dtm.registry.storage.lifecycle;

import dtm.registry.storage.ServiceKey;

import java.util.ArrayList;
import java.util.List;

/**
 * Tempo gasto em cada serviço de uma varredura, na ordem de visita, com o resultado.
 * Usado só pela thread que conduz a varredura.
 */
class SweepTimings {

    record Visit(ServiceKey key, long elapsedNanos, boolean failed) {
        double elapsedMillis() {
            return elapsedNanos / 1_000_000.0;
        }
    }

    private final String sweep;
    private final long startedAt;
    private final List<Visit> visits = new ArrayList<>();

    SweepTimings(String sweep) {
        this.sweep = sweep;
        this.startedAt = System.nanoTime();
    }

    /**
     * @param visitStartedAt valor de {@link System#nanoTime()} antes de chamar o serviço
     */
    void record(ServiceKey key, long visitStartedAt, boolean failed) {
        visits.add(new Visit(key, System.nanoTime() - visitStartedAt, failed));
    }

    List<Visit> visits() {
        return List.copyOf(visits);
    }

    long failures() {
        return visits.stream().filter(Visit::failed).count();
    }

    double totalMillis() {
        return (System.nanoTime() - startedAt) / 1_000_000.0;
    }

    String summary() {
        double total = totalMillis();
        StringBuilder out = new StringBuilder();
        out.append(String.format("%s: %d serviço(s), %d falha(s), %.3f ms",
                sweep, visits.size(), failures(), total));

        Visit slowest = null;
        for (Visit visit : visits) {
            out.append(String.format("%n   %-40s %9.3f ms%s",
                    visit.key(), visit.elapsedMillis(), visit.failed() ? "  [FALHOU]" : ""));
            if (slowest == null || visit.elapsedNanos() > slowest.elapsedNanos()) {
                slowest = visit;
            }
        }

        if (slowest != null) {
            out.append(String.format("%n   mais lento: %s", slowest.key()));
        }
        return out.toString();
    }
}
