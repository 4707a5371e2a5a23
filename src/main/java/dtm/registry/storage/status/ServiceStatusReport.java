package dtm.registry.storage.status;

import dtm.registry.prototypes.ServiceStatus;
import dtm.registry.storage.ServiceKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Linhas planas de status, no formato consumido pelo endpoint de operação:
 * tipo, workspace, saúde, código e mensagem.
 */
public record ServiceStatusReport(List<Row> rows) {

    public record Row(String key, String type, String workspaceId, boolean healthy, Integer statusCode, String message) {}

    public static ServiceStatusReport from(Map<String, ServiceStatus> statuses) {
        List<Row> rows = new ArrayList<>(statuses.size());
        for (Map.Entry<String, ServiceStatus> entry : statuses.entrySet()) {
            String key = entry.getKey();
            ServiceStatus status = entry.getValue();

            int separator = key.lastIndexOf(ServiceKey.SCOPE_SEPARATOR);
            String workspaceId = separator > 0 ? key.substring(0, separator) : null;
            String type = separator > 0 ? key.substring(separator + 1) : key;

            rows.add(new Row(key, type, workspaceId, status.isHealthy(), status.getStatusCode(), status.getMessage()));
        }
        return new ServiceStatusReport(Collections.unmodifiableList(rows));
    }

    public boolean allHealthy() {
        return rows.stream().allMatch(Row::healthy);
    }

    public long unhealthyCount() {
        return rows.stream().filter(row -> !row.healthy()).count();
    }
}
