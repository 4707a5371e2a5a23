package dtm.registry.prototypes;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Map;

/**
 * Fotografia da saúde de um serviço.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class ServiceStatus {

    private final boolean healthy;
    private final Integer statusCode;
    private final String message;

    @Singular("detail")
    private final Map<String, Object> details;

    public static ServiceStatus healthy(String message) {
        return ServiceStatus.builder()
                .healthy(true)
                .statusCode(200)
                .message(message)
                .build();
    }

    public static ServiceStatus unhealthy(String message) {
        return ServiceStatus.builder()
                .healthy(false)
                .statusCode(503)
                .message(message)
                .build();
    }

    public static ServiceStatus failed(Throwable cause) {
        return ServiceStatus.builder()
                .healthy(false)
                .statusCode(500)
                .message("Falha ao obter status: " + (cause != null ? cause.getMessage() : "causa desconhecida"))
                .detail("error", cause != null ? cause.getClass().getName() : "unknown")
                .build();
    }
}
