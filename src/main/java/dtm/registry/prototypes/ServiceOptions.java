package dtm.registry.prototypes;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Opções de registro de um serviço.
 * <p>
 * {@code dependencies} lista os tipos dos quais o serviço depende. Para um serviço de workspace,
 * cada tipo é resolvido primeiro contra a própria workspace e, na ausência, contra o serviço global
 * de mesmo tipo. {@code initializationPriority} desempata serviços independentes: maior inicializa antes.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class ServiceOptions {

    public static final ServiceOptions DEFAULT = ServiceOptions.builder().build();

    @Singular
    private final List<String> dependencies;

    private final int initializationPriority;

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;

    public static ServiceOptions dependsOn(String... dependencies) {
        return ServiceOptions.builder()
                .dependencies(List.of(dependencies))
                .build();
    }

    public static ServiceOptions withPriority(int initializationPriority, String... dependencies) {
        return ServiceOptions.builder()
                .dependencies(List.of(dependencies))
                .initializationPriority(initializationPriority)
                .build();
    }
}
