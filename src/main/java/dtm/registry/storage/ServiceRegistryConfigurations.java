package dtm.registry.storage;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Configurações do registro.
 * <p>
 * Sem timeouts (padrão), um serviço que trava no {@code init()} ou no {@code cleanup()} trava a
 * varredura inteira. Com timeout, o estouro conta como falha daquele serviço.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ServiceRegistryConfigurations {

    /**
     * Executor da inicialização em segundo plano dos serviços criados após a partida.
     * Se nulo, o registro cria e gerencia o próprio executor.
     */
    @ToString.Exclude
    private final ExecutorService lazyInitExecutor;

    private final Duration initTimeout;

    private final Duration cleanupTimeout;

    /**
     * Espera máxima por um {@code getStatus()}. Estourar vira status não saudável.
     */
    private final Duration statusTimeout;

    @Builder.Default
    private final boolean logInitializationOrder = true;

    public static ServiceRegistryConfigurations defaults() {
        return ServiceRegistryConfigurations.builder().build();
    }

    public boolean hasInitTimeout() {
        return initTimeout != null && !initTimeout.isNegative() && !initTimeout.isZero();
    }

    public boolean hasCleanupTimeout() {
        return cleanupTimeout != null && !cleanupTimeout.isNegative() && !cleanupTimeout.isZero();
    }
}
