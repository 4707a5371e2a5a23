package dtm.registry.prototypes;

import java.util.concurrent.CompletableFuture;

/**
 * Contrato de todo serviço supervisionado pelo registro.
 * <p>
 * O registro só conhece os serviços através desta interface: gerenciadores de workspace,
 * gateways de ferramentas e coordenadores de sessão entram no registro por meio de
 * adaptadores que a implementam explicitamente.
 *
 * <ul>
 *     <li>{@link #init()} é idempotente: uma segunda chamada em uma instância já
 *     inicializada não faz nada;</li>
 *     <li>{@link #isInitialized()} é síncrono e sem efeitos colaterais;</li>
 *     <li>{@link #cleanup()} é idempotente e deve zerar o estado de inicializado
 *     mesmo se alguma etapa interna falhar;</li>
 *     <li>{@link #getStatus()} não deve falhar; falhas são convertidas em status
 *     não saudável pelo agregador de qualquer forma.</li>
 * </ul>
 */
public interface ManagedService {

    /**
     * Inicializa o serviço, criando os recursos necessários.
     *
     * @return futuro concluído quando o serviço estiver pronto, ou concluído
     * excepcionalmente se a inicialização falhar.
     */
    CompletableFuture<Void> init();

    /**
     * @return {@code true} se o serviço foi inicializado com sucesso e ainda não foi limpo.
     */
    boolean isInitialized();

    /**
     * Libera os recursos do serviço.
     *
     * @return futuro concluído quando a limpeza terminar.
     */
    CompletableFuture<Void> cleanup();

    /**
     * Consulta assíncrona de saúde do serviço.
     *
     * @return futuro com o status atual.
     */
    CompletableFuture<ServiceStatus> getStatus();
}
