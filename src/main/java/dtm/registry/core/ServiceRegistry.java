package dtm.registry.core;

import dtm.registry.exceptions.CompositeCleanupException;
import dtm.registry.exceptions.DependencyCycleException;
import dtm.registry.exceptions.RegistryStateException;
import dtm.registry.exceptions.ServiceInitializationException;

/**
 * Registro de serviços com ciclo de vida ordenado por dependências.
 *
 * Estende as interfaces:
 * <ul>
 *   <li>{@link ServiceRegistryGetter} - para consulta de serviços e status;</li>
 *   <li>{@link ServiceRegistryRegistor} - para registro de serviços e fábricas.</li>
 * </ul>
 * Os registros devem ser feitos antes de {@link #initializeServices()}; registrar durante
 * uma varredura não é suportado.
 */
public interface ServiceRegistry extends
        ServiceRegistryGetter,
        ServiceRegistryRegistor,
        AutoCloseable
{
    /**
     * Inicializa todos os serviços vivos na ordem de dependências: primeiro os globais,
     * depois os de cada workspace.
     *
     * @throws RegistryStateException          se o registro já foi inicializado
     * @throws DependencyCycleException        se o grafo tiver um ciclo; nenhum {@code init()} é chamado
     * @throws ServiceInitializationException  na primeira falha de inicialização; não há rollback
     */
    void initializeServices();

    /**
     * Limpa todos os serviços na ordem inversa: primeiro os de workspace, depois os globais.
     * Falhas individuais não interrompem a varredura.
     *
     * @throws CompositeCleanupException ao final, se algum serviço falhou na limpeza
     */
    void cleanupServices();

    /**
     * Indica se {@link #initializeServices()} terminou com sucesso e ainda não houve limpeza.
     *
     * @return true se o registro está iniciado
     */
    boolean isStarted();

    /**
     * Libera os recursos próprios do registro (executor de inicialização em segundo plano).
     * Não limpa os serviços.
     */
    @Override
    void close();
}
