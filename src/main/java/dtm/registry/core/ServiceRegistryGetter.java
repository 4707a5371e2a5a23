package dtm.registry.core;

import dtm.registry.prototypes.ManagedService;
import dtm.registry.prototypes.ServiceStatus;

import java.util.Map;

/**
 * Interface responsável por fornecer acesso aos serviços registrados.
 * <p>
 * Uma consulta sem resultado não é erro: os métodos retornam {@code null}. Quando não há
 * instância viva mas existe uma fábrica, o serviço é criado e registrado na hora; se o
 * registro já foi inicializado, o {@code init()} da nova instância é disparado em segundo
 * plano e o serviço é devolvido sem esperar. Quem chama deve conferir
 * {@link ManagedService#isInitialized()} antes de depender dos efeitos da inicialização.
 */
public interface ServiceRegistryGetter {

    /**
     * Obtém um serviço global.
     *
     * @param type tipo do serviço
     * @return a instância, ou {@code null} se não houver instância nem fábrica
     */
    ManagedService getService(String type);

    /**
     * Obtém um serviço global já convertido para o tipo esperado.
     *
     * @param type      tipo do serviço
     * @param reference classe esperada
     * @return a instância, ou {@code null} se não encontrada ou de outra classe
     */
    <T extends ManagedService> T getService(String type, Class<T> reference);

    /**
     * Obtém um serviço de workspace.
     *
     * @param workspaceId id da workspace
     * @param type        tipo do serviço
     * @return a instância, ou {@code null} se não houver instância nem fábrica aplicável
     */
    ManagedService getWorkspaceService(String workspaceId, String type);

    <T extends ManagedService> T getWorkspaceService(String workspaceId, String type, Class<T> reference);

    /**
     * Consulta o status de um serviço global.
     *
     * @param type tipo do serviço
     * @return o status, ou {@code null} se o serviço não existir
     */
    ServiceStatus getServiceStatus(String type);

    /**
     * Consulta o status de um serviço. Com {@code workspaceId} nulo, consulta o serviço global.
     *
     * @param type        tipo do serviço
     * @param workspaceId id da workspace, ou {@code null}
     * @return o status, ou {@code null} se o serviço não existir
     */
    ServiceStatus getServiceStatus(String type, String workspaceId);

    /**
     * Status de todas as instâncias vivas (fábricas ainda não materializadas ficam de fora).
     *
     * @return mapa com chave {@code tipo} para serviços globais e {@code workspace:tipo} para os de workspace
     */
    Map<String, ServiceStatus> getAllServiceStatuses();
}
