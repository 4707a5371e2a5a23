package dtm.registry.core;

import dtm.registry.exceptions.InvalidServiceRegistrationException;
import dtm.registry.prototypes.ManagedService;
import dtm.registry.prototypes.ServiceOptions;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Interface para registro de serviços e fábricas no registro.
 * <p>
 * O registro apenas grava a intenção: nenhum serviço é inicializado aqui. Registrar de novo
 * uma chave existente sobrescreve a anterior (último a escrever vence) e emite um aviso no log.
 */
public interface ServiceRegistryRegistor {

    /**
     * Registra uma instância de serviço global.
     *
     * @param type     identificador do tipo do serviço
     * @param instance instância a ser registrada
     * @param options  opções de registro; pode ser {@code null}
     * @throws InvalidServiceRegistrationException se o tipo ou a instância forem inválidos
     */
    void registerService(String type, ManagedService instance, ServiceOptions options) throws InvalidServiceRegistrationException;

    /**
     * Registra uma instância de serviço global sem opções.
     *
     * @param type     identificador do tipo do serviço
     * @param instance instância a ser registrada
     */
    default void registerService(String type, ManagedService instance) throws InvalidServiceRegistrationException {
        registerService(type, instance, null);
    }

    /**
     * Registra uma instância de serviço pertencente a uma workspace.
     *
     * @param workspaceId id da workspace
     * @param type        identificador do tipo do serviço
     * @param instance    instância a ser registrada
     * @param options     opções de registro; pode ser {@code null}
     * @throws InvalidServiceRegistrationException se algum argumento for inválido
     */
    void registerWorkspaceService(String workspaceId, String type, ManagedService instance, ServiceOptions options) throws InvalidServiceRegistrationException;

    default void registerWorkspaceService(String workspaceId, String type, ManagedService instance) throws InvalidServiceRegistrationException {
        registerWorkspaceService(workspaceId, type, instance, null);
    }

    /**
     * Registra uma fábrica para criação preguiçosa de um serviço global.
     *
     * @param type    identificador do tipo do serviço
     * @param factory função que cria a instância na primeira consulta
     * @param options opções aplicadas à instância criada; pode ser {@code null}
     * @throws InvalidServiceRegistrationException se algum argumento for inválido
     */
    void registerServiceFactory(String type, Supplier<? extends ManagedService> factory, ServiceOptions options) throws InvalidServiceRegistrationException;

    default void registerServiceFactory(String type, Supplier<? extends ManagedService> factory) throws InvalidServiceRegistrationException {
        registerServiceFactory(type, factory, null);
    }

    /**
     * Registra uma fábrica para criação preguiçosa de um serviço de uma workspace específica.
     *
     * @param workspaceId id da workspace
     * @param type        identificador do tipo do serviço
     * @param factory     função que cria a instância na primeira consulta
     * @param options     opções aplicadas à instância criada; pode ser {@code null}
     * @throws InvalidServiceRegistrationException se algum argumento for inválido
     */
    void registerWorkspaceServiceFactory(String workspaceId, String type, Supplier<? extends ManagedService> factory, ServiceOptions options) throws InvalidServiceRegistrationException;

    default void registerWorkspaceServiceFactory(String workspaceId, String type, Supplier<? extends ManagedService> factory) throws InvalidServiceRegistrationException {
        registerWorkspaceServiceFactory(workspaceId, type, factory, null);
    }

    /**
     * Registra uma função de fábrica genérica, válida para qualquer workspace.
     * <p>
     * A função recebe o id da workspace e é chamada na primeira consulta de
     * {@code (workspaceId, type)} que não tenha instância nem fábrica específica.
     *
     * @param type      identificador do tipo do serviço
     * @param factoryFn função que cria a instância a partir do id da workspace
     * @param options   opções aplicadas a toda instância criada; pode ser {@code null}
     * @throws InvalidServiceRegistrationException se algum argumento for inválido
     */
    void registerWorkspaceFactoryFunction(String type, Function<String, ? extends ManagedService> factoryFn, ServiceOptions options) throws InvalidServiceRegistrationException;

    default void registerWorkspaceFactoryFunction(String type, Function<String, ? extends ManagedService> factoryFn) throws InvalidServiceRegistrationException {
        registerWorkspaceFactoryFunction(type, factoryFn, null);
    }
}
