package dtm.registry.storage;

import dtm.registry.prototypes.ManagedService;
import dtm.registry.prototypes.ServiceOptions;

import java.util.Map;
import java.util.Set;

/**
 * Cópia do {@link ServiceRegistrationStore} em um instante, usada pelas varreduras.
 *
 * @param instances       instâncias vivas, na ordem de registro
 * @param instanceOptions opções das instâncias vivas
 * @param factoryKeys     chaves com fábrica registrada (globais e específicas de workspace)
 * @param factoryOptions  opções das fábricas
 * @param workspaceIds    workspaces com pelo menos uma instância viva, na ordem de registro
 */
public record RegistrationSnapshot(
        Map<ServiceKey, ManagedService> instances,
        Map<ServiceKey, ServiceOptions> instanceOptions,
        Set<ServiceKey> factoryKeys,
        Map<ServiceKey, ServiceOptions> factoryOptions,
        Set<String> workspaceIds
) {

    /**
     * Opções efetivas de uma chave: as da instância viva, senão as da fábrica.
     */
    public ServiceOptions optionsOf(ServiceKey key) {
        ServiceOptions options = instanceOptions.get(key);
        if (options == null) {
            options = factoryOptions.get(key);
        }
        return options != null ? options : ServiceOptions.DEFAULT;
    }
}
