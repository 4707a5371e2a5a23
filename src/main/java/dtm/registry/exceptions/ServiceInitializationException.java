package dtm.registry.exceptions;

import dtm.registry.storage.ServiceKey;
import lombok.Getter;

@Getter
public class ServiceInitializationException extends ServiceRegistryException {
    private final ServiceKey serviceKey;

    public ServiceInitializationException(ServiceKey serviceKey, Throwable th){
        super("Serviço " + serviceKey + " falhou ao inicializar: " + (th != null ? th.getMessage() : "causa desconhecida"), th);
        this.serviceKey = serviceKey;
    }
}
