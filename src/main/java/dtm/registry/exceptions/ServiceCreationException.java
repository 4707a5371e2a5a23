package dtm.registry.exceptions;

import dtm.registry.storage.ServiceKey;
import lombok.Getter;

@Getter
public class ServiceCreationException extends ServiceRegistryException {
    private final ServiceKey serviceKey;

    public ServiceCreationException(String message, ServiceKey serviceKey, Throwable th){
        super(message, th);
        this.serviceKey = serviceKey;
    }

    public ServiceCreationException(String message, ServiceKey serviceKey){
        super(message);
        this.serviceKey = serviceKey;
    }
}
