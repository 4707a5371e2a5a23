package dtm.registry.exceptions;

import lombok.Getter;

@Getter
public class InvalidServiceRegistrationException extends ServiceRegistryException{
    private final String serviceType;

    public InvalidServiceRegistrationException(String message, String serviceType){
        super(message);
        this.serviceType = serviceType;
    }
}
