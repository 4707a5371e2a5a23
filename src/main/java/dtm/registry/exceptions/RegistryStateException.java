package dtm.registry.exceptions;

public class RegistryStateException extends ServiceRegistryException {

    public RegistryStateException(String message) {
        super(message);
    }

}
