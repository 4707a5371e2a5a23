package dtm.registry.exceptions;

import dtm.registry.storage.ServiceKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Erro agregado do {@code cleanupServices()}: reúne todas as falhas de limpeza
 * coletadas durante a varredura, na ordem em que ocorreram.
 */
public class CompositeCleanupException extends ServiceRegistryException {

    private final List<Throwable> errors = new CopyOnWriteArrayList<>();
    private final Map<ServiceKey, Throwable> errorsByService = Collections.synchronizedMap(new LinkedHashMap<>());

    public CompositeCleanupException() {
        super("Alguns serviços falharam durante a limpeza.");
    }

    public CompositeCleanupException(String message) {
        super(message);
    }

    public void addError(ServiceKey serviceKey, Throwable error) {
        if (error != null) {
            this.errors.add(error);
            this.addSuppressed(error);
            if (serviceKey != null) {
                this.errorsByService.put(serviceKey, error);
            }
        }
    }

    public List<Throwable> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public Map<ServiceKey, Throwable> getErrorsByService() {
        synchronized (errorsByService) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(errorsByService));
        }
    }

    public int getErrorsSize() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasError(Class<? extends Throwable> type) {
        return errors.stream().anyMatch(type::isInstance);
    }

    public Throwable getFirstError() {
        if (errors.isEmpty()) return null;
        return errors.get(0);
    }

    @Override
    public String getMessage() {
        if (errors.isEmpty()) {
            return super.getMessage();
        }

        String detailedErrors = errors.stream()
                .map(e -> String.format("[%s]: %s", e.getClass().getSimpleName(), e.getMessage()))
                .collect(Collectors.joining("\n  -> "));

        return super.getMessage() + "\nErros acumulados:\n  -> " + detailedErrors;
    }

}
