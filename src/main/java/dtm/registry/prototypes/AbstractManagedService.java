package dtm.registry.prototypes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base para adaptadores de {@link ManagedService}.
 * <p>
 * Cuida da idempotência de {@link #init()} e {@link #cleanup()} e garante que o estado de
 * inicializado volte a {@code false} mesmo quando {@link #doCleanup()} falha.
 * Subclasses implementam {@link #doInit()} e {@link #doCleanup()}.
 */
public abstract class AbstractManagedService implements ManagedService {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final String serviceName;
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicReference<CompletableFuture<Void>> initialization = new AtomicReference<>();

    protected AbstractManagedService(String serviceName) {
        this.serviceName = serviceName;
    }

    protected abstract void doInit() throws Exception;

    protected abstract void doCleanup() throws Exception;

    /**
     * Detalhes adicionais expostos no status. Padrão: vazio.
     */
    protected Map<String, Object> statusDetails() {
        return Map.of();
    }

    /**
     * Chamadas concorrentes recebem o mesmo futuro: {@link #doInit()} roda uma única vez
     * até a próxima limpeza. Uma falha libera a próxima chamada para tentar de novo.
     */
    @Override
    public CompletableFuture<Void> init() {
        CompletableFuture<Void> pending = new CompletableFuture<>();
        CompletableFuture<Void> current = initialization.compareAndExchange(null, pending);
        if (current != null) {
            log.debug("Serviço '{}' já inicializado ou em inicialização", serviceName);
            return current;
        }

        try {
            log.debug("Inicializando serviço '{}'", serviceName);
            doInit();
            initialized.set(true);
            log.debug("Serviço '{}' inicializado", serviceName);
            pending.complete(null);
        } catch (Exception e) {
            log.error("Falha ao inicializar serviço '{}': {}", serviceName, e.getMessage());
            initialization.set(null);
            pending.completeExceptionally(e);
        }
        return pending;
    }

    @Override
    public boolean isInitialized() {
        return initialized.get();
    }

    @Override
    public CompletableFuture<Void> cleanup() {
        if (!initialized.get()) {
            log.debug("Serviço '{}' não inicializado, nada a limpar", serviceName);
            return CompletableFuture.completedFuture(null);
        }

        try {
            log.debug("Limpando serviço '{}'", serviceName);
            doCleanup();
            log.debug("Serviço '{}' limpo", serviceName);
            return CompletableFuture.completedFuture(null);
        } catch (Exception e) {
            log.error("Falha ao limpar serviço '{}': {}", serviceName, e.getMessage());
            return CompletableFuture.failedFuture(e);
        } finally {
            initialized.set(false);
            initialization.set(null);
        }
    }

    @Override
    public CompletableFuture<ServiceStatus> getStatus() {
        boolean healthy = initialized.get();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("name", serviceName);
        details.put("initialized", healthy);
        details.putAll(statusDetails());

        return CompletableFuture.completedFuture(ServiceStatus.builder()
                .healthy(healthy)
                .statusCode(healthy ? 200 : 503)
                .message(healthy
                        ? "Serviço " + serviceName + " saudável"
                        : "Serviço " + serviceName + " não inicializado")
                .details(details)
                .build());
    }
}
