package com.presentos.core.health;

import com.presentos.core.config.RouterProperties;
import com.presentos.core.model.HandlerKind;
import com.presentos.core.persistence.PersistenceGateway;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reports whether each collaborator the router depends on is configured.
 * Checks configuration only; no collaborator is called.
 */
@Service
public class HealthCheckService {

    private final RouterProperties properties;
    private final PersistenceGateway persistence;
    private final String classifierApiKey;

    public HealthCheckService(RouterProperties properties,
                              @Autowired(required = false) PersistenceGateway persistence,
                              @Value("${spring.ai.openai.api-key:}") String classifierApiKey) {
        this.properties = properties;
        this.persistence = persistence;
        this.classifierApiKey = classifierApiKey;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkClassifier());
        results.add(checkStore());
        results.add(checkHandlers());
        return results;
    }

    private HealthStatus checkClassifier() {
        if (classifierApiKey == null || classifierApiKey.isBlank() || "not-set".equals(classifierApiKey)) {
            return HealthStatus.down("classifier", "No classifier API key configured", Map.of());
        }
        return HealthStatus.up("classifier", "Classifier API key configured", Map.of());
    }

    private HealthStatus checkStore() {
        if (persistence == null || !persistence.isConfigured()) {
            return HealthStatus.down("store", "Task store not configured", Map.of());
        }
        return HealthStatus.up("store", "Task store configured", Map.of("database", properties.getNotion().getDatabaseId()));
    }

    private HealthStatus checkHandlers() {
        var metadata = new LinkedHashMap<String, String>();
        int configured = 0;
        for (HandlerKind kind : HandlerKind.values()) {
            boolean ok = properties.getHandlers().forKind(kind).isConfigured();
            metadata.put(kind.name().toLowerCase(Locale.ROOT), ok ? "configured" : "missing");
            if (ok) {
                configured++;
            }
        }
        if (configured == HandlerKind.values().length) {
            return HealthStatus.up("handlers", "All handlers configured", metadata);
        }
        if (configured == 0) {
            return HealthStatus.down("handlers", "No handler URLs configured", metadata);
        }
        return HealthStatus.degraded("handlers", configured + "/" + HandlerKind.values().length + " handlers configured", metadata);
    }
}
