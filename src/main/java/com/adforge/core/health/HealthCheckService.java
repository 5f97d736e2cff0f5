package com.adforge.core.health;

import com.adforge.core.config.TaskCoreProperties;
import com.adforge.core.guard.BreakerRegistry;
import com.adforge.core.guard.BreakerState;
import com.adforge.core.job.JobStore;
import com.adforge.core.store.ItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final BreakerRegistry breakers;
    private final TaskCoreProperties properties;
    private final ItemStore itemStore;
    private final JobStore jobStore;
    private final DataSource dataSource;

    public HealthCheckService(
            BreakerRegistry breakers,
            TaskCoreProperties properties,
            @Autowired(required = false) ItemStore itemStore,
            @Autowired(required = false) JobStore jobStore,
            @Autowired(required = false) DataSource dataSource) {
        this.breakers = breakers;
        this.properties = properties;
        this.itemStore = itemStore;
        this.jobStore = jobStore;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkBreakers());
        results.add(checkProvider());
        results.add(checkItemStore());
        results.add(checkJobStore());
        if (dataSource != null) {
            results.add(checkDatabase());
        }
        return results;
    }

    HealthStatus checkBreakers() {
        Instant now = breakers.now();
        Map<String, String> open = new LinkedHashMap<>();
        for (BreakerState state : breakers.snapshot()) {
            if (state.isOpenAt(now)) {
                open.put(state.key(), state.openedUntil().toString());
            }
        }
        if (open.isEmpty()) {
            return new HealthStatus("breakers", HealthStatus.Status.UP,
                    "All circuit breakers closed", Map.of());
        }
        return new HealthStatus("breakers", HealthStatus.Status.DEGRADED,
                open.size() + " circuit breaker(s) open: " + String.join(", ", open.keySet()), open);
    }

    HealthStatus checkProvider() {
        var provider = properties.getProvider();
        var metadata = Map.of("baseUrl", String.valueOf(provider.getBaseUrl()));
        if (provider.getApiKey() == null || provider.getApiKey().isBlank()) {
            return new HealthStatus("provider", HealthStatus.Status.DOWN,
                    provider.getName() + " API key not configured (KIE_API_KEY)", metadata);
        }
        return new HealthStatus("provider", HealthStatus.Status.UP,
                provider.getName() + " credentials configured", metadata);
    }

    private HealthStatus checkItemStore() {
        if (itemStore == null) {
            return new HealthStatus("item-store", HealthStatus.Status.DOWN,
                    "No ItemStore configured", Map.of());
        }
        try {
            itemStore.listByBatch("__health__");
            return new HealthStatus("item-store", HealthStatus.Status.UP,
                    "ItemStore available (" + itemStore.getClass().getSimpleName() + ")", Map.of());
        } catch (Exception e) {
            log.warn("Item store health check failed: {}", e.getMessage());
            return new HealthStatus("item-store", HealthStatus.Status.DOWN,
                    "ItemStore error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkJobStore() {
        if (jobStore == null) {
            return new HealthStatus("job-store", HealthStatus.Status.DOWN,
                    "No JobStore configured", Map.of());
        }
        try {
            jobStore.recent(1);
            return new HealthStatus("job-store", HealthStatus.Status.UP,
                    "JobStore available (" + jobStore.getClass().getSimpleName() + ")", Map.of());
        } catch (Exception e) {
            log.warn("Job store health check failed: {}", e.getMessage());
            return new HealthStatus("job-store", HealthStatus.Status.DOWN,
                    "JobStore error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkDatabase() {
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }
}
