package com.phillippitts.voicerelay.service.health;

import com.phillippitts.voicerelay.domain.ModelProfile;
import com.phillippitts.voicerelay.service.resilience.CircuitBreakerRegistry;
import com.phillippitts.voicerelay.service.resilience.CircuitSnapshot;
import com.phillippitts.voicerelay.service.resilience.CircuitState;
import com.phillippitts.voicerelay.service.routing.ModelCatalog;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Health indicator for the circuit breakers guarding the generation and synthesis services.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: All breakers closed</li>
 *   <li>DEGRADED: Some breakers open or half-open</li>
 *   <li>DOWN: Every generation model's breaker is open</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health as {@code circuitBreakers}.
 */
@Component("circuitBreakers")
public class CircuitBreakerHealthIndicator implements HealthIndicator {

    private final CircuitBreakerRegistry registry;
    private final ModelCatalog catalog;

    public CircuitBreakerHealthIndicator(CircuitBreakerRegistry registry, ModelCatalog catalog) {
        this.registry = registry;
        this.catalog = catalog;
    }

    @Override
    public Health health() {
        List<CircuitSnapshot> snapshots = registry.snapshots();
        Map<String, String> states = new TreeMap<>();
        snapshots.forEach(s -> states.put(s.target(), s.state().name()));

        boolean allModelsOpen = !catalog.all().isEmpty() && catalog.all().stream()
                .map(ModelProfile::id)
                .allMatch(id -> registry.state(id) == CircuitState.OPEN);
        long notClosed = snapshots.stream().filter(s -> s.state() != CircuitState.CLOSED).count();

        Health.Builder builder = new Health.Builder();
        if (allModelsOpen) {
            builder.down().withDetail("status", "Every generation model circuit is open");
        } else if (notClosed > 0) {
            builder.status("DEGRADED").withDetail("status", notClosed + " circuit(s) not closed");
        } else {
            builder.up().withDetail("status", "All circuits closed");
        }
        return builder.withDetail("circuits", states).build();
    }
}
