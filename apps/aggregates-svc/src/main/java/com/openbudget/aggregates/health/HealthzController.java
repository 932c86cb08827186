package com.openbudget.aggregates.health;

import com.openbudget.aggregates.config.AggregatesProperties;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probe. Reaching it means the factor datasets were validated at startup, since the
 * context refuses to start without them.
 */
@RestController
public class HealthzController {

    private final AggregatesProperties properties;

    public HealthzController(AggregatesProperties properties) {
        this.properties = properties;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        return Map.of(
                "status", "UP",
                "strategy", properties.strategy().name(),
                "repository", properties.repository().name()
        );
    }
}
