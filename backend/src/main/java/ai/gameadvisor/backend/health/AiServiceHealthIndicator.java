package ai.gameadvisor.backend.health;

import ai.gameadvisor.backend.model.dto.ConnectionCheck;
import ai.gameadvisor.backend.service.AiProcessingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Reports whether the AI extraction service answers its health endpoint.
 * Images queue up but are not processed while it is down.
 */
@Component
public class AiServiceHealthIndicator implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(AiServiceHealthIndicator.class);

    private static final long SLOW_RESPONSE_TIME_MS = 3000;

    private final AiProcessingService aiProcessingService;
    private final String serviceUrl;
    private final boolean checkEnabled;

    public AiServiceHealthIndicator(AiProcessingService aiProcessingService,
                                    @Value("${app.ai.service.url:http://localhost:8002}") String serviceUrl,
                                    @Value("${app.health.ai.enabled:true}") boolean checkEnabled) {
        this.aiProcessingService = aiProcessingService;
        this.serviceUrl = serviceUrl;
        this.checkEnabled = checkEnabled;
    }

    @Override
    public Health health() {
        Health.Builder healthBuilder = new Health.Builder();

        if (!checkEnabled) {
            return healthBuilder
                    .status("DISABLED")
                    .withDetail("service", "AI Service")
                    .withDetail("url", serviceUrl)
                    .withDetail("enabled", false)
                    .build();
        }

        try {
            Instant startTime = Instant.now();
            ConnectionCheck check = aiProcessingService.testConnection();
            long responseTimeMs = Duration.between(startTime, Instant.now()).toMillis();

            if (check.isSuccessful()) {
                healthBuilder.up()
                        .withDetail("status", "Available")
                        .withDetail("performance_rating", responseTimeMs <= SLOW_RESPONSE_TIME_MS ? "GOOD" : "SLOW");
            } else {
                healthBuilder.down()
                        .withDetail("status", "Unavailable")
                        .withDetail("error", check.getMessage());
            }
            return healthBuilder
                    .withDetail("service", "AI Service")
                    .withDetail("url", serviceUrl)
                    .withDetail("response_time_ms", responseTimeMs)
                    .withDetail("last_check", Instant.now().toString())
                    .build();

        } catch (Exception e) {
            logger.error("AI service health check failed with unexpected error", e);
            return healthBuilder.down()
                    .withDetail("service", "AI Service")
                    .withDetail("status", "Error")
                    .withDetail("url", serviceUrl)
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
