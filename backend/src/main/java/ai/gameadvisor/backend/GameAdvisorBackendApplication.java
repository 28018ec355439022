package ai.gameadvisor.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the rulebook ingestion backend.
 * Starts the image worker pool, the orphan reconciler and the retrieval services.
 */
@SpringBootApplication
@EnableScheduling
public class GameAdvisorBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameAdvisorBackendApplication.class, args);
    }
}
