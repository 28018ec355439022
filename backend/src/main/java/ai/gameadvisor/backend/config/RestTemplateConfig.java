package ai.gameadvisor.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate for the AI extraction service. Image processing can take a while,
 * so the read timeout is much longer than the connect timeout.
 */
@Configuration
public class RestTemplateConfig {

    @Value("${app.ai.service.connect-timeout:5000}")
    private int connectTimeoutMs;

    @Value("${app.ai.service.read-timeout:120000}")
    private int readTimeoutMs;

    @Bean("aiServiceRestTemplate")
    public RestTemplate aiServiceRestTemplate() {
        return new RestTemplate(clientHttpRequestFactory());
    }

    private ClientHttpRequestFactory clientHttpRequestFactory() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return factory;
    }
}
