package com.bank.governance.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RestClientConfig {

    /**
     * Client for the semantic classifier. Connect and read timeouts both use semantic-classifier.timeout-ms.
     */
    @Bean
    public RestTemplate semanticClassifierRestTemplate(RestTemplateBuilder builder, ScannerConfig scannerConfig) {
        Duration timeout = Duration.ofMillis(scannerConfig.getSemanticClassifier().getTimeoutMs());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .additionalInterceptors((request, body, execution) -> {
                    request.getHeaders().add("X-Scanner-Version", scannerConfig.getScannerVersion());
                    return execution.execute(request, body);
                })
                .build();
    }
}
