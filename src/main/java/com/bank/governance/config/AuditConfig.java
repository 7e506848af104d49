package com.bank.governance.config;

import com.bank.governance.exception.GovernanceConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "governance.audit")
public class AuditConfig {

    private boolean enabled = true;

    // Bounded audit queue; when full the oldest event is dropped and counted as loss.
    private int queueCapacity = 10_000;

    // How long shutdown waits for the writer to drain the queue.
    private long shutdownTimeoutMs = 5_000L;

    @PostConstruct
    public void validate() {
        if (queueCapacity <= 0) {
            throw new GovernanceConfigurationException("governance.audit.queue-capacity must be > 0");
        }
        if (shutdownTimeoutMs < 0) {
            throw new GovernanceConfigurationException("governance.audit.shutdown-timeout-ms must be >= 0");
        }
    }
}
