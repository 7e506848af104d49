package com.bank.governance.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI governanceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Governance Decision Layer API")
                        .version("1.0.0")
                        .description(
                                "Prompt-injection defense and tiered human oversight for dispute-resolution agents.\n\n" +
                                "**Scanning Pipeline:**\n" +
                                "1. Receive untrusted text via `POST /security/scan` (or `/security/scan/agent-output` between agents)\n" +
                                "2. Layer 1: case-insensitive pattern match against the active pattern snapshot\n" +
                                "3. Layer 2: structural heuristics (role override phrasing, chat-template delimiters)\n" +
                                "4. Layer 3 (optional): external semantic classifier with fail-open/fail-closed policy\n" +
                                "5. Return verdict, sanitized text and reason; audit a hashed record asynchronously\n\n" +
                                "**Oversight Tiers:**\n" +
                                "- `tier_1`: regulatory actions (SAR filing, payment block, account close): always reviewed\n" +
                                "- `tier_2`: low confidence, high amount or high-risk dispute: sampled for review\n" +
                                "- `tier_3`: everything else: logged, never interrupted\n\n" +
                                "Interrupted actions are submitted to `POST /review/requests` and resolved once by a reviewer.")
                        .contact(new Contact().name("Governance Platform Team")));
    }
}
