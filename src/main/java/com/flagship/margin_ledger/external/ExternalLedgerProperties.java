package com.flagship.margin_ledger.external;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * external-ledger.* settings.
 */
@Data
@ConfigurationProperties(prefix = "external-ledger")
public class ExternalLedgerProperties {

    private String baseUrl = "http://localhost:5001";
    private String apiKey;
    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 30000;
}
