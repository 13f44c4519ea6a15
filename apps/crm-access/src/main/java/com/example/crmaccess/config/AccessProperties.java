package com.example.crmaccess.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.access")
public record AccessProperties(
        AuditProperties audit,
        BatchProperties batch
) {
    public AccessProperties {
        if (audit == null) {
            audit = new AuditProperties(true);
        }
        if (batch == null) {
            batch = new BatchProperties(100);
        }
    }

    public record AuditProperties(
            boolean enabled
    ) {}

    public record BatchProperties(
            int maxRecords
    ) {
        public BatchProperties {
            if (maxRecords <= 0) {
                maxRecords = 100;
            }
        }
    }
}
