package com.carbondna.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ledger settings. Changing annotation-fields on a ledger that already holds
 * records changes which fields new records hash; existing records keep
 * verifying because their stored payload is what gets rehashed.
 */
@Configuration
@ConfigurationProperties(prefix = "carbondna.ledger")
public class LedgerProperties {

    private int maxAppendAttempts = 3;
    private Duration lockTimeout = Duration.ofSeconds(5);
    private List<String> partitionKeys = new ArrayList<>(List.of("org_unit", "supplier_name"));
    private String defaultPartition = "global";
    private List<String> annotationFields = new ArrayList<>(
            List.of("uncertainty_pct", "data_quality_score", "quality_flags", "verification_status"));
    private int verificationPageSize = 500;
    private final Anchoring anchoring = new Anchoring();

    public int getMaxAppendAttempts() { return maxAppendAttempts; }
    public void setMaxAppendAttempts(int maxAppendAttempts) { this.maxAppendAttempts = maxAppendAttempts; }
    public Duration getLockTimeout() { return lockTimeout; }
    public void setLockTimeout(Duration lockTimeout) { this.lockTimeout = lockTimeout; }
    public List<String> getPartitionKeys() { return partitionKeys; }
    public void setPartitionKeys(List<String> partitionKeys) { this.partitionKeys = partitionKeys; }
    public String getDefaultPartition() { return defaultPartition; }
    public void setDefaultPartition(String defaultPartition) { this.defaultPartition = defaultPartition; }
    public List<String> getAnnotationFields() { return annotationFields; }
    public void setAnnotationFields(List<String> annotationFields) { this.annotationFields = annotationFields; }
    public int getVerificationPageSize() { return verificationPageSize; }
    public void setVerificationPageSize(int verificationPageSize) { this.verificationPageSize = verificationPageSize; }
    public Anchoring getAnchoring() { return anchoring; }

    public Set<String> annotationFieldSet() {
        return new LinkedHashSet<>(annotationFields);
    }

    public static class Anchoring {
        private boolean schedulerEnabled = true;
        private String cron = "0 5 0 * * *";

        public boolean isSchedulerEnabled() { return schedulerEnabled; }
        public void setSchedulerEnabled(boolean schedulerEnabled) { this.schedulerEnabled = schedulerEnabled; }
        public String getCron() { return cron; }
        public void setCron(String cron) { this.cron = cron; }
    }
}
