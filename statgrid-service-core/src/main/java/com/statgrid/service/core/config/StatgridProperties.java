package com.statgrid.service.core.config;

import com.statgrid.service.core.ingest.UnresolvedLabelPolicy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "statgrid")
public class StatgridProperties {
    private Resolution resolution = new Resolution();
    private Ingest ingest = new Ingest();

    public Resolution getResolution() {
        return resolution;
    }

    public void setResolution(Resolution resolution) {
        this.resolution = resolution;
    }

    public Ingest getIngest() {
        return ingest;
    }

    public void setIngest(Ingest ingest) {
        this.ingest = ingest;
    }

    public static class Resolution {
        private int cacheSize = 50_000;

        public int getCacheSize() {
            return cacheSize;
        }

        public void setCacheSize(int cacheSize) {
            this.cacheSize = Math.max(1, cacheSize);
        }
    }

    public static class Ingest {
        /** Upper bound keeps a batch within the Postgres bind-parameter limit. */
        public static final int MAX_BATCH_SIZE = 5_000;

        private int batchSize = 500;
        /** Null means a synced chunk stays fresh until its checkpoint is cleared. */
        private Duration maxChunkAge;

        /** Rows whose labels do not all resolve are dropped unless configured otherwise. */
        private UnresolvedLabelPolicy unresolvedPolicy = UnresolvedLabelPolicy.SKIP_ROW;
        private boolean stopOnFetchFailure = false;
        private int deadlockMaxAttempts = 6;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, Math.min(MAX_BATCH_SIZE, batchSize));
        }

        public Duration getMaxChunkAge() {
            return maxChunkAge;
        }

        public void setMaxChunkAge(Duration maxChunkAge) {
            this.maxChunkAge = maxChunkAge;
        }

        public UnresolvedLabelPolicy getUnresolvedPolicy() {
            return unresolvedPolicy;
        }

        public void setUnresolvedPolicy(UnresolvedLabelPolicy unresolvedPolicy) {
            this.unresolvedPolicy = unresolvedPolicy == null ? UnresolvedLabelPolicy.SKIP_ROW : unresolvedPolicy;
        }

        public boolean isStopOnFetchFailure() {
            return stopOnFetchFailure;
        }

        public void setStopOnFetchFailure(boolean stopOnFetchFailure) {
            this.stopOnFetchFailure = stopOnFetchFailure;
        }

        public int getDeadlockMaxAttempts() {
            return deadlockMaxAttempts;
        }

        public void setDeadlockMaxAttempts(int deadlockMaxAttempts) {
            this.deadlockMaxAttempts = Math.max(1, deadlockMaxAttempts);
        }
    }
}
