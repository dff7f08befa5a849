package com.rms.cdc.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.rms.cdc.core.filter.MissingColumnPolicy;
import com.rms.cdc.core.key.KeyFormat;
import com.rms.cdc.core.key.KeyTokenPolicy;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * =====================================================================
 * DeliveryProperties
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Selects the delivery path of this node and tunes the pure core.
 *
 *   FAN_OUT : changes → consumer_events / consumer_records (relational)
 *   KEYED   : changes → one key per row in a JetStream key/value bucket
 *
 * CONFIGURATION PREFIX
 * --------------------
 * cdc.delivery.*
 */
@Validated
@ConfigurationProperties(prefix = "cdc.delivery")
public class DeliveryProperties {

    public enum Mode {
        FAN_OUT,
        KEYED
    }

    @NotNull
    private Mode mode = Mode.FAN_OUT;

    /** What a filter on a column absent from the change evaluates to. */
    private MissingColumnPolicy missingColumnPolicy = MissingColumnPolicy.FAIL;

    /** How key segments containing characters outside the key charset are handled. */
    private KeyTokenPolicy keyTokenPolicy = KeyTokenPolicy.REJECT;

    @Valid
    private Keyed keyed = new Keyed();

    public Mode getMode() { return mode; }
    public void setMode(Mode mode) { this.mode = mode; }

    public MissingColumnPolicy getMissingColumnPolicy() { return missingColumnPolicy; }
    public void setMissingColumnPolicy(MissingColumnPolicy missingColumnPolicy) { this.missingColumnPolicy = missingColumnPolicy; }

    public KeyTokenPolicy getKeyTokenPolicy() { return keyTokenPolicy; }
    public void setKeyTokenPolicy(KeyTokenPolicy keyTokenPolicy) { this.keyTokenPolicy = keyTokenPolicy; }

    public Keyed getKeyed() { return keyed; }
    public void setKeyed(Keyed keyed) { this.keyed = keyed; }

    /**
     * Keyed path target. stream-id names the key/value bucket.
     */
    public static class Keyed {

        @NotBlank
        private String streamId = "CDC_ROWS";

        /** Leading key segment, usually the source database name. */
        @NotBlank
        private String keyPrefix = "db";

        private KeyFormat keyFormat = KeyFormat.BASIC;

        /** Revisions kept per key; 1 keeps only the latest row image. */
        @Min(1)
        private int history = 1;

        /** Create the bucket at startup when it does not exist. */
        private boolean bootstrap = true;

        /** Fail startup when an existing bucket differs from the settings above. */
        private boolean failOnMismatch = false;

        public String getStreamId() { return streamId; }
        public void setStreamId(String streamId) { this.streamId = streamId; }

        public String getKeyPrefix() { return keyPrefix; }
        public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }

        public KeyFormat getKeyFormat() { return keyFormat; }
        public void setKeyFormat(KeyFormat keyFormat) { this.keyFormat = keyFormat; }

        public int getHistory() { return history; }
        public void setHistory(int history) { this.history = history; }

        public boolean isBootstrap() { return bootstrap; }
        public void setBootstrap(boolean bootstrap) { this.bootstrap = bootstrap; }

        public boolean isFailOnMismatch() { return failOnMismatch; }
        public void setFailOnMismatch(boolean failOnMismatch) { this.failOnMismatch = failOnMismatch; }
    }
}
