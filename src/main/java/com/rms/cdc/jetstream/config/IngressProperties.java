package com.rms.cdc.jetstream.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Pull subscription the decoded changes arrive on.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Name the change stream and the subjects this node consumes.</li>
 *   <li>Size the batches handed to the delivery core.</li>
 *   <li>Control how a failed batch is retried without giving up commit order.</li>
 * </ul>
 *
 * <h2>Binding</h2>
 * <pre>
 * cdc:
 *   ingress:
 *     enabled: true
 *     stream: CDC_CHANGES
 *     filter-subject: cdc.changes.&gt;
 *     batch-size: 100
 *     poll-interval: 200ms
 *     fetch-timeout: 1s
 *     retry-backoff: 1s
 *     retry-max-backoff: 30s
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "cdc.ingress")
public class IngressProperties {

    /**
     * Starts the pull loop when true. Off by default so a node can run the
     * delivery core without a change stream (tests, one-off tooling).
     */
    private boolean enabled = false;

    /** JetStream stream the decoder publishes to. Must already exist. */
    @NotBlank
    private String stream = "CDC_CHANGES";

    @NotBlank
    private String filterSubject = "cdc.changes.>";

    /** Durable name; defaults to cdc_ingress_<nodeId> when blank. */
    private String durable;

    /** Maximum changes pulled, and handled, as one batch. */
    @Min(1)
    private int batchSize = 100;

    private Duration pollInterval = Duration.ofMillis(200);

    private Duration fetchTimeout = Duration.ofSeconds(1);

    /**
     * First delay before a failed batch is delivered again.
     *
     * <p><b>Purpose</b></p>
     * <ul>
     *   <li>A failed batch is retried in place. No newer batch is pulled until it
     *       succeeds, so changes keep their commit order.</li>
     *   <li>Each retry doubles the delay, up to {@link #retryMaxBackoff}.</li>
     * </ul>
     */
    @NotNull
    private Duration retryBackoff = Duration.ofSeconds(1);

    /** Upper bound of the retry delay. */
    @NotNull
    private Duration retryMaxBackoff = Duration.ofSeconds(30);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getStream() { return stream; }
    public void setStream(String stream) { this.stream = stream; }

    public String getFilterSubject() { return filterSubject; }
    public void setFilterSubject(String filterSubject) { this.filterSubject = filterSubject; }

    public String getDurable() { return durable; }
    public void setDurable(String durable) { this.durable = durable; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

    public Duration getFetchTimeout() { return fetchTimeout; }
    public void setFetchTimeout(Duration fetchTimeout) { this.fetchTimeout = fetchTimeout; }

    public Duration getRetryBackoff() { return retryBackoff; }
    public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }

    public Duration getRetryMaxBackoff() { return retryMaxBackoff; }
    public void setRetryMaxBackoff(Duration retryMaxBackoff) { this.retryMaxBackoff = retryMaxBackoff; }
}
