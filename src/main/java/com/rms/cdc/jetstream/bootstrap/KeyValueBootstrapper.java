package com.rms.cdc.jetstream.bootstrap;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.rms.cdc.jetstream.config.DeliveryProperties;

import io.nats.client.JetStreamApiException;
import io.nats.client.KeyValueManagement;
import io.nats.client.api.KeyValueConfiguration;
import io.nats.client.api.KeyValueStatus;
import io.nats.client.api.StorageType;

/**
 * =====================================================================
 * KeyValueBootstrapper
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Makes sure the key/value bucket of the keyed delivery path exists before
 * the first upsert.
 *
 *  - bucket missing → created (file storage, configured history)
 *  - bucket present → compared against the settings; a mismatch is logged,
 *                     or fails startup when fail-on-mismatch is set
 *
 * Other API errors are rethrown; permission failures must not look like a
 * missing bucket.
 *
 * CONFIGURATION PREFIX
 * --------------------
 * cdc.delivery.keyed.*  (active only with cdc.delivery.mode=KEYED)
 */
@Component
@ConditionalOnProperty(
        prefix = "cdc.delivery",
        name = "mode",
        havingValue = "KEYED"
)
public class KeyValueBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(KeyValueBootstrapper.class);

    static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final KeyValueManagement kvm;

    private final DeliveryProperties props;

    public KeyValueBootstrapper(KeyValueManagement kvm, DeliveryProperties props) {
        this.kvm = kvm;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        DeliveryProperties.Keyed keyed = props.getKeyed();
        if (!keyed.isBootstrap()) {
            log.info("KV bootstrap disabled (bucket={})", keyed.getStreamId());
            return;
        }
        ensureBucket(keyed);
    }

    void ensureBucket(DeliveryProperties.Keyed keyed) throws Exception {
        KeyValueConfiguration desired = KeyValueConfiguration.builder()
                .name(keyed.getStreamId())
                .maxHistoryPerKey(keyed.getHistory())
                .storageType(StorageType.File)
                .build();

        try {
            KeyValueStatus existing = kvm.getStatus(keyed.getStreamId());
            validateExisting(keyed, existing);
            return;
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() != JS_STREAM_NOT_FOUND_ERR) {
                throw e;
            }
        }

        kvm.create(desired);
        log.info("Created KV bucket: {} (history={}, storage={})",
                keyed.getStreamId(), keyed.getHistory(), StorageType.File);
    }

    private void validateExisting(DeliveryProperties.Keyed keyed, KeyValueStatus existing) {
        List<String> diffs = new ArrayList<>();

        if (existing.getMaxHistoryPerKey() != keyed.getHistory()) {
            diffs.add("history actual=" + existing.getMaxHistoryPerKey() + " expected=" + keyed.getHistory());
        }
        if (!Objects.equals(existing.getStorageType(), StorageType.File)) {
            diffs.add("storageType actual=" + existing.getStorageType() + " expected=" + StorageType.File);
        }

        if (diffs.isEmpty()) {
            log.info("KV bucket exists and matches config: {}", keyed.getStreamId());
            return;
        }

        String msg = "KV bucket exists but differs from expected: " + keyed.getStreamId() + " :: "
                + String.join("; ", diffs);
        if (keyed.isFailOnMismatch()) {
            throw new IllegalStateException(msg);
        }
        log.warn(msg);
    }
}
