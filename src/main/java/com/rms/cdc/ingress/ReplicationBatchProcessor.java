package com.rms.cdc.ingress;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.rms.cdc.core.handler.KeyedDeliveryContext;
import com.rms.cdc.core.handler.KeyedUpsertHandler;
import com.rms.cdc.core.handler.MessageHandler;
import com.rms.cdc.core.model.Change;
import com.rms.cdc.jetstream.config.DeliveryProperties;
import com.rms.cdc.r2dbc.store.ConsumerConfigStore;

import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * ReplicationBatchProcessor
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Hands one batch of decoded changes to the delivery path this node runs.
 *
 *   FAN_OUT : reload active consumers → MessageHandler
 *   KEYED   : KeyedUpsertHandler with the configured bucket and key scheme
 *
 * Active consumers are read per batch so subscription edits apply to the
 * next batch without a restart.
 *
 * CONTRACT
 * --------
 * The returned Mono completes only after the batch is durably delivered.
 * Callers acknowledge upstream on completion and nothing earlier.
 */
@Component
public class ReplicationBatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(ReplicationBatchProcessor.class);

    private final DeliveryProperties props;
    private final ConsumerConfigStore consumerConfigStore;
    private final MessageHandler messageHandler;
    private final KeyedUpsertHandler keyedUpsertHandler;

    public ReplicationBatchProcessor(DeliveryProperties props, ConsumerConfigStore consumerConfigStore,
            MessageHandler messageHandler, KeyedUpsertHandler keyedUpsertHandler) {
        this.props = props;
        this.consumerConfigStore = consumerConfigStore;
        this.messageHandler = messageHandler;
        this.keyedUpsertHandler = keyedUpsertHandler;
    }

    /**
     * @return number of delivery records (fan-out) or upserts (keyed) written
     */
    public Mono<Integer> process(List<Change> changes) {
        if (changes == null || changes.isEmpty()) {
            return Mono.just(0);
        }
        log.debug("Processing batch mode={} size={}", props.getMode(), changes.size());
        return switch (props.getMode()) {
            case FAN_OUT -> consumerConfigStore.findActive()
                    .collectList()
                    .flatMap(consumers -> messageHandler.handleMessages(consumers, changes));
            case KEYED -> keyedUpsertHandler.handleMessages(keyedContext(), changes);
        };
    }

    KeyedDeliveryContext keyedContext() {
        DeliveryProperties.Keyed keyed = props.getKeyed();
        return new KeyedDeliveryContext(keyed.getStreamId(), keyed.getKeyPrefix(), keyed.getKeyFormat());
    }

    public DeliveryProperties.Mode mode() {
        return props.getMode();
    }
}
