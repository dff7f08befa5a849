package com.rms.cdc.app;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.cdc.core.envelope.EnvelopeCodec;
import com.rms.cdc.core.filter.ColumnFilterEvaluator;
import com.rms.cdc.core.handler.KeyedUpsertHandler;
import com.rms.cdc.core.handler.MessageHandler;
import com.rms.cdc.core.key.KeyFormatter;
import com.rms.cdc.core.routing.ConsumerMatcher;
import com.rms.cdc.core.store.ConsumerMessageStore;
import com.rms.cdc.core.store.KeyedStreamStore;
import com.rms.cdc.jetstream.config.DeliveryProperties;

/**
 * The delivery core is framework free; this is where it meets Spring. Policies
 * come from cdc.delivery.*, the stores from the r2dbc and jetstream packages.
 */
@Configuration
public class CdcCoreConfig {

    @Bean
    public ColumnFilterEvaluator columnFilterEvaluator(DeliveryProperties props) {
        return new ColumnFilterEvaluator(props.getMissingColumnPolicy());
    }

    @Bean
    public ConsumerMatcher consumerMatcher(ColumnFilterEvaluator evaluator) {
        return new ConsumerMatcher(evaluator);
    }

    @Bean
    public KeyFormatter keyFormatter(DeliveryProperties props) {
        return new KeyFormatter(props.getKeyTokenPolicy());
    }

    @Bean
    public EnvelopeCodec envelopeCodec(ObjectMapper mapper) {
        return new EnvelopeCodec(mapper);
    }

    @Bean
    public MessageHandler messageHandler(ConsumerMatcher matcher, ConsumerMessageStore store) {
        return new MessageHandler(matcher, store);
    }

    @Bean
    public KeyedUpsertHandler keyedUpsertHandler(KeyFormatter keyFormatter, EnvelopeCodec codec,
            KeyedStreamStore store) {
        return new KeyedUpsertHandler(keyFormatter, codec, store);
    }
}
