package com.rms.cdc.ingress;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.rms.cdc.core.model.Change;
import com.rms.cdc.jetstream.config.CdcProperties;
import com.rms.cdc.jetstream.config.IngressProperties;

import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
import io.nats.client.api.ReplayPolicy;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

/**
 * =====================================================================
 * ChangeBatchConsumer
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Feeds decoded changes from the change stream into the delivery core, one
 * pull cycle at a time.
 *
 * FLOW (per poll)
 * ---------------
 * 1. pull(batchSize) and drain what arrived, in delivery order
 * 2. decode each message; undecodable ones are term()'d and dropped
 * 3. hand the decoded batch to {@link ReplicationBatchProcessor}
 * 4. success → ack every message of the batch
 *    failure → retry the same batch with backoff; nothing newer is pulled
 *              until it goes through
 *
 * The server-side consumer position only advances through acks, so a batch
 * that failed delivery is never skipped. Retrying in place keeps commit order:
 * a later batch can never overtake an earlier one, which the keyed path needs
 * for last-write-wins. Messages of a retried batch are marked in progress so
 * the server does not redeliver them behind our back.
 *
 * SUPERVISION
 * -----------
 * A single outer loop (re)subscribes; "stream not found" during
 * provisioning is retried, other errors end the inner loop and trigger a
 * resubscribe.
 */
@Component
@ConditionalOnProperty(prefix = "cdc.ingress", name = "enabled", havingValue = "true", matchIfMissing = false)
public class ChangeBatchConsumer implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ChangeBatchConsumer.class);

    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private static final Duration SUBSCRIBE_RETRY_INTERVAL = Duration.ofSeconds(2);

    private final JetStream js;
    private final CdcProperties cdcProps;
    private final IngressProperties props;
    private final ChangeCodec codec;
    private final ReplicationBatchProcessor processor;

    private final AtomicReference<Disposable> running = new AtomicReference<>();

    public ChangeBatchConsumer(JetStream js, CdcProperties cdcProps, IngressProperties props, ChangeCodec codec,
            ReplicationBatchProcessor processor) {
        this.js = js;
        this.cdcProps = cdcProps;
        this.props = props;
        this.codec = codec;
        this.processor = processor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        if (running.get() != null) {
            return;
        }

        final String durable = durableName();

        // Explicit ACK: the server redelivers anything not acked.
        final ConsumerConfiguration consumerConfig = ConsumerConfiguration.builder()
                .durable(durable)
                .deliverPolicy(DeliverPolicy.All)
                .replayPolicy(ReplayPolicy.Instant)
                .ackPolicy(AckPolicy.Explicit)
                .filterSubject(props.getFilterSubject())
                .build();

        final PullSubscribeOptions pso = PullSubscribeOptions.builder()
                .stream(props.getStream())
                .configuration(consumerConfig)
                .build();

        Disposable d = Flux.interval(Duration.ZERO, SUBSCRIBE_RETRY_INTERVAL)
                .publishOn(Schedulers.boundedElastic())
                .concatMap(tick -> subscribeAndConsumeOnce(pso, durable)
                        .onErrorResume(err -> {
                            log.warn("Ingress loop ended with error. Will retry subscription. stream={} durable={} err={}",
                                    props.getStream(), durable, err.toString());
                            return Mono.empty();
                        }))
                .subscribe(
                        v -> { },
                        err -> log.error("Ingress supervisor terminated unexpectedly: {}", err.toString(), err));

        if (!running.compareAndSet(null, d)) {
            d.dispose();
        }
        log.info("Ingress started: mode={} stream={} filter={} durable={} batchSize={}",
                processor.mode(), props.getStream(), props.getFilterSubject(), durable, props.getBatchSize());
    }

    String durableName() {
        String durable = props.getDurable();
        if (durable != null && !durable.isBlank()) {
            return durable;
        }
        return "cdc_ingress_" + cdcProps.getNodeId();
    }

    private Mono<Void> subscribeAndConsumeOnce(PullSubscribeOptions pso, String durable) {
        return Mono.fromCallable(() -> {
                    try {
                        JetStreamSubscription sub = js.subscribe(props.getFilterSubject(), pso);
                        log.info("Subscribed: stream={} filter={} durable={}",
                                props.getStream(), props.getFilterSubject(), durable);
                        return sub;
                    } catch (JetStreamApiException jse) {
                        if (jse.getApiErrorCode() == JS_STREAM_NOT_FOUND_ERR) {
                            log.warn("Waiting for stream to exist: stream={}. Will retry...", props.getStream());
                            return null;
                        }
                        throw jse;
                    }
                })
                .flatMap(sub -> consumePullLoop(sub)
                        .doFinally(sig -> {
                            try {
                                sub.unsubscribe();
                            } catch (Exception e) {
                                log.debug("Unsubscribe failed: {}", e.toString());
                            }
                        }));
    }

    private Mono<Void> consumePullLoop(JetStreamSubscription sub) {
        return Flux.interval(props.getPollInterval())
                .onBackpressureDrop()
                .publishOn(Schedulers.boundedElastic())
                .concatMap(t -> Mono.fromCallable(() -> fetch(sub))
                        .subscribeOn(Schedulers.boundedElastic())
                        .flatMap(this::handleBatch), 1)
                .then();
    }

    private List<Message> fetch(JetStreamSubscription sub) throws InterruptedException {
        // Blocking: waits up to fetchTimeout for the first message.
        return sub.fetch(props.getBatchSize(), props.getFetchTimeout());
    }

    /**
     * Decodes, delivers and settles one pulled batch.
     *
     * Completes only once the batch is delivered; a failing batch is retried
     * until it succeeds or the loop is disposed.
     *
     * @return number of delivered records; 0 for an empty or fully poisoned batch
     */
    Mono<Integer> handleBatch(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return Mono.just(0);
        }

        List<Message> accepted = new ArrayList<>(messages.size());
        List<Change> changes = new ArrayList<>(messages.size());
        for (Message msg : messages) {
            try {
                changes.add(codec.decode(msg.getData()));
                accepted.add(msg);
            } catch (UndecodableChangeException e) {
                log.error("Terminating undecodable change subject={} seq={} err={}",
                        msg.getSubject(), sequenceOf(msg), e.getMessage());
                msg.term();
            }
        }

        if (changes.isEmpty()) {
            return Mono.just(0);
        }

        return Mono.defer(() -> processor.process(changes))
                .retryWhen(Retry.backoff(Long.MAX_VALUE, props.getRetryBackoff())
                        .maxBackoff(props.getRetryMaxBackoff())
                        .scheduler(Schedulers.boundedElastic())
                        .doBeforeRetry(signal -> {
                            log.warn("Batch delivery failed; retrying changes={} attempt={} err={}",
                                    changes.size(), signal.totalRetries() + 1, signal.failure().toString());
                            accepted.forEach(Message::inProgress);
                        }))
                .doOnSuccess(n -> {
                    accepted.forEach(Message::ack);
                    log.info("Delivered batch changes={} written={}", changes.size(), n);
                });
    }

    private static Object sequenceOf(Message msg) {
        return msg.isJetStream() ? msg.metaData().streamSequence() : "n/a";
    }

    @Override
    public void destroy() {
        Disposable d = running.getAndSet(null);
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
    }
}
