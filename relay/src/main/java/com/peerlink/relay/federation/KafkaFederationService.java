package com.peerlink.relay.federation;

import com.peerlink.core.msg.RelayFrames;
import com.peerlink.core.msg.Topics;
import com.peerlink.core.util.JsonUtils;
import com.peerlink.relay.config.RelayConfig;
import com.peerlink.relay.metrics.MetricsService;
import com.peerlink.relay.session.ISessionManager;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Federation over Kafka with one topic per relay instance.
 * <p>
 * Message routing flow:
 * <pre>
 * 1. Sender relay reads the recipient's relayId from Redis presence
 * 2. Publishes to relay.forward.{relayId}
 * 3. Only that relay consumes the topic and hands the frame to the local socket
 * </pre>
 * The consumer never writes to the offline queue: the sender relay queued the message when it
 * forwarded it.
 * </p>
 */
public class KafkaFederationService implements IFederationService {
    private static final Logger log = LoggerFactory.getLogger(KafkaFederationService.class);

    private static final int DEFAULT_PARTITIONS = 1;
    private static final short REPLICATION_FACTOR = 1;

    private final RelayConfig config;
    private final ISessionManager sessionManager;
    private final MetricsService metricsService;

    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;
    private Disposable consumer;

    public KafkaFederationService(RelayConfig config, ISessionManager sessionManager, MetricsService metricsService) {
        this.config = config;
        this.sessionManager = sessionManager;
        this.metricsService = metricsService;

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all");
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        producerProps.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 10_000);
        producerProps.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, 5_000);

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        log.info("Kafka producer and admin client initialized");
    }

    @Override
    public Mono<Void> start() {
        String relayId = config.getRelayId();
        String topic = Topics.forwardTopicFor(relayId);

        return createTopicIfNotExists(topic)
            .publishOn(Schedulers.boundedElastic())
            .doOnSuccess(v -> {
                Map<String, Object> consumerProps = new HashMap<>();
                consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
                consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, "relay-forward-" + relayId);
                consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
                consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
                // Backlog from before a restart is covered by the offline queue
                consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
                consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

                ReceiverOptions<String, String> receiverOptions = ReceiverOptions.<String, String>create(consumerProps)
                    .subscription(Collections.singleton(topic));

                consumer = listenToForwards(KafkaReceiver.create(receiverOptions)).subscribe();
                log.info("Relay {} consuming forwards from {}", relayId, topic);
            });
    }

    private Flux<Void> listenToForwards(KafkaReceiver<String, String> receiver) {
        return receiver.receive()
            .concatMap(record -> {
                try {
                    ForwardedMessage message = JsonUtils.readValue(record.value(), ForwardedMessage.class);
                    String frame = RelayFrames.message(message.getFromDid(), message.getPayload(), message.getTimestamp());

                    if (sessionManager.deliver(message.getToDid(), frame)) {
                        log.debug("Forwarded message from relay {} delivered to {}",
                            message.getOriginRelayId(), message.getToDid());
                    } else {
                        log.debug("Forward target {} not connected here, left to the offline queue", message.getToDid());
                    }
                } catch (Exception e) {
                    log.error("Failed to process forwarded message, skipping", e);
                }
                record.receiverOffset().acknowledge();
                return Mono.<Void>empty();
            })
            .onErrorContinue((err, obj) -> log.error("Error in forward consumer loop", err));
    }

    @Override
    public Mono<Void> forward(String targetRelayId, ForwardedMessage message) {
        return Mono.defer(() -> {
            String topic = Topics.forwardTopicFor(targetRelayId);
            String json = JsonUtils.writeValueAsString(message);
            long startNanos = System.nanoTime();

            ProducerRecord<String, String> record = new ProducerRecord<>(topic, message.getToDid(), json);
            return sender.send(Mono.just(SenderRecord.create(record, null)))
                .retry(2)
                .doOnNext(result -> {
                    metricsService.recordKafkaPublishLatency(startNanos);
                    log.debug("Forwarded message for {} to relay {} (topic {})",
                        message.getToDid(), targetRelayId, topic);
                })
                .then();
        });
    }

    private Mono<Void> createTopicIfNotExists(String topicName) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }

                return Mono.fromFuture(() -> {
                    log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                        topicName, DEFAULT_PARTITIONS, REPLICATION_FACTOR);
                    return adminClient.createTopics(Collections.singleton(
                            new NewTopic(topicName, DEFAULT_PARTITIONS, REPLICATION_FACTOR)))
                        .all()
                        .toCompletionStage()
                        .toCompletableFuture();
                });
            })
            .onErrorResume(error -> {
                if (error.getCause() instanceof TopicExistsException) {
                    log.info("Kafka topic already exists: {}", topicName);
                    return Mono.empty();
                }
                log.error("Failed to create Kafka topic {}: {}", topicName, error.getMessage(), error);
                return Mono.error(error);
            })
            .then();
    }

    @Override
    public Mono<Void> stop() {
        return Mono.fromRunnable(() -> {
            if (consumer != null) {
                consumer.dispose();
            }
            sender.close();
            adminClient.close();
            log.info("Kafka federation stopped");
        });
    }
}
