package com.wildtrack.dispatch;

import com.wildtrack.errors.TransientTransportException;
import com.wildtrack.errors.WildtrackException;
import com.wildtrack.model.TransformedObservation;
import com.wildtrack.serde.ObservationSerializer;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.serialization.StringSerializer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes each observation of a batch to a Kafka topic, keyed by source so that one
 * device's observations stay ordered within a partition.
 *
 * <p>The batch future completes once every record is acknowledged.  Retriable broker errors
 * are reported as {@link TransientTransportException}.</p>
 */
@Slf4j
public class KafkaObservationSender implements ObservationSender {

    static final String INTEGRATION_HEADER = "integration_id";

    private final Producer<String, String> producer;
    private final String topic;
    private final ObservationSerializer serializer = new ObservationSerializer();

    public KafkaObservationSender(Producer<String, String> producer, String topic) {
        this.producer = producer;
        this.topic = topic;
    }

    /**
     * Creates a sender with an idempotent {@link KafkaProducer} for the given cluster.
     */
    public static KafkaObservationSender create(String bootstrapServers, String topic) {
        if (bootstrapServers == null || bootstrapServers.isBlank()) {
            throw new IllegalArgumentException("kafkaBootstrapServers must be configured for KAFKA dispatch");
        }
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        log.info("Initialised KafkaObservationSender → {} topic={}", bootstrapServers, topic);
        return new KafkaObservationSender(new KafkaProducer<>(props), topic);
    }

    @Override
    public CompletableFuture<Void> send(String integrationId, List<TransformedObservation> batch) {
        List<CompletableFuture<Void>> acks = new ArrayList<>(batch.size());
        for (TransformedObservation observation : batch) {
            ProducerRecord<String, String> record =
                    new ProducerRecord<>(topic, observation.getSource(), serializer.serialize(observation));
            record.headers().add(INTEGRATION_HEADER, integrationId.getBytes(StandardCharsets.UTF_8));

            CompletableFuture<Void> ack = new CompletableFuture<>();
            producer.send(record, (metadata, exception) -> {
                if (exception == null) {
                    ack.complete(null);
                } else if (exception instanceof RetriableException) {
                    ack.completeExceptionally(new TransientTransportException(
                            "Kafka publish failed for " + observation.getSource(), exception));
                } else {
                    ack.completeExceptionally(new WildtrackException(
                            "Kafka publish failed for " + observation.getSource(), exception));
                }
            });
            acks.add(ack);
        }
        return CompletableFuture.allOf(acks.toArray(new CompletableFuture[0]));
    }

    @Override
    public void close() {
        producer.close();
        log.info("Closed KafkaObservationSender for topic {}", topic);
    }
}
