package com.companya.analytics.kafka;

import com.companya.analytics.config.ReplicaProperties;
import com.companya.analytics.metrics.ReplicationMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Parks a record that exhausted its retries on {@code <topic><suffix>}, keeping
 * the original key and value.
 */
@Slf4j
@Component
public class DeadLetterPublisher {

    public static final String ERROR_HEADER = "error";
    public static final String ORIGINAL_TOPIC_HEADER = "original-topic";
    public static final String ORIGINAL_PARTITION_HEADER = "original-partition";
    public static final String ORIGINAL_OFFSET_HEADER = "original-offset";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ReplicaProperties properties;
    private final ReplicationMetrics metrics;

    public DeadLetterPublisher(KafkaTemplate<String, String> kafkaTemplate, ReplicaProperties properties,
                               ReplicationMetrics metrics) {
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Blocks until the broker has the dead letter, so the caller may commit past the original.
     */
    public void publish(ConsumerRecord<String, String> record, Exception cause) {
        String dltTopic = record.topic() + properties.getConsumer().getDeadLetterSuffix();
        ProducerRecord<String, String> dlt = new ProducerRecord<>(dltTopic, record.key(), record.value());
        String error = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
        dlt.headers().add(ERROR_HEADER, error.getBytes(StandardCharsets.UTF_8));
        dlt.headers().add(ORIGINAL_TOPIC_HEADER, record.topic().getBytes(StandardCharsets.UTF_8));
        dlt.headers().add(ORIGINAL_PARTITION_HEADER, String.valueOf(record.partition()).getBytes(StandardCharsets.UTF_8));
        dlt.headers().add(ORIGINAL_OFFSET_HEADER, String.valueOf(record.offset()).getBytes(StandardCharsets.UTF_8));

        kafkaTemplate.send(dlt).join();
        metrics.deadLettered();
        log.error("Dead-lettered {}-{}@{} key={} to {}: {}",
                record.topic(), record.partition(), record.offset(), record.key(), dltTopic, error);
    }
}
