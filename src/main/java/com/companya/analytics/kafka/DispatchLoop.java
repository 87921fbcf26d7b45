package com.companya.analytics.kafka;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.BackOffExecution;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-threaded poll loop that owns its {@link Consumer}. Records of a partition
 * are dispatched one at a time in offset order and each offset is committed
 * synchronously once its record has been handled or skipped. A failing record
 * rewinds its partition so the next poll redelivers it; the {@link BackOff}
 * decides how long to wait and when to give up and dead-letter it.
 */
@Slf4j
public class DispatchLoop implements Runnable {

    private final Consumer<String, String> consumer;
    private final EventDispatcher dispatcher;
    private final DeadLetterPublisher deadLetterPublisher;
    private final List<String> topics;
    private final Duration pollTimeout;
    private final BackOff backOff;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private final Map<TopicPartition, PendingRetry> retries = new HashMap<>();
    private volatile ConsumerState state = ConsumerState.IDLE;

    public DispatchLoop(Consumer<String, String> consumer, EventDispatcher dispatcher,
                        DeadLetterPublisher deadLetterPublisher, List<String> topics,
                        Duration pollTimeout, BackOff backOff) {
        this.consumer = consumer;
        this.dispatcher = dispatcher;
        this.deadLetterPublisher = deadLetterPublisher;
        this.topics = List.copyOf(topics);
        this.pollTimeout = pollTimeout;
        this.backOff = backOff;
    }

    @Override
    public void run() {
        try {
            subscribe();
            while (running.get()) {
                pollOnce();
            }
        } catch (WakeupException ex) {
            if (running.get()) {
                throw ex;
            }
        } finally {
            running.set(false);
            state = ConsumerState.SHUTTING_DOWN;
            consumer.close();
            log.info("Consumer closed");
        }
    }

    public void subscribe() {
        consumer.subscribe(topics);
        state = ConsumerState.POLLING;
        log.info("Subscribed to {}", topics);
    }

    /**
     * One poll and the dispatch of everything it returned.
     */
    public void pollOnce() {
        ConsumerRecords<String, String> records = consumer.poll(pollTimeout);
        if (records.isEmpty()) {
            return;
        }
        state = ConsumerState.DISPATCHING;
        try {
            for (TopicPartition partition : records.partitions()) {
                if (!running.get()) {
                    break;
                }
                dispatchPartition(partition, records.records(partition));
            }
        } finally {
            if (running.get()) {
                state = ConsumerState.POLLING;
            }
        }
    }

    private void dispatchPartition(TopicPartition partition, List<ConsumerRecord<String, String>> records) {
        for (ConsumerRecord<String, String> record : records) {
            if (!running.get()) {
                // uncommitted; redelivered after the next assignment
                return;
            }
            try {
                dispatcher.dispatch(record.topic(), record.value());
            } catch (RuntimeException ex) {
                if (!recoverOrRewind(partition, record, ex)) {
                    return;
                }
                continue;
            }
            retries.remove(partition);
            if (!commit(partition, record)) {
                return;
            }
        }
    }

    /**
     * @return {@code true} if the record was dead-lettered and the partition may continue
     */
    private boolean recoverOrRewind(TopicPartition partition, ConsumerRecord<String, String> record, RuntimeException ex) {
        PendingRetry retry = retries.get(partition);
        if (retry == null || retry.offset != record.offset()) {
            retry = new PendingRetry(record.offset(), backOff.start());
            retries.put(partition, retry);
        }
        retry.attempts++;
        long wait = retry.execution.nextBackOff();

        if (wait == BackOffExecution.STOP) {
            log.error("Giving up on {}-{}@{} key={} after {} attempts",
                    record.topic(), record.partition(), record.offset(), record.key(), retry.attempts, ex);
            try {
                deadLetterPublisher.publish(record, ex);
            } catch (RuntimeException publishFailure) {
                // exhausted execution keeps returning STOP, so the next delivery retries the publish
                log.error("Dead-lettering {}-{}@{} failed, rewinding",
                        record.topic(), record.partition(), record.offset(), publishFailure);
                rewind(partition, record.offset());
                pause(pollTimeout.toMillis());
                return false;
            }
            retries.remove(partition);
            return commit(partition, record);
        }

        log.error("Failed {}-{}@{} key={} (attempt {}), retrying in {}ms",
                record.topic(), record.partition(), record.offset(), record.key(), retry.attempts, wait, ex);
        rewind(partition, record.offset());
        pause(wait);
        return false;
    }

    /**
     * @return {@code false} if the commit failed; the partition is rewound to the record,
     * whose writes are idempotent, and the rest of its batch waits
     */
    private boolean commit(TopicPartition partition, ConsumerRecord<String, String> record) {
        Map<TopicPartition, OffsetAndMetadata> next = Map.of(partition, new OffsetAndMetadata(record.offset() + 1));
        try {
            try {
                consumer.commitSync(next);
            } catch (WakeupException ex) {
                // shutdown raced the commit; the wakeup is consumed, so the retry blocks normally
                consumer.commitSync(next);
            }
            return true;
        } catch (WakeupException ex) {
            throw ex;
        } catch (KafkaException ex) {
            log.warn("Commit of {}-{}@{} failed, redelivering: {}",
                    record.topic(), record.partition(), record.offset(), ex.toString());
            rewind(partition, record.offset());
            return false;
        }
    }

    /**
     * A partition revoked by a rebalance is left alone; its new owner resumes from the last commit.
     */
    private void rewind(TopicPartition partition, long offset) {
        if (consumer.assignment().contains(partition)) {
            consumer.seek(partition, offset);
        }
    }

    private void pause(long millis) {
        if (millis <= 0 || !running.get()) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            running.set(false);
        }
    }

    /**
     * Safe to call from any thread. The record in flight finishes; the rest of the
     * batch stays uncommitted.
     */
    public void shutdown() {
        running.set(false);
        state = ConsumerState.SHUTTING_DOWN;
        consumer.wakeup();
    }

    public boolean isRunning() {
        return running.get();
    }

    public ConsumerState getState() {
        return state;
    }

    private static final class PendingRetry {
        private final long offset;
        private final BackOffExecution execution;
        private int attempts;

        private PendingRetry(long offset, BackOffExecution execution) {
            this.offset = offset;
            this.execution = execution;
        }
    }
}
