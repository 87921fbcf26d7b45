package com.companya.analytics.kafka;

import com.companya.analytics.config.ReplicaProperties;
import com.companya.analytics.consumer.HandlerRegistry;
import com.companya.analytics.schema.SchemaBootstrap;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.SmartLifecycle;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.FixedBackOff;

import java.util.List;

/**
 * Starts the dispatch loop once the schema exists and stops it when the
 * context closes. A loop that dies on its own takes the process down with a
 * non-zero exit code so it gets restarted.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.replica.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReplicationConsumerRunner implements SmartLifecycle {

    private static final long JOIN_TIMEOUT_MS = 30_000L;

    private final ConsumerFactory<String, String> consumerFactory;
    private final EventDispatcher dispatcher;
    private final DeadLetterPublisher deadLetterPublisher;
    private final HandlerRegistry registry;
    private final SchemaBootstrap schemaBootstrap;
    private final ReplicaProperties properties;
    private final Runnable onLoopFailure;

    private volatile DispatchLoop loop;
    private volatile Thread thread;

    @Autowired
    public ReplicationConsumerRunner(ConsumerFactory<String, String> consumerFactory, EventDispatcher dispatcher,
                                     DeadLetterPublisher deadLetterPublisher, HandlerRegistry registry,
                                     SchemaBootstrap schemaBootstrap, ReplicaProperties properties,
                                     ConfigurableApplicationContext applicationContext) {
        this(consumerFactory, dispatcher, deadLetterPublisher, registry, schemaBootstrap, properties,
                () -> System.exit(SpringApplication.exit(applicationContext, () -> 1)));
    }

    ReplicationConsumerRunner(ConsumerFactory<String, String> consumerFactory, EventDispatcher dispatcher,
                              DeadLetterPublisher deadLetterPublisher, HandlerRegistry registry,
                              SchemaBootstrap schemaBootstrap, ReplicaProperties properties,
                              Runnable onLoopFailure) {
        this.onLoopFailure = onLoopFailure;
        this.consumerFactory = consumerFactory;
        this.dispatcher = dispatcher;
        this.deadLetterPublisher = deadLetterPublisher;
        this.registry = registry;
        this.schemaBootstrap = schemaBootstrap;
        this.properties = properties;
    }

    @Override
    public void start() {
        schemaBootstrap.initialize();

        ReplicaProperties.Consumer config = properties.getConsumer();
        List<String> topics = config.getTopics().isEmpty()
                ? registry.topics().stream().map(Topic::topicName).toList()
                : config.getTopics();

        Consumer<String, String> consumer = consumerFactory.createConsumer();
        loop = new DispatchLoop(consumer, dispatcher, deadLetterPublisher, topics,
                config.getPollTimeout(), backOff(config));
        DispatchLoop started = loop;
        thread = new Thread(() -> runLoop(started), "replica-dispatch");
        thread.start();
        log.info("Replication consumer started for {}", topics);
    }

    private void runLoop(DispatchLoop dispatchLoop) {
        try {
            dispatchLoop.run();
        } catch (RuntimeException ex) {
            log.error("Dispatch loop terminated unexpectedly, shutting down", ex);
            onLoopFailure.run();
        }
    }

    static BackOff backOff(ReplicaProperties.Consumer config) {
        long interval = config.getRetryBackoff().toMillis();
        if (config.getMaxAttempts() <= 0) {
            return new FixedBackOff(interval, FixedBackOff.UNLIMITED_ATTEMPTS);
        }
        return new FixedBackOff(interval, config.getMaxAttempts() - 1L);
    }

    @Override
    public void stop() {
        DispatchLoop current = loop;
        if (current == null) {
            return;
        }
        log.info("Stopping replication consumer");
        current.shutdown();
        Thread dispatchThread = thread;
        // the context may be closed from the dispatch thread itself after a loop failure
        if (dispatchThread != null && dispatchThread != Thread.currentThread()) {
            try {
                dispatchThread.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
        loop = null;
        thread = null;
    }

    @Override
    public boolean isRunning() {
        DispatchLoop current = loop;
        return current != null && current.isRunning();
    }

    public ConsumerState getState() {
        DispatchLoop current = loop;
        return current == null ? ConsumerState.IDLE : current.getState();
    }
}
