package io.malicki.messaging.producer;

import io.malicki.messaging.domain.message.OutgoingMessage;
import io.malicki.messaging.domain.message.PublishOptions;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Non-blocking publisher: {@link #publish} only enqueues, the broker round
 * trip is tracked by the {@link PublishAcknowledgmentMatcher} loop.
 */
@Slf4j
public class AsyncMessagePublisher implements MessagePublisher, AutoCloseable {

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(30);

    private final PublishAcknowledgmentMatcher<?> matcher;
    private final OutgoingMessages outgoingMessages;
    private final ExecutorService loopExecutor;
    private CompletableFuture<Void> loop;

    public AsyncMessagePublisher(PublishAcknowledgmentMatcher<?> matcher, OutgoingMessages outgoingMessages) {
        this.matcher = matcher;
        this.outgoingMessages = outgoingMessages;
        this.loopExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "async-publish-loop");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized AsyncMessagePublisher start() {
        if (loop != null) {
            return this;
        }
        loop = CompletableFuture.runAsync(matcher::listen, loopExecutor);
        loop.whenComplete((ignored, ex) -> {
            if (ex != null) {
                log.error("💥 Async publish loop terminated: {}", ex.getMessage(), ex);
            }
        });
        log.info("Async publisher started");
        return this;
    }

    @Override
    public void publish(String topic, byte[] payload, PublishOptions options) {
        OutgoingMessage message = outgoingMessages.prepare(topic, payload, options);

        if (message.isDisablePayloadLogging()) {
            log.info("📥 Enqueue message | Topic: {} | Key: {}", topic, message.getKey());
        } else {
            log.info("📥 Enqueue message | Topic: {} | Key: {} | Payload: {}",
                    topic, message.getKey(), message.payloadAsString());
        }

        matcher.enqueue(message);
    }

    public boolean isRunning() {
        return loop != null && !loop.isDone() && matcher.isOpen();
    }

    @Override
    public synchronized void close() {
        matcher.shutdown();
        if (loop == null) {
            // never started: run the loop once so it closes the transport
            loop = CompletableFuture.runAsync(matcher::listen, loopExecutor);
        }
        try {
            loop.get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("⚠️ Interrupted while closing async publisher");
        } catch (ExecutionException e) {
            log.error("❌ Async publish loop closed with error: {}", e.getCause().getMessage());
        } catch (TimeoutException e) {
            log.warn("⚠️ Async publish loop did not stop within {}s", CLOSE_TIMEOUT.toSeconds());
        }
        loopExecutor.shutdownNow();
        log.info("Async publisher closed");
    }
}
