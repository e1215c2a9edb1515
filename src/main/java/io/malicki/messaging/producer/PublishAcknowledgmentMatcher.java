package io.malicki.messaging.producer;

import io.malicki.messaging.domain.message.DeliveryPosition;
import io.malicki.messaging.domain.message.OutgoingMessage;
import io.malicki.messaging.exception.DuplicateCorrelationIdException;
import io.malicki.messaging.exception.MessagingTransportException;
import io.malicki.messaging.exception.PublishQueueFullException;
import io.malicki.messaging.exception.PublisherClosedException;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Matches asynchronous delivery outcomes back to the publishes that caused them.
 *
 * <p>A single loop thread ({@link #listen()}) owns the table of pending
 * publishes. New messages, transport successes, transport failures and the
 * shutdown request all arrive on one event queue and are handled one at a
 * time, so the table is never touched concurrently and needs no lock.
 *
 * <p>Without a pending TTL an entry whose outcome never arrives stays in the
 * table until the process exits.
 *
 * @param <C> context the {@link PublishObserver} attaches to each pending publish
 */
@Slf4j
public class PublishAcknowledgmentMatcher<C> implements TransportListener {

    public static final int DEFAULT_INGRESS_CAPACITY = 64;
    private static final Duration MAX_SWEEP_INTERVAL = Duration.ofSeconds(1);

    private enum State { OPEN, CLOSING, CLOSED }

    private final AsyncTransport transport;
    private final CorrelationIdExtractor correlationIdExtractor;
    private final PublishObserver<C> observer;
    private final Clock clock;
    private final IngressMode ingressMode;
    private final int ingressCapacity;
    private final Semaphore ingressPermits;
    private final Duration pendingTtl;
    private final long sweepIntervalNanos;

    private final BlockingQueue<LoopEvent> events = new LinkedBlockingQueue<>();
    private final Object lifecycleMonitor = new Object();
    private State state = State.OPEN;
    private boolean started;

    // Loop thread only
    private final Map<String, PendingPublishEntry<C>> pending = new HashMap<>();
    private long lastSweepNanos = System.nanoTime();

    @Builder
    private PublishAcknowledgmentMatcher(
        AsyncTransport transport,
        CorrelationIdExtractor correlationIdExtractor,
        PublishObserver<C> observer,
        Clock clock,
        IngressMode ingressMode,
        Integer ingressCapacity,
        Duration pendingTtl
    ) {
        if (transport == null || observer == null) {
            throw new IllegalArgumentException("transport and observer are required");
        }
        this.transport = transport;
        this.correlationIdExtractor = correlationIdExtractor != null
            ? correlationIdExtractor
            : CorrelationIdExtractor.fromHeader();
        this.observer = observer;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.ingressMode = ingressMode != null ? ingressMode : IngressMode.BLOCK;
        this.ingressCapacity = ingressCapacity != null ? ingressCapacity : DEFAULT_INGRESS_CAPACITY;
        if (this.ingressCapacity < 1) {
            throw new IllegalArgumentException("ingressCapacity must be >= 1: " + this.ingressCapacity);
        }
        this.ingressPermits = this.ingressMode == IngressMode.FAIL_FAST ? new Semaphore(this.ingressCapacity) : null;
        if (pendingTtl != null && (pendingTtl.isZero() || pendingTtl.isNegative())) {
            throw new IllegalArgumentException("pendingTtl must be positive: " + pendingTtl);
        }
        this.pendingTtl = pendingTtl;
        this.sweepIntervalNanos = pendingTtl != null
            ? Math.min(pendingTtl.toNanos(), MAX_SWEEP_INTERVAL.toNanos())
            : 0;

        transport.bind(this);
    }

    /**
     * Queues a message for the loop to hand to the transport.
     *
     * <p>In {@link IngressMode#BLOCK} mode this returns once the loop has handed
     * the message off (not once the broker confirmed it) and rethrows any
     * hand-off failure. In {@link IngressMode#FAIL_FAST} mode it returns at once.
     *
     * @throws PublisherClosedException after {@link #shutdown()}
     * @throws PublishQueueFullException in FAIL_FAST mode when too many hand-offs are waiting
     * @throws DuplicateCorrelationIdException in BLOCK mode when the correlation ID is already pending
     * @throws IllegalArgumentException when {@code message} is null
     */
    public void enqueue(OutgoingMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message is required");
        }
        if (ingressPermits != null && !ingressPermits.tryAcquire()) {
            throw new PublishQueueFullException(ingressCapacity);
        }

        HandOff handOff = new HandOff(message);
        synchronized (lifecycleMonitor) {
            if (state != State.OPEN) {
                releaseIngressPermit();
                throw new PublisherClosedException();
            }
            events.add(handOff);
        }

        if (ingressMode == IngressMode.BLOCK) {
            awaitHandOff(handOff);
        }
    }

    @Override
    public void onSuccess(OutgoingMessage message, DeliveryPosition position) {
        if (message == null) {
            log.warn("⚠️ [async_producer] Success reported without a message | Position: {}", position);
            return;
        }
        submitOutcome(new Outcome(message, position, null));
    }

    @Override
    public void onFailure(OutgoingMessage message, Exception error) {
        if (message == null) {
            log.warn("⚠️ [async_producer] Failure reported without a message", error);
            return;
        }
        submitOutcome(new Outcome(message, null, error));
    }

    /**
     * Correlation IDs currently pending, as seen by the loop once it reaches this request.
     */
    public CompletableFuture<Set<String>> pendingCorrelationIds() {
        Snapshot snapshot = new Snapshot();
        synchronized (lifecycleMonitor) {
            if (state == State.CLOSED) {
                snapshot.result.completeExceptionally(new PublisherClosedException());
                return snapshot.result;
            }
            events.add(snapshot);
        }
        return snapshot.result;
    }

    /**
     * Stops accepting messages and asks the loop to close the transport and return.
     */
    public void shutdown() {
        synchronized (lifecycleMonitor) {
            if (state != State.OPEN) {
                return;
            }
            state = State.CLOSING;
            events.add(Shutdown.INSTANCE);
        }
        log.info("[async_producer] Closing listener....");
    }

    public boolean isOpen() {
        synchronized (lifecycleMonitor) {
            return state == State.OPEN;
        }
    }

    /**
     * Runs the event loop on the calling thread until {@link #shutdown()}.
     *
     * <p>An exception while handling one event fails only that event. A
     * {@link MessagingTransportException} from the transport, or an {@link Error},
     * ends the loop; the transport is closed either way.
     *
     * @throws MessagingTransportException when the transport fails fatally or cannot be closed
     */
    public void listen() {
        synchronized (lifecycleMonitor) {
            if (started) {
                throw new IllegalStateException("Listener already started");
            }
            started = true;
        }
        log.info("[async_producer] Listener started");

        RuntimeException failure = null;
        MessagingTransportException closeFailure;
        try {
            runLoop();
        } catch (RuntimeException e) {
            log.error("💥 [async_producer] Transport failed, stopping listener", e);
            failure = e;
        } finally {
            closeFailure = closeLoop();
        }

        if (failure != null) {
            if (closeFailure != null) {
                failure.addSuppressed(closeFailure);
            }
            throw failure;
        }
        if (closeFailure != null) {
            throw closeFailure;
        }
        log.info("[async_producer] Listener closed");
    }

    private void runLoop() {
        try {
            while (true) {
                LoopEvent event = pendingTtl == null
                    ? events.take()
                    : events.poll(sweepIntervalNanos, TimeUnit.NANOSECONDS);

                if (event == Shutdown.INSTANCE) {
                    return;
                }
                try {
                    dispatch(event);
                } catch (MessagingTransportException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.error("❌ [async_producer] Failed to handle {} | Error: {}",
                            event != null ? event.getClass().getSimpleName() : "sweep", e.getMessage(), e);
                    failEvent(event, e);
                } catch (Error e) {
                    failEvent(event, e);
                    throw e;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("⚠️ [async_producer] Listener interrupted");
        }
    }

    private void dispatch(LoopEvent event) {
        if (event instanceof HandOff) {
            handOff((HandOff) event);
        } else if (event instanceof Outcome) {
            resolve((Outcome) event);
        } else if (event instanceof Snapshot) {
            ((Snapshot) event).result.complete(Set.copyOf(pending.keySet()));
        }

        if (pendingTtl != null) {
            sweepExpired();
        }
    }

    // Completing an already completed future is a no-op
    private static void failEvent(LoopEvent event, Throwable error) {
        if (event instanceof HandOff) {
            ((HandOff) event).reject(error);
        } else if (event instanceof Snapshot) {
            ((Snapshot) event).result.completeExceptionally(error);
        }
    }

    private void handOff(HandOff handOff) {
        OutgoingMessage message = handOff.message;
        try {
            String correlationId = extractCorrelationId(message);
            if (correlationId == null) {
                log.warn("⚠️ [async_producer] No correlation ID | Topic: {} | Outcome will not be tracked",
                        message.getTopic());
                send(handOff, null);
                return;
            }
            if (pending.containsKey(correlationId)) {
                log.error("❌ [async_producer] Correlation ID already pending: {} | Topic: {}",
                        correlationId, message.getTopic());
                handOff.reject(new DuplicateCorrelationIdException(correlationId));
                return;
            }

            C context = null;
            try {
                context = observer.onHandedOff(message);
            } catch (RuntimeException e) {
                log.warn("Publish observer failed on hand-off of {}: {}", correlationId, e.getMessage(), e);
            }
            pending.put(correlationId, new PendingPublishEntry<>(correlationId, clock.instant(), message, context));
            send(handOff, correlationId);
        } finally {
            releaseIngressPermit();
        }
    }

    private void send(HandOff handOff, String correlationId) {
        try {
            transport.send(handOff.message);
        } catch (RuntimeException e) {
            if (correlationId != null) {
                PendingPublishEntry<C> entry = pending.remove(correlationId);
                notifyObserver(() -> observer.onFailed(entry, e));
            }
            handOff.reject(e);
            if (e instanceof MessagingTransportException) {
                throw e;
            }
            return;
        }
        handOff.accept();
    }

    private void resolve(Outcome outcome) {
        String correlationId = extractCorrelationId(outcome.message);
        PendingPublishEntry<C> entry = correlationId != null ? pending.remove(correlationId) : null;

        if (entry == null) {
            log.debug("[async_producer] Unmatched outcome | Topic: {} | Correlation: {}",
                    outcome.message.getTopic(), correlationId);
            notifyObserver(() -> observer.onUnmatched(outcome.message, outcome.position, outcome.error));
            return;
        }

        if (outcome.error == null) {
            notifyObserver(() -> observer.onAcknowledged(entry, outcome.position));
        } else {
            notifyObserver(() -> observer.onFailed(entry, outcome.error));
        }
    }

    private void sweepExpired() {
        long now = System.nanoTime();
        if (now - lastSweepNanos < sweepIntervalNanos) {
            return;
        }
        lastSweepNanos = now;

        Instant cutoff = clock.instant().minus(pendingTtl);
        Iterator<PendingPublishEntry<C>> it = pending.values().iterator();
        while (it.hasNext()) {
            PendingPublishEntry<C> entry = it.next();
            if (entry.getEnqueuedAt().isBefore(cutoff)) {
                it.remove();
                notifyObserver(() -> observer.onExpired(entry));
            }
        }
    }

    private MessagingTransportException closeLoop() {
        List<LoopEvent> leftovers = new ArrayList<>();
        synchronized (lifecycleMonitor) {
            state = State.CLOSED;
            events.drainTo(leftovers);
        }

        int dropped = 0;
        for (LoopEvent event : leftovers) {
            if (event instanceof HandOff) {
                ((HandOff) event).reject(new PublisherClosedException());
                releaseIngressPermit();
            } else if (event instanceof Snapshot) {
                ((Snapshot) event).result.completeExceptionally(new PublisherClosedException());
            } else if (event instanceof Outcome) {
                dropped++;
            }
        }
        if (dropped > 0 || !pending.isEmpty()) {
            log.warn("⚠️ [async_producer] Closing with {} pending publishes, {} late outcomes dropped",
                    pending.size(), dropped);
        }

        try {
            transport.close();
            return null;
        } catch (Exception e) {
            return new MessagingTransportException("Failed to close transport", e);
        }
    }

    private void submitOutcome(Outcome outcome) {
        synchronized (lifecycleMonitor) {
            if (state == State.CLOSED) {
                log.debug("[async_producer] Listener closed, dropping outcome for topic {}",
                        outcome.message.getTopic());
                return;
            }
            events.add(outcome);
        }
    }

    private String extractCorrelationId(OutgoingMessage message) {
        if (message == null) {
            return null;
        }
        try {
            String id = correlationIdExtractor.extract(message);
            return id == null || id.isEmpty() ? null : id;
        } catch (RuntimeException e) {
            log.warn("Correlation ID extraction failed for topic {}: {}", message.getTopic(), e.getMessage());
            return null;
        }
    }

    private void awaitHandOff(HandOff handOff) {
        try {
            handOff.result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagingTransportException("Interrupted while waiting for publish hand-off", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new MessagingTransportException("Publish hand-off failed", cause);
        }
    }

    private void releaseIngressPermit() {
        if (ingressPermits != null) {
            ingressPermits.release();
        }
    }

    private void notifyObserver(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Publish observer failed: {}", e.getMessage(), e);
        }
    }

    private interface LoopEvent {
    }

    private static final class HandOff implements LoopEvent {
        private final OutgoingMessage message;
        private final CompletableFuture<Void> result = new CompletableFuture<>();

        private HandOff(OutgoingMessage message) {
            this.message = message;
        }

        private void accept() {
            result.complete(null);
        }

        private void reject(Throwable error) {
            result.completeExceptionally(error);
        }
    }

    private static final class Outcome implements LoopEvent {
        private final OutgoingMessage message;
        private final DeliveryPosition position;
        private final Exception error;

        private Outcome(OutgoingMessage message, DeliveryPosition position, Exception error) {
            this.message = message;
            this.position = position;
            this.error = error;
        }
    }

    private static final class Snapshot implements LoopEvent {
        private final CompletableFuture<Set<String>> result = new CompletableFuture<>();
    }

    private static final class Shutdown implements LoopEvent {
        private static final Shutdown INSTANCE = new Shutdown();
    }
}
