package com.linlay.agentstream.stream.session;

import com.linlay.agentstream.config.StreamSessionProperties;
import com.linlay.agentstream.stream.model.AgentEvent;
import com.linlay.agentstream.stream.model.AgentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one agent computation on a background thread and hands its events to a single
 * consumer through a queue.
 * <p>
 * The consumer polls with a short wait so it can notice a producer that died without a
 * terminal event, and enforces an overall deadline by emitting a synthetic
 * {@code force_stop} with reason {@value #TIMEOUT_REASON}. The computation cannot be
 * interrupted: after a timeout or early cancellation it is abandoned, and whatever it
 * still posts is discarded.
 */
public class StreamSession {

    public static final String TIMEOUT_REASON = "Timeout";

    private static final Logger log = LoggerFactory.getLogger(StreamSession.class);

    private static final ExecutorService PRODUCER_EXECUTOR = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "agent-stream-producer");
        thread.setDaemon(true);
        return thread;
    });

    private final AgentComputation computation;
    private final SessionState state;
    private final StreamSessionProperties properties;
    private final ExecutorService executor;
    private final BlockingQueue<QueuedEvent> queue;
    private final AtomicLong generations = new AtomicLong();
    private final AtomicBoolean subscribed = new AtomicBoolean();

    private volatile long acceptingGeneration;
    private volatile Future<?> producer;
    private volatile long startedAtNanos;
    private volatile SessionStatus status = SessionStatus.IDLE;
    private volatile SessionStatus outcome;

    public StreamSession(AgentComputation computation, SessionState state, StreamSessionProperties properties) {
        this(computation, state, properties, PRODUCER_EXECUTOR);
    }

    public StreamSession(
            AgentComputation computation,
            SessionState state,
            StreamSessionProperties properties,
            ExecutorService executor
    ) {
        this.computation = Objects.requireNonNull(computation, "computation must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        if (properties.getPollTimeoutMs() <= 0 || properties.getOverallTimeoutMs() <= 0) {
            throw new IllegalArgumentException("poll and overall timeouts must be positive");
        }
        this.queue = properties.getQueueCapacity() > 0
                ? new LinkedBlockingQueue<>(properties.getQueueCapacity())
                : new LinkedBlockingQueue<>();
    }

    /**
     * Clears stale events, resets the session state and launches the computation.
     */
    public synchronized void start(String input) {
        if (status == SessionStatus.RUNNING) {
            throw new IllegalStateException("Stream session is already running");
        }
        long runGeneration = generations.incrementAndGet();
        queue.clear();
        state.reset();
        subscribed.set(false);
        outcome = null;
        startedAtNanos = System.nanoTime();
        acceptingGeneration = runGeneration;
        status = SessionStatus.RUNNING;
        producer = executor.submit(() -> produce(runGeneration, input));
        log.debug("stream session started generation={}", runGeneration);
    }

    /**
     * Cold, single-subscription sequence of the current run's events. Ends after a
     * terminal event, after the producer died silently, or after the synthetic timeout
     * event. Cleanup runs on every kind of termination, including cancellation: the run is
     * released on the terminating thread, and the bounded wait for the producer happens on
     * {@link Schedulers#boundedElastic()}. Completion and error signals are delivered only
     * after that wait; a cancelling thread is never blocked by it.
     */
    public Flux<AgentEvent> events() {
        return Flux.usingWhen(
                        Mono.fromCallable(this::claimSubscription),
                        run -> Flux.<AgentEvent, Boolean>generate(() -> Boolean.FALSE, (ended, sink) -> {
                            if (ended) {
                                sink.complete();
                                return Boolean.TRUE;
                            }
                            AgentEvent next = awaitNext(run.generation());
                            if (next == null || run.generation() != acceptingGeneration) {
                                sink.complete();
                                return Boolean.TRUE;
                            }
                            sink.next(next);
                            return next.isTerminal();
                        }),
                        run -> Mono.fromRunnable(() -> release(run.generation()))
                                .then(Mono.fromRunnable(() -> awaitProducer(run))
                                        .subscribeOn(Schedulers.boundedElastic()))
                )
                .subscribeOn(Schedulers.boundedElastic());
    }

    public SessionStatus status() {
        return status;
    }

    /**
     * How the last run ended, kept after the session has been drained. {@code null} while
     * running, or when the consumer stopped before the run reached an end.
     */
    public SessionStatus outcome() {
        return outcome;
    }

    public SessionState state() {
        return state;
    }

    private synchronized ClaimedRun claimSubscription() {
        if (status == SessionStatus.IDLE || status == SessionStatus.DRAINED) {
            throw new IllegalStateException("Stream session has not been started");
        }
        if (!subscribed.compareAndSet(false, true)) {
            throw new IllegalStateException("Stream session events can only be consumed once per run");
        }
        return new ClaimedRun(acceptingGeneration, producer);
    }

    private void produce(long runGeneration, String input) {
        AgentEvent terminal;
        try {
            AgentResult result = computation.invoke(input, payload -> enqueue(runGeneration, AgentEvent.of(payload)));
            terminal = AgentEvent.result(result);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            terminal = AgentEvent.forceStop("Interrupted");
        } catch (Exception ex) {
            log.warn("agent computation failed generation={}", runGeneration, ex);
            terminal = AgentEvent.forceStop(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
        }
        enqueue(runGeneration, terminal);
    }

    private void enqueue(long runGeneration, AgentEvent event) {
        if (runGeneration != acceptingGeneration) {
            log.debug("discard late event from abandoned run generation={}", runGeneration);
            return;
        }
        if (!queue.offer(new QueuedEvent(runGeneration, event))) {
            log.warn("stream queue full, event dropped generation={}, keys={}", runGeneration, event.payload().keySet());
        }
    }

    private AgentEvent awaitNext(long runGeneration) {
        try {
            while (runGeneration == acceptingGeneration) {
                QueuedEvent queued = queue.poll(properties.getPollTimeoutMs(), TimeUnit.MILLISECONDS);
                if (queued != null) {
                    if (queued.generation() == runGeneration) {
                        return accept(runGeneration, queued.event());
                    }
                    continue;
                }
                if (isProducerDone()) {
                    return finalPoll(runGeneration);
                }
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAtNanos);
                if (elapsedMs >= properties.getOverallTimeoutMs()) {
                    log.warn("agent computation timed out after {} ms, abandoning it", elapsedMs);
                    outcome = SessionStatus.TIMED_OUT;
                    status = SessionStatus.TIMED_OUT;
                    return AgentEvent.forceStop(TIMEOUT_REASON);
                }
            }
            return null;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.debug("stream consumer interrupted generation={}", runGeneration);
            return null;
        }
    }

    private AgentEvent finalPoll(long runGeneration) {
        QueuedEvent queued;
        while ((queued = queue.poll()) != null) {
            if (queued.generation() == runGeneration) {
                return accept(runGeneration, queued.event());
            }
        }
        if (runGeneration == acceptingGeneration) {
            log.warn("agent computation ended without a terminal event generation={}", runGeneration);
            outcome = SessionStatus.COMPLETED;
            status = SessionStatus.COMPLETED;
        }
        return null;
    }

    private AgentEvent accept(long runGeneration, AgentEvent event) {
        if (runGeneration != acceptingGeneration) {
            return event;
        }
        if (event.isForceStop()) {
            outcome = SessionStatus.FORCE_STOPPED;
            status = SessionStatus.FORCE_STOPPED;
        } else if (event.isFinalResult()) {
            outcome = SessionStatus.COMPLETED;
            status = SessionStatus.COMPLETED;
        }
        return event;
    }

    private boolean isProducerDone() {
        Future<?> running = producer;
        return running == null || running.isDone();
    }

    /**
     * Stops accepting the run's events and drains them. Never blocks.
     */
    private void release(long runGeneration) {
        synchronized (this) {
            if (acceptingGeneration == runGeneration) {
                acceptingGeneration = 0;
            }
            if (generations.get() == runGeneration) {
                status = SessionStatus.DRAINED;
            }
        }
        discardQueued(runGeneration);
    }

    private void awaitProducer(ClaimedRun run) {
        long runGeneration = run.generation();
        Future<?> running = run.producer();
        if (running != null) {
            try {
                running.get(properties.getJoinTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException ex) {
                log.warn(
                        "agent computation still running after {} ms, abandoned generation={}",
                        properties.getJoinTimeoutMs(),
                        runGeneration
                );
            } catch (ExecutionException ex) {
                log.warn("agent computation terminated abnormally generation={}", runGeneration, ex.getCause());
            } catch (CancellationException ex) {
                log.debug("agent computation cancelled generation={}", runGeneration);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.debug("interrupted while awaiting agent computation generation={}", runGeneration);
            }
        }
        discardQueued(runGeneration);
    }

    private void discardQueued(long runGeneration) {
        int before = queue.size();
        queue.removeIf(queued -> queued.generation() == runGeneration);
        int discarded = before - queue.size();
        if (discarded > 0) {
            log.debug("discarded {} queued events generation={}", discarded, runGeneration);
        }
    }

    private record QueuedEvent(long generation, AgentEvent event) {
    }

    private record ClaimedRun(long generation, Future<?> producer) {
    }
}
