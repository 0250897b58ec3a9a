package com.questrail.hostlink.exec;

import com.questrail.hostlink.api.Command;
import com.questrail.hostlink.api.CommandResponse;
import com.questrail.hostlink.api.SessionApi;
import com.questrail.hostlink.api.SessionException;
import com.questrail.hostlink.observability.CommandExecutedEvent;
import com.questrail.hostlink.observability.CommandRejectedEvent;
import com.questrail.hostlink.observability.DispatchErrorEvent;
import com.questrail.hostlink.observability.DispatchErrorKind;
import com.questrail.hostlink.observability.DispatchObservabilitySink;
import com.questrail.hostlink.observability.NullObservabilitySink;
import com.questrail.hostlink.observability.RejectionReason;
import com.questrail.hostlink.registry.CommandDescriptor;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ExecutionSerializer
 * =============================================================================
 * The single choke point where commands touch host state.
 *
 * <h2>Purpose</h2>
 * Any number of producers (every reliable connection, the lossy receive loop)
 * submit classified commands. Exactly one consumer thread dequeues them and
 * invokes the {@link SessionApi}. This gives:
 * <ul>
 *   <li>Single-writer access to host state, without locks inside the host</li>
 *   <li>FIFO execution in dequeue order across all producers combined</li>
 *   <li>One command fully completes before the next begins</li>
 * </ul>
 *
 * <p>FIFO is defined by the order in which submissions enter the queue. Two
 * producers racing to submit are ordered by whichever enqueues first; no
 * ordering between the reliable and lossy transports is implied.</p>
 *
 * <h2>Threading Model</h2>
 * <pre>
 *   serializer.start()                    → starts the consumer thread
 *   serializer.submit(descriptor, cmd, r) → enqueues, never runs the handler
 *   serializer.stop()                     → stops the consumer, fails queued tasks
 * </pre>
 *
 * <h2>Backpressure</h2>
 * The queue is bounded. When it is full the submission is either rejected at
 * once or after waiting up to the offer timeout, depending on
 * {@link QueueFullPolicy}. A rejected submission completes its responder with
 * an error on the submitting thread.
 *
 * <h2>Failure isolation</h2>
 * Handler exceptions and errors are caught per command and converted into an
 * error response. They never stop the consumer loop or affect queued commands.
 */
public final class ExecutionSerializer {

    static final String QUEUE_FULL_MESSAGE = "Execution queue full";
    static final String STOPPED_MESSAGE = "Serializer stopped";

    private static final long POLL_INTERVAL_MILLIS = 100;

    private final SessionApi session;
    private final SerializerConfig config;
    private final DispatchObservabilitySink observabilitySink;

    private final BlockingQueue<PendingTask> taskQueue;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread consumerThread;

    public ExecutionSerializer(SessionApi session,
                               SerializerConfig config,
                               DispatchObservabilitySink observabilitySink)
    {
        this.session = Objects.requireNonNull(session, "session");
        this.config = Objects.requireNonNull(config, "config");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.taskQueue = new ArrayBlockingQueue<>(config.queueCapacity());
    }

    public ExecutionSerializer(SessionApi session) {
        this(session, SerializerConfig.defaults(), null);
    }

    /**
     * Starts the consumer thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            Thread t = new Thread(this::runConsumerLoop, "hostlink-serializer");
            t.setDaemon(true);
            consumerThread = t;
            t.start();
        }
    }

    /**
     * Stops the consumer thread.
     *
     * <p>A command that is executing when stop is requested runs to completion.
     * Commands still queued afterwards are completed with an error and never
     * executed.</p>
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread t = consumerThread;
            if (t != null && t != Thread.currentThread()) {
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            failQueuedTasks();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Returns {@code true} if the calling thread is the consumer context, the
     * only context allowed to touch host state.
     */
    public boolean inConsumerContext() {
        return Thread.currentThread() == consumerThread;
    }

    public int queuedTasks() {
        return taskQueue.size();
    }

    /**
     * Returns {@code true} if {@link #submit} may wait for queue space, so
     * callers on a shared I/O thread must submit from elsewhere.
     */
    public boolean submitMayBlock() {
        return config.queueFullPolicy() == QueueFullPolicy.BLOCK;
    }

    /**
     * Submits a classified command for execution.
     *
     * <p>Never executes the handler on the calling thread. Under
     * {@link QueueFullPolicy#BLOCK} the call may wait up to the configured offer
     * timeout for queue space; otherwise it returns immediately.</p>
     *
     * @param descriptor registry entry the command was classified as
     * @param command    the decoded command
     * @param responder  receives the outcome exactly once
     * @return {@code true} if the command was queued; {@code false} if it was
     *         rejected (the responder has then already received an error)
     */
    public boolean submit(CommandDescriptor descriptor, Command command, Responder responder) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(responder, "responder");

        if (!running.get()) {
            reject(command, responder, RejectionReason.SERIALIZER_STOPPED, STOPPED_MESSAGE);
            return false;
        }

        PendingTask task = new PendingTask(command, descriptor, responder, System.nanoTime());
        if (!enqueue(task)) {
            reject(command, responder, RejectionReason.QUEUE_FULL, QUEUE_FULL_MESSAGE);
            return false;
        }

        // stop() may have drained the queue between the running check and the offer.
        if (!running.get()) {
            failQueuedTasks();
        }
        return true;
    }

    private boolean enqueue(PendingTask task) {
        if (config.queueFullPolicy() == QueueFullPolicy.REJECT) {
            return taskQueue.offer(task);
        }
        try {
            return taskQueue.offer(task, config.offerTimeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Main consumer loop - runs on the dedicated thread.
     */
    private void runConsumerLoop() {
        while (running.get()) {
            try {
                PendingTask task = taskQueue.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
                if (task != null) {
                    execute(task);
                }
            } catch (InterruptedException e) {
                if (!running.get()) {
                    return;
                }
            } catch (RuntimeException | Error e) {
                observabilitySink.onError(new DispatchErrorEvent(
                    Instant.now(),
                    DispatchErrorKind.HANDLER,
                    "Command processing error",
                    e
                ));
            }
        }
    }

    /**
     * Executes one task: invoke the handler, report, then hand the response to
     * the responder.
     */
    private void execute(PendingTask task) {
        Command command = task.command();
        long started = System.nanoTime();

        CommandResponse response;
        Throwable failure = null;
        try {
            Object result = task.descriptor().handler().handle(session, command);
            response = CommandResponse.success(result);
        } catch (SessionException e) {
            failure = e;
            response = CommandResponse.error(e.getMessage() != null ? e.getMessage() : "Host session error");
        } catch (InterruptedException e) {
            failure = e;
            response = CommandResponse.error("Command interrupted");
            Thread.currentThread().interrupt();
        } catch (Exception | Error e) {
            // Errors included: the consumer thread must outlive any handler.
            failure = e;
            response = CommandResponse.error(describe(e));
        }

        observabilitySink.onCommandExecuted(new CommandExecutedEvent(
            Instant.now(),
            command,
            response,
            Duration.ofNanos(started - task.enqueuedNanos()),
            Duration.ofNanos(System.nanoTime() - started),
            failure
        ));

        try {
            task.responder().complete(response);
        } catch (RuntimeException e) {
            observabilitySink.onError(new DispatchErrorEvent(
                Instant.now(),
                DispatchErrorKind.TRANSPORT,
                "Responder failed for " + command.name(),
                e
            ));
        }
    }

    private void failQueuedTasks() {
        PendingTask task;
        while ((task = taskQueue.poll()) != null) {
            reject(task.command(), task.responder(), RejectionReason.SERIALIZER_STOPPED, STOPPED_MESSAGE);
        }
    }

    private void reject(Command command, Responder responder, RejectionReason reason, String message) {
        observabilitySink.onCommandRejected(new CommandRejectedEvent(
            Instant.now(),
            command.transport(),
            command.name(),
            reason,
            message,
            null
        ));
        try {
            responder.complete(CommandResponse.error(message));
        } catch (RuntimeException e) {
            observabilitySink.onError(new DispatchErrorEvent(
                Instant.now(),
                DispatchErrorKind.TRANSPORT,
                "Responder failed for rejected " + command.name(),
                e
            ));
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }
}
