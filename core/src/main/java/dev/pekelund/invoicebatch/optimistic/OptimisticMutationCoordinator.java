package dev.pekelund.invoicebatch.optimistic;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Tracks optimistic operations between the moment their local effect is applied and the moment
 * the server confirms or rejects them.
 *
 * <p>Every operation is resolved exactly once. Confirmation, rejection and the timeout sweep all
 * go through {@code pending.remove(key, entry)}; whoever removes the entry owns the outcome and
 * anything arriving later is ignored.
 *
 * <p>Mutations of the same entity are not serialised. Callers avoid issuing conflicting
 * operations concurrently.
 */
public class OptimisticMutationCoordinator implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(OptimisticMutationCoordinator.class);

    private final OptimisticProperties properties;
    private final Executor executor;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final RollbackListener rollbackListener;

    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentMap<OperationKey, PendingEntry> pending = new ConcurrentHashMap<>();
    private ScheduledFuture<?> sweepTask;

    public OptimisticMutationCoordinator(OptimisticProperties properties, Executor executor,
        ScheduledExecutorService scheduler, Clock clock, RollbackListener rollbackListener) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.scheduler = scheduler;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.rollbackListener = rollbackListener != null ? rollbackListener : RollbackListener.NONE;
    }

    /**
     * Apply {@code operation} locally and confirm it with a blocking server call run on the
     * coordinator executor.
     */
    public OperationKey apply(OptimisticOperation operation, RemoteMutation call, MutationCallbacks callbacks) {
        return applyBatch(List.of(operation), call, callbacks).get(0);
    }

    /**
     * Apply {@code operation} locally and confirm it with a non-blocking server call.
     */
    public OperationKey apply(OptimisticOperation operation, Supplier<? extends CompletionStage<?>> call,
        MutationCallbacks callbacks) {
        Objects.requireNonNull(call, "call");
        PendingGroup group = register(List.of(operation), callbacks);
        CompletionStage<?> stage;
        try {
            stage = call.get();
        } catch (RuntimeException ex) {
            stage = CompletableFuture.failedFuture(ex);
        }
        if (stage == null) {
            stage = CompletableFuture.failedFuture(new IllegalStateException("Remote call returned no result"));
        }
        stage.whenComplete((ignored, error) -> resolve(group, error));
        return group.keys().get(0);
    }

    /**
     * Apply several operations locally and confirm them with one server call. The batch is all
     * or nothing on the client: if the call fails every operation is rolled back.
     */
    public List<OperationKey> applyBatch(List<? extends OptimisticOperation> operations, RemoteMutation call,
        MutationCallbacks callbacks) {
        Objects.requireNonNull(call, "call");
        PendingGroup group = register(operations, callbacks);

        CompletableFuture<Void> remote;
        try {
            remote = CompletableFuture.runAsync(() -> execute(call), executor);
        } catch (RejectedExecutionException ex) {
            remote = CompletableFuture.failedFuture(ex);
        }
        remote.whenComplete((ignored, error) -> resolve(group, error));
        return group.keys();
    }

    public boolean hasPendingOperation(String entityId) {
        return pending.keySet().stream().anyMatch(key -> key.entityId().equals(entityId));
    }

    public List<OptimisticOperation> pendingOperations() {
        return pending.values().stream().map(PendingEntry::operation).toList();
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Roll back every operation that has been pending longer than the configured timeout.
     *
     * @return number of operations rolled back
     */
    public int sweepExpired() {
        Duration timeout = properties.getOperationTimeout();
        Instant now = clock.instant();
        Map<PendingGroup, OperationKey> expired = new IdentityHashMap<>();
        for (Map.Entry<OperationKey, PendingEntry> entry : pending.entrySet()) {
            PendingGroup group = entry.getValue().group();
            if (!now.isBefore(group.registeredAt().plus(timeout))) {
                expired.putIfAbsent(group, entry.getKey());
            }
        }

        int rolledBack = 0;
        for (Map.Entry<PendingGroup, OperationKey> entry : expired.entrySet()) {
            rolledBack += rollback(entry.getKey(), RollbackReason.TIMED_OUT,
                new OptimisticOperationTimeoutException(entry.getValue(), timeout));
        }
        return rolledBack;
    }

    public synchronized void start() {
        if (sweepTask != null || scheduler == null) {
            return;
        }
        long interval = properties.getSweepInterval().toMillis();
        Assert.isTrue(interval > 0, "invoice.optimistic.sweep-interval must be positive");
        sweepTask = scheduler.scheduleWithFixedDelay(this::sweepSafely, interval, interval, TimeUnit.MILLISECONDS);
        LOGGER.info("Optimistic operation sweep scheduled every {} ms (timeout {})", interval,
            properties.getOperationTimeout());
    }

    @Override
    public synchronized void close() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
    }

    private PendingGroup register(List<? extends OptimisticOperation> operations, MutationCallbacks callbacks) {
        Assert.notEmpty(operations, "At least one operation is required");
        Objects.requireNonNull(callbacks, "callbacks");

        PendingGroup group = new PendingGroup(callbacks, clock.instant());
        for (OptimisticOperation operation : operations) {
            Objects.requireNonNull(operation, "operation");
            OperationKey key = new OperationKey(operation.kind(), operation.entityId(), sequence.incrementAndGet());
            PendingEntry entry = new PendingEntry(operation, group);
            group.add(key, entry);
            pending.put(key, entry);
        }

        try {
            callbacks.onSuccess(group.operations());
        } catch (RuntimeException ex) {
            group.removeFrom(pending);
            throw ex;
        }
        LOGGER.debug("Registered {} optimistic operation(s): {}", group.keys().size(), group.keys());
        return group;
    }

    private void resolve(PendingGroup group, Throwable error) {
        if (error == null) {
            List<OptimisticOperation> confirmed = group.removeFrom(pending);
            if (confirmed.isEmpty()) {
                LOGGER.debug("Ignoring late confirmation of {}", group.keys());
                return;
            }
            try {
                group.callbacks().onConfirmed(confirmed);
            } catch (RuntimeException ex) {
                LOGGER.warn("Confirmation callback failed for {}", group.keys(), ex);
            }
            return;
        }
        rollback(group, RollbackReason.REMOTE_FAILURE, unwrap(error));
    }

    private int rollback(PendingGroup group, RollbackReason reason, Throwable cause) {
        List<OptimisticOperation> rolledBack = group.removeFrom(pending);
        if (rolledBack.isEmpty()) {
            LOGGER.debug("Ignoring late {} of {}; already resolved", reason, group.keys());
            return 0;
        }

        LOGGER.warn("Rolling back {} optimistic operation(s) ({}): {}", rolledBack.size(), reason,
            cause != null ? cause.getMessage() : null);
        for (OptimisticOperation operation : rolledBack) {
            try {
                rollbackListener.onRollback(new RollbackNotification(operation, reason, cause));
            } catch (RuntimeException ex) {
                LOGGER.error("Rollback listener failed for {} {}", operation.kind(), operation.entityId(), ex);
            }
        }
        try {
            group.callbacks().onError(rolledBack, cause);
        } catch (RuntimeException ex) {
            LOGGER.error("Error callback failed for {}", group.keys(), ex);
        }
        return rolledBack.size();
    }

    private void sweepSafely() {
        try {
            int rolledBack = sweepExpired();
            if (rolledBack > 0) {
                LOGGER.info("Timed out {} optimistic operation(s)", rolledBack);
            }
        } catch (RuntimeException ex) {
            LOGGER.error("Optimistic operation sweep failed", ex);
        }
    }

    private static void execute(RemoteMutation call) {
        try {
            call.execute();
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new CompletionException(ex);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private record PendingEntry(OptimisticOperation operation, PendingGroup group) {
    }

    /**
     * Operations registered together; they are confirmed or rolled back together.
     */
    private static final class PendingGroup {

        private final MutationCallbacks callbacks;
        private final Instant registeredAt;
        private final Map<OperationKey, PendingEntry> entries = Collections.synchronizedMap(new LinkedHashMap<>());

        PendingGroup(MutationCallbacks callbacks, Instant registeredAt) {
            this.callbacks = callbacks;
            this.registeredAt = registeredAt;
        }

        MutationCallbacks callbacks() {
            return callbacks;
        }

        Instant registeredAt() {
            return registeredAt;
        }

        void add(OperationKey key, PendingEntry entry) {
            entries.put(key, entry);
        }

        List<OperationKey> keys() {
            synchronized (entries) {
                return List.copyOf(entries.keySet());
            }
        }

        List<OptimisticOperation> operations() {
            synchronized (entries) {
                return entries.values().stream().map(PendingEntry::operation).toList();
            }
        }

        List<OptimisticOperation> removeFrom(ConcurrentMap<OperationKey, PendingEntry> pending) {
            List<OptimisticOperation> removed = new ArrayList<>();
            synchronized (entries) {
                for (Map.Entry<OperationKey, PendingEntry> entry : entries.entrySet()) {
                    if (pending.remove(entry.getKey(), entry.getValue())) {
                        removed.add(entry.getValue().operation());
                    }
                }
            }
            return removed;
        }
    }
}
