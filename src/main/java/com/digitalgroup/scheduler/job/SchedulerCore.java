package com.digitalgroup.scheduler.job;

import com.digitalgroup.scheduler.domain.task.Requester;
import com.digitalgroup.scheduler.domain.task.entity.ScheduledTask;
import com.digitalgroup.scheduler.domain.task.enums.TriggerKind;
import com.digitalgroup.scheduler.domain.task.store.TaskStore;
import com.digitalgroup.scheduler.domain.task.trigger.TaskTrigger;
import com.digitalgroup.scheduler.domain.task.trigger.TriggerEngine;
import com.digitalgroup.scheduler.exception.ForbiddenOperationException;
import com.digitalgroup.scheduler.exception.InvalidTaskException;
import com.digitalgroup.scheduler.exception.ResourceNotFoundException;
import com.digitalgroup.scheduler.exception.TaskStateConflictException;
import com.digitalgroup.scheduler.job.dispatch.DispatchRequest;
import com.digitalgroup.scheduler.job.dispatch.DispatchResult;
import com.digitalgroup.scheduler.job.dispatch.TaskDispatcher;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * In-process task scheduler.
 *
 * A single clock thread sleeps until the earliest armed fire time, hands every due task to the
 * {@link TaskDispatcher} and then reschedules or retires it. API operations and the clock thread
 * serialize on one lock, so a task removed concurrently with its firing either does not fire or
 * fires once more before being removed.
 *
 * Dispatch outcomes come back through the dispatcher's futures into a result queue that the clock
 * thread drains and records on the task.
 */
@Slf4j
@Service
public class SchedulerCore {

    private static final Duration ERROR_BACKOFF = Duration.ofSeconds(1);
    private static final Duration RESULT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final TaskStore taskStore;
    private final TriggerEngine triggerEngine;
    private final TaskDispatcher dispatcher;
    private final Clock clock;
    private final boolean autoStart;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();
    private final TreeSet<TimerEntry> timers = new TreeSet<>(
            Comparator.comparing(TimerEntry::fireAt).thenComparing(TimerEntry::taskId));
    private final Map<String, TimerEntry> timersByTask = new HashMap<>();
    private final Queue<DispatchResult> dispatchResults = new ConcurrentLinkedQueue<>();
    private final AtomicInteger inFlightDispatches = new AtomicInteger();

    private Thread clockThread;
    private volatile boolean running;

    public SchedulerCore(TaskStore taskStore,
                         TriggerEngine triggerEngine,
                         TaskDispatcher dispatcher,
                         Clock clock,
                         @Value("${scheduler.auto-start:true}") boolean autoStart) {
        this.taskStore = taskStore;
        this.triggerEngine = triggerEngine;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.autoStart = autoStart;
    }

    @PostConstruct
    public void init() {
        if (autoStart) {
            start();
        }
    }

    /**
     * Re-arms every active task from the store and starts the clock thread.
     */
    public void start() {
        lock.lock();
        try {
            if (running) {
                return;
            }
            recoverActiveTasks();
            running = true;
            clockThread = new Thread(this::runClockLoop, "task-scheduler-clock");
            clockThread.setDaemon(true);
            clockThread.start();
            log.info("SchedulerCore started with {} armed tasks", timers.size());
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        Thread thread;
        lock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            wakeUp.signalAll();
            thread = clockThread;
        } finally {
            lock.unlock();
        }
        try {
            thread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("SchedulerCore shutdown complete");
    }

    public boolean isRunning() {
        return running;
    }

    // ---------------------------------------------------------------- operations

    /**
     * Validates, persists and arms a new task. Nothing is persisted when validation fails.
     */
    public ScheduledTask create(ScheduledTask task) {
        lock.lock();
        try {
            Instant now = clock.instant();
            TaskTrigger trigger = task.getTrigger();
            triggerEngine.validate(trigger, now);

            if (task.getTaskName() != null && taskStore.existsByTaskName(task.getTaskName())) {
                throw new TaskStateConflictException("Task with name '" + task.getTaskName() + "' already exists",
                        TaskStateConflictException.DUPLICATE_NAME);
            }

            Instant firstFire = triggerEngine.computeFirstFire(trigger, now)
                    .orElseThrow(() -> new InvalidTaskException("Task has no valid fire time"));
            task.setNextFireAt(firstFire);

            ScheduledTask saved = taskStore.save(task);
            arm(saved.getId(), firstFire);
            log.info("Task {} ({}) created by owner {}, first run at {}",
                    saved.getId(), saved.getTriggerKind().getValue(), saved.getOwnerId(), firstFire);
            return saved;
        } finally {
            lock.unlock();
        }
    }

    public ScheduledTask pause(String taskId, Requester requester) {
        lock.lock();
        try {
            ScheduledTask task = loadManageable(taskId, requester);
            if (task.isPaused()) {
                throw new TaskStateConflictException("Task " + taskId + " is already paused",
                        TaskStateConflictException.ALREADY_PAUSED);
            }
            disarm(taskId);
            task.setActive(false);
            task.setNextFireAt(null);
            ScheduledTask saved = taskStore.save(task);
            log.info("Task {} paused by {}", taskId, requester);
            return saved;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-activates a paused task at its next fire time not earlier than now.
     * A periodic task whose window has closed while paused is retired and reported as a conflict.
     */
    public ScheduledTask resume(String taskId, Requester requester) {
        lock.lock();
        try {
            ScheduledTask task = loadManageable(taskId, requester);
            if (task.isActive()) {
                throw new TaskStateConflictException("Task " + taskId + " is already running",
                        TaskStateConflictException.ALREADY_RUNNING);
            }
            Optional<Instant> next = triggerEngine.computeFirstFire(task.getTrigger(), clock.instant());
            if (next.isEmpty()) {
                retire(task);
                throw new TaskStateConflictException("Task " + taskId + " has no remaining run time and was removed",
                        TaskStateConflictException.EXHAUSTED);
            }
            task.setActive(true);
            task.setNextFireAt(next.get());
            ScheduledTask saved = taskStore.save(task);
            arm(taskId, next.get());
            log.info("Task {} resumed by {}, next run at {}", taskId, requester, next.get());
            return saved;
        } finally {
            lock.unlock();
        }
    }

    public void remove(String taskId, Requester requester) {
        lock.lock();
        try {
            loadManageable(taskId, requester);
            disarm(taskId);
            taskStore.deleteById(taskId);
            log.info("Task {} removed by {}", taskId, requester);
        } finally {
            lock.unlock();
        }
    }

    public BatchResult removeBatch(List<String> taskIds, Requester requester) {
        return applyBatch(taskIds, requester, (id, r) -> {
            remove(id, r);
            return null;
        });
    }

    public BatchResult pauseBatch(List<String> taskIds, Requester requester) {
        return applyBatch(taskIds, requester, this::pause);
    }

    public BatchResult resumeBatch(List<String> taskIds, Requester requester) {
        return applyBatch(taskIds, requester, this::resume);
    }

    public ScheduledTask get(String taskId) {
        return taskStore.findById(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("Task", "id", taskId));
    }

    public ScheduledTask getByName(String taskName) {
        return taskStore.findByTaskName(taskName)
                .orElseThrow(() -> new ResourceNotFoundException("Task", "name", taskName));
    }

    /**
     * Tasks visible to the requester: all tasks for the system caller, otherwise the requester's own.
     *
     * @param kind   optional trigger kind filter
     * @param paused optional paused-state filter
     */
    public List<ScheduledTask> list(Requester requester, TriggerKind kind, Boolean paused) {
        List<ScheduledTask> tasks = requester.system()
                ? taskStore.findAll()
                : taskStore.findByOwner(requester.userId());
        return tasks.stream()
                .filter(task -> kind == null || task.getTriggerKind() == kind)
                .filter(task -> paused == null || task.isPaused() == paused)
                .collect(Collectors.toList());
    }

    /**
     * Armed fire time of a task, empty when the task is paused, retired or unknown.
     */
    public Optional<Instant> getArmedFireTime(String taskId) {
        lock.lock();
        try {
            return Optional.ofNullable(timersByTask.get(taskId)).map(TimerEntry::fireAt);
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- clock

    /**
     * Fires every task whose armed time is not after now. Called by the clock thread on each wake-up.
     *
     * @return number of tasks fired
     */
    public int runDueTasks() {
        lock.lock();
        try {
            processDispatchResults();
            Instant now = clock.instant();
            int fired = 0;
            while (!timers.isEmpty() && !timers.first().fireAt().isAfter(now)) {
                TimerEntry entry = timers.pollFirst();
                timersByTask.remove(entry.taskId());
                try {
                    if (fire(entry, now)) {
                        fired++;
                    }
                } catch (RuntimeException e) {
                    log.error("Fire of task {} failed, retrying in {}", entry.taskId(), ERROR_BACKOFF, e);
                    rearm(entry, now.plus(ERROR_BACKOFF));
                }
            }
            processDispatchResults();
            return fired;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records dispatch outcomes received so far on their tasks.
     */
    public void processDispatchResults() {
        lock.lock();
        try {
            DispatchResult result;
            while ((result = dispatchResults.poll()) != null) {
                recordDispatchResult(result);
            }
        } finally {
            lock.unlock();
        }
    }

    private void runClockLoop() {
        log.info("Scheduler clock thread started");
        while (running) {
            lock.lock();
            try {
                runDueTasks();
                if (!running) {
                    break;
                }
                if (!dispatchResults.isEmpty()) {
                    continue;
                }
                // workers signal only when the lock is free, so poll while dispatches are outstanding
                boolean polling = inFlightDispatches.get() > 0;
                if (timers.isEmpty() && !polling) {
                    wakeUp.await();
                } else {
                    long waitMs = timers.isEmpty()
                            ? Long.MAX_VALUE
                            : Duration.between(clock.instant(), timers.first().fireAt()).toMillis();
                    if (polling) {
                        waitMs = Math.min(waitMs, RESULT_POLL_INTERVAL.toMillis());
                    }
                    if (waitMs > 0) {
                        wakeUp.await(waitMs, TimeUnit.MILLISECONDS);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Scheduler tick failed, retrying in {}", ERROR_BACKOFF, e);
                awaitQuietly(ERROR_BACKOFF);
            } finally {
                lock.unlock();
            }
        }
        log.info("Scheduler clock thread stopped");
    }

    private boolean fire(TimerEntry entry, Instant now) {
        Optional<ScheduledTask> found = taskStore.findById(entry.taskId());
        if (found.isEmpty() || !found.get().isActive()) {
            log.warn("Skipping fire of task {}: no longer active", entry.taskId());
            return false;
        }
        ScheduledTask task = found.get();
        Instant scheduledAt = entry.scheduledAt();

        inFlightDispatches.incrementAndGet();
        try {
            dispatcher.enqueue(DispatchRequest.of(task, scheduledAt))
                    .whenComplete((result, error) -> onDispatchCompleted(task.getId(), result, error));
            log.info("Task {} fired (scheduled {}), url {}", task.getId(), scheduledAt, task.getTargetUrl());
        } catch (RuntimeException e) {
            inFlightDispatches.decrementAndGet();
            log.error("Hand-off of task {} to dispatcher failed: {}", task.getId(), e.getMessage(), e);
        }

        TaskTrigger trigger = task.getTrigger();
        Optional<Instant> next = triggerEngine.computeNextFire(trigger, scheduledAt);
        if (next.isPresent() && next.get().isBefore(now)) {
            // woke up late, skip the missed fire times
            next = triggerEngine.computeFirstFire(trigger, now);
        }

        if (next.isEmpty()) {
            try {
                retire(task);
            } catch (DataAccessException e) {
                log.error("Could not retire task {} after its last run: {}", task.getId(), e.getMessage());
            }
            return true;
        }
        try {
            task.setNextFireAt(next.get());
            taskStore.save(task);
        } catch (DataAccessException e) {
            log.error("Could not persist next run of task {}: {}", task.getId(), e.getMessage());
        }
        arm(task.getId(), next.get());
        return true;
    }

    private void onDispatchCompleted(String taskId, DispatchResult result, Throwable error) {
        DispatchResult outcome = result != null
                ? result
                : DispatchResult.transportError(taskId, error != null ? error.getMessage() : "unknown", clock.instant());
        dispatchResults.offer(outcome);
        inFlightDispatches.decrementAndGet();
        if (lock.tryLock()) {
            try {
                wakeUp.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

    private void recordDispatchResult(DispatchResult result) {
        if (!result.isSuccess()) {
            log.warn("Task {} dispatch {}: {}", result.taskId(), result.summary(), result.detail());
        }
        Optional<ScheduledTask> found = taskStore.findById(result.taskId());
        if (found.isEmpty()) {
            log.debug("Dispatch result for removed task {}: {}", result.taskId(), result.summary());
            return;
        }
        ScheduledTask task = found.get();
        task.setLastRunAt(result.completedAt());
        task.setLastRunStatus(result.summary());
        try {
            taskStore.save(task);
        } catch (DataAccessException e) {
            log.warn("Could not record dispatch result of task {}: {}", result.taskId(), e.getMessage());
        }
    }

    // ---------------------------------------------------------------- internals

    private void recoverActiveTasks() {
        Instant now = clock.instant();
        List<ScheduledTask> active = taskStore.findActive();
        for (ScheduledTask task : active) {
            Optional<Instant> next = triggerEngine.computeFirstFire(task.getTrigger(), now);
            if (next.isEmpty()) {
                log.info("Task {} expired while the scheduler was down", task.getId());
                retire(task);
                continue;
            }
            ScheduledTask armed = task;
            if (!next.get().equals(task.getNextFireAt())) {
                task.setNextFireAt(next.get());
                armed = taskStore.save(task);
            }
            arm(armed.getId(), next.get());
        }
        if (!active.isEmpty()) {
            log.info("Recovered {} active tasks from the task store", timers.size());
        }
    }

    private BatchResult applyBatch(List<String> taskIds, Requester requester,
                                   BiFunction<String, Requester, ScheduledTask> operation) {
        BatchResult result = BatchResult.empty();
        for (String taskId : taskIds) {
            try {
                operation.apply(taskId, requester);
                result.succeeded().add(taskId);
            } catch (ResourceNotFoundException e) {
                result.notFound().add(taskId);
            } catch (ForbiddenOperationException e) {
                result.forbidden().add(taskId);
            } catch (TaskStateConflictException e) {
                result.conflict().add(taskId);
            }
        }
        log.info("Batch operation by {} on {} tasks: {} succeeded, {} not found, {} forbidden, {} conflict",
                requester, taskIds.size(), result.succeeded().size(), result.notFound().size(),
                result.forbidden().size(), result.conflict().size());
        return result;
    }

    private ScheduledTask loadManageable(String taskId, Requester requester) {
        ScheduledTask task = get(taskId);
        if (!requester.canManage(task)) {
            throw new ForbiddenOperationException("Task " + taskId + " does not belong to " + requester);
        }
        return task;
    }

    private void retire(ScheduledTask task) {
        disarm(task.getId());
        taskStore.deleteById(task.getId());
        log.info("Task {} has no remaining run time and was retired", task.getId());
    }

    private void arm(String taskId, Instant fireAt) {
        schedule(new TimerEntry(fireAt, taskId, fireAt));
    }

    /**
     * Puts a failed timer back at {@code retryAt}, keeping its original scheduled time.
     * Skipped when an API operation re-armed the task meanwhile.
     */
    private void rearm(TimerEntry entry, Instant retryAt) {
        if (timersByTask.containsKey(entry.taskId())) {
            return;
        }
        schedule(new TimerEntry(retryAt, entry.taskId(), entry.scheduledAt()));
    }

    private void schedule(TimerEntry entry) {
        disarm(entry.taskId());
        timers.add(entry);
        timersByTask.put(entry.taskId(), entry);
        wakeUp.signalAll();
    }

    private void disarm(String taskId) {
        TimerEntry entry = timersByTask.remove(taskId);
        if (entry != null) {
            timers.remove(entry);
        }
    }

    private void awaitQuietly(Duration duration) {
        try {
            wakeUp.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    /**
     * @param fireAt      when the clock thread picks the entry up
     * @param scheduledAt the trigger's fire time, earlier than {@code fireAt} only after a failed attempt
     */
    private record TimerEntry(Instant fireAt, String taskId, Instant scheduledAt) {
    }
}
