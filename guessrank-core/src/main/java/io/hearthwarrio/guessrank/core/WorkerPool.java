package io.hearthwarrio.guessrank.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed number of worker threads draining a shared task queue.
 * <p>
 * Lifecycle: workers start in the constructor, tasks are added with {@link #submit(String, Runnable)}
 * from any thread, and {@link #shutdownAndJoin()} waits until every submitted task has run.
 * <p>
 * A worker exits only after shutdown was requested <b>and</b> the queue is empty. An empty queue alone
 * never ends a worker, because submissions may still be on their way.
 * <p>
 * A {@link RuntimeException} thrown by a task is recorded as a {@link TaskFailure} and the worker moves on.
 * An {@link Error} is recorded and then ends its worker.
 */
public final class WorkerPool {

    private static final String THREAD_NAME_PREFIX = "guessrank-worker-";

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition workAvailable = lock.newCondition();

    /**
     * Guarded by {@link #lock}.
     */
    private final Deque<NamedTask> queue = new ArrayDeque<>();
    private boolean shutdown = false;
    private long submitted = 0;
    private long completed = 0;
    private final List<TaskFailure> failures = new ArrayList<>();

    private final List<Thread> workers;

    /**
     * Creates a pool with one worker per available processor.
     */
    public WorkerPool() {
        this(defaultWorkerCount());
    }

    /**
     * Creates a pool with the given number of workers.
     *
     * @param workerCount number of threads; values below 1 are raised to 1
     */
    public WorkerPool(int workerCount) {
        int n = Math.max(1, workerCount);
        List<Thread> threads = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Thread t = new Thread(this::runWorker, THREAD_NAME_PREFIX + i);
            t.setDaemon(true);
            threads.add(t);
        }
        this.workers = Collections.unmodifiableList(threads);
        for (Thread t : workers) {
            t.start();
        }
    }

    public static int defaultWorkerCount() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public int getWorkerCount() {
        return workers.size();
    }

    /**
     * Enqueues a task. Never waits for the task to run.
     *
     * @param task task to execute once
     * @throws IllegalStateException if the pool is shut down
     */
    public void submit(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        lock.lock();
        try {
            enqueue("task-" + submitted, task);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enqueues a named task. The name is used in {@link TaskFailure}.
     *
     * @param name task name for diagnostics
     * @param task task to execute once
     * @throws IllegalStateException if the pool is shut down
     */
    public void submit(String name, Runnable task) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(task, "task must not be null");
        lock.lock();
        try {
            enqueue(name, task);
        } finally {
            lock.unlock();
        }
    }

    private void enqueue(String name, Runnable task) {
        if (shutdown) {
            throw new IllegalStateException("Worker pool is shut down, task rejected: " + name);
        }
        queue.addLast(new NamedTask(name, task));
        submitted++;
        workAvailable.signal();
    }

    /**
     * Stops accepting tasks, waits for all submitted tasks to complete and for the workers to exit.
     * Calling it again is a no-op once workers are gone.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting
     * @throws WorkerPoolException  if workers died while tasks were still queued
     */
    public void shutdownAndJoin() throws InterruptedException {
        lock.lock();
        try {
            shutdown = true;
            workAvailable.signalAll();
        } finally {
            lock.unlock();
        }

        for (Thread t : workers) {
            t.join();
        }

        int abandoned;
        lock.lock();
        try {
            abandoned = queue.size();
            queue.clear();
        } finally {
            lock.unlock();
        }
        if (abandoned > 0) {
            throw new WorkerPoolException(
                    abandoned + " task(s) never ran: all workers terminated on fatal errors " + failures()
            );
        }
    }

    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    public long submittedCount() {
        lock.lock();
        try {
            return submitted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of tasks that finished, successfully or not.
     */
    public long completedCount() {
        lock.lock();
        try {
            return completed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of failures recorded so far. Complete once {@link #shutdownAndJoin()} returned.
     */
    public List<TaskFailure> failures() {
        lock.lock();
        try {
            return List.copyOf(failures);
        } finally {
            lock.unlock();
        }
    }

    private void runWorker() {
        while (true) {
            NamedTask next;
            lock.lock();
            try {
                while (queue.isEmpty() && !shutdown) {
                    workAvailable.awaitUninterruptibly();
                }
                next = queue.pollFirst();
            } finally {
                lock.unlock();
            }

            if (next == null) {
                // shut down and drained
                return;
            }
            runTask(next);
        }
    }

    private void runTask(NamedTask task) {
        try {
            task.task.run();
            finished(null);
        } catch (RuntimeException e) {
            finished(new TaskFailure(task.name, e));
        } catch (Error e) {
            finished(new TaskFailure(task.name, e));
            throw e;
        }
    }

    private void finished(TaskFailure failure) {
        lock.lock();
        try {
            completed++;
            if (failure != null) {
                failures.add(failure);
            }
        } finally {
            lock.unlock();
        }
    }

    private static final class NamedTask {
        private final String name;
        private final Runnable task;

        private NamedTask(String name, Runnable task) {
            this.name = name;
            this.task = task;
        }
    }
}
