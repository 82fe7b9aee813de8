package com.consullo.standby.reminder;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the {@link ReminderStateMachine} and runs it on a single worker thread.
 *
 * <p>
 * The periodic tick and every external request are executed as tasks on the
 * same thread, so the machine has exactly one writer. External callers block
 * until their request has run. Requests issued from the worker thread itself
 * (for example from a listener) run inline.
 * </p>
 *
 * <p>
 * The worker is a daemon thread. {@link #close()} cancels the tick, drains
 * queued requests and joins the thread.
 * </p>
 */
public final class ReminderScheduler implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReminderScheduler.class);

  private static final long SHUTDOWN_TIMEOUT_MILLIS = 5_000L;

  private final ReminderStateMachine machine;
  private final Duration period;
  private final ScheduledExecutorService executor;

  private volatile Thread worker;
  private ScheduledFuture<?> tickFuture;

  /**
   * Creates a scheduler.
   *
   * @param machine state machine to own; must not be used by anyone else afterwards
   * @param period tick cadence
   */
  public ReminderScheduler(final ReminderStateMachine machine, final Duration period) {
    Validate.notNull(machine, "machine must not be null");
    Validate.notNull(period, "period must not be null");
    Validate.isTrue(!period.isNegative() && !period.isZero(), "period must be positive");
    this.machine = machine;
    this.period = period;
    this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "ReminderScheduler");
      t.setDaemon(true);
      worker = t;
      return t;
    });
  }

  /**
   * Starts the periodic tick. The first tick runs one period from now.
   */
  public synchronized void start() {
    if (executor.isShutdown()) {
      throw new IllegalStateException("scheduler is closed.");
    }
    if (tickFuture != null) {
      return;
    }
    long millis = period.toMillis();
    tickFuture = executor.scheduleAtFixedRate(this::safeTick, millis, millis, TimeUnit.MILLISECONDS);
    LOGGER.info("Reminder scheduler started (period={}ms)", millis);
  }

  public synchronized boolean isRunning() {
    return tickFuture != null && !tickFuture.isDone() && !executor.isShutdown();
  }

  /**
   * Runs {@code request} against the state machine on the worker thread and returns its result.
   *
   * @param request request
   * @param <T> result type
   * @return result
   * @throws IllegalStateException if the scheduler is closed or the caller is interrupted
   */
  public <T> T call(final Function<ReminderStateMachine, T> request) {
    Validate.notNull(request, "request must not be null");
    if (Thread.currentThread() == worker) {
      return request.apply(machine);
    }
    Future<T> future;
    try {
      future = executor.submit(() -> request.apply(machine));
    } catch (RejectedExecutionException e) {
      throw new IllegalStateException("scheduler is closed.", e);
    }
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(false);
      throw new IllegalStateException("Interrupted waiting for scheduler.", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException("Scheduler request failed.", cause);
    }
  }

  /**
   * Runs {@code request} on the worker thread.
   *
   * @param request request
   */
  public void run(final Consumer<ReminderStateMachine> request) {
    Validate.notNull(request, "request must not be null");
    call(m -> {
      request.accept(m);
      return null;
    });
  }

  private void safeTick() {
    try {
      machine.tick();
    } catch (RuntimeException e) {
      // A thrown exception would cancel the fixed-rate task.
      LOGGER.warn("Reminder tick failed: {}", e.getMessage(), e);
    }
  }

  @Override
  public void close() {
    synchronized (this) {
      if (tickFuture != null) {
        tickFuture.cancel(false);
      }
      executor.shutdown();
    }
    if (Thread.currentThread() == worker) {
      return;
    }
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
        LOGGER.warn("Reminder scheduler did not stop within {}ms; forcing shutdown", SHUTDOWN_TIMEOUT_MILLIS);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    LOGGER.info("Reminder scheduler stopped");
  }
}
