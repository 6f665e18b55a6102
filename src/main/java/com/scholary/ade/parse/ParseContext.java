package com.scholary.ade.parse;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Future;

/**
 * Cancellation context for a parse call.
 *
 * <p>A context may carry a deadline and can be cancelled from any thread. Cancelling aborts the
 * request currently bound to it; a context that is already cancelled or past its deadline makes
 * the call fail before anything is sent.
 *
 * <pre>{@code
 * ParseContext context = ParseContext.withTimeout(Duration.ofMinutes(5));
 * ParseResponse response = client.parse(context).withFile("report.pdf").execute();
 * }</pre>
 */
public final class ParseContext {

  private final Instant deadline;
  private final Clock clock;

  private boolean cancelled;
  private Future<?> inFlight;

  private ParseContext(Instant deadline, Clock clock) {
    this.deadline = deadline;
    this.clock = clock;
  }

  /** A context with no deadline; it only ends when cancelled. */
  public static ParseContext background() {
    return new ParseContext(null, Clock.systemUTC());
  }

  public static ParseContext withTimeout(Duration timeout) {
    Clock clock = Clock.systemUTC();
    return new ParseContext(clock.instant().plus(timeout), clock);
  }

  public static ParseContext withDeadline(Instant deadline) {
    return new ParseContext(deadline, Clock.systemUTC());
  }

  /** Cancel the context, aborting any request bound to it. Idempotent. */
  public void cancel() {
    Future<?> toCancel;
    synchronized (this) {
      if (cancelled) {
        return;
      }
      cancelled = true;
      toCancel = inFlight;
    }
    if (toCancel != null) {
      toCancel.cancel(true);
    }
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  public boolean isExpired() {
    return deadline != null && !clock.instant().isBefore(deadline);
  }

  /** True once the context is cancelled or past its deadline. */
  public boolean isDone() {
    return isCancelled() || isExpired();
  }

  public Optional<Instant> deadline() {
    return Optional.ofNullable(deadline);
  }

  /** Time left before the deadline (never negative), or empty when there is no deadline. */
  public Optional<Duration> remaining() {
    if (deadline == null) {
      return Optional.empty();
    }
    Duration left = Duration.between(clock.instant(), deadline);
    return Optional.of(left.isNegative() ? Duration.ZERO : left);
  }

  /**
   * Bind an in-flight request to this context.
   *
   * @return false if the context was already cancelled, in which case the future is cancelled
   */
  synchronized boolean bind(Future<?> future) {
    if (cancelled) {
      future.cancel(true);
      return false;
    }
    inFlight = future;
    return true;
  }

  synchronized void unbind(Future<?> future) {
    if (inFlight == future) {
      inFlight = null;
    }
  }
}
