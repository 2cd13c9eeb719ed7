// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.*;
import java.util.logging.Level;

import static io.github.simbo1905.negative.space.NegativeSpace.LOGGER;

/// Finds concrete values that satisfy a list of constraints.
///
/// Each accepted value is excluded from the next backend call so successive values differ. Solving blocks the caller
/// while the instance's own worker thread talks to the backend. The timeout is a deadline for the whole call and each
/// backend call is given only the time that is left. A call that runs out of time reports [SolverStatus#TIMEOUT] when
/// nothing was found and [SolverStatus#SUCCESS] with the values found so far otherwise. Successful results are cached
/// by constraint list. An instance is not safe for concurrent use.
public final class ConstraintSolver implements AutoCloseable {

  static final long GRACE_MS = 250;

  public enum SolverStatus {SUCCESS, UNSATISFIABLE, TIMEOUT, ERROR}

  /// How successive solutions are pushed apart.
  public enum Diversification {
    /// Exclude every value already found.
    BACKTRACK,
    /// Exclude found values and vary the backend seed per attempt.
    RANDOM,
    /// Send no exclusions; a repeated value ends the search.
    NONE
  }

  /// @param maxSolutions the most values returned
  /// @param timeoutMs the limit for the whole call
  /// @param enableCache whether results are read from and written to the cache
  /// @param maxCacheSize the cache capacity
  /// @param diversification how successive values are made distinct
  public record SolverOptions(int maxSolutions, long timeoutMs, boolean enableCache, int maxCacheSize,
                              @NotNull Diversification diversification) {
    public static final SolverOptions DEFAULTS = new SolverOptions(10, 5000, true, 1000, Diversification.BACKTRACK);

    public SolverOptions {
      Objects.requireNonNull(diversification, "diversification must not be null");
      if (maxSolutions < 0) {
        throw new IllegalArgumentException("maxSolutions must not be negative: " + maxSolutions);
      }
      if (timeoutMs <= 0) {
        throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
      }
      if (maxCacheSize < 0) {
        throw new IllegalArgumentException("maxCacheSize must not be negative: " + maxCacheSize);
      }
    }

    public SolverOptions withMaxSolutions(int maxSolutions) {
      return new SolverOptions(maxSolutions, timeoutMs, enableCache, maxCacheSize, diversification);
    }

    public SolverOptions withTimeout(long timeoutMs) {
      return new SolverOptions(maxSolutions, timeoutMs, enableCache, maxCacheSize, diversification);
    }

    public SolverOptions withCache(boolean enableCache) {
      return new SolverOptions(maxSolutions, timeoutMs, enableCache, maxCacheSize, diversification);
    }

    public SolverOptions withDiversification(Diversification diversification) {
      return new SolverOptions(maxSolutions, timeoutMs, enableCache, maxCacheSize, diversification);
    }
  }

  /// Counters at the end of the call. Hits and misses are totals for the solver instance.
  public record SolverStats(long solveTimeMs, long cacheHits, long cacheMisses) {
  }

  public record SolverResult(@NotNull SolverStatus status,
                             @NotNull List<Value> values,
                             int solutionCount,
                             @NotNull Optional<String> error,
                             @NotNull SolverStats stats) {
    public SolverResult {
      Objects.requireNonNull(status, "status must not be null");
      values = List.copyOf(values);
      Objects.requireNonNull(error, "error must not be null");
      Objects.requireNonNull(stats, "stats must not be null");
    }

    static SolverResult failed(SolverStatus status, String error, SolverStats stats) {
      return new SolverResult(status, List.of(), 0, Optional.of(error), stats);
    }

    SolverResult withStats(SolverStats stats) {
      return new SolverResult(status, values, solutionCount, error, stats);
    }

    /// The first `maxSolutions` values of this result.
    SolverResult limitedTo(int maxSolutions) {
      if (values.size() <= maxSolutions) {
        return this;
      }
      final List<Value> kept = values.subList(0, maxSolutions);
      return new SolverResult(status, kept, kept.size(), error, stats);
    }
  }

  /// Cache occupancy and lookup counters since construction or the last [#clearCache()].
  public record CacheStats(int size, long hits, long misses) {
    /// Hits over lookups, zero before the first lookup.
    public double hitRate() {
      final long lookups = hits + misses;
      return lookups == 0 ? 0d : (double) hits / lookups;
    }
  }

  private record Search(SolverStatus status, List<Value> values, @Nullable String error) {
  }

  private final SmtBackend<?> backend;
  private final SolverCache cache;
  private ExecutorService worker;
  private long cacheHits;
  private long cacheMisses;

  /// A solver on the Z3 backend. Call [#init()] before solving.
  public ConstraintSolver() {
    this(new Z3Backend());
  }

  public ConstraintSolver(SmtBackend<?> backend) {
    this(backend, Clock.systemUTC());
  }

  ConstraintSolver(SmtBackend<?> backend, Clock clock) {
    this.backend = Objects.requireNonNull(backend, "backend must not be null");
    this.cache = new SolverCache(clock);
  }

  public void init() {
    init(SmtBackend.SmtOptions.DEFAULTS);
  }

  public void init(SmtBackend.SmtOptions options) {
    backend.init(options);
    if (worker == null) {
      worker = Executors.newSingleThreadExecutor(r -> {
        final Thread t = new Thread(r, "constraint-solver");
        t.setDaemon(true);
        return t;
      });
    }
    LOGGER.fine(() -> "Constraint solver ready on " + backend);
  }

  public boolean isInitialized() {
    return worker != null && backend.isInitialized();
  }

  public SolverResult solveForSatisfyingValues(@Nullable TypeNode type, List<TypeConstraint> constraints) {
    return solveForSatisfyingValues(type, constraints, SolverOptions.DEFAULTS);
  }

  public SolverResult solveForSatisfyingValues(@Nullable TypeNode type, List<TypeConstraint> constraints,
                                               SolverOptions options) {
    if (!isInitialized()) {
      throw new IllegalStateException("Constraint solver is not initialized, call init() first");
    }
    Objects.requireNonNull(constraints, "constraints must not be null");
    Objects.requireNonNull(options, "options must not be null");
    final long started = System.nanoTime();
    final String key = SolverCache.keyOf(constraints);

    if (options.enableCache()) {
      final Optional<SolverResult> cached = cache.get(key);
      if (cached.isPresent()) {
        cacheHits++;
        LOGGER.finer(() -> "Cache hit for " + key);
        return cached.get().limitedTo(options.maxSolutions()).withStats(stats(started));
      }
      cacheMisses++;
    }

    final List<TypeConstraint> snapshot = List.copyOf(constraints);
    final long deadline = started + TimeUnit.MILLISECONDS.toNanos(options.timeoutMs());
    final List<Value> found = new CopyOnWriteArrayList<>();
    final Future<Search> future = worker.submit(() -> search(type, snapshot, options, deadline, found));
    SolverResult result;
    try {
      final Search search = future.get(options.timeoutMs() + GRACE_MS, TimeUnit.MILLISECONDS);
      result = new SolverResult(search.status(), search.values(), search.values().size(),
          Optional.ofNullable(search.error()), stats(started));
    } catch (TimeoutException e) {
      future.cancel(true);
      final List<Value> partial = List.copyOf(found);
      LOGGER.fine(() -> "Solving " + key + " overran " + options.timeoutMs() + "ms with " + partial.size() + " values");
      result = partial.isEmpty()
          ? SolverResult.failed(SolverStatus.TIMEOUT, timedOut(options), stats(started))
          : new SolverResult(SolverStatus.SUCCESS, partial, partial.size(), Optional.empty(), stats(started));
    } catch (ExecutionException e) {
      final Throwable cause = e.getCause() == null ? e : e.getCause();
      LOGGER.log(Level.WARNING, "Backend failed solving " + key, cause);
      result = SolverResult.failed(SolverStatus.ERROR, String.valueOf(cause.getMessage()), stats(started));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      result = SolverResult.failed(SolverStatus.ERROR, "interrupted while solving", stats(started));
    }

    if (options.enableCache() && result.status() == SolverStatus.SUCCESS) {
      cache.put(key, result, options.maxCacheSize());
    }
    final SolverResult finalResult = result;
    LOGGER.fine(() -> "Solved " + key + ": " + finalResult.status() + " with " + finalResult.solutionCount()
        + " values in " + finalResult.stats().solveTimeMs() + "ms");
    return result;
  }

  /// Empties the cache and resets the hit and miss counters.
  public void clearCache() {
    cache.clear();
    cacheHits = 0;
    cacheMisses = 0;
  }

  public CacheStats getCacheStats() {
    return new CacheStats(cache.size(), cacheHits, cacheMisses);
  }

  /// Stops the worker and releases the backend. The solver can be initialized again.
  public void dispose() {
    if (worker != null) {
      worker.shutdownNow();
      worker = null;
    }
    backend.dispose();
  }

  @Override
  public void close() {
    dispose();
  }

  /// Values are published to `found` as they are accepted so the caller can keep them if the deadline passes.
  private Search search(@Nullable TypeNode type, List<TypeConstraint> constraints, SolverOptions options,
                        long deadline, List<Value> found) {
    final var values = new ArrayList<Value>();
    if (constraints.isEmpty()) {
      return new Search(SolverStatus.SUCCESS, values, null);
    }
    SmtBackend.SmtStatus last = SmtBackend.SmtStatus.SAT;
    boolean outOfTime = false;
    for (int attempt = 0; attempt < options.maxSolutions() && !Thread.currentThread().isInterrupted(); attempt++) {
      final long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
      if (remainingMs <= 0) {
        outOfTime = true;
        break;
      }
      final var base = SmtBackend.SmtOptions.DEFAULTS.withTimeout(remainingMs);
      final var smtOptions = options.diversification() == Diversification.RANDOM ? base.withRandomSeed(attempt) : base;
      final List<Value> exclusions = options.diversification() == Diversification.NONE ? List.of() : List.copyOf(values);
      final var solution = backend.solve(constraints, exclusions, smtOptions);
      last = solution.status();
      if (last != SmtBackend.SmtStatus.SAT) {
        break;
      }
      final Optional<Value> value = solution.firstValue();
      if (value.isEmpty()) {
        break;
      }
      if (!fitsType(type, value.get())) {
        final String message = "solver value " + value.get().render() + " does not fit " + type.toTypeString();
        LOGGER.fine(() -> message);
        return values.isEmpty() ? new Search(SolverStatus.ERROR, values, message)
            : new Search(SolverStatus.SUCCESS, values, null);
      }
      if (values.contains(value.get())) {
        break;
      }
      values.add(value.get());
      found.add(value.get());
    }
    if (!values.isEmpty()) {
      return new Search(SolverStatus.SUCCESS, values, null);
    }
    if (outOfTime) {
      return new Search(SolverStatus.TIMEOUT, values, timedOut(options));
    }
    return switch (last) {
      case UNSAT -> new Search(SolverStatus.UNSATISFIABLE, values, null);
      case UNKNOWN -> new Search(SolverStatus.TIMEOUT, values, "backend could not decide within " + options.timeoutMs() + "ms");
      case SAT -> new Search(SolverStatus.SUCCESS, values, null);
    };
  }

  /// A value fits when no type is given, when the type is not a primitive or literal, or when it matches them.
  static boolean fitsType(@Nullable TypeNode type, Value value) {
    if (type == null) {
      return true;
    }
    if (type.kind() == TypeKind.LITERAL && type.name() != null) {
      return Literals.valueOf(type.name()).equals(value);
    }
    if (type.kind() != TypeKind.PRIMITIVE || type.name() == null) {
      return true;
    }
    switch (type.name()) {
      case "number", "bigint" -> {
        return value instanceof Value.NumberValue;
      }
      case "string" -> {
        return value instanceof Value.StringValue;
      }
      case "boolean" -> {
        return value instanceof Value.BooleanValue;
      }
      default -> {
        return true;
      }
    }
  }

  private static String timedOut(SolverOptions options) {
    return "solver timed out after " + options.timeoutMs() + "ms";
  }

  private SolverStats stats(long startedNanos) {
    return new SolverStats(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos), cacheHits, cacheMisses);
  }
}
