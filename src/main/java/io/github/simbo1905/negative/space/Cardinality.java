// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import java.util.Collection;

/// The size of a region: a non-negative count or the symbolic value infinite.
/// Infinite absorbs under both [#times] and [#plus]. A finite result that does not fit in a `long` is infinite.
public sealed interface Cardinality permits Cardinality.Finite, Cardinality.Infinite {

  Cardinality INFINITE = new Infinite();

  Cardinality ZERO = new Finite(0);

  Cardinality ONE = new Finite(1);

  static Cardinality of(long count) {
    return new Finite(count);
  }

  boolean isInfinite();

  default boolean isFinite() {
    return !isInfinite();
  }

  /// True when this is finite and no larger than `limit`.
  default boolean isAtMost(long limit) {
    return this instanceof Finite f && f.count() <= limit;
  }

  default Cardinality times(Cardinality other) {
    if (this instanceof Finite a && other instanceof Finite b) {
      try {
        return new Finite(Math.multiplyExact(a.count(), b.count()));
      } catch (ArithmeticException overflow) {
        return INFINITE;
      }
    }
    return INFINITE;
  }

  default Cardinality plus(Cardinality other) {
    if (this instanceof Finite a && other instanceof Finite b) {
      try {
        return new Finite(Math.addExact(a.count(), b.count()));
      } catch (ArithmeticException overflow) {
        return INFINITE;
      }
    }
    return INFINITE;
  }

  static Cardinality product(Collection<Cardinality> factors) {
    Cardinality result = ONE;
    for (Cardinality c : factors) {
      result = result.times(c);
    }
    return result;
  }

  static Cardinality sum(Collection<Cardinality> terms) {
    Cardinality result = ZERO;
    for (Cardinality c : terms) {
      result = result.plus(c);
    }
    return result;
  }

  /// Ascending order with infinite last.
  static int compare(Cardinality a, Cardinality b) {
    if (a instanceof Finite fa && b instanceof Finite fb) {
      return Long.compare(fa.count(), fb.count());
    }
    return Boolean.compare(a.isInfinite(), b.isInfinite());
  }

  record Finite(long count) implements Cardinality {
    public Finite {
      if (count < 0) {
        throw new IllegalArgumentException("Cardinality must not be negative: " + count);
      }
    }

    @Override
    public boolean isInfinite() {
      return false;
    }

    @Override
    public String toString() {
      return Long.toString(count);
    }
  }

  record Infinite() implements Cardinality {
    @Override
    public boolean isInfinite() {
      return true;
    }

    @Override
    public String toString() {
      return "infinite";
    }
  }
}
