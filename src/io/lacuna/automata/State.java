package io.lacuna.automata;

import java.util.concurrent.atomic.AtomicLong;

/**
 * An opaque automaton state.  A state carries no payload, and is only ever equal to itself; everything
 * known about it (its transitions, whether it accepts) is owned by the {@link Automaton} that created it.
 */
public final class State {

  private static final AtomicLong COUNTER = new AtomicLong();

  final long id = COUNTER.incrementAndGet();

  State() {
  }

  /**
   * @return a number unique to this state, for display purposes
   */
  public long id() {
    return id;
  }

  @Override
  public String toString() {
    return "state(" + id + ")";
  }
}
