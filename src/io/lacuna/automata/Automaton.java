package io.lacuna.automata;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An immutable deterministic finite automaton.  Every state is reachable from {@link #start()}, and every state
 * has a transition for every symbol in {@link #alphabet()}; input which can never be accepted is routed to a
 * non-accepting sink state rather than left undefined.
 * <p>
 * Each combinator returns a new automaton with freshly allocated states, leaving its operands untouched.
 */
public final class Automaton implements Iterable<State> {

  private static final Logger log = LoggerFactory.getLogger(Automaton.class);

  private final Alphabet alphabet;
  private final State init;
  private final ISet<State> states, accept;
  private final IMap<State, IMap<Character, State>> transitions;

  private Automaton(
          Alphabet alphabet,
          State init,
          ISet<State> states,
          ISet<State> accept,
          IMap<State, IMap<Character, State>> transitions) {
    this.alphabet = alphabet;
    this.init = init;
    this.states = states;
    this.accept = accept;
    this.transitions = transitions;
  }

  /// constructors

  /**
   * @return an automaton over {@link Alphabet#DEFAULT} which accepts exactly {@code atom}
   */
  public static Automaton fromAtom(String atom) {
    return fromAtom(atom, Alphabet.DEFAULT);
  }

  /**
   * @return an automaton which accepts exactly {@code atom}, and nothing else
   * @throws AlphabetMismatchException if {@code atom} contains a symbol outside {@code alphabet}
   */
  public static Automaton fromAtom(String atom, Alphabet alphabet) {
    checkNotNull(atom, "atom");
    checkNotNull(alphabet, "alphabet");

    for (char c : atom.toCharArray()) {
      if (!alphabet.contains(c)) {
        throw new AlphabetMismatchException(c, alphabet);
      }
    }

    State init = new State();
    State reject = new State();
    LinearSet<State> states = LinearSet.of(init, reject);
    LinearMap<State, IMap<Character, State>> transitions = new LinearMap<>();
    transitions.put(reject, row(alphabet, s -> reject));

    State state = init;
    for (char c : atom.toCharArray()) {
      State next = new State();
      transitions.put(state, row(alphabet, s -> s == c ? next : reject));
      states.add(next);
      state = next;
    }

    // nothing extends a match past the end of the atom
    transitions.put(state, row(alphabet, s -> reject));

    return create("atom", alphabet, init, states, LinearSet.of(state), transitions);
  }

  /**
   * @return an automaton over {@code alphabet} that rejects any input
   */
  public static Automaton empty(Alphabet alphabet) {
    return loop("empty", alphabet, false);
  }

  /**
   * @return an automaton over {@code alphabet} that accepts any input
   */
  public static Automaton any(Alphabet alphabet) {
    return loop("any", alphabet, true);
  }

  /**
   * @return an automaton over {@link Alphabet#DEFAULT} which accepts the language described by {@code pattern}
   * @see Regex
   */
  public static Automaton fromRegex(String pattern) {
    return fromRegex(pattern, Alphabet.DEFAULT);
  }

  /**
   * @return an automaton over {@code alphabet} which accepts the language described by {@code pattern}
   * @see Regex
   */
  public static Automaton fromRegex(String pattern, Alphabet alphabet) {
    return new Regex(alphabet).compile(pattern);
  }

  /// combinators

  /**
   * @return an automaton which accepts everything this automaton rejects, and vice versa
   */
  public Automaton complement() {
    return construct(
            "complement",
            alphabet,
            init,
            this::transition,
            s -> !accept.contains(s));
  }

  /**
   * @return an automaton which accepts anything accepted by either this automaton or {@code automaton}
   */
  public Automaton union(Automaton automaton) {
    Automaton b = checkAlphabet(automaton);

    return construct(
            "union",
            alphabet,
            label(LinearSet.of(init), LinearSet.of(b.init)),
            (l, symbol) -> label(step(l.nth(0), symbol), b.step(l.nth(1), symbol)),
            l -> acceptsAny(l.nth(0)) || b.acceptsAny(l.nth(1)));
  }

  /**
   * @return an automaton which accepts anything accepted by both this automaton and {@code automaton}
   */
  public Automaton intersect(Automaton automaton) {
    Automaton b = checkAlphabet(automaton);

    // each half of the label must accept in its own automaton
    return construct(
            "intersect",
            alphabet,
            label(LinearSet.of(init), LinearSet.of(b.init)),
            (l, symbol) -> label(step(l.nth(0), symbol), b.step(l.nth(1), symbol)),
            l -> acceptsAny(l.nth(0)) && b.acceptsAny(l.nth(1)));
  }

  /**
   * @return an automaton which accepts anything accepted by this automaton, but not by {@code automaton}
   */
  public Automaton difference(Automaton automaton) {
    Automaton b = checkAlphabet(automaton);

    return construct(
            "difference",
            alphabet,
            label(LinearSet.of(init), LinearSet.of(b.init)),
            (l, symbol) -> label(step(l.nth(0), symbol), b.step(l.nth(1), symbol)),
            l -> acceptsAny(l.nth(0)) && !b.acceptsAny(l.nth(1)));
  }

  /**
   * @return an automaton which accepts any input that can be split into a prefix accepted by this automaton and
   * a suffix accepted by {@code automaton}
   */
  public Automaton concatenate(Automaton automaton) {
    Automaton b = checkAlphabet(automaton);

    LinearSet<State> suffix = accept.contains(init) ? LinearSet.of(b.init) : new LinearSet<>();

    return construct(
            "concatenate",
            alphabet,
            label(LinearSet.of(init), suffix),
            (l, symbol) -> {
              LinearSet<State> prefix = step(l.nth(0), symbol);
              LinearSet<State> next = b.step(l.nth(1), symbol);

              // completing the prefix starts a new match of the suffix
              if (acceptsAny(prefix)) {
                next.add(b.init);
              }
              return label(prefix, next);
            },
            l -> b.acceptsAny(l.nth(1)));
  }

  /**
   * @return an automaton which accepts the empty string, and any input that can be split into pieces each
   * accepted by this automaton
   */
  public Automaton kleeneStar() {
    ISet<State> none = new LinearSet<>();

    // the first half of the label is only non-empty for the start state, which accepts the empty string even if
    // a later label holds the same states
    return construct(
            "kleeneStar",
            alphabet,
            label(LinearSet.of(init), LinearSet.of(init)),
            (l, symbol) -> {
              LinearSet<State> next = step(l.nth(1), symbol);

              // completing a piece starts the next one
              if (acceptsAny(next)) {
                next.add(init);
              }
              return label(none, next);
            },
            l -> l.nth(0).size() > 0 || acceptsAny(l.nth(1)));
  }

  /// queries

  /**
   * @return true if this automaton accepts {@code input}
   * @throws AlphabetMismatchException if {@code input} contains a symbol outside the alphabet
   */
  public boolean accepts(CharSequence input) {
    State state = init;
    for (int i = 0; i < input.length(); i++) {
      state = transition(state, input.charAt(i));
    }
    return accept.contains(state);
  }

  /**
   * @return the state reached from {@code state} on {@code symbol}
   * @throws AlphabetMismatchException if {@code symbol} is outside the alphabet
   */
  public State transition(State state, char symbol) {
    IMap<Character, State> row = transitions(state);
    return row.get(symbol).orElseThrow(() -> new AlphabetMismatchException(symbol, alphabet));
  }

  /**
   * @return the outgoing transitions of {@code state}, keyed by symbol
   */
  public IMap<Character, State> transitions(State state) {
    Optional<IMap<Character, State>> row = transitions.get(state);
    checkArgument(row.isPresent(), "%s does not belong to this automaton", state);
    return row.get();
  }

  public Alphabet alphabet() {
    return alphabet;
  }

  public State start() {
    return init;
  }

  public ISet<State> accept() {
    return accept;
  }

  public ISet<State> states() {
    return states;
  }

  public boolean contains(State state) {
    return states.contains(state);
  }

  public long size() {
    return states.size();
  }

  /**
   * Lazily visits every state reachable from the start state, each exactly once.  The order is breadth-first over
   * the alphabet, but shouldn't be relied upon.
   */
  @Override
  public Iterator<State> iterator() {
    LinearSet<State> visited = LinearSet.of(init);
    LinearList<State> queue = LinearList.of(init);

    return new Iterator<State>() {
      @Override
      public boolean hasNext() {
        return queue.size() > 0;
      }

      @Override
      public State next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }

        State state = queue.popFirst();
        for (Character symbol : alphabet) {
          State s = transition(state, symbol);
          if (!visited.contains(s)) {
            visited.add(s);
            queue.addLast(s);
          }
        }
        return state;
      }
    };
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (State state : this) {
      sb.append(state == init ? "-> " : "   ")
              .append(state)
              .append(accept.contains(state) ? "* " : "  ");
      for (Character symbol : alphabet) {
        sb.append(" ").append(symbol).append(":").append(transition(state, symbol));
      }
      sb.append("\n");
    }
    return sb.toString();
  }

  ///

  private Automaton checkAlphabet(Automaton automaton) {
    checkNotNull(automaton, "automaton");
    if (!alphabet.equals(automaton.alphabet)) {
      throw new AlphabetMismatchException(alphabet, automaton.alphabet);
    }
    return automaton;
  }

  private boolean acceptsAny(ISet<State> states) {
    return Utils.containsAny(accept, states);
  }

  // the states reached from each of {@code states} on {@code symbol}
  private LinearSet<State> step(ISet<State> states, char symbol) {
    return Utils.map(states, s -> transition(s, symbol));
  }

  // a composite label, holding one set of states per operand
  private static IList<ISet<State>> label(ISet<State> a, ISet<State> b) {
    return LinearList.of(a, b);
  }

  private static LinearMap<Character, State> row(Alphabet alphabet, Function<Character, State> f) {
    return Utils.zipMap(alphabet, f);
  }

  private static Automaton loop(String operation, Alphabet alphabet, boolean accepting) {
    checkNotNull(alphabet, "alphabet");

    State state = new State();
    LinearMap<State, IMap<Character, State>> transitions = new LinearMap<>();
    transitions.put(state, row(alphabet, s -> state));

    return create(
            operation,
            alphabet,
            state,
            LinearSet.of(state),
            accepting ? LinearSet.of(state) : new LinearSet<>(),
            transitions);
  }

  /**
   * Allocates a fresh state for every label reachable from {@code init}, where the successor of a label on a given
   * symbol is defined by {@code successor}.  Labels must have value semantics, since equal labels are merged into a
   * single state.
   */
  private static <L> Automaton construct(
          String operation,
          Alphabet alphabet,
          L init,
          BiFunction<L, Character, L> successor,
          Predicate<L> isAccept) {

    LinearMap<L, State> cache = new LinearMap<>();
    LinearList<L> queue = new LinearList<>();

    Function<L, State> enqueue = label -> {
      Optional<State> s = cache.get(label);
      if (s.isPresent()) {
        return s.get();
      } else {
        State state = new State();
        cache.put(label, state);
        queue.addLast(label);

        return state;
      }
    };

    State start = enqueue.apply(init);

    LinearSet<State> states = new LinearSet<>();
    LinearSet<State> accept = new LinearSet<>();
    LinearMap<State, IMap<Character, State>> transitions = new LinearMap<>();

    while (queue.size() > 0) {
      L label = queue.popLast();
      State state = cache.get(label).get();

      states.add(state);
      if (isAccept.test(label)) {
        accept.add(state);
      }
      transitions.put(state, row(alphabet, symbol -> enqueue.apply(successor.apply(label, symbol))));
    }

    return create(operation, alphabet, start, states, accept, transitions);
  }

  private static Automaton create(
          String operation,
          Alphabet alphabet,
          State init,
          LinearSet<State> states,
          LinearSet<State> accept,
          LinearMap<State, IMap<Character, State>> transitions) {

    LinearMap<State, IMap<Character, State>> forked = new LinearMap<>();
    for (State s : states) {
      forked.put(s, transitions.get(s).get().forked());
    }

    log.debug("{}: built automaton with {} states, {} accepting", operation, states.size(), accept.size());

    return new Automaton(alphabet, init, states.forked(), accept.forked(), forked.forked());
  }
}
