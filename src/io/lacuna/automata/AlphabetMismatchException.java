package io.lacuna.automata;

import java.util.Optional;

/**
 * Thrown when a symbol has no transition in an automaton's alphabet, or when automata over different
 * alphabets are combined.
 */
public class AlphabetMismatchException extends IllegalArgumentException {

  private final Character symbol;

  public AlphabetMismatchException(char symbol, Alphabet alphabet) {
    super("symbol '" + symbol + "' is not in the alphabet " + alphabet);
    this.symbol = symbol;
  }

  public AlphabetMismatchException(Alphabet a, Alphabet b) {
    super("cannot combine automata over different alphabets " + a + " and " + b);
    this.symbol = null;
  }

  /**
   * @return the symbol outside the alphabet, if the failure was caused by one
   */
  public Optional<Character> symbol() {
    return Optional.ofNullable(symbol);
  }
}
