package io.lacuna.automata.parser;

/**
 * Thrown when no lexer rule matches the remaining input.
 */
public class LexException extends IllegalArgumentException {

  private final String remaining;
  private final int offset;

  public LexException(String remaining, int offset) {
    super("could not lex \"" + remaining + "\" at offset " + offset);
    this.remaining = remaining;
    this.offset = offset;
  }

  /**
   * @return the input which couldn't be lexed, up to the end
   */
  public String remaining() {
    return remaining;
  }

  public int offset() {
    return offset;
  }
}
