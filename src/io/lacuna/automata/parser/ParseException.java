package io.lacuna.automata.parser;

import io.lacuna.bifurcan.IList;

/**
 * Thrown when the input is exhausted, and the parse stack can't be reduced to a single value.
 */
public class ParseException extends IllegalArgumentException {

  private final IList<String> stack;

  public ParseException(IList<String> stack) {
    super(stack.size() == 0 ? "nothing to parse" : "could not parse " + stack);
    this.stack = stack;
  }

  /**
   * @return the types of the tokens left on the stack, from bottom to top
   */
  public IList<String> stack() {
    return stack;
  }
}
