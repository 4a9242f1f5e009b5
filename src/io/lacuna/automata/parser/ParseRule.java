package io.lacuna.automata.parser;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;

import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A reduction, which replaces the tokens on top of the parse stack whose types match {@code inputs} with the single
 * token returned by {@code reducer}.  If the rule has an {@code operator}, it's only applied when the lookahead token
 * doesn't bind more tightly.
 *
 * @param <V> the values carried by tokens
 */
public final class ParseRule<V> {

  final String operator;
  final IList<String> inputs;
  final Function<IList<Token<V>>, Token<V>> reducer;

  private ParseRule(String operator, IList<String> inputs, Function<IList<Token<V>>, Token<V>> reducer) {
    checkArgument(inputs.size() > 0, "a rule must consume at least one token");
    this.operator = operator;
    this.inputs = inputs;
    this.reducer = checkNotNull(reducer, "reducer");
  }

  /**
   * @param operator the operator whose precedence governs this rule, or null if it always applies
   * @param inputs the token types this rule consumes, from deepest to top of stack
   * @param reducer a function from the consumed tokens to their replacement
   */
  public static <V> ParseRule<V> of(
          String operator,
          IList<String> inputs,
          Function<IList<Token<V>>, Token<V>> reducer) {
    return new ParseRule<>(operator, LinearList.from(inputs).forked(), reducer);
  }

  public String operator() {
    return operator;
  }

  public IList<String> inputs() {
    return inputs;
  }

  @Override
  public String toString() {
    return (operator == null ? "" : operator + ":") + inputs;
  }
}
