package io.lacuna.automata.parser;

import java.util.function.Function;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A lexer rule, which consumes input matching {@code pattern} and hands the matched text to {@code handler}.  A
 * handler returning {@code null} discards the text.
 *
 * @param <V> the values carried by tokens
 */
public final class LexRule<V> {

  final Pattern pattern;
  final Function<String, Token<V>> handler;

  private LexRule(Pattern pattern, Function<String, Token<V>> handler) {
    this.pattern = checkNotNull(pattern, "pattern");
    this.handler = checkNotNull(handler, "handler");
  }

  public static <V> LexRule<V> of(String regex, Function<String, Token<V>> handler) {
    return new LexRule<>(Pattern.compile(regex), handler);
  }

  /**
   * @return a rule which consumes text matching {@code regex} without producing a token
   */
  public static <V> LexRule<V> skip(String regex) {
    return new LexRule<>(Pattern.compile(regex), s -> null);
  }

  public Pattern pattern() {
    return pattern;
  }

  @Override
  public String toString() {
    return "lex(" + pattern + ")";
  }
}
