package io.lacuna.automata.parser;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A typed value produced by a {@link Lexer}, or by a reduction in a {@link Parser}.
 *
 * @param <V> the values carried by tokens
 */
public final class Token<V> {

  private final String type;
  private final V value;

  private Token(String type, V value) {
    this.type = checkNotNull(type, "type");
    this.value = value;
  }

  /**
   * @return a token of the given type, with a possibly-null {@code value}
   */
  public static <V> Token<V> of(String type, V value) {
    return new Token<>(type, value);
  }

  public String type() {
    return type;
  }

  public V value() {
    return value;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Token)) {
      return false;
    }
    Token<?> t = (Token<?>) obj;
    return type.equals(t.type) && Objects.equals(value, t.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value);
  }

  @Override
  public String toString() {
    return value == null ? type : type + "(" + value + ")";
  }
}
