package io.lacuna.automata.parser;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Splits text into tokens, using an ordered list of rules.  At each position the first rule which matches a
 * non-empty prefix of the remaining input consumes it, so earlier rules take priority.
 *
 * @param <V> the values carried by tokens
 */
public final class Lexer<V> {

  private static final Logger log = LoggerFactory.getLogger(Lexer.class);

  private final IList<LexRule<V>> rules;

  public Lexer(IList<LexRule<V>> rules) {
    checkArgument(rules.size() > 0, "a lexer needs at least one rule");
    this.rules = LinearList.from(rules).forked();
  }

  @SafeVarargs
  public static <V> Lexer<V> of(LexRule<V>... rules) {
    return new Lexer<>(LinearList.of(rules));
  }

  public IList<LexRule<V>> rules() {
    return rules;
  }

  /**
   * @return a lazy sequence of the tokens in {@code text}, which throws a {@link LexException} once it reaches input
   * no rule matches
   */
  public Iterator<Token<V>> lex(CharSequence text) {
    checkNotNull(text, "text");
    return new Tokens(text);
  }

  private class Tokens implements Iterator<Token<V>> {

    private final CharSequence text;
    private int offset = 0;
    private Token<V> next = null;

    Tokens(CharSequence text) {
      this.text = text;
    }

    @Override
    public boolean hasNext() {
      while (next == null && offset < text.length()) {
        next = advance();
      }
      return next != null;
    }

    @Override
    public Token<V> next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Token<V> token = next;
      next = null;
      return token;
    }

    // consumes one match, returning its token if there is one
    private Token<V> advance() {
      for (LexRule<V> rule : rules) {
        Matcher m = rule.pattern.matcher(text);
        m.region(offset, text.length());

        // an empty match would never advance
        if (m.lookingAt() && m.end() > offset) {
          offset = m.end();
          return rule.handler.apply(m.group());
        }
      }

      String remaining = text.subSequence(offset, text.length()).toString();
      log.debug("no rule matches \"{}\" at offset {}", remaining, offset);
      throw new LexException(remaining, offset);
    }
  }
}
