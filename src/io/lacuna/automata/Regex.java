package io.lacuna.automata;

import io.lacuna.automata.parser.LexRule;
import io.lacuna.automata.parser.Lexer;
import io.lacuna.automata.parser.OpPrecedence;
import io.lacuna.automata.parser.ParseRule;
import io.lacuna.automata.parser.Parser;
import io.lacuna.automata.parser.Token;
import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Compiles regular expressions over an {@link Alphabet} into automata.  The syntax is:
 * <ul>
 *   <li>any symbol in the alphabet matches itself</li>
 *   <li>{@code xy} matches {@code x} followed by {@code y}</li>
 *   <li>{@code x+y} matches either {@code x} or {@code y}</li>
 *   <li>{@code x*} matches zero or more repetitions of {@code x}</li>
 *   <li>{@code ^} or {@code Λ} matches the empty string</li>
 *   <li>parentheses group, and whitespace is ignored</li>
 * </ul>
 * Star binds most tightly, then concatenation, then union.  Expressions are reduced to automata as they're parsed.
 */
public final class Regex {

  private static final Logger log = LoggerFactory.getLogger(Regex.class);

  public static final String ATOM = "atom";
  public static final String ADD = "add";
  public static final String STAR = "star";
  public static final String NULL = "null";
  public static final String OPEN = "(";
  public static final String CLOSE = ")";
  public static final String EXPRESSION = "E";

  /**
   * Concatenation has no operator token, so its rule borrows the precedence of {@code atom}, which binds more tightly
   * than {@code add} and more loosely than {@code star}.
   */
  public static final IList<OpPrecedence> PRECEDENCE = LinearList.of(
          OpPrecedence.left(ADD),
          OpPrecedence.left(ATOM),
          OpPrecedence.left(STAR)).forked();

  private final Alphabet alphabet;
  private final Lexer<Object> lexer;
  private final Parser<Object> parser;

  public Regex() {
    this(Alphabet.DEFAULT);
  }

  public Regex(Alphabet alphabet) {
    this.alphabet = checkNotNull(alphabet, "alphabet");
    this.lexer = new Lexer<>(lexRules(alphabet));
    this.parser = new Parser<>(parseRules(alphabet), PRECEDENCE, EXPRESSION);
  }

  /**
   * @return an automaton over {@code alphabet} which accepts the language described by {@code pattern}
   */
  public static Automaton compile(String pattern, Alphabet alphabet) {
    return new Regex(alphabet).compile(pattern);
  }

  /**
   * @return an automaton which accepts the language described by {@code pattern}
   * @throws io.lacuna.automata.parser.LexException if {@code pattern} contains anything but symbols and operators
   * @throws io.lacuna.automata.parser.ParseException if {@code pattern} isn't well-formed
   */
  public Automaton compile(String pattern) {
    checkNotNull(pattern, "pattern");

    Automaton automaton = (Automaton) parser.parse(lexer.lex(pattern));
    log.debug("compiled \"{}\" over {} into {} states", pattern, alphabet, automaton.size());

    return automaton;
  }

  public Alphabet alphabet() {
    return alphabet;
  }

  public Lexer<Object> lexer() {
    return lexer;
  }

  public Parser<Object> parser() {
    return parser;
  }

  /// grammar

  /**
   * @return the lexer rules, where symbols are checked before operators so that an alphabet may contain operator
   * characters
   */
  public static IList<LexRule<Object>> lexRules(Alphabet alphabet) {
    return LinearList.of(
            LexRule.<Object>skip("\\s+"),
            LexRule.<Object>of(symbolClass(alphabet), s -> Token.of(ATOM, s)),
            LexRule.<Object>of("\\+", s -> Token.of(ADD, null)),
            LexRule.<Object>of("\\*", s -> Token.of(STAR, null)),
            LexRule.<Object>of("[\\^Λ]", s -> Token.of(NULL, "Λ")),
            LexRule.<Object>of("\\(", s -> Token.of(OPEN, null)),
            LexRule.<Object>of("\\)", s -> Token.of(CLOSE, null)));
  }

  public static IList<ParseRule<Object>> parseRules(Alphabet alphabet) {
    return LinearList.of(
            ParseRule.<Object>of(
                    null,
                    LinearList.of(ATOM),
                    t -> expression(Automaton.fromAtom((String) t.nth(0).value(), alphabet))),
            ParseRule.<Object>of(
                    null,
                    LinearList.of(NULL),
                    t -> expression(Automaton.fromAtom("", alphabet))),
            ParseRule.<Object>of(
                    null,
                    LinearList.of(OPEN, EXPRESSION, CLOSE),
                    t -> t.nth(1)),
            ParseRule.<Object>of(
                    STAR,
                    LinearList.of(EXPRESSION, STAR),
                    t -> expression(automaton(t.nth(0)).kleeneStar())),
            ParseRule.<Object>of(
                    ATOM,
                    LinearList.of(EXPRESSION, EXPRESSION),
                    t -> expression(automaton(t.nth(0)).concatenate(automaton(t.nth(1))))),
            ParseRule.<Object>of(
                    ADD,
                    LinearList.of(EXPRESSION, ADD, EXPRESSION),
                    t -> expression(automaton(t.nth(0)).union(automaton(t.nth(2))))));
  }

  ///

  private static String symbolClass(Alphabet alphabet) {
    StringBuilder sb = new StringBuilder();
    for (Character symbol : alphabet) {
      if (sb.length() > 0) {
        sb.append("|");
      }
      sb.append(Pattern.quote(symbol.toString()));
    }
    return sb.toString();
  }

  private static Token<Object> expression(Automaton automaton) {
    return Token.of(EXPRESSION, automaton);
  }

  private static Automaton automaton(Token<Object> token) {
    return (Automaton) token.value();
  }
}
