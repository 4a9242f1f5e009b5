package io.lacuna.automata.parser;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A shift-reduce parser with a single token of lookahead.  At each step, the first applicable rule is used to
 * reduce the top of the stack; if none applies, the lookahead token is shifted onto the stack.
 * <p>
 * A rule applies when the types on top of the stack equal its inputs, and either it has no operator, or the lookahead
 * token doesn't bind more tightly than the rule's operator.  This means that values may be computed as the input is
 * parsed, rather than from a syntax tree afterwards.
 *
 * @param <V> the values carried by tokens
 */
public final class Parser<V> {

  private static final Logger log = LoggerFactory.getLogger(Parser.class);

  private final IList<ParseRule<V>> rules;
  private final IList<OpPrecedence> precedence;
  private final String result;

  /**
   * @param rules the reductions, in priority order
   * @param precedence the precedence levels, from loosest to tightest binding
   */
  public Parser(IList<ParseRule<V>> rules, IList<OpPrecedence> precedence) {
    this(rules, precedence, null);
  }

  /**
   * @param rules the reductions, in priority order
   * @param precedence the precedence levels, from loosest to tightest binding
   * @param result the type of the token a complete parse reduces to, or null if any single token will do
   */
  public Parser(IList<ParseRule<V>> rules, IList<OpPrecedence> precedence, String result) {
    this.rules = LinearList.from(checkNotNull(rules, "rules")).forked();
    this.precedence = LinearList.from(checkNotNull(precedence, "precedence")).forked();
    this.result = result;
  }

  public IList<ParseRule<V>> rules() {
    return rules;
  }

  public IList<OpPrecedence> precedence() {
    return precedence;
  }

  public String result() {
    return result;
  }

  /**
   * @return the value of the single token {@code tokens} reduces to
   * @throws ParseException if the tokens can't be reduced to a single value of the result type
   */
  public V parse(Iterator<Token<V>> tokens) {
    LinearList<Token<V>> stack = new LinearList<>();
    Token<V> lookahead = tokens.hasNext() ? tokens.next() : null;

    for (; ; ) {
      ParseRule<V> rule = applicable(stack, lookahead);

      if (rule != null) {
        reduce(stack, rule);
      } else if (lookahead != null) {
        log.trace("shift {} onto {}", lookahead, stack);
        stack.addLast(lookahead);
        lookahead = tokens.hasNext() ? tokens.next() : null;
      } else if (stack.size() == 1 && (result == null || result.equals(stack.nth(0).type()))) {
        return stack.nth(0).value();
      } else {
        IList<String> types = types(stack);
        log.debug("could not reduce {}", types);
        throw new ParseException(types);
      }
    }
  }

  /**
   * @return true if {@code a} binds more loosely than {@code b}, or they're equal and right-associative, which means
   * a reduction over {@code a} should wait until {@code b} has been reduced
   */
  boolean lowerPrecedence(String a, String b) {
    int i = level(a);
    int j = level(b);
    return i >= 0
            && j >= 0
            && (i < j || (i == j && precedence.nth(j).associativity == OpPrecedence.Associativity.RIGHT));
  }

  ///

  private ParseRule<V> applicable(IList<Token<V>> stack, Token<V> lookahead) {
    for (ParseRule<V> rule : rules) {
      if (!matches(stack, rule.inputs)) {
        continue;
      }
      if (rule.operator != null && lookahead != null && lowerPrecedence(rule.operator, lookahead.type())) {
        continue;
      }
      return rule;
    }
    return null;
  }

  private void reduce(LinearList<Token<V>> stack, ParseRule<V> rule) {
    LinearList<Token<V>> args = new LinearList<>();
    for (long i = 0; i < rule.inputs.size(); i++) {
      args.addFirst(stack.popLast());
    }

    Token<V> reduced = rule.reducer.apply(args);
    checkNotNull(reduced, "rule %s reduced to null", rule);
    log.trace("reduce {} to {}", args, reduced);
    stack.addLast(reduced);
  }

  private int level(String operator) {
    for (int i = 0; i < precedence.size(); i++) {
      if (precedence.nth(i).operators.contains(operator)) {
        return i;
      }
    }
    return -1;
  }

  private static boolean matches(IList<? extends Token<?>> stack, IList<String> inputs) {
    long n = inputs.size();
    long offset = stack.size() - n;
    if (offset < 0) {
      return false;
    }

    for (long i = 0; i < n; i++) {
      if (!inputs.nth(i).equals(stack.nth(offset + i).type())) {
        return false;
      }
    }
    return true;
  }

  private static IList<String> types(IList<? extends Token<?>> stack) {
    LinearList<String> types = new LinearList<>();
    stack.forEach(t -> types.addLast(t.type()));
    return types.forked();
  }
}
