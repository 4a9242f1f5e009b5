package io.lacuna.automata;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;

import java.util.Iterator;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An ordered, finite set of input symbols.
 */
public final class Alphabet implements Iterable<Character> {

  /**
   * The alphabet {@code {a, b}}, used wherever none is given.
   */
  public static final Alphabet DEFAULT = Alphabet.of("ab");

  private final IList<Character> symbols;
  private final ISet<Character> index;

  private Alphabet(IList<Character> symbols, ISet<Character> index) {
    this.symbols = symbols;
    this.index = index;
  }

  /**
   * @return an alphabet of every character in {@code symbols}, in order
   */
  public static Alphabet of(String symbols) {
    checkNotNull(symbols, "symbols");
    checkArgument(!symbols.isEmpty(), "an alphabet needs at least one symbol");

    LinearList<Character> list = new LinearList<>();
    LinearSet<Character> index = new LinearSet<>();
    for (char c : symbols.toCharArray()) {
      checkArgument(!index.contains(c), "duplicate symbol '%s' in alphabet \"%s\"", c, symbols);
      list.addLast(c);
      index.add(c);
    }

    return new Alphabet(list.forked(), index.forked());
  }

  public boolean contains(char symbol) {
    return index.contains(symbol);
  }

  public int size() {
    return (int) symbols.size();
  }

  /**
   * @return the symbols, in order, as a string
   */
  public String symbols() {
    StringBuilder sb = new StringBuilder();
    symbols.forEach(sb::append);
    return sb.toString();
  }

  @Override
  public Iterator<Character> iterator() {
    return symbols.iterator();
  }

  // symbol order doesn't affect which automata an alphabet can be combined with
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Alphabet)) {
      return false;
    }
    return index.equals(((Alphabet) obj).index);
  }

  @Override
  public int hashCode() {
    return index.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    symbols.forEach(c -> sb.append(c).append(", "));
    sb.delete(sb.length() - 2, sb.length());
    return sb.append("}").toString();
  }
}
