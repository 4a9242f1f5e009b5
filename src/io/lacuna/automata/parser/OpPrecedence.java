package io.lacuna.automata.parser;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearSet;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A precedence level, holding operators of equal binding strength.  Within a precedence table, earlier levels bind
 * more loosely than later ones.
 */
public final class OpPrecedence {

  public enum Associativity {
    LEFT,
    RIGHT
  }

  final Associativity associativity;
  final ISet<String> operators;

  private OpPrecedence(Associativity associativity, String... operators) {
    checkArgument(operators.length > 0, "a precedence level needs at least one operator");
    this.associativity = associativity;
    this.operators = LinearSet.of(operators).forked();
  }

  public static OpPrecedence left(String... operators) {
    return new OpPrecedence(Associativity.LEFT, operators);
  }

  public static OpPrecedence right(String... operators) {
    return new OpPrecedence(Associativity.RIGHT, operators);
  }

  public Associativity associativity() {
    return associativity;
  }

  public ISet<String> operators() {
    return operators;
  }

  @Override
  public String toString() {
    return associativity.name().toLowerCase() + operators;
  }
}
