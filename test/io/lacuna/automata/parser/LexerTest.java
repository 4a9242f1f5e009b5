package io.lacuna.automata.parser;

import io.lacuna.bifurcan.LinearList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Iterator;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

  private static LinearList<Token<Integer>> lexAll(Lexer<Integer> lexer, String text) {
    LinearList<Token<Integer>> tokens = new LinearList<>();
    lexer.lex(text).forEachRemaining(tokens::addLast);
    return tokens;
  }

  @Test
  void producesTokensInOrder() {
    LinearList<Token<Integer>> tokens = lexAll(Arithmetic.LEXER, "12 + (3*4)");

    assertEquals(
            LinearList.of(
                    Token.of("num", 12),
                    Token.of("+", null),
                    Token.of("(", null),
                    Token.of("num", 3),
                    Token.of("*", null),
                    Token.of("num", 4),
                    Token.of(")", null)),
            tokens);
  }

  @Test
  @DisplayName("discarded text produces no tokens")
  void skipsWhitespace() {
    assertEquals(0, lexAll(Arithmetic.LEXER, "   ").size());
    assertEquals(0, lexAll(Arithmetic.LEXER, "").size());
  }

  @Test
  @DisplayName("earlier rules take priority")
  void ruleOrder() {
    Lexer<Integer> lexer = Lexer.of(
            LexRule.<Integer>of("ab", s -> Token.of("pair", null)),
            LexRule.<Integer>of("a", s -> Token.of("a", null)),
            LexRule.<Integer>of("b", s -> Token.of("b", null)));

    assertEquals(LinearList.of(Token.of("pair", null), Token.of("a", null)), lexAll(lexer, "aba"));
  }

  @Test
  void reportsUnmatchedInput() {
    LexException e = assertThrows(LexException.class, () -> lexAll(Arithmetic.LEXER, "1 + x2"));
    assertEquals("x2", e.remaining());
    assertEquals(4, e.offset());
  }

  @Test
  @DisplayName("tokens are produced lazily, up to the first failure")
  void lazy() {
    Iterator<Token<Integer>> tokens = Arithmetic.LEXER.lex("1 ? 2");
    assertEquals(Token.of("num", 1), tokens.next());
    assertThrows(LexException.class, tokens::hasNext);
  }

  @Test
  @DisplayName("rules which only match empty text are ignored")
  void emptyMatches() {
    Lexer<Integer> lexer = Lexer.of(
            LexRule.<Integer>skip("\\s*"),
            LexRule.<Integer>of("a", s -> Token.of("a", null)));

    assertEquals(1, lexAll(lexer, "  a").size());
    LexException e = assertThrows(LexException.class, () -> lexAll(lexer, "ab"));
    assertEquals("b", e.remaining());
  }
}
