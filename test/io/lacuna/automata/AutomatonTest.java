package io.lacuna.automata;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class AutomatonTest {

  private static final int MAX_LENGTH = 6;

  private static IList<String> strings;
  private static IList<Automaton> samples;

  @BeforeAll
  static void setUp() {
    strings = Strings.upTo(Alphabet.DEFAULT, MAX_LENGTH);

    Automaton a = Automaton.fromAtom("a");
    Automaton b = Automaton.fromAtom("b");
    samples = LinearList.of(
            Automaton.fromAtom(""),
            a,
            Automaton.fromAtom("bab"),
            a.union(b),
            a.concatenate(b.kleeneStar()),
            a.union(b).kleeneStar(),
            Automaton.fromAtom("ab").complement(),
            Automaton.empty(Alphabet.DEFAULT),
            Automaton.any(Alphabet.DEFAULT));
  }

  private static void assertLanguage(Automaton automaton, Predicate<String> expected) {
    for (String s : strings) {
      assertEquals(expected.test(s), automaton.accepts(s), "\"" + s + "\" in\n" + automaton);
    }
  }

  private static void assertTotal(Automaton automaton) {
    long count = 0;
    for (State state : automaton) {
      count++;
      assertTrue(automaton.contains(state));
      assertEquals(automaton.alphabet().size(), automaton.transitions(state).size());
      for (Character symbol : automaton.alphabet()) {
        assertTrue(automaton.contains(automaton.transition(state, symbol)));
      }
    }
    assertEquals(automaton.size(), count);
  }

  @Nested
  @DisplayName("atoms")
  class Atoms {

    @Test
    void acceptsExactlyTheAtom() {
      for (String atom : new String[]{"", "a", "ab", "bab", "aaba"}) {
        Automaton automaton = Automaton.fromAtom(atom);
        assertLanguage(automaton, atom::equals);
      }
    }

    @Test
    void bab() {
      Automaton automaton = Automaton.fromAtom("bab");
      assertTrue(automaton.accepts("bab"));
      assertFalse(automaton.accepts("ba"));
      assertFalse(automaton.accepts("babb"));
    }

    @Test
    @DisplayName("a chain of one state per symbol, plus a sink")
    void structure() {
      Automaton automaton = Automaton.fromAtom("bab");
      assertEquals(5, automaton.size());
      assertEquals(1, automaton.accept().size());
      assertTotal(automaton);

      State sink = automaton.transition(automaton.start(), 'a');
      assertFalse(automaton.accept().contains(sink));
      assertSame(sink, automaton.transition(sink, 'a'));
      assertSame(sink, automaton.transition(sink, 'b'));
    }

    @Test
    void rejectsSymbolsOutsideTheAlphabet() {
      AlphabetMismatchException e =
              assertThrows(AlphabetMismatchException.class, () -> Automaton.fromAtom("abc"));
      assertEquals('c', e.symbol().get());
    }

    @Test
    void customAlphabet() {
      Alphabet alphabet = Alphabet.of("xyz");
      Automaton automaton = Automaton.fromAtom("zx", alphabet);
      assertSame(alphabet, automaton.alphabet());
      assertTrue(automaton.accepts("zx"));
      assertFalse(automaton.accepts("zy"));
      assertTotal(automaton);
    }
  }

  @Nested
  @DisplayName("combinators")
  class Combinators {

    @Test
    void union() {
      for (Automaton a : samples) {
        for (Automaton b : samples) {
          Automaton u = a.union(b);
          assertLanguage(u, s -> a.accepts(s) || b.accepts(s));
          assertTotal(u);
        }
      }
    }

    @Test
    void intersect() {
      for (Automaton a : samples) {
        for (Automaton b : samples) {
          Automaton i = a.intersect(b);
          assertLanguage(i, s -> a.accepts(s) && b.accepts(s));
          assertTotal(i);
        }
      }
    }

    @Test
    void intersectAtoms() {
      Automaton ab = Automaton.fromAtom("ab");
      assertLanguage(ab.intersect(Automaton.fromAtom("ab")), "ab"::equals);
      assertLanguage(ab.intersect(Automaton.fromAtom("ba")), s -> false);
    }

    @Test
    @DisplayName("intersection requires each operand to accept in its own automaton")
    void intersectionUsesEachOperandsOwnAcceptStates() {
      // with an automaton intersected with itself, both halves of every label are the same state
      for (Automaton a : samples) {
        assertLanguage(a.intersect(a), a::accepts);
      }

      Automaton a = Automaton.fromAtom("a");
      Automaton notA = a.complement();
      assertLanguage(a.intersect(notA), s -> false);
    }

    @Test
    void difference() {
      for (Automaton a : samples) {
        for (Automaton b : samples) {
          assertLanguage(a.difference(b), s -> a.accepts(s) && !b.accepts(s));
        }
      }
    }

    @Test
    void concatenate() {
      for (Automaton a : samples) {
        for (Automaton b : samples) {
          Automaton c = a.concatenate(b);
          assertLanguage(c, s -> Strings.splits(a, b, s));
          assertTotal(c);
        }
      }
    }

    @Test
    void concatenateWithItself() {
      Automaton ab = Automaton.fromAtom("ab").union(Automaton.fromAtom("b"));
      assertLanguage(ab.concatenate(ab), s -> Strings.splits(ab, ab, s));
    }

    @Test
    void kleeneStar() {
      for (Automaton a : samples) {
        Automaton star = a.kleeneStar();
        assertLanguage(star, s -> Strings.pieces(a, s));
        assertTrue(star.accepts(""));
        assertTotal(star);
      }
    }

    @Test
    @DisplayName("the star of an automaton whose start state loops without accepting only accepts the empty string")
    void kleeneStarOfNothing() {
      Automaton any = Automaton.any(Alphabet.DEFAULT);

      for (Automaton a : new Automaton[]{Automaton.empty(Alphabet.DEFAULT), any.difference(any)}) {
        Automaton star = a.kleeneStar();
        assertLanguage(star, String::isEmpty);
        assertFalse(star.accepts("a"));
        assertFalse(star.accepts("abba"));
        assertTotal(star);
      }
    }

    @Test
    void complement() {
      for (Automaton a : samples) {
        Automaton c = a.complement();
        assertLanguage(c, s -> !a.accepts(s));
        assertEquals(a.size(), c.size());
        assertLanguage(c.complement(), a::accepts);
      }
    }

    @Test
    @DisplayName("results never share states with their operands")
    void freshStates() {
      Automaton a = Automaton.fromAtom("ab");
      Automaton b = Automaton.fromAtom("b");

      for (Automaton result : new Automaton[]{
              a.complement(), a.union(b), a.intersect(b), a.concatenate(b), a.kleeneStar(), a.difference(b)}) {
        for (State state : result) {
          assertFalse(a.contains(state));
          assertFalse(b.contains(state));
        }
      }
    }

    @Test
    @DisplayName("operands are unaffected by combinators")
    void operandsUnchanged() {
      Automaton a = Automaton.fromAtom("ab");
      long size = a.size();
      State start = a.start();

      a.kleeneStar().union(a).concatenate(a.complement());

      assertEquals(size, a.size());
      assertSame(start, a.start());
      assertLanguage(a, "ab"::equals);
    }

    @Test
    void rejectsDifferentAlphabets() {
      Automaton a = Automaton.fromAtom("a");
      Automaton x = Automaton.fromAtom("x", Alphabet.of("xy"));

      assertThrows(AlphabetMismatchException.class, () -> a.union(x));
      assertThrows(AlphabetMismatchException.class, () -> a.intersect(x));
      assertThrows(AlphabetMismatchException.class, () -> a.concatenate(x));
      assertThrows(AlphabetMismatchException.class, () -> a.difference(x));

      AlphabetMismatchException e = assertThrows(AlphabetMismatchException.class, () -> x.union(a));
      assertFalse(e.symbol().isPresent());
    }
  }

  @Nested
  @DisplayName("queries")
  class Queries {

    @Test
    void acceptsRejectsSymbolsOutsideTheAlphabet() {
      Automaton automaton = Automaton.fromRegex("(a+b)*");
      AlphabetMismatchException e = assertThrows(AlphabetMismatchException.class, () -> automaton.accepts("abc"));
      assertEquals('c', e.symbol().get());
    }

    @Test
    void transitionsOfForeignStatesAreRejected() {
      Automaton a = Automaton.fromAtom("a");
      Automaton b = Automaton.fromAtom("a");
      assertThrows(IllegalArgumentException.class, () -> a.transitions(b.start()));
    }

    @Test
    @DisplayName("iteration visits every reachable state exactly once")
    void iteration() {
      for (Automaton a : samples) {
        LinearSet<State> seen = new LinearSet<>();
        Iterator<State> it = a.iterator();
        assertEquals(a.start(), it.next());
        seen.add(a.start());

        while (it.hasNext()) {
          State state = it.next();
          assertFalse(seen.contains(state), "visited twice: " + state);
          seen.add(state);
        }

        assertEquals(a.size(), seen.size());
        assertThrows(NoSuchElementException.class, it::next);
      }
    }

    @Test
    void views() {
      Automaton automaton = Automaton.fromAtom("a");
      assertTrue(automaton.contains(automaton.start()));
      assertTrue(automaton.states().containsAll(automaton.accept()));
      assertFalse(automaton.accept().contains(automaton.start()));
      assertTrue(automaton.toString().contains("-> " + automaton.start()));
    }

    @Test
    void emptyAndAny() {
      assertLanguage(Automaton.empty(Alphabet.DEFAULT), s -> false);
      assertLanguage(Automaton.any(Alphabet.DEFAULT), s -> true);
      assertEquals(1, Automaton.any(Alphabet.DEFAULT).size());
    }
  }
}
