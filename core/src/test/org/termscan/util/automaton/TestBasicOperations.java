package org.termscan.util.automaton;

/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.termscan.util.TermScanTestCase;
import org.termscan.util._TestUtil;

public class TestBasicOperations extends TermScanTestCase {

  /** Random strings over a small alphabet, plus strings accepted by either automaton. */
  private static List<String> probes(Random random, Automaton a1, Automaton a2) {
    List<String> strings = new ArrayList<String>();
    for (int i = 0; i < 20; i++) {
      strings.add(_TestUtil.randomSimpleString(random, 'a', 'e', 6));
      strings.add(_TestUtil.randomUnicodeString(random, 4));
      String s1 = AutomatonTestUtil.randomAcceptedStringAsString(random, a1);
      if (s1 != null) strings.add(s1);
      String s2 = AutomatonTestUtil.randomAcceptedStringAsString(random, a2);
      if (s2 != null) strings.add(s2);
    }
    return strings;
  }

  public void testAlgebraAgreesWithRun() {
    int num = atLeast(20);
    for (int iter = 0; iter < num; iter++) {
      Automaton a1 = AutomatonTestUtil.randomAutomaton(random());
      Automaton a2 = AutomatonTestUtil.randomAutomaton(random());
      CharacterRunAutomaton r1 = new CharacterRunAutomaton(a1);
      CharacterRunAutomaton r2 = new CharacterRunAutomaton(a2);
      CharacterRunAutomaton union = new CharacterRunAutomaton(BasicOperations.union(a1, a2));
      CharacterRunAutomaton intersection = new CharacterRunAutomaton(BasicOperations.intersection(a1, a2));
      CharacterRunAutomaton complement = new CharacterRunAutomaton(BasicOperations.complement(a1));
      CharacterRunAutomaton minus = new CharacterRunAutomaton(BasicOperations.minus(a1, a2));
      for (String s : probes(random(), a1, a2)) {
        boolean m1 = r1.run(s);
        boolean m2 = r2.run(s);
        assertEquals(m1 || m2, union.run(s));
        assertEquals(m1 && m2, intersection.run(s));
        assertEquals(!m1, complement.run(s));
        assertEquals(m1 && !m2, minus.run(s));
      }
    }
  }

  public void testOperandsAreNotModified() {
    Automaton a1 = new RegExp("ab*").toAutomaton();
    Automaton a2 = new RegExp("c|d").toAutomaton();
    String before1 = a1.toString();
    String before2 = a2.toString();
    BasicOperations.concatenate(a1, a2);
    BasicOperations.union(a1, a2);
    BasicOperations.intersection(a1, a2);
    BasicOperations.complement(a1);
    BasicOperations.repeat(a1, 2, 4);
    BasicOperations.optional(a2);
    assertEquals(before1, a1.toString());
    assertEquals(before2, a2.toString());
  }

  public void testConsumeReusesOperand() {
    Automaton a1 = new RegExp("ab*").toAutomaton();
    Automaton a2 = new RegExp("c|d").toAutomaton();
    Automaton result = BasicOperations.concatenate(a1, a2, true);
    assertSame(a1, result);
    assertTrue(BasicOperations.run(result, "abbc"));
  }

  public void testSingletonConcatenation() {
    Automaton a = BasicOperations.concatenate(BasicAutomata.makeString("foo"), BasicAutomata.makeString("bar"));
    assertEquals("foobar", a.getSingleton());
    a = BasicOperations.concatenate(Arrays.asList(BasicAutomata.makeString("a"),
        BasicAutomata.makeChar('b'), BasicAutomata.makeString("c")));
    assertEquals("abc", a.getSingleton());
  }

  public void testConcatenateSameInstance() {
    Automaton a = new RegExp("a|bc").toAutomaton();
    Automaton aa = BasicOperations.concatenate(Arrays.asList(a, a));
    assertTrue(BasicOperations.run(aa, "abc"));
    assertTrue(BasicOperations.run(aa, "bcbc"));
    assertFalse(BasicOperations.run(aa, "a"));
    assertTrue(BasicOperations.run(a, "a"));
  }

  public void testRepeat() {
    Automaton a = BasicAutomata.makeString("ab");
    Automaton r = BasicOperations.repeat(a, 1, 2);
    assertTrue(BasicOperations.run(r, "ab"));
    assertTrue(BasicOperations.run(r, "abab"));
    assertFalse(BasicOperations.run(r, "ababab"));
    assertFalse(BasicOperations.run(r, ""));
    assertTrue(BasicOperations.isEmpty(BasicOperations.repeat(a, 3, 2)));
    assertTrue(BasicOperations.run(BasicOperations.repeat(a), ""));
    assertTrue(BasicOperations.run(BasicOperations.repeat(a, 2), "ababab"));
    assertFalse(BasicOperations.run(BasicOperations.repeat(a, 2), "ab"));
  }

  public void testSubsetOf() {
    Automaton small = new RegExp("ab|ac").toAutomaton();
    Automaton big = new RegExp("a.").toAutomaton();
    assertTrue(BasicOperations.subsetOf(small, big));
    assertFalse(BasicOperations.subsetOf(big, small));
    assertTrue(BasicOperations.subsetOf(BasicAutomata.makeEmpty(), small));
    assertTrue(BasicOperations.subsetOf(BasicAutomata.makeString("ab"), small));
    assertFalse(BasicOperations.subsetOf(BasicAutomata.makeString("ad"), small));
  }

  public void testEmptyAndTotal() {
    assertTrue(BasicOperations.isEmpty(BasicAutomata.makeEmpty()));
    assertFalse(BasicOperations.isEmpty(BasicAutomata.makeEmptyString()));
    assertTrue(BasicOperations.isEmptyString(BasicAutomata.makeEmptyString()));
    assertTrue(BasicOperations.isTotal(BasicAutomata.makeAnyString()));
    assertFalse(BasicOperations.isTotal(BasicAutomata.makeAnyChar()));

    // a dead branch does not make the language non-empty
    State init = new State();
    State dead = new State();
    init.addTransition(new Transition('a', dead));
    dead.addTransition(new Transition('b', dead));
    assertTrue(BasicOperations.isEmpty(new Automaton(init)));

    // a total language that is not in minimal form
    Automaton total = BasicOperations.union(BasicAutomata.makeAnyString(), BasicAutomata.makeString("x"));
    assertTrue(BasicOperations.isTotal(total));
  }

  public void testComplementOfEmptyIsTotal() {
    Automaton a = BasicOperations.complement(BasicAutomata.makeEmpty());
    assertTrue(BasicOperations.isTotal(a));
    assertTrue(BasicOperations.isEmpty(BasicOperations.complement(a)));
  }

  public void testCharRangeChecksBounds() {
    try {
      BasicAutomata.makeCharRange('z', 'a');
      fail("min > max must be rejected");
    } catch (IllegalArgumentException expected) {
      // expected
    }
  }

  public void testMakeInterval() {
    Automaton a = BasicAutomata.makeInterval(7, 103, 0);
    for (int i = 0; i < 200; i++) {
      assertEquals(i >= 7 && i <= 103, BasicOperations.run(a, Integer.toString(i)));
    }
    assertTrue(BasicOperations.run(a, "0042"));
    Automaton fixed = BasicAutomata.makeInterval(7, 103, 3);
    assertTrue(BasicOperations.run(fixed, "042"));
    assertFalse(BasicOperations.run(fixed, "42"));
    try {
      BasicAutomata.makeInterval(1000, 2000, 3);
      fail("too many digits must be rejected");
    } catch (IllegalArgumentException expected) {
      // expected
    }
  }

  public void testStringUnionMatchesUnion() {
    int num = atLeast(10);
    for (int iter = 0; iter < num; iter++) {
      List<String> strings = new ArrayList<String>();
      int count = _TestUtil.nextInt(random(), 1, 20);
      for (int i = 0; i < count; i++) {
        strings.add(_TestUtil.randomUnicodeString(random(), 6));
      }
      Automaton expected = BasicAutomata.makeEmpty();
      for (String s : strings) {
        expected = BasicOperations.union(expected, BasicAutomata.makeString(s));
      }
      Automaton actual = BasicAutomata.makeStringUnion(_TestUtil.sortedTerms(strings));
      assertTrue(BasicOperations.sameLanguage(expected, actual));
    }
  }
}
