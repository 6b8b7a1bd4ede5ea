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

import java.util.Arrays;

import org.termscan.util.TermScanTestCase;

public class TestAutomaton extends TermScanTestCase {

  public void testSingletonCounts() {
    Automaton a = BasicAutomata.makeString("ab𐐀");
    assertEquals("ab𐐀", a.getSingleton());
    assertEquals(4, a.getNumberOfStates());
    assertEquals(3, a.getNumberOfTransitions());
    assertTrue(a.toString().startsWith("singleton: "));

    a.expandSingleton();
    assertNull(a.getSingleton());
    assertEquals(4, a.getNumberOfStates());
    assertEquals(3, a.getNumberOfTransitions());
    assertTrue(BasicOperations.run(a, "ab𐐀"));
  }

  public void testToString() {
    Automaton a = new RegExp("a[b-d]").toAutomaton();
    String s = a.toString();
    assertTrue(s, s.startsWith("initial state: 0\n"));
    assertTrue(s, s.contains("state 0 [reject]:\n  a -> 1\n"));
    assertTrue(s, s.contains("  b-d -> 2\n"));
    assertTrue(s, s.contains("state 2 [accept]:\n"));
  }

  public void testToDot() {
    Automaton a = new RegExp("a[b-d]").toAutomaton();
    String dot = a.toDot();
    assertTrue(dot, dot.startsWith("digraph Automaton {\n"));
    assertTrue(dot, dot.contains("  initial -> 0\n"));
    assertTrue(dot, dot.contains("  0 -> 1 [label=\"a\"]\n"));
    assertTrue(dot, dot.contains("  1 -> 2 [label=\"b-d\"]\n"));
    assertTrue(dot, dot.contains("  2 [shape=doublecircle,label=\"\"];\n"));
    assertTrue(dot, dot.endsWith("}\n"));
  }

  public void testNonPrintableLabels() {
    Automaton a = BasicAutomata.makeCharRange(0, ' ');
    String s = a.toString();
    assertTrue(s, s.contains("\\\\U00000000-\\\\U00000020"));
  }

  public void testClone() {
    Automaton a = new RegExp("(ab|c)*").toAutomaton();
    Automaton clone = a.clone();
    assertNotSame(a.getInitialState(), clone.getInitialState());
    assertEquals(a.toString(), clone.toString());
    clone.getInitialState().addTransition(new Transition('z', clone.getInitialState()));
    assertFalse(BasicOperations.run(a, "z"));
    assertTrue(BasicOperations.run(clone, "z"));
  }

  public void testSlicedTransitions() {
    Automaton a = new RegExp("a[b-d]|e").toAutomaton();
    SlicedTransitions sliced = a.getSlicedTransitions();
    assertEquals(a.getNumberOfStates(), sliced.numStates);
    assertEquals(2, sliced.numTransitions(0));
    assertFalse(sliced.isAccept(0));
    int afterA = sliced.step(0, 'a');
    assertTrue(afterA > 0);
    assertEquals(-1, sliced.step(0, 'b'));
    int end = sliced.step(afterA, 'c');
    assertTrue(sliced.isAccept(end));
    assertEquals(end, sliced.step(0, 'e'));
    int[] points = sliced.getPoints();
    assertEquals(0, points[0]);
    for (int i = 1; i < points.length; i++) {
      assertTrue(points[i-1] < points[i]);
    }
  }

  public void testStartPointsAndTotalize() {
    Automaton a = new RegExp("[b-d]").toAutomaton();
    int[] points = a.getStartPoints();
    assertEquals(3, points.length);
    a.totalize();
    for (State s : a.getNumberedStates()) {
      assertEquals(Character.MIN_CODE_POINT, s.getTransitions().iterator().next().getMin());
    }
    assertTrue(BasicOperations.run(a, "c"));
    assertFalse(BasicOperations.run(a, "x"));
  }

  public void testConvenienceMethods() {
    Automaton ab = BasicAutomata.makeString("ab");
    Automaton c = BasicAutomata.makeChar('c');
    assertTrue(BasicOperations.run(ab.concatenate(c), "abc"));
    assertTrue(BasicOperations.run(ab.optional(), ""));
    assertTrue(BasicOperations.run(ab.repeat(), "ababab"));
    assertFalse(BasicOperations.run(ab.repeat(2), "ab"));
    assertTrue(BasicOperations.run(ab.repeat(1, 2), "abab"));
    assertFalse(BasicOperations.run(ab.complement(), "ab"));
    assertTrue(BasicOperations.isEmpty(ab.minus(ab)));
    assertTrue(ab.intersection(ab.union(c)).subsetOf(ab));
    assertTrue(BasicOperations.run(Automaton.union(Arrays.asList(ab, c)), "c"));
    assertTrue(BasicOperations.run(Automaton.concatenate(Arrays.asList(ab, c, ab)), "abcab"));
    assertTrue(BasicAutomata.makeEmptyString().isEmptyString());
    assertFalse(ab.isEmptyString());

    Automaton nfa = ab.union(BasicAutomata.makeString("ac"));
    assertFalse(nfa.isDeterministic());
    nfa.determinize();
    assertTrue(nfa.isDeterministic());
    assertSame(nfa, Automaton.minimize(nfa));
    assertEquals(3, nfa.getNumberOfStates());
  }

  public void testEditAfterNumbering() {
    Automaton a = new Automaton();
    State s0 = a.getInitialState();
    State sa = new State();
    a.addTransition(s0, new Transition('a', sa));
    a.setAccept(sa, true);
    assertEquals(2, a.getNumberOfStates());
    assertTrue(new CharacterRunAutomaton(a).run("a"));

    // states numbered above; the new edge must renumber
    State sb = new State();
    a.addTransition(s0, new Transition('b', sb));
    a.setAccept(sb, true);
    assertTrue(a.isDeterministic());
    assertEquals(3, a.getNumberOfStates());
    assertEquals(2, a.getNumberOfTransitions());

    CharacterRunAutomaton run = new CharacterRunAutomaton(a);
    assertTrue(run.run("a"));
    assertTrue(run.run("b"));
    assertFalse(run.run("c"));
    assertFalse(run.run(""));

    Automaton copy = a.clone();
    assertTrue(BasicOperations.run(copy, "b"));
    assertFalse(BasicOperations.run(copy, "ab"));
    assertTrue(BasicOperations.sameLanguage(a, copy));

    a.setAccept(s0, true);
    assertTrue(new CharacterRunAutomaton(a).run(""));
    assertFalse(new CharacterRunAutomaton(copy).run(""));

    // overlapping interval out of the same state
    a.addTransition(s0, new Transition('a', 'c', new State()));
    assertFalse(a.isDeterministic());
    assertEquals(4, a.getNumberOfStates());
    assertTrue(new CharacterRunAutomaton(a).run("b"));
  }

  public void testEditExpandsSingleton() {
    Automaton a = BasicAutomata.makeString("x");
    assertEquals(2, a.getNumberOfStates());
    State extra = new State();
    a.addTransition(a.getInitialState(), new Transition('y', extra));
    a.setAccept(extra, true);
    assertNull(a.getSingleton());
    CharacterRunAutomaton run = new CharacterRunAutomaton(a);
    assertTrue(run.run("x"));
    assertTrue(run.run("y"));
  }
}
