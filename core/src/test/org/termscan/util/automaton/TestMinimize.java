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

import org.termscan.util.TermScanTestCase;

/** 
 * This test builds some randomish NFA/DFA and minimizes them.
 */
public class TestMinimize extends TermScanTestCase {

  /** the minimal and non-minimal are compared to ensure they are the same. */
  public void testBasic() {
    int num = atLeast(200);
    for (int i = 0; i < num; i++) {
      Automaton a = AutomatonTestUtil.randomAutomaton(random());
      Automaton b = a.clone();
      MinimizationOperations.minimize(b);
      assertTrue(BasicOperations.sameLanguage(a, b));
    }
  }

  /** minimization never adds states, and running it twice changes nothing */
  public void testIdempotent() {
    int num = atLeast(100);
    for (int i = 0; i < num; i++) {
      Automaton a = AutomatonTestUtil.randomAutomaton(random());
      a.determinize();
      a.removeDeadTransitions();
      Automaton b = a.clone();
      MinimizationOperations.minimize(b);
      assertTrue(b.getNumberOfStates() <= a.getNumberOfStates());
      int states = b.getNumberOfStates();
      MinimizationOperations.minimize(b);
      assertEquals(states, b.getNumberOfStates());
    }
  }

  public void testMergesEquivalentStates() {
    // a trie of {ab, cb}: the two 'b' states are equivalent
    State init = new State();
    State afterA = new State();
    State afterC = new State();
    State end1 = new State();
    State end2 = new State();
    end1.setAccept(true);
    end2.setAccept(true);
    init.addTransition(new Transition('a', afterA));
    init.addTransition(new Transition('c', afterC));
    afterA.addTransition(new Transition('b', end1));
    afterC.addTransition(new Transition('b', end2));
    Automaton a = new Automaton(init);
    a.setDeterministic(true);
    assertEquals(5, a.getNumberOfStates());
    MinimizationOperations.minimize(a);
    assertEquals(3, a.getNumberOfStates());
    assertTrue(BasicOperations.run(a, "ab"));
    assertTrue(BasicOperations.run(a, "cb"));
    assertFalse(BasicOperations.run(a, "bb"));
  }

  /** n^2 space usage in Hopcroft minimization? */
  public void testMinimizeHuge() {
    Automaton a = new RegExp("+-*(A|.....|BC)*]", RegExp.NONE).toAutomaton();
    assertTrue(a.getNumberOfStates() > 1);
  }
}
