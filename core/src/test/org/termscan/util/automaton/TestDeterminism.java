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
 * Not completely thorough, but tries to test determinism correctness
 * somewhat randomly.
 */
public class TestDeterminism extends TermScanTestCase {

  /** test a bunch of random regular expressions */
  public void testRegexps() throws Exception {
    int num = atLeast(200);
    for (int i = 0; i < num; i++) {
      assertAutomaton(new RegExp(AutomatonTestUtil.randomRegexp(random()), RegExp.NONE).toAutomaton());
    }
  }

  /** test against a simple, unoptimized det */
  public void testAgainstSimple() throws Exception {
    int num = atLeast(100);
    for (int i = 0; i < num; i++) {
      Automaton a = AutomatonTestUtil.randomAutomaton(random());
      Automaton b = a.clone();
      b.determinize();
      assertTrue(b.isDeterministic());
      assertTrue(AutomatonTestUtil.isDeterministicSlow(b));
      CharacterRunAutomaton ra = new CharacterRunAutomaton(a);
      for (int j = 0; j < 10; j++) {
        String s = AutomatonTestUtil.randomAcceptedStringAsString(random(), a);
        if (s != null) {
          assertTrue(BasicOperations.run(b, s));
          assertTrue(ra.run(s));
        }
      }
      assertTrue(BasicOperations.sameLanguage(a, b));
    }
  }

  public void testSubsetConstruction() {
    // (a|ab)c: the nondeterministic split on 'a' must merge into one state
    Automaton a = BasicOperations.concatenate(
        BasicOperations.union(BasicAutomata.makeChar('a'), BasicAutomata.makeString("ab")),
        BasicAutomata.makeChar('c'));
    assertFalse(a.isDeterministic());
    a.determinize();
    assertTrue(AutomatonTestUtil.isDeterministicSlow(a));
    assertTrue(BasicOperations.run(a, "ac"));
    assertTrue(BasicOperations.run(a, "abc"));
    assertFalse(BasicOperations.run(a, "ab"));
    assertEquals(1, a.getInitialState().numTransitions());
  }

  private static void assertAutomaton(Automaton a) {
    Automaton clone = a.clone();
    // complement(complement(a)) = a
    Automaton equivalent = BasicOperations.complement(BasicOperations.complement(a));
    assertTrue(BasicOperations.sameLanguage(a, equivalent));
    
    // a union a = a
    equivalent = BasicOperations.union(a, clone);
    assertTrue(BasicOperations.sameLanguage(a, equivalent));
    
    // a intersect a = a
    equivalent = BasicOperations.intersection(a, clone);
    assertTrue(BasicOperations.sameLanguage(a, equivalent));
    
    // a minus a = empty
    Automaton empty = BasicOperations.minus(a, clone);
    assertTrue(BasicOperations.isEmpty(empty));
    
    // as long as don't accept the empty string
    // then optional(a) - empty = a
    if (!BasicOperations.run(a, "")) {
      Automaton optional = BasicOperations.optional(a);
      Automaton empty2 = BasicAutomata.makeEmptyString();
      assertTrue(BasicOperations.sameLanguage(a, BasicOperations.minus(optional, empty2)));
    }
  } 
}
