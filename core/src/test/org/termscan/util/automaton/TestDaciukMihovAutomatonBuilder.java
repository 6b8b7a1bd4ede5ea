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
import java.util.Collections;
import java.util.List;

import org.termscan.util.BytesRef;
import org.termscan.util.TermScanTestCase;
import org.termscan.util._TestUtil;

public class TestDaciukMihovAutomatonBuilder extends TermScanTestCase {

  public void testSharedSuffixes() {
    List<BytesRef> terms = _TestUtil.sortedTerms(Arrays.asList("an", "and", "ant"));
    Automaton a = DaciukMihovAutomatonBuilder.build(terms);
    assertTrue(a.isDeterministic());
    // root, a, an, and one shared final state for "d" and "t"
    assertEquals(4, a.getNumberOfStates());
    int literalStates = 0;
    for (BytesRef term : terms) {
      literalStates += BasicAutomata.makeString(term.utf8ToString()).getNumberOfStates();
    }
    assertTrue(a.getNumberOfStates() < literalStates);

    assertTrue(BasicOperations.run(a, "an"));
    assertTrue(BasicOperations.run(a, "and"));
    assertTrue(BasicOperations.run(a, "ant"));
    assertFalse(BasicOperations.run(a, "a"));
    assertFalse(BasicOperations.run(a, "ants"));
    assertFalse(BasicOperations.run(a, ""));
  }

  public void testEmptyString() {
    Automaton a = DaciukMihovAutomatonBuilder.build(_TestUtil.sortedTerms(Arrays.asList("", "x")));
    assertTrue(BasicOperations.run(a, ""));
    assertTrue(BasicOperations.run(a, "x"));
    assertEquals(2, a.getNumberOfStates());
  }

  public void testNoStrings() {
    Automaton a = BasicAutomata.makeStringUnion(Collections.<BytesRef>emptyList());
    assertTrue(BasicOperations.isEmpty(a));
  }

  /** the result is already minimal */
  public void testRandomIsMinimal() {
    int num = atLeast(50);
    for (int i = 0; i < num; i++) {
      List<String> strings = new ArrayList<String>();
      int count = 1 + random().nextInt(30);
      for (int j = 0; j < count; j++) {
        strings.add(random().nextBoolean()
            ? _TestUtil.randomSimpleString(random(), 'a', 'd', 6)
            : _TestUtil.randomUnicodeString(random(), 4));
      }
      Automaton a = BasicAutomata.makeStringUnion(_TestUtil.sortedTerms(strings));
      Automaton minimal = a.clone();
      MinimizationOperations.minimize(minimal);
      assertEquals(minimal.getNumberOfStates(), a.getNumberOfStates());
      CharacterRunAutomaton run = new CharacterRunAutomaton(a);
      for (String s : strings) {
        assertTrue(run.run(s));
      }
    }
  }
}
