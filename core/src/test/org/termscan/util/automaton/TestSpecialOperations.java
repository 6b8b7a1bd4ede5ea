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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.termscan.util.BytesRef;
import org.termscan.util.IntsRef;
import org.termscan.util.TermScanTestCase;
import org.termscan.util.UnicodeUtil;
import org.termscan.util._TestUtil;

public class TestSpecialOperations extends TermScanTestCase {

  public void testIsFinite() {
    assertTrue(SpecialOperations.isFinite(BasicAutomata.makeEmpty()));
    assertTrue(SpecialOperations.isFinite(BasicAutomata.makeString("foo")));
    assertTrue(SpecialOperations.isFinite(new RegExp("abc|d|ef?").toAutomaton()));
    assertFalse(SpecialOperations.isFinite(new RegExp("ab*").toAutomaton()));
    assertFalse(SpecialOperations.isFinite(BasicAutomata.makeAnyString()));
    assertFalse(SpecialOperations.isFinite(new RegExp("(ab)+c").toAutomaton()));
  }

  /** a cycle that cannot reach an accept state still counts */
  public void testIsFiniteWithDeadCycle() {
    State init = new State();
    State end = new State();
    State loop = new State();
    end.setAccept(true);
    init.addTransition(new Transition('a', end));
    init.addTransition(new Transition('b', loop));
    loop.addTransition(new Transition('b', loop));
    Automaton a = new Automaton(init);
    assertFalse(SpecialOperations.isFinite(a));
    a.removeDeadTransitions();
    assertTrue(SpecialOperations.isFinite(a));
  }

  public void testRandomFinite() {
    int num = atLeast(50);
    for (int i = 0; i < num; i++) {
      List<String> strings = new ArrayList<String>();
      int count = random().nextInt(10);
      for (int j = 0; j < count; j++) {
        strings.add("x" + _TestUtil.randomSimpleString(random(), 'a', 'c', 5));
      }
      Automaton a = BasicAutomata.makeStringUnion(_TestUtil.sortedTerms(strings));
      assertTrue(SpecialOperations.isFinite(a));
      Set<IntsRef> finite = SpecialOperations.getFiniteStrings(a, -1);
      assertEquals(new HashSet<String>(strings).size(), finite.size());
      for (String s : strings) {
        assertTrue(finite.contains(UnicodeUtil.toUTF32(s, new IntsRef())));
      }
      if (count > 0) {
        assertFalse(SpecialOperations.isFinite(BasicOperations.repeat(a)));
      }
    }
  }

  public void testReverse() {
    Automaton a = new RegExp("abc|de+").toAutomaton();
    Set<State> initials = SpecialOperations.reverse(a);
    assertEquals(2, initials.size());
    assertTrue(BasicOperations.run(a, "cba"));
    assertTrue(BasicOperations.run(a, "ed"));
    assertTrue(BasicOperations.run(a, "eeed"));
    assertFalse(BasicOperations.run(a, "abc"));
    assertFalse(BasicOperations.run(a, "de"));

    // reversing the same language again gives back the original one
    SpecialOperations.reverse(a);
    assertTrue(BasicOperations.sameLanguage(new RegExp("abc|de+").toAutomaton(), a));
  }

  public void testReverseSingleton() {
    Automaton a = BasicAutomata.makeString("ab𐐀");
    SpecialOperations.reverse(a);
    assertNull(a.getSingleton());
    assertTrue(BasicOperations.run(a, "𐐀ba"));
    assertFalse(BasicOperations.run(a, "ab𐐀"));
  }

  public void testCommonPrefix() {
    assertEquals("fooba", SpecialOperations.getCommonPrefix(new RegExp("foo(bar|baz)").toAutomaton()));
    assertEquals("foo", SpecialOperations.getCommonPrefix(new RegExp("foo.*").toAutomaton()));
    assertEquals("", SpecialOperations.getCommonPrefix(new RegExp("(foo|bar)baz").toAutomaton()));
    assertEquals("literal", SpecialOperations.getCommonPrefix(BasicAutomata.makeString("literal")));
    // stops at an accept state
    assertEquals("ab", SpecialOperations.getCommonPrefix(new RegExp("ab(cd)?").toAutomaton()));
    // stops at a branch
    assertEquals("a", SpecialOperations.getCommonPrefix(new RegExp("a(bc)*d").toAutomaton()));
  }

  public void testCommonSuffix() {
    assertEquals("baz", SpecialOperations.getCommonSuffix(new RegExp("(foo|bar)baz").toAutomaton()));
    assertEquals("", SpecialOperations.getCommonSuffix(new RegExp("foo(bar|baz)").toAutomaton()));
    assertEquals("literal", SpecialOperations.getCommonSuffix(BasicAutomata.makeString("literal")));
    assertEquals("x𐐀", SpecialOperations.getCommonSuffix(new RegExp("(a|bc*)x𐐀").toAutomaton()));
    assertEquals("", SpecialOperations.getCommonSuffix(BasicAutomata.makeEmpty()));
  }

  public void testCommonPrefixBytesRef() {
    Automaton utf8 = new UTF32ToUTF8().convert(new RegExp("héllo.*").toAutomaton());
    assertEquals(new BytesRef("héllo"), SpecialOperations.getCommonPrefixBytesRef(utf8));
    assertEquals(new BytesRef("abc"), SpecialOperations.getCommonPrefixBytesRef(BasicAutomata.makeString("abc")));
  }

  public void testCommonSuffixBytesRef() {
    Automaton utf8 = new UTF32ToUTF8().convert(new RegExp("(foo|bar)é").toAutomaton());
    assertEquals(new BytesRef("é"), SpecialOperations.getCommonSuffixBytesRef(utf8));
    utf8 = new UTF32ToUTF8().convert(new RegExp(".*ing").toAutomaton());
    assertEquals(new BytesRef("ing"), SpecialOperations.getCommonSuffixBytesRef(utf8));
  }

  public void testFiniteStrings() {
    Automaton a = BasicOperations.union(Arrays.asList(
        BasicAutomata.makeString("a"),
        BasicAutomata.makeString("bc"),
        BasicAutomata.makeEmptyString()));
    Set<IntsRef> strings = SpecialOperations.getFiniteStrings(a, -1);
    assertEquals(3, strings.size());
    assertTrue(strings.contains(new IntsRef()));
    assertTrue(strings.contains(UnicodeUtil.toUTF32("a", new IntsRef())));
    assertTrue(strings.contains(UnicodeUtil.toUTF32("bc", new IntsRef())));

    assertNotNull(SpecialOperations.getFiniteStrings(a, 3));
    assertNull(SpecialOperations.getFiniteStrings(a, 2));
  }

  public void testFiniteStringsRanges() {
    Set<IntsRef> strings = SpecialOperations.getFiniteStrings(new RegExp("x[a-d]").toAutomaton(), -1);
    assertEquals(4, strings.size());
    assertTrue(strings.contains(UnicodeUtil.toUTF32("xc", new IntsRef())));
  }

  public void testFiniteStringsSingleton() {
    Automaton a = BasicAutomata.makeString("one");
    Set<IntsRef> strings = SpecialOperations.getFiniteStrings(a, 1);
    assertEquals(1, strings.size());
    assertTrue(strings.contains(UnicodeUtil.toUTF32("one", new IntsRef())));
    assertNull(SpecialOperations.getFiniteStrings(a, 0));
  }

  public void testFiniteStringsInfinite() {
    assertNull(SpecialOperations.getFiniteStrings(new RegExp("ab*").toAutomaton(), -1));
  }
}
