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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.termscan.util.BytesRef;
import org.termscan.util.PrintStreamInfoStream;
import org.termscan.util.TermScanTestCase;
import org.termscan.util._TestUtil;

public class TestCompiledAutomaton extends TermScanTestCase {

  private CompiledAutomaton build(String... strings) {
    final List<BytesRef> terms = _TestUtil.sortedTerms(Arrays.asList(strings));
    return new CompiledAutomaton(BasicAutomata.makeStringUnion(terms), true, false);
  }

  private void checkFloor(CompiledAutomaton c, String input, String expected) {
    final BytesRef b = new BytesRef(input);
    final BytesRef result = c.floor(b, b);
    if (expected == null) {
      assertNull(result);
    } else {
      assertNotNull(result);
      assertEquals("actual=" + result.utf8ToString() + " vs expected=" + expected + " (input=" + input + ")",
                   result, new BytesRef(expected));
    }
  }

  private void checkTerms(String[] terms) throws Exception {
    final CompiledAutomaton c = build(terms);
    final BytesRef[] termBytes = new BytesRef[terms.length];
    for (int idx = 0; idx < terms.length; idx++) {
      termBytes[idx] = new BytesRef(terms[idx]);
    }
    Arrays.sort(termBytes);

    for (int iter = 0; iter < 100 * RANDOM_MULTIPLIER; iter++) {
      final String s = random().nextInt(10) == 1 ? terms[random().nextInt(terms.length)] : randomString();
      final BytesRef term = new BytesRef(s);
      int loc = Arrays.binarySearch(termBytes, term);
      if (loc < 0) {
        loc = -(loc+1);
      } else {
        // matched exactly
        loc++;
      }
      checkFloor(c, s, loc == 0 ? null : termBytes[loc-1].utf8ToString());
    }
  }

  private String randomString() {
    return random().nextBoolean()
        ? _TestUtil.randomSimpleString(random(), 'a', 'e', 6)
        : _TestUtil.randomUnicodeString(random(), 6);
  }

  public void testBasic() throws Exception {
    CompiledAutomaton c = build("fob", "foo", "goo");
    checkFloor(c, "goo", "goo");
    checkFloor(c, "ga", "foo");
    checkFloor(c, "g", "foo");
    checkFloor(c, "foc", "fob");
    checkFloor(c, "foz", "foo");
    checkFloor(c, "f", null);
    checkFloor(c, "", null);
    checkFloor(c, "aa", null);
    checkFloor(c, "zzz", "goo");
  }

  public void testSharedPrefix() throws Exception {
    CompiledAutomaton c = build("bob", "bobby", "cat");
    checkFloor(c, "bobbx", "bob");
    checkFloor(c, "bobz", "bobby");
    checkFloor(c, "bobby", "bobby");
    checkFloor(c, "c", "bobby");
    checkFloor(c, "cat", "cat");
    checkFloor(c, "dog", "cat");
    checkFloor(c, "bo", null);
  }

  public void testEmptyStringAccepted() throws Exception {
    CompiledAutomaton c = build("", "b");
    checkFloor(c, "", "");
    checkFloor(c, "a", "");
    checkFloor(c, "c", "b");
  }

  public void testSeparateOutput() throws Exception {
    CompiledAutomaton c = build("fob", "foo", "goo");
    BytesRef input = new BytesRef("gz");
    BytesRef output = new BytesRef();
    assertSame(output, c.floor(input, output));
    assertEquals(new BytesRef("goo"), output);
    assertEquals(new BytesRef("gz"), input);
  }

  public void testFloorRangeTransitions() throws Exception {
    CompiledAutomaton c = new CompiledAutomaton(new RegExp("[a-f]x|[k-p]y").toAutomaton());
    assertEquals(CompiledAutomaton.AUTOMATON_TYPE.NORMAL, c.type);
    checkFloor(c, "a", null);
    checkFloor(c, "ax", "ax");
    checkFloor(c, "gz", "fx");
    checkFloor(c, "j", "fx");
    // the range k-p is cut below the label
    checkFloor(c, "l", "ky");
    checkFloor(c, "la", "ky");
    checkFloor(c, "lz", "ly");
    checkFloor(c, "q", "py");
    checkFloor(c, "zz", "py");
  }

  /** the greatest term below the input would loop forever */
  public void testFloorInfinite() throws Exception {
    CompiledAutomaton c = new CompiledAutomaton(new RegExp("a*").toAutomaton());
    assertEquals(CompiledAutomaton.AUTOMATON_TYPE.NORMAL, c.type);
    checkFloor(c, "a", "a");
    checkFloor(c, "", "");
    checkFloor(c, "b", null);

    c = new CompiledAutomaton(new RegExp("x(ab)*").toAutomaton());
    checkFloor(c, "xab", "xab");
    checkFloor(c, "xaa", "x");
    // xab < xabab < xababab < ... < xac
    checkFloor(c, "xac", null);
    checkFloor(c, "w", null);
  }

  public void testRandomFinite() throws Exception {
    int numTerms = atLeast(400);
    List<String> terms = new ArrayList<String>();
    for (int i = 0; i < numTerms; i++) {
      terms.add(randomString());
    }
    checkTerms(terms.toArray(new String[terms.size()]));
  }

  public void testClassification() {
    CompiledAutomaton c = new CompiledAutomaton(BasicAutomata.makeEmpty());
    assertEquals(CompiledAutomaton.AUTOMATON_TYPE.NONE, c.type);
    assertNull(c.runAutomaton);

    c = new CompiledAutomaton(new RegExp(".*").toAutomaton());
    assertEquals(CompiledAutomaton.AUTOMATON_TYPE.ALL, c.type);

    c = new CompiledAutomaton(new RegExp("foo").toAutomaton());
    assertEquals(CompiledAutomaton.AUTOMATON_TYPE.SINGLE, c.type);
    assertEquals(new BytesRef("foo"), c.term);

    Automaton expanded = BasicAutomata.makeString("foo");
    expanded.expandSingleton();
    c = new CompiledAutomaton(expanded);
    assertEquals(CompiledAutomaton.AUTOMATON_TYPE.SINGLE, c.type);
    assertEquals(new BytesRef("foo"), c.term);

    c = new CompiledAutomaton(BasicAutomata.makeEmptyString());
    assertEquals(CompiledAutomaton.AUTOMATON_TYPE.SINGLE, c.type);
    assertEquals(0, c.term.length);

    c = new CompiledAutomaton(new RegExp("foo.*").toAutomaton());
    assertEquals(CompiledAutomaton.AUTOMATON_TYPE.PREFIX, c.type);
    assertEquals(new BytesRef("foo"), c.term);
    assertNull(c.runAutomaton);
    assertNull(c.sortedTransitions);

    c = new CompiledAutomaton(new RegExp("fo[ox]").toAutomaton());
    assertEquals(CompiledAutomaton.AUTOMATON_TYPE.NORMAL, c.type);
    assertNull(c.term);
    assertTrue(c.finite);
    assertNull(c.commonSuffixRef);
    assertNotNull(c.runAutomaton);
    assertEquals(c.runAutomaton.getSize(), c.sortedTransitions.length);
  }

  public void testNoSimplify() {
    CompiledAutomaton c = new CompiledAutomaton(new RegExp(".*").toAutomaton(), null, false);
    assertEquals(CompiledAutomaton.AUTOMATON_TYPE.NORMAL, c.type);
    assertFalse(c.finite);
    BytesRef any = new BytesRef("whatever");
    assertTrue(c.runAutomaton.run(any.bytes, any.offset, any.length));

    c = new CompiledAutomaton(BasicAutomata.makeString("foo"), null, false);
    assertEquals(CompiledAutomaton.AUTOMATON_TYPE.NORMAL, c.type);
    assertTrue(c.finite);
  }

  public void testCommonSuffix() {
    CompiledAutomaton c = new CompiledAutomaton(new RegExp("fo.*ing").toAutomaton());
    assertEquals(CompiledAutomaton.AUTOMATON_TYPE.NORMAL, c.type);
    assertFalse(c.finite);
    assertEquals(new BytesRef("ing"), c.commonSuffixRef);

    c = new CompiledAutomaton(new RegExp("fo.*").toAutomaton(), null, false);
    assertNull(c.commonSuffixRef);

    // the caller's answer is taken as is
    c = new CompiledAutomaton(new RegExp("a.*b").toAutomaton(), true, true);
    assertTrue(c.finite);
    assertNull(c.commonSuffixRef);
  }

  public void testToStringAndEquals() {
    assertEquals("PREFIX(foo)", new CompiledAutomaton(new RegExp("foo.*").toAutomaton()).toString());
    assertEquals("SINGLE(foo)", new CompiledAutomaton(BasicAutomata.makeString("foo")).toString());
    assertEquals("NONE", new CompiledAutomaton(BasicAutomata.makeEmpty()).toString());
    assertTrue(new CompiledAutomaton(new RegExp("a[bc]+").toAutomaton()).toString().startsWith("NORMAL(states="));

    CompiledAutomaton c1 = new CompiledAutomaton(new RegExp("a[bc]+").toAutomaton());
    CompiledAutomaton c2 = new CompiledAutomaton(new RegExp("a(b|c)+").toAutomaton());
    CompiledAutomaton c3 = new CompiledAutomaton(new RegExp("a[bd]+").toAutomaton());
    assertEquals(c1, c2);
    assertEquals(c1.hashCode(), c2.hashCode());
    assertFalse(c1.equals(c3));
    assertEquals(new CompiledAutomaton(new RegExp("foo.*").toAutomaton()),
                 new CompiledAutomaton(new RegExp("fo(o.*)").toAutomaton()));
    assertFalse(new CompiledAutomaton(new RegExp("foo.*").toAutomaton()).equals(
                new CompiledAutomaton(BasicAutomata.makeString("foo"))));
  }

  public void testInfoStream() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true);
    AutomatonConfig config = new AutomatonConfig().setInfoStream(new PrintStreamInfoStream(out));
    new CompiledAutomaton(new RegExp("foo.*").toAutomaton(), null, true, config);
    new CompiledAutomaton(new RegExp("ab*c").toAutomaton(), null, true, config);
    String log = bytes.toString();
    assertTrue(log, log.startsWith("CA "));
    assertTrue(log, log.contains("type=PREFIX term=foo"));
    assertTrue(log, log.contains("type=NORMAL states="));
    assertTrue(log, log.contains("finite=false"));
    assertTrue(log, log.contains("commonSuffix="));
  }
}
