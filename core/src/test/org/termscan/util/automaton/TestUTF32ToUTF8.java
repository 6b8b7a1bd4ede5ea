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

import org.termscan.util.BytesRef;
import org.termscan.util.TermScanTestCase;
import org.termscan.util._TestUtil;

public class TestUTF32ToUTF8 extends TermScanTestCase {

  private void assertSameRun(Automaton utf32) {
    CharacterRunAutomaton cra = new CharacterRunAutomaton(utf32);
    ByteRunAutomaton bra = new ByteRunAutomaton(utf32);
    int num = atLeast(100);
    for (int i = 0; i < num; i++) {
      final String string;
      if (random().nextBoolean()) {
        string = _TestUtil.randomUnicodeString(random());
      } else {
        string = AutomatonTestUtil.randomAcceptedStringAsString(random(), utf32);
        if (string == null) {
          continue;
        }
        assertTrue(cra.run(string));
      }
      BytesRef bytes = new BytesRef(string);
      assertEquals(string, cra.run(string), bra.run(bytes.bytes, bytes.offset, bytes.length));
    }
  }

  public void testRandomRegexes() throws Exception {
    int num = atLeast(100);
    for (int i = 0; i < num; i++) {
      assertSameRun(new RegExp(AutomatonTestUtil.randomRegexp(random()), RegExp.NONE).toAutomaton());
    }
  }

  public void testRandomRanges() throws Exception {
    int num = atLeast(100);
    for (int i = 0; i < num; i++) {
      int start = random().nextInt(0x10000);
      int end;
      switch (random().nextInt(3)) {
        case 0:
          end = start + random().nextInt(0x80);
          break;
        case 1:
          end = start + random().nextInt(0x1000);
          break;
        default:
          end = start + random().nextInt(0x110000 - start);
          break;
      }
      end = Math.min(end, Character.MAX_CODE_POINT);
      assertSameRun(BasicOperations.repeat(BasicAutomata.makeCharRange(start, end)));
    }
  }

  public void testEncodingBoundaries() {
    // last code point of each UTF-8 length and the first of the next
    int[] points = {0x7f, 0x80, 0x7ff, 0x800, 0xffff, 0x10000, 0x10ffff};
    for (int i = 0; i < points.length - 1; i++) {
      Automaton utf8 = new UTF32ToUTF8().convert(BasicAutomata.makeCharRange(points[i], points[i + 1]));
      ByteRunAutomaton run = new ByteRunAutomaton(utf8, true);
      for (int cp = points[i]; cp <= points[i + 1]; cp += Math.max(1, (points[i + 1] - points[i]) / 7)) {
        if (cp < Character.MIN_SURROGATE || cp > Character.MAX_SURROGATE) {
          assertAccepts(run, cp, true);
        }
      }
      assertAccepts(run, points[i + 1], true);
      if (points[i] > 0) {
        assertAccepts(run, points[i] - 1, false);
      }
      if (points[i + 1] < Character.MAX_CODE_POINT) {
        assertAccepts(run, points[i + 1] + 1, false);
      }
    }
  }

  public void testConvertKeepsInput() {
    Automaton utf32 = new RegExp("[a-é]x").toAutomaton();
    String before = utf32.toString();
    Automaton utf8 = new UTF32ToUTF8().convert(utf32);
    assertEquals(before, utf32.toString());
    ByteRunAutomaton run = new ByteRunAutomaton(utf8, true);
    BytesRef bytes = new BytesRef("éx");
    assertTrue(run.run(bytes.bytes, bytes.offset, bytes.length));
    bytes = new BytesRef("êx");
    assertFalse(run.run(bytes.bytes, bytes.offset, bytes.length));
  }

  private void assertAccepts(ByteRunAutomaton run, int cp, boolean expected) {
    BytesRef bytes = new BytesRef(new String(Character.toChars(cp)));
    assertEquals("cp=" + Integer.toHexString(cp), expected, run.run(bytes.bytes, bytes.offset, bytes.length));
  }
}
