package org.termscan.util;

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

public class TestBytesRef extends TermScanTestCase {

  public void testEmpty() {
    BytesRef b = new BytesRef();
    assertEquals(BytesRef.EMPTY_BYTES, b.bytes);
    assertEquals(0, b.offset);
    assertEquals(0, b.length);
    assertEquals("", b.utf8ToString());
  }

  public void testFromChars() {
    for (int i = 0; i < 100; i++) {
      String s = _TestUtil.randomUnicodeString(random());
      String s2 = new BytesRef(s).utf8ToString();
      assertEquals(s, s2);
    }
  }

  /** bytes compare unsigned, which is code point order for UTF-8 */
  public void testCompareTo() {
    assertTrue(new BytesRef("a").compareTo(new BytesRef("b")) < 0);
    assertTrue(new BytesRef("ab").compareTo(new BytesRef("a")) > 0);
    assertEquals(0, new BytesRef("ab").compareTo(new BytesRef("ab")));
    assertTrue(new BytesRef("z").compareTo(new BytesRef("é")) < 0);
    assertTrue(new BytesRef("￿").compareTo(new BytesRef("𐐀")) < 0);
    BytesRef high = new BytesRef(new byte[] {(byte) 0x80}, 0, 1);
    assertTrue(new BytesRef("\u007f").compareTo(high) < 0);
  }

  public void testCopyAndGrow() {
    BytesRef b = new BytesRef("hello");
    BytesRef copy = BytesRef.deepCopyOf(new BytesRef(b.bytes, 1, 3));
    assertEquals(new BytesRef("ell"), copy);
    assertEquals(0, copy.offset);

    BytesRef target = new BytesRef();
    target.copyBytes(b);
    assertEquals(b, target);
    assertEquals(b.hashCode(), target.hashCode());
    assertNotSame(b.bytes, target.bytes);

    target.grow(20);
    assertTrue(target.bytes.length >= 20);
    assertEquals(new BytesRef("hello"), target);
  }

  public void testStartsEndsWith() {
    BytesRef ref = new BytesRef("foobar");
    assertTrue(StringHelper.startsWith(ref, new BytesRef("foo")));
    assertTrue(StringHelper.startsWith(ref, new BytesRef("")));
    assertFalse(StringHelper.startsWith(ref, new BytesRef("bar")));
    assertFalse(StringHelper.startsWith(new BytesRef("fo"), new BytesRef("foo")));
    assertTrue(StringHelper.endsWith(ref, new BytesRef("bar")));
    assertFalse(StringHelper.endsWith(ref, new BytesRef("foo")));
    assertFalse(StringHelper.endsWith(new BytesRef("ar"), new BytesRef("bar")));
  }

  public void testCodePoints() {
    IntsRef utf32 = UnicodeUtil.toUTF32("a𐐀é", new IntsRef());
    assertEquals(3, utf32.length);
    assertEquals('a', utf32.ints[0]);
    assertEquals(0x10400, utf32.ints[1]);
    assertEquals(0xe9, utf32.ints[2]);
    assertEquals("a𐐀é", UnicodeUtil.newString(utf32.ints, utf32.offset, utf32.length));

    IntsRef fromUTF8 = new IntsRef();
    UnicodeUtil.UTF8toUTF32(new BytesRef("a𐐀é"), fromUTF8);
    assertEquals(utf32, fromUTF8);
    assertEquals("a𐐀é", UnicodeUtil.newString(new BytesRef("a𐐀é")));
  }
}
