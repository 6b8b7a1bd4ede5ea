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
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.termscan.util.IntsRef;

/**
 * Parametric transition tables for the Levenshtein automata of degree 1
 * and 2, with and without transpositions. Unlike constant tables produced
 * by an offline generator, these are derived from the Schulz-Mihov position
 * sets at run time, once per class load, and bit packed in memory.
 * <p>
 * A parametric state is a set of positions relative to the state's offset
 * in the word, normalized so that the smallest position is 0. A position
 * {@code i#e} has consumed {@code i} word symbols with {@code e} edits; a
 * transposition position {@code i#e_t} has read {@code word[i+1]} and must
 * read {@code word[i]} next. State 0 is always <code>{0#0}</code>.
 * <p>
 * For every characteristic vector length {@code k} in {@code [0, 2n+1]} the
 * table holds the target state (plus one, so that 0 means no transition)
 * and the offset increment for each {@code (vector, state)} pair, bit packed
 * at index {@code vector * numStates + state}.
 *
 * @lucene.internal
 */
final class ParametricTables {

  static final ParametricTables LEV1 = new ParametricTables(1, false);
  static final ParametricTables LEV1T = new ParametricTables(1, true);
  static final ParametricTables LEV2 = new ParametricTables(2, false);
  static final ParametricTables LEV2T = new ParametricTables(2, true);

  final int n;
  final boolean transpositions;
  final int numStates;
  final int[] minErrors;
  /** packed targets (+1), by vector length */
  final long[][] toStates;
  final int stateBits;
  /** packed offset increments, by vector length */
  final long[][] offsetIncrs;
  final int[] incrBits;

  static ParametricTables get(int n, boolean transpositions) {
    switch (n) {
      case 1: return transpositions ? LEV1T : LEV1;
      case 2: return transpositions ? LEV2T : LEV2;
      default: throw new IllegalArgumentException("no parametric tables for distance " + n);
    }
  }

  private ParametricTables(int n, boolean transpositions) {
    this.n = n;
    this.transpositions = transpositions;
    final int range = 2*n+1;
    // all vectors of all lengths 0..range, laid out by length
    final int slots = (1 << (range+1)) - 1;

    final Map<IntsRef,Integer> ids = new HashMap<IntsRef,Integer>();
    final List<int[]> states = new ArrayList<int[]>();
    final List<int[]> targets = new ArrayList<int[]>();
    final List<int[]> incrs = new ArrayList<int[]>();
    final int[] initial = new int[] {encode(0, 0, false)};
    ids.put(new IntsRef(initial, 0, 1), 0);
    states.add(initial);

    final int[] incr = new int[1];
    for (int s = 0; s < states.size(); s++) {
      final int[] state = states.get(s);
      final int[] target = new int[slots];
      final int[] offsets = new int[slots];
      for (int k = 0; k <= range; k++) {
        for (int vector = 0; vector < (1 << k); vector++) {
          final int slot = (1 << k) - 1 + vector;
          final int[] next = step(state, k, vector, incr);
          if (next == null) {
            target[slot] = -1;
            continue;
          }
          final IntsRef key = new IntsRef(next, 0, next.length);
          Integer id = ids.get(key);
          if (id == null) {
            id = states.size();
            ids.put(key, id);
            states.add(next);
          }
          target[slot] = id;
          offsets[slot] = incr[0];
        }
      }
      targets.add(target);
      incrs.add(offsets);
    }

    numStates = states.size();
    minErrors = new int[numStates];
    for (int s = 0; s < numStates; s++) {
      int min = n+1;
      for (int code : states.get(s)) {
        if (!isTransposition(code)) {
          min = Math.min(min, errors(code) - position(code));
        }
      }
      minErrors[s] = min;
    }

    stateBits = bitsRequired(numStates);
    toStates = new long[range+1][];
    offsetIncrs = new long[range+1][];
    incrBits = new int[range+1];
    for (int k = 0; k <= range; k++) {
      final int numVectors = 1 << k;
      final int[] to = new int[numVectors * numStates];
      final int[] inc = new int[numVectors * numStates];
      int maxIncr = 0;
      for (int vector = 0; vector < numVectors; vector++) {
        final int slot = numVectors - 1 + vector;
        for (int s = 0; s < numStates; s++) {
          final int loc = vector * numStates + s;
          to[loc] = targets.get(s)[slot] + 1;
          inc[loc] = incrs.get(s)[slot];
          maxIncr = Math.max(maxIncr, inc[loc]);
        }
      }
      toStates[k] = pack(to, stateBits);
      incrBits[k] = bitsRequired(maxIncr);
      offsetIncrs[k] = pack(inc, incrBits[k]);
    }
  }

  /**
   * Computes the successor of {@code state} for the given characteristic
   * vector of length {@code k}, or null if there is none. The offset
   * increment is returned in {@code incr[0]}.
   */
  private int[] step(int[] state, int k, int vector, int[] incr) {
    for (int code : state) {
      final int i = position(code);
      // these positions cannot occur this close to the end of the word
      if (isTransposition(code) ? i + 1 >= k : i > k) {
        return null;
      }
    }

    final TreeSet<Integer> next = new TreeSet<Integer>();
    for (int code : state) {
      final int i = position(code);
      final int e = errors(code);
      if (isTransposition(code)) {
        if (has(vector, k, i)) {
          next.add(encode(i + 2, e, false));
        }
        continue;
      }
      if (has(vector, k, i)) {
        next.add(encode(i + 1, e, false));
      }
      if (e < n) {
        // insertion
        next.add(encode(i, e + 1, false));
        // substitution
        if (i < k) {
          next.add(encode(i + 1, e + 1, false));
        }
        // d deletions followed by a match
        for (int d = 1; d <= n - e; d++) {
          if (has(vector, k, i + d)) {
            next.add(encode(i + d + 1, e + d, false));
          }
        }
        if (transpositions && has(vector, k, i + 1)) {
          next.add(encode(i, e + 1, true));
        }
      }
    }

    for (Iterator<Integer> it = next.iterator(); it.hasNext();) {
      final int candidate = it.next();
      for (int other : next) {
        if (other != candidate && subsumes(other, candidate)) {
          it.remove();
          break;
        }
      }
    }
    if (next.isEmpty()) {
      return null;
    }

    int min = Integer.MAX_VALUE;
    for (int code : next) {
      min = Math.min(min, position(code));
    }
    final int[] result = new int[next.size()];
    int upto = 0;
    for (int code : next) {
      result[upto++] = encode(position(code) - min, errors(code), isTransposition(code));
    }
    // shifting every position by the same amount keeps the order
    incr[0] = min;
    return result;
  }

  /**
   * True if every string accepted from position {@code b} is also accepted
   * from position {@code a}.
   */
  private static boolean subsumes(int a, int b) {
    final int i = position(a), e = errors(a);
    final int j = position(b), f = errors(b);
    if (e >= f) {
      return false;
    }
    if (isTransposition(a)) {
      return isTransposition(b) && i == j;
    }
    if (isTransposition(b)) {
      return Math.min(Math.abs(j - i), Math.abs(j + 1 - i)) + 1 <= f - e;
    }
    return Math.abs(j - i) <= f - e;
  }

  /** Bit {@code j} of a vector of length {@code k}, most significant first. */
  private static boolean has(int vector, int k, int j) {
    return j < k && ((vector >>> (k - 1 - j)) & 1) != 0;
  }

  static int encode(int position, int errors, boolean transposition) {
    return (position << 4) | (errors << 1) | (transposition ? 1 : 0);
  }

  static int position(int code) {
    return code >>> 4;
  }

  static int errors(int code) {
    return (code >>> 1) & 7;
  }

  static boolean isTransposition(int code) {
    return (code & 1) != 0;
  }

  static int bitsRequired(int maxValue) {
    return Math.max(1, 32 - Integer.numberOfLeadingZeros(maxValue));
  }

  /** Packs the values in the layout read by {@code ParametricDescription.unpack}. */
  static long[] pack(int[] values, int bitsPerValue) {
    final long[] blocks = new long[(int) (((long) values.length * bitsPerValue + 63) >>> 6)];
    for (int i = 0; i < values.length; i++) {
      final long v = values[i];
      assert v >= 0 && v < (1L << bitsPerValue);
      final long bitLoc = (long) i * bitsPerValue;
      final int block = (int) (bitLoc >>> 6);
      final int shift = (int) (bitLoc & 63);
      blocks[block] |= v << shift;
      if (shift + bitsPerValue > 64) {
        blocks[block + 1] |= v >>> (64 - shift);
      }
    }
    return blocks;
  }

  /** Description of the Levenshtein automaton for a word of length {@code w}. */
  LevenshteinAutomata.ParametricDescription newDescription(int w) {
    return new TableDescription(w, n, minErrors);
  }

  private final class TableDescription extends LevenshteinAutomata.ParametricDescription {

    TableDescription(int w, int n, int[] minErrors) {
      super(w, n, minErrors);
    }

    @Override
    int transition(int absState, int position, int vector) {
      // null absState should never be passed in
      assert absState != -1;

      // decode absState -> state, offset
      int state = absState/(w+1);
      int offset = absState%(w+1);
      assert offset >= 0;

      final int k = Math.min(w - position, 2*n+1);
      final int loc = vector * numStates + state;
      state = unpack(toStates[k], loc, stateBits)-1;
      if (state == -1) {
        // null state
        return -1;
      }
      offset += unpack(offsetIncrs[k], loc, incrBits[k]);
      // translate back to abs
      return state*(w+1)+offset;
    }
  }
}
