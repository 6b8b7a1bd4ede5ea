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

import org.termscan.util._TestUtil;

/**
 * Utilities for testing automata.
 * <p>
 * Capable of generating random regular expressions,
 * and automata, and also provides a number of very
 * basic unoptimized implementations (*slow) for testing.
 */
public class AutomatonTestUtil {

  private AutomatonTestUtil() {}

  /** Returns a random regular expression that parses with {@link RegExp#NONE}. */
  public static String randomRegexp(Random r) {
    while (true) {
      String regexp = randomRegexpString(r);
      try {
        new RegExp(regexp, RegExp.NONE);
        return regexp;
      } catch (IllegalArgumentException e) {
        // not a valid regexp, try again
      }
    }
  }

  private static String randomRegexpString(Random r) {
    final int end = r.nextInt(20);
    if (end == 0) {
      // allow 0 length
      return "";
    }
    final char[] buffer = new char[end];
    for (int i = 0; i < end; i++) {
      int t = r.nextInt(15);
      if (0 == t && i < end - 1) {
        // Make a surrogate pair
        // High surrogate
        buffer[i++] = (char) _TestUtil.nextInt(r, 0xd800, 0xdbff);
        // Low surrogate
        buffer[i] = (char) _TestUtil.nextInt(r, 0xdc00, 0xdfff);
      }
      else if (t <= 1) buffer[i] = (char) _TestUtil.nextInt(r, 'a', 'e');
      else if (2 == t) buffer[i] = (char) _TestUtil.nextInt(r, 0x80, 0x800);
      else if (3 == t) buffer[i] = (char) _TestUtil.nextInt(r, 0x800, 0xd7ff);
      else if (4 == t) buffer[i] = (char) _TestUtil.nextInt(r, 0xe000, 0xffff);
      else if (5 == t) buffer[i] = '.';
      else if (6 == t) buffer[i] = '?';
      else if (7 == t) buffer[i] = '*';
      else if (8 == t) buffer[i] = '+';
      else if (9 == t) buffer[i] = '(';
      else if (10 == t) buffer[i] = ')';
      else if (11 == t) buffer[i] = '-';
      else if (12 == t) buffer[i] = '[';
      else if (13 == t) buffer[i] = ']';
      else if (14 == t) buffer[i] = '|';
    }
    return new String(buffer, 0, end);
  }

  /** return a random NFA/DFA for testing */
  public static Automaton randomAutomaton(Random random) {
    // get two random Automata from regexps
    Automaton a1 = new RegExp(AutomatonTestUtil.randomRegexp(random), RegExp.NONE).toAutomaton();
    if (random.nextBoolean())
      a1 = BasicOperations.complement(a1);
    
    Automaton a2 = new RegExp(AutomatonTestUtil.randomRegexp(random), RegExp.NONE).toAutomaton();
    if (random.nextBoolean()) 
      a2 = BasicOperations.complement(a2);
    
    // combine them in random ways
    switch(random.nextInt(4)) {
      case 0: return BasicOperations.concatenate(a1, a2);
      case 1: return BasicOperations.union(a1, a2);
      case 2: return BasicOperations.intersection(a1, a2);
      default: return BasicOperations.minus(a1, a2);
    }
  }

  /**
   * Returns the code points of a random string accepted by the automaton,
   * or null if it accepts nothing that can be written as a valid UTF-16
   * string. Walks live states only, and heads for the nearest accept state
   * once the string gets long.
   */
  public static int[] randomAcceptedString(Random r, Automaton a) {
    final State[] states = a.getNumberedStates();
    final int[] distance = new int[states.length];
    Arrays.fill(distance, Integer.MAX_VALUE);
    for (State s : states) {
      if (s.isAccept()) {
        distance[s.getNumber()] = 0;
      }
    }
    boolean changed = true;
    while (changed) {
      changed = false;
      for (State s : states) {
        for (Transition t : s.getTransitions()) {
          final int d = distance[t.getDest().getNumber()];
          if (d != Integer.MAX_VALUE && d + 1 < distance[s.getNumber()]) {
            distance[s.getNumber()] = d + 1;
            changed = true;
          }
        }
      }
    }

    final List<Integer> codePoints = new ArrayList<Integer>();
    State s = a.getInitialState();
    if (distance[s.getNumber()] == Integer.MAX_VALUE) {
      return null;
    }
    while (true) {
      if (s.isAccept() && (codePoints.size() > 20 || r.nextInt(4) == 0)) {
        break;
      }
      final List<Transition> candidates = new ArrayList<Transition>();
      for (Transition t : s.getTransitions()) {
        final int d = distance[t.getDest().getNumber()];
        if (d == Integer.MAX_VALUE) {
          continue;
        }
        if (t.getMin() >= Character.MIN_SURROGATE && t.getMax() <= Character.MAX_SURROGATE) {
          continue;
        }
        if (codePoints.size() > 20 && d >= distance[s.getNumber()]) {
          continue;
        }
        candidates.add(t);
      }
      if (candidates.isEmpty()) {
        if (s.isAccept()) {
          break;
        }
        return null;
      }
      final Transition t = candidates.get(r.nextInt(candidates.size()));
      int cp = _TestUtil.nextInt(r, t.getMin(), t.getMax());
      if (cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE) {
        cp = t.getMin() < Character.MIN_SURROGATE ? t.getMin() : t.getMax();
      }
      codePoints.add(cp);
      s = t.getDest();
    }
    final int[] result = new int[codePoints.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = codePoints.get(i);
    }
    return result;
  }

  /** Like {@link #randomAcceptedString(Random, Automaton)}, as a String. */
  public static String randomAcceptedStringAsString(Random r, Automaton a) {
    final int[] codePoints = randomAcceptedString(r, a);
    return codePoints == null ? null : new String(codePoints, 0, codePoints.length);
  }

  /**
   * Returns true if no state has two transitions whose intervals overlap.
   */
  public static boolean isDeterministicSlow(Automaton a) {
    for (State s : a.getNumberedStates()) {
      final List<Transition> transitions = new ArrayList<Transition>();
      for (Transition t : s.getTransitions()) {
        transitions.add(t);
      }
      for (int i = 0; i < transitions.size(); i++) {
        for (int j = i + 1; j < transitions.size(); j++) {
          final Transition t1 = transitions.get(i);
          final Transition t2 = transitions.get(j);
          if (t1.getMin() <= t2.getMax() && t2.getMin() <= t1.getMax()) {
            return false;
          }
        }
      }
    }
    return true;
  }

  /**
   * Plain dynamic programming Levenshtein distance over code points.
   */
  public static int levenshteinSlow(int[] a, int[] b) {
    return editDistanceSlow(a, b, false);
  }

  /**
   * Optimal string alignment distance: Levenshtein plus swaps of adjacent
   * symbols, where no substring is edited more than once.
   */
  public static int osaSlow(int[] a, int[] b) {
    return editDistanceSlow(a, b, true);
  }

  private static int editDistanceSlow(int[] a, int[] b, boolean transpositions) {
    final int[][] d = new int[a.length + 1][b.length + 1];
    for (int i = 0; i <= a.length; i++) {
      d[i][0] = i;
    }
    for (int j = 0; j <= b.length; j++) {
      d[0][j] = j;
    }
    for (int i = 1; i <= a.length; i++) {
      for (int j = 1; j <= b.length; j++) {
        final int cost = a[i-1] == b[j-1] ? 0 : 1;
        d[i][j] = Math.min(Math.min(d[i-1][j] + 1, d[i][j-1] + 1), d[i-1][j-1] + cost);
        if (transpositions && i > 1 && j > 1 && a[i-1] == b[j-2] && a[i-2] == b[j-1]) {
          d[i][j] = Math.min(d[i][j], d[i-2][j-2] + 1);
        }
      }
    }
    return d[a.length][b.length];
  }

  /** Returns the code points of the given string. */
  public static int[] codePoints(String s) {
    final int[] result = new int[s.codePointCount(0, s.length())];
    for (int i = 0, j = 0, cp; i < s.length(); i += Character.charCount(cp)) {
      result[j++] = cp = s.codePointAt(i);
    }
    return result;
  }
}
