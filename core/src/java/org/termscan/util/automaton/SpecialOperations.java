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
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.termscan.util.BytesRef;
import org.termscan.util.IntsRef;
import org.termscan.util.UnicodeUtil;

/**
 * Special automata operations.
 *
 * @lucene.experimental
 */
final public class SpecialOperations {

  private SpecialOperations() {}

  /**
   * Finds the largest entry whose value is less than or equal to c, or 0 if
   * there is no such entry.
   */
  static int findIndex(int c, int[] points) {
    int a = 0;
    int b = points.length;
    while (b - a > 1) {
      int d = (a + b) >>> 1;
      if (points[d] > c) b = d;
      else if (points[d] < c) a = d;
      else return d;
    }
    return a;
  }

  /**
   * Returns true if the language of this automaton is finite. Only the
   * reachable graph is inspected, so a cycle among dead states also counts
   * as infinite.
   */
  public static boolean isFinite(Automaton a) {
    if (a.isSingleton()) return true;
    final State[] states = a.getNumberedStates();
    final BitSet path = new BitSet(states.length);
    final BitSet visited = new BitSet(states.length);
    // explicit depth-first stack: state number and next transition to follow
    final int[] stack = new int[states.length];
    final int[] next = new int[states.length];
    int depth = 0;
    stack[depth] = a.initial.number;
    next[depth] = 0;
    depth++;
    path.set(a.initial.number);
    visited.set(a.initial.number);
    while (depth > 0) {
      final State s = states[stack[depth-1]];
      final int i = next[depth-1];
      if (i < s.numTransitions) {
        next[depth-1]++;
        final State to = s.transitionsArray[i].to;
        if (path.get(to.number)) {
          return false;
        }
        if (!visited.get(to.number)) {
          visited.set(to.number);
          path.set(to.number);
          stack[depth] = to.number;
          next[depth] = 0;
          depth++;
        }
      } else {
        path.clear(s.number);
        depth--;
      }
    }
    return true;
  }

  /**
   * Returns the longest string that is a prefix of all accepted strings and
   * visits each state at most once.
   *
   * @return common prefix
   */
  public static String getCommonPrefix(Automaton a) {
    if (a.isSingleton()) return a.singleton;
    StringBuilder b = new StringBuilder();
    HashSet<State> visited = new HashSet<State>();
    State s = a.initial;
    boolean done;
    do {
      done = true;
      visited.add(s);
      if (!s.accept && s.numTransitions() == 1) {
        Transition t = s.getTransitions().iterator().next();
        if (t.min == t.max && !visited.contains(t.to)) {
          b.appendCodePoint(t.min);
          s = t.to;
          done = false;
        }
      }
    } while (!done);
    return b.toString();
  }

  /** Like {@link #getCommonPrefix(Automaton)}, for a byte (UTF-8)
   *  automaton. */
  public static BytesRef getCommonPrefixBytesRef(Automaton a) {
    if (a.isSingleton()) return new BytesRef(a.singleton);
    BytesRef ref = new BytesRef(10);
    HashSet<State> visited = new HashSet<State>();
    State s = a.initial;
    boolean done;
    do {
      done = true;
      visited.add(s);
      if (!s.accept && s.numTransitions() == 1) {
        Transition t = s.getTransitions().iterator().next();
        if (t.min == t.max && !visited.contains(t.to)) {
          ref.grow(++ref.length);
          ref.bytes[ref.length - 1] = (byte)t.min;
          s = t.to;
          done = false;
        }
      }
    } while (!done);
    return ref;
  }

  /**
   * Returns the longest string that is a suffix of all accepted strings and
   * visits each state at most once.
   *
   * @return common suffix
   */
  public static String getCommonSuffix(Automaton a) {
    if (a.isSingleton()) // if singleton, the suffix is the string itself.
      return a.singleton;

    // reverse the language of the automaton, then reverse its common prefix.
    Automaton r = a.clone();
    reverse(r);
    r.determinize();
    final String prefix = getCommonPrefix(r);
    final IntsRef codePoints = UnicodeUtil.toUTF32(prefix, new IntsRef());
    final int[] reversed = new int[codePoints.length];
    for (int i = 0; i < codePoints.length; i++) {
      reversed[i] = codePoints.ints[codePoints.length - 1 - i];
    }
    return UnicodeUtil.newString(reversed, 0, reversed.length);
  }

  /** Like {@link #getCommonSuffix(Automaton)}, for a byte (UTF-8)
   *  automaton. */
  public static BytesRef getCommonSuffixBytesRef(Automaton a) {
    if (a.isSingleton()) // if singleton, the suffix is the string itself.
      return new BytesRef(a.singleton);

    // reverse the language of the automaton, then reverse its common prefix.
    Automaton r = a.clone();
    reverse(r);
    r.determinize();
    BytesRef ref = getCommonPrefixBytesRef(r);
    reverseBytes(ref);
    return ref;
  }

  private static void reverseBytes(BytesRef ref) {
    if (ref.length <= 1) return;
    int num = ref.length >> 1;
    for (int i = ref.offset; i < ( ref.offset + num ); i++) {
      byte b = ref.bytes[i];
      ref.bytes[i] = ref.bytes[ref.offset * 2 + ref.length - i - 1];
      ref.bytes[ref.offset * 2 + ref.length - i - 1] = b;
    }
  }

  /**
   * Reverses the language of the given (non-singleton) automaton while returning
   * the set of new initial states.
   */
  public static Set<State> reverse(Automaton a) {
    a.expandSingleton();
    // reverse all edges
    State[] states = a.getNumberedStates();
    List<List<Transition>> m = new ArrayList<List<Transition>>(states.length);
    Set<State> accept = new HashSet<State>();
    for (State s : states)
      if (s.isAccept())
        accept.add(s);
    for (State r : states) {
      m.add(new ArrayList<Transition>());
      r.accept = false;
    }
    for (State r : states)
      for (Transition t : r.getTransitions())
        m.get(t.to.number).add(new Transition(t.min, t.max, r));
    for (State r : states) {
      List<Transition> tr = m.get(r.number);
      r.setTransitions(tr.toArray(new Transition[tr.size()]));
    }
    // make new initial+final states
    a.initial.accept = true;
    a.initial = new State();
    for (State r : accept)
      a.initial.addEpsilon(r); // ensures that all initial states are reachable
    a.deterministic = false;
    a.clearNumberedStates();
    return accept;
  }

  /**
   * Returns the set of accepted strings, assuming that at most
   * <code>limit</code> strings are accepted. If more than <code>limit</code>
   * strings are accepted, or the automaton has a reachable cycle, null is
   * returned. If <code>limit</code>&lt;0, then the limit is infinite. The
   * empty string is included when the initial state accepts.
   */
  public static Set<IntsRef> getFiniteStrings(Automaton a, int limit) {
    HashSet<IntsRef> strings = new HashSet<IntsRef>();
    if (a.isSingleton()) {
      if (limit > 0 || limit < 0) {
        strings.add(UnicodeUtil.toUTF32(a.singleton, new IntsRef()));
      } else {
        return null;
      }
    } else {
      if (a.initial.accept) {
        strings.add(new IntsRef());
        if (limit >= 0 && strings.size() > limit) {
          return null;
        }
      }
      if (!getFiniteStrings(a.initial, new HashSet<State>(), strings, new IntsRef(), limit)) {
        return null;
      }
    }
    return strings;
  }

  /**
   * Returns the strings that can be produced from the given state, or
   * false if more than <code>limit</code> strings are found.
   * <code>limit</code>&lt;0 means "infinite".
   */
  private static boolean getFiniteStrings(State s, HashSet<State> pathstates,
      HashSet<IntsRef> strings, IntsRef path, int limit) {
    pathstates.add(s);
    for (Transition t : s.getTransitions()) {
      if (pathstates.contains(t.to)) {
        return false;
      }
      for (int n = t.min; n <= t.max; n++) {
        path.grow(path.length+1);
        path.ints[path.length] = n;
        path.length++;
        if (t.to.accept) {
          strings.add(deepCopyOf(path));
          if (limit >= 0 && strings.size() > limit) {
            return false;
          }
        }
        if (!getFiniteStrings(t.to, pathstates, strings, path, limit)) {
          return false;
        }
        path.length--;
      }
    }
    pathstates.remove(s);
    return true;
  }

  private static IntsRef deepCopyOf(IntsRef other) {
    final IntsRef copy = new IntsRef(other.length);
    copy.copyInts(other);
    return copy;
  }
}
