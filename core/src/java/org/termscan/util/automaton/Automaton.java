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
import java.util.BitSet;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

import org.termscan.util.ArrayUtil;
import org.termscan.util.RamUsageEstimator;

/**
 * Finite-state automaton with regular expression operations.
 * <p>
 * Class invariants:
 * <ul>
 * <li>An automaton is either represented explicitly (with {@link State} and
 * {@link Transition} objects) or with a singleton string (see
 * {@link #getSingleton()} and {@link #expandSingleton()}) in case the automaton
 * is known to accept exactly one string. (Implicitly, all states and
 * transitions of an automaton are reachable from its initial state.)
 * <li>Automata are always reduced (see {@link #reduce()}) and have no
 * transitions to dead states (see {@link #removeDeadTransitions()}).
 * <li>If an automaton is nondeterministic, then {@link #isDeterministic()}
 * returns false (but the converse is not required).
 * <li>Automata provided as input to operations are generally assumed to be
 * disjoint.
 * </ul>
 * <p>
 * Operations of {@link BasicOperations} come in two forms: the plain form
 * never modifies its arguments, while the form taking a {@code consume}
 * flag is allowed to reuse (and thereby destroy) the argument automata when
 * the flag is set.
 * <p>
 * The cached numbering of states returned by {@link #getNumberedStates()}
 * is dropped by every method that changes the shape of the graph.
 *
 * @lucene.experimental
 */
public class Automaton implements Cloneable {

  /**
   * Initial state of this automaton.
   */
  State initial;

  /**
   * If true, then this automaton is definitely deterministic (i.e., there are
   * no choices for any run, but a run may crash).
   */
  boolean deterministic;

  /**
   * Singleton string. Null if not applicable.
   */
  String singleton;

  /** Cached array of reachable states, in breadth-first order. */
  private State[] numberedStates;

  /**
   * Constructs a new automaton that accepts the empty language. Using this
   * constructor, automata can be constructed manually from {@link State} and
   * {@link Transition} objects.
   *
   * @see State
   * @see Transition
   */
  public Automaton(State initial) {
    this.initial = initial;
    deterministic = true;
    singleton = null;
  }

  public Automaton() {
    this(new State());
  }

  boolean isSingleton() {
    return singleton != null;
  }

  /**
   * Returns the singleton string for this automaton. An automaton that accepts
   * exactly one string <i>may</i> be represented in singleton mode. In that
   * case, this method may be used to obtain the string.
   *
   * @return string, null if this automaton is not in singleton mode.
   */
  public String getSingleton() {
    return singleton;
  }

  /**
   * Gets initial state.
   *
   * @return state
   */
  public State getInitialState() {
    expandSingleton();
    return initial;
  }

  /**
   * Returns deterministic flag for this automaton.
   *
   * @return true if the automaton is definitely deterministic, false if the
   *         automaton may be nondeterministic
   */
  public boolean isDeterministic() {
    return deterministic;
  }

  /**
   * Sets deterministic flag for this automaton. This method should (only) be
   * used if automata are constructed manually.
   *
   * @param deterministic true if the automaton is definitely deterministic,
   *          false if the automaton may be nondeterministic
   */
  public void setDeterministic(boolean deterministic) {
    this.deterministic = deterministic;
  }

  /**
   * Returns all reachable states, numbered 0 to N-1 in breadth-first order
   * from the initial state (which is always number 0). The array is cached
   * until the graph is changed.
   */
  public State[] getNumberedStates() {
    if (numberedStates == null) {
      expandSingleton();
      final Set<State> visited = new HashSet<State>();
      final LinkedList<State> worklist = new LinkedList<State>();
      State[] states = new State[4];
      int upto = 0;
      worklist.add(initial);
      visited.add(initial);
      initial.number = upto;
      states[upto] = initial;
      upto++;
      while (worklist.size() > 0) {
        State s = worklist.removeFirst();
        for (int i=0;i<s.numTransitions;i++) {
          final Transition t = s.transitionsArray[i];
          if (!visited.contains(t.to)) {
            visited.add(t.to);
            worklist.add(t.to);
            t.to.number = upto;
            if (upto == states.length) {
              final State[] newArray = new State[ArrayUtil.oversize(1+upto, RamUsageEstimator.NUM_BYTES_OBJECT_REF)];
              System.arraycopy(states, 0, newArray, 0, upto);
              states = newArray;
            }
            states[upto] = t.to;
            upto++;
          }
        }
      }

      if (states.length != upto) {
        final State[] newArray = new State[upto];
        System.arraycopy(states, 0, newArray, 0, upto);
        states = newArray;
      }
      numberedStates = states;
    }

    return numberedStates;
  }

  /**
   * Expert: installs an already numbered array of states. The states must
   * be exactly the reachable states, with {@code states[i].number == i}
   * and the initial state at index 0.
   */
  void setNumberedStates(State[] states) {
    setNumberedStates(states, states.length);
  }

  void setNumberedStates(State[] states, int count) {
    assert count <= states.length;
    if (count < states.length) {
      final State[] newArray = new State[count];
      System.arraycopy(states, 0, newArray, 0, count);
      numberedStates = newArray;
    } else {
      numberedStates = states;
    }
  }

  public void clearNumberedStates() {
    numberedStates = null;
  }

  /**
   * Adds an outgoing transition to a state of this automaton. The state
   * numbering is discarded, and the automaton is marked nondeterministic
   * if the new interval overlaps an existing one of {@code from}.
   *
   * @param from source state, reachable from {@link #getInitialState()}
   * @param t transition to add
   */
  public void addTransition(State from, Transition t) {
    expandSingleton();
    for (int i = 0; i < from.numTransitions; i++) {
      final Transition other = from.transitionsArray[i];
      if (other.min <= t.max && t.min <= other.max) {
        deterministic = false;
        break;
      }
    }
    from.addTransition(t);
    clearNumberedStates();
  }

  /**
   * Sets acceptance of a state of this automaton.
   *
   * @param s state, reachable from {@link #getInitialState()}
   * @param accept if true, {@code s} becomes an accept state
   */
  public void setAccept(State s, boolean accept) {
    expandSingleton();
    s.accept = accept;
    clearNumberedStates();
  }

  /**
   * Returns the set of reachable accept states.
   *
   * @return set of {@link State} objects
   */
  public Set<State> getAcceptStates() {
    expandSingleton();
    HashSet<State> accepts = new HashSet<State>();
    for (State s : getNumberedStates()) {
      if (s.accept) {
        accepts.add(s);
      }
    }
    return accepts;
  }

  /**
   * Adds transitions to explicit crash state to ensure that transition function
   * is total.
   */
  void totalize() {
    State s = new State();
    s.addTransition(new Transition(Character.MIN_CODE_POINT, Character.MAX_CODE_POINT,
        s));
    for (State p : getNumberedStates()) {
      int maxi = Character.MIN_CODE_POINT;
      p.sortTransitions(Transition.COMPARE_BY_MIN_MAX_THEN_DEST);
      final int limit = p.numTransitions;
      for (int i=0;i<limit;i++) {
        Transition t = p.transitionsArray[i];
        if (t.min > maxi) {
          p.addTransition(new Transition(maxi, (t.min - 1), s));
        }
        if (t.max + 1 > maxi) {
          maxi = t.max + 1;
        }
      }
      if (maxi <= Character.MAX_CODE_POINT) {
        p.addTransition(new Transition(maxi, Character.MAX_CODE_POINT, s));
      }
      p.sortTransitions(Transition.COMPARE_BY_MIN_MAX_THEN_DEST);
    }
    clearNumberedStates();
  }

  /**
   * Reduces this automaton. An automaton is "reduced" by combining overlapping
   * and adjacent edge intervals with same destination.
   */
  public void reduce() {
    final State[] states = getNumberedStates();
    for (State s : states) {
      s.reduce();
    }
  }

  /**
   * Returns sorted array of all interval start points.
   */
  public int[] getStartPoints() {
    final State[] states = getNumberedStates();
    Set<Integer> pointset = new HashSet<Integer>();
    pointset.add(Character.MIN_CODE_POINT);
    for (State s : states) {
      for (int i=0;i<s.numTransitions;i++) {
        Transition t = s.transitionsArray[i];
        pointset.add(t.min);
        if (t.max < Character.MAX_CODE_POINT) {
          pointset.add((t.max + 1));
        }
      }
    }
    int[] points = new int[pointset.size()];
    int n = 0;
    for (Integer m : pointset)
      points[n++] = m;
    Arrays.sort(points);
    return points;
  }

  /**
   * Returns the set of live states, by number. A state is "live" if an accept
   * state is reachable from it.
   */
  private BitSet getLiveStates() {
    final State[] states = getNumberedStates();
    final BitSet live = new BitSet(states.length);
    final LinkedList<State> worklist = new LinkedList<State>();
    for (State q : states) {
      if (q.accept) {
        live.set(q.number);
        worklist.add(q);
      }
    }
    // reverse adjacency, by target number
    final List<List<State>> reverse = new ArrayList<List<State>>(states.length);
    for (int i = 0; i < states.length; i++) {
      reverse.add(new ArrayList<State>());
    }
    for (State s : states) {
      for (int i=0;i<s.numTransitions;i++) {
        reverse.get(s.transitionsArray[i].to.number).add(s);
      }
    }
    while (worklist.size() > 0) {
      State s = worklist.removeFirst();
      for (State p : reverse.get(s.number)) {
        if (!live.get(p.number)) {
          live.set(p.number);
          worklist.add(p);
        }
      }
    }
    return live;
  }

  /**
   * Removes transitions to dead states and calls {@link #reduce()}.
   * (A state is "dead" if no accept state is
   * reachable from it.)
   */
  public void removeDeadTransitions() {
    if (isSingleton()) {
      return;
    }
    final State[] states = getNumberedStates();
    final BitSet live = getLiveStates();
    for (State s : states) {
      int upto = 0;
      for (int i=0;i<s.numTransitions;i++) {
        final Transition t = s.transitionsArray[i];
        if (live.get(t.to.number)) {
          s.transitionsArray[upto++] = s.transitionsArray[i];
        }
      }
      s.numTransitions = upto;
    }
    clearNumberedStates();
    reduce();
  }

  /**
   * Returns a sorted array of transitions for each state (and sets state
   * numbers).
   */
  public Transition[][] getSortedTransitions() {
    final State[] states = getNumberedStates();
    Transition[][] transitions = new Transition[states.length][];
    for (State s : states) {
      s.sortTransitions(Transition.COMPARE_BY_MIN_MAX_THEN_DEST);
      s.trimTransitionsArray();
      transitions[s.number] = s.transitionsArray;
      assert s.transitionsArray != null;
    }
    return transitions;
  }

  /**
   * Returns the flat, numbered form of this automaton: per state, its
   * transitions as sorted {@code (min, max, dest)} triples. The initial
   * state is state 0.
   */
  public SlicedTransitions getSlicedTransitions() {
    final State[] states = getNumberedStates();
    int numTransitions = 0;
    for (State s : states) {
      numTransitions += s.numTransitions;
    }
    final int[] from = new int[states.length + 1];
    final int[] transitions = new int[numTransitions * 3];
    final boolean[] accept = new boolean[states.length];
    int upto = 0;
    for (State s : states) {
      from[s.number] = upto;
      accept[s.number] = s.accept;
      s.sortTransitions(Transition.COMPARE_BY_MIN_MAX_THEN_DEST);
      for (int i = 0; i < s.numTransitions; i++) {
        final Transition t = s.transitionsArray[i];
        transitions[upto++] = t.min;
        transitions[upto++] = t.max;
        transitions[upto++] = t.to.number;
      }
    }
    from[states.length] = upto;
    return new SlicedTransitions(from, transitions, states.length, accept);
  }

  /**
   * Expands singleton representation to normal representation. Does nothing if
   * not in singleton representation.
   */
  public void expandSingleton() {
    if (isSingleton()) {
      State p = new State();
      initial = p;
      for (int i = 0, cp = 0; i < singleton.length(); i += Character.charCount(cp)) {
        State q = new State();
        p.addTransition(new Transition(cp = singleton.codePointAt(i), q));
        p = q;
      }
      p.accept = true;
      deterministic = true;
      singleton = null;
      numberedStates = null;
    }
  }

  /**
   * Returns the number of states in this automaton.
   */
  public int getNumberOfStates() {
    if (isSingleton()) return singleton.codePointCount(0, singleton.length()) + 1;
    return getNumberedStates().length;
  }

  /**
   * Returns the number of transitions in this automaton. This number is counted
   * as the total number of edges, where one edge may be a character interval.
   */
  public int getNumberOfTransitions() {
    if (isSingleton()) return singleton.codePointCount(0, singleton.length());
    int c = 0;
    for (State s : getNumberedStates())
      c += s.numTransitions();
    return c;
  }

  /**
   * Returns a string representation of this automaton.
   */
  @Override
  public String toString() {
    StringBuilder b = new StringBuilder();
    if (isSingleton()) {
      b.append("singleton: ");
      for (int i = 0, cp = 0; i < singleton.length(); i += Character.charCount(cp)) {
        Transition.appendCharString(cp = singleton.codePointAt(i), b);
      }
      b.append("\n");
    } else {
      State[] states = getNumberedStates();
      b.append("initial state: ").append(initial.number).append("\n");
      for (State s : states)
        b.append(s.toString());
    }
    return b.toString();
  }

  /**
   * Returns <a href="http://www.research.att.com/sw/tools/graphviz/"
   * target="_top">Graphviz Dot</a> representation of this automaton.
   */
  public String toDot() {
    StringBuilder b = new StringBuilder("digraph Automaton {\n");
    b.append("  rankdir = LR;\n");
    State[] states = getNumberedStates();
    for (State s : states) {
      b.append("  ").append(s.number);
      if (s.accept) b.append(" [shape=doublecircle,label=\"\"];\n");
      else b.append(" [shape=circle,label=\"\"];\n");
      if (s == initial) {
        b.append("  initial [shape=plaintext,label=\"\"];\n");
        b.append("  initial -> ").append(s.number).append("\n");
      }
      for (Transition t : s.getTransitions()) {
        b.append("  ").append(s.number);
        t.appendDot(b);
      }
    }
    return b.append("}\n").toString();
  }

  /**
   * Returns a clone of this automaton, expands if singleton.
   */
  Automaton cloneExpanded() {
    Automaton a = clone();
    a.expandSingleton();
    return a;
  }

  /**
   * Returns this automaton, expanded, when {@code consume} is set, otherwise
   * an expanded clone.
   */
  Automaton cloneExpandedIfRequired(boolean consume) {
    if (consume) {
      expandSingleton();
      return this;
    } else {
      return cloneExpanded();
    }
  }

  /**
   * Returns a clone of this automaton.
   */
  @Override
  public Automaton clone() {
    try {
      Automaton a = (Automaton) super.clone();
      a.numberedStates = null;
      if (!isSingleton()) {
        final State[] states = getNumberedStates();
        final State[] clones = new State[states.length];
        for (int i = 0; i < states.length; i++) {
          clones[i] = new State();
        }
        for (State s : states) {
          State p = clones[s.number];
          p.accept = s.accept;
          for (int i = 0; i < s.numTransitions; i++) {
            final Transition t = s.transitionsArray[i];
            p.addTransition(new Transition(t.min, t.max, clones[t.to.number]));
          }
        }
        a.initial = clones[initial.number];
        for (int i = 0; i < clones.length; i++) {
          clones[i].number = i;
        }
        a.numberedStates = clones;
      }
      return a;
    } catch (CloneNotSupportedException e) {
      throw new RuntimeException(e);
    }
  }

  /**
   * Returns this automaton when {@code consume} is set, otherwise a clone.
   */
  Automaton cloneIfRequired(boolean consume) {
    if (consume) return this;
    else return clone();
  }

  /**
   * See {@link BasicOperations#concatenate(Automaton, Automaton)}.
   */
  public Automaton concatenate(Automaton a) {
    return BasicOperations.concatenate(this, a);
  }

  /**
   * See {@link BasicOperations#concatenate(List)}.
   */
  static public Automaton concatenate(List<Automaton> l) {
    return BasicOperations.concatenate(l);
  }

  /**
   * See {@link BasicOperations#optional(Automaton)}.
   */
  public Automaton optional() {
    return BasicOperations.optional(this);
  }

  /**
   * See {@link BasicOperations#repeat(Automaton)}.
   */
  public Automaton repeat() {
    return BasicOperations.repeat(this);
  }

  /**
   * See {@link BasicOperations#repeat(Automaton, int)}.
   */
  public Automaton repeat(int min) {
    return BasicOperations.repeat(this, min);
  }

  /**
   * See {@link BasicOperations#repeat(Automaton, int, int)}.
   */
  public Automaton repeat(int min, int max) {
    return BasicOperations.repeat(this, min, max);
  }

  /**
   * See {@link BasicOperations#complement(Automaton)}.
   */
  public Automaton complement() {
    return BasicOperations.complement(this);
  }

  /**
   * See {@link BasicOperations#minus(Automaton, Automaton)}.
   */
  public Automaton minus(Automaton a) {
    return BasicOperations.minus(this, a);
  }

  /**
   * See {@link BasicOperations#intersection(Automaton, Automaton)}.
   */
  public Automaton intersection(Automaton a) {
    return BasicOperations.intersection(this, a);
  }

  /**
   * See {@link BasicOperations#subsetOf(Automaton, Automaton)}.
   */
  public boolean subsetOf(Automaton a) {
    return BasicOperations.subsetOf(this, a);
  }

  /**
   * See {@link BasicOperations#union(Automaton, Automaton)}.
   */
  public Automaton union(Automaton a) {
    return BasicOperations.union(this, a);
  }

  /**
   * See {@link BasicOperations#union(Collection)}.
   */
  static public Automaton union(Collection<Automaton> l) {
    return BasicOperations.union(l);
  }

  /**
   * See {@link BasicOperations#determinize(Automaton)}.
   */
  public void determinize() {
    BasicOperations.determinize(this);
  }

  /**
   * See {@link BasicOperations#isEmptyString(Automaton)}.
   */
  public boolean isEmptyString() {
    return BasicOperations.isEmptyString(this);
  }

  /**
   * See {@link MinimizationOperations#minimize(Automaton)}. Returns the
   * automaton being given as argument.
   */
  public static Automaton minimize(Automaton a) {
    MinimizationOperations.minimize(a);
    return a;
  }
}
