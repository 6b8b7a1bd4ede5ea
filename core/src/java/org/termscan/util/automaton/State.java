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

import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

import org.termscan.util.ArrayUtil;
import org.termscan.util.RamUsageEstimator;

/**
 * <tt>Automaton</tt> state. Outside this package a state's transitions and
 * acceptance are changed through {@link Automaton#addTransition} and
 * {@link Automaton#setAccept}, which keep the automaton's state numbering
 * current.
 *
 * @lucene.experimental
 */
public class State implements Comparable<State> {

  private static final AtomicInteger NEXT_ID = new AtomicInteger();

  boolean accept;
  Transition[] transitionsArray;
  int numTransitions;

  int number;

  final int id;

  /**
   * Constructs a new state. Initially, the new state is a reject state.
   */
  public State() {
    resetTransitions();
    id = NEXT_ID.getAndIncrement();
  }

  /**
   * Resets transition set.
   */
  final void resetTransitions() {
    transitionsArray = new Transition[0];
    numTransitions = 0;
  }

  private class TransitionsIterable implements Iterable<Transition> {
    @Override
    public Iterator<Transition> iterator() {
      return new Iterator<Transition>() {
        int upto;

        @Override
        public boolean hasNext() {
          return upto < numTransitions;
        }

        @Override
        public Transition next() {
          if (!hasNext()) {
            throw new NoSuchElementException();
          }
          return transitionsArray[upto++];
        }

        @Override
        public void remove() {
          throw new UnsupportedOperationException();
        }
      };
    }
  }

  /**
   * Returns the set of outgoing transitions. Subsequent changes are reflected
   * in the automaton.
   *
   * @return transition set
   */
  public Iterable<Transition> getTransitions() {
    return new TransitionsIterable();
  }

  public int numTransitions() {
    return numTransitions;
  }

  void setTransitions(Transition[] transitions) {
    this.numTransitions = transitions.length;
    this.transitionsArray = transitions;
  }

  /**
   * Adds an outgoing transition.
   *
   * @param t transition
   */
  void addTransition(Transition t) {
    if (numTransitions == transitionsArray.length) {
      final Transition[] newArray = new Transition[ArrayUtil.oversize(1+numTransitions, RamUsageEstimator.NUM_BYTES_OBJECT_REF)];
      System.arraycopy(transitionsArray, 0, newArray, 0, numTransitions);
      transitionsArray = newArray;
    }
    transitionsArray[numTransitions++] = t;
  }

  /**
   * Sets acceptance for this state.
   *
   * @param accept if true, this state is an accept state
   */
  void setAccept(boolean accept) {
    this.accept = accept;
  }

  /**
   * Returns acceptance status.
   *
   * @return true is this is an accept state
   */
  public boolean isAccept() {
    return accept;
  }

  /**
   * Performs lookup in transitions, assuming determinism.
   *
   * @param c codepoint to look up
   * @return destination state, null if no matching outgoing transition
   * @see #step(int, Collection)
   */
  public State step(int c) {
    assert c >= 0;
    for (int i=0;i<numTransitions;i++) {
      final Transition t = transitionsArray[i];
      if (t.min <= c && c <= t.max) return t.to;
    }
    return null;
  }

  /**
   * Performs lookup in transitions, allowing nondeterminism.
   *
   * @param c codepoint to look up
   * @param dest collection where destination states are stored
   * @see #step(int)
   */
  public void step(int c, Collection<State> dest) {
    for (int i=0;i<numTransitions;i++) {
      final Transition t = transitionsArray[i];
      if (t.min <= c && c <= t.max) dest.add(t.to);
    }
  }

  /** Virtually adds an epsilon transition to the target
   *  {@code to} state.  This is implemented by copying all
   *  transitions from {@code to} to this state, and if {@code
   *  to} is an accept state then set accept for this state. */
  void addEpsilon(State to) {
    if (to.accept) accept = true;
    // snapshot the count: to may be this state
    final int limit = to.numTransitions;
    final Transition[] transitions = to.transitionsArray;
    for (int i=0;i<limit;i++) {
      addTransition(transitions[i]);
    }
  }

  /** Downsizes transitionArray to numTransitions */
  void trimTransitionsArray() {
    if (numTransitions < transitionsArray.length) {
      Transition[] newArray = new Transition[numTransitions];
      System.arraycopy(transitionsArray, 0, newArray, 0, numTransitions);
      transitionsArray = newArray;
    }
  }

  /**
   * Reduces this state. A state is "reduced" by combining overlapping
   * and adjacent edge intervals with same destination. Afterwards the
   * transitions are sorted by interval.
   */
  void reduce() {
    if (numTransitions <= 1) {
      return;
    }
    sortTransitions(Transition.COMPARE_BY_DEST_THEN_MIN_MAX);
    State p = null;
    int min = -1, max = -1;
    int upto = 0;
    for (int i=0;i<numTransitions;i++) {
      final Transition t = transitionsArray[i];
      if (p == t.to) {
        if (t.min <= max + 1) {
          if (t.max > max) max = t.max;
        } else {
          if (p != null) {
            transitionsArray[upto++] = new Transition(min, max, p);
          }
          min = t.min;
          max = t.max;
        }
      } else {
        if (p != null) {
          transitionsArray[upto++] = new Transition(min, max, p);
        }
        p = t.to;
        min = t.min;
        max = t.max;
      }
    }

    if (p != null) {
      transitionsArray[upto++] = new Transition(min, max, p);
    }
    numTransitions = upto;
    sortTransitions(Transition.COMPARE_BY_MIN_MAX_THEN_DEST);
  }

  /**
   * Returns sorted list of outgoing transitions.
   *
   * @param comparator comparator to sort with
   */
  void sortTransitions(Comparator<Transition> comparator) {
    if (numTransitions > 1) {
      Arrays.sort(transitionsArray, 0, numTransitions, comparator);
    }
  }

  /**
   * Return this state's number.
   * <p>
   * Expert: Will be useless unless {@link Automaton#getNumberedStates}
   * has been called first to number the states.
   * @return the number
   */
  public int getNumber() {
    return number;
  }

  /**
   * Returns string describing this state. Normally invoked via
   * {@link Automaton#toString()}.
   */
  @Override
  public String toString() {
    StringBuilder b = new StringBuilder();
    b.append("state ").append(number);
    if (accept) b.append(" [accept]");
    else b.append(" [reject]");
    b.append(":\n");
    for (Transition t : getTransitions())
      b.append("  ").append(t.toString()).append("\n");
    return b.toString();
  }

  /**
   * Compares this object with the specified object for order. States are
   * ordered by the time of construction.
   */
  @Override
  public int compareTo(State s) {
    return s.id - id;
  }

  @Override
  public int hashCode() {
    return id;
  }
}
