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

import org.termscan.util.InfoStream;

/**
 * Holds the settings used when building automata from regular expressions
 * and when compiling automata for term matching.
 * <p>
 * All setter methods return this instance so that calls can be chained:
 * <pre class="prettyprint">
 * AutomatonConfig config = new AutomatonConfig()
 *     .setMinimize(false)
 *     .setInfoStream(new PrintStreamInfoStream(System.out));
 * </pre>
 * <p>
 * A config may be shared by several builders, but must not be changed while
 * one of them is running.
 */
public final class AutomatonConfig implements Cloneable {

  /** Default value for {@link #getMinimize()}. */
  public static final boolean DEFAULT_MINIMIZE = true;

  /** Default value for {@link #getAllowMutate()}. */
  public static final boolean DEFAULT_ALLOW_MUTATE = false;

  private boolean minimize = DEFAULT_MINIMIZE;
  private boolean allowMutate = DEFAULT_ALLOW_MUTATE;
  private InfoStream infoStream;

  /**
   * Creates a new config with defaults, logging to
   * {@link InfoStream#getDefault()}.
   */
  public AutomatonConfig() {
    infoStream = InfoStream.getDefault();
  }

  /**
   * If true (the default), {@link RegExp} minimizes the automaton produced
   * by every composite operation (union, concatenation, repetition,
   * complement, intersection). Without it the result accepts the same
   * language but may have many more states.
   */
  public AutomatonConfig setMinimize(boolean minimize) {
    this.minimize = minimize;
    return this;
  }

  /** @see #setMinimize(boolean) */
  public boolean getMinimize() {
    return minimize;
  }

  /**
   * If true, {@link RegExp} lets the automaton operations reuse the
   * intermediate automata it builds instead of copying them. Named
   * automata supplied by the caller are always copied. Default is false.
   */
  public AutomatonConfig setAllowMutate(boolean allowMutate) {
    this.allowMutate = allowMutate;
    return this;
  }

  /** @see #setAllowMutate(boolean) */
  public boolean getAllowMutate() {
    return allowMutate;
  }

  /**
   * Information about regular expression compilation and about the
   * matching strategy chosen by {@link CompiledAutomaton} is written to
   * this stream. Use {@link InfoStream#NO_OUTPUT} to disable it.
   */
  public AutomatonConfig setInfoStream(InfoStream infoStream) {
    if (infoStream == null) {
      throw new IllegalArgumentException("Cannot set InfoStream implementation to null. "+
        "To disable logging use InfoStream.NO_OUTPUT");
    }
    this.infoStream = infoStream;
    return this;
  }

  /** @see #setInfoStream(InfoStream) */
  public InfoStream getInfoStream() {
    return infoStream;
  }

  @Override
  public AutomatonConfig clone() {
    try {
      return (AutomatonConfig) super.clone();
    } catch (CloneNotSupportedException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("minimize=").append(getMinimize()).append("\n");
    sb.append("allowMutate=").append(getAllowMutate()).append("\n");
    sb.append("infoStream=").append(getInfoStream().getClass().getName()).append("\n");
    return sb.toString();
  }
}
