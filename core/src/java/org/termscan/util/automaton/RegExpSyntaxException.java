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

/**
 * Thrown by {@link RegExp} when a regular expression cannot be parsed.
 * <p>
 * The message reads {@code "<problem> at position <n>"}. Expressions that use
 * an optional construct which is disabled by the syntax flags report
 * {@link #isIllegalSyntax()} as true; all other parse failures report false.
 *
 * @lucene.experimental
 */
public class RegExpSyntaxException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  private final String regExp;
  private final int position;
  private final boolean illegalSyntax;

  public RegExpSyntaxException(String problem, String regExp, int position) {
    this(problem, regExp, position, false);
  }

  public RegExpSyntaxException(String problem, String regExp, int position, boolean illegalSyntax) {
    super(problem + " at position " + position);
    this.regExp = regExp;
    this.position = position;
    this.illegalSyntax = illegalSyntax;
  }

  /** The expression that failed to parse. */
  public String getRegExp() {
    return regExp;
  }

  /** Offset (in chars) into the expression where the problem was found. */
  public int getPosition() {
    return position;
  }

  /** True if the expression used syntax disabled by the syntax flags. */
  public boolean isIllegalSyntax() {
    return illegalSyntax;
  }
}
