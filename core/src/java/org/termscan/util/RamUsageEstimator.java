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

/**
 * Sizes of primitive types and object references, used to pick growth
 * sizes for arrays that are about to be reallocated.
 *
 * @lucene.internal
 */
public final class RamUsageEstimator {

  private RamUsageEstimator() {}

  public final static int NUM_BYTES_BYTE = 1;
  public final static int NUM_BYTES_INT = 4;

  /**
   * Number of bytes this jvm uses to represent an object reference.
   */
  public final static int NUM_BYTES_OBJECT_REF;

  static {
    final String model = System.getProperty("sun.arch.data.model");
    if ("32".equals(model)) {
      NUM_BYTES_OBJECT_REF = 4;
    } else {
      NUM_BYTES_OBJECT_REF = 8;
    }
  }
}
