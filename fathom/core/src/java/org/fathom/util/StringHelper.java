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
package org.fathom.util;


import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Methods for manipulating strings and the unique ids that tag segments
 * and commits.
 *
 * @fathom.internal
 */
public abstract class StringHelper {

  /** length in bytes of an ID */
  public static final int ID_LENGTH = 16;

  private static final SecureRandom ID_SOURCE = new SecureRandom();

  private StringHelper() {
  }

  /**
   * Compares two {@link BytesRef}, element by element, and returns the
   * number of elements common to both arrays (from the start of each).
   * This method assumes currentTerm comes after priorTerm.
   *
   * @param priorTerm The first {@link BytesRef} to compare
   * @param currentTerm The second {@link BytesRef} to compare
   * @return The number of common elements (from the start of each).
   */
  public static int bytesDifference(BytesRef priorTerm, BytesRef currentTerm) {
    int mismatch = Arrays.mismatch(priorTerm.bytes, priorTerm.offset, priorTerm.offset + priorTerm.length,
                                   currentTerm.bytes, currentTerm.offset, currentTerm.offset + currentTerm.length);
    if (mismatch < 0) {
      // identical or one is a prefix of the other
      return Math.min(priorTerm.length, currentTerm.length);
    }
    return mismatch;
  }

  /**
   * Returns <code>true</code> iff the ref starts with the given prefix.
   * Otherwise <code>false</code>.
   */
  public static boolean startsWith(BytesRef ref, BytesRef prefix) {
    if (ref.length < prefix.length) {
      return false;
    }
    return Arrays.equals(ref.bytes, ref.offset, ref.offset + prefix.length,
                         prefix.bytes, prefix.offset, prefix.offset + prefix.length);
  }

  /** Generates a non-cryptographic globally unique id. */
  public static byte[] randomId() {
    byte[] id = new byte[ID_LENGTH];
    synchronized (ID_SOURCE) {
      ID_SOURCE.nextBytes(id);
    }
    return id;
  }

  /**
   * Helper method to render an ID as a string, for debugging
   * <p>
   * Returns the string {@code (null)} if the id is null.
   * Otherwise, returns a string representation for debugging.
   * Never throws an exception. The returned string may
   * indicate if the id is definitely invalid.
   */
  public static String idToString(byte id[]) {
    if (id == null) {
      return "(null)";
    } else {
      StringBuilder sb = new StringBuilder();
      sb.append(new BigInteger(1, id).toString(Character.MAX_RADIX));
      if (id.length != ID_LENGTH) {
        sb.append(" (INVALID FORMAT)");
      }
      return sb.toString();
    }
  }
}
