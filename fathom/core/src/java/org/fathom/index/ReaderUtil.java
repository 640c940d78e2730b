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
package org.fathom.index;


import java.util.List;

/**
 * Helpers for locating documents among the leaves of a reader.
 *
 * @fathom.internal
 */
public final class ReaderUtil {

  private ReaderUtil() {}

  /**
   * Returns the position in {@code leaves} of the leaf holding the
   * reader-wide document {@code docID}: the last leaf whose doc base is not
   * above it, which skips empty leaves sharing a doc base.
   */
  public static int subIndex(int docID, List<LeafReaderContext> leaves) {
    int lo = 0;
    int hi = leaves.size();
    // invariant: leaves before lo start at or below docID, leaves from hi on start above it
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (leaves.get(mid).docBase <= docID) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo - 1;
  }
}
