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
package org.fathom.codecs;


import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import org.fathom.util.SmallFloat;

/**
 * Per-document field lengths of one segment, one byte per document and
 * field. A length is the number of tokens indexed for the field in the
 * document, quantized with {@link SmallFloat#intToByte4(int)}: small
 * lengths are exact, larger ones lose precision.
 */
public final class FieldLengths {

  /** Instance without any field. */
  public static final FieldLengths EMPTY = new FieldLengths(0, Collections.emptyMap(), Collections.emptyMap());

  private final int maxDoc;
  private final Map<Integer,byte[]> byField;
  private final Map<Integer,Long> totals;

  /**
   * Wraps the encoded lengths; every array must have {@code maxDoc} entries.
   * {@code totals} holds the exact sum of the unquantized lengths of each field.
   */
  public FieldLengths(int maxDoc, Map<Integer,byte[]> byField, Map<Integer,Long> totals) {
    for (Map.Entry<Integer,byte[]> entry : byField.entrySet()) {
      if (entry.getValue().length != maxDoc) {
        throw new IllegalArgumentException("lengths of field number " + entry.getKey() + " cover "
            + entry.getValue().length + " docs, expected " + maxDoc);
      }
      if (totals.containsKey(entry.getKey()) == false) {
        throw new IllegalArgumentException("no total length for field number " + entry.getKey());
      }
    }
    this.maxDoc = maxDoc;
    this.byField = Collections.unmodifiableMap(new TreeMap<>(byField));
    this.totals = Collections.unmodifiableMap(new TreeMap<>(totals));
  }

  /** Encodes a length into its one-byte form. */
  public static byte encode(int length) {
    return SmallFloat.intToByte4(length);
  }

  /** Decodes a length encoded with {@link #encode(int)}. */
  public static int decode(byte encoded) {
    return SmallFloat.byte4ToInt(encoded);
  }

  /** Number of documents covered. */
  public int maxDoc() {
    return maxDoc;
  }

  /** Number of fields with recorded lengths. */
  public int size() {
    return byField.size();
  }

  /** True if lengths were recorded for the field. */
  public boolean hasField(int fieldNumber) {
    return byField.containsKey(fieldNumber);
  }

  /** Numbers of the fields with recorded lengths, ascending. */
  public Iterable<Integer> fieldNumbers() {
    return byField.keySet();
  }

  /** Returns the decoded length of the field in {@code docID}, 0 when the field has no lengths. */
  public int get(int fieldNumber, int docID) {
    final byte[] lengths = byField.get(fieldNumber);
    if (lengths == null) {
      return 0;
    }
    return decode(lengths[docID]);
  }

  /** Returns the exact sum of the field's lengths over all documents, deleted ones included. */
  public long total(int fieldNumber) {
    final Long total = totals.get(fieldNumber);
    return total == null ? 0L : total;
  }

  /** Returns the encoded lengths of a field, or null. Callers must not modify the array. */
  byte[] encoded(int fieldNumber) {
    return byField.get(fieldNumber);
  }
}
