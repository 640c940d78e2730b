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


/**
 * Controls how much information is stored in the postings lists.
 * Each option includes everything the previous one stores.
 */
public enum IndexOptions {
  /** Not indexed */
  NONE,
  /**
   * Only documents are indexed: weights and positions are omitted.
   * Phrase queries on the field match nothing, and scoring
   * behaves as if every term in the document had weight 1.
   */
  DOCS,
  /**
   * Documents and per-document term weights are indexed: positions are omitted.
   */
  DOCS_AND_FREQS,
  /**
   * Indexes documents, weights and positions.
   * This is a typical default for full-text search: full scoring is enabled
   * and positional queries are supported.
   */
  DOCS_AND_FREQS_AND_POSITIONS,
  /**
   * Indexes documents, weights, positions, and a per-posting value holding the
   * character offsets and token payloads of every occurrence.
   */
  DOCS_AND_FREQS_AND_POSITIONS_AND_PAYLOADS;

  /** True if postings carry a weight per document. */
  public boolean hasFreqs() {
    return compareTo(DOCS_AND_FREQS) >= 0;
  }

  /** True if postings carry positions. */
  public boolean hasPositions() {
    return compareTo(DOCS_AND_FREQS_AND_POSITIONS) >= 0;
  }

  /** True if postings carry a per-posting value. */
  public boolean hasPayloads() {
    return this == DOCS_AND_FREQS_AND_POSITIONS_AND_PAYLOADS;
  }
}
