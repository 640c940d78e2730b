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
 * Per-segment statistics and postings pointer of one term.
 *
 * <p>A term with exactly one posting and no positions keeps that posting
 * inline ({@link #singletonDocID()}), and no postings list is written for it.
 * Every term in a dictionary has {@code docFreq >= 1}.
 */
public final class TermInfo {

  /** Marker for {@link #postingsFP()} when the posting is kept inline. */
  public static final long NO_POSTINGS = -1L;

  private final int docFreq;
  private final float totalWeight;
  private final int minLength;
  private final int maxLength;
  private final float minWeight;
  private final float maxWeight;
  private final long postingsFP;
  private final long postingsLength;
  private final int singletonDocID;

  /** Creates a term info whose postings list lives at {@code postingsFP}. */
  public TermInfo(int docFreq, float totalWeight, int minLength, int maxLength, float minWeight, float maxWeight,
                  long postingsFP, long postingsLength) {
    this(docFreq, totalWeight, minLength, maxLength, minWeight, maxWeight, postingsFP, postingsLength, -1);
  }

  private TermInfo(int docFreq, float totalWeight, int minLength, int maxLength, float minWeight, float maxWeight,
                   long postingsFP, long postingsLength, int singletonDocID) {
    if (docFreq < 1) {
      throw new IllegalArgumentException("docFreq must be >= 1, got " + docFreq);
    }
    this.docFreq = docFreq;
    this.totalWeight = totalWeight;
    this.minLength = minLength;
    this.maxLength = maxLength;
    this.minWeight = minWeight;
    this.maxWeight = maxWeight;
    this.postingsFP = postingsFP;
    this.postingsLength = postingsLength;
    this.singletonDocID = singletonDocID;
  }

  /** Creates a term info for a term occurring in one document only, with the posting inline. */
  public static TermInfo singleton(int docID, float weight, int length) {
    return new TermInfo(1, weight, length, length, weight, weight, NO_POSTINGS, 0, docID);
  }

  /** Number of documents containing the term. */
  public int docFreq() {
    return docFreq;
  }

  /** Sum of the term's weights over all documents. */
  public float totalWeight() {
    return totalWeight;
  }

  /** Smallest field length among the documents containing the term. */
  public int minLength() {
    return minLength;
  }

  /** Largest field length among the documents containing the term. */
  public int maxLength() {
    return maxLength;
  }

  /** Smallest per-document weight of the term. */
  public float minWeight() {
    return minWeight;
  }

  /** Largest per-document weight of the term. */
  public float maxWeight() {
    return maxWeight;
  }

  /** File pointer of the postings list, or {@link #NO_POSTINGS}. */
  public long postingsFP() {
    return postingsFP;
  }

  /** Byte length of the postings list. */
  public long postingsLength() {
    return postingsLength;
  }

  /** True if the only posting is kept inline. */
  public boolean isSingleton() {
    return singletonDocID >= 0;
  }

  /** Document of the inline posting, or -1. */
  public int singletonDocID() {
    return singletonDocID;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("TermInfo(docFreq=").append(docFreq)
        .append(",totalWeight=").append(totalWeight)
        .append(",length=").append(minLength).append("..").append(maxLength)
        .append(",weight=").append(minWeight).append("..").append(maxWeight);
    if (isSingleton()) {
      sb.append(",singletonDocID=").append(singletonDocID);
    } else {
      sb.append(",postingsFP=").append(postingsFP).append(",postingsLength=").append(postingsLength);
    }
    return sb.append(')').toString();
  }
}
