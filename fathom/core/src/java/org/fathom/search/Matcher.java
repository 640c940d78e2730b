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
package org.fathom.search;


import java.io.IOException;

/**
 * Iterates over the documents of one leaf that match a query, in increasing
 * doc id order, and scores them.
 * <p>
 * A matcher starts unpositioned. {@link #advance(int)} never returns a
 * document smaller than its target, and {@link #score()} may only be called
 * while the matcher is {@link #isActive() active}: an unpositioned or
 * exhausted matcher throws {@link IllegalStateException}.
 */
public abstract class Matcher extends DocIdSetIterator {

  /** The weight that created this matcher. */
  protected final Weight weight;

  /**
   * Constructs a Matcher
   * @param weight The matcher's weight.
   */
  protected Matcher(Weight weight) {
    this.weight = weight;
  }

  /** returns parent Weight
   */
  public Weight getWeight() {
    return weight;
  }

  /**
   * Returns the score of the current document.
   * @throws IllegalStateException if the matcher is not on a document
   */
  public abstract float score() throws IOException;
}
