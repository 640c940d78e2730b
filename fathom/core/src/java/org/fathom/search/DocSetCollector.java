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


import org.fathom.index.LeafReaderContext;
import org.fathom.util.FixedBitSet;

/**
 * Records every matching document, by top-level doc id, in a
 * {@link FixedBitSet}.
 */
public class DocSetCollector extends SimpleCollector {
  private final FixedBitSet docs;
  private int docBase;

  /** @param maxDoc the {@link org.fathom.index.IndexReader#maxDoc()} of the searched reader */
  public DocSetCollector(int maxDoc) {
    this.docs = new FixedBitSet(maxDoc);
  }

  @Override
  protected void doSetNextReader(LeafReaderContext context) {
    docBase = context.docBase;
  }

  @Override
  public void collect(int doc) {
    docs.set(docBase + doc);
  }

  /** The matching documents. */
  public FixedBitSet getDocs() {
    return docs;
  }

  @Override
  public boolean needsScores() {
    return false;
  }
}
