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
 * Context of a {@link LeafReader} inside its top-level reader.
 */
public final class LeafReaderContext {
  /** The reader's ord in the top-level's leaves array */
  public final int ord;
  /** The reader's absolute doc base */
  public final int docBase;

  private final LeafReader reader;

  LeafReaderContext(LeafReader reader, int ord, int docBase) {
    this.ord = ord;
    this.docBase = docBase;
    this.reader = reader;
  }

  /** Context of a reader used as its own top-level reader. */
  LeafReaderContext(LeafReader leafReader) {
    this(leafReader, 0, 0);
  }

  /** Returns the leaf reader of this context. */
  public LeafReader reader() {
    return reader;
  }

  @Override
  public String toString() {
    return "LeafReaderContext(" + reader + " docBase=" + docBase + " ord=" + ord + ")";
  }
}
