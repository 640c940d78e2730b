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


import java.io.IOException;
import java.util.Collections;
import java.util.List;

import org.fathom.util.Bits;

/** {@code LeafReader} is an abstract class, providing an interface for accessing an
 index.  Search of an index is done entirely through this abstract interface,
 so that any subclass which implements it is searchable. IndexReaders implemented
 by this subclass do not consist of several sub-readers,
 they are atomic. They support retrieval of stored fields, columns, lengths,
 terms, and postings.

 <p>For efficiency, in this API documents are often referred to via
 <i>document numbers</i>, non-negative integers which each name a unique
 document in the index.  These document numbers are ephemeral -- they may change
 as documents are added to and deleted from an index.  Clients should thus not
 rely on a given document having the same number between sessions.

 <p><a id="thread-safety"></a><p><b>NOTE</b>: {@link
 IndexReader} instances are completely thread
 safe, meaning multiple threads can call any of its methods,
 concurrently.
*/
public abstract class LeafReader extends IndexReader {

  private final LeafReaderContext readerContext = new LeafReaderContext(this);
  private final List<LeafReaderContext> leaves = Collections.singletonList(readerContext);

  /** Sole constructor. (For invocation by subclass
   *  constructors, typically implicit.) */
  protected LeafReader() {
    super();
  }

  /** Returns the context of this reader used as a top-level reader. */
  public final LeafReaderContext getContext() {
    ensureOpen();
    return readerContext;
  }

  @Override
  public final List<LeafReaderContext> leaves() {
    ensureOpen();
    return leaves;
  }

  /** Returns the {@link Bits} representing live (not
   *  deleted) docs.  A set bit indicates the doc ID has not
   *  been deleted.  If this method returns null it means
   *  there are no deleted documents (all documents are
   *  live).
   *
   *  The returned instance has been safely published for
   *  use by multiple threads without additional
   *  synchronization.
   */
  public abstract Bits getLiveDocs();

  /** Returns {@link NumericColumn} for this field, or
   *  null if the field is not a numeric column or no document of
   *  this segment has a value for it. */
  public abstract NumericColumn getNumericColumn(String field) throws IOException;

  /** Returns {@link BinaryColumn} for this field, or
   *  null if the field is not a binary column or no document of
   *  this segment has a value for it. */
  public abstract BinaryColumn getBinaryColumn(String field) throws IOException;

  /** Returns the exact sum of the lengths of {@code field} over all
   *  documents of this reader, deleted documents included. */
  public abstract long totalFieldLength(String field) throws IOException;

  /** Returns the quantized length of {@code field} in {@code docID}, 0 when
   *  the document has no tokens in the field or the field keeps no lengths. */
  public abstract int documentFieldLength(int docID, String field) throws IOException;

  /**
   * Checks consistency of this reader.
   * <p>
   * Note that this may be costly in terms of I/O, e.g.
   * may involve computing a checksum value against large data files.
   * @fathom.internal
   */
  public abstract void checkIntegrity() throws IOException;
}
