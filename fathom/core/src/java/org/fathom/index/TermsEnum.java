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

import org.fathom.util.BytesRef;

/** Iterator to seek ({@link #seekCeil(BytesRef)}, {@link
 * #seekExact(BytesRef)}) or step through ({@link
 * #next} terms to obtain frequency information ({@link
 * #docFreq}), {@link PostingsEnum} for the current term ({@link
 * #postings}).
 *
 * <p>Term enumerations are always ordered by
 * {@link BytesRef#compareTo}, which is Unicode sort
 * order if the terms are UTF-8 bytes.  Each term in the
 * enumeration is greater than the one before it.</p>
 *
 * <p>The TermsEnum is unpositioned when you first obtain it
 * and you must first successfully call {@link #next} or one
 * of the <code>seek</code> methods.
 *
 * @fathom.experimental */
public abstract class TermsEnum {

  /** Sole constructor. (For invocation by subclass
   *  constructors, typically implicit.) */
  protected TermsEnum() {
  }

  /** Represents returned result from {@link #seekCeil}. */
  public enum SeekStatus {
    /** The term was not found, and the end of iteration was hit. */
    END,
    /** The precise term was found. */
    FOUND,
    /** A different term was found after the requested term */
    NOT_FOUND
  };

  /** Increments the iteration to the next {@link BytesRef} in the iterator.
   *  Returns the resulting {@link BytesRef} or <code>null</code> if the end of
   *  the iterator is reached. The returned BytesRef may be re-used across calls
   *  to next. After this method returns null, do not call it again: the results
   *  are undefined. The first call returns the first term.
   *
   *  @return the next BytesRef in the iterator or null if the end of the iterator is reached.
   *  @throws IOException If there is a low-level I/O error.
   */
  public abstract BytesRef next() throws IOException;

  /** Attempts to seek to the exact term, returning
   *  true if the term is found.  If this returns false, the
   *  position of the enum is undefined until the next seek. */
  public boolean seekExact(BytesRef text) throws IOException {
    return seekCeil(text) == SeekStatus.FOUND;
  }

  /** Seeks to the specified term, if it exists, or to the
   *  next (ceiling) term.  Returns SeekStatus to
   *  indicate whether exact term was found, a different
   *  term was found, or EOF was hit.  The target term may
   *  be before or after the current term.  If this returns
   *  SeekStatus.END, the enum is unpositioned and {@link #term()}
   *  returns null. */
  public abstract SeekStatus seekCeil(BytesRef text) throws IOException;

  /** Returns current term. Do not call this when the enum
   *  is unpositioned. */
  public abstract BytesRef term() throws IOException;

  /** Returns the statistics of the current term. Only enums reading a
   *  single segment return an info with a postings pointer. */
  public abstract TermInfo termInfo() throws IOException;

  /** Returns the number of documents containing the current
   *  term.  Do not call this when the enum is unpositioned. */
  public abstract int docFreq() throws IOException;

  /** Returns the sum of the current term's weights over all documents. */
  public abstract float totalWeight() throws IOException;

  /** Get {@link PostingsEnum} for the current term.  Do not
   *  call this when the enum is unpositioned.  This method
   *  will not return null. */
  public abstract PostingsEnum postings() throws IOException;

  /** An empty TermsEnum for quickly returning an empty instance e.g.
   * in {@link org.fathom.search.MultiTermQuery}. */
  public static final TermsEnum EMPTY = new TermsEnum() {
    @Override
    public SeekStatus seekCeil(BytesRef term) { return SeekStatus.END; }

    @Override
    public BytesRef term() {
      throw new IllegalStateException("this method should never be called");
    }

    @Override
    public TermInfo termInfo() {
      throw new IllegalStateException("this method should never be called");
    }

    @Override
    public int docFreq() {
      throw new IllegalStateException("this method should never be called");
    }

    @Override
    public float totalWeight() {
      throw new IllegalStateException("this method should never be called");
    }

    @Override
    public PostingsEnum postings() {
      throw new IllegalStateException("this method should never be called");
    }

    @Override
    public BytesRef next() {
      return null;
    }
  };
}
