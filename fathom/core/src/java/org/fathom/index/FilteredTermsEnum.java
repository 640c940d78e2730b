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

/**
 * A forward-only view of the terms of another {@link TermsEnum} that
 * {@link #accept(BytesRef) accepts}, starting at a given term. Seeking
 * is not supported.
 */
public abstract class FilteredTermsEnum extends TermsEnum {

  /** What to do with a term of the underlying enum. */
  protected enum AcceptStatus {
    /** Return the term. */
    YES,
    /** Skip the term. */
    NO,
    /** Skip the term and every term after it. */
    END
  }

  /** The filtered enum. */
  protected final TermsEnum tenum;
  private BytesRef startTerm;
  private boolean done;

  /**
   * Filters {@code tenum} from {@code startTerm} on; a null start term
   * starts at the first term.
   */
  protected FilteredTermsEnum(TermsEnum tenum, BytesRef startTerm) {
    assert tenum != null;
    this.tenum = tenum;
    this.startTerm = startTerm == null ? new BytesRef() : startTerm;
  }

  /** Decides whether {@code term} is part of this enum. */
  protected abstract AcceptStatus accept(BytesRef term) throws IOException;

  @Override
  public BytesRef next() throws IOException {
    while (done == false) {
      BytesRef term;
      if (startTerm != null) {
        term = tenum.seekCeil(startTerm) == SeekStatus.END ? null : tenum.term();
        startTerm = null;
      } else {
        term = tenum.next();
      }
      if (term == null) {
        break;
      }
      AcceptStatus status = accept(term);
      if (status == AcceptStatus.YES) {
        return term;
      } else if (status == AcceptStatus.END) {
        break;
      }
    }
    done = true;
    return null;
  }

  @Override
  public BytesRef term() throws IOException {
    return tenum.term();
  }

  @Override
  public TermInfo termInfo() throws IOException {
    return tenum.termInfo();
  }

  @Override
  public int docFreq() throws IOException {
    return tenum.docFreq();
  }

  @Override
  public float totalWeight() throws IOException {
    return tenum.totalWeight();
  }

  @Override
  public PostingsEnum postings() throws IOException {
    return tenum.postings();
  }

  /** @throws UnsupportedOperationException always */
  @Override
  public boolean seekExact(BytesRef term) {
    throw new UnsupportedOperationException(getClass().getSimpleName() + " cannot seek");
  }

  /** @throws UnsupportedOperationException always */
  @Override
  public SeekStatus seekCeil(BytesRef term) {
    throw new UnsupportedOperationException(getClass().getSimpleName() + " cannot seek");
  }
}
