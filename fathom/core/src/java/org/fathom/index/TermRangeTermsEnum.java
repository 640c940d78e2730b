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


import org.fathom.util.BytesRef;

/**
 * The terms between two bounds, each inclusive or exclusive. A null bound
 * leaves that side of the range open.
 */
public class TermRangeTermsEnum extends FilteredTermsEnum {

  private final BytesRef lower;
  private final BytesRef upper;
  private final boolean includeLower;
  private final boolean includeUpper;

  public TermRangeTermsEnum(TermsEnum tenum, BytesRef lowerTerm, BytesRef upperTerm,
                            boolean includeLower, boolean includeUpper) {
    super(tenum, lowerTerm);
    this.lower = lowerTerm;
    this.upper = upperTerm;
    this.includeLower = includeLower;
    this.includeUpper = includeUpper;
  }

  @Override
  protected AcceptStatus accept(BytesRef term) {
    if (lower != null && includeLower == false && term.equals(lower)) {
      return AcceptStatus.NO;
    }
    if (upper != null) {
      int cmp = term.compareTo(upper);
      if (cmp > 0 || (cmp == 0 && includeUpper == false)) {
        return AcceptStatus.END;
      }
    }
    return AcceptStatus.YES;
  }
}
