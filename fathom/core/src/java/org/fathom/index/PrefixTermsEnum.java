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
import org.fathom.util.StringHelper;

/** The terms starting with a prefix. */
public class PrefixTermsEnum extends FilteredTermsEnum {

  private final BytesRef prefix;

  public PrefixTermsEnum(TermsEnum tenum, BytesRef prefix) {
    super(tenum, prefix);
    this.prefix = prefix;
  }

  @Override
  protected AcceptStatus accept(BytesRef term) {
    // terms sharing the prefix are contiguous
    return StringHelper.startsWith(term, prefix) ? AcceptStatus.YES : AcceptStatus.END;
  }
}
