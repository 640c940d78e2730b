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
package org.fathom.analysis;


import java.util.Locale;

import org.fathom.util.BytesRef;

/**
 * Tokenizes text on whitespace, lower-casing every token. Positions
 * count tokens from 0; offsets are the character offsets in the text.
 */
public final class MockTokenStream extends TokenStream {

  private final String text;
  private int upto;
  private int position;

  public MockTokenStream(String text) {
    this.text = text;
  }

  @Override
  public boolean incrementToken() {
    token.clear();
    while (upto < text.length() && Character.isWhitespace(text.charAt(upto))) {
      upto++;
    }
    if (upto == text.length()) {
      return false;
    }
    final int start = upto;
    while (upto < text.length() && Character.isWhitespace(text.charAt(upto)) == false) {
      upto++;
    }
    token.setTerm(new BytesRef(text.substring(start, upto).toLowerCase(Locale.ROOT)));
    token.setPosition(position++);
    token.setOffset(start, upto);
    return true;
  }

  @Override
  public void reset() {
    upto = 0;
    position = 0;
  }
}
