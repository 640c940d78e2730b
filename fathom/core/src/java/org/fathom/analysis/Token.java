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


import org.fathom.util.BytesRef;
import org.fathom.util.BytesRefBuilder;

/**
  A Token is an occurrence of a term from the text of a field.  It consists of
  the term's bytes, its absolute position in the field, the start and end
  offset of the term in the text of the field, a boost and an optional payload.
  <p>
  The start and end offsets permit applications to re-associate a token with
  its source text. The boost is added to the term's weight in the document
  for every occurrence, so a term's weight is its frequency when every boost
  is 1.
  <p>
  Token streams re-use a single Token instance, changing its content
  in-place as the stream advances.
*/
public class Token {

  private final BytesRefBuilder term = new BytesRefBuilder();
  private int position;
  private int startOffset;
  private int endOffset;
  private float boost = 1f;
  private BytesRef payload;

  /** Constructs a Token with empty text. */
  public Token() {
  }

  /** Constructs a Token with the given term text, position and offsets. */
  public Token(CharSequence text, int position, int startOffset, int endOffset) {
    this(new BytesRef(text), position, startOffset, endOffset);
  }

  /** Constructs a Token with the given term bytes, position and offsets. */
  public Token(BytesRef term, int position, int startOffset, int endOffset) {
    setTerm(term);
    setPosition(position);
    setOffset(startOffset, endOffset);
  }

  /** Returns the term bytes. The returned instance is only valid until the token changes. */
  public BytesRef term() {
    return term.get();
  }

  /** Copies {@code term} into this token. */
  public Token setTerm(BytesRef term) {
    this.term.copyBytes(term);
    return this;
  }

  /** Returns the absolute position of this token in the field. */
  public int position() {
    return position;
  }

  /** Sets the absolute position of this token. */
  public Token setPosition(int position) {
    if (position < 0) {
      throw new IllegalArgumentException("position must be >= 0, got " + position);
    }
    this.position = position;
    return this;
  }

  /** Returns this Token's starting offset, the position of the first character
    corresponding to this token in the source text. */
  public int startOffset() {
    return startOffset;
  }

  /** Returns this Token's ending offset, one greater than the position of the
    last character corresponding to this token in the source text. */
  public int endOffset() {
    return endOffset;
  }

  /** Set the starting and ending offset. */
  public Token setOffset(int startOffset, int endOffset) {
    if (startOffset < 0 || endOffset < startOffset) {
      throw new IllegalArgumentException("startOffset must be non-negative, and endOffset must be >= startOffset, "
          + "startOffset=" + startOffset + ",endOffset=" + endOffset);
    }
    this.startOffset = startOffset;
    this.endOffset = endOffset;
    return this;
  }

  /** Returns the boost of this occurrence. */
  public float boost() {
    return boost;
  }

  /** Sets the boost of this occurrence; must be finite and positive. */
  public Token setBoost(float boost) {
    if (Float.isFinite(boost) == false || boost <= 0) {
      throw new IllegalArgumentException("boost must be finite and > 0, got " + boost);
    }
    this.boost = boost;
    return this;
  }

  /** Returns this Token's payload, possibly null. */
  public BytesRef payload() {
    return payload;
  }

  /** Sets this Token's payload. */
  public Token setPayload(BytesRef payload) {
    this.payload = payload;
    return this;
  }

  /** Resets the term text, payload, boost and offsets. */
  public void clear() {
    term.clear();
    position = 0;
    startOffset = endOffset = 0;
    boost = 1f;
    payload = null;
  }

  /** Copies the content of {@code other} into this token. */
  public void copyFrom(Token other) {
    term.copyBytes(other.term());
    position = other.position;
    startOffset = other.startOffset;
    endOffset = other.endOffset;
    boost = other.boost;
    payload = other.payload == null ? null : BytesRef.deepCopyOf(other.payload);
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder();
    sb.append('(').append(term().utf8ToString()).append(',').append(position)
        .append(',').append(startOffset).append(',').append(endOffset);
    if (boost != 1f) {
      sb.append(",boost=").append(boost);
    }
    if (payload != null) {
      sb.append(",payload=").append(payload);
    }
    sb.append(')');
    return sb.toString();
  }
}
