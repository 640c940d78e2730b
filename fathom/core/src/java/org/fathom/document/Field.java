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
package org.fathom.document;


import java.util.Objects;

import org.fathom.analysis.CannedTokenStream;
import org.fathom.analysis.Token;
import org.fathom.analysis.TokenStream;
import org.fathom.util.BytesRef;
import org.fathom.util.NumericUtils;

/**
 * A field is a section of a Document. A field carries up to three values:
 * the tokens to index, the value to store and the value to keep in the
 * field's column. The {@link FieldType} registered for the field's name
 * decides which of them are used: an indexed field must carry tokens, other
 * values are ignored when the type does not use them.
 * <p>
 * The token stream is consumed when the document is added, so a field that
 * carries tokens can be added only once.
 */
public final class Field {

  private final String name;
  private final TokenStream tokenStream;
  private final Object storedValue;
  private final Object columnValue;

  private Field(String name, TokenStream tokenStream, Object storedValue, Object columnValue) {
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.tokenStream = tokenStream;
    this.storedValue = checkStoredValue(name, storedValue);
    this.columnValue = columnValue;
  }

  private static Object checkStoredValue(String name, Object value) {
    if (value == null || value instanceof String || value instanceof BytesRef || value instanceof Integer
        || value instanceof Long || value instanceof Float || value instanceof Double) {
      return value;
    }
    if (value instanceof byte[]) {
      return new BytesRef((byte[]) value);
    }
    throw new IllegalArgumentException("cannot store value of type " + value.getClass().getName() + " in field \"" + name + "\"");
  }

  private static TokenStream singleToken(BytesRef term, int textLength) {
    return new CannedTokenStream(new Token(term, 0, 0, textLength));
  }

  /**
   * A value indexed as a single term, such as an identifier or a tag. The
   * value is also the stored value and the binary column value.
   */
  public static Field keyword(String name, String value) {
    final BytesRef term = new BytesRef(value);
    return new Field(name, singleToken(term, value.length()), value, term);
  }

  /** A byte string indexed as a single term, also stored and kept as binary column value. */
  public static Field keyword(String name, BytesRef value) {
    return new Field(name, singleToken(value, 0), value, value);
  }

  /**
   * A long indexed as a single term whose byte order is the numeric order
   * (see {@link NumericUtils#longToSortableBytes(long)}). The value is also the
   * stored value and the numeric column value.
   */
  public static Field numeric(String name, long value) {
    return new Field(name, singleToken(NumericUtils.longToSortableBytes(value), 0), value, value);
  }

  /** Text indexed from the given tokens; {@code text} is the stored value. */
  public static Field text(String name, String text, TokenStream tokens) {
    return new Field(name, Objects.requireNonNull(tokens, "tokens must not be null"), text, null);
  }

  /** Indexed tokens only. */
  public static Field tokens(String name, TokenStream tokens) {
    return new Field(name, Objects.requireNonNull(tokens, "tokens must not be null"), null, null);
  }

  /**
   * A stored value only. Supported values are {@link String}, {@link BytesRef},
   * {@code byte[]}, {@link Integer}, {@link Long}, {@link Float} and {@link Double}.
   */
  public static Field stored(String name, Object value) {
    return new Field(name, null, Objects.requireNonNull(value, "value must not be null"), null);
  }

  /** A numeric column value only. */
  public static Field column(String name, long value) {
    return new Field(name, null, null, value);
  }

  /** A binary column value only. */
  public static Field column(String name, BytesRef value) {
    return new Field(name, null, null, Objects.requireNonNull(value, "value must not be null"));
  }

  /** The name of the field as a String. */
  public String name() {
    return name;
  }

  /** The tokens to index, or null. */
  public TokenStream tokenStream() {
    return tokenStream;
  }

  /** The value to store, or null. */
  public Object storedValue() {
    return storedValue;
  }

  /** The stored value if it is a String, else null. */
  public String stringValue() {
    return storedValue instanceof String ? (String) storedValue : null;
  }

  /** The stored value if it is a number, else null. */
  public Number numericValue() {
    return storedValue instanceof Number ? (Number) storedValue : null;
  }

  /** The stored value if it is binary, else null. */
  public BytesRef binaryValue() {
    return storedValue instanceof BytesRef ? (BytesRef) storedValue : null;
  }

  /** The column value, a {@link Long} or a {@link BytesRef}, or null. */
  public Object columnValue() {
    return columnValue;
  }

  @Override
  public String toString() {
    StringBuilder result = new StringBuilder();
    result.append(name).append('<');
    if (storedValue != null) {
      result.append(storedValue);
    } else if (tokenStream != null) {
      result.append("tokens");
    } else if (columnValue != null) {
      result.append("column:").append(columnValue);
    }
    result.append('>');
    return result.toString();
  }
}
