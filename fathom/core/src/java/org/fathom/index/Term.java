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


import java.util.Objects;

import org.fathom.util.BytesRef;

/**
 * A field name and an indexed token of that field. Terms sort by field
 * name first and then by their bytes.
 */
public final class Term implements Comparable<Term> {

  private final String field;
  private final BytesRef bytes;

  /** A term over a private copy of {@code bytes}. */
  public Term(String field, BytesRef bytes) {
    this.field = Objects.requireNonNull(field);
    this.bytes = BytesRef.deepCopyOf(bytes);
  }

  /** A term over the UTF-8 encoding of {@code text}. */
  public Term(String field, String text) {
    this(field, new BytesRef(text));
  }

  public String field() {
    return field;
  }

  /** The term bytes decoded as UTF-8. */
  public String text() {
    return bytes.utf8ToString();
  }

  /** The term bytes; callers must not modify them. */
  public BytesRef bytes() {
    return bytes;
  }

  @Override
  public int compareTo(Term other) {
    int cmp = field.compareTo(other.field);
    return cmp != 0 ? cmp : bytes.compareTo(other.bytes);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof Term == false) {
      return false;
    }
    Term other = (Term) obj;
    return field.equals(other.field) && bytes.equals(other.bytes);
  }

  @Override
  public int hashCode() {
    return 31 * field.hashCode() + bytes.hashCode();
  }

  @Override
  public String toString() {
    return field + ":" + text();
  }
}
