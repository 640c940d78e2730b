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
package org.fathom.search;


import java.util.Objects;

/**
 * One key of a {@link Sort}: relevance, index order, or the value of a
 * numeric or binary column.
 *
 * <p>Documents without a value in the column come after those with one,
 * whichever the direction, unless {@link #setMissingLast(boolean)} is
 * turned off.
 */
public class SortField {

  /** What a sort key compares. */
  public enum Type {
    /** Relevance score, best first. Values are Float. */
    SCORE("<score>"),
    /** Doc ID, smallest first. Values are Integer. */
    DOC("<doc>"),
    /** A numeric column, smallest first. Values are Long. */
    LONG("long"),
    /** A binary column compared as unsigned bytes, smallest first. Values are BytesRef. */
    BINARY("binary");

    private final String label;

    Type(String label) {
      this.label = label;
    }

    boolean isColumn() {
      return this == LONG || this == BINARY;
    }
  }

  public static final SortField FIELD_SCORE = new SortField(null, Type.SCORE);

  public static final SortField FIELD_DOC = new SortField(null, Type.DOC);

  private final String field;
  private final Type type;
  private final boolean reverse;
  private boolean missingLast = true;

  public SortField(String field, Type type) {
    this(field, type, false);
  }

  /**
   * @param field the column to sort by; null for {@link Type#SCORE} and {@link Type#DOC}
   * @param reverse whether to invert the natural order of {@code type}
   */
  public SortField(String field, Type type, boolean reverse) {
    this.type = Objects.requireNonNull(type);
    if (field == null && type.isColumn()) {
      throw new IllegalArgumentException(type + " sorts need a field");
    }
    this.field = field;
    this.reverse = reverse;
  }

  /** The column, or null for score and doc sorts. */
  public String getField() {
    return field;
  }

  public Type getType() {
    return type;
  }

  public boolean getReverse() {
    return reverse;
  }

  public boolean getMissingLast() {
    return missingLast;
  }

  /**
   * Puts documents without a value after (true, the default) or before the
   * others, independent of {@link #getReverse()}. Only column sorts have
   * missing values.
   */
  public SortField setMissingLast(boolean missingLast) {
    if (type.isColumn() == false) {
      throw new IllegalArgumentException(type + " sorts have no missing values");
    }
    this.missingLast = missingLast;
    return this;
  }

  public boolean needsScores() {
    return type == Type.SCORE;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (type.isColumn()) {
      sb.append('<').append(type.label).append(": \"").append(field).append("\">");
    } else {
      sb.append(type.label);
    }
    if (reverse) {
      sb.append('!');
    }
    if (missingLast == false) {
      sb.append(" missingFirst");
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (o instanceof SortField == false) {
      return false;
    }
    SortField other = (SortField) o;
    return Objects.equals(field, other.field)
        && type == other.type
        && reverse == other.reverse
        && missingLast == other.missingLast;
  }

  @Override
  public int hashCode() {
    return Objects.hash(field, type, reverse, missingLast);
  }
}
