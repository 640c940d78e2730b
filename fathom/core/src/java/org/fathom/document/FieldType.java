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

import org.fathom.index.ColumnType;
import org.fathom.index.IndexOptions;

/**
 * Describes the properties of a field: whether it is stored, how it is
 * indexed, whether it keeps a column, whether its value identifies a
 * document, and whether term vectors are recorded.
 *
 * <p>A FieldType is registered with the writer under a field name and
 * frozen from then on.
 */
public class FieldType {

  private boolean stored;
  private IndexOptions indexOptions = IndexOptions.NONE;
  private ColumnType columnType = ColumnType.NONE;
  private boolean unique;
  private boolean storeTermVectors;
  private boolean omitLengths;
  private boolean frozen;

  /**
   * Create a new mutable FieldType with all of the properties from <code>ref</code>
   */
  public FieldType(FieldType ref) {
    this.stored = ref.stored();
    this.indexOptions = ref.indexOptions();
    this.columnType = ref.columnType();
    this.unique = ref.unique();
    this.storeTermVectors = ref.storeTermVectors();
    this.omitLengths = ref.omitLengths();
  }

  /**
   * Create a new FieldType with default properties.
   */
  public FieldType() {
  }

  /**
   * Throws an exception if this FieldType is frozen. Subclasses should
   * call this within setters for additional state.
   */
  protected void checkIfFrozen() {
    if (frozen) {
      throw new IllegalStateException("this FieldType is already frozen and cannot be changed");
    }
  }

  /**
   * Prevents future changes. Note, it is recommended that this is called once
   * the FieldTypes's properties have been set, to prevent unintentional state
   * changes.
   */
  public FieldType freeze() {
    this.frozen = true;
    return this;
  }

  /**
   * True if the field's value should be stored
   */
  public boolean stored() {
    return this.stored;
  }

  /**
   * Set to <code>true</code> to store this field.
   * @throws IllegalStateException if this FieldType is frozen against
   *         future modifications.
   */
  public FieldType setStored(boolean value) {
    checkIfFrozen();
    this.stored = value;
    return this;
  }

  /**
   * {@link IndexOptions}, describing what should be
   * recorded into the inverted index
   */
  public IndexOptions indexOptions() {
    return indexOptions;
  }

  /**
   * Sets the indexing options for the field.
   * @throws IllegalStateException if this FieldType is frozen against
   *         future modifications.
   */
  public FieldType setIndexOptions(IndexOptions value) {
    checkIfFrozen();
    this.indexOptions = Objects.requireNonNull(value, "IndexOptions must not be null");
    return this;
  }

  /** The column kept for this field, {@link ColumnType#NONE} if none. */
  public ColumnType columnType() {
    return columnType;
  }

  /**
   * Sets the field's column type.
   * @throws IllegalStateException if this FieldType is frozen against
   *         future modifications.
   */
  public FieldType setColumnType(ColumnType type) {
    checkIfFrozen();
    this.columnType = Objects.requireNonNull(type, "ColumnType must not be null");
    return this;
  }

  /**
   * True if a value of this field identifies at most one live document:
   * adding a document deletes every older document sharing the value.
   */
  public boolean unique() {
    return unique;
  }

  /**
   * Set to <code>true</code> to make the field's indexed value a document key.
   * @throws IllegalStateException if this FieldType is frozen against
   *         future modifications.
   */
  public FieldType setUnique(boolean value) {
    checkIfFrozen();
    this.unique = value;
    return this;
  }

  /**
   * True if this field's indexed form should be also stored
   * into term vectors.
   */
  public boolean storeTermVectors() {
    return this.storeTermVectors;
  }

  /**
   * Set to <code>true</code> to record term vectors.
   * @throws IllegalStateException if this FieldType is frozen against
   *         future modifications.
   */
  public FieldType setStoreTermVectors(boolean value) {
    checkIfFrozen();
    this.storeTermVectors = value;
    return this;
  }

  /**
   * True if per-document field lengths are not recorded. Scoring
   * then treats every document as having the average length.
   */
  public boolean omitLengths() {
    return this.omitLengths;
  }

  /**
   * Set to <code>true</code> to omit field lengths.
   * @throws IllegalStateException if this FieldType is frozen against
   *         future modifications.
   */
  public FieldType setOmitLengths(boolean value) {
    checkIfFrozen();
    this.omitLengths = value;
    return this;
  }

  /** Prints a Field for human consumption. */
  @Override
  public String toString() {
    StringBuilder result = new StringBuilder();
    if (stored()) {
      result.append("stored");
    }
    if (indexOptions != IndexOptions.NONE) {
      if (result.length() > 0)
        result.append(",");
      result.append("indexOptions=");
      result.append(indexOptions);
      if (storeTermVectors()) {
        result.append(",termVector");
      }
      if (omitLengths()) {
        result.append(",omitLengths");
      }
    }
    if (unique) {
      if (result.length() > 0)
        result.append(",");
      result.append("unique");
    }
    if (columnType != ColumnType.NONE) {
      if (result.length() > 0)
        result.append(",");
      result.append("columnType=");
      result.append(columnType);
    }
    return result.toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null) return false;
    if (getClass() != obj.getClass()) return false;
    FieldType other = (FieldType) obj;
    return stored == other.stored
        && indexOptions == other.indexOptions
        && columnType == other.columnType
        && unique == other.unique
        && storeTermVectors == other.storeTermVectors
        && omitLengths == other.omitLengths;
  }

  @Override
  public int hashCode() {
    return Objects.hash(stored, indexOptions, columnType, unique, storeTermVectors, omitLengths);
  }
}
