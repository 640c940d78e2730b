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

import org.fathom.document.FieldType;

/**
 *  Access to the Field Info file that describes document fields and whether or
 *  not they are indexed. Each segment has a separate Field Info file. Objects
 *  of this class are thread-safe for multiple readers, but only one thread can
 *  be adding documents at a time, with no other reader or writer threads
 *  accessing this object.
 */
public final class FieldInfo {
  /** Field's name */
  public final String name;
  /** Internal field number */
  public final int number;

  private final IndexOptions indexOptions;
  private final ColumnType columnType;
  private final boolean stored;
  private final boolean unique;
  private final boolean storeTermVector;
  private final boolean omitLengths;

  /**
   * Sole constructor.
   */
  public FieldInfo(String name, int number, IndexOptions indexOptions, ColumnType columnType,
                   boolean stored, boolean unique, boolean storeTermVector, boolean omitLengths) {
    this.name = Objects.requireNonNull(name);
    this.number = number;
    this.indexOptions = Objects.requireNonNull(indexOptions, "IndexOptions must not be null (field: \"" + name + "\")");
    this.columnType = Objects.requireNonNull(columnType, "ColumnType must not be null (field: \"" + name + "\")");
    this.stored = stored;
    this.unique = unique;
    if (indexOptions != IndexOptions.NONE) {
      this.storeTermVector = storeTermVector;
      this.omitLengths = omitLengths;
    } else { // for non-indexed fields, leave defaults
      this.storeTermVector = false;
      this.omitLengths = false;
    }
    assert checkConsistency();
  }

  /** Creates the info for a field registered under {@code name} with the given type. */
  public FieldInfo(String name, int number, FieldType type) {
    this(name, number, type.indexOptions(), type.columnType(), type.stored(), type.unique(),
        type.storeTermVectors(), type.omitLengths());
  }

  /**
   * Performs internal consistency checks.
   * Always returns true (or throws IllegalStateException)
   */
  public boolean checkConsistency() {
    if (number < 0) {
      throw new IllegalStateException("field number must be >= 0, got " + number + " (field: \"" + name + "\")");
    }
    if (unique && indexOptions == IndexOptions.NONE) {
      throw new IllegalStateException("unique field must be indexed (field: \"" + name + "\")");
    }
    return true;
  }

  /** Returns IndexOptions for the field, or IndexOptions.NONE if the field is not indexed */
  public IndexOptions getIndexOptions() {
    return indexOptions;
  }

  /** Returns {@link ColumnType} of the column kept for this field, possibly {@link ColumnType#NONE}. */
  public ColumnType getColumnType() {
    return columnType;
  }

  /** True if the field's values are stored. */
  public boolean isStored() {
    return stored;
  }

  /** True if a value of this field identifies a single live document. */
  public boolean isUnique() {
    return unique;
  }

  /** True if this field is indexed. */
  public boolean isIndexed() {
    return indexOptions != IndexOptions.NONE;
  }

  /** True if per-document lengths are recorded for this field. */
  public boolean hasLengths() {
    return indexOptions != IndexOptions.NONE && omitLengths == false;
  }

  /** Returns true if any term vectors exist for this field. */
  public boolean hasVectors() {
    return storeTermVector;
  }

  /** Returns a mutable {@link FieldType} carrying the same properties. */
  public FieldType toFieldType() {
    return new FieldType()
        .setStored(stored)
        .setIndexOptions(indexOptions)
        .setColumnType(columnType)
        .setUnique(unique)
        .setStoreTermVectors(storeTermVector)
        .setOmitLengths(omitLengths);
  }

  boolean sameType(FieldType type) {
    return type.indexOptions() == indexOptions
        && type.columnType() == columnType
        && type.stored() == stored
        && type.unique() == unique
        && (indexOptions == IndexOptions.NONE || (type.storeTermVectors() == storeTermVector && type.omitLengths() == omitLengths));
  }

  @Override
  public String toString() {
    return "FieldInfo(name=" + name + ",number=" + number + ",indexOptions=" + indexOptions
        + ",columnType=" + columnType + ",stored=" + stored + ",unique=" + unique + ")";
  }
}
