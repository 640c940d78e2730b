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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.fathom.document.FieldType;
import org.fathom.store.DataInput;
import org.fathom.store.DataOutput;
import org.fathom.util.ArrayUtil;

/**
 * Collection of {@link FieldInfo}s: the index schema.
 *
 * <p>Instances are immutable. {@link #withField} and {@link #withoutField}
 * return a modified copy. Field numbers are never reused, so a segment
 * written under an older schema still resolves its field numbers, and
 * data of a removed field is simply not exposed.
 *
 * @fathom.experimental
 */
public class FieldInfos implements Iterable<FieldInfo> {

  /** An instance without any fields. */
  public final static FieldInfos EMPTY = new FieldInfos(new FieldInfo[0], 0);

  private static final byte STORED = 0x1;
  private static final byte UNIQUE = 0x2;
  private static final byte STORE_TERMVECTOR = 0x4;
  private static final byte OMIT_LENGTHS = 0x8;

  private final boolean hasVectors;
  private final boolean hasColumns;
  private final boolean hasLengths;
  private final int nextFieldNumber;

  // used only by fieldInfo(int)
  private final FieldInfo[] byNumber;

  private final Map<String,FieldInfo> byName = new LinkedHashMap<>();
  private final Collection<FieldInfo> values; // for an unmodifiable iterator

  /**
   * Constructs a new FieldInfos from an array of FieldInfo objects, in
   * schema order. {@code nextFieldNumber} is the number the next added field
   * receives and must be larger than every number in use.
   */
  public FieldInfos(FieldInfo[] infos, int nextFieldNumber) {
    boolean hasVectors = false;
    boolean hasColumns = false;
    boolean hasLengths = false;

    int size = 0; // number of elements in byNumberTemp, number of used array slots
    FieldInfo[] byNumberTemp = new FieldInfo[10]; // initial array capacity of 10
    for (FieldInfo info : infos) {
      if (info.number < 0) {
        throw new IllegalArgumentException("illegal field number: " + info.number + " for field " + info.name);
      }
      if (info.number >= nextFieldNumber) {
        throw new IllegalArgumentException("field number " + info.number + " for field " + info.name + " is not below nextFieldNumber=" + nextFieldNumber);
      }
      size = info.number >= size ? info.number + 1 : size;
      if (info.number >= byNumberTemp.length) { //grow array
        byNumberTemp = ArrayUtil.grow(byNumberTemp, info.number + 1);
      }
      FieldInfo previous = byNumberTemp[info.number];
      if (previous != null) {
        throw new IllegalArgumentException("duplicate field numbers: " + previous.name + " and " + info.name + " have: " + info.number);
      }
      byNumberTemp[info.number] = info;

      previous = byName.put(info.name, info);
      if (previous != null) {
        throw new IllegalArgumentException("duplicate field names: " + previous.number + " and " + info.number + " have: " + info.name);
      }

      hasVectors |= info.hasVectors();
      hasColumns |= info.getColumnType() != ColumnType.NONE;
      hasLengths |= info.hasLengths();
    }

    this.hasVectors = hasVectors;
    this.hasColumns = hasColumns;
    this.hasLengths = hasLengths;
    this.nextFieldNumber = nextFieldNumber;
    this.byNumber = Arrays.copyOf(byNumberTemp, size);
    this.values = Collections.unmodifiableCollection(new ArrayList<>(byName.values()));
  }

  /** Returns true if any fields have vectors */
  public boolean hasVectors() {
    return hasVectors;
  }

  /** Returns true if any fields keep a column */
  public boolean hasColumns() {
    return hasColumns;
  }

  /** Returns true if any fields record lengths */
  public boolean hasLengths() {
    return hasLengths;
  }

  /** Returns the number the next added field receives. */
  public int nextFieldNumber() {
    return nextFieldNumber;
  }

  /** Returns the number of fields */
  public int size() {
    return byName.size();
  }

  /**
   * Returns an iterator over all the fieldinfo objects present,
   * in schema order
   */
  @Override
  public Iterator<FieldInfo> iterator() {
    return values.iterator();
  }

  /**
   * Return the fieldinfo object referenced by the field name
   * @return the FieldInfo object or null when the given fieldName
   * doesn't exist.
   */
  public FieldInfo fieldInfo(String fieldName) {
    return byName.get(fieldName);
  }

  /**
   * Return the fieldinfo object referenced by the fieldNumber.
   * @param fieldNumber field's number.
   * @return the FieldInfo object or null when the given fieldNumber
   * doesn't exist.
   * @throws IllegalArgumentException if fieldNumber is negative
   */
  public FieldInfo fieldInfo(int fieldNumber) {
    if (fieldNumber < 0) {
      throw new IllegalArgumentException("Illegal field number: " + fieldNumber);
    }
    if (fieldNumber >= byNumber.length) {
      return null;
    }
    return byNumber[fieldNumber];
  }

  /**
   * Returns a copy of this schema with {@code name} added under a fresh
   * field number. Adding a field that already exists with the same type
   * returns this instance.
   *
   * @throws IllegalArgumentException if the field exists with a different type
   */
  public FieldInfos withField(String name, FieldType type) {
    FieldInfo existing = byName.get(name);
    if (existing != null) {
      if (existing.sameType(type)) {
        return this;
      }
      throw new IllegalArgumentException("field \"" + name + "\" already exists with a different type: " + existing);
    }
    List<FieldInfo> infos = new ArrayList<>(values);
    infos.add(new FieldInfo(name, nextFieldNumber, type));
    return new FieldInfos(infos.toArray(new FieldInfo[0]), nextFieldNumber + 1);
  }

  /**
   * Returns a copy of this schema without {@code name}. Removing an unknown
   * field returns this instance.
   */
  public FieldInfos withoutField(String name) {
    if (byName.containsKey(name) == false) {
      return this;
    }
    List<FieldInfo> infos = new ArrayList<>(values);
    infos.removeIf(fi -> fi.name.equals(name));
    return new FieldInfos(infos.toArray(new FieldInfo[0]), nextFieldNumber);
  }

  /** Returns true if {@code other} holds the same fields under the same numbers. */
  public boolean sameFields(FieldInfos other) {
    if (other == this) {
      return true;
    }
    if (size() != other.size()) {
      return false;
    }
    for (FieldInfo fi : values) {
      FieldInfo otherInfo = other.fieldInfo(fi.number);
      if (otherInfo == null || otherInfo.name.equals(fi.name) == false) {
        return false;
      }
    }
    return true;
  }

  /** Writes this schema; read back with {@link #read(DataInput)}. */
  public void write(DataOutput out) throws IOException {
    out.writeVInt(nextFieldNumber);
    out.writeVInt(size());
    for (FieldInfo fi : this) {
      out.writeString(fi.name);
      out.writeVInt(fi.number);
      out.writeByte((byte) fi.getIndexOptions().ordinal());
      out.writeByte((byte) fi.getColumnType().ordinal());
      byte bits = 0x0;
      if (fi.isStored()) bits |= STORED;
      if (fi.isUnique()) bits |= UNIQUE;
      if (fi.hasVectors()) bits |= STORE_TERMVECTOR;
      if (fi.isIndexed() && fi.hasLengths() == false) bits |= OMIT_LENGTHS;
      out.writeByte(bits);
    }
  }

  /** Reads a schema written by {@link #write(DataOutput)}. */
  public static FieldInfos read(DataInput in) throws IOException {
    final int nextFieldNumber = in.readVInt();
    final int size = in.readVInt();
    FieldInfo[] infos = new FieldInfo[size];
    for (int i = 0; i < size; i++) {
      String name = in.readString();
      int number = in.readVInt();
      IndexOptions indexOptions = getIndexOptions(in, in.readByte());
      ColumnType columnType = getColumnType(in, in.readByte());
      byte bits = in.readByte();
      try {
        infos[i] = new FieldInfo(name, number, indexOptions, columnType,
            (bits & STORED) != 0, (bits & UNIQUE) != 0, (bits & STORE_TERMVECTOR) != 0, (bits & OMIT_LENGTHS) != 0);
      } catch (IllegalStateException e) {
        throw new CorruptIndexException("invalid field info for field: " + name + ", fieldNumber=" + number, in, e);
      }
    }
    try {
      return new FieldInfos(infos, nextFieldNumber);
    } catch (IllegalArgumentException e) {
      throw new CorruptIndexException("invalid schema", in, e);
    }
  }

  private static IndexOptions getIndexOptions(DataInput input, byte b) throws IOException {
    IndexOptions[] values = IndexOptions.values();
    if (b < 0 || b >= values.length) {
      throw new CorruptIndexException("invalid IndexOptions byte: " + b, input);
    }
    return values[b];
  }

  private static ColumnType getColumnType(DataInput input, byte b) throws IOException {
    ColumnType[] values = ColumnType.values();
    if (b < 0 || b >= values.length) {
      throw new CorruptIndexException("invalid ColumnType byte: " + b, input);
    }
    return values[b];
  }

  @Override
  public String toString() {
    return "FieldInfos" + byName.keySet();
  }
}
