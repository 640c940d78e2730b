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


import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import org.fathom.index.IndexReader;

/**
 * An ordered list of {@link Field}s, the unit that is indexed and
 * retrieved. A name may occur several times; the tokens of all its fields
 * are indexed as one stream.
 *
 * <p>Documents read back through {@link IndexReader#document(int)} only
 * hold the stored values.
 */
public final class Document implements Iterable<Field> {

  private final List<Field> fields = new ArrayList<>();

  public Document add(Field field) {
    fields.add(field);
    return this;
  }

  @Override
  public Iterator<Field> iterator() {
    return fields.iterator();
  }

  /** All fields in the order they were added. */
  public List<Field> getFields() {
    return Collections.unmodifiableList(fields);
  }

  /** First field called {@code name}, or null. */
  public Field getField(String name) {
    for (Field field : fields) {
      if (field.name().equals(name)) {
        return field;
      }
    }
    return null;
  }

  /** First stored value under {@code name}, or null. */
  public Object getValue(String name) {
    for (Field field : fields) {
      if (field.name().equals(name) && field.storedValue() != null) {
        return field.storedValue();
      }
    }
    return null;
  }

  /** First string or number stored under {@code name} as a string, or null. */
  public String get(String name) {
    List<String> values = textValues(name);
    return values.isEmpty() ? null : values.get(0);
  }

  /** Every string or number stored under {@code name}, as strings. */
  public String[] getValues(String name) {
    return textValues(name).toArray(new String[0]);
  }

  private List<String> textValues(String name) {
    List<String> values = new ArrayList<>();
    for (Field field : fields) {
      if (field.name().equals(name) == false) {
        continue;
      }
      if (field.stringValue() != null) {
        values.add(field.stringValue());
      } else if (field.numericValue() != null) {
        values.add(field.numericValue().toString());
      }
    }
    return values;
  }

  @Override
  public String toString() {
    return fields.stream().map(Field::toString).collect(Collectors.joining(" ", "Document<", ">"));
  }
}
