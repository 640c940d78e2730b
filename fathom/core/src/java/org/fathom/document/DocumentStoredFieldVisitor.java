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


import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.fathom.index.FieldInfo;
import org.fathom.index.IndexReader;
import org.fathom.index.StoredFieldVisitor;
import org.fathom.util.BytesRef;

/**
 * Collects the stored fields of a document into a {@link Document}, either
 * all of them or a chosen subset. {@link IndexReader#document(int)} loads
 * documents through it.
 *
 * @fathom.experimental
 */
public class DocumentStoredFieldVisitor extends StoredFieldVisitor {
  private final Document document = new Document();
  // null loads every field
  private final Set<String> wanted;

  /** Loads every stored field. */
  public DocumentStoredFieldVisitor() {
    this((Set<String>) null);
  }

  /** Loads the fields in {@code wanted}, or every field if it is null. */
  public DocumentStoredFieldVisitor(Set<String> wanted) {
    this.wanted = wanted;
  }

  public DocumentStoredFieldVisitor(String... wanted) {
    this(new HashSet<>(Arrays.asList(wanted)));
  }

  @Override
  public Status needsField(FieldInfo fieldInfo) {
    return wanted == null || wanted.contains(fieldInfo.name) ? Status.YES : Status.NO;
  }

  @Override
  public void stringField(FieldInfo fieldInfo, String value) {
    document.add(Field.stored(fieldInfo.name, value));
  }

  @Override
  public void binaryField(FieldInfo fieldInfo, byte[] value) {
    document.add(Field.stored(fieldInfo.name, new BytesRef(value)));
  }

  @Override
  public void intField(FieldInfo fieldInfo, int value) {
    document.add(Field.stored(fieldInfo.name, value));
  }

  @Override
  public void longField(FieldInfo fieldInfo, long value) {
    document.add(Field.stored(fieldInfo.name, value));
  }

  @Override
  public void floatField(FieldInfo fieldInfo, float value) {
    document.add(Field.stored(fieldInfo.name, value));
  }

  @Override
  public void doubleField(FieldInfo fieldInfo, double value) {
    document.add(Field.stored(fieldInfo.name, value));
  }

  /** The document built from the fields visited so far. */
  public Document getDocument() {
    return document;
  }
}
