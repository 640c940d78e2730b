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


import org.fathom.util.BytesRef;
import org.fathom.util.FathomTestCase;

public class TestDocument extends FathomTestCase {

  public void testRepeatedName() {
    Document doc = new Document()
        .add(Field.stored("tag", "alfa"))
        .add(Field.numeric("num", 7))
        .add(Field.stored("tag", "bravo"))
        .add(Field.stored("tag", new BytesRef("binary")));
    assertEquals("alfa", doc.get("tag"));
    assertArrayEquals(new String[] {"alfa", "bravo"}, doc.getValues("tag"));
    assertEquals("7", doc.get("num"));
    assertEquals(4, doc.getFields().size());
    assertEquals("tag", doc.getField("tag").name());
    assertNull(doc.getField("missing"));
    assertNull(doc.get("missing"));
    assertEquals(0, doc.getValues("missing").length);
  }

  public void testGetValueSkipsFieldsWithoutStoredValue() {
    Document doc = new Document()
        .add(Field.column("tag", new BytesRef("column only")))
        .add(Field.stored("tag", 3L));
    assertEquals(Long.valueOf(3), doc.getValue("tag"));
    assertThrows(UnsupportedOperationException.class, () -> doc.getFields().clear());
  }
}
