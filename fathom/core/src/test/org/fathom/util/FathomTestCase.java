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
package org.fathom.util;


import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.carrotsearch.randomizedtesting.JUnit3MethodProvider;
import com.carrotsearch.randomizedtesting.JUnit4MethodProvider;
import com.carrotsearch.randomizedtesting.RandomizedContext;
import com.carrotsearch.randomizedtesting.RandomizedRunner;
import com.carrotsearch.randomizedtesting.annotations.TestMethodProviders;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakLingering;
import com.carrotsearch.randomizedtesting.generators.RandomNumbers;
import com.carrotsearch.randomizedtesting.generators.RandomStrings;
import org.fathom.analysis.MockTokenStream;
import org.fathom.document.Document;
import org.fathom.document.Field;
import org.fathom.document.FieldType;
import org.fathom.index.ColumnType;
import org.fathom.index.ConcurrentMergeScheduler;
import org.fathom.index.IndexOptions;
import org.fathom.index.IndexWriter;
import org.fathom.index.IndexWriterConfig;
import org.fathom.index.LogDocMergePolicy;
import org.fathom.index.LogMergePolicy;
import org.fathom.index.MergePolicy;
import org.fathom.index.NoMergePolicy;
import org.fathom.index.SerialMergeScheduler;
import org.fathom.store.ByteBuffersDirectory;
import org.fathom.store.Directory;
import org.fathom.store.MMapDirectory;
import org.junit.After;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;

/**
 * Base class for all Fathom unit tests, JUnit3 or JUnit4 style.
 * <p>
 * Test methods named {@code test*} run without an annotation. Randomness
 * comes from the runner's seed, so a failure reproduces with
 * {@code -Dtests.seed=...}.
 * <p>
 * Directories returned by {@link #newDirectory()} are closed after the test.
 */
@RunWith(RandomizedRunner.class)
@TestMethodProviders({
  JUnit3MethodProvider.class,
  JUnit4MethodProvider.class
})
@ThreadLeakLingering(linger = 5000)
public abstract class FathomTestCase extends Assert {

  /** Field type of whitespace-tokenized text: stored, with positions. */
  public static final FieldType TEXT_TYPE = new FieldType()
      .setStored(true)
      .setIndexOptions(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS)
      .freeze();

  /** Field type of an identifier: stored, indexed as one term, unique. */
  public static final FieldType ID_TYPE = new FieldType()
      .setStored(true)
      .setIndexOptions(IndexOptions.DOCS)
      .setUnique(true)
      .freeze();

  /** Field type of a keyword kept in a binary column. */
  public static final FieldType KEYWORD_TYPE = new FieldType()
      .setStored(true)
      .setIndexOptions(IndexOptions.DOCS)
      .setColumnType(ColumnType.BINARY)
      .freeze();

  /** Field type of a long: stored, indexed as a sortable term and kept in a numeric column. */
  public static final FieldType NUMERIC_TYPE = new FieldType()
      .setStored(true)
      .setIndexOptions(IndexOptions.DOCS)
      .setColumnType(ColumnType.NUMERIC)
      .freeze();

  @Rule
  public final TemporaryFolder tempFolder = new TemporaryFolder();

  private final List<Directory> directories = new ArrayList<>();

  @After
  public void closeDirectories() throws IOException {
    IOUtils.close(directories);
    directories.clear();
  }

  /** The random source of the current test. */
  public static Random random() {
    return RandomizedContext.current().getRandom();
  }

  /** A random int between <code>min</code> and <code>max</code>, both inclusive. */
  public static int randomIntBetween(int min, int max) {
    return RandomNumbers.randomIntBetween(random(), min, max);
  }

  public static boolean randomBoolean() {
    return random().nextBoolean();
  }

  /** True about one time in ten. */
  public static boolean rarely() {
    return random().nextInt(10) == 0;
  }

  /** A random string of unicode code points; its length is counted in chars. */
  public static String randomUnicodeOfLengthBetween(int minLength, int maxLength) {
    return RandomStrings.randomUnicodeOfLengthBetween(random(), minLength, maxLength);
  }

  /** Returns a number of at least <code>i</code>, sometimes a bit more. */
  public static int atLeast(int i) {
    return randomIntBetween(i, i + i / 2);
  }

  /** A new temporary directory on the file system, removed after the test. */
  public Path createTempDir() throws IOException {
    return tempFolder.newFolder().toPath();
  }

  /**
   * Returns a new, empty Directory: mostly a heap directory, sometimes a
   * memory-mapped one over a temporary folder. It is closed after the test.
   */
  public Directory newDirectory() throws IOException {
    final Directory dir;
    if (rarely()) {
      dir = new MMapDirectory(createTempDir());
    } else {
      dir = new ByteBuffersDirectory();
    }
    directories.add(dir);
    return dir;
  }

  /** Returns a new file system directory over a temporary folder. */
  public Directory newFSDirectory() throws IOException {
    final Directory dir = new MMapDirectory(createTempDir());
    directories.add(dir);
    return dir;
  }

  /** A config with a random buffer size and merge policy, merging in the committing thread. */
  public static IndexWriterConfig newIndexWriterConfig() {
    final IndexWriterConfig config = new IndexWriterConfig();
    config.setMaxBufferedDocs(randomIntBetween(2, 50));
    config.setMergePolicy(newMergePolicy());
    config.setMergeScheduler(new SerialMergeScheduler());
    return config;
  }

  /** Same as {@link #newIndexWriterConfig()} but merges run in background threads. */
  public static IndexWriterConfig newConcurrentIndexWriterConfig() {
    final IndexWriterConfig config = newIndexWriterConfig();
    final ConcurrentMergeScheduler cms = new ConcurrentMergeScheduler();
    cms.setMaxMergesAndThreads(randomIntBetween(2, 4), randomIntBetween(1, 2));
    config.setMergeScheduler(cms);
    return config;
  }

  /** A merge policy with random settings; rarely one that never merges. */
  public static MergePolicy newMergePolicy() {
    if (rarely()) {
      return NoMergePolicy.INSTANCE;
    }
    final LogDocMergePolicy mp = new LogDocMergePolicy();
    mp.setMinMergeDocs(randomIntBetween(1, 10));
    mp.setMergeFactor(randomIntBetween(2, 10));
    mp.setDeletesPctAllowed(randomBoolean() ? LogMergePolicy.DEFAULT_DELETES_PCT_ALLOWED : randomIntBetween(10, 90));
    return mp;
  }

  /** Opens a writer on <code>dir</code> and declares the common test fields. */
  public static IndexWriter newWriter(Directory dir, IndexWriterConfig config) throws IOException {
    final IndexWriter writer = new IndexWriter(dir, config);
    writer.addField("id", ID_TYPE);
    writer.addField("body", TEXT_TYPE);
    writer.addField("tag", KEYWORD_TYPE);
    writer.addField("num", NUMERIC_TYPE);
    return writer;
  }

  /** A text field tokenized on whitespace. */
  public static Field newTextField(String name, String text) {
    return Field.text(name, text, new MockTokenStream(text));
  }

  /** A document with an id and a body. */
  public static Document newDocument(String id, String body) {
    return new Document()
        .add(Field.keyword("id", id))
        .add(newTextField("body", body));
  }
}
