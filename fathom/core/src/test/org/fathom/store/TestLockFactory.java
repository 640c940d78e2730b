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
package org.fathom.store;


import org.fathom.util.FathomTestCase;

public class TestLockFactory extends FathomTestCase {

  public void testHeapDirectoryLockIsExclusive() throws Exception {
    Directory dir = newDirectory();
    Lock lock = dir.obtainLock("test.lock");
    expectLockFailure(dir);
    lock.ensureValid();
    lock.close();
    // released: can obtain again
    try (Lock again = dir.obtainLock("test.lock")) {
      again.ensureValid();
    }
  }

  public void testNativeLockIsExclusiveWithinJVM() throws Exception {
    Directory dir = newFSDirectory();
    try (Lock lock = dir.obtainLock("test.lock")) {
      lock.ensureValid();
      expectLockFailure(dir);
    }
    try (Lock again = dir.obtainLock("test.lock")) {
      again.ensureValid();
    }
  }

  public void testDifferentLockNames() throws Exception {
    Directory dir = newDirectory();
    try (Lock a = dir.obtainLock("a.lock"); Lock b = dir.obtainLock("b.lock")) {
      a.ensureValid();
      b.ensureValid();
    }
  }

  private static void expectLockFailure(Directory dir) {
    assertThrows(LockObtainFailedException.class, () -> dir.obtainLock("test.lock"));
  }
}
