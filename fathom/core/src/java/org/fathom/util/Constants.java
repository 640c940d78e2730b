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


/**
 * Some useful constants.
 */
public final class Constants {
  private Constants() {} // can't construct

  /** Version recorded in the diagnostics of every segment. */
  public static final String FATHOM_VERSION = "1.0.0";

  /** The value of <code>System.getProperty("os.name")</code>. **/
  public static final String OS_NAME = System.getProperty("os.name");
  /** True iff running on Linux. */
  public static final boolean LINUX = OS_NAME.startsWith("Linux");
  /** True iff running on Windows. */
  public static final boolean WINDOWS = OS_NAME.startsWith("Windows");
  /** True iff running on Mac OS X */
  public static final boolean MAC_OS_X = OS_NAME.startsWith("Mac OS X");

  /** True iff the JVM addresses memory with 64 bit pointers. */
  public static final boolean JRE_IS_64BIT;

  static {
    String model = System.getProperty("sun.arch.data.model");
    if (model != null) {
      JRE_IS_64BIT = model.contains("64");
    } else {
      String arch = System.getProperty("os.arch", "");
      JRE_IS_64BIT = arch.contains("64");
    }
  }
}
