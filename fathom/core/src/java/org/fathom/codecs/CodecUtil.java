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
package org.fathom.codecs;


import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.fathom.index.CorruptIndexException;
import org.fathom.index.IndexFormatTooNewException;
import org.fathom.index.IndexFormatTooOldException;
import org.fathom.store.BufferedChecksumIndexInput;
import org.fathom.store.ChecksumIndexInput;
import org.fathom.store.DataInput;
import org.fathom.store.DataOutput;
import org.fathom.store.IndexInput;
import org.fathom.store.IndexOutput;
import org.fathom.util.IOUtils;
import org.fathom.util.StringHelper;

/**
 * Headers and footers shared by every index file.
 *
 * <p>IndexHeader: Magic (Int32, {@value #CODEC_MAGIC}), Codec (String),
 * Version (Int32), Id ({@link StringHelper#ID_LENGTH} bytes), then a
 * Suffix of at most 255 ASCII bytes preceded by its length byte. The id
 * ties the file to its segment or commit and the suffix names the
 * generation or field.
 *
 * <p>Footer: Magic (Int32, {@value #FOOTER_MAGIC}), Algorithm (Int32,
 * always 0 for CRC-32), Checksum (Int64) of every byte before it.
 *
 * @fathom.experimental
 */
public final class CodecUtil {

  public static final int CODEC_MAGIC = 0x3fd76c17;
  public static final int FOOTER_MAGIC = ~CODEC_MAGIC;

  private static final int FOOTER_LENGTH = 16;

  private CodecUtil() {}

  /**
   * Writes an index header.
   *
   * @throws IllegalArgumentException if {@code codec} is not ASCII of fewer
   *         than 128 characters, {@code suffix} is not ASCII of fewer than
   *         256 characters, or {@code id} has the wrong length
   */
  public static void writeIndexHeader(DataOutput out, String codec, int version, byte[] id, String suffix) throws IOException {
    if (id.length != StringHelper.ID_LENGTH) {
      throw new IllegalArgumentException("id must be " + StringHelper.ID_LENGTH + " bytes, got " + id.length);
    }
    checkAscii("codec", codec, 128);
    byte[] suffixBytes = checkAscii("suffix", suffix, 256);
    out.writeInt(CODEC_MAGIC);
    out.writeString(codec);
    out.writeInt(version);
    out.writeBytes(id, 0, id.length);
    out.writeByte((byte) suffixBytes.length);
    out.writeBytes(suffixBytes, 0, suffixBytes.length);
  }

  private static byte[] checkAscii(String what, String value, int limit) {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length != value.length() || bytes.length >= limit) {
      throw new IllegalArgumentException(what + " must be ASCII and shorter than " + limit + " characters, got " + value);
    }
    return bytes;
  }

  /** Number of bytes {@link #writeIndexHeader} writes for an ASCII codec name and suffix. */
  public static int indexHeaderLength(String codec, String suffix) {
    // magic, codec length byte, codec, version, id, suffix length byte, suffix
    return 4 + 1 + codec.length() + 4 + StringHelper.ID_LENGTH + 1 + suffix.length();
  }

  /**
   * Checks the magic, codec name and version of a header and returns the version.
   *
   * @throws IndexFormatTooOldException if the version is below {@code minVersion}
   * @throws IndexFormatTooNewException if the version is above {@code maxVersion}
   */
  public static int checkHeader(DataInput in, String codec, int minVersion, int maxVersion) throws IOException {
    int magic = in.readInt();
    if (magic != CODEC_MAGIC) {
      throw new CorruptIndexException("bad header magic " + Integer.toHexString(magic)
          + ", expected " + Integer.toHexString(CODEC_MAGIC), in);
    }
    String actualCodec = in.readString();
    if (actualCodec.equals(codec) == false) {
      throw new CorruptIndexException("file is " + actualCodec + ", expected " + codec, in);
    }
    int version = in.readInt();
    if (version < minVersion) {
      throw new IndexFormatTooOldException(in, version, minVersion, maxVersion);
    }
    if (version > maxVersion) {
      throw new IndexFormatTooNewException(in, version, minVersion, maxVersion);
    }
    return version;
  }

  /** Checks a whole index header, including its id and suffix, and returns the version. */
  public static int checkIndexHeader(DataInput in, String codec, int minVersion, int maxVersion,
                                     byte[] expectedId, String expectedSuffix) throws IOException {
    int version = checkHeader(in, codec, minVersion, maxVersion);
    byte[] id = new byte[StringHelper.ID_LENGTH];
    in.readBytes(id, 0, id.length);
    if (Arrays.equals(id, expectedId) == false) {
      throw new CorruptIndexException("file belongs to id " + StringHelper.idToString(id)
          + ", expected " + StringHelper.idToString(expectedId), in);
    }
    checkIndexHeaderSuffix(in, expectedSuffix);
    return version;
  }

  /** Reads the suffix ending an index header and checks it. */
  public static String checkIndexHeaderSuffix(DataInput in, String expectedSuffix) throws IOException {
    byte[] bytes = new byte[in.readByte() & 0xFF];
    in.readBytes(bytes, 0, bytes.length);
    String suffix = new String(bytes, StandardCharsets.UTF_8);
    if (suffix.equals(expectedSuffix) == false) {
      throw new CorruptIndexException("file has suffix " + suffix + ", expected " + expectedSuffix, in);
    }
    return suffix;
  }

  /** Writes the footer with the checksum of everything written so far. */
  public static void writeFooter(IndexOutput out) throws IOException {
    out.writeInt(FOOTER_MAGIC);
    out.writeInt(0);
    long checksum = out.getChecksum();
    if ((checksum & 0xFFFFFFFF00000000L) != 0) {
      throw new IllegalStateException("checksum " + checksum + " is not a CRC-32 (resource=" + out + ")");
    }
    out.writeLong(checksum);
  }

  public static int footerLength() {
    return FOOTER_LENGTH;
  }

  /**
   * Reads the footer, which must start at the current position, and
   * compares the stored checksum with the one computed while reading.
   */
  public static long checkFooter(ChecksumIndexInput in) throws IOException {
    readFooterStart(in);
    long actual = in.getChecksum();
    long stored = readChecksum(in);
    if (stored != actual) {
      throw new CorruptIndexException("checksum failed: stored " + Long.toHexString(stored)
          + " but computed " + Long.toHexString(actual), in);
    }
    return actual;
  }

  /**
   * Finishes reading a file whose decoding may have failed with
   * {@code failure}. Without a failure this is {@link #checkFooter(ChecksumIndexInput)}.
   * With one, the rest of the file is checksummed: a mismatch is thrown with
   * the failure suppressed, otherwise the failure is rethrown with a note of
   * the checksum outcome attached.
   */
  public static void checkFooter(ChecksumIndexInput in, Throwable failure) throws IOException {
    if (failure == null) {
      checkFooter(in);
      return;
    }
    try {
      long unread = in.length() - in.getFilePointer();
      if (unread < FOOTER_LENGTH) {
        throw new CorruptIndexException("read " + (FOOTER_LENGTH - unread) + " bytes into the footer", in);
      }
      in.skipBytes(unread - FOOTER_LENGTH);
      long checksum = checkFooter(in);
      failure.addSuppressed(new CorruptIndexException("checksum " + Long.toHexString(checksum)
          + " is intact, the failure is not file corruption", in));
    } catch (CorruptIndexException corruption) {
      corruption.addSuppressed(failure);
      throw corruption;
    } catch (Throwable t) {
      failure.addSuppressed(new CorruptIndexException("could not verify the checksum", in, t));
    }
    throw IOUtils.rethrowAlways(failure);
  }

  /** Returns the checksum stored in the footer without verifying the file. */
  public static long retrieveChecksum(IndexInput in) throws IOException {
    checkLongEnough(in, in);
    in.seek(in.length() - FOOTER_LENGTH);
    readFooterStart(in);
    return readChecksum(in);
  }

  /** Reads the whole file through a clone of {@code input} and verifies its checksum. */
  public static long checksumEntireFile(IndexInput input) throws IOException {
    IndexInput clone = input.clone();
    clone.seek(0);
    ChecksumIndexInput in = new BufferedChecksumIndexInput(clone);
    checkLongEnough(in, input);
    in.seek(in.length() - FOOTER_LENGTH);
    return checkFooter(in);
  }

  private static void checkLongEnough(IndexInput in, IndexInput described) throws CorruptIndexException {
    if (in.length() < FOOTER_LENGTH) {
      throw new CorruptIndexException("file of " + in.length() + " bytes cannot hold a footer (truncated?)", described);
    }
  }

  private static void readFooterStart(IndexInput in) throws IOException {
    long unread = in.length() - in.getFilePointer();
    if (unread != FOOTER_LENGTH) {
      throw new CorruptIndexException("footer expected at " + in.getFilePointer() + " but " + unread
          + " bytes remain (file " + (unread < FOOTER_LENGTH ? "truncated" : "extended") + "?)", in);
    }
    int magic = in.readInt();
    if (magic != FOOTER_MAGIC) {
      throw new CorruptIndexException("bad footer magic " + Integer.toHexString(magic), in);
    }
    int algorithm = in.readInt();
    if (algorithm != 0) {
      throw new CorruptIndexException("unknown checksum algorithm " + algorithm, in);
    }
  }

  private static long readChecksum(IndexInput in) throws IOException {
    long value = in.readLong();
    if ((value & 0xFFFFFFFF00000000L) != 0) {
      throw new CorruptIndexException("stored checksum " + value + " is not a CRC-32", in);
    }
    return value;
  }
}
