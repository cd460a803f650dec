// Copyright (c) 2025-2026 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// This software, the RabbitMQ LZ4 Frame Java library, is dual-licensed under the
// Mozilla Public License 2.0 ("MPL"), and the Apache License version 2 ("ASL").
// For the MPL, please see LICENSE-MPL-RabbitMQ. For the ASL,
// please see LICENSE-APACHE2.
//
// This software is distributed on an "AS IS" basis, WITHOUT WARRANTY OF ANY KIND,
// either express or implied. See the LICENSE file for specific language governing
// rights and limitations of this software.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.lz4frame.engine;

import java.nio.ByteBuffer;

/** Constants and little-endian helpers of the LZ4 frame format. */
final class FrameFormat {

  static final int MAGIC = 0x184D2204;
  static final int SKIPPABLE_MAGIC = 0x184D2A50;
  static final int SKIPPABLE_MAGIC_MASK = 0xFFFFFFF0;

  static final int MAGIC_SIZE = 4;
  static final int HEADER_SIZE_MIN = 7;
  static final int HEADER_SIZE_MAX = Lz4FrameEngine.FRAME_HEADER_SIZE_MAX;
  static final int SKIPPABLE_HEADER_SIZE = 8;
  static final int BLOCK_HEADER_SIZE = 4;
  static final int CHECKSUM_SIZE = 4;
  static final int CONTENT_SIZE_SIZE = 8;
  static final int DICTIONARY_ID_SIZE = 4;

  static final int VERSION = 1;
  static final int FLG_VERSION_SHIFT = 6;
  static final int FLG_BLOCK_INDEPENDENCE = 1 << 5;
  static final int FLG_BLOCK_CHECKSUM = 1 << 4;
  static final int FLG_CONTENT_SIZE = 1 << 3;
  static final int FLG_CONTENT_CHECKSUM = 1 << 2;
  static final int FLG_RESERVED = 1 << 1;
  static final int FLG_DICTIONARY_ID = 1;
  static final int BD_BLOCK_SIZE_SHIFT = 4;
  static final int BD_RESERVED = 0x8F;

  static final int UNCOMPRESSED_BLOCK_FLAG = 0x80000000;
  static final int END_MARK = 0;

  static final int XXHASH_SEED = 0;

  static final int LINKED_WINDOW_SIZE = 64 * 1024;

  private FrameFormat() {}

  static int readIntLE(byte[] buf, int off) {
    return (buf[off] & 0xFF)
        | ((buf[off + 1] & 0xFF) << 8)
        | ((buf[off + 2] & 0xFF) << 16)
        | ((buf[off + 3] & 0xFF) << 24);
  }

  static long readLongLE(byte[] buf, int off) {
    return (readIntLE(buf, off) & 0xFFFFFFFFL) | ((long) readIntLE(buf, off + 4) << 32);
  }

  static void writeIntLE(byte[] buf, int off, int value) {
    buf[off] = (byte) value;
    buf[off + 1] = (byte) (value >>> 8);
    buf[off + 2] = (byte) (value >>> 16);
    buf[off + 3] = (byte) (value >>> 24);
  }

  static void writeLongLE(byte[] buf, int off, long value) {
    writeIntLE(buf, off, (int) value);
    writeIntLE(buf, off + 4, (int) (value >>> 32));
  }

  static void putIntLE(ByteBuffer dst, int value) {
    dst.put((byte) value);
    dst.put((byte) (value >>> 8));
    dst.put((byte) (value >>> 16));
    dst.put((byte) (value >>> 24));
  }

  static int headerSize(int flg) {
    int size = HEADER_SIZE_MIN;
    if ((flg & FLG_CONTENT_SIZE) != 0) {
      size += CONTENT_SIZE_SIZE;
    }
    if ((flg & FLG_DICTIONARY_ID) != 0) {
      size += DICTIONARY_ID_SIZE;
    }
    return size;
  }
}
