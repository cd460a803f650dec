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

/** Maximum block size of a frame, as encoded in the block descriptor byte. */
public enum BlockSizeId {
  DEFAULT((byte) 0, 64 * 1024),
  MAX_64KB((byte) 4, 64 * 1024),
  MAX_256KB((byte) 5, 256 * 1024),
  MAX_1MB((byte) 6, 1024 * 1024),
  MAX_4MB((byte) 7, 4 * 1024 * 1024);

  private final byte code;
  private final int bytes;

  BlockSizeId(byte code, int bytes) {
    this.code = code;
    this.bytes = bytes;
  }

  /**
   * The identifier written in the frame descriptor. {@link #DEFAULT} is written as its effective
   * value, {@link #MAX_64KB}.
   *
   * @return the block size identifier
   */
  public byte code() {
    return this == DEFAULT ? MAX_64KB.code : this.code;
  }

  public int bytes() {
    return this.bytes;
  }

  /**
   * Returns the block size for a frame descriptor identifier.
   *
   * @param code the identifier, between 4 and 7
   * @return the matching block size, or {@code null} if the identifier is not valid
   */
  public static BlockSizeId fromCode(int code) {
    switch (code) {
      case 4:
        return MAX_64KB;
      case 5:
        return MAX_256KB;
      case 6:
        return MAX_1MB;
      case 7:
        return MAX_4MB;
      default:
        return null;
    }
  }
}
