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

import java.util.Objects;

/** Content of a frame descriptor. */
public final class FrameInfo {

  private final BlockSizeId blockSizeId;
  private final BlockMode blockMode;
  private final boolean contentChecksum;
  private final boolean blockChecksum;
  private final long contentSize;
  private final int dictionaryId;

  /**
   * @param blockSizeId maximum block size
   * @param blockMode block linkage
   * @param contentChecksum whether the frame ends with a checksum of the whole content
   * @param blockChecksum whether each block is followed by its checksum
   * @param contentSize size of the original content, 0 if unknown
   * @param dictionaryId dictionary identifier, 0 if none
   */
  public FrameInfo(
      BlockSizeId blockSizeId,
      BlockMode blockMode,
      boolean contentChecksum,
      boolean blockChecksum,
      long contentSize,
      int dictionaryId) {
    this.blockSizeId = Objects.requireNonNull(blockSizeId, "blockSizeId");
    this.blockMode = Objects.requireNonNull(blockMode, "blockMode");
    if (contentSize < 0) {
      throw new IllegalArgumentException("Content size cannot be negative: " + contentSize);
    }
    this.contentChecksum = contentChecksum;
    this.blockChecksum = blockChecksum;
    this.contentSize = contentSize;
    this.dictionaryId = dictionaryId;
  }

  public BlockSizeId blockSizeId() {
    return blockSizeId;
  }

  public BlockMode blockMode() {
    return blockMode;
  }

  public boolean contentChecksum() {
    return contentChecksum;
  }

  public boolean blockChecksum() {
    return blockChecksum;
  }

  public long contentSize() {
    return contentSize;
  }

  public int dictionaryId() {
    return dictionaryId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    FrameInfo that = (FrameInfo) o;
    return contentChecksum == that.contentChecksum
        && blockChecksum == that.blockChecksum
        && contentSize == that.contentSize
        && dictionaryId == that.dictionaryId
        && blockSizeId == that.blockSizeId
        && blockMode == that.blockMode;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        blockSizeId, blockMode, contentChecksum, blockChecksum, contentSize, dictionaryId);
  }

  @Override
  public String toString() {
    return "FrameInfo{"
        + "blockSizeId="
        + blockSizeId
        + ", blockMode="
        + blockMode
        + ", contentChecksum="
        + contentChecksum
        + ", blockChecksum="
        + blockChecksum
        + ", contentSize="
        + contentSize
        + ", dictionaryId="
        + dictionaryId
        + '}';
  }
}
