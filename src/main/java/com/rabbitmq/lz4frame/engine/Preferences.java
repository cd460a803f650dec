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

/** Compression preferences handed to {@link CompressionContext#begin}. */
public final class Preferences {

  private final FrameInfo frameInfo;
  private final int compressionLevel;
  private final boolean autoFlush;
  private final boolean favorDecompressionSpeed;

  public Preferences(
      FrameInfo frameInfo,
      int compressionLevel,
      boolean autoFlush,
      boolean favorDecompressionSpeed) {
    this.frameInfo = Objects.requireNonNull(frameInfo, "frameInfo");
    this.compressionLevel = compressionLevel;
    this.autoFlush = autoFlush;
    this.favorDecompressionSpeed = favorDecompressionSpeed;
  }

  public FrameInfo frameInfo() {
    return frameInfo;
  }

  public int compressionLevel() {
    return compressionLevel;
  }

  /**
   * Whether {@link CompressionContext#update} compresses buffered data immediately instead of
   * waiting for a full block.
   *
   * @return auto-flush flag
   */
  public boolean autoFlush() {
    return autoFlush;
  }

  /**
   * Parser hint for high compression levels. Engines without such a parser ignore it.
   *
   * @return favor decompression speed flag
   */
  public boolean favorDecompressionSpeed() {
    return favorDecompressionSpeed;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Preferences that = (Preferences) o;
    return compressionLevel == that.compressionLevel
        && autoFlush == that.autoFlush
        && favorDecompressionSpeed == that.favorDecompressionSpeed
        && frameInfo.equals(that.frameInfo);
  }

  @Override
  public int hashCode() {
    return Objects.hash(frameInfo, compressionLevel, autoFlush, favorDecompressionSpeed);
  }

  @Override
  public String toString() {
    return "Preferences{"
        + "frameInfo="
        + frameInfo
        + ", compressionLevel="
        + compressionLevel
        + ", autoFlush="
        + autoFlush
        + ", favorDecompressionSpeed="
        + favorDecompressionSpeed
        + '}';
  }
}
