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
package com.rabbitmq.lz4frame;

import com.rabbitmq.lz4frame.engine.BlockMode;
import com.rabbitmq.lz4frame.engine.BlockSizeId;
import com.rabbitmq.lz4frame.engine.FrameInfo;
import com.rabbitmq.lz4frame.engine.Preferences;
import java.util.Objects;

/**
 * Settings of the frames an encoding stream produces.
 *
 * <p>Instances are immutable, use {@link #builder()} to create them. The defaults are: default
 * block size (64 KB), linked blocks, no checksums, fast compression, no auto-flush.
 */
public final class FramePreferences {

  private static final FramePreferences DEFAULT = builder().build();

  /** Maximum size of the blocks of a frame. */
  public enum BlockSize {
    DEFAULT(BlockSizeId.DEFAULT),
    MAX_64KB(BlockSizeId.MAX_64KB),
    MAX_256KB(BlockSizeId.MAX_256KB),
    MAX_1MB(BlockSizeId.MAX_1MB),
    MAX_4MB(BlockSizeId.MAX_4MB);

    private final BlockSizeId id;

    BlockSize(BlockSizeId id) {
      this.id = id;
    }

    BlockSizeId id() {
      return this.id;
    }
  }

  /** Named compression levels. Levels from 3 use the high compression algorithm. */
  public enum CompressionLevel {
    FAST(0),
    MIN(3),
    DEFAULT(9),
    OPT_MIN(10),
    MAX(12);

    private final int level;

    CompressionLevel(int level) {
      this.level = level;
    }

    public int level() {
      return this.level;
    }
  }

  private final BlockSize blockSize;
  private final boolean linked;
  private final boolean contentChecksum;
  private final boolean blockChecksum;
  private final int compressionLevel;
  private final boolean autoFlush;
  private final boolean favorDecompressionSpeed;

  private FramePreferences(Builder builder) {
    this.blockSize = builder.blockSize;
    this.linked = builder.linked;
    this.contentChecksum = builder.contentChecksum;
    this.blockChecksum = builder.blockChecksum;
    this.compressionLevel = builder.compressionLevel;
    this.autoFlush = builder.autoFlush;
    this.favorDecompressionSpeed = builder.favorDecompressionSpeed;
  }

  /**
   * Preferences with all the default values.
   *
   * @return default preferences
   */
  public static FramePreferences defaults() {
    return DEFAULT;
  }

  public static Builder builder() {
    return new Builder();
  }

  public BlockSize blockSize() {
    return blockSize;
  }

  public boolean linked() {
    return linked;
  }

  public boolean contentChecksum() {
    return contentChecksum;
  }

  public boolean blockChecksum() {
    return blockChecksum;
  }

  public int compressionLevel() {
    return compressionLevel;
  }

  public boolean autoFlush() {
    return autoFlush;
  }

  public boolean favorDecompressionSpeed() {
    return favorDecompressionSpeed;
  }

  /**
   * Maps these settings to the engine preferences. The content size is always unknown and there
   * is no dictionary.
   *
   * @return the engine preferences
   */
  public Preferences toPreferences() {
    FrameInfo frameInfo =
        new FrameInfo(
            blockSize.id(),
            linked ? BlockMode.LINKED : BlockMode.INDEPENDENT,
            contentChecksum,
            blockChecksum,
            0,
            0);
    return new Preferences(frameInfo, compressionLevel, autoFlush, favorDecompressionSpeed);
  }

  /**
   * A builder initialized with the values of this instance.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    return new Builder()
        .blockSize(blockSize)
        .linked(linked)
        .contentChecksum(contentChecksum)
        .blockChecksum(blockChecksum)
        .compressionLevel(compressionLevel)
        .autoFlush(autoFlush)
        .favorDecompressionSpeed(favorDecompressionSpeed);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    FramePreferences that = (FramePreferences) o;
    return linked == that.linked
        && contentChecksum == that.contentChecksum
        && blockChecksum == that.blockChecksum
        && compressionLevel == that.compressionLevel
        && autoFlush == that.autoFlush
        && favorDecompressionSpeed == that.favorDecompressionSpeed
        && blockSize == that.blockSize;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        blockSize,
        linked,
        contentChecksum,
        blockChecksum,
        compressionLevel,
        autoFlush,
        favorDecompressionSpeed);
  }

  @Override
  public String toString() {
    return "FramePreferences{"
        + "blockSize="
        + blockSize
        + ", linked="
        + linked
        + ", contentChecksum="
        + contentChecksum
        + ", blockChecksum="
        + blockChecksum
        + ", compressionLevel="
        + compressionLevel
        + ", autoFlush="
        + autoFlush
        + ", favorDecompressionSpeed="
        + favorDecompressionSpeed
        + '}';
  }

  /** Builder for {@link FramePreferences}. */
  public static final class Builder {

    private BlockSize blockSize = BlockSize.DEFAULT;
    private boolean linked = true;
    private boolean contentChecksum = false;
    private boolean blockChecksum = false;
    private int compressionLevel = CompressionLevel.FAST.level();
    private boolean autoFlush = false;
    private boolean favorDecompressionSpeed = false;

    private Builder() {}

    public Builder blockSize(BlockSize blockSize) {
      this.blockSize = Objects.requireNonNull(blockSize, "blockSize");
      return this;
    }

    /**
     * Whether blocks may reference data of previous blocks.
     *
     * @param linked linked blocks flag
     * @return this builder
     */
    public Builder linked(boolean linked) {
      this.linked = linked;
      return this;
    }

    /**
     * Whether the frame ends with an xxHash32 checksum of its whole content.
     *
     * @param contentChecksum content checksum flag
     * @return this builder
     */
    public Builder contentChecksum(boolean contentChecksum) {
      this.contentChecksum = contentChecksum;
      return this;
    }

    /**
     * Whether each block is followed by an xxHash32 checksum of its stored data.
     *
     * @param blockChecksum block checksum flag
     * @return this builder
     */
    public Builder blockChecksum(boolean blockChecksum) {
      this.blockChecksum = blockChecksum;
      return this;
    }

    public Builder compressionLevel(CompressionLevel compressionLevel) {
      Objects.requireNonNull(compressionLevel, "compressionLevel");
      this.compressionLevel = compressionLevel.level();
      return this;
    }

    /**
     * Numeric compression level, from 0 to {@link CompressionLevel#MAX}.
     *
     * @param compressionLevel the level
     * @return this builder
     */
    public Builder compressionLevel(int compressionLevel) {
      if (compressionLevel < 0 || compressionLevel > CompressionLevel.MAX.level()) {
        throw new IllegalArgumentException(
            "Compression level must be between 0 and "
                + CompressionLevel.MAX.level()
                + ": "
                + compressionLevel);
      }
      this.compressionLevel = compressionLevel;
      return this;
    }

    /**
     * Whether each write emits its data as blocks immediately instead of waiting for a full block.
     *
     * @param autoFlush auto-flush flag
     * @return this builder
     */
    public Builder autoFlush(boolean autoFlush) {
      this.autoFlush = autoFlush;
      return this;
    }

    public Builder favorDecompressionSpeed(boolean favorDecompressionSpeed) {
      this.favorDecompressionSpeed = favorDecompressionSpeed;
      return this;
    }

    public FramePreferences build() {
      return new FramePreferences(this);
    }
  }
}
