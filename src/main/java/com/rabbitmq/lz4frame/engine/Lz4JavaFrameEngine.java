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

import static com.rabbitmq.lz4frame.engine.FrameFormat.*;

import java.util.Objects;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.xxhash.XXHashFactory;

/**
 * {@link Lz4FrameEngine} implementation based on <a href="https://github.com/lz4/lz4-java">LZ4
 * Java</a>.
 *
 * <p>LZ4 Java provides the block codecs and xxHash32, the frame format is handled by the contexts
 * of this engine. Blocks are always compressed independently, which produces valid frames for
 * both block modes. Frames using linked blocks produced by other encoders cannot be decoded.
 */
public final class Lz4JavaFrameEngine implements Lz4FrameEngine {

  private final LZ4Factory lz4Factory;
  private final XXHashFactory xxHashFactory;

  public Lz4JavaFrameEngine() {
    this(LZ4Factory.fastestInstance(), XXHashFactory.fastestInstance());
  }

  public Lz4JavaFrameEngine(LZ4Factory lz4Factory, XXHashFactory xxHashFactory) {
    this.lz4Factory = Objects.requireNonNull(lz4Factory, "lz4Factory");
    this.xxHashFactory = Objects.requireNonNull(xxHashFactory, "xxHashFactory");
  }

  @Override
  public CompressionContext createCompressionContext() {
    return new Lz4JavaCompressionContext(lz4Factory, xxHashFactory);
  }

  @Override
  public DecompressionContext createDecompressionContext() {
    return new Lz4JavaDecompressionContext(lz4Factory.safeDecompressor(), xxHashFactory);
  }

  @Override
  public int compressBound(int srcSize, Preferences preferences) {
    if (srcSize < 0) {
      throw new IllegalArgumentException("Source size must be positive: " + srcSize);
    }
    return Math.max(compressBound(srcSize, preferences, -1), HEADER_SIZE_MAX);
  }

  // worst case with a negative alreadyBuffered value is a full block minus one byte
  static int compressBound(long srcSize, Preferences preferences, int alreadyBuffered) {
    FrameInfo frameInfo = preferences.frameInfo();
    int blockSize = frameInfo.blockSizeId().bytes();
    long buffered = alreadyBuffered < 0 ? blockSize - 1 : alreadyBuffered;
    long maxSrcSize = srcSize + buffered;
    long fullBlocks = maxSrcSize / blockSize;
    long partialBlockSize = maxSrcSize & (blockSize - 1);
    boolean flush = preferences.autoFlush() || srcSize == 0;
    long lastBlockSize = flush ? partialBlockSize : 0;
    long blockCount = fullBlocks + (lastBlockSize > 0 ? 1 : 0);
    int blockOverhead = BLOCK_HEADER_SIZE + (frameInfo.blockChecksum() ? CHECKSUM_SIZE : 0);
    int frameEnd = BLOCK_HEADER_SIZE + (frameInfo.contentChecksum() ? CHECKSUM_SIZE : 0);
    long bound = blockOverhead * blockCount + blockSize * fullBlocks + lastBlockSize + frameEnd;
    if (bound > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Source size too large: " + srcSize);
    }
    return (int) bound;
  }

  @Override
  public String toString() {
    return "LZ4 frame engine (" + lz4Factory + ")";
  }
}
