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

import java.nio.ByteBuffer;
import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.xxhash.StreamingXXHash32;
import net.jpountz.xxhash.XXHash32;
import net.jpountz.xxhash.XXHashFactory;

final class Lz4JavaCompressionContext implements CompressionContext {

  // below this level the fast compressor is used
  static final int HIGH_COMPRESSION_LEVEL_MIN = 3;

  private final LZ4Factory lz4Factory;
  private final XXHash32 hash32;
  private final StreamingXXHash32 contentHash;
  private final byte[] header = new byte[HEADER_SIZE_MAX];

  private Preferences preferences;
  private LZ4Compressor compressor;
  private int compressionLevel = -1;
  private byte[] inBuffer;
  private int buffered;
  private byte[] blockBuffer;
  private long totalInSize;
  private boolean started;
  private boolean released;

  Lz4JavaCompressionContext(LZ4Factory lz4Factory, XXHashFactory xxHashFactory) {
    this.lz4Factory = lz4Factory;
    this.hash32 = xxHashFactory.hash32();
    this.contentHash = xxHashFactory.newStreamingHash32(XXHASH_SEED);
  }

  @Override
  public int begin(Preferences preferences, ByteBuffer dst) throws Lz4FrameException {
    checkNotReleased();
    if (dst.remaining() < HEADER_SIZE_MAX) {
      throw new Lz4FrameException(ErrorCode.DST_MAX_SIZE_TOO_SMALL);
    }
    FrameInfo frameInfo = preferences.frameInfo();
    if (this.compressor == null || this.compressionLevel != preferences.compressionLevel()) {
      this.compressionLevel = preferences.compressionLevel();
      this.compressor =
          compressionLevel < HIGH_COMPRESSION_LEVEL_MIN
              ? lz4Factory.fastCompressor()
              : lz4Factory.highCompressor(compressionLevel);
    }
    int blockSize = frameInfo.blockSizeId().bytes();
    if (this.inBuffer == null || this.inBuffer.length != blockSize) {
      this.inBuffer = new byte[blockSize];
      this.blockBuffer = new byte[compressor.maxCompressedLength(blockSize)];
    }

    writeIntLE(header, 0, MAGIC);
    int flg = VERSION << FLG_VERSION_SHIFT;
    if (frameInfo.blockMode() == BlockMode.INDEPENDENT) {
      flg |= FLG_BLOCK_INDEPENDENCE;
    }
    if (frameInfo.blockChecksum()) {
      flg |= FLG_BLOCK_CHECKSUM;
    }
    if (frameInfo.contentSize() != 0) {
      flg |= FLG_CONTENT_SIZE;
    }
    if (frameInfo.contentChecksum()) {
      flg |= FLG_CONTENT_CHECKSUM;
    }
    if (frameInfo.dictionaryId() != 0) {
      flg |= FLG_DICTIONARY_ID;
    }
    header[4] = (byte) flg;
    header[5] = (byte) (frameInfo.blockSizeId().code() << BD_BLOCK_SIZE_SHIFT);
    int position = 6;
    if (frameInfo.contentSize() != 0) {
      writeLongLE(header, position, frameInfo.contentSize());
      position += CONTENT_SIZE_SIZE;
    }
    if (frameInfo.dictionaryId() != 0) {
      writeIntLE(header, position, frameInfo.dictionaryId());
      position += DICTIONARY_ID_SIZE;
    }
    int descriptorChecksum = hash32.hash(header, MAGIC_SIZE, position - MAGIC_SIZE, XXHASH_SEED);
    header[position++] = (byte) (descriptorChecksum >>> 8);
    dst.put(header, 0, position);

    this.preferences = preferences;
    this.contentHash.reset();
    this.totalInSize = 0;
    this.buffered = 0;
    this.started = true;
    return position;
  }

  @Override
  public int update(ByteBuffer src, ByteBuffer dst, boolean stableSrc) throws Lz4FrameException {
    checkStarted();
    int length = src.remaining();
    if (dst.remaining() < Lz4JavaFrameEngine.compressBound(length, preferences, buffered)) {
      throw new Lz4FrameException(ErrorCode.DST_MAX_SIZE_TOO_SMALL);
    }
    // blocks are self-contained, src is never referenced once the call returns
    if (!src.hasArray()) {
      byte[] copy = new byte[length];
      src.get(copy);
      src = ByteBuffer.wrap(copy);
    }
    int start = dst.position();
    byte[] in = src.array();
    int offset = src.arrayOffset() + src.position();
    src.position(src.limit());

    if (preferences.frameInfo().contentChecksum()) {
      contentHash.update(in, offset, length);
    }
    totalInSize += length;

    int blockSize = inBuffer.length;
    if (buffered > 0) {
      int count = Math.min(blockSize - buffered, length);
      System.arraycopy(in, offset, inBuffer, buffered, count);
      buffered += count;
      offset += count;
      length -= count;
      if (buffered == blockSize) {
        writeBlock(inBuffer, 0, blockSize, dst);
        buffered = 0;
      }
    }
    while (length >= blockSize) {
      writeBlock(in, offset, blockSize, dst);
      offset += blockSize;
      length -= blockSize;
    }
    if (length > 0) {
      System.arraycopy(in, offset, inBuffer, 0, length);
      buffered = length;
    }

    if (preferences.autoFlush() && buffered > 0) {
      writeBlock(inBuffer, 0, buffered, dst);
      buffered = 0;
    }
    return dst.position() - start;
  }

  @Override
  public int flush(ByteBuffer dst) throws Lz4FrameException {
    checkNotReleased();
    if (buffered == 0) {
      return 0;
    }
    checkStarted();
    int checksumSize = preferences.frameInfo().blockChecksum() ? CHECKSUM_SIZE : 0;
    if (dst.remaining() < BLOCK_HEADER_SIZE + buffered + checksumSize) {
      throw new Lz4FrameException(ErrorCode.DST_MAX_SIZE_TOO_SMALL);
    }
    int start = dst.position();
    writeBlock(inBuffer, 0, buffered, dst);
    buffered = 0;
    return dst.position() - start;
  }

  @Override
  public int end(ByteBuffer dst) throws Lz4FrameException {
    checkStarted();
    if (dst.remaining() < Lz4JavaFrameEngine.compressBound(0, preferences, buffered)) {
      throw new Lz4FrameException(ErrorCode.DST_MAX_SIZE_TOO_SMALL);
    }
    int start = dst.position();
    flush(dst);
    putIntLE(dst, END_MARK);
    if (preferences.frameInfo().contentChecksum()) {
      putIntLE(dst, contentHash.getValue());
    }
    started = false;
    long contentSize = preferences.frameInfo().contentSize();
    if (contentSize != 0 && contentSize != totalInSize) {
      throw new Lz4FrameException(ErrorCode.FRAME_SIZE_WRONG);
    }
    return dst.position() - start;
  }

  @Override
  public void reset() {
    started = false;
    buffered = 0;
    totalInSize = 0;
    contentHash.reset();
  }

  @Override
  public void close() {
    if (!released) {
      released = true;
      started = false;
      inBuffer = null;
      blockBuffer = null;
    }
  }

  private void writeBlock(byte[] in, int offset, int length, ByteBuffer dst)
      throws Lz4FrameException {
    int compressedLength;
    try {
      compressedLength =
          compressor.compress(in, offset, length, blockBuffer, 0, blockBuffer.length);
    } catch (LZ4Exception e) {
      throw new Lz4FrameException(ErrorCode.GENERIC, e);
    }
    int checksum;
    boolean blockChecksum = preferences.frameInfo().blockChecksum();
    if (compressedLength < length) {
      putIntLE(dst, compressedLength);
      dst.put(blockBuffer, 0, compressedLength);
      checksum = blockChecksum ? hash32.hash(blockBuffer, 0, compressedLength, XXHASH_SEED) : 0;
    } else {
      // does not shrink, stored as is
      putIntLE(dst, length | UNCOMPRESSED_BLOCK_FLAG);
      dst.put(in, offset, length);
      checksum = blockChecksum ? hash32.hash(in, offset, length, XXHASH_SEED) : 0;
    }
    if (blockChecksum) {
      putIntLE(dst, checksum);
    }
  }

  private void checkStarted() throws Lz4FrameException {
    checkNotReleased();
    if (!started) {
      throw new Lz4FrameException(ErrorCode.COMPRESSION_STATE_UNINITIALIZED);
    }
  }

  private void checkNotReleased() throws Lz4FrameException {
    if (released) {
      throw new Lz4FrameException(ErrorCode.CONTEXT_RELEASED);
    }
  }
}
