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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4SafeDecompressor;
import net.jpountz.xxhash.StreamingXXHash32;
import net.jpountz.xxhash.XXHash32;
import net.jpountz.xxhash.XXHashFactory;
import org.apache.commons.compress.compressors.lz4.BlockLZ4CompressorInputStream;
import org.apache.commons.compress.utils.IOUtils;

/**
 * Frame decoding state machine.
 *
 * <p>Fixed-size items (frame header, block header, compressed block, checksums) are accumulated in
 * {@code tmpIn} until complete. Uncompressed blocks are copied straight to the destination,
 * compressed blocks are decompressed to {@code tmpOut} and drained from there.
 *
 * <p>Blocks of linked frames can refer to the last 64 KiB of the frame's output, which are kept
 * in {@code window}. lz4-java rejects such references, these blocks go through Commons Compress'
 * block decoder instead.
 */
final class Lz4JavaDecompressionContext implements DecompressionContext {

  private enum Stage {
    FRAME_HEADER,
    SKIPPABLE_HEADER,
    SKIP,
    BLOCK_HEADER,
    UNCOMPRESSED_BLOCK,
    BLOCK_CHECKSUM,
    COMPRESSED_BLOCK,
    FLUSH,
    CONTENT_CHECKSUM
  }

  private final LZ4SafeDecompressor decompressor;
  private final XXHash32 hash32;
  private final StreamingXXHash32 contentHash;
  private final StreamingXXHash32 blockHash;

  private Stage stage;
  private FrameInfo frameInfo;
  private byte[] tmpIn = new byte[HEADER_SIZE_MAX];
  private int tmpInSize;
  private int tmpInTarget;
  private byte[] tmpOut;
  private int tmpOutStart;
  private int tmpOutEnd;
  private byte[] window;
  private int windowSize;
  private int blockRemaining;
  private long skipRemaining;
  private long decodedSize;
  private boolean released;

  Lz4JavaDecompressionContext(LZ4SafeDecompressor decompressor, XXHashFactory xxHashFactory) {
    this.decompressor = decompressor;
    this.hash32 = xxHashFactory.hash32();
    this.contentHash = xxHashFactory.newStreamingHash32(XXHASH_SEED);
    this.blockHash = xxHashFactory.newStreamingHash32(XXHASH_SEED);
    nextFrame();
  }

  @Override
  public int decompress(ByteBuffer src, ByteBuffer dst) throws Lz4FrameException {
    if (released) {
      throw new Lz4FrameException(ErrorCode.CONTEXT_RELEASED);
    }
    while (true) {
      switch (stage) {
        case FRAME_HEADER:
          if (!accumulate(src)) {
            return tmpInTarget - tmpInSize;
          }
          if (tmpInTarget == HEADER_SIZE_MIN) {
            int magic = readIntLE(tmpIn, 0);
            if ((magic & SKIPPABLE_MAGIC_MASK) == SKIPPABLE_MAGIC) {
              tmpInTarget = SKIPPABLE_HEADER_SIZE;
              stage = Stage.SKIPPABLE_HEADER;
              break;
            }
            if (magic != MAGIC) {
              throw new Lz4FrameException(ErrorCode.FRAME_TYPE_UNKNOWN);
            }
            int headerSize = headerSize(tmpIn[4] & 0xFF);
            if (headerSize > tmpInTarget) {
              tmpInTarget = headerSize;
              break;
            }
          }
          decodeFrameHeader();
          break;
        case SKIPPABLE_HEADER:
          if (!accumulate(src)) {
            return tmpInTarget - tmpInSize;
          }
          skipRemaining = readIntLE(tmpIn, MAGIC_SIZE) & 0xFFFFFFFFL;
          stage = Stage.SKIP;
          break;
        case SKIP:
          int skipped = (int) Math.min(src.remaining(), skipRemaining);
          src.position(src.position() + skipped);
          skipRemaining -= skipped;
          if (skipRemaining > 0) {
            return (int) Math.min(skipRemaining, Integer.MAX_VALUE);
          }
          nextFrame();
          return 0;
        case BLOCK_HEADER:
          if (!accumulate(src)) {
            return tmpInTarget - tmpInSize;
          }
          int blockHeader = readIntLE(tmpIn, 0);
          tmpInSize = 0;
          if (blockHeader == END_MARK) {
            if (frameInfo.contentChecksum()) {
              tmpInTarget = CHECKSUM_SIZE;
              stage = Stage.CONTENT_CHECKSUM;
              break;
            }
            return endFrame();
          }
          int blockSize = blockHeader & ~UNCOMPRESSED_BLOCK_FLAG;
          if (blockSize > frameInfo.blockSizeId().bytes()) {
            throw new Lz4FrameException(ErrorCode.MAX_BLOCK_SIZE_INVALID);
          }
          if ((blockHeader & UNCOMPRESSED_BLOCK_FLAG) != 0) {
            blockRemaining = blockSize;
            blockHash.reset();
            stage = Stage.UNCOMPRESSED_BLOCK;
          } else {
            tmpInTarget = blockSize + checksumSize();
            stage = Stage.COMPRESSED_BLOCK;
          }
          break;
        case UNCOMPRESSED_BLOCK:
          int count = Math.min(blockRemaining, Math.min(src.remaining(), dst.remaining()));
          if (count > 0) {
            src.get(tmpOut, 0, count);
            if (frameInfo.blockChecksum()) {
              blockHash.update(tmpOut, 0, count);
            }
            if (frameInfo.contentChecksum()) {
              contentHash.update(tmpOut, 0, count);
            }
            dst.put(tmpOut, 0, count);
            appendToWindow(tmpOut, 0, count);
            blockRemaining -= count;
            decodedSize += count;
          }
          if (blockRemaining > 0) {
            return blockRemaining + checksumSize() + BLOCK_HEADER_SIZE;
          }
          if (frameInfo.blockChecksum()) {
            tmpInTarget = CHECKSUM_SIZE;
            stage = Stage.BLOCK_CHECKSUM;
          } else {
            tmpInTarget = BLOCK_HEADER_SIZE;
            stage = Stage.BLOCK_HEADER;
          }
          break;
        case BLOCK_CHECKSUM:
          if (!accumulate(src)) {
            return tmpInTarget - tmpInSize + BLOCK_HEADER_SIZE;
          }
          if (readIntLE(tmpIn, 0) != blockHash.getValue()) {
            throw new Lz4FrameException(ErrorCode.BLOCK_CHECKSUM_INVALID);
          }
          tmpInSize = 0;
          tmpInTarget = BLOCK_HEADER_SIZE;
          stage = Stage.BLOCK_HEADER;
          break;
        case COMPRESSED_BLOCK:
          if (!accumulate(src)) {
            return tmpInTarget - tmpInSize + BLOCK_HEADER_SIZE;
          }
          decodeCompressedBlock(tmpInTarget - checksumSize());
          tmpInSize = 0;
          tmpInTarget = BLOCK_HEADER_SIZE;
          stage = Stage.FLUSH;
          break;
        case FLUSH:
          int flushed = Math.min(dst.remaining(), tmpOutEnd - tmpOutStart);
          dst.put(tmpOut, tmpOutStart, flushed);
          tmpOutStart += flushed;
          if (tmpOutStart < tmpOutEnd) {
            return BLOCK_HEADER_SIZE;
          }
          stage = Stage.BLOCK_HEADER;
          break;
        case CONTENT_CHECKSUM:
          if (!accumulate(src)) {
            return tmpInTarget - tmpInSize;
          }
          if (readIntLE(tmpIn, 0) != contentHash.getValue()) {
            throw new Lz4FrameException(ErrorCode.CONTENT_CHECKSUM_INVALID);
          }
          return endFrame();
        default:
          throw new IllegalStateException("Unknown stage: " + stage);
      }
    }
  }

  @Override
  public boolean frameInProgress() {
    return stage != Stage.FRAME_HEADER || tmpInSize > 0;
  }

  @Override
  public FrameInfo frameInfo() {
    return frameInfo;
  }

  @Override
  public void reset() {
    frameInfo = null;
    nextFrame();
  }

  @Override
  public void close() {
    if (!released) {
      released = true;
      tmpIn = null;
      tmpOut = null;
      window = null;
    }
  }

  private boolean accumulate(ByteBuffer src) {
    int count = Math.min(src.remaining(), tmpInTarget - tmpInSize);
    src.get(tmpIn, tmpInSize, count);
    tmpInSize += count;
    return tmpInSize == tmpInTarget;
  }

  private void decodeFrameHeader() throws Lz4FrameException {
    int flg = tmpIn[4] & 0xFF;
    int bd = tmpIn[5] & 0xFF;
    if ((flg >>> FLG_VERSION_SHIFT) != VERSION) {
      throw new Lz4FrameException(ErrorCode.HEADER_VERSION_WRONG);
    }
    if ((flg & FLG_RESERVED) != 0 || (bd & BD_RESERVED) != 0) {
      throw new Lz4FrameException(ErrorCode.RESERVED_FLAG_SET);
    }
    BlockSizeId blockSizeId = BlockSizeId.fromCode(bd >>> BD_BLOCK_SIZE_SHIFT);
    if (blockSizeId == null) {
      throw new Lz4FrameException(ErrorCode.MAX_BLOCK_SIZE_INVALID);
    }
    int headerSize = tmpInTarget;
    int descriptorChecksum =
        hash32.hash(tmpIn, MAGIC_SIZE, headerSize - MAGIC_SIZE - 1, XXHASH_SEED) >>> 8;
    if ((byte) descriptorChecksum != tmpIn[headerSize - 1]) {
      throw new Lz4FrameException(ErrorCode.HEADER_CHECKSUM_INVALID);
    }
    int position = 6;
    long contentSize = 0;
    if ((flg & FLG_CONTENT_SIZE) != 0) {
      contentSize = readLongLE(tmpIn, position);
      position += CONTENT_SIZE_SIZE;
      if (contentSize < 0) {
        throw new Lz4FrameException(ErrorCode.FRAME_SIZE_WRONG);
      }
    }
    int dictionaryId = 0;
    if ((flg & FLG_DICTIONARY_ID) != 0) {
      dictionaryId = readIntLE(tmpIn, position);
    }
    frameInfo =
        new FrameInfo(
            blockSizeId,
            (flg & FLG_BLOCK_INDEPENDENCE) != 0 ? BlockMode.INDEPENDENT : BlockMode.LINKED,
            (flg & FLG_CONTENT_CHECKSUM) != 0,
            (flg & FLG_BLOCK_CHECKSUM) != 0,
            contentSize,
            dictionaryId);

    int maxBlockSize = blockSizeId.bytes();
    if (tmpOut == null || tmpOut.length < maxBlockSize) {
      tmpOut = new byte[maxBlockSize];
    }
    if (tmpIn.length < maxBlockSize + CHECKSUM_SIZE) {
      tmpIn = new byte[maxBlockSize + CHECKSUM_SIZE];
    }
    if (frameInfo.blockMode() == BlockMode.LINKED && window == null) {
      window = new byte[LINKED_WINDOW_SIZE];
    }
    windowSize = 0;
    contentHash.reset();
    decodedSize = 0;
    tmpInSize = 0;
    tmpInTarget = BLOCK_HEADER_SIZE;
    stage = Stage.BLOCK_HEADER;
  }

  private void decodeCompressedBlock(int blockSize) throws Lz4FrameException {
    if (frameInfo.blockChecksum()
        && readIntLE(tmpIn, blockSize) != hash32.hash(tmpIn, 0, blockSize, XXHASH_SEED)) {
      throw new Lz4FrameException(ErrorCode.BLOCK_CHECKSUM_INVALID);
    }
    int maxBlockSize = frameInfo.blockSizeId().bytes();
    try {
      tmpOutEnd = decompressor.decompress(tmpIn, 0, blockSize, tmpOut, 0, maxBlockSize);
    } catch (LZ4Exception e) {
      if (windowSize == 0) {
        throw new Lz4FrameException(ErrorCode.DECOMPRESSION_FAILED, e);
      }
      // the block refers to the output of previous blocks
      tmpOutEnd = decompressLinked(blockSize, maxBlockSize);
    }
    appendToWindow(tmpOut, 0, tmpOutEnd);
    tmpOutStart = 0;
    if (frameInfo.contentChecksum()) {
      contentHash.update(tmpOut, 0, tmpOutEnd);
    }
    decodedSize += tmpOutEnd;
  }

  private int decompressLinked(int blockSize, int maxBlockSize) throws Lz4FrameException {
    try (BlockLZ4CompressorInputStream block =
        new BlockLZ4CompressorInputStream(new ByteArrayInputStream(tmpIn, 0, blockSize))) {
      block.prefill(Arrays.copyOf(window, windowSize));
      int decompressed = IOUtils.readFully(block, tmpOut, 0, maxBlockSize);
      if (decompressed == maxBlockSize && block.read() != -1) {
        throw new Lz4FrameException(ErrorCode.DECOMPRESSION_FAILED);
      }
      return decompressed;
    } catch (Lz4FrameException e) {
      throw e;
    } catch (IOException | RuntimeException e) {
      throw new Lz4FrameException(ErrorCode.DECOMPRESSION_FAILED, e);
    }
  }

  /** Keeps the last bytes of the output of a linked frame. */
  private void appendToWindow(byte[] data, int offset, int length) {
    if (window == null || frameInfo.blockMode() != BlockMode.LINKED || length == 0) {
      return;
    }
    if (length >= LINKED_WINDOW_SIZE) {
      System.arraycopy(data, offset + length - LINKED_WINDOW_SIZE, window, 0, LINKED_WINDOW_SIZE);
      windowSize = LINKED_WINDOW_SIZE;
      return;
    }
    int kept = Math.min(windowSize, LINKED_WINDOW_SIZE - length);
    System.arraycopy(window, windowSize - kept, window, 0, kept);
    System.arraycopy(data, offset, window, kept, length);
    windowSize = kept + length;
  }

  private int endFrame() throws Lz4FrameException {
    long contentSize = frameInfo.contentSize();
    if (contentSize != 0 && contentSize != decodedSize) {
      throw new Lz4FrameException(ErrorCode.FRAME_SIZE_WRONG);
    }
    nextFrame();
    return 0;
  }

  private void nextFrame() {
    stage = Stage.FRAME_HEADER;
    tmpInSize = 0;
    tmpInTarget = HEADER_SIZE_MIN;
    tmpOutStart = 0;
    tmpOutEnd = 0;
    blockRemaining = 0;
    skipRemaining = 0;
  }

  private int checksumSize() {
    return frameInfo.blockChecksum() ? CHECKSUM_SIZE : 0;
  }
}
