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

/**
 * Stateful, incremental decompression of frames.
 *
 * <p>Instances are not thread-safe.
 */
public interface DecompressionContext extends AutoCloseable {

  /**
   * Decompresses as much as possible.
   *
   * <p>The context consumes bytes from {@code src} and produces bytes in {@code dst}, the
   * positions of both buffers are advanced accordingly. Either may be left with remaining bytes:
   * the context stops when the destination is full, when the source is exhausted, or when a frame
   * is complete.
   *
   * @param src compressed data
   * @param dst where to write decompressed data
   * @return how many more input bytes the context expects to make progress, an advisory value,
   *     or 0 when a frame is complete and all its content has been produced
   * @throws Lz4FrameException if the data is not a valid frame
   */
  int decompress(ByteBuffer src, ByteBuffer dst) throws Lz4FrameException;

  /**
   * Whether the context has consumed part of a frame it has not finished decoding.
   *
   * @return true if a frame is partially decoded
   */
  boolean frameInProgress();

  /**
   * The descriptor of the frame being decoded.
   *
   * @return the frame info, or {@code null} if no frame header has been decoded yet
   */
  FrameInfo frameInfo();

  /** Drops the decoding state, the next byte is expected to be the start of a frame. */
  void reset();

  /** Releases the context. The context cannot be used afterwards. */
  @Override
  void close();
}
