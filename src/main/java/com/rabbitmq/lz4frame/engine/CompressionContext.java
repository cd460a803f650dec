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
 * Stateful compression of one frame at a time.
 *
 * <p>All the methods write to the destination buffer from its position and return the number of
 * bytes written, the position of the destination is advanced by the same amount. The destination
 * must have at least {@link Lz4FrameEngine#compressBound(int, Preferences)} bytes remaining for
 * the size of the data passed in.
 *
 * <p>Instances are not thread-safe.
 */
public interface CompressionContext extends AutoCloseable {

  /**
   * Starts a new frame and writes its header.
   *
   * @param preferences the frame settings
   * @param dst where to write the header
   * @return the number of bytes written
   * @throws Lz4FrameException if the destination is too small
   */
  int begin(Preferences preferences, ByteBuffer dst) throws Lz4FrameException;

  /**
   * Compresses data. The data may be buffered internally until a block is full.
   *
   * @param src the plain data, consumed entirely
   * @param dst where to write the compressed blocks
   * @param stableSrc whether the source bytes stay untouched until the next call
   * @return the number of bytes written, possibly 0
   * @throws Lz4FrameException if no frame was started or the destination is too small
   */
  int update(ByteBuffer src, ByteBuffer dst, boolean stableSrc) throws Lz4FrameException;

  /**
   * Compresses the buffered data, if any, without ending the frame.
   *
   * @param dst where to write the compressed block
   * @return the number of bytes written, possibly 0
   * @throws Lz4FrameException if the destination is too small
   */
  int flush(ByteBuffer dst) throws Lz4FrameException;

  /**
   * Compresses the buffered data and writes the end of the frame.
   *
   * @param dst where to write the last block and the frame terminator
   * @return the number of bytes written
   * @throws Lz4FrameException if no frame was started or the declared content size does not
   *     match
   */
  int end(ByteBuffer dst) throws Lz4FrameException;

  /** Drops the frame in progress, if any. The context can then begin a new frame. */
  void reset();

  /** Releases the context. The context cannot be used afterwards. */
  @Override
  void close();
}
