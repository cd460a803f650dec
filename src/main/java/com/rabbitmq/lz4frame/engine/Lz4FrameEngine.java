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

/**
 * Codec engine doing the LZ4 frame compression and decompression work.
 *
 * @see Lz4FrameEngines
 */
public interface Lz4FrameEngine {

  /** Maximum size of a frame header, with content size and dictionary ID. */
  int FRAME_HEADER_SIZE_MAX = 19;

  /**
   * Creates a compression context. The caller owns it and must close it.
   *
   * @return a new compression context
   */
  CompressionContext createCompressionContext();

  /**
   * Creates a decompression context. The caller owns it and must close it.
   *
   * @return a new decompression context
   */
  DecompressionContext createDecompressionContext();

  /**
   * Worst-case output size of one {@link CompressionContext#update} call with {@code srcSize}
   * bytes, including data that may already be buffered and the end of the frame.
   *
   * @param srcSize size of the plain data
   * @param preferences the frame settings
   * @return the capacity a destination buffer must have
   */
  int compressBound(int srcSize, Preferences preferences);
}
