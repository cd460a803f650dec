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

import com.rabbitmq.lz4frame.engine.CompressionContext;
import com.rabbitmq.lz4frame.engine.DecompressionContext;
import java.lang.ref.Cleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Releases the codec contexts of a stream.
 *
 * <p>The release happens once, either explicitly with {@link Cleaner.Cleanable#clean()} or when
 * the stream becomes unreachable.
 */
final class ContextCleaner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ContextCleaner.class);

  private static final Cleaner CLEANER = Cleaner.create();

  private ContextCleaner() {}

  static Cleaner.Cleanable register(
      Object stream, CompressionContext compression, DecompressionContext decompression) {
    return CLEANER.register(stream, new ReleaseAction(compression, decompression));
  }

  // must not reference the stream, or it would never become unreachable
  private static final class ReleaseAction implements Runnable {

    private final CompressionContext compression;
    private final DecompressionContext decompression;

    private ReleaseAction(CompressionContext compression, DecompressionContext decompression) {
      this.compression = compression;
      this.decompression = decompression;
    }

    @Override
    public void run() {
      try {
        if (compression != null) {
          compression.close();
        }
      } finally {
        if (decompression != null) {
          decompression.close();
        }
      }
      LOGGER.debug("Codec contexts released");
    }
  }
}
