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
import com.rabbitmq.lz4frame.engine.Lz4FrameEngine;
import com.rabbitmq.lz4frame.engine.Lz4FrameException;
import com.rabbitmq.lz4frame.engine.Preferences;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Encoding state of one stream direction: the compression context, the scratch buffer, the frame
 * lifecycle and the counters.
 *
 * <p>Compressed bytes are written to the sink as soon as the context produces them.
 */
final class FrameEncoder {

  static final int CHUNK_SIZE = 64 * 1024;

  private final CompressionContext context;
  private final Preferences preferences;
  // holds the worst-case output of one chunk
  private final ByteBuffer scratch;
  private boolean headerWritten;
  private long compressedBytes;
  private long uncompressedBytes;

  FrameEncoder(Lz4FrameEngine engine, CompressionContext context, Preferences preferences) {
    this.context = context;
    this.preferences = preferences;
    this.scratch = ByteBuffer.allocate(engine.compressBound(CHUNK_SIZE, preferences));
  }

  void write(OutputStream sink, byte[] b, int off, int len) throws IOException {
    Objects.checkFromIndexSize(off, len, b.length);
    writeHeader(sink);
    boolean stableSrc = len > CHUNK_SIZE;
    int end = off + len;
    for (int position = off; position < end; position += CHUNK_SIZE) {
      int chunk = Math.min(CHUNK_SIZE, end - position);
      scratch.clear();
      try {
        context.update(ByteBuffer.wrap(b, position, chunk), scratch, stableSrc);
      } catch (Lz4FrameException e) {
        throw new Lz4FrameException("Failed to compress", e);
      }
      drain(sink);
    }
    uncompressedBytes += len;
  }

  void flush(OutputStream sink) throws IOException {
    writeHeader(sink);
    scratch.clear();
    try {
      context.flush(scratch);
    } catch (Lz4FrameException e) {
      throw new Lz4FrameException("Failed to flush", e);
    }
    drain(sink);
    sink.flush();
  }

  void endFrame(OutputStream sink) throws IOException {
    writeHeader(sink);
    scratch.clear();
    try {
      context.end(scratch);
    } catch (Lz4FrameException e) {
      throw new Lz4FrameException("Failed to end frame", e);
    }
    drain(sink);
    sink.flush();
    headerWritten = false;
  }

  /** Ends the open frame, if any, then resets the counters and the context. */
  void reset(OutputStream sink) throws IOException {
    if (headerWritten) {
      endFrame(sink);
    }
    compressedBytes = 0;
    uncompressedBytes = 0;
    context.reset();
  }

  boolean frameOpen() {
    return headerWritten;
  }

  long compressedBytes() {
    return compressedBytes;
  }

  long uncompressedBytes() {
    return uncompressedBytes;
  }

  double compressionRatio() {
    return FrameDecoder.ratio(uncompressedBytes, compressedBytes);
  }

  private void writeHeader(OutputStream sink) throws IOException {
    if (headerWritten) {
      return;
    }
    scratch.clear();
    try {
      context.begin(preferences, scratch);
    } catch (Lz4FrameException e) {
      throw new Lz4FrameException("Failed to begin compression", e);
    }
    drain(sink);
    headerWritten = true;
  }

  private void drain(OutputStream sink) throws IOException {
    int length = scratch.position();
    if (length > 0) {
      sink.write(scratch.array(), 0, length);
      compressedBytes += length;
    }
  }
}
