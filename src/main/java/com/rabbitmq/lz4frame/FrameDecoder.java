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

import com.rabbitmq.lz4frame.engine.DecompressionContext;
import com.rabbitmq.lz4frame.engine.Lz4FrameException;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Decoding state of one stream direction: the decompression context, the pending input and the
 * counters.
 *
 * <p>The pending buffer is refilled from the source only once the context has consumed all of
 * it.
 */
final class FrameDecoder {

  static final int BUFFER_SIZE = 64 * 1024;

  private final DecompressionContext context;
  // bytes read from the source and not consumed yet, between position and limit
  private final ByteBuffer pending = ByteBuffer.allocate(BUFFER_SIZE);
  private long compressedBytes;
  private long uncompressedBytes;
  private boolean sourceExhausted;

  FrameDecoder(DecompressionContext context) {
    this.context = context;
    this.pending.limit(0);
  }

  /**
   * Reads with the {@link InputStream#read(byte[], int, int)} contract: -1 at the end of the
   * source, never 0 for a non-empty request.
   */
  int read(InputStream source, byte[] b, int off, int len) throws IOException {
    Objects.checkFromIndexSize(off, len, b.length);
    if (len == 0) {
      return 0;
    }
    while (true) {
      int read = decode(source, b, off, len);
      if (read > 0) {
        return read;
      }
      if (sourceExhausted && !pending.hasRemaining()) {
        if (context.frameInProgress()) {
          throw new EOFException("Unexpected end of LZ4 frame in input stream");
        }
        return -1;
      }
    }
  }

  /**
   * One pass of the decompression loop, stops when the destination is full, when a frame is
   * complete, or when the source has no more bytes for now.
   *
   * @return the number of bytes produced, possibly 0
   */
  int decode(InputStream source, byte[] b, int off, int len) throws IOException {
    if (len == 0) {
      return 0;
    }
    ByteBuffer dst = ByteBuffer.wrap(b, off, len);
    int hint = 0;
    int produced = 0;
    while (true) {
      ByteBuffer src = pending;
      if (hint > 0 && pending.remaining() > hint) {
        src = pending.duplicate();
        src.limit(pending.position() + hint);
      }
      int start = dst.position();
      try {
        hint = context.decompress(src, dst);
      } catch (Lz4FrameException e) {
        throw new Lz4FrameException("Failed to decompress", e);
      }
      pending.position(src.position());
      produced += dst.position() - start;

      if (!dst.hasRemaining() || hint == 0) {
        break;
      }
      if (!pending.hasRemaining() && refill(source) <= 0) {
        break;
      }
    }
    uncompressedBytes += produced;
    return produced;
  }

  private int refill(InputStream source) throws IOException {
    if (pending.hasRemaining()) {
      return pending.remaining();
    }
    int read = source.read(pending.array(), 0, BUFFER_SIZE);
    if (read < 0) {
      sourceExhausted = true;
      pending.position(0).limit(0);
      return 0;
    }
    sourceExhausted = false;
    pending.position(0).limit(read);
    compressedBytes += read;
    return read;
  }

  void reset() {
    pending.position(0).limit(0);
    compressedBytes = 0;
    uncompressedBytes = 0;
    sourceExhausted = false;
    context.reset();
  }

  long compressedBytes() {
    return compressedBytes;
  }

  long uncompressedBytes() {
    return uncompressedBytes;
  }

  double compressionRatio() {
    return ratio(uncompressedBytes, compressedBytes);
  }

  static double ratio(long uncompressedBytes, long compressedBytes) {
    return compressedBytes == 0 ? 0.0 : (double) uncompressedBytes / compressedBytes;
  }
}
