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
import com.rabbitmq.lz4frame.engine.Lz4FrameEngine;
import com.rabbitmq.lz4frame.engine.Lz4FrameEngines;
import java.io.IOException;
import java.io.InputStream;
import java.lang.ref.Cleaner;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link InputStream} that decompresses data in the LZ4 frame format read from another stream.
 *
 * <p>Concatenated frames are read as one stream, skippable frames are ignored.
 *
 * <p>Instances are not thread-safe.
 */
public class Lz4DecodingInputStream extends InputStream implements Rewindable {

  private static final Logger LOGGER = LoggerFactory.getLogger(Lz4DecodingInputStream.class);

  private final InputStream source;
  private final boolean ownsSource;
  private final FrameDecoder decoder;
  private final StreamRewinder rewinder;
  private final Cleaner.Cleanable contextCleanable;
  private final byte[] oneByte = new byte[1];
  private boolean closed = false;

  /**
   * Creates a decoding stream that does not close the source.
   *
   * @param source the compressed data
   */
  public Lz4DecodingInputStream(InputStream source) {
    this(source, false);
  }

  /**
   * @param source the compressed data
   * @param ownsSource whether {@link #close()} closes the source
   */
  public Lz4DecodingInputStream(InputStream source, boolean ownsSource) {
    this(source, ownsSource, Lz4FrameEngines.defaultEngine());
  }

  /**
   * @param source the compressed data
   * @param ownsSource whether {@link #close()} closes the source
   * @param engine the codec engine
   */
  public Lz4DecodingInputStream(InputStream source, boolean ownsSource, Lz4FrameEngine engine) {
    this(source, ownsSource, engine, null);
  }

  /**
   * Creates a decoding stream reading a file. The file is closed with the stream.
   *
   * @param path the compressed file
   * @throws IOException if the file cannot be opened
   */
  public Lz4DecodingInputStream(Path path) throws IOException {
    this(FileChannel.open(path, StandardOpenOption.READ), Lz4FrameEngines.defaultEngine());
  }

  private Lz4DecodingInputStream(FileChannel channel, Lz4FrameEngine engine) {
    this(Channels.newInputStream(channel), true, engine, StreamRewinder.forChannel(channel));
  }

  private Lz4DecodingInputStream(
      InputStream source, boolean ownsSource, Lz4FrameEngine engine, StreamRewinder rewinder) {
    this.source = Objects.requireNonNull(source, "source");
    this.ownsSource = ownsSource;
    DecompressionContext context = engine.createDecompressionContext();
    this.contextCleanable = ContextCleaner.register(this, null, context);
    this.decoder = new FrameDecoder(context);
    this.rewinder = rewinder == null ? StreamRewinder.forInput(source) : rewinder;
    LOGGER.debug("Created LZ4 decoding stream (owns source: {})", ownsSource);
  }

  @Override
  public int read() throws IOException {
    int read = read(oneByte, 0, 1);
    return read == -1 ? -1 : oneByte[0] & 0xFF;
  }

  @Override
  public int read(byte[] b, int off, int len) throws IOException {
    checkStream();
    return decoder.read(source, b, off, len);
  }

  /**
   * Goes back to the start of the source and discards all the decoding state, including the
   * counters.
   *
   * @throws IOException if the source cannot be rewound
   */
  @Override
  public void rewind() throws IOException {
    checkStream();
    rewinder.rewind();
    decoder.reset();
    LOGGER.debug("LZ4 decoding stream rewound");
  }

  /**
   * Closes this stream and releases its decompression context. The source is closed only if the
   * stream owns it.
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    try {
      if (ownsSource) {
        source.close();
      }
    } finally {
      contextCleanable.clean();
    }
    LOGGER.debug("LZ4 decoding stream closed");
  }

  /**
   * Compressed bytes read from the source since creation or the last rewind.
   *
   * @return number of compressed bytes
   */
  public long compressedBytes() {
    return decoder.compressedBytes();
  }

  /**
   * Decompressed bytes returned since creation or the last rewind.
   *
   * @return number of uncompressed bytes
   */
  public long uncompressedBytes() {
    return decoder.uncompressedBytes();
  }

  /**
   * Uncompressed bytes divided by compressed bytes.
   *
   * @return the ratio, 0.0 if no compressed bytes have been read
   */
  public double compressionRatio() {
    return decoder.compressionRatio();
  }

  private void checkStream() throws IOException {
    if (closed) {
      throw new IOException("Stream closed");
    }
  }
}
