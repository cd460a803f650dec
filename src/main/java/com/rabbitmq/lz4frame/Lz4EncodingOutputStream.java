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
import com.rabbitmq.lz4frame.engine.Lz4FrameEngines;
import java.io.IOException;
import java.io.OutputStream;
import java.lang.ref.Cleaner;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link OutputStream} that compresses data in the LZ4 frame format to another stream.
 *
 * <p>The frame header is written on the first operation, {@link #close()} ends the frame. When
 * the stream does not own its sink, it stays usable after {@link #close()}: the next write starts
 * a new frame. When it owns its sink, {@link #close()} also closes the sink and the stream cannot
 * be used anymore.
 *
 * <p>Instances are not thread-safe.
 */
public class Lz4EncodingOutputStream extends OutputStream implements Rewindable {

  private static final Logger LOGGER = LoggerFactory.getLogger(Lz4EncodingOutputStream.class);

  private final OutputStream sink;
  private final boolean ownsSink;
  private final FrameEncoder encoder;
  private final StreamRewinder rewinder;
  private final Cleaner.Cleanable contextCleanable;
  private final byte[] oneByte = new byte[1];
  private boolean closed = false;

  /**
   * Creates an encoding stream with the default preferences that does not close the sink.
   *
   * @param sink where compressed data ends up
   */
  public Lz4EncodingOutputStream(OutputStream sink) {
    this(sink, FramePreferences.defaults());
  }

  /**
   * Creates an encoding stream that does not close the sink.
   *
   * @param sink where compressed data ends up
   * @param preferences the frame settings
   */
  public Lz4EncodingOutputStream(OutputStream sink, FramePreferences preferences) {
    this(sink, preferences, false);
  }

  /**
   * @param sink where compressed data ends up
   * @param preferences the frame settings
   * @param ownsSink whether {@link #close()} closes the sink
   */
  public Lz4EncodingOutputStream(
      OutputStream sink, FramePreferences preferences, boolean ownsSink) {
    this(sink, preferences, ownsSink, Lz4FrameEngines.defaultEngine());
  }

  /**
   * @param sink where compressed data ends up
   * @param preferences the frame settings
   * @param ownsSink whether {@link #close()} closes the sink
   * @param engine the codec engine
   */
  public Lz4EncodingOutputStream(
      OutputStream sink, FramePreferences preferences, boolean ownsSink, Lz4FrameEngine engine) {
    this(sink, preferences, ownsSink, engine, null);
  }

  /**
   * Creates an encoding stream writing to a file with the default preferences. The file is
   * created or truncated, and closed with the stream.
   *
   * @param path the file to write to
   * @throws IOException if the file cannot be opened
   */
  public Lz4EncodingOutputStream(Path path) throws IOException {
    this(path, FramePreferences.defaults());
  }

  /**
   * Creates an encoding stream writing to a file. The file is created or truncated, and closed
   * with the stream.
   *
   * @param path the file to write to
   * @param preferences the frame settings
   * @throws IOException if the file cannot be opened
   */
  public Lz4EncodingOutputStream(Path path, FramePreferences preferences) throws IOException {
    this(
        FileChannel.open(
            path,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE),
        preferences);
  }

  private Lz4EncodingOutputStream(FileChannel channel, FramePreferences preferences) {
    this(
        Channels.newOutputStream(channel),
        preferences,
        true,
        Lz4FrameEngines.defaultEngine(),
        StreamRewinder.forWritableChannel(channel));
  }

  private Lz4EncodingOutputStream(
      OutputStream sink,
      FramePreferences preferences,
      boolean ownsSink,
      Lz4FrameEngine engine,
      StreamRewinder rewinder) {
    this.sink = Objects.requireNonNull(sink, "sink");
    Objects.requireNonNull(preferences, "preferences");
    this.ownsSink = ownsSink;
    CompressionContext context = engine.createCompressionContext();
    this.contextCleanable = ContextCleaner.register(this, context, null);
    try {
      this.encoder = new FrameEncoder(engine, context, preferences.toPreferences());
    } catch (RuntimeException e) {
      contextCleanable.clean();
      throw e;
    }
    this.rewinder = rewinder == null ? StreamRewinder.forOutput(sink) : rewinder;
    LOGGER.debug("Created LZ4 encoding stream with {} (owns sink: {})", preferences, ownsSink);
  }

  @Override
  public void write(int b) throws IOException {
    oneByte[0] = (byte) b;
    write(oneByte, 0, 1);
  }

  @Override
  public void write(byte[] b, int off, int len) throws IOException {
    checkStream();
    encoder.write(sink, b, off, len);
  }

  /**
   * Writes the data buffered by the engine as blocks and flushes the sink, without ending the
   * frame.
   *
   * @throws IOException if the engine or the sink fails
   */
  @Override
  public void flush() throws IOException {
    checkStream();
    encoder.flush(sink);
  }

  /**
   * Ends the current frame and flushes the sink. If the stream owns the sink, the sink is closed
   * and the stream is closed for good, otherwise the next write starts a new frame.
   *
   * <p>Closing a stream that is closed for good has no effect.
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    try {
      encoder.endFrame(sink);
    } finally {
      if (ownsSink) {
        closed = true;
        try {
          sink.close();
        } finally {
          contextCleanable.clean();
        }
        LOGGER.debug("LZ4 encoding stream closed");
      }
    }
  }

  /**
   * Ends the open frame if any, resets the counters and the compression state, and goes back to
   * the start of the sink.
   *
   * @throws IOException if the sink cannot be rewound
   */
  @Override
  public void rewind() throws IOException {
    checkStream();
    encoder.reset(sink);
    rewinder.rewind();
    LOGGER.debug("LZ4 encoding stream rewound");
  }

  /**
   * Compressed bytes written to the sink since creation or the last rewind, frame headers and
   * end marks included.
   *
   * @return number of compressed bytes
   */
  public long compressedBytes() {
    return encoder.compressedBytes();
  }

  /**
   * Plain bytes written to this stream since creation or the last rewind.
   *
   * @return number of uncompressed bytes
   */
  public long uncompressedBytes() {
    return encoder.uncompressedBytes();
  }

  /**
   * Uncompressed bytes divided by compressed bytes.
   *
   * @return the ratio, 0.0 if no compressed bytes have been written
   */
  public double compressionRatio() {
    return encoder.compressionRatio();
  }

  private void checkStream() throws IOException {
    if (closed) {
      throw new IOException("Stream closed");
    }
  }
}
