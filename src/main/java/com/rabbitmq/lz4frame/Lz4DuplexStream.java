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
import com.rabbitmq.lz4frame.engine.Lz4FrameEngine;
import com.rabbitmq.lz4frame.engine.Lz4FrameEngines;
import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.ref.Cleaner;
import java.net.Socket;
import java.net.SocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes LZ4 frames over one bidirectional transport.
 *
 * <p>Inbound data is decompressed, outbound data is compressed. Each direction has its own codec
 * context, buffer, counters and frame lifecycle. {@link #close()} ends the outbound frame and,
 * if the stream owns the transport, closes it.
 *
 * <p>Instances are not thread-safe, the same thread should drive both directions.
 */
public class Lz4DuplexStream implements Closeable, Flushable, Rewindable {

  private static final Logger LOGGER = LoggerFactory.getLogger(Lz4DuplexStream.class);

  private final InputStream in;
  private final OutputStream out;
  private final Closeable transport;
  private final boolean ownsTransport;
  private final Socket socket;
  private final FrameDecoder decoder;
  private final FrameEncoder encoder;
  private final StreamRewinder rewinder;
  private final Cleaner.Cleanable contextCleanable;
  private final byte[] oneByte = new byte[1];
  private final InputStream inputView = new InboundStream();
  private final OutputStream outputView = new OutboundStream();
  private boolean closed = false;

  /**
   * Creates a duplex stream over a connected socket.
   *
   * @param socket the transport
   * @param preferences the settings of outbound frames
   * @param ownsSocket whether {@link #close()} closes the socket
   * @throws IOException if the socket streams cannot be obtained
   */
  public Lz4DuplexStream(Socket socket, FramePreferences preferences, boolean ownsSocket)
      throws IOException {
    this(
        socket.getInputStream(),
        socket.getOutputStream(),
        socket,
        ownsSocket,
        preferences,
        Lz4FrameEngines.defaultEngine(),
        null,
        socket);
  }

  /**
   * Creates a duplex stream over a pair of streams. Closing the transport closes both streams.
   *
   * @param in inbound compressed data
   * @param out where outbound compressed data ends up
   * @param preferences the settings of outbound frames
   * @param ownsTransport whether {@link #close()} closes the streams
   */
  public Lz4DuplexStream(
      InputStream in, OutputStream out, FramePreferences preferences, boolean ownsTransport) {
    this(in, out, preferences, ownsTransport, Lz4FrameEngines.defaultEngine());
  }

  /**
   * Creates a duplex stream over a pair of streams. Closing the transport closes both streams.
   *
   * @param in inbound compressed data
   * @param out where outbound compressed data ends up
   * @param preferences the settings of outbound frames
   * @param ownsTransport whether {@link #close()} closes the streams
   * @param engine the codec engine
   */
  public Lz4DuplexStream(
      InputStream in,
      OutputStream out,
      FramePreferences preferences,
      boolean ownsTransport,
      Lz4FrameEngine engine) {
    this(
        in,
        out,
        closeBoth(in, out),
        ownsTransport,
        preferences,
        engine,
        rewindBoth(in, out),
        null);
  }

  /**
   * Creates a duplex stream over a file opened for reading and writing, with one position shared
   * by both directions. The file is created if it does not exist, and closed with the stream.
   *
   * @param path the file
   * @param preferences the settings of outbound frames
   * @throws IOException if the file cannot be opened
   */
  public Lz4DuplexStream(Path path, FramePreferences preferences) throws IOException {
    this(
        FileChannel.open(
            path, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE),
        preferences);
  }

  private Lz4DuplexStream(FileChannel channel, FramePreferences preferences) {
    this(
        Channels.newInputStream(channel),
        Channels.newOutputStream(channel),
        channel,
        true,
        preferences,
        Lz4FrameEngines.defaultEngine(),
        StreamRewinder.forChannel(channel),
        null);
  }

  private Lz4DuplexStream(
      InputStream in,
      OutputStream out,
      Closeable transport,
      boolean ownsTransport,
      FramePreferences preferences,
      Lz4FrameEngine engine,
      StreamRewinder rewinder,
      Socket socket) {
    this.in = Objects.requireNonNull(in, "in");
    this.out = Objects.requireNonNull(out, "out");
    Objects.requireNonNull(preferences, "preferences");
    this.transport = transport;
    this.ownsTransport = ownsTransport;
    this.socket = socket;
    CompressionContext compressionContext = engine.createCompressionContext();
    DecompressionContext decompressionContext = null;
    try {
      decompressionContext = engine.createDecompressionContext();
    } catch (RuntimeException e) {
      compressionContext.close();
      throw e;
    }
    this.contextCleanable =
        ContextCleaner.register(this, compressionContext, decompressionContext);
    try {
      this.encoder = new FrameEncoder(engine, compressionContext, preferences.toPreferences());
    } catch (RuntimeException e) {
      contextCleanable.clean();
      throw e;
    }
    this.decoder = new FrameDecoder(decompressionContext);
    this.rewinder = rewinder == null ? StreamRewinder.forInput(in) : rewinder;
    LOGGER.debug(
        "Created LZ4 duplex stream with {} (owns transport: {})", preferences, ownsTransport);
  }

  public int read() throws IOException {
    int read = read(oneByte, 0, 1);
    return read == -1 ? -1 : oneByte[0] & 0xFF;
  }

  /**
   * Reads decompressed inbound data.
   *
   * @param b destination array
   * @param off offset in the array
   * @param len maximum number of bytes to read
   * @return the number of bytes read, or -1 at the end of the inbound data
   * @throws IOException if the data is not valid or the transport fails
   * @see InputStream#read(byte[], int, int)
   */
  public int read(byte[] b, int off, int len) throws IOException {
    checkStream();
    return decoder.read(in, b, off, len);
  }

  public int read(byte[] b) throws IOException {
    return read(b, 0, b.length);
  }

  public void write(int b) throws IOException {
    oneByte[0] = (byte) b;
    write(oneByte, 0, 1);
  }

  /**
   * Compresses outbound data. Compressed bytes are written to the transport as the engine
   * produces them.
   *
   * @param b source array
   * @param off offset in the array
   * @param len number of bytes to write
   * @throws IOException if the engine or the transport fails
   */
  public void write(byte[] b, int off, int len) throws IOException {
    checkStream();
    encoder.write(out, b, off, len);
  }

  public void write(byte[] b) throws IOException {
    write(b, 0, b.length);
  }

  /**
   * Writes the outbound data buffered by the engine and flushes the transport, without ending
   * the frame.
   */
  @Override
  public void flush() throws IOException {
    checkStream();
    encoder.flush(out);
  }

  /**
   * Ends the outbound frame. If the stream owns the transport, the transport is closed and the
   * stream is closed for good, otherwise the next write starts a new frame.
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    try {
      encoder.endFrame(out);
    } finally {
      if (ownsTransport) {
        closed = true;
        try {
          transport.close();
        } finally {
          contextCleanable.clean();
        }
        LOGGER.debug("LZ4 duplex stream closed");
      }
    }
  }

  /**
   * Ends the open outbound frame if any, resets both directions and goes back to the start of
   * the transport.
   *
   * @throws IOException if the transport cannot be rewound
   */
  @Override
  public void rewind() throws IOException {
    checkStream();
    encoder.reset(out);
    decoder.reset();
    rewinder.rewind();
    LOGGER.debug("LZ4 duplex stream rewound");
  }

  /**
   * An {@link InputStream} reading the inbound data of this duplex stream. Closing it closes the
   * duplex stream.
   *
   * @return the inbound stream
   */
  public InputStream getInputStream() {
    return inputView;
  }

  /**
   * An {@link OutputStream} writing the outbound data of this duplex stream. Closing it closes
   * the duplex stream.
   *
   * @return the outbound stream
   */
  public OutputStream getOutputStream() {
    return outputView;
  }

  /**
   * @return the remote address of the socket, or {@code null} if the transport is not a socket
   */
  public SocketAddress remoteAddress() {
    return socket == null ? null : socket.getRemoteSocketAddress();
  }

  /**
   * @return the local address of the socket, or {@code null} if the transport is not a socket
   */
  public SocketAddress localAddress() {
    return socket == null ? null : socket.getLocalSocketAddress();
  }

  public long compressedBytesIn() {
    return decoder.compressedBytes();
  }

  public long uncompressedBytesIn() {
    return decoder.uncompressedBytes();
  }

  public long compressedBytesOut() {
    return encoder.compressedBytes();
  }

  public long uncompressedBytesOut() {
    return encoder.uncompressedBytes();
  }

  /**
   * Inbound uncompressed bytes divided by inbound compressed bytes.
   *
   * @return the ratio, 0.0 if no compressed bytes have been read
   */
  public double inboundCompressionRatio() {
    return decoder.compressionRatio();
  }

  /**
   * Outbound uncompressed bytes divided by outbound compressed bytes.
   *
   * @return the ratio, 0.0 if no compressed bytes have been written
   */
  public double outboundCompressionRatio() {
    return encoder.compressionRatio();
  }

  private void checkStream() throws IOException {
    if (closed) {
      throw new IOException("Stream closed");
    }
  }

  private static Closeable closeBoth(InputStream in, OutputStream out) {
    return () -> {
      try {
        out.close();
      } finally {
        in.close();
      }
    };
  }

  private static StreamRewinder rewindBoth(InputStream in, OutputStream out) {
    StreamRewinder inRewinder = StreamRewinder.forInput(in);
    StreamRewinder outRewinder = StreamRewinder.forOutput(out);
    return () -> {
      outRewinder.rewind();
      inRewinder.rewind();
    };
  }

  private final class InboundStream extends InputStream {

    @Override
    public int read() throws IOException {
      return Lz4DuplexStream.this.read();
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      return Lz4DuplexStream.this.read(b, off, len);
    }

    @Override
    public void close() throws IOException {
      Lz4DuplexStream.this.close();
    }
  }

  private final class OutboundStream extends OutputStream {

    @Override
    public void write(int b) throws IOException {
      Lz4DuplexStream.this.write(b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
      Lz4DuplexStream.this.write(b, off, len);
    }

    @Override
    public void flush() throws IOException {
      Lz4DuplexStream.this.flush();
    }

    @Override
    public void close() throws IOException {
      Lz4DuplexStream.this.close();
    }
  }
}
