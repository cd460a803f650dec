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

import static com.rabbitmq.lz4frame.TestUtils.compress;
import static com.rabbitmq.lz4frame.TestUtils.compressibleData;
import static com.rabbitmq.lz4frame.TestUtils.decompress;
import static com.rabbitmq.lz4frame.TestUtils.readAll;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.lz4frame.engine.CompressionContext;
import com.rabbitmq.lz4frame.engine.DecompressionContext;
import com.rabbitmq.lz4frame.engine.Lz4FrameEngine;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class Lz4DuplexStreamTest {

  static final byte[] PLAIN = compressibleData(200_000);

  @TempDir Path tempDir;

  @Test
  void directionsAreIndependent() throws Exception {
    byte[] inbound = compressibleData(50_000);
    byte[] compressedInbound = compress(inbound, FramePreferences.defaults());
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    Lz4DuplexStream duplex =
        new Lz4DuplexStream(
            new ByteArrayInputStream(compressedInbound), out, FramePreferences.defaults(), false);

    duplex.write(PLAIN);
    assertThat(readAll(duplex.getInputStream(), 1000)).isEqualTo(inbound);
    duplex.close();

    assertThat(duplex.uncompressedBytesIn()).isEqualTo(inbound.length);
    assertThat(duplex.compressedBytesIn()).isEqualTo(compressedInbound.length);
    assertThat(duplex.uncompressedBytesOut()).isEqualTo(PLAIN.length);
    assertThat(duplex.compressedBytesOut()).isEqualTo(out.size());
    assertThat(duplex.inboundCompressionRatio())
        .isEqualTo((double) inbound.length / compressedInbound.length);
    assertThat(duplex.outboundCompressionRatio()).isEqualTo((double) PLAIN.length / out.size());
    assertThat(decompress(out.toByteArray())).isEqualTo(PLAIN);
    assertThat(duplex.remoteAddress()).isNull();
    assertThat(duplex.localAddress()).isNull();
  }

  @Test
  void ratiosAreZeroBeforeAnyTraffic() {
    Lz4DuplexStream duplex =
        new Lz4DuplexStream(
            new ByteArrayInputStream(new byte[0]),
            new ByteArrayOutputStream(),
            FramePreferences.defaults(),
            false);
    assertThat(duplex.inboundCompressionRatio()).isZero();
    assertThat(duplex.outboundCompressionRatio()).isZero();
  }

  @Test
  void pathTransportSharesOnePosition() throws Exception {
    Path file = tempDir.resolve("duplex.lz4");
    Lz4DuplexStream duplex = new Lz4DuplexStream(file, FramePreferences.defaults());
    duplex.getOutputStream().write(PLAIN);
    duplex.rewind();
    assertThat(duplex.compressedBytesOut()).isZero();
    assertThat(duplex.uncompressedBytesOut()).isZero();
    assertThat(readAll(duplex.getInputStream(), 4096)).isEqualTo(PLAIN);
    assertThat(duplex.uncompressedBytesIn()).isEqualTo(PLAIN.length);
    duplex.close();
    assertThatThrownBy(() -> duplex.read(new byte[10], 0, 10))
        .isInstanceOf(IOException.class)
        .hasMessage("Stream closed");
    assertThatThrownBy(() -> duplex.write(1)).isInstanceOf(IOException.class);
    // the close appended an empty frame
    try (Lz4DecodingInputStream in = new Lz4DecodingInputStream(file)) {
      assertThat(in.readAllBytes()).isEqualTo(PLAIN);
    }
  }

  @Test
  void rewindResetsBothDirectionsOfStreamPair() throws Exception {
    byte[] compressedInbound = compress(PLAIN, FramePreferences.defaults());
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    Lz4DuplexStream duplex =
        new Lz4DuplexStream(
            new ByteArrayInputStream(compressedInbound), out, FramePreferences.defaults(), false);
    duplex.write(PLAIN);
    byte[] start = new byte[100];
    assertThat(duplex.read(start)).isPositive();

    duplex.rewind();
    assertThat(out.size()).isZero();
    assertThat(duplex.compressedBytesIn()).isZero();
    assertThat(duplex.uncompressedBytesIn()).isZero();
    assertThat(duplex.compressedBytesOut()).isZero();
    assertThat(duplex.uncompressedBytesOut()).isZero();
    assertThat(readAll(duplex.getInputStream(), 4096)).isEqualTo(PLAIN);
  }

  @Test
  void closeClosesTransportOnlyIfOwned() throws Exception {
    InputStream in = mock(InputStream.class);
    OutputStream out = mock(OutputStream.class);
    Lz4DuplexStream duplex = new Lz4DuplexStream(in, out, FramePreferences.defaults(), false);
    duplex.close();
    verify(in, never()).close();
    verify(out, never()).close();
    duplex.write(1);

    duplex = new Lz4DuplexStream(in, out, FramePreferences.defaults(), true);
    duplex.close();
    duplex.close();
    verify(in, times(1)).close();
    verify(out, times(1)).close();
  }

  @Test
  void contextsAreReleasedOnceOnOwnedClose() throws Exception {
    Lz4FrameEngine engine = mock(Lz4FrameEngine.class);
    CompressionContext compression = mock(CompressionContext.class);
    DecompressionContext decompression = mock(DecompressionContext.class);
    when(engine.createCompressionContext()).thenReturn(compression);
    when(engine.createDecompressionContext()).thenReturn(decompression);
    when(engine.compressBound(anyInt(), any())).thenReturn(1024);

    Lz4DuplexStream duplex =
        new Lz4DuplexStream(
            mock(InputStream.class),
            mock(OutputStream.class),
            FramePreferences.defaults(),
            true,
            engine);
    duplex.close();
    duplex.getOutputStream().close();
    verify(compression, times(1)).close();
    verify(decompression, times(1)).close();
  }

  @Test
  void socketCannotBeRewound() throws Exception {
    try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        Socket socket = new Socket(InetAddress.getLoopbackAddress(), server.getLocalPort())) {
      Lz4DuplexStream duplex = new Lz4DuplexStream(socket, FramePreferences.defaults(), false);
      assertThatThrownBy(duplex::rewind)
          .isInstanceOf(IOException.class)
          .hasMessageContaining("Cannot rewind");
      duplex.close();
      assertThat(socket.isClosed()).isFalse();
    }
  }

  @Test
  void socketEcho() throws Exception {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      Future<Long> echo =
          executor.submit(
              () -> {
                try (Socket socket = server.accept()) {
                  return socket.getInputStream().transferTo(socket.getOutputStream());
                }
              });
      Socket socket = new Socket(InetAddress.getLoopbackAddress(), server.getLocalPort());
      Lz4DuplexStream duplex = new Lz4DuplexStream(socket, FramePreferences.defaults(), true);
      assertThat(duplex.remoteAddress()).isEqualTo(socket.getRemoteSocketAddress());
      assertThat(duplex.localAddress()).isEqualTo(socket.getLocalSocketAddress());

      byte[] message = compressibleData(10_000);
      duplex.write(message);
      duplex.flush();
      byte[] received = new byte[message.length];
      int offset = 0;
      while (offset < message.length) {
        int read = duplex.read(received, offset, message.length - offset);
        assertThat(read).isPositive();
        offset += read;
      }
      assertThat(received).isEqualTo(message);
      assertThat(duplex.uncompressedBytesIn()).isEqualTo(message.length);
      long sent = duplex.compressedBytesOut();

      duplex.close();
      assertThat(socket.isClosed()).isTrue();
      // the echo also got the end of the frame
      assertThat(echo.get(10, TimeUnit.SECONDS)).isGreaterThan(sent);
    } finally {
      executor.shutdownNow();
    }
  }
}
