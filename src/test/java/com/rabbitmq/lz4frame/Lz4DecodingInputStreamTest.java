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
import static com.rabbitmq.lz4frame.TestUtils.randomData;
import static com.rabbitmq.lz4frame.TestUtils.readAll;
import static com.rabbitmq.lz4frame.TestUtils.trickle;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.lz4frame.engine.DecompressionContext;
import com.rabbitmq.lz4frame.engine.ErrorCode;
import com.rabbitmq.lz4frame.engine.Lz4FrameEngine;
import com.rabbitmq.lz4frame.engine.Lz4FrameException;
import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.apache.commons.compress.compressors.lz4.FramedLZ4CompressorOutputStream;
import org.apache.commons.compress.compressors.lz4.FramedLZ4CompressorOutputStream.BlockSize;
import org.apache.commons.compress.compressors.lz4.FramedLZ4CompressorOutputStream.Parameters;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class Lz4DecodingInputStreamTest {

  static final byte[] PLAIN = compressibleData(300_000);

  @TempDir Path tempDir;

  @ParameterizedTest
  @ValueSource(ints = {1, 7, 100, 4096, 65_536, 1_000_000})
  void destinationSmallerOrLargerThanBlocks(int bufferSize) throws Exception {
    byte[] compressed = compress(PLAIN, FramePreferences.builder().contentChecksum(true).build());
    try (InputStream in = new Lz4DecodingInputStream(new ByteArrayInputStream(compressed))) {
      assertThat(readAll(in, bufferSize)).isEqualTo(PLAIN);
    }
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 100, 65_536})
  void framesWithDependentBlocks(int chunk) throws Exception {
    byte[] pattern = randomData(40_000);
    ByteArrayOutputStream plain = new ByteArrayOutputStream();
    ByteArrayOutputStream compressed = new ByteArrayOutputStream();
    try (OutputStream lz4 =
        new FramedLZ4CompressorOutputStream(
            compressed, new Parameters(BlockSize.K64, true, false, true))) {
      for (int i = 0; i < 5; i++) {
        lz4.write(pattern);
        plain.write(pattern);
      }
    }
    try (Lz4DecodingInputStream in =
        new Lz4DecodingInputStream(trickle(compressed.toByteArray(), chunk))) {
      assertThat(readAll(in, 4096)).isEqualTo(plain.toByteArray());
      assertThat(in.compressedBytes()).isEqualTo(compressed.size());
    }
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 3, 5000})
  void sourceReturningFewBytesAtATime(int chunk) throws Exception {
    byte[] data = randomData(150_000);
    FramePreferences preferences =
        FramePreferences.builder().blockChecksum(true).contentChecksum(true).build();
    byte[] compressed = compress(data, preferences);
    try (InputStream in = new Lz4DecodingInputStream(trickle(compressed, chunk))) {
      assertThat(readAll(in, 10_000)).isEqualTo(data);
    }
  }

  @Test
  void singleByteReads() throws Exception {
    byte[] data = compressibleData(1000);
    byte[] compressed = compress(data, FramePreferences.defaults());
    try (InputStream in = new Lz4DecodingInputStream(new ByteArrayInputStream(compressed))) {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      int b;
      while ((b = in.read()) != -1) {
        out.write(b);
      }
      assertThat(out.toByteArray()).isEqualTo(data);
    }
  }

  @Test
  void emptyDestinationIsNoOp() throws Exception {
    byte[] compressed = compress(PLAIN, FramePreferences.defaults());
    try (Lz4DecodingInputStream in =
        new Lz4DecodingInputStream(new ByteArrayInputStream(compressed))) {
      assertThat(in.read(new byte[10], 5, 0)).isZero();
      assertThat(in.compressedBytes()).isZero();
      assertThatThrownBy(() -> in.read(new byte[10], 5, 6))
          .isInstanceOf(IndexOutOfBoundsException.class);
    }
  }

  @Test
  void emptyFrameAndEmptySource() throws Exception {
    byte[] compressed = compress(new byte[0], FramePreferences.defaults());
    try (InputStream in = new Lz4DecodingInputStream(new ByteArrayInputStream(compressed))) {
      assertThat(in.read(new byte[10])).isEqualTo(-1);
    }
    try (InputStream in = new Lz4DecodingInputStream(new ByteArrayInputStream(new byte[0]))) {
      assertThat(in.read()).isEqualTo(-1);
      assertThat(in.read()).isEqualTo(-1);
    }
  }

  @Test
  void concatenatedFramesAreReadAsOneStream() throws Exception {
    byte[] first = compressibleData(70_000);
    byte[] second = randomData(10);
    byte[] empty = compress(new byte[0], FramePreferences.defaults());
    ByteArrayOutputStream frames = new ByteArrayOutputStream();
    frames.write(compress(first, FramePreferences.defaults()));
    frames.write(empty);
    frames.write(compress(second, FramePreferences.builder().linked(false).build()));

    ByteArrayOutputStream expected = new ByteArrayOutputStream();
    expected.write(first);
    expected.write(second);
    try (InputStream in =
        new Lz4DecodingInputStream(new ByteArrayInputStream(frames.toByteArray()))) {
      assertThat(readAll(in, 1000)).isEqualTo(expected.toByteArray());
    }
  }

  @Test
  void countersAndRatio() throws Exception {
    byte[] compressed = compress(PLAIN, FramePreferences.defaults());
    try (Lz4DecodingInputStream in =
        new Lz4DecodingInputStream(new ByteArrayInputStream(compressed))) {
      assertThat(in.compressionRatio()).isZero();
      readAll(in, 8192);
      assertThat(in.uncompressedBytes()).isEqualTo(PLAIN.length);
      assertThat(in.compressedBytes()).isEqualTo(compressed.length);
      assertThat(in.compressionRatio())
          .isEqualTo((double) PLAIN.length / compressed.length)
          .isGreaterThan(1.0);
    }
  }

  @Test
  void corruptedMagicFailsWithEngineError() throws Exception {
    byte[] compressed = compress(PLAIN, FramePreferences.defaults());
    compressed[1] ^= 0xFF;
    try (InputStream in = new Lz4DecodingInputStream(new ByteArrayInputStream(compressed))) {
      assertThatThrownBy(() -> readAll(in, 8192))
          .isInstanceOf(Lz4FrameException.class)
          .hasMessage("Failed to decompress: ERROR_frameType_unknown")
          .extracting(e -> ((Lz4FrameException) e).errorCode())
          .isEqualTo(ErrorCode.FRAME_TYPE_UNKNOWN);
    }
  }

  @Test
  void corruptedBlockChecksumFailsWithEngineError() throws Exception {
    byte[] compressed = compress(PLAIN, FramePreferences.builder().blockChecksum(true).build());
    int firstBlockSize =
        (compressed[7] & 0xFF) | (compressed[8] & 0xFF) << 8 | (compressed[9] & 0xFF) << 16;
    // last byte of the first block checksum
    compressed[7 + 4 + firstBlockSize + 3] ^= 0x01;
    try (InputStream in = new Lz4DecodingInputStream(new ByteArrayInputStream(compressed))) {
      assertThatThrownBy(() -> readAll(in, 8192))
          .isInstanceOf(Lz4FrameException.class)
          .hasMessageContaining("ERROR_blockChecksum_invalid");
    }
  }

  @Test
  void truncatedFrameFailsWithEofException() throws Exception {
    byte[] compressed = compress(PLAIN, FramePreferences.defaults());
    byte[] truncated = Arrays.copyOf(compressed, compressed.length - 10);
    try (InputStream in = new Lz4DecodingInputStream(new ByteArrayInputStream(truncated))) {
      assertThatThrownBy(() -> readAll(in, 8192)).isInstanceOf(EOFException.class);
    }
  }

  @Test
  void rewindReadsFromTheStartAgain() throws Exception {
    byte[] compressed = compress(PLAIN, FramePreferences.defaults());
    try (Lz4DecodingInputStream in =
        new Lz4DecodingInputStream(new ByteArrayInputStream(compressed))) {
      byte[] start = new byte[1000];
      assertThat(in.read(start)).isPositive();
      in.rewind();
      assertThat(in.compressedBytes()).isZero();
      assertThat(in.uncompressedBytes()).isZero();
      assertThat(readAll(in, 5000)).isEqualTo(PLAIN);
    }
  }

  @Test
  void bufferedSourceDoesNotRetainReadData() throws Exception {
    byte[] plain = randomData(3_000_000);
    byte[] compressed = compress(plain, FramePreferences.defaults());
    class InspectableBufferedInputStream extends BufferedInputStream {

      InspectableBufferedInputStream(InputStream in) {
        super(in);
      }

      int bufferSize() {
        return buf.length;
      }
    }
    InspectableBufferedInputStream source =
        new InspectableBufferedInputStream(new ByteArrayInputStream(compressed));
    try (Lz4DecodingInputStream in = new Lz4DecodingInputStream(source)) {
      assertThat(readAll(in, 65_536)).isEqualTo(plain);
      assertThat(source.bufferSize()).isLessThan(1_000_000);
      assertThatThrownBy(in::rewind)
          .isInstanceOf(IOException.class)
          .hasMessageContaining(InspectableBufferedInputStream.class.getName());
    }
  }

  @Test
  void rewindUnsupportedStreamFails() throws Exception {
    byte[] compressed = compress(PLAIN, FramePreferences.defaults());
    InputStream source =
        new FilterInputStream(new ByteArrayInputStream(compressed)) {
          @Override
          public boolean markSupported() {
            return false;
          }
        };
    try (Lz4DecodingInputStream in = new Lz4DecodingInputStream(source)) {
      assertThatThrownBy(in::rewind).isInstanceOf(IOException.class);
    }
  }

  @Test
  void pathSourceIsOwnedAndRewindable() throws Exception {
    Path file = tempDir.resolve("data.lz4");
    Files.write(file, compress(PLAIN, FramePreferences.defaults()));
    Lz4DecodingInputStream in = new Lz4DecodingInputStream(file);
    assertThat(readAll(in, 10_000)).isEqualTo(PLAIN);
    in.rewind();
    assertThat(readAll(in, 10_000)).isEqualTo(PLAIN);
    in.close();
    assertThatThrownBy(in::read).isInstanceOf(IOException.class).hasMessage("Stream closed");
  }

  @Test
  void closeClosesSourceOnlyIfOwned() throws Exception {
    InputStream notOwned = mock(InputStream.class);
    new Lz4DecodingInputStream(notOwned).close();
    verify(notOwned, never()).close();

    InputStream owned = mock(InputStream.class);
    Lz4DecodingInputStream in = new Lz4DecodingInputStream(owned, true);
    in.close();
    in.close();
    verify(owned, times(1)).close();
  }

  @Test
  void contextIsReleasedOnceEvenIfSourceFailsToClose() throws Exception {
    Lz4FrameEngine engine = mock(Lz4FrameEngine.class);
    DecompressionContext context = mock(DecompressionContext.class);
    when(engine.createDecompressionContext()).thenReturn(context);
    InputStream source = mock(InputStream.class);
    doThrow(new IOException("boom")).when(source).close();

    Lz4DecodingInputStream in = new Lz4DecodingInputStream(source, true, engine);
    assertThatThrownBy(in::close).isInstanceOf(IOException.class).hasMessage("boom");
    in.close();
    verify(context, times(1)).close();
  }

  @Test
  void hintLimitsWhatIsFedToTheEngine() throws Exception {
    Lz4FrameEngine engine = mock(Lz4FrameEngine.class);
    DecompressionContext context = mock(DecompressionContext.class);
    when(engine.createDecompressionContext()).thenReturn(context);
    int[] fed = new int[3];
    int[] call = new int[1];
    when(context.decompress(any(), any()))
        .thenAnswer(
            invocation -> {
              ByteBuffer src = invocation.getArgument(0);
              ByteBuffer dst = invocation.getArgument(1);
              int index = call[0]++;
              if (index == 0) {
                return 7;
              }
              fed[index - 1] = src.remaining();
              src.position(src.limit());
              dst.put((byte) index);
              return index == 3 ? 0 : 7;
            });

    try (Lz4DecodingInputStream in =
        new Lz4DecodingInputStream(new ByteArrayInputStream(new byte[100]), false, engine)) {
      byte[] b = new byte[10];
      assertThat(in.read(b)).isEqualTo(3);
      // 100 bytes available, only the hinted 7 are handed over each time
      assertThat(fed).containsExactly(7, 7, 7);
      assertThat(in.compressedBytes()).isEqualTo(100);
      assertThat(in.uncompressedBytes()).isEqualTo(3);
    }
  }
}
