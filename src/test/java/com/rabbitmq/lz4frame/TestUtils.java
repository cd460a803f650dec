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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Random;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

final class TestUtils {

  private static final Random RANDOM = new Random(42);

  private TestUtils() {}

  static byte[] compressibleData(int size) {
    byte[] pattern =
        IntStream.range(0, 100)
            .mapToObj(i -> UUID.randomUUID().toString())
            .flatMap(v -> Stream.of(v, v))
            .collect(Collectors.joining())
            .getBytes(StandardCharsets.UTF_8);
    byte[] data = new byte[size];
    for (int i = 0; i < size; i++) {
      data[i] = pattern[i % pattern.length];
    }
    return data;
  }

  static byte[] randomData(int size) {
    byte[] data = new byte[size];
    RANDOM.nextBytes(data);
    return data;
  }

  static byte[] compress(byte[] data, FramePreferences preferences) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (Lz4EncodingOutputStream lz4 = new Lz4EncodingOutputStream(out, preferences, true)) {
      lz4.write(data);
    }
    return out.toByteArray();
  }

  static byte[] decompress(byte[] compressed) throws IOException {
    try (InputStream in =
        new Lz4DecodingInputStream(new ByteArrayInputStream(compressed), true)) {
      return readAll(in, 8192);
    }
  }

  static byte[] readAll(InputStream in, int bufferSize) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] buffer = new byte[bufferSize];
    int read;
    while ((read = in.read(buffer)) != -1) {
      out.write(buffer, 0, read);
    }
    return out.toByteArray();
  }

  /** Returns at most {@code chunk} bytes per read call. */
  static InputStream trickle(byte[] data, int chunk) {
    return new ByteArrayInputStream(data) {
      @Override
      public synchronized int read(byte[] b, int off, int len) {
        return super.read(b, off, Math.min(len, chunk));
      }
    };
  }
}
