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

import com.rabbitmq.lz4frame.engine.Lz4FrameEngine;
import com.rabbitmq.lz4frame.engine.Lz4FrameEngines;
import com.rabbitmq.lz4frame.engine.Preferences;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * {@link CompressionCodec} producing one LZ4 frame per compressed stream.
 *
 * <p>The streams it creates own the underlying streams, one frame is written per {@link
 * OutputStream}.
 */
public class Lz4FrameCodec implements CompressionCodec {

  private final FramePreferences preferences;
  private final Preferences enginePreferences;
  private final Lz4FrameEngine engine;

  public Lz4FrameCodec() {
    this(FramePreferences.defaults());
  }

  public Lz4FrameCodec(FramePreferences preferences) {
    this(preferences, Lz4FrameEngines.defaultEngine());
  }

  public Lz4FrameCodec(FramePreferences preferences, Lz4FrameEngine engine) {
    this.preferences = Objects.requireNonNull(preferences, "preferences");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.enginePreferences = preferences.toPreferences();
  }

  /**
   * Worst-case size of a whole frame for the source length, header included.
   *
   * @param sourceLength size of plain, uncompressed data
   * @return maximum compressed size
   */
  @Override
  public int maxCompressedLength(int sourceLength) {
    return engine.compressBound(sourceLength, enginePreferences)
        + Lz4FrameEngine.FRAME_HEADER_SIZE_MAX;
  }

  @Override
  public OutputStream compress(OutputStream target) {
    return new Lz4EncodingOutputStream(target, preferences, true, engine);
  }

  @Override
  public InputStream decompress(InputStream source) {
    return new Lz4DecodingInputStream(source, true, engine);
  }

  @Override
  public String toString() {
    return "LZ4 frame codec (" + engine + ")";
  }
}
