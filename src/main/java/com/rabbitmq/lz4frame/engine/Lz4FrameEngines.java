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
package com.rabbitmq.lz4frame.engine;

import java.util.Locale;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.xxhash.XXHashFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Access to {@link Lz4FrameEngine} instances. */
public final class Lz4FrameEngines {

  private static final Logger LOGGER = LoggerFactory.getLogger(Lz4FrameEngines.class);

  /** System property to choose the LZ4 Java implementation of the default engine. */
  public static final String FACTORY_PROPERTY = "rabbitmq.lz4frame.factory";

  private static final Lz4FrameEngine DEFAULT_ENGINE =
      engine(System.getProperty(FACTORY_PROPERTY, "fastest"));

  private Lz4FrameEngines() {}

  /**
   * The engine used when none is specified.
   *
   * <p>It uses the LZ4 Java implementation set with the {@code rabbitmq.lz4frame.factory} system
   * property: {@code fastest} (default), {@code java}, {@code safe}, or {@code native}.
   *
   * @return the default engine
   */
  public static Lz4FrameEngine defaultEngine() {
    return DEFAULT_ENGINE;
  }

  /**
   * Creates an engine based on an LZ4 Java implementation.
   *
   * @param factory {@code fastest}, {@code java}, {@code safe}, or {@code native}
   * @return the engine
   */
  public static Lz4FrameEngine engine(String factory) {
    Lz4FrameEngine engine;
    switch (factory.trim().toLowerCase(Locale.ROOT)) {
      case "fastest":
        engine =
            new Lz4JavaFrameEngine(LZ4Factory.fastestInstance(), XXHashFactory.fastestInstance());
        break;
      case "java":
        engine =
            new Lz4JavaFrameEngine(
                LZ4Factory.fastestJavaInstance(), XXHashFactory.fastestJavaInstance());
        break;
      case "safe":
        engine = new Lz4JavaFrameEngine(LZ4Factory.safeInstance(), XXHashFactory.safeInstance());
        break;
      case "native":
        engine =
            new Lz4JavaFrameEngine(LZ4Factory.nativeInstance(), XXHashFactory.nativeInstance());
        break;
      default:
        throw new IllegalArgumentException("Unknown LZ4 factory: " + factory);
    }
    LOGGER.debug("Created LZ4 frame engine {}", engine);
    return engine;
  }
}
