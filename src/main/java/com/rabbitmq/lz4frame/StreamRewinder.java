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
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.FileChannel;

/** Puts an underlying stream back to its start. The strategy is chosen once, at construction. */
@FunctionalInterface
interface StreamRewinder {

  void rewind() throws IOException;

  static StreamRewinder forInput(InputStream in) {
    if (in instanceof Rewindable) {
      return ((Rewindable) in)::rewind;
    } else if (in instanceof FileInputStream) {
      return forChannel(((FileInputStream) in).getChannel());
    } else if (in instanceof ByteArrayInputStream) {
      // the initial mark is the start of the array range
      return in::reset;
    } else {
      return unsupported(in);
    }
  }

  static StreamRewinder forOutput(OutputStream out) {
    if (out instanceof Rewindable) {
      return ((Rewindable) out)::rewind;
    } else if (out instanceof FileOutputStream) {
      return forWritableChannel(((FileOutputStream) out).getChannel());
    } else if (out instanceof ByteArrayOutputStream) {
      return ((ByteArrayOutputStream) out)::reset;
    } else {
      return unsupported(out);
    }
  }

  static StreamRewinder forChannel(FileChannel channel) {
    return () -> channel.position(0);
  }

  /** Drops the content of the channel, so a new frame does not end up before stale data. */
  static StreamRewinder forWritableChannel(FileChannel channel) {
    return () -> channel.truncate(0).position(0);
  }

  private static StreamRewinder unsupported(Object stream) {
    String type = stream.getClass().getName();
    return () -> {
      throw new IOException("Cannot rewind stream of type " + type);
    };
  }
}
