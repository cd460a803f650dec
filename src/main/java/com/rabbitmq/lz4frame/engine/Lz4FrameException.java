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

import java.io.IOException;

/**
 * Failure reported by a codec engine.
 *
 * <p>Codec errors are not transient, the operation that raised it must not be retried with the
 * same input.
 */
public class Lz4FrameException extends IOException {

  private static final long serialVersionUID = -4273356015232189318L;

  private final ErrorCode errorCode;

  public Lz4FrameException(ErrorCode errorCode) {
    super(errorCode.errorName());
    this.errorCode = errorCode;
  }

  public Lz4FrameException(ErrorCode errorCode, Throwable cause) {
    super(errorCode.errorName(), cause);
    this.errorCode = errorCode;
  }

  /**
   * Wraps an engine failure with the operation that was in progress.
   *
   * @param operation what the caller was doing, e.g. "Failed to decompress"
   * @param cause the engine failure
   */
  public Lz4FrameException(String operation, Lz4FrameException cause) {
    super(operation + ": " + cause.errorName(), cause);
    this.errorCode = cause.errorCode;
  }

  public ErrorCode errorCode() {
    return errorCode;
  }

  public String errorName() {
    return errorCode.errorName();
  }
}
