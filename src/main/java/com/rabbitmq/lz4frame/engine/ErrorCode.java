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

/**
 * Errors a codec engine can report.
 *
 * <p>The names returned by {@link #errorName()} are the ones of the reference LZ4 frame
 * implementation, so they can be matched against its documentation. {@link #CONTEXT_RELEASED} has
 * no counterpart there, it reports the use of a context after {@code close()}.
 */
public enum ErrorCode {
  GENERIC("ERROR_GENERIC"),
  MAX_BLOCK_SIZE_INVALID("ERROR_maxBlockSize_invalid"),
  HEADER_VERSION_WRONG("ERROR_headerVersion_wrong"),
  BLOCK_CHECKSUM_INVALID("ERROR_blockChecksum_invalid"),
  RESERVED_FLAG_SET("ERROR_reservedFlag_set"),
  DST_MAX_SIZE_TOO_SMALL("ERROR_dstMaxSize_tooSmall"),
  FRAME_TYPE_UNKNOWN("ERROR_frameType_unknown"),
  FRAME_SIZE_WRONG("ERROR_frameSize_wrong"),
  DECOMPRESSION_FAILED("ERROR_decompressionFailed"),
  HEADER_CHECKSUM_INVALID("ERROR_headerChecksum_invalid"),
  CONTENT_CHECKSUM_INVALID("ERROR_contentChecksum_invalid"),
  COMPRESSION_STATE_UNINITIALIZED("ERROR_compressionState_uninitialized"),
  CONTEXT_RELEASED("ERROR_context_released");

  private final String errorName;

  ErrorCode(String errorName) {
    this.errorName = errorName;
  }

  public String errorName() {
    return this.errorName;
  }
}
