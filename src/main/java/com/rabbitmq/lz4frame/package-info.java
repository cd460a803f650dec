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
/**
 * Streams to read and write data in the LZ4 frame format.
 *
 * <p>{@link com.rabbitmq.lz4frame.Lz4DecodingInputStream} decompresses, {@link
 * com.rabbitmq.lz4frame.Lz4EncodingOutputStream} compresses, and {@link
 * com.rabbitmq.lz4frame.Lz4DuplexStream} does both over one transport like a socket. The frame
 * settings are set with {@link com.rabbitmq.lz4frame.FramePreferences}.
 */
package com.rabbitmq.lz4frame;
