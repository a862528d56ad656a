// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.wire;

import com.github.postbox.Client;
import com.github.postbox.ClientId;

import java.nio.ByteOrder;

/// Protocol constants for the postbox wire format. Encapsulates the frame layout knowledge shared by the codec,
/// the server and clients.
public sealed interface WireProtocol permits WireCodec {

  ByteOrder BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;

  byte SERVER_VERSION = 2;
  int MIN_CLIENT_VERSION = 1;
  int MAX_CLIENT_VERSION = 2;

  // client id(16) + version(1) + code(2) + payload size(4)
  int REQUEST_HEADER_SIZE = ClientId.SIZE + 1 + 2 + 4;
  // version(1) + code(2) + payload size(4)
  int RESPONSE_HEADER_SIZE = 1 + 2 + 4;

  int NAME_FIELD_SIZE = 255;
  int PUBLIC_KEY_SIZE = Client.PUBLIC_KEY_SIZE;
  int MESSAGE_ID_SIZE = 4;

  int REGISTER_PAYLOAD_SIZE = NAME_FIELD_SIZE + PUBLIC_KEY_SIZE;
  // recipient(16) + type(1) + content size(4)
  int SEND_PREFIX_SIZE = ClientId.SIZE + 1 + 4;
  int CLIENT_LIST_ENTRY_SIZE = ClientId.SIZE + NAME_FIELD_SIZE;
  // sender(16) + message id(4) + type(1) + content size(4)
  int PENDING_ENTRY_PREFIX_SIZE = ClientId.SIZE + MESSAGE_ID_SIZE + 1 + 4;

  int DEFAULT_MAX_PAYLOAD_SIZE = 16 * 1024 * 1024;
}
