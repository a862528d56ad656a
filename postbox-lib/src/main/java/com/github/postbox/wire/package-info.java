// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The binary wire format. See [com.github.postbox.wire.WireCodec] for the frame layouts.
package com.github.postbox.wire;
