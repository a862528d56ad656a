// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// H2 MVStore persistence for the mailbox.
package com.github.postbox.store;
