// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// This package contains the core types of the postbox store-and-forward message server.
///
/// Clients register a name and a public key, look up each other's keys, and leave end-to-end encrypted messages in
/// each other's mailboxes. The server never interprets message content.
///
/// Key classes and interfaces in this package:
/// - 'MailboxStore': The storage contract. The server ships an H2 MVStore implementation; tests use an in-memory fake.
/// - 'RequestDispatcher': Runs one decoded request against the store inside a single transaction and returns an 'Outcome'.
/// - 'ResponseBuilder': Maps an 'Outcome' to the response frame, including the error code for each 'ErrorKind'.
/// - 'PostboxException': The root of the unchecked failures that are reported back to clients.
package com.github.postbox;
