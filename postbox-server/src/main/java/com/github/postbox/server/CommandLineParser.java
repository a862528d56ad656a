// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.server;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Parses `--option=value`, `--option value`, `--flag`, `-o value` and `-o`. An option with no value is recorded as
/// `"true"`. Arguments that are not options are collected as positional and left to the caller to reject.
class CommandLineParser {
  private final Map<String, String> options = new HashMap<>();
  private final List<String> positional = new ArrayList<>();

  CommandLineParser parse(String[] args) {
    int i = 0;
    while (i < args.length) {
      final String arg = args[i++];
      final String name = optionName(arg);
      if (name == null) {
        positional.add(arg);
        continue;
      }
      final int equals = name.indexOf('=');
      if (arg.startsWith("--") && equals >= 0) {
        options.put(name.substring(0, equals), name.substring(equals + 1));
      } else if (i < args.length && optionName(args[i]) == null) {
        options.put(name, args[i++]);
      } else {
        options.put(name, "true");
      }
    }
    return this;
  }

  /// @return the option name without its dashes, or null if the argument is not an option.
  private static String optionName(String arg) {
    if (arg.startsWith("--")) {
      return arg.substring(2);
    }
    if (arg.startsWith("-") && arg.length() > 1) {
      return arg.substring(1);
    }
    return null;
  }

  Optional<String> option(String name) {
    return Optional.ofNullable(options.get(name));
  }

  boolean hasOption(String name) {
    return options.containsKey(name);
  }

  boolean flag(String name) {
    return option(name).map(Boolean::parseBoolean).orElse(false);
  }

  /// @throws IllegalArgumentException if the option is present but not a number.
  Optional<Long> longOption(String name) {
    return option(name).map(value -> {
      try {
        return Long.parseLong(value.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("--" + name + " expects a number but was '" + value + "'");
      }
    });
  }

  List<String> positional() {
    return List.copyOf(positional);
  }
}
