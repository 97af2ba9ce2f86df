// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package com.google.devtools.levitation.frontend;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import javax.annotation.Nullable;

/**
 * Fully expanded argument vector of a frontend command. The first argument is the executable.
 *
 * <p>Built with {@link #builder}; {@code key=value} arguments are spelled the way the compiler
 * driver expects them, e.g. {@code -cppl-deps-out=build/a.ldeps}.
 */
public final class CommandLine {
  private static final Joiner SPACE_JOINER = Joiner.on(' ');

  private final ImmutableList<String> arguments;

  private CommandLine(ImmutableList<String> arguments) {
    this.arguments = arguments;
  }

  public static Builder builder(String executable) {
    return new Builder(executable);
  }

  public ImmutableList<String> arguments() {
    return arguments;
  }

  public String getExecutable() {
    return arguments.get(0);
  }

  @Override
  public String toString() {
    return SPACE_JOINER.join(arguments);
  }

  /** Appends arguments in order. */
  public static final class Builder {
    private final ImmutableList.Builder<String> arguments = ImmutableList.builder();

    private Builder(String executable) {
      checkArgument(!executable.isEmpty(), "Empty executable");
      arguments.add(executable);
    }

    public Builder add(String arg) {
      arguments.add(checkNotNull(arg));
      return this;
    }

    public Builder add(Path path) {
      return add(path.toString());
    }

    public Builder addAll(Iterable<String> args) {
      arguments.addAll(args);
      return this;
    }

    public Builder addPaths(Iterable<Path> paths) {
      for (Path path : paths) {
        add(path);
      }
      return this;
    }

    /** Adds {@code key=value}. */
    public Builder addKeyValue(String key, Object value) {
      return add(key + "=" + value);
    }

    /** Adds {@code key=value} unless the value is null or empty. */
    public Builder addKeyValueIfNotEmpty(String key, @Nullable Object value) {
      if (value == null || value.toString().isEmpty()) {
        return this;
      }
      return addKeyValue(key, value);
    }

    /** Adds {@code key=value} once per value. */
    public Builder addKeyValues(String key, Iterable<?> values) {
      for (Object value : values) {
        addKeyValue(key, value);
      }
      return this;
    }

    /** Adds {@code flag} and {@code value} as two separate arguments. */
    public Builder addFlagAndValue(String flag, Object value) {
      return add(flag).add(value.toString());
    }

    public CommandLine build() {
      return new CommandLine(arguments.build());
    }
  }
}
