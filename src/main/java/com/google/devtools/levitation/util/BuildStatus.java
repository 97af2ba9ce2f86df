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
package com.google.devtools.levitation.util;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Outcome accumulator shared by all phases and workers of a run.
 *
 * <p>The first failure wins: once the status is invalid, later failures are only logged and the
 * first error message is kept. Warnings never invalidate the status; they are buffered and
 * reported once at the end of the run.
 */
@ThreadSafe
public final class BuildStatus {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  @GuardedBy("this")
  @Nullable
  private String errorMessage;

  @GuardedBy("this")
  private final List<String> warnings = new ArrayList<>();

  public synchronized boolean isValid() {
    return errorMessage == null;
  }

  /** Marks the status as failed. Has no effect on the message if it has already failed. */
  public synchronized void setFailure(String message) {
    if (errorMessage == null) {
      errorMessage = message;
    } else {
      logger.atFine().log("Additional failure after '%s': %s", errorMessage, message);
    }
  }

  @FormatMethod
  public void setFailure(String format, Object... args) {
    setFailure(String.format(format, args));
  }

  public synchronized void addWarning(String message) {
    warnings.add(message);
  }

  @FormatMethod
  public void addWarning(String format, Object... args) {
    addWarning(String.format(format, args));
  }

  /** Copies the failure of {@code other}, if any, prefixed with {@code prefix}. */
  public void inheritResult(BuildStatus other, String prefix) {
    String otherError;
    ImmutableList<String> otherWarnings;
    synchronized (other) {
      otherError = other.errorMessage;
      otherWarnings = ImmutableList.copyOf(other.warnings);
    }
    for (String warning : otherWarnings) {
      addWarning(warning);
    }
    if (otherError != null) {
      setFailure(prefix + otherError);
    }
  }

  @Nullable
  public synchronized String getErrorMessage() {
    return errorMessage;
  }

  public synchronized boolean hasWarnings() {
    return !warnings.isEmpty();
  }

  public synchronized ImmutableList<String> getWarnings() {
    return ImmutableList.copyOf(warnings);
  }

  @Override
  public synchronized String toString() {
    return MoreObjects.toStringHelper(this)
        .add("valid", errorMessage == null)
        .add("error", errorMessage)
        .add("warnings", warnings.size())
        .toString();
  }
}
