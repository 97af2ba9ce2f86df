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
package com.google.devtools.levitation.concurrent;

/**
 * Per-task state handed to a task body. A task is successful only if its body explicitly calls
 * {@link #setSuccessful}; a body that returns without doing so, or throws, has failed.
 */
public final class TaskContext {
  private final TaskId taskId;
  private boolean successful;

  TaskContext(TaskId taskId) {
    this.taskId = taskId;
  }

  public TaskId getTaskId() {
    return taskId;
  }

  public void setSuccessful(boolean successful) {
    this.successful = successful;
  }

  public boolean isSuccessful() {
    return successful;
  }
}
