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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ThreadFactory;

/**
 * Fixed-size worker pool with a recursive, reentrant task/wait primitive.
 *
 * <p>Task bodies may themselves add tasks and wait for them. A thread blocked in {@link
 * #waitForTasks} does not simply park: as long as one of the tasks it waits for is still queued,
 * it takes that task off the queue and runs it itself. Helping is restricted to the awaited tasks,
 * so a frame stacked on a thread is always a dependency of the frame below it, and waits over an
 * acyclic task structure can not deadlock regardless of the pool size. The thread that created
 * the scheduler participates the same way, which is why the pool is usually sized {@code jobs -
 * 1}.
 *
 * <p>A pool of size 0 is valid: every task then runs on a waiting thread.
 */
@ThreadSafe
public final class TaskScheduler implements AutoCloseable {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Body of a task. */
  @FunctionalInterface
  public interface Action {
    void run(TaskContext context) throws InterruptedException;
  }

  private enum State {
    PENDING,
    QUEUED,
    RUNNING,
    SUCCESSFUL,
    FAILED
  }

  private static final class Task {
    final TaskId id;
    final Action action;
    State state = State.PENDING;

    Task(TaskId id, Action action) {
      this.id = id;
      this.action = action;
    }
  }

  private final Object lock = new Object();

  @GuardedBy("lock")
  private final Deque<Task> queue = new ArrayDeque<>();

  @GuardedBy("lock")
  private final Map<TaskId, Task> tasks = new HashMap<>();

  @GuardedBy("lock")
  private long nextTaskId;

  @GuardedBy("lock")
  private int idleWorkers;

  @GuardedBy("lock")
  private boolean shutdown;

  private final ImmutableList<Thread> workers;

  public TaskScheduler(int numWorkers) {
    this(
        numWorkers,
        new ThreadFactoryBuilder().setNameFormat("levitation-worker-%d").setDaemon(true).build());
  }

  public TaskScheduler(int numWorkers, ThreadFactory threadFactory) {
    checkArgument(numWorkers >= 0, "Negative number of workers: %s", numWorkers);
    ImmutableList.Builder<Thread> builder = ImmutableList.builderWithExpectedSize(numWorkers);
    for (int i = 0; i < numWorkers; i++) {
      builder.add(threadFactory.newThread(this::workerLoop));
    }
    workers = builder.build();
    for (Thread worker : workers) {
      worker.start();
    }
    logger.atFine().log("Started task scheduler with %d worker(s)", numWorkers);
  }

  /**
   * Registers a task without starting it. Its status is {@link TaskStatus#EXECUTING} from now on,
   * and it may already be waited for; it must be started with {@link #startTask}.
   */
  public TaskId newTask(Action action) {
    checkNotNull(action);
    synchronized (lock) {
      checkState(!shutdown, "Scheduler is shut down");
      Task task = new Task(new TaskId(nextTaskId++), action);
      tasks.put(task.id, task);
      return task.id;
    }
  }

  /**
   * Starts a task registered with {@link #newTask}. With {@code sameThread} the body runs
   * synchronously on the calling thread and has finished when this method returns; otherwise it is
   * queued for the pool.
   */
  public void startTask(TaskId id, boolean sameThread) {
    Task task;
    synchronized (lock) {
      task = getTaskLocked(id);
      checkState(task.state == State.PENDING, "%s already started", id);
      if (!sameThread) {
        enqueueLocked(task);
        return;
      }
      task.state = State.RUNNING;
    }
    execute(task);
  }

  /** Adds a task to the queue, or runs it right away on this thread if {@code sameThread}. */
  @CanIgnoreReturnValue
  public TaskId addTask(Action action, boolean sameThread) {
    TaskId id = newTask(action);
    startTask(id, sameThread);
    return id;
  }

  @CanIgnoreReturnValue
  public TaskId addTask(Action action) {
    return addTask(action, /* sameThread= */ false);
  }

  /**
   * Dispatches a task to an idle worker if there is one that has not already been promised queued
   * work, and otherwise runs it on the calling thread before returning.
   */
  @CanIgnoreReturnValue
  public TaskId runTask(Action action) {
    TaskId id = newTask(action);
    Task task;
    synchronized (lock) {
      task = tasks.get(id);
      if (queue.size() < idleWorkers) {
        enqueueLocked(task);
        return id;
      }
      task.state = State.RUNNING;
    }
    execute(task);
    return id;
  }

  /**
   * Blocks until every task in {@code ids} is done, running queued ones on this thread meanwhile.
   *
   * @return whether all of the tasks were successful
   */
  public boolean waitForTasks(Collection<TaskId> ids) throws InterruptedException {
    while (true) {
      Task toRun = null;
      synchronized (lock) {
        boolean allDone = true;
        boolean allSuccessful = true;
        for (TaskId id : ids) {
          Task task = getTaskLocked(id);
          switch (task.state) {
            case SUCCESSFUL:
              break;
            case FAILED:
              allSuccessful = false;
              break;
            case QUEUED:
              if (toRun == null) {
                toRun = task;
              }
              allDone = false;
              break;
            default:
              allDone = false;
          }
        }
        if (allDone) {
          return allSuccessful;
        }
        if (toRun != null) {
          queue.remove(toRun);
          toRun.state = State.RUNNING;
        } else {
          lock.wait();
          continue;
        }
      }
      execute(toRun);
    }
  }

  /** Waits for every task registered so far. */
  public boolean waitForTasks() throws InterruptedException {
    ImmutableList<TaskId> all;
    synchronized (lock) {
      all = ImmutableList.copyOf(tasks.keySet());
    }
    return waitForTasks(all);
  }

  public TaskStatus getTaskStatus(TaskId id) {
    synchronized (lock) {
      switch (getTaskLocked(id).state) {
        case SUCCESSFUL:
          return TaskStatus.SUCCESSFUL;
        case FAILED:
          return TaskStatus.FAILED;
        default:
          return TaskStatus.EXECUTING;
      }
    }
  }

  /**
   * Stops the pool. Tasks already queued are still run by the workers before they exit; no new
   * tasks may be added.
   */
  @Override
  public void close() {
    synchronized (lock) {
      if (shutdown) {
        return;
      }
      shutdown = true;
      lock.notifyAll();
    }
    for (Thread worker : workers) {
      try {
        worker.join();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
    }
  }

  @GuardedBy("lock")
  private Task getTaskLocked(TaskId id) {
    Task task = tasks.get(id);
    checkArgument(task != null, "Unknown task %s", id);
    return task;
  }

  @GuardedBy("lock")
  private void enqueueLocked(Task task) {
    task.state = State.QUEUED;
    queue.addLast(task);
    lock.notifyAll();
  }

  private void execute(Task task) {
    TaskContext context = new TaskContext(task.id);
    try {
      task.action.run(context);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      context.setSuccessful(false);
    } catch (RuntimeException e) {
      logger.atSevere().withCause(e).log("%s crashed", task.id);
      context.setSuccessful(false);
    } finally {
      synchronized (lock) {
        task.state = context.isSuccessful() ? State.SUCCESSFUL : State.FAILED;
        lock.notifyAll();
      }
    }
  }

  private void workerLoop() {
    while (true) {
      Task task;
      synchronized (lock) {
        idleWorkers++;
        try {
          while (queue.isEmpty() && !shutdown) {
            lock.wait();
          }
        } catch (InterruptedException e) {
          logger.atFine().log("%s interrupted, exiting", Thread.currentThread().getName());
          return;
        } finally {
          idleWorkers--;
        }
        task = queue.pollFirst();
        if (task == null) {
          return;
        }
        task.state = State.RUNNING;
      }
      execute(task);
    }
  }
}
