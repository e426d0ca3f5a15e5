package com.mesosphere.master.state;

import org.apache.mesos.Protos;

import java.util.OptionalDouble;

/**
 * Various utility methods for inspecting the state of tasks.
 */
public class TaskUtils {

    private TaskUtils() {
        // do not instantiate
    }

    /**
     * Returns whether the provided {@link Protos.TaskState} is a final state: once a task reaches it, the task is
     * never updated again.
     */
    public static boolean isTerminal(Protos.TaskState state) {
        switch (state) {
            case TASK_FINISHED:
            case TASK_FAILED:
            case TASK_KILLED:
            case TASK_LOST:
            case TASK_ERROR:
            case TASK_DROPPED:
            case TASK_GONE:
            case TASK_GONE_BY_OPERATOR:
                return true;
            default:
                return false;
        }
    }

    /**
     * Returns the timestamp of the earliest recorded status of the task, or an empty value if it has none.
     */
    public static OptionalDouble getEarliestTimestamp(Protos.Task task) {
        return task.getStatusesCount() == 0
                ? OptionalDouble.empty()
                : OptionalDouble.of(task.getStatuses(0).getTimestamp());
    }

    /**
     * Returns a new {@link Protos.Task} for a {@link Protos.TaskInfo} which an agent has started, in the provided
     * state and with no recorded statuses.
     */
    public static Protos.Task toTask(Protos.FrameworkID frameworkId, Protos.TaskInfo taskInfo, Protos.TaskState state) {
        Protos.Task.Builder builder = Protos.Task.newBuilder()
                .setName(taskInfo.getName())
                .setTaskId(taskInfo.getTaskId())
                .setFrameworkId(frameworkId)
                .setSlaveId(taskInfo.getSlaveId())
                .setState(state)
                .addAllResources(taskInfo.getResourcesList());
        if (taskInfo.hasExecutor()) {
            builder.setExecutorId(taskInfo.getExecutor().getExecutorId());
        }
        if (taskInfo.hasLabels()) {
            builder.setLabels(taskInfo.getLabels());
        }
        return builder.build();
    }

    /**
     * Returns a status for the task in a new state, stamped with the provided time in seconds since the epoch.
     */
    public static Protos.TaskStatus newStatus(
            Protos.TaskID taskId,
            Protos.SlaveID agentId,
            Protos.TaskState state,
            Protos.TaskStatus.Reason reason,
            String message,
            double timestamp) {
        return Protos.TaskStatus.newBuilder()
                .setTaskId(taskId)
                .setSlaveId(agentId)
                .setState(state)
                .setSource(Protos.TaskStatus.Source.SOURCE_MASTER)
                .setReason(reason)
                .setMessage(message)
                .setTimestamp(timestamp)
                .build();
    }
}
