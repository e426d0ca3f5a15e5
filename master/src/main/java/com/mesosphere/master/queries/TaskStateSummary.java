package com.mesosphere.master.queries;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.mesos.Protos;

/**
 * Number of tasks in each of the tracked task states. Tasks in any other state are not counted.
 */
public final class TaskStateSummary {

    public static final TaskStateSummary EMPTY = new Builder().build();

    private final int staging;
    private final int starting;
    private final int running;
    private final int finished;
    private final int killed;
    private final int failed;
    private final int lost;
    private final int error;

    private TaskStateSummary(Builder builder) {
        this.staging = builder.staging;
        this.starting = builder.starting;
        this.running = builder.running;
        this.finished = builder.finished;
        this.killed = builder.killed;
        this.failed = builder.failed;
        this.lost = builder.lost;
        this.error = builder.error;
    }

    @JsonProperty("staging")
    public int getStaging() {
        return staging;
    }

    @JsonProperty("starting")
    public int getStarting() {
        return starting;
    }

    @JsonProperty("running")
    public int getRunning() {
        return running;
    }

    @JsonProperty("finished")
    public int getFinished() {
        return finished;
    }

    @JsonProperty("killed")
    public int getKilled() {
        return killed;
    }

    @JsonProperty("failed")
    public int getFailed() {
        return failed;
    }

    @JsonProperty("lost")
    public int getLost() {
        return lost;
    }

    @JsonProperty("error")
    public int getError() {
        return error;
    }

    /**
     * Returns the count for the provided state, or zero if the state is not tracked.
     */
    public int getCount(Protos.TaskState state) {
        switch (state) {
            case TASK_STAGING:
                return staging;
            case TASK_STARTING:
                return starting;
            case TASK_RUNNING:
                return running;
            case TASK_FINISHED:
                return finished;
            case TASK_KILLED:
                return killed;
            case TASK_FAILED:
                return failed;
            case TASK_LOST:
                return lost;
            case TASK_ERROR:
                return error;
            default:
                return 0;
        }
    }

    @Override
    public boolean equals(Object o) {
        return EqualsBuilder.reflectionEquals(this, o);
    }

    @Override
    public int hashCode() {
        return HashCodeBuilder.reflectionHashCode(this);
    }

    @Override
    public String toString() {
        return String.format(
                "TaskStateSummary{staging=%d, starting=%d, running=%d, finished=%d, killed=%d, failed=%d, lost=%d, "
                        + "error=%d}",
                staging, starting, running, finished, killed, failed, lost, error);
    }

    static class Builder {
        private int staging;
        private int starting;
        private int running;
        private int finished;
        private int killed;
        private int failed;
        private int lost;
        private int error;

        Builder count(Protos.TaskState state) {
            switch (state) {
                case TASK_STAGING:
                    staging++;
                    break;
                case TASK_STARTING:
                    starting++;
                    break;
                case TASK_RUNNING:
                    running++;
                    break;
                case TASK_FINISHED:
                    finished++;
                    break;
                case TASK_KILLED:
                    killed++;
                    break;
                case TASK_FAILED:
                    failed++;
                    break;
                case TASK_LOST:
                    lost++;
                    break;
                case TASK_ERROR:
                    error++;
                    break;
                default:
                    break;
            }
            return this;
        }

        TaskStateSummary build() {
            return new TaskStateSummary(this);
        }
    }
}
