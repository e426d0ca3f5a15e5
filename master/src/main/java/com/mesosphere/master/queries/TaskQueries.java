package com.mesosphere.master.queries;

import com.mesosphere.master.master.Master;
import com.mesosphere.master.state.Framework;
import com.mesosphere.master.state.MasterState;
import com.mesosphere.master.state.TaskUtils;

import com.google.common.primitives.Ints;
import org.apache.mesos.Protos;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Lists the active and completed tasks of every registered and completed framework, ordered by when each task was
 * first reported.
 */
public class TaskQueries {

    static final String ASCENDING = "asc";

    /**
     * Oldest first. Tasks without any status come before every task with one.
     */
    static final Comparator<Protos.Task> EARLIEST_FIRST = (a, b) -> {
        OptionalDouble first = TaskUtils.getEarliestTimestamp(a);
        OptionalDouble second = TaskUtils.getEarliestTimestamp(b);
        if (!first.isPresent() || !second.isPresent()) {
            return Boolean.compare(first.isPresent(), second.isPresent());
        }
        return Double.compare(first.getAsDouble(), second.getAsDouble());
    };

    /**
     * Newest first. Tasks without any status come after every task with one.
     */
    static final Comparator<Protos.Task> LATEST_FIRST = (a, b) -> {
        OptionalDouble first = TaskUtils.getEarliestTimestamp(a);
        OptionalDouble second = TaskUtils.getEarliestTimestamp(b);
        if (!first.isPresent() || !second.isPresent()) {
            return Boolean.compare(second.isPresent(), first.isPresent());
        }
        return Double.compare(second.getAsDouble(), first.getAsDouble());
    };

    private final Master master;

    public TaskQueries(Master master) {
        this.master = master;
    }

    /**
     * Returns one page of tasks. Parameters are taken as received: a missing, non-numeric or negative {@code limit}
     * falls back to the configured default, and likewise {@code offset} falls back to zero. Tasks are listed newest
     * first unless {@code order} is {@code asc}.
     */
    public List<Protos.Task> listTasks(String limit, String offset, String order) {
        int pageLimit = parseNonNegative(limit, master.getConfig().getTaskListDefaultLimit());
        int pageOffset = parseNonNegative(offset, 0);
        Comparator<Protos.Task> comparator = ASCENDING.equalsIgnoreCase(order) ? EARLIEST_FIRST : LATEST_FIRST;
        List<Protos.Task> tasks = master.query(TaskQueries::getAllTasks);
        tasks.sort(comparator);
        return page(tasks, pageOffset, pageLimit);
    }

    static List<Protos.Task> page(List<Protos.Task> tasks, int offset, int limit) {
        if (offset >= tasks.size()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(tasks.subList(offset, (int) Math.min((long) offset + limit, tasks.size())));
    }

    private static List<Protos.Task> getAllTasks(MasterState state) {
        List<Protos.Task> tasks = new ArrayList<>();
        for (Framework framework : AgentFrameworkMapping.allFrameworks(state)) {
            tasks.addAll(framework.getTasks());
            tasks.addAll(framework.getCompletedTasks());
        }
        return tasks;
    }

    private static int parseNonNegative(String value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        Integer parsed = Ints.tryParse(value.trim());
        return parsed == null || parsed < 0 ? defaultValue : parsed;
    }
}
