package com.mesosphere.master.queries;

import com.mesosphere.master.state.Framework;
import com.mesosphere.master.state.MasterState;

import org.apache.mesos.Protos;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Task state histograms for every framework and every agent, built in a single pass over the pending, active and
 * completed tasks of registered and completed frameworks. Pending tasks are counted as staging.
 */
public final class TaskStateSummaries {

    private final Map<Protos.FrameworkID, TaskStateSummary> byFramework;
    private final Map<Protos.SlaveID, TaskStateSummary> byAgent;

    private TaskStateSummaries(
            Map<Protos.FrameworkID, TaskStateSummary> byFramework,
            Map<Protos.SlaveID, TaskStateSummary> byAgent) {
        this.byFramework = byFramework;
        this.byAgent = byAgent;
    }

    public static TaskStateSummaries of(MasterState state) {
        return of(AgentFrameworkMapping.allFrameworks(state));
    }

    public static TaskStateSummaries of(Collection<Framework> frameworks) {
        Map<Protos.FrameworkID, TaskStateSummary.Builder> frameworkBuilders = new HashMap<>();
        Map<Protos.SlaveID, TaskStateSummary.Builder> agentBuilders = new HashMap<>();
        for (Framework framework : frameworks) {
            TaskStateSummary.Builder frameworkBuilder =
                    frameworkBuilders.computeIfAbsent(framework.getId(), id -> new TaskStateSummary.Builder());
            for (Protos.TaskInfo taskInfo : framework.getPendingTasks()) {
                frameworkBuilder.count(Protos.TaskState.TASK_STAGING);
                agentBuilders.computeIfAbsent(taskInfo.getSlaveId(), id -> new TaskStateSummary.Builder())
                        .count(Protos.TaskState.TASK_STAGING);
            }
            for (Protos.Task task : framework.getTasks()) {
                frameworkBuilder.count(task.getState());
                agentBuilders.computeIfAbsent(task.getSlaveId(), id -> new TaskStateSummary.Builder())
                        .count(task.getState());
            }
            for (Protos.Task task : framework.getCompletedTasks()) {
                frameworkBuilder.count(task.getState());
                agentBuilders.computeIfAbsent(task.getSlaveId(), id -> new TaskStateSummary.Builder())
                        .count(task.getState());
            }
        }
        return new TaskStateSummaries(build(frameworkBuilders), build(agentBuilders));
    }

    /**
     * Returns the histogram of a framework's tasks, which is all zero for an unknown framework.
     */
    public TaskStateSummary getFramework(Protos.FrameworkID frameworkId) {
        return byFramework.getOrDefault(frameworkId, TaskStateSummary.EMPTY);
    }

    /**
     * Returns the histogram of the tasks on an agent, which is all zero for an unknown agent.
     */
    public TaskStateSummary getAgent(Protos.SlaveID agentId) {
        return byAgent.getOrDefault(agentId, TaskStateSummary.EMPTY);
    }

    private static <K> Map<K, TaskStateSummary> build(Map<K, TaskStateSummary.Builder> builders) {
        Map<K, TaskStateSummary> result = new HashMap<>();
        for (Map.Entry<K, TaskStateSummary.Builder> entry : builders.entrySet()) {
            result.put(entry.getKey(), entry.getValue().build());
        }
        return result;
    }
}
