package com.mesosphere.master.queries;

import com.mesosphere.master.state.Framework;
import com.mesosphere.master.state.MasterState;

import org.apache.mesos.Protos;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Which agents host tasks of which frameworks, counting pending, active and completed tasks of registered and
 * completed frameworks.
 */
public final class AgentFrameworkMapping {

    private final Map<Protos.FrameworkID, Set<Protos.SlaveID>> agentsByFramework;
    private final Map<Protos.SlaveID, Set<Protos.FrameworkID>> frameworksByAgent;

    private AgentFrameworkMapping(
            Map<Protos.FrameworkID, Set<Protos.SlaveID>> agentsByFramework,
            Map<Protos.SlaveID, Set<Protos.FrameworkID>> frameworksByAgent) {
        this.agentsByFramework = agentsByFramework;
        this.frameworksByAgent = frameworksByAgent;
    }

    public static AgentFrameworkMapping of(MasterState state) {
        return of(allFrameworks(state));
    }

    public static AgentFrameworkMapping of(Collection<Framework> frameworks) {
        Map<Protos.FrameworkID, Set<Protos.SlaveID>> agentsByFramework = new HashMap<>();
        Map<Protos.SlaveID, Set<Protos.FrameworkID>> frameworksByAgent = new HashMap<>();
        for (Framework framework : frameworks) {
            Set<Protos.SlaveID> agentIds =
                    agentsByFramework.computeIfAbsent(framework.getId(), id -> new LinkedHashSet<>());
            List<Protos.SlaveID> taskAgentIds = new ArrayList<>();
            for (Protos.TaskInfo taskInfo : framework.getPendingTasks()) {
                taskAgentIds.add(taskInfo.getSlaveId());
            }
            for (Protos.Task task : framework.getTasks()) {
                taskAgentIds.add(task.getSlaveId());
            }
            for (Protos.Task task : framework.getCompletedTasks()) {
                taskAgentIds.add(task.getSlaveId());
            }
            for (Protos.SlaveID agentId : taskAgentIds) {
                agentIds.add(agentId);
                frameworksByAgent.computeIfAbsent(agentId, id -> new LinkedHashSet<>()).add(framework.getId());
            }
        }
        return new AgentFrameworkMapping(agentsByFramework, frameworksByAgent);
    }

    /**
     * Returns the agents hosting any task of the framework, or an empty set.
     */
    public Set<Protos.SlaveID> getAgentIds(Protos.FrameworkID frameworkId) {
        return Collections.unmodifiableSet(agentsByFramework.getOrDefault(frameworkId, Collections.emptySet()));
    }

    /**
     * Returns the frameworks with any task on the agent, or an empty set.
     */
    public Set<Protos.FrameworkID> getFrameworkIds(Protos.SlaveID agentId) {
        return Collections.unmodifiableSet(frameworksByAgent.getOrDefault(agentId, Collections.emptySet()));
    }

    /**
     * Returns the registered frameworks followed by the completed ones.
     */
    static List<Framework> allFrameworks(MasterState state) {
        List<Framework> frameworks = new ArrayList<>(state.getFrameworks());
        frameworks.addAll(state.getCompletedFrameworks());
        return frameworks;
    }
}
