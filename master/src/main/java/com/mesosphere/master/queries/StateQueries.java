package com.mesosphere.master.queries;

import com.mesosphere.master.master.Master;
import com.mesosphere.master.offer.Resources;
import com.mesosphere.master.offer.ValueUtils;
import com.mesosphere.master.state.Agent;
import com.mesosphere.master.state.Framework;
import com.mesosphere.master.state.MasterState;

import org.apache.mesos.Protos;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read-only summaries of the master's agents and frameworks. Every summary is computed from a single consistent view of
 * the state and never fails: anything unknown is simply left out or reported as empty.
 */
public class StateQueries {

    private final Master master;

    public StateQueries(Master master) {
        this.master = master;
    }

    public StateSummary stateSummary() {
        return master.query(state -> {
            Indices indices = new Indices(state);
            return new StateSummary(
                    state.getHostname(),
                    state.getClusterName(),
                    agents(state, indices),
                    frameworks(state.getFrameworks(), indices),
                    frameworks(state.getCompletedFrameworks(), indices));
        });
    }

    /**
     * Returns the registered frameworks followed by the completed ones, oldest first.
     */
    public List<FrameworkSummary> frameworks() {
        return master.query(state -> frameworks(AgentFrameworkMapping.allFrameworks(state), new Indices(state)));
    }

    public List<AgentSummary> agents() {
        return master.query(state -> agents(state, new Indices(state)));
    }

    /**
     * Returns the roles of the registered frameworks, sorted by name. A framework is listed under every role it is
     * subscribed to, and the resources its tasks use are counted under the role they were allocated to.
     */
    public List<RoleSummary> roles() {
        return master.query(state -> {
            Map<String, List<String>> frameworkIds = new TreeMap<>();
            Map<String, Resources> used = new HashMap<>();
            for (Framework framework : state.getFrameworks()) {
                List<String> roles = getRoles(framework.getInfo());
                for (String role : roles) {
                    frameworkIds.computeIfAbsent(role, r -> new ArrayList<>()).add(framework.getId().getValue());
                }
                for (Protos.Resource resource : framework.getUsedResources()) {
                    String role = resource.hasAllocationInfo() && resource.getAllocationInfo().hasRole()
                            ? resource.getAllocationInfo().getRole()
                            : roles.get(0);
                    used.merge(role, Resources.of(resource), Resources::plus);
                }
            }
            List<RoleSummary> summaries = new ArrayList<>();
            for (Map.Entry<String, List<String>> entry : frameworkIds.entrySet()) {
                summaries.add(new RoleSummary(
                        entry.getKey(),
                        entry.getValue(),
                        summarize(used.getOrDefault(entry.getKey(), Resources.empty()))));
            }
            return summaries;
        });
    }

    /**
     * Returns the roles of a multi-role framework, or the single role of any other framework.
     */
    @SuppressWarnings("deprecation")
    private static List<String> getRoles(Protos.FrameworkInfo info) {
        return info.getRolesCount() > 0 ? info.getRolesList() : Collections.singletonList(info.getRole());
    }

    /**
     * Renders resources as a map from resource name to the sum of its values: a number for scalars, and text for
     * ranges and sets, e.g. {@code {"cpus": 2.5, "ports": "[31000-32000]"}}.
     */
    static Map<String, Object> summarize(Resources resources) {
        Map<String, Protos.Value> values = new TreeMap<>();
        for (Protos.Resource resource : resources) {
            Protos.Value value = ValueUtils.getValue(resource);
            values.merge(resource.getName(), value, ValueUtils::add);
        }
        Map<String, Object> result = new TreeMap<>();
        for (Map.Entry<String, Protos.Value> entry : values.entrySet()) {
            result.put(entry.getKey(), render(entry.getValue()));
        }
        return result;
    }

    private static Object render(Protos.Value value) {
        switch (value.getType()) {
            case SCALAR:
                return ValueUtils.round(value.getScalar().getValue());
            case RANGES:
                return value.getRanges().getRangeList().stream()
                        .map(range -> String.format("%d-%d", range.getBegin(), range.getEnd()))
                        .collect(Collectors.joining(", ", "[", "]"));
            case SET:
                return value.getSet().getItemList().stream().collect(Collectors.joining(",", "{", "}"));
            default:
                return value.toString();
        }
    }

    private static List<AgentSummary> agents(MasterState state, Indices indices) {
        List<AgentSummary> agents = new ArrayList<>();
        for (Agent agent : state.getAgents()) {
            Resources used = Resources.empty();
            for (Resources frameworkUsed : agent.getUsedResources().values()) {
                used = used.plus(frameworkUsed);
            }
            Map<String, Map<String, Object>> reserved = new TreeMap<>();
            for (Map.Entry<String, Resources> entry : agent.getTotalResources().reserved().entrySet()) {
                reserved.put(entry.getKey(), summarize(entry.getValue()));
            }
            agents.add(new AgentSummary(
                    agent.getId().getValue(),
                    agent.getHostname(),
                    agent.getRegisteredTime(),
                    agent.getVersion(),
                    agent.isActive(),
                    summarize(agent.getTotalResources()),
                    summarize(used),
                    summarize(state.getOfferedResources(agent)),
                    reserved,
                    summarize(agent.getTotalResources().unreserved()),
                    indices.summaries.getAgent(agent.getId()),
                    indices.mapping.getFrameworkIds(agent.getId()).stream()
                            .map(Protos.FrameworkID::getValue)
                            .collect(Collectors.toList())));
        }
        return agents;
    }

    private static List<FrameworkSummary> frameworks(Iterable<Framework> frameworks, Indices indices) {
        List<FrameworkSummary> summaries = new ArrayList<>();
        for (Framework framework : frameworks) {
            Protos.FrameworkInfo info = framework.getInfo();
            summaries.add(new FrameworkSummary(
                    framework.getId().getValue(),
                    info.getName(),
                    info.getHostname(),
                    info.hasWebuiUrl() ? Optional.of(info.getWebuiUrl()) : Optional.empty(),
                    info.getCapabilitiesList().stream()
                            .map(capability -> capability.getType().name())
                            .collect(Collectors.toList()),
                    framework.getRegisteredTime(),
                    framework.getUnregisteredTime(),
                    framework.isActive(),
                    summarize(framework.getUsedResources()),
                    summarize(framework.getOfferedResources()),
                    indices.summaries.getFramework(framework.getId()),
                    indices.mapping.getAgentIds(framework.getId()).stream()
                            .map(Protos.SlaveID::getValue)
                            .collect(Collectors.toList())));
        }
        return summaries;
    }

    private static class Indices {
        private final TaskStateSummaries summaries;
        private final AgentFrameworkMapping mapping;

        private Indices(MasterState state) {
            List<Framework> frameworks = AgentFrameworkMapping.allFrameworks(state);
            this.summaries = TaskStateSummaries.of(frameworks);
            this.mapping = AgentFrameworkMapping.of(frameworks);
        }
    }
}
