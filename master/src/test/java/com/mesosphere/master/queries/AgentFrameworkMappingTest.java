package com.mesosphere.master.queries;

import com.mesosphere.master.state.Framework;
import com.mesosphere.master.state.MasterState;
import com.mesosphere.master.state.TaskUtils;
import com.mesosphere.master.testutils.MasterTestUtils;
import com.mesosphere.master.testutils.TestConstants;

import com.google.common.collect.ImmutableSet;
import org.apache.mesos.Protos;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class AgentFrameworkMappingTest {

    private static final Protos.SlaveID AGENT_1 = TestConstants.agentId("agent-1");
    private static final Protos.SlaveID AGENT_2 = TestConstants.agentId("agent-2");
    private static final Protos.FrameworkID FRAMEWORK_1 = TestConstants.frameworkId("framework-1");
    private static final Protos.FrameworkID FRAMEWORK_2 = TestConstants.frameworkId("framework-2");
    private static final Protos.FrameworkID FRAMEWORK_3 = TestConstants.frameworkId("framework-3");

    private MasterState state;

    @Before
    public void beforeEach() {
        state = new MasterState(MasterTestUtils.getTestConfig(), MasterTestUtils.CLOCK);
        Framework framework1 = state.addFramework(MasterTestUtils.frameworkInfo(FRAMEWORK_1, "one"));
        Framework framework2 = state.addFramework(MasterTestUtils.frameworkInfo(FRAMEWORK_2, "two"));
        state.addFramework(MasterTestUtils.frameworkInfo(FRAMEWORK_3, "idle"));

        addTask(framework1, "task-1", AGENT_1);
        state.addPendingTask(framework1, MasterTestUtils.taskInfo(TestConstants.taskId("task-2"), AGENT_2));
        Protos.Task task = addTask(framework2, "task-3", AGENT_2);
        state.completeTask(framework2, task.toBuilder().setState(Protos.TaskState.TASK_FINISHED).build());
    }

    @Test
    public void testMapsBothWays() {
        AgentFrameworkMapping mapping = AgentFrameworkMapping.of(state);

        assertEquals(ImmutableSet.of(AGENT_1, AGENT_2), mapping.getAgentIds(FRAMEWORK_1));
        assertEquals(ImmutableSet.of(AGENT_2), mapping.getAgentIds(FRAMEWORK_2));
        assertEquals(ImmutableSet.of(FRAMEWORK_1), mapping.getFrameworkIds(AGENT_1));
        assertEquals(ImmutableSet.of(FRAMEWORK_1, FRAMEWORK_2), mapping.getFrameworkIds(AGENT_2));
    }

    @Test
    public void testUnknownIdsAreEmpty() {
        AgentFrameworkMapping mapping = AgentFrameworkMapping.of(state);

        assertTrue(mapping.getAgentIds(FRAMEWORK_3).isEmpty());
        assertTrue(mapping.getAgentIds(TestConstants.frameworkId("unknown")).isEmpty());
        assertTrue(mapping.getFrameworkIds(TestConstants.agentId("unknown")).isEmpty());
    }

    @Test
    public void testCompletedFrameworksAreMapped() {
        state.completeFramework(FRAMEWORK_2);

        assertEquals(Arrays.asList(FRAMEWORK_1, FRAMEWORK_3, FRAMEWORK_2),
                AgentFrameworkMapping.allFrameworks(state).stream()
                        .map(Framework::getId)
                        .collect(Collectors.toList()));
        assertEquals(ImmutableSet.of(FRAMEWORK_1, FRAMEWORK_2),
                AgentFrameworkMapping.of(state).getFrameworkIds(AGENT_2));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testResultsAreReadOnly() {
        AgentFrameworkMapping.of(state).getAgentIds(FRAMEWORK_1).add(AGENT_2);
    }

    private Protos.Task addTask(Framework framework, String taskId, Protos.SlaveID agentId) {
        Protos.Task task = TaskUtils.toTask(
                framework.getId(),
                MasterTestUtils.taskInfo(TestConstants.taskId(taskId), agentId),
                Protos.TaskState.TASK_RUNNING);
        state.addTask(framework, task);
        return task;
    }
}
