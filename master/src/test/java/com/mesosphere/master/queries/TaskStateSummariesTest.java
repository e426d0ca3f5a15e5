package com.mesosphere.master.queries;

import com.mesosphere.master.offer.Resources;
import com.mesosphere.master.state.Agent;
import com.mesosphere.master.state.Framework;
import com.mesosphere.master.state.MasterState;
import com.mesosphere.master.state.TaskUtils;
import com.mesosphere.master.testutils.MasterTestUtils;
import com.mesosphere.master.testutils.ResourceTestUtils;
import com.mesosphere.master.testutils.TestConstants;

import org.apache.mesos.Protos;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class TaskStateSummariesTest {

    private static final Protos.SlaveID AGENT_1 = TestConstants.agentId("agent-1");
    private static final Protos.SlaveID AGENT_2 = TestConstants.agentId("agent-2");
    private static final Protos.FrameworkID FRAMEWORK_1 = TestConstants.frameworkId("framework-1");
    private static final Protos.FrameworkID FRAMEWORK_2 = TestConstants.frameworkId("framework-2");

    private MasterState state;

    @Before
    public void beforeEach() {
        state = new MasterState(MasterTestUtils.getTestConfig(), MasterTestUtils.CLOCK);
        addAgent(AGENT_1);
        addAgent(AGENT_2);
        Framework framework1 = state.addFramework(MasterTestUtils.frameworkInfo(FRAMEWORK_1, "one"));
        Framework framework2 = state.addFramework(MasterTestUtils.frameworkInfo(FRAMEWORK_2, "two"));

        addTask(framework1, "running-1", AGENT_1, Protos.TaskState.TASK_RUNNING);
        addTask(framework1, "running-2", AGENT_1, Protos.TaskState.TASK_RUNNING);
        Protos.Task failed = addTask(framework1, "failed", AGENT_2, Protos.TaskState.TASK_RUNNING);
        state.completeTask(framework1, failed.toBuilder().setState(Protos.TaskState.TASK_FAILED).build());
        state.addPendingTask(framework1, MasterTestUtils.taskInfo(TestConstants.taskId("pending"), AGENT_1));

        addTask(framework2, "starting", AGENT_2, Protos.TaskState.TASK_STARTING);
    }

    @Test
    public void testFrameworkCounts() {
        TaskStateSummaries summaries = TaskStateSummaries.of(state);

        TaskStateSummary framework1 = summaries.getFramework(FRAMEWORK_1);
        assertEquals(2, framework1.getRunning());
        assertEquals(1, framework1.getFailed());
        assertEquals(1, framework1.getStaging());
        assertEquals(0, framework1.getStarting());
        assertEquals(new TaskStateSummary.Builder()
                        .count(Protos.TaskState.TASK_STARTING)
                        .build(),
                summaries.getFramework(FRAMEWORK_2));
    }

    @Test
    public void testAgentCounts() {
        TaskStateSummaries summaries = TaskStateSummaries.of(state);

        TaskStateSummary agent1 = summaries.getAgent(AGENT_1);
        assertEquals(2, agent1.getCount(Protos.TaskState.TASK_RUNNING));
        assertEquals(1, agent1.getCount(Protos.TaskState.TASK_STAGING));
        assertEquals(0, agent1.getCount(Protos.TaskState.TASK_FAILED));

        TaskStateSummary agent2 = summaries.getAgent(AGENT_2);
        assertEquals(1, agent2.getFailed());
        assertEquals(1, agent2.getStarting());
        assertEquals(0, agent2.getRunning());
    }

    @Test
    public void testUnknownIdsAreEmpty() {
        TaskStateSummaries summaries = TaskStateSummaries.of(state);
        assertEquals(TaskStateSummary.EMPTY, summaries.getFramework(TestConstants.frameworkId("unknown")));
        assertEquals(TaskStateSummary.EMPTY, summaries.getAgent(TestConstants.agentId("unknown")));
    }

    @Test
    public void testCompletedFrameworksAreCounted() {
        Framework framework2 = state.getFramework(FRAMEWORK_2).get();
        Protos.Task starting = framework2.getTasks().iterator().next();
        state.completeTask(framework2, starting.toBuilder().setState(Protos.TaskState.TASK_KILLED).build());
        state.completeFramework(FRAMEWORK_2);

        TaskStateSummaries summaries = TaskStateSummaries.of(state);
        assertEquals(1, summaries.getFramework(FRAMEWORK_2).getKilled());
        assertEquals(1, summaries.getAgent(AGENT_2).getKilled());
        assertEquals(0, summaries.getAgent(AGENT_2).getStarting());
    }

    @Test
    public void testUntrackedStatesAreNotCounted() {
        Framework framework2 = state.getFramework(FRAMEWORK_2).get();
        addTask(framework2, "dropped", AGENT_2, Protos.TaskState.TASK_DROPPED);

        TaskStateSummary summary = TaskStateSummaries.of(state).getFramework(FRAMEWORK_2);
        assertEquals(0, summary.getCount(Protos.TaskState.TASK_DROPPED));
        assertEquals(1, summary.getStarting());
    }

    private void addAgent(Protos.SlaveID agentId) {
        Protos.SlaveInfo info = MasterTestUtils.agentInfo(
                agentId, agentId.getValue() + ".test", ResourceTestUtils.getUnreservedCpus(4.0));
        state.addAgent(new Agent(info, TestConstants.machineId(agentId.getValue()),
                Resources.of(info.getResourcesList()), Resources.empty(), MasterTestUtils.NOW, TestConstants.VERSION));
    }

    private Protos.Task addTask(Framework framework, String taskId, Protos.SlaveID agentId, Protos.TaskState taskState) {
        Protos.Task task = TaskUtils.toTask(
                framework.getId(),
                MasterTestUtils.taskInfo(TestConstants.taskId(taskId), agentId, ResourceTestUtils.getUnreservedCpus(0.5)),
                taskState);
        state.addTask(framework, task);
        return task;
    }
}
