package com.mesosphere.master.queries;

import com.mesosphere.master.framework.Allocator;
import com.mesosphere.master.framework.MasterConfig;
import com.mesosphere.master.framework.Messenger;
import com.mesosphere.master.master.Master;
import com.mesosphere.master.offer.Resources;
import com.mesosphere.master.registry.PersisterRegistry;
import com.mesosphere.master.storage.MemPersister;
import com.mesosphere.master.testutils.MasterTestUtils;
import com.mesosphere.master.testutils.ResourceTestUtils;
import com.mesosphere.master.testutils.TestConstants;

import com.google.common.collect.ImmutableMap;
import org.apache.mesos.Protos;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TaskQueriesTest {

    private static final Protos.TaskID TASK_1 = TestConstants.taskId("task-1");
    private static final Protos.TaskID TASK_2 = TestConstants.taskId("task-2");
    private static final Protos.TaskID TASK_3 = TestConstants.taskId("task-3");

    @Mock private Allocator mockAllocator;
    @Mock private Messenger mockMessenger;

    private Master master;
    private TaskQueries queries;

    @Before
    public void beforeEach() {
        MockitoAnnotations.initMocks(this);
        master = newMaster(MasterTestUtils.getTestConfig());
        queries = new TaskQueries(master);
    }

    @Test
    public void testNewestFirstByDefault() {
        launchTasks();
        assertEquals(Arrays.asList(TASK_2, TASK_1, TASK_3), ids(queries.listTasks(null, null, null)));
        assertEquals(Arrays.asList(TASK_2, TASK_1, TASK_3), ids(queries.listTasks(null, null, "desc")));
    }

    @Test
    public void testOldestFirst() {
        launchTasks();
        assertEquals(Arrays.asList(TASK_3, TASK_1, TASK_2), ids(queries.listTasks(null, null, "asc")));
        assertEquals(Arrays.asList(TASK_3, TASK_1, TASK_2), ids(queries.listTasks(null, null, "ASC")));
    }

    @Test
    public void testCompletedTasksAreListed() {
        launchTasks();
        master.updateTaskStatus(TestConstants.FRAMEWORK_ID, MasterTestUtils.status(
                TASK_1, TestConstants.AGENT_ID, Protos.TaskState.TASK_FINISHED, 30)).join();

        List<Protos.Task> tasks = queries.listTasks(null, null, "asc");
        assertEquals(Arrays.asList(TASK_3, TASK_1, TASK_2), ids(tasks));
        assertEquals(Protos.TaskState.TASK_FINISHED, tasks.get(1).getState());
    }

    @Test
    public void testTasksOfTornDownFrameworksAreListed() {
        launchTasks();
        master.teardown(TestConstants.FRAMEWORK_ID).join();

        // task-3 is first seen when it is killed at teardown
        List<Protos.Task> tasks = queries.listTasks(null, null, "asc");
        assertEquals(Arrays.asList(TASK_1, TASK_2, TASK_3), ids(tasks));
        for (Protos.Task task : tasks) {
            assertEquals(Protos.TaskState.TASK_KILLED, task.getState());
        }
    }

    @Test
    public void testPaging() {
        launchTasks();
        assertEquals(Collections.singletonList(TASK_1), ids(queries.listTasks("1", "1", null)));
        assertEquals(Arrays.asList(TASK_1, TASK_3), ids(queries.listTasks("10", "1", null)));
        assertTrue(queries.listTasks("10", "5", null).isEmpty());
        assertTrue(queries.listTasks("0", "0", null).isEmpty());
    }

    @Test
    public void testInvalidParametersUseDefaults() {
        launchTasks();
        assertEquals(Arrays.asList(TASK_2, TASK_1, TASK_3), ids(queries.listTasks("-1", "abc", "sideways")));
        assertEquals(Arrays.asList(TASK_2, TASK_1, TASK_3), ids(queries.listTasks("", " ", null)));
    }

    @Test
    public void testDefaultLimitFromConfig() {
        master = newMaster(MasterTestUtils.getTestConfig(ImmutableMap.of("TASK_LIST_DEFAULT_LIMIT", "2")));
        queries = new TaskQueries(master);
        launchTasks();
        assertEquals(Arrays.asList(TASK_2, TASK_1), ids(queries.listTasks(null, null, null)));
        assertEquals(Arrays.asList(TASK_2, TASK_1, TASK_3), ids(queries.listTasks("3", null, null)));
    }

    @Test
    public void testEmptyMaster() {
        assertTrue(queries.listTasks(null, null, null).isEmpty());
    }

    @Test
    public void testPageBounds() {
        List<Protos.Task> tasks = Arrays.asList(task(TASK_1), task(TASK_2), task(TASK_3));
        assertEquals(tasks, TaskQueries.page(tasks, 0, Integer.MAX_VALUE));
        assertEquals(Collections.singletonList(task(TASK_3)), TaskQueries.page(tasks, 2, 5));
        assertTrue(TaskQueries.page(tasks, 3, 5).isEmpty());
    }

    @Test
    public void testTasksWithoutStatusCompareEqual() {
        assertEquals(0, TaskQueries.EARLIEST_FIRST.compare(task(TASK_1), task(TASK_2)));
        assertEquals(0, TaskQueries.LATEST_FIRST.compare(task(TASK_1), task(TASK_2)));
    }

    private Master newMaster(MasterConfig config) {
        Master newMaster = MasterTestUtils.newMaster(
                config, mockAllocator, mockMessenger, new PersisterRegistry(MemPersister.newBuilder().build()));
        newMaster.recover().join();
        newMaster.addAgent(
                MasterTestUtils.agentInfo(TestConstants.AGENT_ID, "agent.test",
                        ResourceTestUtils.getUnreservedCpus(4.0)),
                TestConstants.MACHINE_ID,
                Resources.empty(),
                TestConstants.VERSION).join();
        newMaster.addFramework(MasterTestUtils.frameworkInfo(TestConstants.FRAMEWORK_ID, "test")).join();
        return newMaster;
    }

    /**
     * Launches task-1 first seen at t=10, task-2 first seen at t=20, and task-3 without any status.
     */
    private void launchTasks() {
        launch(TASK_1);
        launch(TASK_2);
        launch(TASK_3);
        master.updateTaskStatus(TestConstants.FRAMEWORK_ID, MasterTestUtils.status(
                TASK_2, TestConstants.AGENT_ID, Protos.TaskState.TASK_RUNNING, 20)).join();
        master.updateTaskStatus(TestConstants.FRAMEWORK_ID, MasterTestUtils.status(
                TASK_1, TestConstants.AGENT_ID, Protos.TaskState.TASK_RUNNING, 10)).join();
    }

    private void launch(Protos.TaskID taskId) {
        master.launchTask(TestConstants.FRAMEWORK_ID, MasterTestUtils.taskInfo(
                taskId, TestConstants.AGENT_ID, ResourceTestUtils.getUnreservedCpus(0.5))).join();
    }

    private static Protos.Task task(Protos.TaskID taskId) {
        return Protos.Task.newBuilder()
                .setName(taskId.getValue())
                .setTaskId(taskId)
                .setFrameworkId(TestConstants.FRAMEWORK_ID)
                .setSlaveId(TestConstants.AGENT_ID)
                .setState(Protos.TaskState.TASK_STAGING)
                .build();
    }

    private static List<Protos.TaskID> ids(List<Protos.Task> tasks) {
        return tasks.stream().map(Protos.Task::getTaskId).collect(Collectors.toList());
    }
}
