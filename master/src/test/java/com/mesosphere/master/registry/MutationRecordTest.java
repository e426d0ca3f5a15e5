package com.mesosphere.master.registry;

import com.mesosphere.master.maintenance.MaintenanceSchedule;
import com.mesosphere.master.maintenance.MaintenanceWindow;
import com.mesosphere.master.offer.ResourceOperation;
import com.mesosphere.master.offer.Resources;
import com.mesosphere.master.testutils.ResourceTestUtils;
import com.mesosphere.master.testutils.TestConstants;

import org.apache.mesos.Protos;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class MutationRecordTest {

    private static final Protos.MachineID MACHINE_1 = TestConstants.machineId("host-1", "10.0.0.1");
    private static final Protos.MachineID MACHINE_2 = TestConstants.machineId("host-2", "10.0.0.2");
    private static final Protos.MachineID MACHINE_3 = TestConstants.machineId("host-3");

    private static final Protos.Unavailability FIRST = unavailability(1000);
    private static final Protos.Unavailability SECOND = unavailability(2000);

    @Test
    public void testUpdateScheduleAddsDrainingMachines() throws Exception {
        MaintenanceSchedule schedule = new MaintenanceSchedule(Arrays.asList(
                new MaintenanceWindow(Collections.singletonList(MACHINE_1), FIRST),
                new MaintenanceWindow(Collections.singletonList(MACHINE_2), SECOND)));

        RegistrySnapshot snapshot = new MutationRecord.UpdateSchedule(schedule).perform(RegistrySnapshot.empty());

        assertEquals(Arrays.asList(
                machine(MACHINE_1, Protos.MachineInfo.Mode.DRAINING, FIRST),
                machine(MACHINE_2, Protos.MachineInfo.Mode.DRAINING, SECOND)),
                snapshot.getMachines());
        assertEquals(Collections.singletonList(schedule), snapshot.getSchedules());
    }

    @Test
    public void testUpdateScheduleKeepsModeOfRemainingMachines() throws Exception {
        RegistrySnapshot snapshot = new MutationRecord.UpdateSchedule(new MaintenanceSchedule(Collections.singletonList(
                new MaintenanceWindow(Arrays.asList(MACHINE_1, MACHINE_2), FIRST))))
                .perform(RegistrySnapshot.empty());
        snapshot = new MutationRecord.StartMaintenance(Collections.singletonList(MACHINE_1)).perform(snapshot);

        // machine 2 leaves the schedule, machine 3 joins it
        MaintenanceSchedule updated = new MaintenanceSchedule(Collections.singletonList(
                new MaintenanceWindow(Arrays.asList(MACHINE_1, MACHINE_3), SECOND)));
        snapshot = new MutationRecord.UpdateSchedule(updated).perform(snapshot);

        assertEquals(Arrays.asList(
                machine(MACHINE_1, Protos.MachineInfo.Mode.DOWN, SECOND),
                machine(MACHINE_3, Protos.MachineInfo.Mode.DRAINING, SECOND)),
                snapshot.getMachines());
        assertEquals(Collections.singletonList(updated), snapshot.getSchedules());
    }

    @Test
    public void testEmptyScheduleClearsSchedules() throws Exception {
        RegistrySnapshot snapshot = new MutationRecord.UpdateSchedule(new MaintenanceSchedule(Collections.singletonList(
                new MaintenanceWindow(Collections.singletonList(MACHINE_1), FIRST))))
                .perform(RegistrySnapshot.empty());

        snapshot = new MutationRecord.UpdateSchedule(MaintenanceSchedule.empty()).perform(snapshot);

        assertTrue(snapshot.getMachines().isEmpty());
        assertTrue(snapshot.getSchedules().isEmpty());
    }

    @Test
    public void testStartMaintenanceOnlyTouchesNamedMachines() throws Exception {
        RegistrySnapshot snapshot = new MutationRecord.UpdateSchedule(new MaintenanceSchedule(Collections.singletonList(
                new MaintenanceWindow(Arrays.asList(MACHINE_1, MACHINE_2), FIRST))))
                .perform(RegistrySnapshot.empty());

        snapshot = new MutationRecord.StartMaintenance(Collections.singletonList(MACHINE_2)).perform(snapshot);

        assertEquals(Arrays.asList(
                machine(MACHINE_1, Protos.MachineInfo.Mode.DRAINING, FIRST),
                machine(MACHINE_2, Protos.MachineInfo.Mode.DOWN, FIRST)),
                snapshot.getMachines());
    }

    @Test
    public void testStopMaintenancePrunesSchedule() throws Exception {
        RegistrySnapshot snapshot = new MutationRecord.UpdateSchedule(new MaintenanceSchedule(Arrays.asList(
                new MaintenanceWindow(Collections.singletonList(MACHINE_1), FIRST),
                new MaintenanceWindow(Arrays.asList(MACHINE_2, MACHINE_3), SECOND))))
                .perform(RegistrySnapshot.empty());
        snapshot = new MutationRecord.StartMaintenance(Arrays.asList(MACHINE_1, MACHINE_2)).perform(snapshot);

        snapshot = new MutationRecord.StopMaintenance(Arrays.asList(MACHINE_1, MACHINE_2)).perform(snapshot);

        assertEquals(Collections.singletonList(machine(MACHINE_3, Protos.MachineInfo.Mode.DRAINING, SECOND)),
                snapshot.getMachines());
        assertEquals(Collections.singletonList(new MaintenanceSchedule(Collections.singletonList(
                new MaintenanceWindow(Collections.singletonList(MACHINE_3), SECOND)))),
                snapshot.getSchedules());

        snapshot = new MutationRecord.StartMaintenance(Collections.singletonList(MACHINE_3)).perform(snapshot);
        snapshot = new MutationRecord.StopMaintenance(Collections.singletonList(MACHINE_3)).perform(snapshot);
        assertTrue(snapshot.getSchedules().isEmpty());
    }

    @Test(expected = MutationRecord.PreconditionException.class)
    public void testStartMaintenanceRequiresDrainingMachine() throws Exception {
        new MutationRecord.StartMaintenance(Collections.singletonList(MACHINE_1)).perform(RegistrySnapshot.empty());
    }

    @Test(expected = MutationRecord.PreconditionException.class)
    public void testStartMaintenanceRejectsDownMachine() throws Exception {
        RegistrySnapshot snapshot = new MutationRecord.UpdateSchedule(new MaintenanceSchedule(Collections.singletonList(
                new MaintenanceWindow(Collections.singletonList(MACHINE_1), FIRST))))
                .perform(RegistrySnapshot.empty());
        snapshot = new MutationRecord.StartMaintenance(Collections.singletonList(MACHINE_1)).perform(snapshot);
        new MutationRecord.StartMaintenance(Collections.singletonList(MACHINE_1)).perform(snapshot);
    }

    @Test(expected = MutationRecord.PreconditionException.class)
    public void testStopMaintenanceRequiresDownMachine() throws Exception {
        RegistrySnapshot snapshot = new MutationRecord.UpdateSchedule(new MaintenanceSchedule(Collections.singletonList(
                new MaintenanceWindow(Collections.singletonList(MACHINE_1), FIRST))))
                .perform(RegistrySnapshot.empty());
        new MutationRecord.StopMaintenance(Collections.singletonList(MACHINE_1)).perform(snapshot);
    }

    @Test(expected = MutationRecord.PreconditionException.class)
    public void testUpdateScheduleCannotDropDownMachine() throws Exception {
        RegistrySnapshot snapshot = new MutationRecord.UpdateSchedule(new MaintenanceSchedule(Collections.singletonList(
                new MaintenanceWindow(Arrays.asList(MACHINE_1, MACHINE_2), FIRST))))
                .perform(RegistrySnapshot.empty());
        snapshot = new MutationRecord.StartMaintenance(Collections.singletonList(MACHINE_1)).perform(snapshot);
        new MutationRecord.UpdateSchedule(MaintenanceSchedule.empty()).perform(snapshot);
    }

    @Test
    public void testApplyOperationTracksCheckpointPerAgent() throws Exception {
        Protos.SlaveID otherAgent = TestConstants.agentId("other-agent");
        Resources reserved = Resources.of(ResourceTestUtils.getReservedCpus(2.0));

        RegistrySnapshot snapshot = new MutationRecord.ApplyOperation(
                TestConstants.AGENT_ID, ResourceOperation.reserve(reserved), reserved)
                .perform(RegistrySnapshot.empty());
        snapshot = new MutationRecord.ApplyOperation(
                otherAgent, ResourceOperation.reserve(reserved), reserved)
                .perform(snapshot);
        assertEquals(2, snapshot.getCheckpointedResources().size());

        snapshot = new MutationRecord.ApplyOperation(
                TestConstants.AGENT_ID, ResourceOperation.unreserve(reserved), Resources.empty())
                .perform(snapshot);

        assertEquals(Collections.singleton(otherAgent.getValue()), snapshot.getCheckpointedResources().keySet());
        assertEquals(reserved.toList(), snapshot.getCheckpointedResources().get(otherAgent.getValue()));
    }

    private static Protos.Unavailability unavailability(long startSeconds) {
        return Protos.Unavailability.newBuilder()
                .setStart(Protos.TimeInfo.newBuilder().setNanoseconds(startSeconds * 1000000000L))
                .build();
    }

    private static Protos.MachineInfo machine(
            Protos.MachineID id, Protos.MachineInfo.Mode mode, Protos.Unavailability unavailability) {
        return Protos.MachineInfo.newBuilder()
                .setId(id)
                .setMode(mode)
                .setUnavailability(unavailability)
                .build();
    }
}
