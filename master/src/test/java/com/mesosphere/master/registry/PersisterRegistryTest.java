package com.mesosphere.master.registry;

import com.mesosphere.master.config.Serializer;
import com.mesosphere.master.maintenance.MaintenanceSchedule;
import com.mesosphere.master.maintenance.MaintenanceWindow;
import com.mesosphere.master.offer.ResourceOperation;
import com.mesosphere.master.offer.Resources;
import com.mesosphere.master.storage.MemPersister;
import com.mesosphere.master.storage.Persister;
import com.mesosphere.master.storage.PersisterException;
import com.mesosphere.master.storage.StorageError;
import com.mesosphere.master.testutils.ResourceTestUtils;
import com.mesosphere.master.testutils.TestConstants;

import org.apache.mesos.Protos;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class PersisterRegistryTest {

    private static final Protos.MachineID MACHINE_1 = TestConstants.machineId("host-1", "10.0.0.1");
    private static final Protos.MachineID MACHINE_2 = TestConstants.machineId("host-2", "10.0.0.2");
    private static final Protos.Unavailability UNAVAILABILITY = Protos.Unavailability.newBuilder()
            .setStart(Protos.TimeInfo.newBuilder().setNanoseconds(1000000000000L))
            .setDuration(Protos.DurationInfo.newBuilder().setNanoseconds(3600000000000L))
            .build();
    private static final MaintenanceSchedule SCHEDULE = new MaintenanceSchedule(Collections.singletonList(
            new MaintenanceWindow(Arrays.asList(MACHINE_1, MACHINE_2), UNAVAILABILITY)));

    private Persister persister;
    private PersisterRegistry registry;

    @Before
    public void beforeEach() {
        persister = MemPersister.newBuilder().disableLocking().build();
        registry = new PersisterRegistry(persister);
    }

    @Test
    public void testRecoverEmpty() {
        assertEquals(RegistrySnapshot.empty(), registry.recover().join());
    }

    @Test
    public void testScheduleSurvivesRecovery() {
        assertTrue(registry.apply(new MutationRecord.UpdateSchedule(SCHEDULE)).join());
        assertTrue(registry.apply(new MutationRecord.StartMaintenance(Collections.singletonList(MACHINE_1))).join());

        RegistrySnapshot recovered = new PersisterRegistry(persister).recover().join();

        assertEquals(Collections.singletonList(SCHEDULE), recovered.getSchedules());
        assertEquals(Arrays.asList(
                machine(MACHINE_1, Protos.MachineInfo.Mode.DOWN),
                machine(MACHINE_2, Protos.MachineInfo.Mode.DRAINING)),
                recovered.getMachines());
    }

    @Test
    public void testStopMaintenanceForgetsMachines() {
        registry.apply(new MutationRecord.UpdateSchedule(SCHEDULE)).join();
        registry.apply(new MutationRecord.StartMaintenance(Collections.singletonList(MACHINE_1))).join();
        registry.apply(new MutationRecord.StopMaintenance(Collections.singletonList(MACHINE_1))).join();

        RegistrySnapshot recovered = new PersisterRegistry(persister).recover().join();
        assertEquals(Collections.singletonList(machine(MACHINE_2, Protos.MachineInfo.Mode.DRAINING)),
                recovered.getMachines());
        assertEquals(Collections.singletonList(new MaintenanceSchedule(Collections.singletonList(
                new MaintenanceWindow(Collections.singletonList(MACHINE_2), UNAVAILABILITY)))),
                recovered.getSchedules());

        registry.apply(new MutationRecord.StartMaintenance(Collections.singletonList(MACHINE_2))).join();
        registry.apply(new MutationRecord.StopMaintenance(Collections.singletonList(MACHINE_2))).join();
        assertEquals(RegistrySnapshot.empty(), new PersisterRegistry(persister).recover().join());
    }

    @Test
    public void testCheckpointedResources() {
        Resources reserved = Resources.of(
                ResourceTestUtils.getReservedCpus(1.0),
                ResourceTestUtils.getVolume(10, TestConstants.PERSISTENCE_ID));
        registry.apply(new MutationRecord.ApplyOperation(
                TestConstants.AGENT_ID, ResourceOperation.reserve(reserved), reserved)).join();

        RegistrySnapshot recovered = new PersisterRegistry(persister).recover().join();
        assertEquals(reserved,
                Resources.of(recovered.getCheckpointedResources().get(TestConstants.AGENT_ID.getValue())));

        registry.apply(new MutationRecord.ApplyOperation(
                TestConstants.AGENT_ID, ResourceOperation.unreserve(reserved), Resources.empty())).join();
        assertTrue(new PersisterRegistry(persister).recover().join().getCheckpointedResources().isEmpty());
    }

    @Test
    public void testSerializationFailureIsNotStored() throws IOException {
        Serializer mockSerializer = mock(Serializer.class);
        when(mockSerializer.serialize(any())).thenThrow(new IOException("cannot serialize"));
        registry = new PersisterRegistry(persister, mockSerializer);

        assertFalse(registry.apply(new MutationRecord.UpdateSchedule(SCHEDULE)).join());
        assertEquals(RegistrySnapshot.empty(), new PersisterRegistry(persister).recover().join());
    }

    @Test
    public void testStorageFailureIsNotApplied() throws Exception {
        Persister mockPersister = mock(Persister.class);
        doThrow(new PersisterException(StorageError.Reason.STORAGE_ERROR, "unreachable"))
                .when(mockPersister).set(anyString(), any());
        registry = new PersisterRegistry(mockPersister);

        assertFalse(registry.apply(new MutationRecord.UpdateSchedule(SCHEDULE)).join());
    }

    @Test
    public void testFailedWriteDoesNotAdvanceSnapshot() throws Exception {
        Persister mockPersister = mock(Persister.class);
        doThrow(new PersisterException(StorageError.Reason.STORAGE_ERROR, "unreachable"))
                .doNothing()
                .when(mockPersister).set(anyString(), any());
        registry = new PersisterRegistry(mockPersister);

        assertFalse(registry.apply(new MutationRecord.UpdateSchedule(SCHEDULE)).join());
        // the schedule was never stored, so there is no DRAINING machine to bring down
        assertFalse(registry.apply(new MutationRecord.StartMaintenance(Collections.singletonList(MACHINE_1))).join());
        verify(mockPersister, times(1)).set(anyString(), any());

        assertTrue(registry.apply(new MutationRecord.UpdateSchedule(SCHEDULE)).join());
        assertTrue(registry.apply(new MutationRecord.StartMaintenance(Collections.singletonList(MACHINE_1))).join());
    }

    @Test
    public void testRecordWhichDoesNotApplyIsRejected() {
        assertTrue(registry.apply(new MutationRecord.UpdateSchedule(SCHEDULE)).join());

        assertFalse(registry.apply(new MutationRecord.StopMaintenance(Collections.singletonList(MACHINE_1))).join());

        assertTrue(registry.apply(new MutationRecord.StartMaintenance(Collections.singletonList(MACHINE_1))).join());
        assertFalse(registry.apply(new MutationRecord.UpdateSchedule(MaintenanceSchedule.empty())).join());

        RegistrySnapshot recovered = new PersisterRegistry(persister).recover().join();
        assertEquals(Collections.singletonList(SCHEDULE), recovered.getSchedules());
        assertEquals(machine(MACHINE_1, Protos.MachineInfo.Mode.DOWN), recovered.getMachines().get(0));
    }

    @Test
    public void testCorruptSnapshotFailsRecovery() throws Exception {
        persister.set(PersisterRegistry.SNAPSHOT_PATH, "not json".getBytes(StandardCharsets.UTF_8));
        CompletableFuture<RegistrySnapshot> recovered = registry.recover();
        try {
            recovered.join();
            fail("Expected recovery to fail");
        } catch (CompletionException e) {
            assertTrue(e.getCause() instanceof IOException);
        }
    }

    private static Protos.MachineInfo machine(Protos.MachineID id, Protos.MachineInfo.Mode mode) {
        return Protos.MachineInfo.newBuilder()
                .setId(id)
                .setMode(mode)
                .setUnavailability(UNAVAILABILITY)
                .build();
    }
}
