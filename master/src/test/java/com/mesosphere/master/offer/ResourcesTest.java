package com.mesosphere.master.offer;

import com.mesosphere.master.testutils.ResourceTestUtils;
import com.mesosphere.master.testutils.TestConstants;

import org.apache.mesos.Protos;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class ResourcesTest {

    @Test
    public void testPlusMergesMatchingEntries() {
        Resources resources = Resources.of(ResourceTestUtils.getUnreservedCpus(1.0))
                .plus(ResourceTestUtils.getUnreservedCpus(2.0));
        assertEquals(1, resources.size());
        assertEquals(3.0, resources.getScalar("cpus"), 0.0);
    }

    @Test
    public void testReservedAndUnreservedAreDistinct() {
        Resources resources = Resources.of(
                ResourceTestUtils.getUnreservedCpus(1.0),
                ResourceTestUtils.getReservedCpus(1.0));
        assertEquals(2, resources.size());
        assertEquals(2.0, resources.getScalar("cpus"), 0.0);
        assertNotEquals(
                Resources.of(ResourceTestUtils.getUnreservedCpus(1.0)),
                Resources.of(ResourceTestUtils.getReservedCpus(1.0)));
    }

    @Test
    public void testPlusThenMinusRoundTrips() {
        Resources a = Resources.of(
                ResourceTestUtils.getUnreservedCpus(2.5),
                ResourceTestUtils.getReservedCpus(1.0),
                ResourceTestUtils.getUnreservedPorts(31000, 31010),
                ResourceTestUtils.getUnreservedSet("gpus", "gpu0"));
        Resources b = Resources.of(
                ResourceTestUtils.getUnreservedCpus(0.5),
                ResourceTestUtils.getUnreservedMem(128),
                ResourceTestUtils.getUnreservedPorts(32000, 32005),
                ResourceTestUtils.getVolume(100, TestConstants.PERSISTENCE_ID));
        assertEquals(a, a.plus(b).minus(b));
    }

    @Test
    public void testOverlappingSetsAndRangesDoNotRoundTrip() {
        Resources gpus = Resources.of(ResourceTestUtils.getUnreservedSet("gpus", "gpu0"));
        assertEquals(gpus, gpus.plus(gpus));
        assertTrue(gpus.plus(gpus).minus(gpus).isEmpty());

        Resources ports = Resources.of(ResourceTestUtils.getUnreservedPorts(31000, 31010));
        Resources overlap = Resources.of(ResourceTestUtils.getUnreservedPorts(31005, 31020));
        assertEquals(Resources.of(ResourceTestUtils.getUnreservedPorts(31000, 31004)),
                ports.plus(overlap).minus(overlap));
    }

    @Test
    public void testMinusOfMissingResourceIsNoOp() {
        Resources cpus = Resources.of(ResourceTestUtils.getUnreservedCpus(1.0));
        assertEquals(cpus, cpus.minus(ResourceTestUtils.getUnreservedMem(64)));
        assertEquals(cpus, cpus.minus(ResourceTestUtils.getReservedCpus(1.0)));
    }

    @Test
    public void testEmptiedEntriesAreRemoved() {
        Resources resources = Resources.of(ResourceTestUtils.getUnreservedCpus(2.0))
                .minus(ResourceTestUtils.getUnreservedCpus(2.0));
        assertTrue(resources.isEmpty());
        assertEquals(Resources.empty(), resources);
    }

    @Test
    public void testScalarsCompareAtFixedPrecision() {
        Resources sum = Resources.of(ResourceTestUtils.getUnreservedCpus(0.1))
                .plus(ResourceTestUtils.getUnreservedCpus(0.2));
        assertEquals(Resources.of(ResourceTestUtils.getUnreservedCpus(0.3)), sum);
        assertEquals(0.3, sum.getScalar("cpus"), 0.0);
        assertTrue(Resources.of(ResourceTestUtils.getUnreservedCpus(1.0))
                .minus(ResourceTestUtils.getUnreservedCpus(0.9999))
                .isEmpty());
    }

    @Test
    public void testPersistentVolumesAreNeverMerged() {
        Protos.Resource first = ResourceTestUtils.getVolume(10, "first");
        Protos.Resource second = ResourceTestUtils.getVolume(10, "second");
        Resources volumes = Resources.of(first, second);
        assertEquals(2, volumes.size());
        assertEquals(Resources.of(second), volumes.minus(first));
        assertTrue(volumes.contains(first));
        assertFalse(volumes.contains(ResourceTestUtils.getVolume(5, "first")));
        assertEquals(volumes, volumes.plus(ResourceTestUtils.getReservedDisk(10)).persistentVolumes());
    }

    @Test
    public void testPersistentVolumesAreOnlySubtractedByEqualVolumes() {
        Resources volumes = Resources.of(ResourceTestUtils.getVolume(10, "volume"));
        assertEquals(volumes, volumes.minus(ResourceTestUtils.getReservedDisk(10)));
        assertEquals(volumes, volumes.minus(ResourceTestUtils.getVolume(10, "other")));
        assertTrue(volumes.minus(ResourceTestUtils.getVolume(10, "volume")).isEmpty());
    }

    @Test
    public void testRangeArithmetic() {
        Resources ports = Resources.of(ResourceTestUtils.getUnreservedPorts(1, 10));
        Resources remaining = ports.minus(ResourceTestUtils.getUnreservedPorts(3, 5));
        assertTrue(remaining.contains(ResourceTestUtils.getUnreservedPorts(1, 2)));
        assertTrue(remaining.contains(ResourceTestUtils.getUnreservedPorts(6, 10)));
        assertFalse(remaining.contains(ResourceTestUtils.getUnreservedPorts(4, 4)));
        assertEquals(ports, remaining.plus(ResourceTestUtils.getUnreservedPorts(3, 5)));
    }

    @Test
    public void testContainsResources() {
        Resources resources = Resources.of(
                ResourceTestUtils.getUnreservedCpus(4.0),
                ResourceTestUtils.getUnreservedMem(256));
        assertTrue(resources.contains(Resources.of(
                ResourceTestUtils.getUnreservedCpus(2.0), ResourceTestUtils.getUnreservedMem(256))));
        assertTrue(resources.contains(Resources.of(
                ResourceTestUtils.getUnreservedCpus(2.0), ResourceTestUtils.getUnreservedCpus(2.0))));
        assertFalse(resources.contains(Resources.of(ResourceTestUtils.getUnreservedCpus(4.5))));
        assertTrue(resources.contains(Resources.empty()));
    }

    @Test
    public void testReservationViews() {
        Protos.Resource otherRole = ResourceTestUtils.reserve(
                ResourceTestUtils.getUnreservedMem(64), "other-role", TestConstants.PRINCIPAL);
        Resources resources = Resources.of(
                ResourceTestUtils.getUnreservedCpus(1.0),
                ResourceTestUtils.getReservedCpus(2.0),
                otherRole);

        Map<String, Resources> reserved = resources.reserved();
        assertEquals(2, reserved.size());
        assertEquals(Resources.of(ResourceTestUtils.getReservedCpus(2.0)), reserved.get(TestConstants.ROLE));
        assertEquals(Resources.of(otherRole), resources.reserved("other-role"));
        assertEquals(Resources.of(ResourceTestUtils.getUnreservedCpus(1.0)), resources.unreserved());
        assertEquals(
                Resources.of(ResourceTestUtils.getUnreservedCpus(3.0), ResourceTestUtils.getUnreservedMem(64)),
                resources.flatten());
    }

    @Test
    public void testEqualityIgnoresEntryOrder() {
        Resources first = Resources.of(ResourceTestUtils.getUnreservedCpus(1.0), ResourceTestUtils.getUnreservedMem(2));
        Resources second = Resources.of(ResourceTestUtils.getUnreservedMem(2), ResourceTestUtils.getUnreservedCpus(1.0));
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }
}
