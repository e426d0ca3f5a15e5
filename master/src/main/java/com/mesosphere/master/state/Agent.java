package com.mesosphere.master.state;

import com.mesosphere.master.offer.Resources;

import org.apache.mesos.Protos;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A registered agent: its advertised capacity, the offers outstanding against it, and the resources used by each
 * framework's tasks. The remaining {@code total - used - offered} is held by the allocator.
 *
 * <p>Instances are owned by {@link MasterState} and must only be modified by the master's dispatcher.
 */
public final class Agent {

    private static final Comparator<Protos.OfferID> OFFER_ORDER = Comparator.comparing(Protos.OfferID::getValue);

    private final Protos.SlaveID id;
    private final Protos.SlaveInfo info;
    private final Protos.MachineID machineId;
    private final double registeredTime;
    private final String version;
    private final Set<Protos.OfferID> offerIds = new TreeSet<>(OFFER_ORDER);
    private final Map<Protos.FrameworkID, Resources> usedResources = new HashMap<>();
    private Resources totalResources;
    private Resources checkpointedResources;

    public Agent(
            Protos.SlaveInfo info,
            Protos.MachineID machineId,
            Resources totalResources,
            Resources checkpointedResources,
            double registeredTime,
            String version) {
        this.id = info.getId();
        this.info = info;
        this.machineId = machineId;
        this.totalResources = totalResources;
        this.checkpointedResources = checkpointedResources;
        this.registeredTime = registeredTime;
        this.version = version;
    }

    public Protos.SlaveID getId() {
        return id;
    }

    public Protos.SlaveInfo getInfo() {
        return info;
    }

    public String getHostname() {
        return info.getHostname();
    }

    public Protos.MachineID getMachineId() {
        return machineId;
    }

    public double getRegisteredTime() {
        return registeredTime;
    }

    public String getVersion() {
        return version;
    }

    /**
     * Agents leave the ledger when they are removed, so a registered agent is always active.
     */
    public boolean isActive() {
        return true;
    }

    public Resources getTotalResources() {
        return totalResources;
    }

    public void setTotalResources(Resources totalResources) {
        this.totalResources = totalResources;
    }

    /**
     * Returns the reservations and persistent volumes which the agent keeps across restarts.
     */
    public Resources getCheckpointedResources() {
        return checkpointedResources;
    }

    public void setCheckpointedResources(Resources checkpointedResources) {
        this.checkpointedResources = checkpointedResources;
    }

    /**
     * Returns the ids of the offers outstanding against this agent, ordered by id. Callers which remove offers while
     * iterating must copy the result first.
     */
    public Set<Protos.OfferID> getOfferIds() {
        return Collections.unmodifiableSet(offerIds);
    }

    void addOffer(Protos.OfferID offerId) {
        offerIds.add(offerId);
    }

    void removeOffer(Protos.OfferID offerId) {
        offerIds.remove(offerId);
    }

    /**
     * Returns the resources used by each framework's tasks on this agent.
     */
    public Map<Protos.FrameworkID, Resources> getUsedResources() {
        return Collections.unmodifiableMap(usedResources);
    }

    public Resources getUsedResources(Protos.FrameworkID frameworkId) {
        return usedResources.getOrDefault(frameworkId, Resources.empty());
    }

    void addUsedResources(Protos.FrameworkID frameworkId, Resources resources) {
        usedResources.put(frameworkId, getUsedResources(frameworkId).plus(resources));
    }

    void removeUsedResources(Protos.FrameworkID frameworkId, Resources resources) {
        Resources remaining = getUsedResources(frameworkId).minus(resources);
        if (remaining.isEmpty()) {
            usedResources.remove(frameworkId);
        } else {
            usedResources.put(frameworkId, remaining);
        }
    }

    @Override
    public String toString() {
        return String.format("Agent{id=%s, hostname=%s}", id.getValue(), info.getHostname());
    }
}
