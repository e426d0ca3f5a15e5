package com.mesosphere.master.state;

import com.mesosphere.master.offer.Resources;

import com.google.common.collect.EvictingQueue;
import org.apache.mesos.Protos;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A framework known to the master: the tasks it has asked to launch, the tasks running on its behalf, a bounded
 * history of its completed tasks, and its outstanding offers.
 *
 * <p>Instances are owned by {@link MasterState} and must only be modified by the master's dispatcher. Tasks in the
 * completed history are never modified.
 */
public final class Framework {

    private final Protos.FrameworkID id;
    private final Protos.FrameworkInfo info;
    private final double registeredTime;
    private final Map<Protos.TaskID, Protos.TaskInfo> pendingTasks = new LinkedHashMap<>();
    private final Map<Protos.TaskID, Protos.Task> tasks = new LinkedHashMap<>();
    private final EvictingQueue<Protos.Task> completedTasks;
    private final Set<Protos.OfferID> offerIds = new LinkedHashSet<>();
    private final Map<Protos.SlaveID, Resources> usedResources = new HashMap<>();
    private final Map<Protos.SlaveID, Resources> offeredResources = new HashMap<>();
    private boolean active = true;
    private Optional<Double> unregisteredTime = Optional.empty();

    public Framework(Protos.FrameworkInfo info, double registeredTime, int maxCompletedTasks) {
        this.id = info.getId();
        this.info = info;
        this.registeredTime = registeredTime;
        this.completedTasks = EvictingQueue.create(maxCompletedTasks);
    }

    public Protos.FrameworkID getId() {
        return id;
    }

    public Protos.FrameworkInfo getInfo() {
        return info;
    }

    public double getRegisteredTime() {
        return registeredTime;
    }

    public Optional<Double> getUnregisteredTime() {
        return unregisteredTime;
    }

    public boolean isActive() {
        return active;
    }

    void deactivate(double time) {
        this.active = false;
        this.unregisteredTime = Optional.of(time);
    }

    /**
     * Returns the tasks which the framework has asked to launch but which no agent has acknowledged yet.
     */
    public Collection<Protos.TaskInfo> getPendingTasks() {
        return Collections.unmodifiableCollection(pendingTasks.values());
    }

    public Collection<Protos.Task> getTasks() {
        return Collections.unmodifiableCollection(tasks.values());
    }

    public Optional<Protos.Task> getTask(Protos.TaskID taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /**
     * Returns the completed tasks, oldest first. Once the history is full, the oldest task is evicted for each new
     * one.
     */
    public List<Protos.Task> getCompletedTasks() {
        return Collections.unmodifiableList(new ArrayList<>(completedTasks));
    }

    public Set<Protos.OfferID> getOfferIds() {
        return Collections.unmodifiableSet(offerIds);
    }

    public Resources getUsedResources() {
        return sum(usedResources);
    }

    public Resources getOfferedResources() {
        return sum(offeredResources);
    }

    public Optional<Protos.TaskInfo> getPendingTask(Protos.TaskID taskId) {
        return Optional.ofNullable(pendingTasks.get(taskId));
    }

    void addPendingTask(Protos.TaskInfo taskInfo) {
        pendingTasks.put(taskInfo.getTaskId(), taskInfo);
    }

    Optional<Protos.TaskInfo> removePendingTask(Protos.TaskID taskId) {
        return Optional.ofNullable(pendingTasks.remove(taskId));
    }

    void addTask(Protos.Task task) {
        tasks.put(task.getTaskId(), task);
        addTo(usedResources, task.getSlaveId(), Resources.of(task.getResourcesList()));
    }

    /**
     * Replaces an active task with an updated copy, without changing its resources.
     */
    void updateTask(Protos.Task task) {
        tasks.put(task.getTaskId(), task);
    }

    /**
     * Moves a task into the completed history and releases its resources.
     */
    void completeTask(Protos.Task task) {
        tasks.remove(task.getTaskId());
        removeFrom(usedResources, task.getSlaveId(), Resources.of(task.getResourcesList()));
        completedTasks.add(task);
    }

    void addOffer(Protos.Offer offer) {
        offerIds.add(offer.getId());
        addTo(offeredResources, offer.getSlaveId(), Resources.of(offer.getResourcesList()));
    }

    void removeOffer(Protos.Offer offer) {
        offerIds.remove(offer.getId());
        removeFrom(offeredResources, offer.getSlaveId(), Resources.of(offer.getResourcesList()));
    }

    private static void addTo(Map<Protos.SlaveID, Resources> map, Protos.SlaveID agentId, Resources resources) {
        map.put(agentId, map.getOrDefault(agentId, Resources.empty()).plus(resources));
    }

    private static void removeFrom(Map<Protos.SlaveID, Resources> map, Protos.SlaveID agentId, Resources resources) {
        Resources remaining = map.getOrDefault(agentId, Resources.empty()).minus(resources);
        if (remaining.isEmpty()) {
            map.remove(agentId);
        } else {
            map.put(agentId, remaining);
        }
    }

    private static Resources sum(Map<Protos.SlaveID, Resources> map) {
        Resources total = Resources.empty();
        for (Resources resources : map.values()) {
            total = total.plus(resources);
        }
        return total;
    }

    @Override
    public String toString() {
        return String.format("Framework{id=%s, name=%s}", id.getValue(), info.getName());
    }
}
