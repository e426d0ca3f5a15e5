package com.mesosphere.master.framework;

import com.mesosphere.master.offer.Resources;

import org.apache.mesos.Protos;

/**
 * Fire-and-forget delivery of master notifications to agents and frameworks. No acknowledgement is guaranteed for any
 * of these messages.
 */
public interface Messenger {

    void shutdownAgent(Protos.SlaveID agentId, ShutdownNotice notice);

    void rescindOffer(Protos.FrameworkID frameworkId, Protos.OfferID offerId);

    void sendStatusUpdate(Protos.FrameworkID frameworkId, Protos.TaskStatus status);

    /**
     * Tells a framework that an agent hosting some of its tasks has been removed.
     */
    void agentLost(Protos.FrameworkID frameworkId, Protos.SlaveID agentId);

    /**
     * Asks an agent to shut down all executors belonging to a framework.
     */
    void shutdownFramework(Protos.SlaveID agentId, Protos.FrameworkID frameworkId);

    /**
     * Sends an agent the full set of resources which it should checkpoint.
     */
    void checkpointResources(Protos.SlaveID agentId, Resources checkpointed);
}
