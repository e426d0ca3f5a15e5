package com.mesosphere.master.offer;

import com.mesosphere.master.framework.Allocator;
import com.mesosphere.master.framework.Messenger;
import com.mesosphere.master.metrics.Metrics;
import com.mesosphere.master.state.Agent;
import com.mesosphere.master.state.MasterState;

import com.google.common.collect.ImmutableList;
import org.apache.mesos.Protos;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Withdraws outstanding offers from frameworks, returning their resources to the allocator.
 *
 * <p>All methods must be called by the master's dispatcher with the {@link MasterState} write lock held. Each method
 * takes a snapshot of the offers it walks, so the ledger may be modified while walking them.
 */
public class OfferRescinder {

    private static final Logger LOGGER = LoggingUtils.getLogger(OfferRescinder.class);

    private final Allocator allocator;
    private final Messenger messenger;

    public OfferRescinder(Allocator allocator, Messenger messenger) {
        this.allocator = allocator;
        this.messenger = messenger;
    }

    /**
     * Returns a filter which keeps recovered resources from being re-offered to the same framework for the provided
     * number of seconds.
     */
    public static Protos.Filters refuseFor(double seconds) {
        return Protos.Filters.newBuilder().setRefuseSeconds(seconds).build();
    }

    /**
     * Rescinds an outstanding offer: its resources go back to the allocator, it leaves the ledger, and its framework
     * is told it is no longer valid.
     */
    public void rescind(MasterState state, Protos.Offer offer, Optional<Protos.Filters> filters) {
        allocator.recoverResources(
                offer.getFrameworkId(), offer.getSlaveId(), Resources.of(offer.getResourcesList()), filters);
        state.removeOffer(offer.getId());
        messenger.rescindOffer(offer.getFrameworkId(), offer.getId());
        Metrics.incrementRescindedOffers();
        LOGGER.info("Rescinded offer {} from framework {} on agent {}",
                offer.getId().getValue(), offer.getFrameworkId().getValue(), offer.getSlaveId().getValue());
    }

    /**
     * Rescinds every offer outstanding against the agent, without any filter on the recovered resources.
     */
    public void rescindAll(MasterState state, Agent agent) {
        for (Protos.Offer offer : state.getOffers(agent)) {
            rescind(state, offer, Optional.empty());
        }
    }

    /**
     * Rescinds just enough of the agent's offers to make the operation's required resources available.
     *
     * <p>Offers are visited in id order. An offer which holds none of the still-missing resources is skipped. Each
     * rescinded offer's resources are recovered with the provided filter, so that the allocator does not hand them
     * straight back out while the operation is being applied. Rescission stops as soon as the operation can be
     * applied to the recovered resources.
     *
     * <p>The filter only narrows the window in which the allocator may re-offer the resources. It does not close it:
     * the operation may still fail to apply against the allocator.
     */
    public Rescission reconcile(
            MasterState state,
            Agent agent,
            Resources required,
            ResourceOperation operation,
            Protos.Filters filters) {
        Resources missing = required;
        Resources recovered = Resources.empty();
        List<Protos.OfferID> rescinded = new ArrayList<>();
        boolean satisfied = false;

        for (Protos.Offer offer : state.getOffers(agent)) {
            Resources offered = Resources.of(offer.getResourcesList());
            if (missing.minus(offered).equals(missing)) {
                LOGGER.debug("Offer {} holds none of the missing resources {}", offer.getId().getValue(), missing);
                continue;
            }

            recovered = recovered.plus(offered);
            missing = missing.minus(offered);
            rescind(state, offer, Optional.of(filters));
            rescinded.add(offer.getId());

            try {
                operation.apply(recovered);
                satisfied = true;
                break;
            } catch (InvalidOperationException e) {
                LOGGER.debug("Recovered resources do not cover {} yet: {}", operation, e.getMessage());
            }
        }

        LOGGER.info("Rescinded {} offer{} on agent {} for {}, recovering {}",
                rescinded.size(), rescinded.size() == 1 ? "" : "s", agent.getId().getValue(), operation, recovered);
        return new Rescission(rescinded, recovered, satisfied);
    }

    /**
     * The outcome of {@link #reconcile(MasterState, Agent, Resources, ResourceOperation, Protos.Filters)}.
     */
    public static final class Rescission {
        private final List<Protos.OfferID> rescindedOfferIds;
        private final Resources recovered;
        private final boolean satisfied;

        Rescission(List<Protos.OfferID> rescindedOfferIds, Resources recovered, boolean satisfied) {
            this.rescindedOfferIds = ImmutableList.copyOf(rescindedOfferIds);
            this.recovered = recovered;
            this.satisfied = satisfied;
        }

        /**
         * Returns the rescinded offers, in the order they were rescinded.
         */
        public List<Protos.OfferID> getRescindedOfferIds() {
            return rescindedOfferIds;
        }

        public Resources getRecovered() {
            return recovered;
        }

        /**
         * Returns whether the operation could be applied to the recovered resources alone.
         */
        public boolean isSatisfied() {
            return satisfied;
        }
    }
}
