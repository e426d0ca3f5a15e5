package com.mesosphere.master.offer;

import org.apache.mesos.Protos;

import java.util.Collection;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * This class encapsulates common methods for inspecting the reservation and volume metadata of Resources.
 */
public class ResourceUtils {

    private ResourceUtils() {
        // do not instantiate
    }

    /**
     * Returns the role which the resource is reserved for, or {@link Constants#ANY_ROLE} if it's unreserved.
     */
    @SuppressWarnings("deprecation")
    public static String getRole(Protos.Resource resource) {
        int count = resource.getReservationsCount();
        if (count > 0) {
            return resource.getReservations(count - 1).getRole();
        } else if (resource.hasRole()) {
            return resource.getRole();
        }
        return Constants.ANY_ROLE;
    }

    @SuppressWarnings("deprecation")
    public static Optional<Protos.Resource.ReservationInfo> getReservation(Protos.Resource resource) {
        int count = resource.getReservationsCount();
        if (count > 0) {
            // Refined reservations are stacked: the last entry is the most specific role.
            return Optional.of(resource.getReservations(count - 1));
        } else if (resource.hasReservation()) {
            return Optional.of(resource.getReservation());
        } else {
            return Optional.empty();
        }
    }

    public static Optional<String> getPrincipal(Protos.Resource resource) {
        return getReservation(resource)
                .filter(Protos.Resource.ReservationInfo::hasPrincipal)
                .map(Protos.Resource.ReservationInfo::getPrincipal);
    }

    public static boolean isReserved(Protos.Resource resource) {
        return !Constants.ANY_ROLE.equals(getRole(resource));
    }

    /**
     * Returns whether the resource carries a dynamic reservation, as opposed to a static role assignment made by the
     * agent at startup.
     */
    @SuppressWarnings("deprecation")
    public static boolean isDynamicallyReserved(Protos.Resource resource) {
        if (resource.getReservationsCount() > 0) {
            return resource.getReservations(resource.getReservationsCount() - 1).getType()
                    == Protos.Resource.ReservationInfo.Type.DYNAMIC;
        }
        return resource.hasReservation();
    }

    public static Optional<String> getPersistenceId(Protos.Resource resource) {
        if (isPersistentVolume(resource)) {
            return Optional.of(resource.getDisk().getPersistence().getId());
        }

        return Optional.empty();
    }

    public static boolean isPersistentVolume(Protos.Resource resource) {
        return resource.hasDisk() && resource.getDisk().hasPersistence();
    }

    /**
     * Returns a copy of the resource with all reservation information removed, leaving an unreserved resource of the
     * same value and disk metadata.
     */
    @SuppressWarnings("deprecation")
    public static Protos.Resource flatten(Protos.Resource resource) {
        return resource.toBuilder()
                .clearReservations()
                .clearReservation()
                .clearRole()
                .build();
    }

    /**
     * Returns a copy of the resource with any disk information removed, which is the form of a volume's backing disk
     * before the volume was created.
     */
    public static Protos.Resource stripDisk(Protos.Resource resource) {
        return resource.toBuilder().clearDisk().build();
    }

    /**
     * Returns the name-only identity of the resource: everything except its value. Two resources may only be merged
     * when their identities are equal.
     */
    public static Protos.Resource getIdentity(Protos.Resource resource) {
        return resource.toBuilder().clearScalar().clearRanges().clearSet().build();
    }

    public static Collection<String> getPersistenceIds(Collection<Protos.Resource> resources) {
        return resources.stream()
                .map(ResourceUtils::getPersistenceId)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect(Collectors.toList());
    }
}
