package com.mesosphere.master.offer;

import org.apache.mesos.Protos;
import org.apache.mesos.Protos.Resource;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * An operator-initiated change to the reservations and volumes of an agent's resources.
 *
 * <p>The set of operations is closed: {@link Reserve}, {@link Unreserve}, {@link Create} and {@link Destroy}. Each
 * one knows which resources it needs to be available in order to succeed, and how to apply itself to a set of
 * resources.
 */
public abstract class ResourceOperation {

    private final Resources resources;

    private ResourceOperation(Resources resources) {
        this.resources = resources;
    }

    public static Reserve reserve(Resources resources) {
        return new Reserve(resources);
    }

    public static Unreserve unreserve(Resources resources) {
        return new Unreserve(resources);
    }

    public static Create create(Resources volumes) {
        return new Create(volumes);
    }

    public static Destroy destroy(Resources volumes) {
        return new Destroy(volumes);
    }

    /**
     * Converts the Mesos representation of an operation, throwing if it is not a reservation or volume operation.
     */
    public static ResourceOperation fromProto(Protos.Offer.Operation operation) throws InvalidOperationException {
        switch (operation.getType()) {
            case RESERVE:
                return reserve(Resources.of(operation.getReserve().getResourcesList()));
            case UNRESERVE:
                return unreserve(Resources.of(operation.getUnreserve().getResourcesList()));
            case CREATE:
                return create(Resources.of(operation.getCreate().getVolumesList()));
            case DESTROY:
                return destroy(Resources.of(operation.getDestroy().getVolumesList()));
            default:
                throw new InvalidOperationException(
                        String.format("Unsupported operation type: %s", operation.getType()));
        }
    }

    /**
     * Returns the resources this operation targets: reservations for {@link Reserve} and {@link Unreserve}, volumes
     * for {@link Create} and {@link Destroy}.
     */
    public Resources getResources() {
        return resources;
    }

    /**
     * Returns the resources which must be available on the agent for this operation to be applied.
     */
    public abstract Resources getRequiredResources();

    /**
     * Returns the result of applying this operation to the provided resources.
     *
     * @throws InvalidOperationException if the resources don't hold what the operation consumes
     */
    public abstract Resources apply(Resources available) throws InvalidOperationException;

    public abstract Protos.Offer.Operation.Type getType();

    public abstract Protos.Offer.Operation toProto();

    /**
     * Returns a lowercase name for the operation type, for use in logs and metric names.
     */
    public String getName() {
        return getType().name().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return resources.equals(((ResourceOperation) o).resources);
    }

    @Override
    public int hashCode() {
        return getType().hashCode() * 31 + resources.hashCode();
    }

    @Override
    public String toString() {
        return String.format("%s %s", getType(), resources);
    }

    /**
     * Dynamically reserves unreserved resources for a role.
     */
    public static final class Reserve extends ResourceOperation {

        private Reserve(Resources resources) {
            super(resources);
        }

        @Override
        public Resources getRequiredResources() {
            return getResources().flatten();
        }

        @Override
        public Resources apply(Resources available) throws InvalidOperationException {
            Resources result = available;
            for (Resource resource : getResources()) {
                if (!ResourceUtils.isDynamicallyReserved(resource)) {
                    throw new InvalidOperationException(
                            "Invalid RESERVE Operation: Resource must be dynamically reserved");
                }
                Resource flattened = ResourceUtils.flatten(resource);
                if (!result.contains(flattened)) {
                    throw new InvalidOperationException(String.format(
                            "Invalid RESERVE Operation: %s does not contain %s", result, Resources.of(flattened)));
                }
                result = result.minus(flattened).plus(resource);
            }
            return result;
        }

        @Override
        public Protos.Offer.Operation.Type getType() {
            return Protos.Offer.Operation.Type.RESERVE;
        }

        @Override
        public Protos.Offer.Operation toProto() {
            return Protos.Offer.Operation.newBuilder()
                    .setType(getType())
                    .setReserve(Protos.Offer.Operation.Reserve.newBuilder().addAllResources(getResources()))
                    .build();
        }
    }

    /**
     * Releases dynamically reserved resources back to the unreserved pool.
     */
    public static final class Unreserve extends ResourceOperation {

        private Unreserve(Resources resources) {
            super(resources);
        }

        @Override
        public Resources getRequiredResources() {
            return getResources();
        }

        @Override
        public Resources apply(Resources available) throws InvalidOperationException {
            Resources result = available;
            for (Resource resource : getResources()) {
                if (!ResourceUtils.isDynamicallyReserved(resource)) {
                    throw new InvalidOperationException(
                            "Invalid UNRESERVE Operation: Resource is not dynamically reserved");
                }
                if (!result.contains(resource)) {
                    throw new InvalidOperationException(String.format(
                            "Invalid UNRESERVE Operation: %s does not contain %s", result, Resources.of(resource)));
                }
                result = result.minus(resource).plus(ResourceUtils.flatten(resource));
            }
            return result;
        }

        @Override
        public Protos.Offer.Operation.Type getType() {
            return Protos.Offer.Operation.Type.UNRESERVE;
        }

        @Override
        public Protos.Offer.Operation toProto() {
            return Protos.Offer.Operation.newBuilder()
                    .setType(getType())
                    .setUnreserve(Protos.Offer.Operation.Unreserve.newBuilder().addAllResources(getResources()))
                    .build();
        }
    }

    /**
     * Creates persistent volumes on top of (typically reserved) disk resources.
     */
    public static final class Create extends ResourceOperation {

        private Create(Resources volumes) {
            super(volumes);
        }

        @Override
        public Resources getRequiredResources() {
            return Resources.of(getResources().toList().stream()
                    .map(ResourceUtils::stripDisk)
                    .collect(Collectors.toList()));
        }

        @Override
        public Resources apply(Resources available) throws InvalidOperationException {
            Resources result = available;
            for (Resource volume : getResources()) {
                if (!volume.hasDisk()) {
                    throw new InvalidOperationException("Invalid CREATE Operation: Missing 'disk'");
                } else if (!volume.getDisk().hasPersistence()) {
                    throw new InvalidOperationException("Invalid CREATE Operation: Missing 'persistence'");
                }
                Resource stripped = ResourceUtils.stripDisk(volume);
                if (!result.contains(stripped)) {
                    throw new InvalidOperationException("Invalid CREATE Operation: Insufficient disk resources");
                }
                result = result.minus(stripped).plus(volume);
            }
            return result;
        }

        @Override
        public Protos.Offer.Operation.Type getType() {
            return Protos.Offer.Operation.Type.CREATE;
        }

        @Override
        public Protos.Offer.Operation toProto() {
            return Protos.Offer.Operation.newBuilder()
                    .setType(getType())
                    .setCreate(Protos.Offer.Operation.Create.newBuilder().addAllVolumes(getResources()))
                    .build();
        }
    }

    /**
     * Destroys persistent volumes, returning their backing disk.
     */
    public static final class Destroy extends ResourceOperation {

        private Destroy(Resources volumes) {
            super(volumes);
        }

        @Override
        public Resources getRequiredResources() {
            return getResources();
        }

        @Override
        public Resources apply(Resources available) throws InvalidOperationException {
            Resources result = available;
            for (Resource volume : getResources()) {
                if (!volume.hasDisk()) {
                    throw new InvalidOperationException("Invalid DESTROY Operation: Missing 'disk'");
                } else if (!volume.getDisk().hasPersistence()) {
                    throw new InvalidOperationException("Invalid DESTROY Operation: Missing 'persistence'");
                }
                if (!result.contains(volume)) {
                    throw new InvalidOperationException(
                            "Invalid DESTROY Operation: Persistent volume does not exist");
                }
                result = result.minus(volume).plus(ResourceUtils.stripDisk(volume));
            }
            return result;
        }

        @Override
        public Protos.Offer.Operation.Type getType() {
            return Protos.Offer.Operation.Type.DESTROY;
        }

        @Override
        public Protos.Offer.Operation toProto() {
            return Protos.Offer.Operation.newBuilder()
                    .setType(getType())
                    .setDestroy(Protos.Offer.Operation.Destroy.newBuilder().addAllVolumes(getResources()))
                    .build();
        }
    }
}
