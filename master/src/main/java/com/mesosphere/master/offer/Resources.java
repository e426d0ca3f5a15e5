package com.mesosphere.master.offer;

import com.google.common.collect.ImmutableList;
import org.apache.mesos.Protos;
import org.apache.mesos.Protos.Resource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * An immutable multiset of Mesos {@link Resource}s.
 *
 * <p>Entries whose reservation or disk metadata differ are kept apart even when their values could otherwise be
 * combined. Persistent volumes are never merged with one another, and are only subtracted by an identical volume.
 * Scalar values are accounted at a fixed precision of {@link Constants#SCALAR_PRECISION_DIGITS} digits.
 */
public final class Resources implements Iterable<Resource> {

    private static final Resources EMPTY = new Resources(Collections.emptyList());

    private final List<Resource> resources;

    private Resources(List<Resource> resources) {
        this.resources = ImmutableList.copyOf(resources);
    }

    public static Resources empty() {
        return EMPTY;
    }

    public static Resources of(Resource... resources) {
        return of(ImmutableList.copyOf(resources));
    }

    public static Resources of(Collection<Resource> resources) {
        List<Resource> merged = new ArrayList<>();
        for (Resource resource : resources) {
            add(merged, resource);
        }
        return new Resources(merged);
    }

    public Resources plus(Resource resource) {
        List<Resource> merged = new ArrayList<>(resources);
        add(merged, resource);
        return new Resources(merged);
    }

    public Resources plus(Resources other) {
        List<Resource> merged = new ArrayList<>(resources);
        for (Resource resource : other) {
            add(merged, resource);
        }
        return new Resources(merged);
    }

    public Resources minus(Resource resource) {
        List<Resource> remaining = new ArrayList<>(resources);
        subtract(remaining, resource);
        return new Resources(remaining);
    }

    public Resources minus(Resources other) {
        List<Resource> remaining = new ArrayList<>(resources);
        for (Resource resource : other) {
            subtract(remaining, resource);
        }
        return new Resources(remaining);
    }

    /**
     * Returns whether a single entry of this instance holds at least the provided resource.
     */
    public boolean contains(Resource resource) {
        return contains(resources, resource);
    }

    /**
     * Returns whether all of {@code other} could be subtracted from this instance, one entry at a time.
     */
    public boolean contains(Resources other) {
        List<Resource> remaining = new ArrayList<>(resources);
        for (Resource resource : other) {
            if (!contains(remaining, resource)) {
                return false;
            }
            subtract(remaining, resource);
        }
        return true;
    }

    /**
     * Returns the same resources with all reservation information removed.
     */
    public Resources flatten() {
        return Resources.of(resources.stream().map(ResourceUtils::flatten).collect(Collectors.toList()));
    }

    /**
     * Returns the reserved resources, grouped by the role they're reserved for.
     */
    public Map<String, Resources> reserved() {
        Map<String, List<Resource>> byRole = new TreeMap<>();
        for (Resource resource : resources) {
            if (ResourceUtils.isReserved(resource)) {
                byRole.computeIfAbsent(ResourceUtils.getRole(resource), r -> new ArrayList<>()).add(resource);
            }
        }
        Map<String, Resources> result = new TreeMap<>();
        for (Map.Entry<String, List<Resource>> entry : byRole.entrySet()) {
            result.put(entry.getKey(), Resources.of(entry.getValue()));
        }
        return result;
    }

    public Resources reserved(String role) {
        return filter(r -> ResourceUtils.isReserved(r) && role.equals(ResourceUtils.getRole(r)));
    }

    public Resources unreserved() {
        return filter(r -> !ResourceUtils.isReserved(r));
    }

    public Resources persistentVolumes() {
        return filter(ResourceUtils::isPersistentVolume);
    }

    public Resources filter(Predicate<Resource> predicate) {
        return new Resources(resources.stream().filter(predicate).collect(Collectors.toList()));
    }

    /**
     * Returns the sum of all scalar entries with the provided name, regardless of their reservations.
     */
    public double getScalar(String name) {
        double sum = 0;
        for (Resource resource : resources) {
            if (resource.getName().equals(name) && resource.getType() == Protos.Value.Type.SCALAR) {
                sum += resource.getScalar().getValue();
            }
        }
        return ValueUtils.round(sum);
    }

    public boolean isEmpty() {
        return resources.isEmpty();
    }

    public int size() {
        return resources.size();
    }

    public List<Resource> toList() {
        return resources;
    }

    @Override
    public Iterator<Resource> iterator() {
        return resources.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Resources)) {
            return false;
        }
        Resources other = (Resources) o;
        return contains(other) && other.contains(this);
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (Resource resource : resources) {
            hash += ResourceUtils.getIdentity(resource).hashCode();
        }
        return hash;
    }

    @Override
    public String toString() {
        return resources.stream().map(TextFormatter::toString).collect(Collectors.joining("; ", "[", "]"));
    }

    private static void add(List<Resource> entries, Resource resource) {
        if (ValueUtils.isEmpty(ValueUtils.getValue(resource))) {
            return;
        }
        if (!ResourceUtils.isPersistentVolume(resource)) {
            Resource identity = ResourceUtils.getIdentity(resource);
            for (int i = 0; i < entries.size(); ++i) {
                Resource entry = entries.get(i);
                if (ResourceUtils.getIdentity(entry).equals(identity)) {
                    entries.set(i, ValueUtils.withValue(entry,
                            ValueUtils.add(ValueUtils.getValue(entry), ValueUtils.getValue(resource))));
                    return;
                }
            }
        }
        entries.add(resource);
    }

    private static void subtract(List<Resource> entries, Resource resource) {
        for (int i = 0; i < entries.size(); ++i) {
            Resource entry = entries.get(i);
            if (!subtractable(entry, resource)) {
                continue;
            }
            if (ResourceUtils.isPersistentVolume(entry)) {
                entries.remove(i);
                return;
            }
            Protos.Value remaining = ValueUtils.subtract(ValueUtils.getValue(entry), ValueUtils.getValue(resource));
            if (ValueUtils.isEmpty(remaining)) {
                entries.remove(i);
            } else {
                entries.set(i, ValueUtils.withValue(entry, remaining));
            }
            return;
        }
    }

    private static boolean subtractable(Resource entry, Resource resource) {
        if (ResourceUtils.isPersistentVolume(entry) || ResourceUtils.isPersistentVolume(resource)) {
            return entry.equals(resource);
        }
        return ResourceUtils.getIdentity(entry).equals(ResourceUtils.getIdentity(resource));
    }

    private static boolean contains(List<Resource> entries, Resource resource) {
        for (Resource entry : entries) {
            if (subtractable(entry, resource)
                    && ValueUtils.contains(ValueUtils.getValue(entry), ValueUtils.getValue(resource))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Compact single-line rendering of a resource for log output.
     */
    private static final class TextFormatter {
        private static String toString(Resource resource) {
            StringBuilder sb = new StringBuilder(resource.getName());
            String role = ResourceUtils.getRole(resource);
            if (!Constants.ANY_ROLE.equals(role)) {
                sb.append('(').append(role).append(')');
            }
            ResourceUtils.getPersistenceId(resource).ifPresent(id -> sb.append("[").append(id).append("]"));
            sb.append(':');
            switch (resource.getType()) {
                case SCALAR:
                    sb.append(resource.getScalar().getValue());
                    break;
                case RANGES:
                    sb.append(resource.getRanges().getRangeList().stream()
                            .map(r -> r.getBegin() + "-" + r.getEnd())
                            .collect(Collectors.joining(", ", "[", "]")));
                    break;
                case SET:
                    sb.append(resource.getSet().getItemList().stream()
                            .collect(Collectors.joining(", ", "{", "}")));
                    break;
                default:
                    sb.append("?");
                    break;
            }
            return sb.toString();
        }
    }
}
