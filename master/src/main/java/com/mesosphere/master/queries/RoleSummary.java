package com.mesosphere.master.queries;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Immutable JSON serialization object describing a role: the registered frameworks subscribed to it and the resources
 * their tasks use under it.
 */
public final class RoleSummary {

    private final String name;
    private final List<String> frameworkIds;
    private final Map<String, Object> usedResources;

    RoleSummary(String name, Collection<String> frameworkIds, Map<String, Object> usedResources) {
        this.name = name;
        this.frameworkIds = ImmutableList.copyOf(frameworkIds);
        this.usedResources = usedResources;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("frameworks")
    public List<String> getFrameworkIds() {
        return frameworkIds;
    }

    @JsonProperty("resources")
    public Map<String, Object> getUsedResources() {
        return usedResources;
    }

    @Override
    public boolean equals(Object o) {
        return EqualsBuilder.reflectionEquals(this, o);
    }

    @Override
    public int hashCode() {
        return HashCodeBuilder.reflectionHashCode(this);
    }

    @Override
    public String toString() {
        return String.format("RoleSummary{name=%s, frameworks=%s}", name, frameworkIds);
    }
}
