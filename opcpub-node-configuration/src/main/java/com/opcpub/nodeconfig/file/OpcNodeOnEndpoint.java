package com.opcpub.nodeconfig.file;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One node inside an endpoint block ({@code opcNodes[]}). Every field except {@code id} is optional;
 * an absent field means the process default applies and is not written back.
 */
public final class OpcNodeOnEndpoint {

    private final String id;
    private final String expandedId;
    private final Integer publishingInterval;
    private final Integer samplingInterval;
    private final String displayName;
    private final Integer heartbeatInterval;
    private final Boolean skipFirst;

    @JsonCreator
    public OpcNodeOnEndpoint(
            @JsonProperty("id") @JsonAlias("Id") String id,
            @JsonProperty("expandedId") @JsonAlias({"ExpandedNodeId", "expandedNodeId"}) String expandedId,
            @JsonProperty("publishingInterval") @JsonAlias({"OpcPublishingInterval", "opcPublishingInterval"}) Integer publishingInterval,
            @JsonProperty("samplingInterval") @JsonAlias({"OpcSamplingInterval", "opcSamplingInterval"}) Integer samplingInterval,
            @JsonProperty("displayName") @JsonAlias("DisplayName") String displayName,
            @JsonProperty("heartbeatInterval") @JsonAlias("HeartbeatInterval") Integer heartbeatInterval,
            @JsonProperty("skipFirst") @JsonAlias("SkipFirst") Boolean skipFirst) {
        this.id = id;
        this.expandedId = expandedId;
        this.publishingInterval = publishingInterval;
        this.samplingInterval = samplingInterval;
        this.displayName = displayName;
        this.heartbeatInterval = heartbeatInterval;
        this.skipFirst = skipFirst;
    }

    /** Node with only an id; all other settings come from defaults. */
    public static OpcNodeOnEndpoint of(String id) {
        return new OpcNodeOnEndpoint(id, null, null, null, null, null, null);
    }

    public String getId() {
        return id;
    }

    public String getExpandedId() {
        return expandedId;
    }

    public Integer getPublishingInterval() {
        return publishingInterval;
    }

    public Integer getSamplingInterval() {
        return samplingInterval;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Integer getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public Boolean getSkipFirst() {
        return skipFirst;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OpcNodeOnEndpoint that = (OpcNodeOnEndpoint) o;
        return Objects.equals(id, that.id)
                && Objects.equals(expandedId, that.expandedId)
                && Objects.equals(publishingInterval, that.publishingInterval)
                && Objects.equals(samplingInterval, that.samplingInterval)
                && Objects.equals(displayName, that.displayName)
                && Objects.equals(heartbeatInterval, that.heartbeatInterval)
                && Objects.equals(skipFirst, that.skipFirst);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, expandedId, publishingInterval, samplingInterval, displayName, heartbeatInterval, skipFirst);
    }
}
