package com.opcpub.nodeconfig.load;

import com.opcpub.nodeconfig.file.AuthenticationMode;
import com.opcpub.nodeconfig.file.EncryptedCredential;
import com.opcpub.nodeconfig.id.NodeIdentifier;

import java.util.Objects;

/**
 * One node to publish, flattened from the file: the node, its endpoint and connection settings, and
 * the optional per-node settings exactly as configured (null = not configured, default applies later).
 */
public final class NodePublishingConfiguration {

    private final NodeIdentifier identifier;
    private final String endpointUrl;
    private final boolean useSecurity;
    private final Integer publishingInterval;
    private final Integer samplingInterval;
    private final String displayName;
    private final Integer heartbeatInterval;
    private final Boolean skipFirst;
    private final AuthenticationMode authenticationMode;
    private final EncryptedCredential encryptedCredential;

    private NodePublishingConfiguration(Builder b) {
        this.identifier = b.identifier;
        this.endpointUrl = Objects.requireNonNull(b.endpointUrl, "endpointUrl");
        this.useSecurity = b.useSecurity;
        this.publishingInterval = b.publishingInterval;
        this.samplingInterval = b.samplingInterval;
        this.displayName = b.displayName;
        this.heartbeatInterval = b.heartbeatInterval;
        this.skipFirst = b.skipFirst;
        this.authenticationMode = b.authenticationMode != null ? b.authenticationMode : AuthenticationMode.ANONYMOUS;
        this.encryptedCredential = b.encryptedCredential;
    }

    /** Resolved node; null only when built by a caller that could not resolve it. */
    public NodeIdentifier getIdentifier() {
        return identifier;
    }

    /** Node id as written in the configuration. */
    public String getOriginalId() {
        return identifier != null ? identifier.getOriginalId() : null;
    }

    public String getEndpointUrl() {
        return endpointUrl;
    }

    public boolean isUseSecurity() {
        return useSecurity;
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

    public AuthenticationMode getAuthenticationMode() {
        return authenticationMode;
    }

    public EncryptedCredential getEncryptedCredential() {
        return encryptedCredential;
    }

    public static Builder builder(NodeIdentifier identifier, String endpointUrl) {
        return new Builder(identifier, endpointUrl);
    }

    @Override
    public String toString() {
        return "NodePublishingConfiguration{" + getOriginalId() + " on " + endpointUrl
                + ", publishingInterval=" + publishingInterval + "}";
    }

    public static final class Builder {
        private final NodeIdentifier identifier;
        private final String endpointUrl;
        private boolean useSecurity = true;
        private Integer publishingInterval;
        private Integer samplingInterval;
        private String displayName;
        private Integer heartbeatInterval;
        private Boolean skipFirst;
        private AuthenticationMode authenticationMode = AuthenticationMode.ANONYMOUS;
        private EncryptedCredential encryptedCredential;

        private Builder(NodeIdentifier identifier, String endpointUrl) {
            this.identifier = identifier;
            this.endpointUrl = endpointUrl != null ? endpointUrl.trim() : null;
        }

        public Builder useSecurity(boolean useSecurity) {
            this.useSecurity = useSecurity;
            return this;
        }

        public Builder publishingInterval(Integer publishingInterval) {
            this.publishingInterval = publishingInterval;
            return this;
        }

        public Builder samplingInterval(Integer samplingInterval) {
            this.samplingInterval = samplingInterval;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder heartbeatInterval(Integer heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder skipFirst(Boolean skipFirst) {
            this.skipFirst = skipFirst;
            return this;
        }

        public Builder authenticationMode(AuthenticationMode authenticationMode) {
            this.authenticationMode = authenticationMode;
            return this;
        }

        public Builder encryptedCredential(EncryptedCredential encryptedCredential) {
            this.encryptedCredential = encryptedCredential;
            return this;
        }

        public NodePublishingConfiguration build() {
            return new NodePublishingConfiguration(this);
        }
    }
}
