package com.opcpub.nodeconfig.file;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Record of the flat (legacy) file schema. Either {@code nodeId} (one node with endpoint defaults)
 * or {@code opcNodes} (the grouped form) is populated. Every file the gateway accepts is read through
 * this shape; the gateway only writes it for the node id listing, with just {@code endpointUrl} and
 * {@code nodeId} set.
 */
public final class ConfigurationFileEntryLegacy {

    private final String endpointUrl;
    private final Boolean useSecurity;
    private final AuthenticationMode authenticationMode;
    private final EncryptedCredential encryptedCredential;
    private final String nodeId;
    private final List<OpcNodeOnEndpoint> opcNodes;

    @JsonCreator
    public ConfigurationFileEntryLegacy(
            @JsonProperty("endpointUrl") @JsonAlias("EndpointUrl") String endpointUrl,
            @JsonProperty("useSecurity") @JsonAlias("UseSecurity") Boolean useSecurity,
            @JsonProperty("authenticationMode") @JsonAlias({"OpcAuthenticationMode", "opcAuthenticationMode"}) AuthenticationMode authenticationMode,
            @JsonProperty("encryptedCredential") @JsonAlias({"EncryptedAuthCredential", "encryptedAuthCredential"}) EncryptedCredential encryptedCredential,
            @JsonProperty("nodeId") @JsonAlias("NodeId") String nodeId,
            @JsonProperty("opcNodes") @JsonAlias("OpcNodes") List<OpcNodeOnEndpoint> opcNodes) {
        this.endpointUrl = endpointUrl;
        this.useSecurity = useSecurity;
        this.authenticationMode = authenticationMode;
        this.encryptedCredential = encryptedCredential;
        this.nodeId = nodeId;
        this.opcNodes = opcNodes != null ? List.copyOf(opcNodes) : null;
    }

    /** Node id listing record: only the endpoint and the node id are set. */
    public static ConfigurationFileEntryLegacy ofNodeId(String endpointUrl, String nodeId) {
        return new ConfigurationFileEntryLegacy(endpointUrl, null, null, null, nodeId, null);
    }

    public String getEndpointUrl() {
        return endpointUrl;
    }

    /** Null when absent in the file; readers treat that as {@code true}. */
    public Boolean getUseSecurity() {
        return useSecurity;
    }

    /** Null when absent in the file; readers treat that as {@link AuthenticationMode#ANONYMOUS}. */
    public AuthenticationMode getAuthenticationMode() {
        return authenticationMode;
    }

    public EncryptedCredential getEncryptedCredential() {
        return encryptedCredential;
    }

    public String getNodeId() {
        return nodeId;
    }

    /** Null when the record uses the {@code nodeId} form. */
    public List<OpcNodeOnEndpoint> getOpcNodes() {
        return opcNodes;
    }
}
