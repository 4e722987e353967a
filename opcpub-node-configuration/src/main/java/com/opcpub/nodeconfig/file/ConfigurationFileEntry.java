package com.opcpub.nodeconfig.file;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Endpoint block of the grouped file schema: connection settings of one endpoint and the nodes
 * published on it. This is the shape the gateway writes when it persists its configuration.
 */
public final class ConfigurationFileEntry {

    private final String endpointUrl;
    private final boolean useSecurity;
    private final AuthenticationMode authenticationMode;
    private final EncryptedCredential encryptedCredential;
    private final List<OpcNodeOnEndpoint> opcNodes;

    @JsonCreator
    public ConfigurationFileEntry(
            @JsonProperty("endpointUrl") @JsonAlias("EndpointUrl") String endpointUrl,
            @JsonProperty("useSecurity") @JsonAlias("UseSecurity") Boolean useSecurity,
            @JsonProperty("authenticationMode") @JsonAlias({"OpcAuthenticationMode", "opcAuthenticationMode"}) AuthenticationMode authenticationMode,
            @JsonProperty("encryptedCredential") @JsonAlias({"EncryptedAuthCredential", "encryptedAuthCredential"}) EncryptedCredential encryptedCredential,
            @JsonProperty("opcNodes") @JsonAlias("OpcNodes") List<OpcNodeOnEndpoint> opcNodes) {
        this.endpointUrl = endpointUrl;
        this.useSecurity = useSecurity == null || useSecurity;
        this.authenticationMode = authenticationMode != null ? authenticationMode : AuthenticationMode.ANONYMOUS;
        this.encryptedCredential = encryptedCredential;
        this.opcNodes = opcNodes != null ? List.copyOf(opcNodes) : List.of();
    }

    public String getEndpointUrl() {
        return endpointUrl;
    }

    public boolean isUseSecurity() {
        return useSecurity;
    }

    public AuthenticationMode getAuthenticationMode() {
        return authenticationMode;
    }

    public EncryptedCredential getEncryptedCredential() {
        return encryptedCredential;
    }

    public List<OpcNodeOnEndpoint> getOpcNodes() {
        return opcNodes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConfigurationFileEntry that = (ConfigurationFileEntry) o;
        return useSecurity == that.useSecurity
                && Objects.equals(endpointUrl, that.endpointUrl)
                && authenticationMode == that.authenticationMode
                && Objects.equals(encryptedCredential, that.encryptedCredential)
                && Objects.equals(opcNodes, that.opcNodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(endpointUrl, useSecurity, authenticationMode, encryptedCredential, opcNodes);
    }
}
