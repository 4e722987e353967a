package com.opcpub.nodeconfig.runtime;

import com.opcpub.nodeconfig.file.AuthenticationMode;
import com.opcpub.nodeconfig.file.EncryptedCredential;
import org.eclipse.milo.opcua.stack.core.NamespaceTable;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UShort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;

/**
 * Connection to one OPC UA endpoint and the subscriptions configured on it.
 * <p>
 * The subscription list and the item lists below it are guarded by the session lock. Callers that
 * walk them must hold {@link #lockSession()}; the lock is not reentrant and must not be held while
 * acquiring the registry locks. State and namespace table are written by the protocol client through
 * {@link #updateState(SessionState, NamespaceTable)}.
 */
public final class OpcSession {

    private final String endpointUrl;
    private final boolean useSecurity;
    private final AuthenticationMode authenticationMode;
    private final EncryptedCredential encryptedCredential;
    private final List<OpcSubscription> subscriptions = new ArrayList<>();
    private final Semaphore sessionLock = new Semaphore(1);
    private volatile SessionState state = SessionState.DISCONNECTED;
    private volatile NamespaceTable namespaceTable;

    public OpcSession(String endpointUrl, boolean useSecurity,
                      AuthenticationMode authenticationMode, EncryptedCredential encryptedCredential) {
        this.endpointUrl = Objects.requireNonNull(endpointUrl, "endpointUrl");
        this.useSecurity = useSecurity;
        this.authenticationMode = authenticationMode != null ? authenticationMode : AuthenticationMode.ANONYMOUS;
        this.encryptedCredential = encryptedCredential;
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

    public SessionState getState() {
        return state;
    }

    public boolean isConnected() {
        return state == SessionState.CONNECTED;
    }

    /** Endpoint URLs compare case-insensitively; a null filter matches every session. */
    public boolean matchesEndpoint(String endpointUrlFilter) {
        return endpointUrlFilter == null || endpointUrl.equalsIgnoreCase(endpointUrlFilter.trim());
    }

    public void lockSession() {
        sessionLock.acquireUninterruptibly();
    }

    public void releaseSession() {
        sessionLock.release();
    }

    /**
     * Called by the protocol client when the connection changes. The namespace table is the server's
     * table of the current connection, or null when disconnected.
     */
    public void updateState(SessionState newState, NamespaceTable newNamespaceTable) {
        Objects.requireNonNull(newState, "newState");
        lockSession();
        try {
            this.namespaceTable = newNamespaceTable;
            this.state = newState;
        } finally {
            releaseSession();
        }
    }

    /**
     * Index of a namespace URI in the server's namespace table. Caller must hold the session lock.
     *
     * @return empty when there is no table or the URI is unknown to the server
     */
    public Optional<UShort> getNamespaceIndexUnlocked(String namespaceUri) {
        NamespaceTable table = namespaceTable;
        if (table == null || namespaceUri == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(table.getIndex(namespaceUri));
    }

    /** Subscriptions in creation order. Caller must hold the session lock. */
    public List<OpcSubscription> getSubscriptionsUnlocked() {
        return Collections.unmodifiableList(subscriptions);
    }

    OpcSubscription findSubscriptionUnlocked(Integer publishingInterval) {
        for (OpcSubscription subscription : subscriptions) {
            if (subscription.hasPublishingInterval(publishingInterval)) {
                return subscription;
            }
        }
        return null;
    }

    OpcSubscription getOrAddSubscriptionUnlocked(Integer publishingInterval) {
        OpcSubscription subscription = findSubscriptionUnlocked(publishingInterval);
        if (subscription == null) {
            subscription = new OpcSubscription(publishingInterval);
            subscriptions.add(subscription);
        }
        return subscription;
    }

    int countMonitoredItemsUnlocked() {
        int count = 0;
        for (OpcSubscription subscription : subscriptions) {
            count += subscription.getMonitoredItems().size();
        }
        return count;
    }

    int countMonitoredItemsUnlocked(MonitoredItemState state) {
        int count = 0;
        for (OpcSubscription subscription : subscriptions) {
            count += subscription.countItemsInState(state);
        }
        return count;
    }

    @Override
    public String toString() {
        return "OpcSession{" + endpointUrl + ", state=" + state + "}";
    }
}
