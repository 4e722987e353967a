package com.opcpub.nodeconfig.export;

/**
 * Entries exported from the live structure together with the node configuration version they
 * correspond to.
 */
public record NodeConfigurationSnapshot<T>(T entries, long version) {
}
