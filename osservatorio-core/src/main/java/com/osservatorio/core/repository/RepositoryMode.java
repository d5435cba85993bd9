package com.osservatorio.core.repository;

/**
 * What the repository can serve given the health of its two stores.
 */
public enum RepositoryMode {
    FULL,
    // analytics store down: metadata reads and writes only
    METADATA_ONLY,
    // metadata store down: analytics reads only, every write rejected
    ANALYTICS_READ_ONLY,
    UNAVAILABLE;

    public static RepositoryMode of(boolean metadataHealthy, boolean analyticsHealthy) {
        if (metadataHealthy && analyticsHealthy) {
            return FULL;
        }
        if (metadataHealthy) {
            return METADATA_ONLY;
        }
        return analyticsHealthy ? ANALYTICS_READ_ONLY : UNAVAILABLE;
    }
}
