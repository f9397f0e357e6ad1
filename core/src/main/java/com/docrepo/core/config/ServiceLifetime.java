package com.docrepo.core.config;

/**
 * How long a registered service instance lives once resolved.
 */
public enum ServiceLifetime {
    /** One instance for the whole registry. */
    SINGLETON,
    /** One instance per scope. */
    SCOPED,
    /** A new instance on every resolution. */
    TRANSIENT
}
