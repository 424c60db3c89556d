package com.platform.dbwatch.healthcheck;

/**
 * Which instances of a cluster a check runs against.
 */
public enum InstanceScope {
    WRITER_ONLY,
    ALL_INSTANCES
}
