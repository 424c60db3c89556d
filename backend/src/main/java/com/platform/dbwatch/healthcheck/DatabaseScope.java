package com.platform.dbwatch.healthcheck;

/**
 * Which databases of an instance a check runs against.
 */
public enum DatabaseScope {
    SINGLE_DATABASE,
    ALL_USER_DATABASES
}
