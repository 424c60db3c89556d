package com.platform.dbwatch.statement;

/**
 * Canonical text of a statement and its signature.
 */
public record NormalizedStatement(String canonicalText, String signature) {
}
