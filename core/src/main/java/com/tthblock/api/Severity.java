package com.tthblock.api;

/**
 * Severity of a user-facing notification.
 */
public enum Severity {
    INFO, WARNING, ERROR
}
