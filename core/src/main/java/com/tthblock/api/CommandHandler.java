package com.tthblock.api;

/**
 * Interface for console commands (e.g. "/block", "/status").
 */
public interface CommandHandler {
    void handle(String command, String[] args);
}
