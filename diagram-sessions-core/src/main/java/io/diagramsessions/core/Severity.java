package io.diagramsessions.core;

/**
 * Severity carried by status and validation actions.
 */
public enum Severity {
    OK,
    INFO,
    WARNING,
    ERROR
}
