package com.walkierelay.server.lifecycle;

/**
 * Ends the process when the shutdown deadline passes.
 */
@FunctionalInterface
public interface ProcessTerminator {
    void terminate(int status);
}
