package com.github.salilvnair.convroute.engine.core;

/**
 * Read-only view of the live connection table, owned by the transport layer.
 */
public interface SessionDirectory {

    int activeSessions();
}
