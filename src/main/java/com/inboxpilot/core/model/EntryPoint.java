package com.inboxpilot.core.model;

/**
 * Where a graph run starts. Fresh conversations start at {@link #PARSE}; resumed
 * ones skip everything that produced the reviewed output.
 */
public enum EntryPoint {
    PARSE,
    ROUTER,
    SCHEDULING,
    SEND
}
