package com.catagent.providers;

import java.util.Iterator;

/**
 * Ordered, single-use sequence of streamed completion events. Closing it mid-way releases
 * the upstream connection.
 */
public interface CompletionStream extends Iterator<ChatEvent>, AutoCloseable {

    /** Usage consumed so far: exact when the provider reported it, otherwise estimated. */
    TokenUsage usageSoFar();

    @Override
    void close();
}
