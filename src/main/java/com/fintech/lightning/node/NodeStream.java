package com.fintech.lightning.node;

import com.fintech.lightning.exception.NodeClientException;

import java.util.Optional;

/**
 * Server-streaming RPC handle.
 *
 * @param <T> message type
 */
public interface NodeStream<T> extends AutoCloseable {

    /**
     * Blocks until the next message arrives.
     *
     * @return the next message, or empty once the server has ended the stream
     * @throws NodeClientException on a read error; the stream may still deliver later messages
     */
    Optional<T> receive() throws NodeClientException;

    /**
     * Cancels the call. Safe to invoke more than once.
     */
    @Override
    void close();
}
