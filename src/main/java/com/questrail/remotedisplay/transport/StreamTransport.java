package com.questrail.remotedisplay.transport;

/**
 * StreamTransport
 * -----------------------------------------------------------------------------
 * Minimal port for an ordered, reliable byte stream to one peer.
 *
 * <p>Implementations may be backed by Netty (TCP), a local socket, or a test
 * harness. Inbound bytes are framed by the implementation and delivered to
 * the session; this port only covers the outbound side.</p>
 */
public interface StreamTransport
{
    /**
     * Queue bytes for sending. Never blocks on the network.
     */
    void send(byte[] data);

    /**
     * Close the stream. Idempotent.
     */
    void close();

    boolean isOpen();

    /**
     * Printable peer address, for logs and events.
     */
    String remoteAddress();
}
