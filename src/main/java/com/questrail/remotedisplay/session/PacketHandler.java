package com.questrail.remotedisplay.session;

import com.questrail.remotedisplay.batch.DamageBatch;
import com.questrail.remotedisplay.protocol.frame.Packet;

/**
 * Application side of an authenticated session: receives client packets and
 * the damage batches that are due for capture and encoding.
 *
 * <p>Callbacks run on the session's worker, except {@link #onDamageBatch}
 * which may also run on the scheduler thread when a batch timer fires.</p>
 */
public interface PacketHandler
{
    PacketHandler NONE = new PacketHandler() {
        @Override
        public void onPacket(DisplaySession session, Packet packet)
        {
        }
    };

    void onPacket(DisplaySession session, Packet packet);

    default void onAuthenticated(DisplaySession session)
    {
    }

    default void onDamageBatch(DisplaySession session, DamageBatch batch)
    {
    }

    default void onClosed(DisplaySession session, String reason)
    {
    }
}
