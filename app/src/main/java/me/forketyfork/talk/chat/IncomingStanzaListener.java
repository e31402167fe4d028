package me.forketyfork.talk.chat;

import me.forketyfork.talk.xmpp.XmppException;
import me.forketyfork.talk.xmpp.stanza.Message;
import me.forketyfork.talk.xmpp.stanza.Presence;

/**
 * Receives what a {@link ReceiveLoop} reads. Called on the loop's thread.
 */
public interface IncomingStanzaListener {

    void messageReceived(Message message);

    void presenceReceived(Presence presence);

    /**
     * The server ended the stream. No further calls follow.
     */
    void streamClosed();

    /**
     * Reading failed. No further calls follow.
     */
    void receiveFailed(XmppException failure);
}
