package me.forketyfork.talk.xmpp;

import me.forketyfork.talk.xmpp.stanza.Stanza;

/**
 * Something that hands out received messages and presences one at a time.
 */
public interface StanzaSource {

    /**
     * Blocks until the next message or presence arrives.
     *
     * @throws EndOfStreamException when the stream has ended
     */
    Stanza recv() throws XmppException;
}
