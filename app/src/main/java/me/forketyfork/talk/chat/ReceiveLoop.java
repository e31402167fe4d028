package me.forketyfork.talk.chat;

import me.forketyfork.talk.xmpp.EndOfStreamException;
import me.forketyfork.talk.xmpp.StanzaSource;
import me.forketyfork.talk.xmpp.XmppException;
import me.forketyfork.talk.xmpp.stanza.Message;
import me.forketyfork.talk.xmpp.stanza.Presence;
import me.forketyfork.talk.xmpp.stanza.Stanza;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pumps received stanzas into a listener until the stream ends or a read fails.
 */
public class ReceiveLoop implements Runnable {

    private final Logger logger = Logger.getLogger("ReceiveLoop");

    private final StanzaSource source;
    private final IncomingStanzaListener listener;

    public ReceiveLoop(StanzaSource source, IncomingStanzaListener listener) {
        this.source = source;
        this.listener = listener;
    }

    @Override
    public void run() {
        while (true) {
            Stanza stanza;
            try {
                stanza = source.recv();
            } catch (EndOfStreamException e) {
                logger.info("Server ended the stream");
                listener.streamClosed();
                return;
            } catch (XmppException e) {
                logger.log(Level.WARNING, "Receiving failed", e);
                listener.receiveFailed(e);
                return;
            }

            if (stanza instanceof Message message) {
                listener.messageReceived(message);
            } else if (stanza instanceof Presence presence) {
                listener.presenceReceived(presence);
            }
        }
    }
}
