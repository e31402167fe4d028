package me.forketyfork.talk.xmpp.stream;

import me.forketyfork.talk.xmpp.XmppException;
import me.forketyfork.talk.xmpp.stanza.Stanza;

/**
 * Decodes one element, starting on its start tag and consuming everything up to and
 * including its end tag.
 */
@FunctionalInterface
public interface ElementDecoder {

    Stanza decode(ElementScanner element) throws XmppException;
}
