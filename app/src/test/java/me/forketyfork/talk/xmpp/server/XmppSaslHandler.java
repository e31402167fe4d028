package me.forketyfork.talk.xmpp.server;

import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

public interface XmppSaslHandler {

    /**
     * @param xmlReader positioned on the {@code <auth>} start tag; consumed up to its end tag
     */
    ClientContext handleSaslAuth(XMLStreamReader xmlReader, ClientContext context) throws XMLStreamException;
}
