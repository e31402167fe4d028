package me.forketyfork.talk.xmpp.server;

import me.forketyfork.talk.xmpp.Namespaces;

import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A bound client that other connections can deliver messages to.
 */
public class ClientSession {
    private static final Logger logger = Logger.getLogger("ClientSession");

    private final String fullJid;
    private final XMLStreamWriter xmlWriter;

    public ClientSession(String fullJid, XMLStreamWriter xmlWriter) {
        this.fullJid = fullJid;
        this.xmlWriter = xmlWriter;
    }

    public String getFullJid() {
        return fullJid;
    }

    /**
     * Writes a chat message into this client's stream. Safe to call from any connection's thread.
     */
    public void deliver(String from, String body) throws XMLStreamException {
        logger.log(Level.FINE, "Delivering message from {0} to {1}", new Object[]{from, fullJid});
        synchronized (xmlWriter) {
            xmlWriter.writeStartElement("message");
            xmlWriter.writeAttribute("from", from);
            xmlWriter.writeAttribute("to", fullJid);
            xmlWriter.writeAttribute("type", "chat");
            if (body != null) {
                xmlWriter.writeStartElement("body");
                xmlWriter.writeCharacters(body);
                xmlWriter.writeEndElement(); // body
            }
            xmlWriter.writeEndElement(); // message
            xmlWriter.flush();
        }
    }

    /**
     * Bounces an undeliverable message back to this client.
     */
    public void bounce(String to, String body, String condition) throws XMLStreamException {
        synchronized (xmlWriter) {
            xmlWriter.writeStartElement("message");
            xmlWriter.writeAttribute("from", to);
            xmlWriter.writeAttribute("to", fullJid);
            xmlWriter.writeAttribute("type", "error");
            if (body != null) {
                xmlWriter.writeStartElement("body");
                xmlWriter.writeCharacters(body);
                xmlWriter.writeEndElement(); // body
            }
            xmlWriter.writeStartElement("error");
            xmlWriter.writeAttribute("type", "cancel");
            xmlWriter.writeEmptyElement(condition);
            xmlWriter.writeAttribute("xmlns", Namespaces.STANZAS);
            xmlWriter.writeEndElement(); // error
            xmlWriter.writeEndElement(); // message
            xmlWriter.flush();
        }
    }
}
