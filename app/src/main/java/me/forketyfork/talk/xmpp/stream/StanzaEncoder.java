package me.forketyfork.talk.xmpp.stream;

import com.ctc.wstx.stax.WstxOutputFactory;
import me.forketyfork.talk.xmpp.Namespaces;
import me.forketyfork.talk.xmpp.stanza.Bind;
import me.forketyfork.talk.xmpp.stanza.Iq;
import me.forketyfork.talk.xmpp.stanza.Message;
import me.forketyfork.talk.xmpp.stanza.Presence;
import me.forketyfork.talk.xmpp.stanza.RawElement;
import me.forketyfork.talk.xmpp.stanza.SaslAbort;
import me.forketyfork.talk.xmpp.stanza.SaslChallenge;
import me.forketyfork.talk.xmpp.stanza.SaslFailure;
import me.forketyfork.talk.xmpp.stanza.SaslMechanisms;
import me.forketyfork.talk.xmpp.stanza.SaslResponse;
import me.forketyfork.talk.xmpp.stanza.SaslSuccess;
import me.forketyfork.talk.xmpp.stanza.Stanza;
import me.forketyfork.talk.xmpp.stanza.StanzaError;
import me.forketyfork.talk.xmpp.stanza.StartTls;
import me.forketyfork.talk.xmpp.stanza.TlsFailure;
import me.forketyfork.talk.xmpp.stanza.TlsProceed;
import org.codehaus.stax2.XMLOutputFactory2;
import org.codehaus.stax2.XMLStreamWriter2;

import javax.xml.namespace.QName;
import javax.xml.stream.XMLStreamException;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;

/**
 * Serializes stanza values into the markup {@link ElementDispatcher} decodes. Each call produces
 * one self-contained element with its namespace declared, so the result can be written to the
 * stream in a single piece.
 */
public class StanzaEncoder {

    private final XMLOutputFactory2 outputFactory = new WstxOutputFactory();

    /**
     * @throws IllegalArgumentException if the value has no element encoding, e.g. a stream header
     */
    public String encode(Stanza stanza) {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter2 writer = (XMLStreamWriter2) outputFactory.createXMLStreamWriter(out);
            write(writer, stanza);
            writer.flush();
            writer.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to encode " + stanza.name(), e);
        }
        return out.toString();
    }

    private void write(XMLStreamWriter2 writer, Stanza stanza) throws XMLStreamException {
        if (stanza instanceof Message message) {
            writeMessage(writer, message);
        } else if (stanza instanceof Presence presence) {
            writePresence(writer, presence);
        } else if (stanza instanceof Iq iq) {
            writeIq(writer, iq);
        } else if (stanza instanceof StanzaError error) {
            writeStanzaError(writer, error);
        } else if (stanza instanceof Bind bind) {
            writeBind(writer, bind);
        } else if (stanza instanceof SaslMechanisms mechanisms) {
            start(writer, SaslMechanisms.NAME);
            writeMechanisms(writer, mechanisms.mechanisms());
            writer.writeEndElement();
        } else if (stanza instanceof SaslChallenge challenge) {
            writeTextElement(writer, SaslChallenge.NAME, challenge.data());
        } else if (stanza instanceof SaslResponse response) {
            writeTextElement(writer, SaslResponse.NAME, response.data());
        } else if (stanza instanceof SaslSuccess success) {
            writeTextElement(writer, SaslSuccess.NAME, success.data());
        } else if (stanza instanceof SaslFailure failure) {
            start(writer, SaslFailure.NAME);
            optEmptyElement(writer, failure.condition());
            optTextElement(writer, "text", failure.text());
            writer.writeEndElement();
        } else if (stanza instanceof StartTls startTls) {
            start(writer, StartTls.NAME);
            if (startTls.required()) {
                writer.writeEmptyElement("required");
            }
            writer.writeEndElement();
        } else if (stanza instanceof SaslAbort || stanza instanceof TlsProceed || stanza instanceof TlsFailure) {
            start(writer, stanza.name());
            writer.writeEndElement();
        } else {
            throw new IllegalArgumentException("No element encoding for " + stanza.name());
        }
    }

    private void writeMessage(XMLStreamWriter2 writer, Message message) throws XMLStreamException {
        start(writer, Message.NAME);
        optAttribute(writer, "from", message.from());
        optAttribute(writer, "id", message.id());
        optAttribute(writer, "to", message.to());
        optAttribute(writer, "type", message.type());
        optLang(writer, message.lang());
        optTextElement(writer, "subject", message.subject());
        optTextElement(writer, "body", message.body());
        optTextElement(writer, "thread", message.thread());
        writeRawElements(writer, message.otherElements());
        writer.writeEndElement();
    }

    private void writePresence(XMLStreamWriter2 writer, Presence presence) throws XMLStreamException {
        start(writer, Presence.NAME);
        optAttribute(writer, "from", presence.from());
        optAttribute(writer, "id", presence.id());
        optAttribute(writer, "to", presence.to());
        optAttribute(writer, "type", presence.type());
        optLang(writer, presence.lang());
        optTextElement(writer, "show", presence.show());
        optTextElement(writer, "status", presence.status());
        optTextElement(writer, "priority", presence.priority());
        if (presence.error() != null) {
            writeStanzaError(writer, presence.error());
        }
        writeRawElements(writer, presence.otherElements());
        writer.writeEndElement();
    }

    private void writeIq(XMLStreamWriter2 writer, Iq iq) throws XMLStreamException {
        start(writer, Iq.NAME);
        optAttribute(writer, "from", iq.from());
        optAttribute(writer, "id", iq.id());
        optAttribute(writer, "to", iq.to());
        optAttribute(writer, "type", iq.type());
        if (iq.bind() != null) {
            writeBind(writer, iq.bind());
        }
        writeRawElements(writer, iq.payload());
        if (iq.error() != null) {
            writeStanzaError(writer, iq.error());
        }
        writer.writeEndElement();
    }

    private void writeBind(XMLStreamWriter2 writer, Bind bind) throws XMLStreamException {
        start(writer, Bind.NAME);
        optTextElement(writer, "resource", bind.resource());
        optTextElement(writer, "jid", bind.jid());
        writer.writeEndElement();
    }

    private void writeStanzaError(XMLStreamWriter2 writer, StanzaError error) throws XMLStreamException {
        start(writer, StanzaError.NAME);
        optAttribute(writer, "code", error.code());
        optAttribute(writer, "type", error.type());
        if (error.condition() != null) {
            start(writer, new QName(Namespaces.STANZAS, error.condition()));
            writer.writeEndElement();
        }
        if (error.text() != null) {
            start(writer, new QName(Namespaces.STANZAS, "text"));
            writer.writeCharacters(error.text());
            writer.writeEndElement();
        }
        writer.writeEndElement();
    }

    private void writeMechanisms(XMLStreamWriter2 writer, List<String> mechanisms) throws XMLStreamException {
        for (String mechanism : mechanisms) {
            optTextElement(writer, "mechanism", mechanism);
        }
    }

    private void writeRawElements(XMLStreamWriter2 writer, List<RawElement> elements) throws XMLStreamException {
        for (RawElement element : elements) {
            QName name = element.name();
            String prefix = name.getPrefix();
            writer.writeStartElement(prefix, name.getLocalPart(), name.getNamespaceURI());
            if (prefix.isEmpty()) {
                writer.writeDefaultNamespace(name.getNamespaceURI());
            } else {
                writer.writeNamespace(prefix, name.getNamespaceURI());
            }
            for (Map.Entry<String, String> binding : element.namespaces().entrySet()) {
                if (binding.getKey().equals(prefix)) {
                    continue;
                }
                if (binding.getKey().isEmpty()) {
                    writer.writeDefaultNamespace(binding.getValue());
                } else {
                    writer.writeNamespace(binding.getKey(), binding.getValue());
                }
            }
            for (Map.Entry<String, String> attribute : element.attributes().entrySet()) {
                writer.writeAttribute(attribute.getKey(), attribute.getValue());
            }
            for (Map.Entry<QName, String> attribute : element.qualifiedAttributes().entrySet()) {
                QName attributeName = attribute.getKey();
                writer.writeAttribute(attributeName.getPrefix(), attributeName.getNamespaceURI(),
                        attributeName.getLocalPart(), attribute.getValue());
            }
            writer.writeRaw(element.innerXml());
            writer.writeEndElement();
        }
    }

    private void writeTextElement(XMLStreamWriter2 writer, QName name, String text) throws XMLStreamException {
        start(writer, name);
        if (text != null) {
            writer.writeCharacters(text);
        }
        writer.writeEndElement();
    }

    private static void start(XMLStreamWriter2 writer, QName name) throws XMLStreamException {
        writer.writeStartElement("", name.getLocalPart(), name.getNamespaceURI());
        writer.writeDefaultNamespace(name.getNamespaceURI());
    }

    private static void optAttribute(XMLStreamWriter2 writer, String name, String value) throws XMLStreamException {
        if (value != null) {
            writer.writeAttribute(name, value);
        }
    }

    private static void optLang(XMLStreamWriter2 writer, String lang) throws XMLStreamException {
        if (lang != null) {
            writer.writeAttribute("xml", Namespaces.XML, "lang", lang);
        }
    }

    private static void optTextElement(XMLStreamWriter2 writer, String localName, String text) throws XMLStreamException {
        if (text != null) {
            writer.writeStartElement(localName);
            writer.writeCharacters(text);
            writer.writeEndElement();
        }
    }

    private static void optEmptyElement(XMLStreamWriter2 writer, String localName) throws XMLStreamException {
        if (localName != null) {
            writer.writeEmptyElement(localName);
        }
    }
}
