package me.forketyfork.talk.xmpp.stream;

import me.forketyfork.talk.xmpp.EndOfStreamException;
import me.forketyfork.talk.xmpp.Namespaces;
import me.forketyfork.talk.xmpp.ProtocolException;
import me.forketyfork.talk.xmpp.TransportException;
import me.forketyfork.talk.xmpp.XmppException;
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
import me.forketyfork.talk.xmpp.stanza.StreamError;
import me.forketyfork.talk.xmpp.stanza.StreamFeatures;
import me.forketyfork.talk.xmpp.stanza.StreamHeader;
import me.forketyfork.talk.xmpp.stanza.TlsFailure;
import me.forketyfork.talk.xmpp.stanza.TlsProceed;

import javax.xml.namespace.QName;
import javax.xml.stream.XMLStreamConstants;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds the next element on the stream and decodes it according to its qualified name.
 * <p>
 * The table of known names is fixed. A name that is not in it fails the read instead of being
 * skipped, so a client that has lost track of the stream notices immediately.
 */
public class ElementDispatcher {

    private static final String STREAMS_ERROR_NAMESPACE = "urn:ietf:params:xml:ns:xmpp-streams";

    private final Logger logger = Logger.getLogger("ElementDispatcher");

    private final XmppTokenReader tokens;
    private final ElementScanner scanner;
    private final Map<QName, ElementDecoder> decoders = new HashMap<>();

    public ElementDispatcher(XmppTokenReader tokens) {
        this.tokens = tokens;
        this.scanner = new ElementScanner(tokens);

        decoders.put(StreamHeader.NAME, this::decodeStreamHeader);
        decoders.put(StreamFeatures.NAME, this::decodeFeatures);
        decoders.put(StreamError.NAME, this::decodeStreamError);
        decoders.put(StartTls.NAME, this::decodeStartTls);
        decoders.put(TlsProceed.NAME, element -> {
            element.skip();
            return new TlsProceed();
        });
        decoders.put(TlsFailure.NAME, element -> {
            element.skip();
            return new TlsFailure();
        });
        decoders.put(SaslMechanisms.NAME, element -> new SaslMechanisms(readMechanisms(element)));
        decoders.put(SaslChallenge.NAME, element -> new SaslChallenge(element.text()));
        decoders.put(SaslResponse.NAME, element -> new SaslResponse(element.text()));
        decoders.put(SaslAbort.NAME, element -> {
            element.skip();
            return new SaslAbort();
        });
        decoders.put(SaslSuccess.NAME, element -> new SaslSuccess(element.text()));
        decoders.put(SaslFailure.NAME, this::decodeSaslFailure);
        decoders.put(Bind.NAME, this::decodeBind);
        decoders.put(Message.NAME, this::decodeMessage);
        decoders.put(Presence.NAME, this::decodePresence);
        decoders.put(Iq.NAME, this::decodeIq);
        decoders.put(StanzaError.NAME, this::decodeStanzaError);
    }

    /**
     * @return the qualified names this dispatcher can decode
     */
    public Set<QName> knownNames() {
        return Collections.unmodifiableSet(decoders.keySet());
    }

    /**
     * Skips tokens up to the next start element.
     *
     * @return the name of that element; the reader is left on its start tag
     * @throws EndOfStreamException if the stream ends first
     */
    public QName nextStart() throws XmppException {
        while (true) {
            int event = tokens.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                return tokens.parser().getName();
            }
            if (event == XMLStreamConstants.END_DOCUMENT) {
                throw new EndOfStreamException();
            }
        }
    }

    /**
     * Reads and decodes the next element.
     *
     * @throws ProtocolException    if the element's qualified name is not known
     * @throws EndOfStreamException if the stream ends before another element starts
     * @throws TransportException   if the stream breaks off in the middle of an element
     */
    public Stanza nextElement() throws XmppException {
        QName name = nextStart();
        ElementDecoder decoder = decoders.get(name);
        if (decoder == null) {
            throw ProtocolException.unexpected(name);
        }
        Stanza stanza;
        try {
            stanza = decoder.decode(scanner);
        } catch (EndOfStreamException e) {
            throw new TransportException("Stream ended inside <" + name.getLocalPart() + "/>", e);
        }
        tokens.release();
        logger.log(Level.FINE, "Decoded {0}", stanza);
        return stanza;
    }

    private Stanza decodeStreamHeader(ElementScanner element) {
        // the root stays open; its children are read by later calls
        return new StreamHeader(element.attribute("from"), element.attribute("id"),
                element.attribute("version"), element.lang());
    }

    private Stanza decodeFeatures(ElementScanner element) throws XmppException {
        boolean[] startTls = new boolean[2];
        List<String> mechanisms = new ArrayList<>();
        boolean[] bindAndSession = new boolean[2];
        List<RawElement> other = new ArrayList<>();

        element.children(child -> {
            if (child.equals(StartTls.NAME)) {
                startTls[0] = true;
                startTls[1] = ((StartTls) decodeStartTls(element)).required();
            } else if (child.equals(SaslMechanisms.NAME)) {
                mechanisms.addAll(readMechanisms(element));
            } else if (child.equals(Bind.NAME)) {
                bindAndSession[0] = true;
                element.skip();
            } else if (is(child, Namespaces.SESSION, "session")) {
                bindAndSession[1] = true;
                element.skip();
            } else {
                other.add(element.capture().element());
            }
        });
        return new StreamFeatures(startTls[0], startTls[1], mechanisms, bindAndSession[0], bindAndSession[1], other);
    }

    private Stanza decodeStreamError(ElementScanner element) throws XmppException {
        String[] conditionAndText = new String[2];
        element.children(child -> {
            if (is(child, STREAMS_ERROR_NAMESPACE, "text")) {
                conditionAndText[1] = element.text();
            } else {
                if (conditionAndText[0] == null) {
                    conditionAndText[0] = child.getLocalPart();
                }
                element.skip();
            }
        });
        return new StreamError(conditionAndText[0], conditionAndText[1]);
    }

    private Stanza decodeStartTls(ElementScanner element) throws XmppException {
        boolean[] required = new boolean[1];
        element.children(child -> {
            if (is(child, Namespaces.TLS, "required")) {
                required[0] = true;
            }
            element.skip();
        });
        return new StartTls(required[0]);
    }

    private List<String> readMechanisms(ElementScanner element) throws XmppException {
        List<String> mechanisms = new ArrayList<>();
        element.children(child -> {
            if (is(child, Namespaces.SASL, "mechanism")) {
                mechanisms.add(element.text().trim());
            } else {
                element.skip();
            }
        });
        return mechanisms;
    }

    private Stanza decodeSaslFailure(ElementScanner element) throws XmppException {
        String[] conditionAndText = new String[2];
        element.children(child -> {
            if (is(child, Namespaces.SASL, "text")) {
                conditionAndText[1] = element.text();
            } else {
                if (conditionAndText[0] == null) {
                    conditionAndText[0] = child.getLocalPart();
                }
                element.skip();
            }
        });
        return new SaslFailure(conditionAndText[0], conditionAndText[1]);
    }

    private Bind decodeBind(ElementScanner element) throws XmppException {
        String[] resourceAndJid = new String[2];
        element.children(child -> {
            if (is(child, Namespaces.BIND, "resource")) {
                resourceAndJid[0] = element.text();
            } else if (is(child, Namespaces.BIND, "jid")) {
                resourceAndJid[1] = element.text();
            } else {
                element.skip();
            }
        });
        return new Bind(resourceAndJid[0], resourceAndJid[1]);
    }

    private Stanza decodeMessage(ElementScanner element) throws XmppException {
        String from = element.attribute("from");
        String id = element.attribute("id");
        String to = element.attribute("to");
        String type = element.attribute("type");
        String lang = element.lang();

        Map<String, String> fields = new HashMap<>();
        List<String> otherText = new ArrayList<>();
        List<RawElement> otherElements = new ArrayList<>();
        element.children(child -> {
            String local = child.getLocalPart();
            if (Namespaces.CLIENT.equals(child.getNamespaceURI())
                    && ("subject".equals(local) || "body".equals(local) || "thread".equals(local))) {
                fields.put(local, element.text());
            } else {
                ElementScanner.Captured captured = element.capture();
                otherText.add(captured.text());
                otherElements.add(captured.element());
            }
        });
        return new Message(from, id, to, type, lang,
                fields.get("subject"), fields.get("body"), fields.get("thread"), otherText, otherElements);
    }

    private Stanza decodePresence(ElementScanner element) throws XmppException {
        String from = element.attribute("from");
        String id = element.attribute("id");
        String to = element.attribute("to");
        String type = element.attribute("type");
        String lang = element.lang();

        Map<String, String> fields = new HashMap<>();
        StanzaError[] error = new StanzaError[1];
        List<String> otherText = new ArrayList<>();
        List<RawElement> otherElements = new ArrayList<>();
        element.children(child -> {
            String local = child.getLocalPart();
            if (child.equals(StanzaError.NAME)) {
                error[0] = decodeStanzaError(element);
            } else if (Namespaces.CLIENT.equals(child.getNamespaceURI())
                    && ("show".equals(local) || "status".equals(local) || "priority".equals(local))) {
                fields.put(local, element.text());
            } else {
                ElementScanner.Captured captured = element.capture();
                otherText.add(captured.text());
                otherElements.add(captured.element());
            }
        });
        return new Presence(from, id, to, type, lang,
                fields.get("show"), fields.get("status"), fields.get("priority"), error[0], otherText, otherElements);
    }

    private Stanza decodeIq(ElementScanner element) throws XmppException {
        String from = element.attribute("from");
        String id = element.attribute("id");
        String to = element.attribute("to");
        String type = element.attribute("type");

        StanzaError[] error = new StanzaError[1];
        Bind[] bind = new Bind[1];
        List<RawElement> payload = new ArrayList<>();
        element.children(child -> {
            if (child.equals(StanzaError.NAME)) {
                error[0] = decodeStanzaError(element);
            } else if (child.equals(Bind.NAME)) {
                bind[0] = decodeBind(element);
            } else {
                payload.add(element.capture().element());
            }
        });
        return new Iq(from, id, to, type, error[0], bind[0], payload);
    }

    private StanzaError decodeStanzaError(ElementScanner element) throws XmppException {
        String code = element.attribute("code");
        String type = element.attribute("type");
        String[] conditionAndText = new String[2];
        element.children(child -> {
            if (is(child, Namespaces.STANZAS, "text")) {
                conditionAndText[1] = element.text();
            } else {
                if (conditionAndText[0] == null) {
                    conditionAndText[0] = child.getLocalPart();
                }
                element.skip();
            }
        });
        return new StanzaError(code, type, conditionAndText[0], conditionAndText[1]);
    }

    private static boolean is(QName name, String namespace, String localName) {
        return namespace.equals(name.getNamespaceURI()) && localName.equals(name.getLocalPart());
    }
}
