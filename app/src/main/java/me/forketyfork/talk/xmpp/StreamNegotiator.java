package me.forketyfork.talk.xmpp;

import me.forketyfork.talk.xmpp.stanza.Iq;
import me.forketyfork.talk.xmpp.stanza.SaslFailure;
import me.forketyfork.talk.xmpp.stanza.SaslSuccess;
import me.forketyfork.talk.xmpp.stanza.Stanza;
import me.forketyfork.talk.xmpp.stanza.StreamError;
import me.forketyfork.talk.xmpp.stanza.StreamFeatures;
import me.forketyfork.talk.xmpp.stanza.StreamHeader;
import me.forketyfork.talk.xmpp.stream.ElementDispatcher;
import org.jxmpp.jid.EntityFullJid;
import org.jxmpp.jid.impl.JidCreate;
import org.jxmpp.stringprep.XmppStringprepException;

import javax.xml.namespace.QName;
import java.util.logging.Level;
import java.util.logging.Logger;

import static me.forketyfork.talk.xmpp.stream.XmlText.escape;

/**
 * Runs the connect-time handshake of RFC 3920: open the stream, authenticate, restart the
 * stream, bind a resource and announce presence. Each step writes one request and blocks for
 * the single element that answers it.
 */
class StreamNegotiator {

    // requests, formatted with the namespace constants
    static final String STREAM_HEADER_FORMAT = "<?xml version='1.0'?>\n"
            + "<stream:stream to='%s' xmlns='%s'\n"
            + " xmlns:stream='%s' version='1.0'>\n";
    static final String AUTH_FORMAT = "<auth xmlns='%s' mechanism='%s'>%s</auth>\n";
    static final String AUTH_NO_PAYLOAD_FORMAT = "<auth xmlns='%s' mechanism='%s'/>\n";
    static final String BIND_FORMAT = "<iq type='set' id='x'><bind xmlns='%s'/></iq>\n";
    static final String BIND_RESOURCE_FORMAT = "<iq type='set' id='x'><bind xmlns='%s'><resource>%s</resource></bind></iq>\n";
    static final String SESSION_FORMAT = "<iq type='set' id='sess'><session xmlns='%s'/></iq>\n";
    static final String PRESENCE_FORMAT = "<presence xml:lang='%s'><show>%s</show><status>%s</status></presence>";

    private final Logger logger = Logger.getLogger("StreamNegotiator");

    private final XmppSession session;
    private final ElementDispatcher dispatcher;
    private final XmppClientConfig config;

    StreamNegotiator(XmppSession session, ElementDispatcher dispatcher, XmppClientConfig config) {
        this.session = session;
        this.dispatcher = dispatcher;
        this.config = config;
    }

    /**
     * Drives the session from {@link SessionState#DISCONNECTED} to {@link SessionState#PRESENCE_SENT}.
     */
    void negotiate() throws XmppException {
        Credential credential = config.credential();
        String header = String.format(STREAM_HEADER_FORMAT, escape(credential.domain()), Namespaces.CLIENT, Namespaces.STREAM);

        session.write(header);
        session.transition(SessionState.STREAM_OPENED);
        awaitStreamRoot();
        StreamFeatures features = awaitFeatures(false);

        SaslSelection selection = SaslMechanismSelector.select(features.mechanisms(), config.preferExternal(), credential);
        if (!session.isSecure() && !config.allowInsecureAuth()) {
            throw new InsecureAuthException("Refusing to authenticate over an unencrypted transport");
        }
        authenticate(selection);

        // the previous root is never closed; the reader sees the new one as a nested start tag
        session.write(header);
        session.transition(SessionState.STREAM_RESTARTED);
        awaitStreamRoot();
        StreamFeatures negotiable = awaitFeatures(true);

        bind();
        if (negotiable.session() && config.establishSession()) {
            establishSession();
        }

        session.write(String.format(PRESENCE_FORMAT, escape(config.language()),
                escape(config.presenceShow()), escape(config.presenceStatus())));
        session.transition(SessionState.PRESENCE_SENT);
    }

    private void awaitStreamRoot() throws XmppException {
        session.transition(SessionState.AWAITING_STREAM_ROOT);
        QName root = dispatcher.nextStart();
        if (!StreamHeader.NAME.equals(root)) {
            throw new ProtocolException("expected <stream> but got <" + root.getLocalPart() + "> in "
                    + root.getNamespaceURI(), root);
        }
    }

    /**
     * @param tolerant whether an undecodable features block counts as an empty one
     */
    private StreamFeatures awaitFeatures(boolean tolerant) throws XmppException {
        session.transition(SessionState.AWAITING_FEATURES);
        Stanza element;
        try {
            element = dispatcher.nextElement();
        } catch (ProtocolException e) {
            if (!tolerant) {
                throw e;
            }
            logger.log(Level.FINE, "Ignoring undecodable features after stream restart", e);
            return StreamFeatures.NONE;
        }
        if (element instanceof StreamFeatures features) {
            logger.log(Level.FINE, "Server features: {0}", features);
            return features;
        }
        if (tolerant) {
            logger.log(Level.FINE, "Expected <features> after stream restart, got {0}", element.name());
            return StreamFeatures.NONE;
        }
        throw unexpected("<features>", element);
    }

    private void authenticate(SaslSelection selection) throws XmppException {
        String mechanism = selection.mechanism().name();
        if (selection.payload() == null) {
            session.write(String.format(AUTH_NO_PAYLOAD_FORMAT, Namespaces.SASL, mechanism));
        } else {
            session.write(String.format(AUTH_FORMAT, Namespaces.SASL, mechanism, selection.payload()));
        }
        session.transition(SessionState.AUTH_SENT);

        Stanza reply = dispatcher.nextElement();
        if (reply instanceof SaslSuccess) {
            session.transition(SessionState.AUTHENTICATED);
        } else if (reply instanceof SaslFailure failure) {
            session.transition(SessionState.AUTH_FAILED);
            throw new AuthException("auth failure: " + failure.condition(), failure.condition());
        } else {
            throw unexpected("<success> or <failure>", reply);
        }
    }

    private void bind() throws XmppException {
        if (config.resource() == null) {
            session.write(String.format(BIND_FORMAT, Namespaces.BIND));
        } else {
            session.write(String.format(BIND_RESOURCE_FORMAT, Namespaces.BIND, escape(config.resource())));
        }
        session.transition(SessionState.BIND_SENT);

        Iq iq = awaitResult("resource binding");
        if (iq.bind() == null || iq.bind().jid() == null || iq.bind().jid().trim().isEmpty()) {
            throw new ProtocolException("<iq> result missing <bind>", Iq.NAME);
        }
        String jid = iq.bind().jid().trim();
        EntityFullJid entityJid;
        try {
            entityJid = JidCreate.entityFullFrom(jid);
        } catch (XmppStringprepException | IllegalArgumentException e) {
            throw new ProtocolException("Server bound an invalid JID: " + jid, e);
        }
        session.bound(jid, entityJid);
        session.transition(SessionState.BOUND);
    }

    private void establishSession() throws XmppException {
        session.write(String.format(SESSION_FORMAT, Namespaces.SESSION));
        awaitResult("session establishment");
    }

    private Iq awaitResult(String step) throws XmppException {
        Stanza reply = dispatcher.nextElement();
        if (!(reply instanceof Iq iq)) {
            throw unexpected("<iq>", reply);
        }
        if (iq.error() != null) {
            throw new ProtocolException(step + " failed: " + iq.error().condition(), Iq.NAME);
        }
        if (!iq.isResult()) {
            throw new ProtocolException(step + " answered with iq type " + iq.type(), Iq.NAME);
        }
        return iq;
    }

    private static ProtocolException unexpected(String expected, Stanza got) {
        QName name = got.name();
        String detail = got instanceof StreamError error ? " (" + error.condition() + ")" : "";
        return new ProtocolException("expected " + expected + ", got <" + name.getLocalPart() + "> in "
                + name.getNamespaceURI() + detail, name);
    }
}
