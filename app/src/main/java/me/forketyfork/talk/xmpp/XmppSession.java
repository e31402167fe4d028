package me.forketyfork.talk.xmpp;

import me.forketyfork.talk.xmpp.stanza.Message;
import me.forketyfork.talk.xmpp.stanza.Presence;
import me.forketyfork.talk.xmpp.stanza.Stanza;
import me.forketyfork.talk.xmpp.stream.ElementDispatcher;
import me.forketyfork.talk.xmpp.stream.StanzaEncoder;
import me.forketyfork.talk.xmpp.stream.XmppTokenReader;
import org.jxmpp.jid.EntityFullJid;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An authenticated, bound XMPP client session over one {@link Transport}.
 * <p>
 * {@link #connect(Transport, XmppClientConfig)} returns only fully negotiated sessions. After
 * that one thread may read ({@link #recv()}, {@link #nextElement()}) while another writes
 * ({@link #send(Stanza)}); the two paths are locked separately. The first failure on either
 * path leaves the session unusable, and every later call fails fast until it is closed.
 */
public class XmppSession implements StanzaSource, AutoCloseable {

    static final String STREAM_CLOSE = "</stream:stream>";

    private static final Logger logger = Logger.getLogger("XmppSession");

    private final Object readLock = new Object();
    private final Object writeLock = new Object();

    private final SwitchableInputStream input;
    private volatile Transport transport;
    private OutputStream output;
    private final ElementDispatcher dispatcher;
    private final StanzaEncoder encoder = new StanzaEncoder();

    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean broken;
    private volatile SessionState state = SessionState.DISCONNECTED;
    private volatile String jid;
    private volatile EntityFullJid entityJid;

    XmppSession(Transport transport) throws IOException {
        this.transport = transport;
        this.output = transport.getOutputStream();
        this.input = new SwitchableInputStream(transport.getInputStream());
        XmppTokenReader tokens = new XmppTokenReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        this.dispatcher = new ElementDispatcher(tokens);
    }

    /**
     * Negotiates a session over an already established transport.
     * <p>
     * On any failure the transport is closed before the exception propagates.
     *
     * @throws ConfigException         if the configured JID has no domain part
     * @throws AuthException           if no mechanism is acceptable or the server rejects the credential
     * @throws InsecureAuthException   if the transport is unencrypted and the config forbids that
     * @throws ProtocolException       if the server answers a step with the wrong element
     * @throws TransportException      if reading or writing fails
     */
    public static XmppSession connect(Transport transport, XmppClientConfig config) throws XmppException {
        XmppSession session;
        try {
            transport.setReadTimeout(config.readTimeoutMs());
            session = new XmppSession(transport);
        } catch (IOException e) {
            closeTransport(transport);
            throw new TransportException("Failed to set up transport: " + e.getMessage(), e);
        }

        try {
            new StreamNegotiator(session, session.dispatcher, config).negotiate();
        } catch (XmppException | RuntimeException e) {
            logger.log(Level.FINE, "Negotiation failed in state " + session.state, e);
            session.closed.set(true);
            closeTransport(transport);
            throw e;
        }
        session.transition(SessionState.READY);
        logger.log(Level.INFO, "Connected as {0} over {1}", new Object[]{session.jid, transport});
        return session;
    }

    /**
     * Blocks until the next message or presence. Every other element is dropped.
     *
     * @throws EndOfStreamException if the server ended the stream
     */
    @Override
    public Stanza recv() throws XmppException {
        synchronized (readLock) {
            while (true) {
                Stanza stanza = read();
                if (stanza instanceof Message || stanza instanceof Presence) {
                    return stanza;
                }
                logger.log(Level.FINE, "Discarding {0}", stanza.name());
            }
        }
    }

    /**
     * Blocks until the next element of any known kind.
     */
    public Stanza nextElement() throws XmppException {
        synchronized (readLock) {
            return read();
        }
    }

    private Stanza read() throws XmppException {
        ensureUsable();
        try {
            return dispatcher.nextElement();
        } catch (XmppException e) {
            broken = true;
            throw e;
        }
    }

    /**
     * Writes one stanza with a single write and flush.
     *
     * @throws TransportException if the write fails; nothing is retried
     */
    public void send(Stanza stanza) throws XmppException {
        write(encoder.encode(stanza));
    }

    public void sendMessage(String to, String type, String body) throws XmppException {
        send(new Message(null, null, to, type, null, null, body, null, null, null));
    }

    public void sendPresence(String show, String status) throws XmppException {
        send(Presence.available(show, status));
    }

    void write(String markup) throws XmppException {
        byte[] bytes = markup.getBytes(StandardCharsets.UTF_8);
        synchronized (writeLock) {
            ensureUsable();
            try {
                output.write(bytes);
                output.flush();
            } catch (SocketTimeoutException e) {
                broken = true;
                throw new TransportTimeoutException("Timed out writing to the transport", e);
            } catch (IOException e) {
                broken = true;
                throw new TransportException("Failed to write to the transport: " + e.getMessage(), e);
            }
        }
    }

    /**
     * Moves the session onto a new transport, typically the TLS-wrapped version of the current
     * one, without rebuilding the token reader. Input already buffered from the old transport is
     * still read first, so call this only once the peer has sent its last plaintext element.
     *
     * @throws TransportException if the session is unusable or the new transport cannot be opened
     */
    public void upgradeTransport(Transport upgraded) throws TransportException {
        synchronized (readLock) {
            synchronized (writeLock) {
                ensureUsable();
                try {
                    OutputStream upgradedOutput = upgraded.getOutputStream();
                    input.switchTo(upgraded.getInputStream());
                    output = upgradedOutput;
                } catch (IOException e) {
                    broken = true;
                    throw new TransportException("Failed to open the upgraded transport: " + e.getMessage(), e);
                }
                logger.log(Level.INFO, "Switched from {0} to {1}", new Object[]{transport, upgraded});
                transport = upgraded;
            }
        }
    }

    private void ensureUsable() throws TransportException {
        if (closed.get()) {
            throw new TransportException("Session is closed");
        }
        if (broken) {
            throw new TransportException("Session is unusable after an earlier failure");
        }
    }

    void transition(SessionState next) {
        logger.log(Level.FINE, "{0} -> {1}", new Object[]{state, next});
        state = next;
    }

    void bound(String jid, EntityFullJid entityJid) {
        this.jid = jid;
        this.entityJid = entityJid;
    }

    /**
     * Ends the stream and closes the transport. Only the first call has an effect.
     *
     * @throws TransportException if closing the transport fails
     */
    @Override
    public void close() throws TransportException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        SessionState previous = state;
        transition(SessionState.CLOSED);
        if (previous != SessionState.DISCONNECTED && !broken) {
            synchronized (writeLock) {
                try {
                    output.write(STREAM_CLOSE.getBytes(StandardCharsets.UTF_8));
                    output.flush();
                } catch (IOException e) {
                    logger.log(Level.WARNING, "Failed to write stream close", e);
                }
            }
        }
        try {
            transport.close();
        } catch (IOException e) {
            throw new TransportException("Failed to close the transport: " + e.getMessage(), e);
        }
    }

    private static void closeTransport(Transport transport) {
        try {
            transport.close();
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to close transport after negotiation failure", e);
        }
    }

    /**
     * @return the full JID the server bound, as it appeared on the wire
     */
    public String jid() {
        return jid;
    }

    public EntityFullJid entityJid() {
        return entityJid;
    }

    public SessionState state() {
        return state;
    }

    public boolean isSecure() {
        return transport.isSecure();
    }
}
