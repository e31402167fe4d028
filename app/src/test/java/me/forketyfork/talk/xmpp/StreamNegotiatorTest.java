package me.forketyfork.talk.xmpp;

import org.junit.jupiter.api.Test;

import javax.xml.namespace.QName;

import static me.forketyfork.talk.xmpp.ServerScript.BIND_AND_SESSION_FEATURES;
import static me.forketyfork.talk.xmpp.ServerScript.BIND_FEATURES;
import static me.forketyfork.talk.xmpp.ServerScript.HEADER;
import static me.forketyfork.talk.xmpp.ServerScript.PLAIN_FEATURES;
import static me.forketyfork.talk.xmpp.ServerScript.SESSION_RESULT;
import static me.forketyfork.talk.xmpp.ServerScript.SUCCESS;
import static me.forketyfork.talk.xmpp.ServerScript.bindResult;
import static me.forketyfork.talk.xmpp.ServerScript.features;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.emptyString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class StreamNegotiatorTest {

    private static final String OPEN = "<?xml version='1.0'?>\n"
            + "<stream:stream to='example.com' xmlns='jabber:client'\n"
            + " xmlns:stream='http://etherx.jabber.org/streams' version='1.0'>\n";
    private static final String PLAIN_AUTH =
            "<auth xmlns='urn:ietf:params:xml:ns:xmpp-sasl' mechanism='PLAIN'>AGp1bGlldABzZWNyZXQ=</auth>\n";
    private static final String BIND = "<iq type='set' id='x'><bind xmlns='urn:ietf:params:xml:ns:xmpp-bind'/></iq>\n";
    private static final String PRESENCE = "<presence xml:lang='en'><show>chat</show><status>Online</status></presence>";

    private final XmppClientConfig plaintextAllowed = XmppClientConfig.builder()
            .jid("juliet@example.com")
            .password("secret")
            .allowInsecureAuth(true)
            .build();

    @Test
    public void negotiatesPlainAuthenticationAndBindsTheServerAssignedJid() throws Exception {
        ScriptedTransport transport = new ScriptedTransport(ServerScript.negotiated("juliet@example.com/balcony"));

        XmppSession session = XmppSession.connect(transport, plaintextAllowed);

        assertThat(session.state(), is(SessionState.READY));
        assertThat(session.jid(), equalTo("juliet@example.com/balcony"));
        assertThat(session.entityJid().getResourcepart().toString(), equalTo("balcony"));
        assertThat(transport.written(), equalTo(OPEN + PLAIN_AUTH + OPEN + BIND + PRESENCE));
    }

    @Test
    public void requestsTheConfiguredResourceAndEstablishesASessionWhenOffered() throws Exception {
        ScriptedTransport transport = new ScriptedTransport(HEADER + PLAIN_FEATURES + SUCCESS
                + HEADER + BIND_AND_SESSION_FEATURES + bindResult("juliet@example.com/balcony") + SESSION_RESULT);
        XmppClientConfig config = XmppClientConfig.builder()
                .jid("juliet@example.com")
                .password("secret")
                .allowInsecureAuth(true)
                .resource("balcony")
                .presence("away", "Wherefore art thou")
                .build();

        XmppSession session = XmppSession.connect(transport, config);

        assertThat(session.state(), is(SessionState.READY));
        assertThat(transport.written(), containsString(
                "<bind xmlns='urn:ietf:params:xml:ns:xmpp-bind'><resource>balcony</resource></bind>"));
        assertThat(transport.written(), containsString(
                "<iq type='set' id='sess'><session xmlns='urn:ietf:params:xml:ns:xmpp-session'/></iq>"));
        assertThat(transport.written(), containsString("<show>away</show><status>Wherefore art thou</status>"));
    }

    @Test
    public void skipsSessionEstablishmentWhenDisabled() throws Exception {
        ScriptedTransport transport = new ScriptedTransport(HEADER + PLAIN_FEATURES + SUCCESS
                + HEADER + BIND_AND_SESSION_FEATURES + bindResult("juliet@example.com/r"));
        XmppClientConfig config = XmppClientConfig.builder()
                .jid("juliet@example.com")
                .password("secret")
                .allowInsecureAuth(true)
                .establishSession(false)
                .build();

        XmppSession.connect(transport, config);

        assertThat(transport.written(), not(containsString("xmpp-session")));
    }

    @Test
    public void surfacesTheSaslFailureConditionAndClosesTheTransport() {
        ScriptedTransport transport = new ScriptedTransport(HEADER + PLAIN_FEATURES
                + "<failure xmlns='urn:ietf:params:xml:ns:xmpp-sasl'><not-authorized/></failure>");

        AuthException e = assertThrows(AuthException.class, () -> XmppSession.connect(transport, plaintextAllowed));

        assertThat(e.getReason(), equalTo("not-authorized"));
        assertThat(transport.isClosed(), is(true));
    }

    @Test
    public void rejectsAnIdentifierWithoutDomainBeforeWritingAnything() {
        ScriptedTransport transport = new ScriptedTransport("");
        XmppClientConfig config = XmppClientConfig.builder().jid("juliet").password("secret").build();

        assertThrows(ConfigException.class, () -> XmppSession.connect(transport, config));

        assertThat(transport.written(), emptyString());
        assertThat(transport.isClosed(), is(true));
    }

    @Test
    public void refusesToSendCredentialsOverAnUnencryptedTransportByDefault() {
        ScriptedTransport transport = new ScriptedTransport(HEADER + PLAIN_FEATURES);

        assertThrows(InsecureAuthException.class,
                () -> XmppSession.connect(transport, new XmppClientConfig("juliet@example.com", "secret")));

        assertThat(transport.written(), not(containsString("<auth")));
    }

    @Test
    public void authenticatesOverASecureTransportWithDefaultPolicy() throws Exception {
        ScriptedTransport transport = new ScriptedTransport(ServerScript.negotiated("juliet@example.com/r"), true);

        XmppSession session = XmppSession.connect(transport, new XmppClientConfig("juliet@example.com", "secret"));

        assertThat(session.isSecure(), is(true));
        assertThat(session.state(), is(SessionState.READY));
    }

    @Test
    public void failsWhenTheServerDoesNotOpenAStream() {
        ScriptedTransport transport = new ScriptedTransport("<html xmlns='http://www.w3.org/1999/xhtml'>");

        ProtocolException e = assertThrows(ProtocolException.class,
                () -> XmppSession.connect(transport, plaintextAllowed));

        assertThat(e.getElement(), equalTo(new QName("http://www.w3.org/1999/xhtml", "html")));
    }

    @Test
    public void failsWhenTheFirstFeaturesAreMissing() {
        ScriptedTransport transport = new ScriptedTransport(HEADER + SUCCESS);

        assertThrows(ProtocolException.class, () -> XmppSession.connect(transport, plaintextAllowed));

        assertThat(transport.written(), not(containsString("<auth")));
    }

    @Test
    public void toleratesUndecodableFeaturesAfterTheRestart() throws Exception {
        ScriptedTransport transport = new ScriptedTransport(HEADER + PLAIN_FEATURES + SUCCESS
                + HEADER + "<surprise xmlns='urn:example:unknown'/>" + bindResult("juliet@example.com/r"));

        XmppSession session = XmppSession.connect(transport, plaintextAllowed);

        assertThat(session.jid(), equalTo("juliet@example.com/r"));
    }

    @Test
    public void failsWhenTheBindResultCarriesNoJid() {
        ScriptedTransport transport = new ScriptedTransport(HEADER + PLAIN_FEATURES + SUCCESS
                + HEADER + BIND_FEATURES + "<iq type='result' id='x'/>");

        assertThrows(ProtocolException.class, () -> XmppSession.connect(transport, plaintextAllowed));

        assertThat(transport.written(), not(containsString("<presence")));
    }

    @Test
    public void failsWhenBindingIsRefused() {
        ScriptedTransport transport = new ScriptedTransport(HEADER + PLAIN_FEATURES + SUCCESS
                + HEADER + BIND_FEATURES + "<iq type='error' id='x'><error type='cancel'>"
                + "<conflict xmlns='urn:ietf:params:xml:ns:xmpp-stanzas'/></error></iq>");

        ProtocolException e = assertThrows(ProtocolException.class,
                () -> XmppSession.connect(transport, plaintextAllowed));

        assertThat(e.getMessage(), containsString("conflict"));
    }

    @Test
    public void failsWhenTheBoundJidHasNoResource() {
        ScriptedTransport transport = new ScriptedTransport(ServerScript.negotiated("juliet@example.com"));

        assertThrows(ProtocolException.class, () -> XmppSession.connect(transport, plaintextAllowed));
    }

    @Test
    public void failsBeforeAuthenticatingWhenNoMechanismIsUsable() {
        ScriptedTransport transport = new ScriptedTransport(HEADER + features("X-OAUTH2"));

        assertThrows(AuthException.class, () -> XmppSession.connect(transport, plaintextAllowed));

        assertThat(transport.written(), not(containsString("<auth")));
    }

    @Test
    public void usesExternalWithoutPayloadWhenPreferred() throws Exception {
        ScriptedTransport transport = new ScriptedTransport(HEADER + features("EXTERNAL", "PLAIN") + SUCCESS
                + HEADER + BIND_FEATURES + bindResult("juliet@example.com/r"), true);
        XmppClientConfig config = XmppClientConfig.builder()
                .jid("juliet@example.com")
                .preferExternal(true)
                .build();

        XmppSession.connect(transport, config);

        assertThat(transport.written(), containsString(
                "<auth xmlns='urn:ietf:params:xml:ns:xmpp-sasl' mechanism='EXTERNAL'/>"));
    }

    @Test
    public void appliesTheConfiguredReadTimeout() throws Exception {
        ScriptedTransport transport = new ScriptedTransport(ServerScript.negotiated("juliet@example.com/r"));
        XmppClientConfig config = XmppClientConfig.builder()
                .jid("juliet@example.com")
                .password("secret")
                .allowInsecureAuth(true)
                .readTimeoutMs(1500)
                .build();

        XmppSession.connect(transport, config);

        assertThat(transport.readTimeoutMs(), is(1500));
    }

    @Test
    public void reportsAServerThatHangsUpMidHandshakeAsEndOfStream() {
        ScriptedTransport transport = new ScriptedTransport(HEADER + PLAIN_FEATURES);
        XmppClientConfig config = plaintextAllowed;

        assertThrows(EndOfStreamException.class, () -> XmppSession.connect(transport, config));

        assertThat(transport.isClosed(), is(true));
    }
}
