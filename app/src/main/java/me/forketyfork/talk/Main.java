package me.forketyfork.talk;

import me.forketyfork.talk.chat.IncomingStanzaListener;
import me.forketyfork.talk.chat.ReceiveLoop;
import me.forketyfork.talk.xmpp.SocketTransport;
import me.forketyfork.talk.xmpp.TransportException;
import me.forketyfork.talk.xmpp.XmppClientConfig;
import me.forketyfork.talk.xmpp.XmppException;
import me.forketyfork.talk.xmpp.XmppSession;
import me.forketyfork.talk.xmpp.stanza.Message;
import me.forketyfork.talk.xmpp.stanza.Presence;

import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.Socket;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Main implements IncomingStanzaListener {

    public static final String INSECURE_FLAG = "--insecure";

    public static final int ARG_HOSTNAME = 0;
    public static final int ARG_PORT = 1;
    public static final int ARG_JID = 2;
    public static final int ARG_PASSWORD = 3;
    public static final int ARG_TO = 4;
    public static final int ARG_TEXT = 5;

    public static final String USAGE = "usage: talk [" + INSECURE_FLAG + "] host port user@domain password [to text]";

    // console formats
    public static final String MESSAGE_FORMAT = "%s: %s%n";
    public static final String PRESENCE_FORMAT = "* %s is %s%s%n";

    private static final Logger logger = Logger.getLogger("Main");

    private final PrintStream out;

    public Main(PrintStream out) {
        this.out = out;
    }

    public static void main(String... args) throws Exception {
        installLogging();

        boolean insecure = args.length > 0 && INSECURE_FLAG.equals(args[0]);
        String[] rest = insecure ? Arrays.copyOfRange(args, 1, args.length) : args;
        if (rest.length != ARG_TO && rest.length != ARG_TEXT + 1) {
            System.err.println(USAGE);
            System.exit(2);
        }

        XmppClientConfig config = XmppClientConfig.builder()
                .jid(rest[ARG_JID])
                .password(rest[ARG_PASSWORD])
                .allowInsecureAuth(insecure)
                .build();
        Socket socket = openSocket(rest[ARG_HOSTNAME], Integer.parseInt(rest[ARG_PORT]), insecure);

        XmppSession session = XmppSession.connect(new SocketTransport(socket), config);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> disconnect(session)));

        if (rest.length > ARG_TEXT) {
            session.sendMessage(rest[ARG_TO], "chat", rest[ARG_TEXT]);
        }
        new ReceiveLoop(session, new Main(System.out)).run();
        disconnect(session);
    }

    @Override
    public void messageReceived(Message message) {
        if (message.body() != null) {
            out.printf(MESSAGE_FORMAT, message.from(), message.body());
        }
    }

    @Override
    public void presenceReceived(Presence presence) {
        String availability = presence.type() == null ? "available" : presence.type();
        String status = presence.status() == null ? "" : " (" + presence.status() + ")";
        out.printf(PRESENCE_FORMAT, presence.from(), availability, status);
    }

    @Override
    public void streamClosed() {
        out.println("* disconnected");
    }

    @Override
    public void receiveFailed(XmppException failure) {
        out.println("* connection lost: " + failure.getMessage());
    }

    private static Socket openSocket(String hostname, int port, boolean insecure) throws IOException {
        if (insecure) {
            return new Socket(hostname, port);
        }
        SSLSocket socket = (SSLSocket) SSLSocketFactory.getDefault().createSocket(hostname, port);
        SSLParameters parameters = socket.getSSLParameters();
        parameters.setEndpointIdentificationAlgorithm("HTTPS");
        socket.setSSLParameters(parameters);
        socket.startHandshake();
        return socket;
    }

    private static void disconnect(XmppSession session) {
        try {
            session.close();
        } catch (TransportException e) {
            logger.log(Level.WARNING, "Failed to close session", e);
        }
    }

    private static void installLogging() throws IOException {
        try (InputStream config = Main.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        }
    }
}
