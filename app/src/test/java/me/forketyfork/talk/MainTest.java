package me.forketyfork.talk;

import me.forketyfork.talk.xmpp.TransportException;
import me.forketyfork.talk.xmpp.stanza.Message;
import me.forketyfork.talk.xmpp.stanza.Presence;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.emptyString;
import static org.hamcrest.Matchers.equalTo;

public class MainTest {

    private final ByteArrayOutputStream console = new ByteArrayOutputStream();
    private final Main main = new Main(new PrintStream(console, true, StandardCharsets.UTF_8));

    private String printed() {
        return console.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
    }

    @Test
    public void printsMessageBodiesWithTheSender() {
        main.messageReceived(new Message("juliet@example.com/balcony", null, null, "chat", null,
                null, "Wherefore art thou?", null, null, null));

        assertThat(printed(), equalTo("juliet@example.com/balcony: Wherefore art thou?\n"));
    }

    @Test
    public void ignoresMessagesWithoutBody() {
        main.messageReceived(new Message("juliet@example.com", null, null, "chat", null,
                null, null, null, null, null));

        assertThat(printed(), emptyString());
    }

    @Test
    public void printsPresenceChanges() {
        main.presenceReceived(new Presence("juliet@example.com", null, null, null, null,
                "away", "At the ball", null, null, null, null));
        main.presenceReceived(new Presence("juliet@example.com", null, null, "unavailable", null,
                null, null, null, null, null, null));

        assertThat(printed(), equalTo("* juliet@example.com is available (At the ball)\n"
                + "* juliet@example.com is unavailable\n"));
    }

    @Test
    public void reportsTheEndOfTheConnection() {
        main.streamClosed();
        main.receiveFailed(new TransportException("Connection reset"));

        assertThat(printed(), equalTo("* disconnected\n* connection lost: Connection reset\n"));
    }
}
