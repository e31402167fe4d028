package me.forketyfork.talk.xmpp.server;

import me.forketyfork.talk.chat.IncomingStanzaListener;
import me.forketyfork.talk.xmpp.XmppException;
import me.forketyfork.talk.xmpp.stanza.Message;
import me.forketyfork.talk.xmpp.stanza.Presence;
import org.hamcrest.Matcher;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;

/**
 * Collects messages from a receive loop running on another thread.
 */
public class SingleMessageListener implements IncomingStanzaListener {

    private final ArrayBlockingQueue<Message> messages = new ArrayBlockingQueue<>(1);

    public Message receivesAMessage(Matcher<? super String> bodyMatcher) throws InterruptedException {
        final Message message = messages.poll(5, TimeUnit.SECONDS);
        assertThat("Message", message, is(notNullValue()));
        assertThat(message.body(), bodyMatcher);
        return message;
    }

    @Override
    public void messageReceived(Message message) {
        messages.add(message);
    }

    @Override
    public void presenceReceived(Presence presence) {
    }

    @Override
    public void streamClosed() {
    }

    @Override
    public void receiveFailed(XmppException failure) {
    }
}
