package me.forketyfork.talk.xmpp.stanza;

import me.forketyfork.talk.xmpp.Namespaces;

import javax.xml.namespace.QName;
import java.util.List;

/**
 * A {@code <message/>} stanza. Absent attributes and children are {@code null}.
 *
 * @param type          chat, error, groupchat, headline or normal
 * @param otherText     decoded character data directly inside each unmodeled child, one entry per child
 * @param otherElements raw capture of each unmodeled child, in document order
 */
public record Message(String from, String id, String to, String type, String lang,
                      String subject, String body, String thread,
                      List<String> otherText, List<RawElement> otherElements) implements Stanza {

    public static final QName NAME = new QName(Namespaces.CLIENT, "message");

    public Message {
        otherText = otherText == null ? List.of() : List.copyOf(otherText);
        otherElements = otherElements == null ? List.of() : List.copyOf(otherElements);
    }

    public static Message chat(String to, String body) {
        return new Message(null, null, to, "chat", null, null, body, null, null, null);
    }

    @Override
    public QName name() {
        return NAME;
    }
}
