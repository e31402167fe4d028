package me.forketyfork.talk.xmpp.stanza;

import me.forketyfork.talk.xmpp.Namespaces;

import javax.xml.namespace.QName;
import java.util.List;

/**
 * A {@code <presence/>} stanza. Absent attributes and children are {@code null}.
 *
 * @param type     error, probe, subscribe, subscribed, unavailable, unsubscribe or unsubscribed;
 *                 {@code null} means available
 * @param show     away, chat, dnd or xa
 * @param priority kept as text, the way it appears on the wire
 */
public record Presence(String from, String id, String to, String type, String lang,
                       String show, String status, String priority, StanzaError error,
                       List<String> otherText, List<RawElement> otherElements) implements Stanza {

    public static final QName NAME = new QName(Namespaces.CLIENT, "presence");

    public Presence {
        otherText = otherText == null ? List.of() : List.copyOf(otherText);
        otherElements = otherElements == null ? List.of() : List.copyOf(otherElements);
    }

    public static Presence available(String show, String status) {
        return new Presence(null, null, null, null, null, show, status, null, null, null, null);
    }

    @Override
    public QName name() {
        return NAME;
    }
}
