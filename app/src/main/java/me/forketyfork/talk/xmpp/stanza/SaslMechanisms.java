package me.forketyfork.talk.xmpp.stanza;

import me.forketyfork.talk.xmpp.Namespaces;

import javax.xml.namespace.QName;
import java.util.List;

public record SaslMechanisms(List<String> mechanisms) implements Stanza {

    public static final QName NAME = new QName(Namespaces.SASL, "mechanisms");

    public SaslMechanisms {
        mechanisms = mechanisms == null ? List.of() : List.copyOf(mechanisms);
    }

    @Override
    public QName name() {
        return NAME;
    }
}
