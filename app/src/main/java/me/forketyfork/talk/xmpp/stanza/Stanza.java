package me.forketyfork.talk.xmpp.stanza;

import javax.xml.namespace.QName;

/**
 * A decoded top-level protocol element. The qualified name identifies the variant.
 */
public interface Stanza {

    /**
     * @return the namespace and local name this element is encoded with
     */
    QName name();
}
