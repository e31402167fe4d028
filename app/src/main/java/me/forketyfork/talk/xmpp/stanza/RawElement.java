package me.forketyfork.talk.xmpp.stanza;

import javax.xml.namespace.QName;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verbatim capture of a child element that has no named field in its parent's model.
 * {@code innerXml} is the markup between the start and end tag exactly as it was received,
 * entity references included.
 * <p>
 * Prefixes in the inner markup may have been declared by an ancestor. {@code namespaces} keeps
 * every binding the captured markup relies on besides the element's own name, so the element
 * can be written out on its own and still parse to the same names.
 *
 * @param name                qualified name of the child, with the prefix it was received with
 * @param attributes          attributes without a namespace, in document order
 * @param qualifiedAttributes attributes in a namespace, such as {@code xml:lang}
 * @param namespaces          prefix to namespace URI, {@code ""} standing for the default namespace
 * @param innerXml            raw content of the child, empty for {@code <child/>}
 */
public record RawElement(QName name, Map<String, String> attributes, Map<QName, String> qualifiedAttributes,
                         Map<String, String> namespaces, String innerXml) {

    public RawElement {
        attributes = copy(attributes);
        qualifiedAttributes = copy(qualifiedAttributes);
        namespaces = copy(namespaces);
        innerXml = innerXml == null ? "" : innerXml;
    }

    public RawElement(QName name, Map<String, String> attributes, String innerXml) {
        this(name, attributes, Collections.emptyMap(), Collections.emptyMap(), innerXml);
    }

    public RawElement(QName name, String innerXml) {
        this(name, Collections.emptyMap(), innerXml);
    }

    private static <K> Map<K, String> copy(Map<K, String> map) {
        return map == null || map.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
