package me.forketyfork.talk.xmpp.stream;

import me.forketyfork.talk.xmpp.Namespaces;
import me.forketyfork.talk.xmpp.XmppException;
import me.forketyfork.talk.xmpp.stanza.RawElement;
import org.codehaus.stax2.XMLStreamReader2;

import javax.xml.XMLConstants;
import javax.xml.namespace.QName;
import javax.xml.stream.XMLStreamConstants;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Cursor handed to an {@link ElementDecoder}. It is positioned on a start element and offers
 * the reads a decoder needs: attributes, text content, iteration over direct children and
 * verbatim capture of children the decoder does not model.
 */
public class ElementScanner {

    /**
     * Called for each direct child; the visitor must consume the child through the scanner.
     */
    @FunctionalInterface
    public interface ChildVisitor {
        void child(QName name) throws XmppException;
    }

    /**
     * An unmodeled child: its raw capture and the character data directly inside it.
     */
    public record Captured(RawElement element, String text) {
    }

    private final XmppTokenReader tokens;

    ElementScanner(XmppTokenReader tokens) {
        this.tokens = tokens;
    }

    public QName name() {
        return tokens.parser().getName();
    }

    /**
     * @return the value of an attribute without namespace, or {@code null}
     */
    public String attribute(String localName) {
        return tokens.parser().getAttributeValue(null, localName);
    }

    /**
     * @return the {@code xml:lang} attribute, or {@code null}
     */
    public String lang() {
        return tokens.parser().getAttributeValue(Namespaces.XML, "lang");
    }

    public Map<String, String> plainAttributes() {
        XMLStreamReader2 parser = tokens.parser();
        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < parser.getAttributeCount(); i++) {
            String namespace = parser.getAttributeNamespace(i);
            if (namespace == null || namespace.isEmpty()) {
                attributes.put(parser.getAttributeLocalName(i), parser.getAttributeValue(i));
            }
        }
        return attributes;
    }

    /**
     * Reads the character data of the current element, ignoring anything inside nested elements.
     * Leaves the cursor on the element's end tag.
     */
    public String text() throws XmppException {
        StringBuilder text = new StringBuilder();
        int depth = 0;
        while (true) {
            int event = tokens.next();
            switch (event) {
                case XMLStreamConstants.START_ELEMENT -> depth++;
                case XMLStreamConstants.END_ELEMENT -> {
                    if (depth == 0) {
                        return text.toString();
                    }
                    depth--;
                }
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE -> {
                    if (depth == 0) {
                        text.append(tokens.parser().getText());
                    }
                }
                default -> {
                }
            }
        }
    }

    /**
     * Walks the direct children of the current element and returns its own character data.
     * Leaves the cursor on the element's end tag.
     */
    public String children(ChildVisitor visitor) throws XmppException {
        StringBuilder text = new StringBuilder();
        while (true) {
            int event = tokens.next();
            switch (event) {
                case XMLStreamConstants.START_ELEMENT -> visitor.child(tokens.parser().getName());
                case XMLStreamConstants.END_ELEMENT -> {
                    return text.toString();
                }
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE ->
                        text.append(tokens.parser().getText());
                default -> {
                }
            }
        }
    }

    /**
     * Consumes the current element and everything in it.
     */
    public void skip() throws XmppException {
        int depth = 0;
        while (true) {
            int event = tokens.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                depth++;
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                if (depth == 0) {
                    return;
                }
                depth--;
            }
        }
    }

    /**
     * @return attributes in a namespace, keyed by their prefixed name
     */
    public Map<QName, String> qualifiedAttributes() {
        XMLStreamReader2 parser = tokens.parser();
        Map<QName, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < parser.getAttributeCount(); i++) {
            String namespace = parser.getAttributeNamespace(i);
            if (namespace != null && !namespace.isEmpty()) {
                attributes.put(new QName(namespace, parser.getAttributeLocalName(i),
                        emptyIfNull(parser.getAttributePrefix(i))), parser.getAttributeValue(i));
            }
        }
        return attributes;
    }

    /**
     * Consumes the current element, keeping its inner markup exactly as it was received along
     * with the namespace bindings that markup depends on.
     */
    public Captured capture() throws XmppException {
        XMLStreamReader2 parser = tokens.parser();
        QName name = parser.getName();
        Map<String, String> attributes = plainAttributes();
        Map<QName, String> qualified = qualifiedAttributes();

        Map<String, String> namespaces = new LinkedHashMap<>();
        Set<String> declaredOnRoot = declaredPrefixes(parser);
        for (int i = 0; i < parser.getNamespaceCount(); i++) {
            namespaces.put(emptyIfNull(parser.getNamespacePrefix(i)), emptyIfNull(parser.getNamespaceURI(i)));
        }
        // the element's own prefix is declared wherever it is written out
        declaredOnRoot.add(emptyIfNull(name.getPrefix()));
        Deque<Set<String>> scopes = new ArrayDeque<>();
        scopes.push(declaredOnRoot);
        requireAttributeBindings(parser, scopes, namespaces);
        namespaces.remove(emptyIfNull(name.getPrefix()));

        if (tokens.emptyElement()) {
            tokens.next();
            return new Captured(new RawElement(name, attributes, qualified, namespaces, ""), "");
        }
        long innerStart = tokens.tokenEnd();
        StringBuilder text = new StringBuilder();
        while (true) {
            int event = tokens.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                scopes.push(declaredPrefixes(parser));
                requireBinding(scopes, namespaces, parser.getPrefix(), parser.getNamespaceURI());
                requireAttributeBindings(parser, scopes, namespaces);
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                scopes.pop();
                if (scopes.isEmpty()) {
                    break;
                }
            } else if (scopes.size() == 1 && (event == XMLStreamConstants.CHARACTERS
                    || event == XMLStreamConstants.CDATA || event == XMLStreamConstants.SPACE)) {
                text.append(parser.getText());
            }
        }
        String inner = tokens.raw(innerStart, tokens.tokenStart());
        return new Captured(new RawElement(name, attributes, qualified, namespaces, inner), text.toString());
    }

    private static Set<String> declaredPrefixes(XMLStreamReader2 parser) {
        Set<String> prefixes = new HashSet<>();
        for (int i = 0; i < parser.getNamespaceCount(); i++) {
            prefixes.add(emptyIfNull(parser.getNamespacePrefix(i)));
        }
        return prefixes;
    }

    private static void requireAttributeBindings(XMLStreamReader2 parser, Deque<Set<String>> scopes,
                                                 Map<String, String> namespaces) {
        for (int i = 0; i < parser.getAttributeCount(); i++) {
            String prefix = emptyIfNull(parser.getAttributePrefix(i));
            if (!prefix.isEmpty()) {
                requireBinding(scopes, namespaces, prefix, parser.getAttributeNamespace(i));
            }
        }
    }

    /**
     * Records a binding used inside the capture that no element of the capture declares.
     */
    private static void requireBinding(Deque<Set<String>> scopes, Map<String, String> namespaces,
                                       String prefix, String namespace) {
        String key = emptyIfNull(prefix);
        if (XMLConstants.XML_NS_PREFIX.equals(key)) {
            return;
        }
        for (Set<String> scope : scopes) {
            if (scope.contains(key)) {
                return;
            }
        }
        namespaces.putIfAbsent(key, emptyIfNull(namespace));
    }

    private static String emptyIfNull(String value) {
        return value == null ? "" : value;
    }
}
