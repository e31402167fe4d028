package me.forketyfork.talk.xmpp.stream;

/**
 * Escaping for values spliced into hand-written markup.
 */
public final class XmlText {

    private XmlText() {
    }

    /**
     * Escapes {@code < > " ' &}, which makes the result safe both as character data and
     * inside a quoted attribute.
     */
    public static String escape(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&apos;");
                case '&' -> escaped.append("&amp;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
