package me.forketyfork.talk.xmpp.stream;

import java.io.FilterReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Removes {@code <?xml ...?>} declarations from a character stream.
 * <p>
 * An XMPP peer repeats the declaration in front of every {@code <stream:stream>} header,
 * including the one that restarts the stream after authentication. To a single long-lived
 * parser the restarted header is a nested element, and a declaration in the middle of a
 * document is a fatal error, so declarations never reach the parser. Encoding is always UTF-8
 * on an XMPP stream, so nothing is lost by dropping them.
 */
public class XmlDeclarationFilterReader extends FilterReader {

    private static final String DECLARATION_START = "<?xml";
    private static final String CDATA_START = "<![CDATA[";
    private static final String COMMENT_START = "<!--";

    private enum Section {
        MARKUP(null), DECLARATION("?>"), INSTRUCTION("?>"), CDATA("]]>"), COMMENT("-->");

        private final String end;

        Section(String end) {
            this.end = end;
        }
    }

    private final char[] chunk = new char[4096];
    private final StringBuilder held = new StringBuilder();
    private final StringBuilder tail = new StringBuilder();
    private final StringBuilder pending = new StringBuilder();
    private Section section = Section.MARKUP;
    private boolean eof;

    public XmlDeclarationFilterReader(Reader in) {
        super(in);
    }

    @Override
    public int read() throws IOException {
        char[] one = new char[1];
        int n = read(one, 0, 1);
        return n == -1 ? -1 : one[0];
    }

    @Override
    public int read(char[] cbuf, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        while (pending.length() == 0) {
            if (eof) {
                return -1;
            }
            int n = in.read(chunk, 0, chunk.length);
            if (n == -1) {
                eof = true;
                // a truncated "<?xm" is passed through and left for the parser to reject
                pending.append(held);
                held.setLength(0);
            } else {
                filter(chunk, n);
            }
        }
        int count = Math.min(len, pending.length());
        pending.getChars(0, count, cbuf, off);
        pending.delete(0, count);
        return count;
    }

    private void filter(char[] chars, int length) {
        for (int i = 0; i < length; i++) {
            accept(chars[i]);
        }
    }

    private void accept(char c) {
        if (section != Section.MARKUP) {
            if (section != Section.DECLARATION) {
                pending.append(c);
            }
            tail.append(c);
            if (tail.length() > section.end.length()) {
                tail.deleteCharAt(0);
            }
            if (tail.toString().equals(section.end)) {
                enter(Section.MARKUP);
            }
            return;
        }
        if (held.length() == DECLARATION_START.length() && DECLARATION_START.contentEquals(held)) {
            held.setLength(0);
            if (Character.isWhitespace(c)) {
                enter(Section.DECLARATION);
            } else {
                // <?xml-stylesheet and friends are ordinary processing instructions
                pending.append(DECLARATION_START);
                enter(Section.INSTRUCTION);
                accept(c);
            }
            return;
        }
        held.append(c);
        if (held.length() == CDATA_START.length() && CDATA_START.contentEquals(held)) {
            pending.append(held);
            held.setLength(0);
            enter(Section.CDATA);
        } else if (held.length() == COMMENT_START.length() && COMMENT_START.contentEquals(held)) {
            pending.append(held);
            held.setLength(0);
            enter(Section.COMMENT);
        } else if (!isPrefix(DECLARATION_START) && !isPrefix(CDATA_START) && !isPrefix(COMMENT_START)) {
            held.setLength(held.length() - 1);
            boolean instruction = held.length() >= 2 && held.charAt(1) == '?';
            pending.append(held);
            held.setLength(0);
            if (instruction) {
                enter(Section.INSTRUCTION);
                accept(c);
            } else if (c == '<') {
                held.append(c);
            } else {
                pending.append(c);
            }
        }
    }

    private boolean isPrefix(String start) {
        return held.length() <= start.length() && start.startsWith(held.toString());
    }

    private void enter(Section next) {
        section = next;
        tail.setLength(0);
    }

    @Override
    public long skip(long n) throws IOException {
        char[] discard = new char[(int) Math.min(n, chunk.length)];
        int read = read(discard, 0, discard.length);
        return Math.max(read, 0);
    }

    @Override
    public boolean ready() throws IOException {
        return pending.length() > 0 || (held.length() == 0 && section != Section.DECLARATION && in.ready());
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    @Override
    public void mark(int readAheadLimit) throws IOException {
        throw new IOException("mark() not supported");
    }

    @Override
    public void reset() throws IOException {
        throw new IOException("reset() not supported");
    }
}
