package me.forketyfork.talk.xmpp.stream;

import java.io.FilterReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Keeps a copy of every character handed to the parser so that element content can be cut out
 * of the original text by character offset. Characters before a released offset are dropped.
 */
class RecordingReader extends FilterReader {

    private final StringBuilder recorded = new StringBuilder();
    private long base;
    private boolean endReached;

    RecordingReader(Reader in) {
        super(in);
    }

    @Override
    public int read() throws IOException {
        int c = in.read();
        if (c == -1) {
            endReached = true;
        } else {
            recorded.append((char) c);
        }
        return c;
    }

    @Override
    public int read(char[] cbuf, int off, int len) throws IOException {
        int n = in.read(cbuf, off, len);
        if (n == -1) {
            endReached = true;
        } else {
            recorded.append(cbuf, off, n);
        }
        return n;
    }

    @Override
    public long skip(long n) throws IOException {
        char[] discard = new char[(int) Math.min(n, 4096)];
        int read = read(discard, 0, discard.length);
        return Math.max(read, 0);
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    /**
     * @return the recorded text between two absolute character offsets
     * @throws IllegalStateException if part of the range was already released
     */
    String slice(long from, long to) {
        if (from < base) {
            throw new IllegalStateException("Characters before offset " + base + " were released, got " + from);
        }
        if (to < from) {
            return "";
        }
        return recorded.substring((int) (from - base), (int) (to - base));
    }

    /**
     * Forgets the characters before {@code offset}.
     */
    void release(long offset) {
        long drop = Math.min(offset - base, recorded.length());
        if (drop > 0) {
            recorded.delete(0, (int) drop);
            base += drop;
        }
    }

    boolean endReached() {
        return endReached;
    }
}
