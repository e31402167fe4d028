package me.forketyfork.talk.xmpp;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads from whichever stream it was last switched to. Everything stacked on top of it
 * (charset decoder, parser buffers) survives a switch, so tokens keep flowing across a
 * transport upgrade.
 */
class SwitchableInputStream extends InputStream {

    private volatile InputStream delegate;

    SwitchableInputStream(InputStream delegate) {
        this.delegate = delegate;
    }

    void switchTo(InputStream next) {
        this.delegate = next;
    }

    @Override
    public int read() throws IOException {
        return delegate.read();
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        return delegate.read(b, off, len);
    }

    @Override
    public int available() throws IOException {
        return delegate.available();
    }

    @Override
    public void close() throws IOException {
        delegate.close();
    }
}
