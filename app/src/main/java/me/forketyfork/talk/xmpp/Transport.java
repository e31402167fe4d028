package me.forketyfork.talk.xmpp;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * A connected duplex byte stream to the server. Establishing it (TCP, proxies, TLS) is the
 * caller's business; the session only reads, writes and closes.
 */
public interface Transport extends Closeable {

    InputStream getInputStream() throws IOException;

    OutputStream getOutputStream() throws IOException;

    /**
     * @return whether bytes on this transport are encrypted
     */
    boolean isSecure();

    /**
     * Bounds how long a single read may block. A read that exceeds it fails with
     * {@link java.net.SocketTimeoutException}.
     *
     * @param timeoutMs the timeout in milliseconds, 0 for none
     */
    void setReadTimeout(int timeoutMs) throws IOException;
}
