package me.forketyfork.talk.xmpp;

import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

/**
 * {@link Transport} over an already connected socket. An {@link SSLSocket} counts as secure.
 */
public class SocketTransport implements Transport {

    private final Socket socket;

    public SocketTransport(Socket socket) {
        if (socket == null || !socket.isConnected()) {
            throw new IllegalArgumentException("Socket must be connected");
        }
        this.socket = socket;
    }

    @Override
    public InputStream getInputStream() throws IOException {
        return socket.getInputStream();
    }

    @Override
    public OutputStream getOutputStream() throws IOException {
        return socket.getOutputStream();
    }

    @Override
    public boolean isSecure() {
        return socket instanceof SSLSocket;
    }

    @Override
    public void setReadTimeout(int timeoutMs) throws IOException {
        socket.setSoTimeout(timeoutMs);
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    @Override
    public String toString() {
        return "SocketTransport{" + socket.getRemoteSocketAddress() + (isSecure() ? ", tls" : "") + "}";
    }
}
