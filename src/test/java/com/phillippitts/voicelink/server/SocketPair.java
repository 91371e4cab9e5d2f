package com.phillippitts.voicelink.server;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Connected loopback sockets: {@link #server} is handed to the code under test, {@link #client} plays the
 * HTTP client.
 */
final class SocketPair implements AutoCloseable {

    final Socket client;
    final Socket server;

    private SocketPair(Socket client, Socket server) {
        this.client = client;
        this.server = server;
    }

    static SocketPair open() throws IOException {
        try (ServerSocket listener = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            Socket client = new Socket(InetAddress.getLoopbackAddress(), listener.getLocalPort());
            Socket server = listener.accept();
            client.setSoTimeout(10_000);
            return new SocketPair(client, server);
        }
    }

    void send(String text) throws IOException {
        send(text.getBytes(StandardCharsets.ISO_8859_1));
    }

    void send(byte[] bytes) throws IOException {
        OutputStream out = client.getOutputStream();
        out.write(bytes);
        out.flush();
    }

    /**
     * Reads exactly {@code length} bytes, or fewer if the server closes first.
     */
    String readExactly(int length) throws IOException {
        InputStream in = client.getInputStream();
        byte[] buf = new byte[length];
        int read = 0;
        while (read < length) {
            int n = in.read(buf, read, length - read);
            if (n < 0) {
                break;
            }
            read += n;
        }
        return new String(buf, 0, read, StandardCharsets.ISO_8859_1);
    }

    /**
     * Reads until the server closes the connection.
     */
    String readAll() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        client.getInputStream().transferTo(out);
        return out.toString(StandardCharsets.ISO_8859_1);
    }

    @Override
    public void close() throws IOException {
        client.close();
        server.close();
    }
}
