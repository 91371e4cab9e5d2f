package com.phillippitts.voicelink.server;

import com.phillippitts.voicelink.config.properties.ApiServerProperties;
import com.phillippitts.voicelink.exception.ServerBindException;
import com.phillippitts.voicelink.server.http.ApiErrorCode;
import com.phillippitts.voicelink.server.http.HttpResponse;
import com.phillippitts.voicelink.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.net.BindException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the listening socket of the transcription API.
 *
 * <p>A dedicated accept thread hands every accepted socket to the {@code connectionExecutor}
 * immediately. When the executor is saturated the socket is answered with 503 and closed.
 * {@link #stop()} closes the listening socket and every connection still in flight, and may be
 * called any number of times.
 */
@Component
public class HttpConnectionListener implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(HttpConnectionListener.class);

    private final ApiServerProperties properties;
    private final ConnectionHandlerFactory handlerFactory;
    private final ThreadPoolTaskExecutor connectionExecutor;
    private final ListenerStatus status;
    private final Set<Socket> liveSockets = ConcurrentHashMap.newKeySet();

    private volatile boolean running;
    private volatile ServerSocket serverSocket;
    private volatile Thread acceptThread;

    public HttpConnectionListener(ApiServerProperties properties,
                                  ConnectionHandlerFactory handlerFactory,
                                  @Qualifier("connectionExecutor") ThreadPoolTaskExecutor connectionExecutor,
                                  ListenerStatus status) {
        this.properties = properties;
        this.handlerFactory = handlerFactory;
        this.connectionExecutor = connectionExecutor;
        this.status = status;
    }

    /**
     * Binds and starts accepting.
     *
     * @throws ServerBindException if the port is occupied or cannot be bound
     */
    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        int port = properties.getPort();
        ServerSocket socket;
        try {
            socket = new ServerSocket();
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(bindAddress(), port), properties.getBacklog());
        } catch (BindException e) {
            LOG.error("Port {} is already in use or not permitted", port);
            throw new ServerBindException(port, e);
        } catch (IOException e) {
            throw new ServerBindException(port, e);
        }
        serverSocket = socket;
        running = true;
        status.markStarted(socket.getLocalPort(), endpoint(socket.getLocalPort()));

        Thread t = new Thread(this::acceptLoop, "api-accept");
        t.setDaemon(true);
        acceptThread = t;
        t.start();
        LOG.info("{} listening on {} (mode={})", properties.getServiceName(), endpoint(socket.getLocalPort()),
                properties.getMode());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        status.markStopped();
        closeQuietly(serverSocket);
        for (Socket s : liveSockets) {
            closeQuietly(s);
        }
        liveSockets.clear();
        Thread t = acceptThread;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(ProcessTimeouts.ACCEPT_THREAD_STOP_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        acceptThread = null;
        LOG.info("{} stopped", properties.getServiceName());
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isEnabled();
    }

    /**
     * Locally bound port, or -1 when not listening. Reports the real port when configured with 0.
     */
    public int getPort() {
        ServerSocket s = serverSocket;
        return running && s != null ? s.getLocalPort() : -1;
    }

    int liveConnectionCount() {
        return liveSockets.size();
    }

    private void acceptLoop() {
        while (running) {
            Socket client;
            try {
                client = serverSocket.accept();
            } catch (SocketException e) {
                if (running) {
                    LOG.warn("Accept failed: {}", e.getMessage());
                }
                continue;
            } catch (IOException e) {
                LOG.warn("Accept failed: {}", e.getMessage());
                continue;
            }
            hand(client);
        }
        LOG.debug("Accept loop exited");
    }

    private void hand(Socket client) {
        liveSockets.add(client);
        ConnectionHandler handler = handlerFactory.create(client);
        try {
            connectionExecutor.execute(() -> {
                try {
                    handler.run();
                } finally {
                    liveSockets.remove(client);
                }
            });
        } catch (TaskRejectedException e) {
            LOG.warn("Connection executor saturated, answering 503");
            rejectBusy(client);
            liveSockets.remove(client);
        }
    }

    private void rejectBusy(Socket client) {
        try {
            OutputStream out = client.getOutputStream();
            out.write(HttpResponse.error(ApiErrorCode.SERVER_BUSY, "Server is busy, try again later").toBytes());
            out.flush();
        } catch (IOException e) {
            LOG.debug("Could not write 503: {}", e.getMessage());
        } finally {
            closeQuietly(client);
        }
    }

    private InetAddress bindAddress() {
        try {
            return properties.getBindScope() == ApiServerProperties.BindScope.ALL_INTERFACES
                    ? InetAddress.getByName("0.0.0.0")
                    : InetAddress.getLoopbackAddress();
        } catch (IOException e) {
            throw new ServerBindException(properties.getPort(), e);
        }
    }

    private String endpoint(int port) {
        String host = properties.getBindScope() == ApiServerProperties.BindScope.ALL_INTERFACES ? "0.0.0.0" : "localhost";
        return "http://" + host + ":" + port;
    }

    private static void closeQuietly(Closeable c) {
        if (c == null) {
            return;
        }
        try {
            c.close();
        } catch (IOException e) {
            LOG.debug("Error closing {}: {}", c, e.getMessage());
        }
    }
}
