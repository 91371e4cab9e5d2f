package com.phillippitts.voicelink.server;

import com.phillippitts.voicelink.server.http.HttpRequest;
import com.phillippitts.voicelink.server.http.HttpResponse;
import com.phillippitts.voicelink.server.http.RequestAccumulator;
import com.phillippitts.voicelink.service.metrics.RequestStatistics;
import com.phillippitts.voicelink.service.metrics.TranscriptionMetrics;
import com.phillippitts.voicelink.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Serves exactly one request on an accepted socket, then closes it.
 *
 * <pre>
 * READING_HEADERS -&gt; READING_BODY -&gt; DISPATCHED -&gt; RESPONDING -&gt; CLOSED
 * </pre>
 * Framing is delegated to {@link RequestAccumulator}. The move to DISPATCHED is a
 * compare-and-set, so a request is routed at most once. Protocol rejections (malformed head,
 * oversized body) are answered straight from the reading states without dispatch. A premature EOF
 * or an inactivity timeout closes the socket without a response.
 *
 * <p>Every log line carries the {@code connectionId}, {@code method} and {@code path} keys.
 */
public class ConnectionHandler implements Runnable {

    private static final Logger LOG = LogManager.getLogger(ConnectionHandler.class);

    protected final Socket socket;
    protected final ConnectionSettings settings;
    protected final String connectionId;

    private final RequestRouter router;
    private final RequestStatistics statistics;
    private final TranscriptionMetrics metrics;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.READING_HEADERS);
    private final Object outputLock = new Object();

    public ConnectionHandler(Socket socket, ConnectionSettings settings, RequestRouter router,
                             RequestStatistics statistics, TranscriptionMetrics metrics) {
        this.socket = Objects.requireNonNull(socket, "socket");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.router = Objects.requireNonNull(router, "router");
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.connectionId = Integer.toHexString(ThreadLocalRandom.current().nextInt(0x10000000, Integer.MAX_VALUE));
    }

    @Override
    public void run() {
        ThreadContext.put("connectionId", connectionId);
        long startNanos = System.nanoTime();
        try {
            socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, settings.inactivityTimeout().toMillis()));
            HttpRequest request = readRequest(socket.getInputStream());
            if (request == null) {
                return;
            }
            ThreadContext.put("method", request.method());
            ThreadContext.put("path", request.path());
            if (!transition(readingState(), ConnectionState.DISPATCHED)) {
                LOG.warn("Connection already dispatched, ignoring request");
                return;
            }
            RequestRouter.Route route = router.route(request);
            LOG.debug("Dispatching {} {} ({} body bytes)", request.method(), request.path(), request.body().length);

            HttpResponse response = dispatch(request);
            respond(response);
            long elapsed = System.nanoTime() - startNanos;
            statistics.record(TimeUtils.nanosToMillis(elapsed));
            metrics.recordRequest(route.tag(), response.status(), elapsed);
            LOG.info("{} {} -> {} in {} ms", request.method(), request.path(), response.status(),
                    TimeUtils.nanosToMillis(elapsed));
        } catch (SocketTimeoutException e) {
            LOG.info("Connection idle for {}s, closing", settings.inactivityTimeout().toSeconds());
        } catch (IOException e) {
            LOG.debug("Connection I/O error: {}", e.getMessage());
        } finally {
            state.set(ConnectionState.CLOSED);
            closeQuietly();
            ThreadContext.clearMap();
        }
    }

    /**
     * Reads until a full request is framed. Answers protocol rejections itself.
     *
     * @return the request, or null when the connection ended without one
     */
    private HttpRequest readRequest(InputStream in) throws IOException {
        RequestAccumulator accumulator = new RequestAccumulator(settings.maxBodyBytes(), settings.maxHeaderBytes());
        byte[] buffer = new byte[settings.readChunkBytes()];
        boolean headSeen = false;
        while (true) {
            int n = in.read(buffer);
            if (n < 0) {
                LOG.debug("Client closed connection after {} body bytes, not dispatching",
                        accumulator.bodyBytesReceived());
                return null;
            }
            RequestAccumulator.Phase phase = accumulator.append(buffer, 0, n);
            if (!headSeen && accumulator.head() != null && phase != RequestAccumulator.Phase.REJECTED) {
                headSeen = true;
                if (phase == RequestAccumulator.Phase.READING_BODY) {
                    transition(ConnectionState.READING_HEADERS, ConnectionState.READING_BODY);
                }
                onHeadParsed(accumulator.head());
            }
            switch (phase) {
                case COMPLETE:
                    return accumulator.toRequest();
                case REJECTED:
                    RequestAccumulator.Rejection rejection = accumulator.rejection();
                    LOG.warn("Rejecting request: {}", rejection.message());
                    respond(rejection.toResponse());
                    return null;
                default:
                    break;
            }
        }
    }

    /**
     * Called once when the request head has been parsed, before the body is read.
     */
    protected void onHeadParsed(RequestAccumulator.RequestHead head) throws IOException {
        // standard connections do not answer Expect: 100-continue; clients send the body after their own delay
    }

    /**
     * Runs the routed handler. Subclasses may wrap it, e.g. with interim responses.
     */
    protected HttpResponse dispatch(HttpRequest request) {
        return router.dispatch(request, new RequestContext(connectionId, settings.processingTimeout()));
    }

    /**
     * Writes raw bytes under the output lock. Interim and final responses never interleave.
     */
    protected final void write(byte[] bytes) throws IOException {
        synchronized (outputLock) {
            OutputStream out = socket.getOutputStream();
            out.write(bytes);
            out.flush();
        }
    }

    /**
     * Writes interim bytes only while the request is still being processed. The state is checked under
     * the output lock, so nothing is written after the final response.
     *
     * @return true when the bytes were written
     */
    protected final boolean writeWhileDispatched(byte[] bytes) throws IOException {
        synchronized (outputLock) {
            if (state.get() != ConnectionState.DISPATCHED) {
                return false;
            }
            OutputStream out = socket.getOutputStream();
            out.write(bytes);
            out.flush();
            return true;
        }
    }

    /**
     * Writes the single final response.
     */
    private void respond(HttpResponse response) {
        ConnectionState current = state.get();
        if (current == ConnectionState.RESPONDING || current == ConnectionState.CLOSED) {
            return;
        }
        state.set(ConnectionState.RESPONDING);
        try {
            write(response.toBytes());
        } catch (IOException e) {
            LOG.warn("Failed to write {} response: {}", response.status(), e.getMessage());
        }
    }

    public ConnectionState state() {
        return state.get();
    }

    private ConnectionState readingState() {
        ConnectionState current = state.get();
        return current == ConnectionState.READING_BODY ? ConnectionState.READING_BODY : ConnectionState.READING_HEADERS;
    }

    private boolean transition(ConnectionState from, ConnectionState to) {
        return state.compareAndSet(from, to);
    }

    private void closeQuietly() {
        try {
            socket.close();
        } catch (IOException e) {
            LOG.debug("Error closing socket: {}", e.getMessage());
        }
    }
}
