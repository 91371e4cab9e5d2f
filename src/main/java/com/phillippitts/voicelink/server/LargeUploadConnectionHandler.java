package com.phillippitts.voicelink.server;

import com.phillippitts.voicelink.server.http.HttpRequest;
import com.phillippitts.voicelink.server.http.HttpResponse;
import com.phillippitts.voicelink.server.http.RequestAccumulator;
import com.phillippitts.voicelink.service.metrics.RequestStatistics;
import com.phillippitts.voicelink.service.metrics.TranscriptionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;

import java.io.IOException;
import java.net.Socket;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Connection handler for very large uploads (long recordings).
 *
 * <p>Differences from {@link ConnectionHandler}:
 * <ul>
 *   <li>answers {@code Expect: 100-continue} with an interim {@code 100 Continue}</li>
 *   <li>while the request is being processed, writes {@code 102 Processing} every heartbeat interval
 *       so clients and proxies keep the connection open</li>
 * </ul>
 * Chunk size and timeouts come from {@code api.server.large-upload.*}.
 */
public class LargeUploadConnectionHandler extends ConnectionHandler {

    private static final Logger LOG = LogManager.getLogger(LargeUploadConnectionHandler.class);

    private final ScheduledExecutorService heartbeats;

    public LargeUploadConnectionHandler(Socket socket, ConnectionSettings settings, RequestRouter router,
                                        RequestStatistics statistics, TranscriptionMetrics metrics,
                                        ScheduledExecutorService heartbeats) {
        super(socket, settings, router, statistics, metrics);
        this.heartbeats = Objects.requireNonNull(heartbeats, "heartbeats");
    }

    @Override
    protected void onHeadParsed(RequestAccumulator.RequestHead head) throws IOException {
        if (head.expectsContinue() && head.contentLength() > 0) {
            LOG.debug("Sending 100 Continue for {} byte upload", head.contentLength());
            write(HttpResponse.interim(HttpStatus.CONTINUE));
        }
    }

    @Override
    protected HttpResponse dispatch(HttpRequest request) {
        if (settings.heartbeatInterval() == null || settings.heartbeatInterval().isZero()) {
            return super.dispatch(request);
        }
        long periodMs = settings.heartbeatInterval().toMillis();
        ScheduledFuture<?> heartbeat = heartbeats.scheduleAtFixedRate(this::sendHeartbeat,
                periodMs, periodMs, TimeUnit.MILLISECONDS);
        try {
            return super.dispatch(request);
        } finally {
            heartbeat.cancel(false);
        }
    }

    private void sendHeartbeat() {
        try {
            if (writeWhileDispatched(HttpResponse.interim(HttpStatus.PROCESSING))) {
                LOG.debug("Sent 102 Processing heartbeat on connection {}", connectionId);
            }
        } catch (IOException e) {
            LOG.debug("Heartbeat write failed: {}", e.getMessage());
        }
    }
}
