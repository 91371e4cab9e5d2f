package com.phillippitts.voicelink.server;

import com.phillippitts.voicelink.config.properties.ApiServerProperties;
import com.phillippitts.voicelink.service.metrics.RequestStatistics;
import com.phillippitts.voicelink.service.metrics.TranscriptionMetrics;
import jakarta.annotation.PreDestroy;
import org.springframework.stereotype.Component;

import java.net.Socket;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Builds the connection handler for an accepted socket according to {@code api.server.mode}.
 */
@Component
public class ConnectionHandlerFactory {

    private final ApiServerProperties properties;
    private final RequestRouter router;
    private final RequestStatistics statistics;
    private final TranscriptionMetrics metrics;
    private final ScheduledExecutorService heartbeats;

    public ConnectionHandlerFactory(ApiServerProperties properties, RequestRouter router,
                                    RequestStatistics statistics, TranscriptionMetrics metrics) {
        this.properties = properties;
        this.router = router;
        this.statistics = statistics;
        this.metrics = metrics;
        this.heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "api-heartbeat");
            t.setDaemon(true);
            return t;
        });
    }

    public ConnectionHandler create(Socket socket) {
        if (properties.getMode() == ApiServerProperties.Mode.LARGE_UPLOAD) {
            return new LargeUploadConnectionHandler(socket, largeUploadSettings(), router, statistics, metrics,
                    heartbeats);
        }
        return new ConnectionHandler(socket, standardSettings(), router, statistics, metrics);
    }

    ConnectionSettings standardSettings() {
        return new ConnectionSettings(properties.getReadChunkBytes(), properties.getMaxBodyBytes(),
                properties.getMaxHeaderBytes(), properties.getInactivityTimeout(),
                properties.getProcessingTimeout(), null);
    }

    ConnectionSettings largeUploadSettings() {
        ApiServerProperties.LargeUploadProperties large = properties.getLargeUpload();
        return new ConnectionSettings(large.getReadChunkBytes(), properties.getMaxBodyBytes(),
                properties.getMaxHeaderBytes(), large.getInactivityTimeout(), large.getProcessingTimeout(),
                large.getHeartbeatInterval());
    }

    @PreDestroy
    void shutdown() {
        heartbeats.shutdownNow();
    }
}
