package com.phillippitts.voicelink.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the embedded HTTP API server.
 *
 * <p>Example application.properties:
 * <pre>
 * api.server.enabled=true
 * api.server.port=5000
 * api.server.bind-scope=LOOPBACK
 * api.server.mode=STANDARD
 * api.server.max-body-bytes=524288000
 * api.server.inactivity-timeout=30s
 * api.server.processing-timeout=20m
 * api.server.large-upload.heartbeat-interval=30s
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "api.server")
public class ApiServerProperties {

    /**
     * Which interfaces the listener binds.
     */
    public enum BindScope {
        /** 127.0.0.1 only. */
        LOOPBACK,
        /** 0.0.0.0, reachable from the network. */
        ALL_INTERFACES
    }

    /**
     * Which connection handler serves accepted sockets.
     */
    public enum Mode {
        STANDARD,
        LARGE_UPLOAD
    }

    private boolean enabled = true;
    private int port = 5000;
    private BindScope bindScope = BindScope.LOOPBACK;
    private Mode mode = Mode.STANDARD;
    private long maxBodyBytes = 500L * 1024 * 1024;
    private int maxHeaderBytes = 64 * 1024;
    private int readChunkBytes = 64 * 1024;
    private Duration inactivityTimeout = Duration.ofSeconds(30);
    private Duration processingTimeout = Duration.ofMinutes(20);
    private int backlog = 50;
    private String serviceName = "VoiceLink API";
    private String version = "1.0.0";
    private LargeUploadProperties largeUpload = new LargeUploadProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public BindScope getBindScope() {
        return bindScope;
    }

    public void setBindScope(BindScope bindScope) {
        this.bindScope = bindScope;
    }

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public long getMaxBodyBytes() {
        return maxBodyBytes;
    }

    public void setMaxBodyBytes(long maxBodyBytes) {
        this.maxBodyBytes = maxBodyBytes;
    }

    public int getMaxHeaderBytes() {
        return maxHeaderBytes;
    }

    public void setMaxHeaderBytes(int maxHeaderBytes) {
        this.maxHeaderBytes = maxHeaderBytes;
    }

    public int getReadChunkBytes() {
        return readChunkBytes;
    }

    public void setReadChunkBytes(int readChunkBytes) {
        this.readChunkBytes = readChunkBytes;
    }

    public Duration getInactivityTimeout() {
        return inactivityTimeout;
    }

    public void setInactivityTimeout(Duration inactivityTimeout) {
        this.inactivityTimeout = inactivityTimeout;
    }

    public Duration getProcessingTimeout() {
        return processingTimeout;
    }

    public void setProcessingTimeout(Duration processingTimeout) {
        this.processingTimeout = processingTimeout;
    }

    public int getBacklog() {
        return backlog;
    }

    public void setBacklog(int backlog) {
        this.backlog = backlog;
    }

    public String getServiceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public LargeUploadProperties getLargeUpload() {
        return largeUpload;
    }

    public void setLargeUpload(LargeUploadProperties largeUpload) {
        this.largeUpload = largeUpload;
    }

    /**
     * Overrides used when {@link Mode#LARGE_UPLOAD} is active.
     */
    public static class LargeUploadProperties {
        private int readChunkBytes = 8 * 1024 * 1024;
        private Duration inactivityTimeout = Duration.ofMinutes(60);
        private Duration processingTimeout = Duration.ofMinutes(60);
        private Duration heartbeatInterval = Duration.ofSeconds(30);

        public int getReadChunkBytes() {
            return readChunkBytes;
        }

        public void setReadChunkBytes(int readChunkBytes) {
            this.readChunkBytes = readChunkBytes;
        }

        public Duration getInactivityTimeout() {
            return inactivityTimeout;
        }

        public void setInactivityTimeout(Duration inactivityTimeout) {
            this.inactivityTimeout = inactivityTimeout;
        }

        public Duration getProcessingTimeout() {
            return processingTimeout;
        }

        public void setProcessingTimeout(Duration processingTimeout) {
            this.processingTimeout = processingTimeout;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }
    }
}
