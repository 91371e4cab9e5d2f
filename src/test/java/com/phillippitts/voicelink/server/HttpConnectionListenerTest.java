package com.phillippitts.voicelink.server;

import com.phillippitts.voicelink.config.ThreadPoolConfig;
import com.phillippitts.voicelink.config.properties.ApiServerProperties;
import com.phillippitts.voicelink.config.properties.ThreadPoolProperties;
import com.phillippitts.voicelink.exception.ServerBindException;
import com.phillippitts.voicelink.server.http.HttpResponse;
import com.phillippitts.voicelink.service.metrics.RequestStatistics;
import com.phillippitts.voicelink.service.metrics.TranscriptionMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HttpConnectionListenerTest {

    private final RequestRouter router = mock(RequestRouter.class);
    private final ListenerStatus status = new ListenerStatus();
    private ApiServerProperties properties;
    private ConnectionHandlerFactory factory;
    private ThreadPoolTaskExecutor executor;
    private HttpConnectionListener listener;

    @BeforeEach
    void setUp() {
        properties = new ApiServerProperties();
        properties.setPort(0);
        properties.setInactivityTimeout(Duration.ofSeconds(10));
        when(router.route(any())).thenReturn(RequestRouter.Route.HEALTH);
        when(router.dispatch(any(), any()))
                .thenReturn(HttpResponse.json(HttpStatus.OK, "{}".getBytes(StandardCharsets.UTF_8)));
        factory = new ConnectionHandlerFactory(properties, router, new RequestStatistics(),
                new TranscriptionMetrics(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() {
        if (listener != null) {
            listener.stop();
        }
        if (executor != null) {
            executor.shutdown();
        }
        factory.shutdown();
    }

    private HttpConnectionListener listener(int poolSize) {
        ThreadPoolProperties pools = new ThreadPoolProperties();
        ThreadPoolProperties.PoolProperties connection = new ThreadPoolProperties.PoolProperties();
        connection.setCorePoolSize(poolSize);
        connection.setMaxPoolSize(poolSize);
        connection.setQueueCapacity(0);
        connection.setThreadNamePrefix("test-conn-");
        pools.setConnection(connection);
        executor = new ThreadPoolConfig(pools).connectionExecutor();
        listener = new HttpConnectionListener(properties, factory, executor, status);
        return listener;
    }

    private static String get(int port, String path) throws IOException {
        try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), port)) {
            socket.setSoTimeout(5000);
            socket.getOutputStream().write(("GET " + path + " HTTP/1.1\r\nHost: localhost\r\n\r\n")
                    .getBytes(StandardCharsets.ISO_8859_1));
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            socket.getInputStream().transferTo(out);
            return out.toString(StandardCharsets.ISO_8859_1);
        }
    }

    @Test
    void startsOnEphemeralPortAndServes() throws Exception {
        HttpConnectionListener l = listener(2);

        l.start();

        assertThat(l.isRunning()).isTrue();
        assertThat(l.getPort()).isPositive();
        assertThat(status.current().running()).isTrue();
        assertThat(status.current().endpoint()).isEqualTo("http://localhost:" + l.getPort());
        assertThat(get(l.getPort(), "/health")).startsWith("HTTP/1.1 200 OK");
    }

    @Test
    void stopIsIdempotent() {
        HttpConnectionListener l = listener(2);
        l.start();
        int port = l.getPort();

        l.stop();
        l.stop();

        assertThat(l.isRunning()).isFalse();
        assertThat(l.getPort()).isEqualTo(-1);
        assertThat(status.current().running()).isFalse();
        assertThatThrownBy(() -> get(port, "/health")).isInstanceOf(IOException.class);
    }

    @Test
    void stopClosesConnectionsInFlight() throws Exception {
        HttpConnectionListener l = listener(2);
        l.start();

        try (Socket idle = new Socket(InetAddress.getLoopbackAddress(), l.getPort())) {
            idle.setSoTimeout(5000);
            idle.getOutputStream().write("GET /health HTTP/1.1\r\n".getBytes(StandardCharsets.ISO_8859_1));
            await().atMost(5, TimeUnit.SECONDS).until(() -> l.liveConnectionCount() == 1);

            l.stop();

            assertThat(idle.getInputStream().read()).isEqualTo(-1);
            assertThat(l.liveConnectionCount()).isZero();
        }
    }

    @Test
    void occupiedPortFailsToStart() throws Exception {
        try (ServerSocket occupied = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            properties.setPort(occupied.getLocalPort());
            HttpConnectionListener l = listener(2);

            assertThatThrownBy(l::start)
                    .isInstanceOf(ServerBindException.class)
                    .hasMessageContaining(String.valueOf(occupied.getLocalPort()));
            assertThat(l.isRunning()).isFalse();
        }
    }

    @Test
    void saturatedPoolAnswersServiceUnavailable() throws Exception {
        HttpConnectionListener l = listener(1);
        l.start();

        try (Socket holder = new Socket(InetAddress.getLoopbackAddress(), l.getPort())) {
            holder.getOutputStream().write("GET /health HTTP/1.1\r\n".getBytes(StandardCharsets.ISO_8859_1));
            await().atMost(5, TimeUnit.SECONDS).until(() -> executor.getActiveCount() == 1);

            String response = get(l.getPort(), "/health");

            assertThat(response).startsWith("HTTP/1.1 503").contains("SERVER_BUSY");
        }
    }

    @Test
    void autoStartupFollowsEnabledFlag() {
        properties.setEnabled(false);

        assertThat(listener(1).isAutoStartup()).isFalse();
    }
}
