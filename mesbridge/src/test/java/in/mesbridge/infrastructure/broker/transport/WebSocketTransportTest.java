package in.mesbridge.infrastructure.broker.transport;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebSocketTransportTest {

    private static final URI ENDPOINT = URI.create("wss://demo.ironbeam.test/socket");

    @Mock
    private HttpClient httpClient;
    @Mock
    private WebSocket.Builder builder;
    @Mock
    private WebSocket webSocket;
    @Mock
    private TransportListener listener;

    private WebSocketTransport transport;

    @BeforeEach
    void setUp() {
        lenient().when(httpClient.newWebSocketBuilder()).thenReturn(builder);
        lenient().when(builder.connectTimeout(any())).thenReturn(builder);
        lenient().when(builder.buildAsync(eq(ENDPOINT), any()))
            .thenReturn(CompletableFuture.completedFuture(webSocket));
        transport = new WebSocketTransport(httpClient, Duration.ofSeconds(1), Duration.ofMillis(200));
    }

    @Test
    void send_failsBeforeOpen() {
        ExecutionException e = assertThrows(ExecutionException.class,
            () -> transport.send("{}").get(1, TimeUnit.SECONDS));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertFalse(transport.isOpen());
    }

    @Test
    void open_thenSendWritesWholeTextFrame() throws Exception {
        when(webSocket.sendText(anyString(), eq(true))).thenReturn(CompletableFuture.completedFuture(webSocket));

        transport.open(ENDPOINT, listener).get(1, TimeUnit.SECONDS);
        assertTrue(transport.isOpen());

        transport.send("{\"action\":\"get_positions\"}").get(1, TimeUnit.SECONDS);

        verify(webSocket).sendText("{\"action\":\"get_positions\"}", true);
    }

    @Test
    void open_onlyOnce() throws Exception {
        transport.open(ENDPOINT, listener).get(1, TimeUnit.SECONDS);

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> transport.open(ENDPOINT, listener).get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void close_isIdempotentAndSuppressesCallbacks() throws Exception {
        when(webSocket.sendClose(anyInt(), anyString())).thenReturn(CompletableFuture.completedFuture(webSocket));
        ArgumentCaptor<WebSocket.Listener> captor = ArgumentCaptor.forClass(WebSocket.Listener.class);

        transport.open(ENDPOINT, listener).get(1, TimeUnit.SECONDS);
        verify(builder).buildAsync(eq(ENDPOINT), captor.capture());

        transport.close();
        transport.close();

        verify(webSocket, times(1)).sendClose(WebSocket.NORMAL_CLOSURE, "Disconnect");
        verify(webSocket, timeout(1000)).abort();
        assertFalse(transport.isOpen());

        captor.getValue().onClose(webSocket, 1000, "Disconnect");
        verify(listener, never()).onClosed(anyInt(), anyString());
    }

    @Test
    void remoteClose_reportedToListener() throws Exception {
        ArgumentCaptor<WebSocket.Listener> captor = ArgumentCaptor.forClass(WebSocket.Listener.class);

        transport.open(ENDPOINT, listener).get(1, TimeUnit.SECONDS);
        verify(builder).buildAsync(eq(ENDPOINT), captor.capture());

        captor.getValue().onClose(webSocket, 1006, "abnormal");

        verify(listener).onClosed(1006, "abnormal");
        assertFalse(transport.isOpen(), "Remote close marks the transport closed");

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> transport.send("{}").get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void handshakeFailure_failsOpen() {
        doReturn(CompletableFuture.failedFuture(new ConnectException("Connection refused")))
            .when(builder).buildAsync(eq(ENDPOINT), any());

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> transport.open(ENDPOINT, listener).get(1, TimeUnit.SECONDS));
        assertInstanceOf(ConnectException.class, e.getCause());
    }
}
