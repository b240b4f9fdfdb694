package io.poolermanager.lifecycle;

import org.junit.jupiter.api.Test;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.boot.web.server.WebServer;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class WebServerMetricsEndpointTest {

    @Test
    void testStopsWebServer() {
        WebServerApplicationContext context = mock(WebServerApplicationContext.class);
        WebServer webServer = mock(WebServer.class);
        when(context.getWebServer()).thenReturn(webServer);

        new WebServerMetricsEndpoint(context).shutdown();

        verify(webServer).stop();
    }

    @Test
    void testNoWebServer() {
        WebServerApplicationContext context = mock(WebServerApplicationContext.class);

        assertThatCode(() -> new WebServerMetricsEndpoint(context).shutdown()).doesNotThrowAnyException();
    }
}
