package io.poolermanager.lifecycle;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.boot.web.server.WebServer;

/**
 * Stops the embedded web server of the Spring context without closing the context itself.
 */
@Slf4j
public class WebServerMetricsEndpoint implements MetricsEndpoint {

    private final WebServerApplicationContext applicationContext;

    public WebServerMetricsEndpoint(WebServerApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @Override
    public void shutdown() {
        WebServer webServer = applicationContext.getWebServer();
        if (webServer == null) {
            log.debug("No web server running");
            return;
        }
        log.info("Stopping web server on port {}", webServer.getPort());
        webServer.stop();
    }
}
