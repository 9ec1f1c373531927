package csw.crawler.render.playwright.pool;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.stereotype.Component;

// GET http://localhost:8080/actuator/browser-pool
@Component
@Endpoint(id = "browser-pool")
@RequiredArgsConstructor
public class BrowserPoolEndpoint {
    private final BrowserSessionPool sessionPool;

    @ReadOperation
    public PoolStats browserPoolStats() {
        return sessionPool.stats();
    }
}
