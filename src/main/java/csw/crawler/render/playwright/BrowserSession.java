package csw.crawler.render.playwright;

import csw.crawler.render.common.exception.BrowserSessionException;

import java.time.Duration;

/**
 * One live browser-automation session. A session is used by one caller at a time; the pool enforces that.
 * Every operation except {@link #isHealthy()} and {@link #terminate()} throws {@link BrowserSessionException}
 * when the browser fails, after which the session must be replaced rather than reused.
 */
public interface BrowserSession {

    String id();

    void navigate(String url);

    /**
     * Adds a cookie scoped to the page currently loaded.
     */
    void addCookie(String name, String value);

    /**
     * Blocks until the condition holds.
     *
     * @throws csw.crawler.render.common.exception.WaitTimeoutException if it does not hold within {@code timeout}
     */
    void waitUntil(WaitCondition condition, Duration timeout);

    Object executeScript(String script);

    String pageSource();

    String currentUrl();

    byte[] captureScreenshot();

    boolean isHealthy();

    /**
     * Stops the browser. Idempotent; never throws.
     */
    void terminate();
}
