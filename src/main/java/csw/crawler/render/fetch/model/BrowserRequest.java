package csw.crawler.render.fetch.model;

import csw.crawler.render.playwright.WaitCondition;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.Map;

/**
 * A request that has to be rendered in a browser before its markup is usable.
 */
@Getter
public class BrowserRequest extends FetchRequest {
    public static final Duration DEFAULT_WAIT_TIMEOUT = Duration.ofSeconds(10);
    public static final String META_SCREENSHOT = "screenshot";
    public static final String META_SESSION = "browser_session";

    private final Map<String, String> cookies;
    private final WaitCondition waitCondition;
    private final Duration waitTimeout;
    private final String script;
    private final boolean screenshot;
    /**
     * Puts the session that rendered the page into meta for callers that need to post-process it.
     * The pool owns the session again once the response is returned, so the reference is only safe to
     * inspect, not to drive.
     */
    private final boolean exposeSession;

    @Builder
    private BrowserRequest(String url,
                           Map<String, String> headers,
                           Map<String, String> cookies,
                           WaitCondition waitCondition,
                           Duration waitTimeout,
                           String script,
                           boolean screenshot,
                           boolean exposeSession) {
        super(url, headers);
        this.cookies = cookies == null ? Map.of() : Map.copyOf(cookies);
        this.waitCondition = waitCondition;
        if (waitTimeout != null && waitTimeout.isNegative()) {
            throw new IllegalArgumentException("waitTimeout must not be negative, got " + waitTimeout);
        }
        this.waitTimeout = waitTimeout == null ? DEFAULT_WAIT_TIMEOUT : waitTimeout;
        this.script = script == null || script.isBlank() ? null : script;
        this.screenshot = screenshot;
        this.exposeSession = exposeSession;
    }
}
