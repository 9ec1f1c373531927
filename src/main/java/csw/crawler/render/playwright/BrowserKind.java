package csw.crawler.render.playwright;

import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import csw.crawler.render.common.exception.UnsupportedBrowserException;
import lombok.Getter;

import java.util.Locale;

/**
 * Browser families a session can be created for.
 * Branded channels (chrome, msedge) run on the chromium engine but are not shipped with Playwright,
 * so they can only be launched from a local binary or a remote endpoint.
 */
@Getter
public enum BrowserKind {
    CHROMIUM(null, true),
    CHROME("chrome", false),
    MSEDGE("msedge", false),
    FIREFOX(null, true),
    WEBKIT(null, true);

    private final String channel;
    private final boolean autoManaged;

    BrowserKind(String channel, boolean autoManaged) {
        this.channel = channel;
        this.autoManaged = autoManaged;
    }

    public boolean isChromiumBased() {
        return this == CHROMIUM || this == CHROME || this == MSEDGE;
    }

    public BrowserType browserType(Playwright playwright) {
        return switch (this) {
            case FIREFOX -> playwright.firefox();
            case WEBKIT -> playwright.webkit();
            default -> playwright.chromium();
        };
    }

    public static BrowserKind of(String name) {
        if (name == null || name.isBlank()) {
            throw new UnsupportedBrowserException("Browser kind must not be blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("EDGE".equals(normalized)) {
            return MSEDGE;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new UnsupportedBrowserException("Unknown browser kind: " + name);
        }
    }
}
