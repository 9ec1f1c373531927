package csw.crawler.render.common.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class PoolExhaustedException extends BrowserPoolException {

    private final Duration timeout;

    public PoolExhaustedException(Duration timeout, Throwable cause) {
        super("No browser session available within " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }
}
