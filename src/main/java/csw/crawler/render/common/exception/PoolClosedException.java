package csw.crawler.render.common.exception;

public class PoolClosedException extends BrowserPoolException {

    public PoolClosedException() {
        super("Browser session pool has been shut down");
    }

    public PoolClosedException(Throwable cause) {
        super("Browser session pool has been shut down", cause);
    }
}
