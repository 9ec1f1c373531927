package csw.crawler.render.common.exception;

/**
 * A browser session could not be created: unknown kind, missing binaries or a process that failed to start.
 */
public class ProvisioningException extends BrowserPoolException {

    public ProvisioningException(String message) {
        super(message);
    }

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
