package csw.crawler.render.common.exception;

/**
 * A broken session was terminated but its replacement could not be created, so the pool runs below its
 * configured size until a later replacement or health sweep succeeds.
 */
public class PoolDegradedException extends ProvisioningException {

    public PoolDegradedException(String message, Throwable cause) {
        super(message, cause);
    }
}
