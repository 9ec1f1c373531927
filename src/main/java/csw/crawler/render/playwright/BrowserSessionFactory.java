package csw.crawler.render.playwright;

import csw.crawler.render.common.exception.ProvisioningException;

public interface BrowserSessionFactory {

    /**
     * Starts a browser for the given configuration and returns once it is ready.
     *
     * @throws ProvisioningException if the browser cannot be started
     */
    BrowserSession create(PoolConfig config);
}
