package csw.crawler.render.playwright;

/**
 * How a session gets its browser. Resolved once from {@link PoolConfig}.
 */
public sealed interface ProvisioningMode
        permits ProvisioningMode.LocalBinary, ProvisioningMode.Remote, ProvisioningMode.AutoManaged {

    /**
     * Launch a browser installed on this machine.
     *
     * @param executablePath    configured local executable
     * @param browserBinaryPath optional override of the binary that is actually started
     */
    record LocalBinary(String executablePath, String browserBinaryPath) implements ProvisioningMode {

        public String binary() {
            return browserBinaryPath != null ? browserBinaryPath : executablePath;
        }
    }

    record Remote(String endpoint) implements ProvisioningMode {

        public boolean isDevToolsEndpoint() {
            return endpoint.startsWith("http://") || endpoint.startsWith("https://");
        }
    }

    record AutoManaged() implements ProvisioningMode {
    }
}
