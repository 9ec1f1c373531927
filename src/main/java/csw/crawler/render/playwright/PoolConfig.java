package csw.crawler.render.playwright;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.List;

@Getter
@ToString
public final class PoolConfig {
    public static final int DEFAULT_POOL_SIZE = 5;
    public static final Duration DEFAULT_CHECKOUT_TIMEOUT = Duration.ofSeconds(300);
    public static final Duration DEFAULT_LAUNCH_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(60);

    private final BrowserKind browserKind;
    private final String executablePath;
    private final String browserBinaryPath;
    private final String remoteEndpoint;
    private final List<String> startupArguments;
    private final int poolSize;
    private final Duration checkoutTimeout;
    private final boolean headless;
    private final String userAgent;
    private final Duration launchTimeout;
    private final Duration commandTimeout;
    // zero disables the idle health sweep
    private final Duration validationInterval;
    private final ProvisioningMode provisioningMode;

    @Builder
    private PoolConfig(BrowserKind browserKind,
                       String executablePath,
                       String browserBinaryPath,
                       String remoteEndpoint,
                       List<String> startupArguments,
                       Integer poolSize,
                       Duration checkoutTimeout,
                       Boolean headless,
                       String userAgent,
                       Duration launchTimeout,
                       Duration commandTimeout,
                       Duration validationInterval) {
        if (browserKind == null) {
            throw new IllegalArgumentException("Browser kind must be set");
        }
        this.browserKind = browserKind;
        this.executablePath = blankToNull(executablePath);
        this.browserBinaryPath = blankToNull(browserBinaryPath);
        this.remoteEndpoint = blankToNull(remoteEndpoint);
        this.startupArguments = startupArguments == null ? List.of() : List.copyOf(startupArguments);
        this.poolSize = poolSize == null ? DEFAULT_POOL_SIZE : poolSize;
        if (this.poolSize < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1, got " + this.poolSize);
        }
        this.checkoutTimeout = nonNegative("checkoutTimeout", checkoutTimeout, DEFAULT_CHECKOUT_TIMEOUT);
        this.headless = headless == null || headless;
        this.userAgent = blankToNull(userAgent);
        this.launchTimeout = nonNegative("launchTimeout", launchTimeout, DEFAULT_LAUNCH_TIMEOUT);
        this.commandTimeout = nonNegative("commandTimeout", commandTimeout, DEFAULT_COMMAND_TIMEOUT);
        this.validationInterval = nonNegative("validationInterval", validationInterval, Duration.ZERO);
        this.provisioningMode = resolveMode();
    }

    public boolean isHealthSweepEnabled() {
        return !validationInterval.isZero();
    }

    // executable path wins over remote endpoint, which wins over auto-managed
    private ProvisioningMode resolveMode() {
        if (executablePath != null) {
            return new ProvisioningMode.LocalBinary(executablePath, browserBinaryPath);
        }
        if (remoteEndpoint != null) {
            return new ProvisioningMode.Remote(remoteEndpoint);
        }
        return new ProvisioningMode.AutoManaged();
    }

    private static Duration nonNegative(String name, Duration value, Duration defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, got " + value);
        }
        return value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
