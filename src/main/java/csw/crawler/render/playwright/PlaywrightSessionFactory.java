package csw.crawler.render.playwright;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import csw.crawler.render.common.exception.ProvisioningException;
import csw.crawler.render.common.exception.UnsupportedBrowserException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates Playwright-backed sessions in one of the three {@link ProvisioningMode}s.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightSessionFactory implements BrowserSessionFactory {
    static final String LAUNCH_OPTIONS_HEADER = "x-playwright-launch-options";
    // Playwright turns this on by default and pages can detect it
    private static final List<String> IGNORED_DEFAULT_ARGS = List.of("--enable-automation");

    private final AtomicLong sequence = new AtomicLong();
    private final PlaywrightFactory playwrightFactory;
    private final ObjectMapper objectMapper;

    @Override
    public BrowserSession create(PoolConfig config) {
        ProvisioningMode mode = config.getProvisioningMode();
        checkProvisionable(config, mode);

        String id = String.valueOf(sequence.incrementAndGet());
        log.debug("Creating browser session {} ({}, {})", id, config.getBrowserKind(), mode);
        long startTime = System.currentTimeMillis();

        PlaywrightBrowserSession session = new PlaywrightBrowserSession(
                id, config, playwrightFactory, playwright -> openBrowser(playwright, config, mode));

        log.debug("Created browser session {} in {}ms", id, System.currentTimeMillis() - startTime);
        return session;
    }

    // fails before any process is spawned
    private void checkProvisionable(PoolConfig config, ProvisioningMode mode) {
        if (mode instanceof ProvisioningMode.LocalBinary local) {
            requireFile(local.executablePath(), "executable");
            if (local.browserBinaryPath() != null) {
                requireFile(local.browserBinaryPath(), "browser binary");
            }
        } else if (mode instanceof ProvisioningMode.Remote remote) {
            if (remote.isDevToolsEndpoint() && !config.getBrowserKind().isChromiumBased()) {
                throw new ProvisioningException("DevTools endpoint " + remote.endpoint()
                        + " requires a chromium-based browser, got " + config.getBrowserKind());
            }
        } else if (!config.getBrowserKind().isAutoManaged()) {
            throw new UnsupportedBrowserException("Browser kind " + config.getBrowserKind()
                    + " has no auto-managed binary; set an executable path or a remote endpoint");
        }
    }

    private static void requireFile(String path, String what) {
        if (!Files.isRegularFile(Path.of(path))) {
            throw new ProvisioningException("Configured " + what + " not found: " + path);
        }
    }

    Browser openBrowser(Playwright playwright, PoolConfig config, ProvisioningMode mode) {
        BrowserType browserType = config.getBrowserKind().browserType(playwright);

        if (mode instanceof ProvisioningMode.LocalBinary local) {
            return browserType.launch(launchOptions(config).setExecutablePath(Path.of(local.binary())));
        }
        if (mode instanceof ProvisioningMode.Remote remote) {
            return connect(browserType, config, remote);
        }
        return browserType.launch(launchOptions(config));
    }

    private Browser connect(BrowserType browserType, PoolConfig config, ProvisioningMode.Remote remote) {
        double timeoutMs = config.getLaunchTimeout().toMillis();
        if (remote.isDevToolsEndpoint()) {
            if (!config.getStartupArguments().isEmpty()) {
                log.warn("Startup arguments are ignored when attaching to DevTools endpoint {}", remote.endpoint());
            }
            return browserType.connectOverCDP(remote.endpoint(),
                    new BrowserType.ConnectOverCDPOptions().setTimeout(timeoutMs));
        }
        return browserType.connect(remote.endpoint(), new BrowserType.ConnectOptions()
                .setHeaders(Map.of(LAUNCH_OPTIONS_HEADER, launchOptionsJson(config)))
                .setTimeout(timeoutMs));
    }

    private BrowserType.LaunchOptions launchOptions(PoolConfig config) {
        return new BrowserType.LaunchOptions()
                .setHeadless(config.isHeadless())
                .setArgs(config.getStartupArguments())
                .setTimeout(config.getLaunchTimeout().toMillis())
                .setIgnoreDefaultArgs(IGNORED_DEFAULT_ARGS);
    }

    // the launch options a Playwright server applies to the browser it starts for this connection
    String launchOptionsJson(PoolConfig config) {
        Map<String, Object> launchOptions = new LinkedHashMap<>();
        launchOptions.put("headless", config.isHeadless());
        launchOptions.put("args", config.getStartupArguments());
        if (config.getBrowserKind().getChannel() != null) {
            launchOptions.put("channel", config.getBrowserKind().getChannel());
        }
        try {
            return objectMapper.writeValueAsString(launchOptions);
        } catch (JsonProcessingException e) {
            throw new ProvisioningException("Failed to encode launch options for " + config.getRemoteEndpoint(), e);
        }
    }
}
