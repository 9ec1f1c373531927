package csw.crawler.render.playwright;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.WaitForSelectorState;
import csw.crawler.render.common.exception.BrowserSessionException;
import csw.crawler.render.common.exception.ProvisioningException;
import csw.crawler.render.common.exception.WaitTimeoutException;
import csw.crawler.render.playwright.pool.PlaywrightWorker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * {@link BrowserSession} backed by one Playwright browser with a single context and page.
 * All Playwright objects live on the session's own {@link PlaywrightWorker}.
 */
@Slf4j
public class PlaywrightBrowserSession implements BrowserSession {
    static final Duration DRIVER_INSTALL_ALLOWANCE = Duration.ofMinutes(1);
    static final Duration BROWSER_DOWNLOAD_ALLOWANCE = Duration.ofMinutes(10);

    private final String id;
    private final PlaywrightWorker worker;
    private final Duration commandTimeout;
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    // only touched on the worker thread
    private Playwright playwright;
    private Browser browser;
    private BrowserContext context;
    private Page page;

    PlaywrightBrowserSession(String id,
                             PoolConfig config,
                             PlaywrightFactory playwrightFactory,
                             Function<Playwright, Browser> browserProvider) {
        this(id, config, startupTimeout(config), playwrightFactory, browserProvider);
    }

    PlaywrightBrowserSession(String id,
                             PoolConfig config,
                             Duration startupTimeout,
                             PlaywrightFactory playwrightFactory,
                             Function<Playwright, Browser> browserProvider) {
        this.id = id;
        this.commandTimeout = config.getCommandTimeout();
        this.worker = new PlaywrightWorker("browser-session-" + id, commandTimeout);
        try {
            // not interrupted on timeout: whatever still starts up is closed by terminate() afterwards
            worker.submit(() -> {
                playwright = playwrightFactory.create(config);
                browser = browserProvider.apply(playwright);
                context = browser.newContext(contextOptions(config));
                page = context.newPage();
                return null;
            }, startupTimeout, false);
        } catch (Exception e) {
            terminate();
            if (e instanceof ProvisioningException provisioningException) {
                throw provisioningException;
            }
            throw new ProvisioningException("Failed to start browser session " + id + ": " + e.getMessage(), e);
        }
        log.info("Browser session {} ready ({})", id, config.getBrowserKind());
    }

    /**
     * Bound for bringing a session up: the launch timeout plus time for Playwright to unpack its driver and,
     * when it manages the browser itself, to download it.
     */
    static Duration startupTimeout(PoolConfig config) {
        Duration timeout = config.getLaunchTimeout().plus(DRIVER_INSTALL_ALLOWANCE);
        if (config.getProvisioningMode() instanceof ProvisioningMode.AutoManaged) {
            timeout = timeout.plus(BROWSER_DOWNLOAD_ALLOWANCE);
        }
        return timeout;
    }

    private static Browser.NewContextOptions contextOptions(PoolConfig config) {
        Browser.NewContextOptions options = new Browser.NewContextOptions()
                .setViewportSize(1280, 720)
                .setJavaScriptEnabled(true);
        if (config.getUserAgent() != null) {
            options.setUserAgent(config.getUserAgent());
        }
        return options;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void navigate(String url) {
        call("navigate to " + url, () -> page.navigate(url));
    }

    @Override
    public void addCookie(String name, String value) {
        call("add cookie " + name, () -> {
            context.addCookies(List.of(new Cookie(name, value).setUrl(page.url())));
            return null;
        });
    }

    /**
     * The worker waits {@code timeout} plus the command timeout, so Playwright's own deadline fires first.
     * A zero timeout checks the condition once instead of waiting, since Playwright reads 0 as "no limit".
     */
    @Override
    public void waitUntil(WaitCondition condition, Duration timeout) {
        double timeoutMs = Math.max(1, timeout.toMillis());
        try {
            call("wait for " + condition, timeout.plus(commandTimeout), () -> {
                if (condition instanceof WaitCondition.SelectorPresent present) {
                    page.waitForSelector(present.selector(), new Page.WaitForSelectorOptions()
                            .setState(WaitForSelectorState.ATTACHED)
                            .setTimeout(timeoutMs));
                } else if (condition instanceof WaitCondition.SelectorVisible visible) {
                    page.waitForSelector(visible.selector(), new Page.WaitForSelectorOptions()
                            .setState(WaitForSelectorState.VISIBLE)
                            .setTimeout(timeoutMs));
                } else if (condition instanceof WaitCondition.UrlMatches urlMatches) {
                    page.waitForURL(Pattern.compile(urlMatches.regex()),
                            new Page.WaitForURLOptions().setTimeout(timeoutMs));
                } else if (condition instanceof WaitCondition.ScriptTrue scriptTrue) {
                    page.waitForFunction(scriptTrue.expression(), null,
                            new Page.WaitForFunctionOptions().setTimeout(timeoutMs));
                } else if (condition instanceof WaitCondition.LoadStateReached loadState) {
                    page.waitForLoadState(loadState.state(),
                            new Page.WaitForLoadStateOptions().setTimeout(timeoutMs));
                }
                return null;
            });
        } catch (BrowserSessionException e) {
            if (e.getCause() instanceof TimeoutError || e.getCause() instanceof TimeoutException) {
                throw new WaitTimeoutException("Condition " + condition + " not met within " + timeout.toMillis() + "ms", e.getCause());
            }
            throw e;
        }
    }

    @Override
    public Object executeScript(String script) {
        return call("execute script", () -> page.evaluate(script));
    }

    @Override
    public String pageSource() {
        return call("read page source", () -> page.content());
    }

    @Override
    public String currentUrl() {
        return call("read current url", () -> page.url());
    }

    @Override
    public byte[] captureScreenshot() {
        return call("capture screenshot", () -> page.screenshot());
    }

    @Override
    public boolean isHealthy() {
        if (terminated.get() || !worker.isRunning()) {
            return false;
        }
        try {
            return worker.submit(() -> browser.isConnected() && !page.isClosed());
        } catch (Exception e) {
            log.warn("Health check of browser session {} failed", id, e);
            return false;
        }
    }

    @Override
    public void terminate() {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        worker.shutdownWorker(this::closeResources);
        log.info("Browser session {} terminated", id);
    }

    private void closeResources() {
        try {
            if (context != null) context.close();
            if (browser != null) browser.close();
        } catch (Exception e) {
            log.error("Error closing browser of session {}", id, e);
        }
        try {
            if (playwright != null) playwright.close();
        } catch (Exception e) {
            log.error("Error closing Playwright of session {}", id, e);
        }
    }

    private <T> T call(String action, Callable<T> task) {
        return call(action, commandTimeout, task);
    }

    private <T> T call(String action, Duration timeout, Callable<T> task) {
        if (terminated.get()) {
            throw new BrowserSessionException("Browser session " + id + " is terminated");
        }
        try {
            return worker.submit(task, timeout, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrowserSessionException("Interrupted while trying to " + action + " in session " + id, e);
        } catch (Exception e) {
            throw new BrowserSessionException("Failed to " + action + " in session " + id, e);
        }
    }

    @Override
    public String toString() {
        return "PlaywrightBrowserSession[" + id + "]";
    }
}
