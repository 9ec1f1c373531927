package csw.crawler.render.playwright;

import com.microsoft.playwright.Playwright;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class DefaultPlaywrightFactory implements PlaywrightFactory {
    static final String SKIP_BROWSER_DOWNLOAD = "PLAYWRIGHT_SKIP_BROWSER_DOWNLOAD";

    @Override
    public Playwright create(PoolConfig config) {
        return Playwright.create(createOptions(config));
    }

    // bundled browsers are only needed when Playwright launches them itself
    static Playwright.CreateOptions createOptions(PoolConfig config) {
        Playwright.CreateOptions options = new Playwright.CreateOptions();
        if (!(config.getProvisioningMode() instanceof ProvisioningMode.AutoManaged)) {
            options.setEnv(Map.of(SKIP_BROWSER_DOWNLOAD, "1"));
        }
        return options;
    }
}
