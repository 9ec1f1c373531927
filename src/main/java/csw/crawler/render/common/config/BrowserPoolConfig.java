package csw.crawler.render.common.config;

import csw.crawler.render.playwright.BrowserKind;
import csw.crawler.render.playwright.PoolConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

@Slf4j
@Configuration
public class BrowserPoolConfig {

    @Bean
    public PoolConfig poolConfig(
            @Value("${render.browser.kind:}") String browserKind,
            @Value("${render.browser.executable-path:}") String executablePath,
            @Value("${render.browser.binary-path:}") String browserBinaryPath,
            @Value("${render.browser.remote-endpoint:}") String remoteEndpoint,
            @Value("${render.browser.arguments:}") List<String> startupArguments,
            @Value("${render.browser.headless:true}") boolean headless,
            @Value("${render.browser.user-agent:}") String userAgent,
            @Value("${render.browser.launch-timeout:30s}") Duration launchTimeout,
            @Value("${render.browser.command-timeout:60s}") Duration commandTimeout,
            @Value("${render.pool.size:5}") int poolSize,
            @Value("${render.pool.checkout-timeout:300s}") Duration checkoutTimeout,
            @Value("${render.pool.validation-interval:0s}") Duration validationInterval) {
        if (browserKind.isBlank()) {
            throw new IllegalStateException("render.browser.kind must be set");
        }

        PoolConfig config = PoolConfig.builder()
                .browserKind(BrowserKind.of(browserKind))
                .executablePath(executablePath)
                .browserBinaryPath(browserBinaryPath)
                .remoteEndpoint(remoteEndpoint)
                .startupArguments(startupArguments.stream().filter(arg -> !arg.isBlank()).toList())
                .headless(headless)
                .userAgent(userAgent)
                .launchTimeout(launchTimeout)
                .commandTimeout(commandTimeout)
                .poolSize(poolSize)
                .checkoutTimeout(checkoutTimeout)
                .validationInterval(validationInterval)
                .build();
        log.info("Browser pool configuration: {}", config);
        return config;
    }

    @Bean
    public RestTemplate restTemplate(
            RestTemplateBuilder builder,
            @Value("${render.http.connect-timeout:10s}") Duration connectTimeout,
            @Value("${render.http.read-timeout:30s}") Duration readTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }
}
