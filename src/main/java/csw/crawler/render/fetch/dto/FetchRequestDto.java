package csw.crawler.render.fetch.dto;

import csw.crawler.render.fetch.model.BrowserRequest;
import csw.crawler.render.fetch.model.FetchRequest;
import csw.crawler.render.playwright.WaitCondition;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

import java.time.Duration;
import java.util.Map;

@Builder
public record FetchRequestDto(
        @Schema(description = "Page to fetch", example = "https://example.com/products")
        @NotBlank(message = "URL is required")
        String url,

        @Schema(description = "Extra request headers, only used by plain HTTP fetches")
        Map<String, String> headers,

        @Schema(description = "Render the page in a browser session")
        boolean render,

        @Schema(description = "Cookies set on the page after navigation", example = "{\"session\": \"abc\"}")
        Map<String, String> cookies,

        @Schema(description = "Condition the page must meet before its markup is read",
                example = "{\"type\": \"selector-visible\", \"selector\": \"#content\"}")
        WaitCondition waitCondition,

        @Schema(description = "How long to wait for the condition, in milliseconds", example = "10000")
        @PositiveOrZero(message = "Wait timeout must not be negative")
        Long waitTimeoutMillis,

        @Schema(description = "JavaScript run in the page before its markup is read")
        String script,

        @Schema(description = "Capture a PNG screenshot of the rendered page")
        boolean screenshot
) {

    public FetchRequest toRequest() {
        if (!render) {
            return FetchRequest.of(url, headers);
        }
        return BrowserRequest.builder()
                .url(url)
                .headers(headers)
                .cookies(cookies)
                .waitCondition(waitCondition)
                .waitTimeout(waitTimeoutMillis == null ? null : Duration.ofMillis(waitTimeoutMillis))
                .script(script)
                .screenshot(screenshot)
                .build();
    }
}
