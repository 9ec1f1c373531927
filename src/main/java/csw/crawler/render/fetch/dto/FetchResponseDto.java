package csw.crawler.render.fetch.dto;

import csw.crawler.render.fetch.model.FetchOutcome;
import csw.crawler.render.fetch.model.RenderedResponse;
import io.swagger.v3.oas.annotations.media.Schema;

public record FetchResponseDto(
        @Schema(description = "Requested URL")
        String url,

        @Schema(description = "URL after redirects")
        String finalUrl,

        @Schema(description = "How the page was fetched", example = "browser")
        String renderer,

        String encoding,

        String body,

        @Schema(description = "Base64-encoded PNG screenshot, when requested")
        byte[] screenshot,

        @Schema(description = "Why the fetch failed (batch requests only)")
        String error
) {

    public static FetchResponseDto from(RenderedResponse response) {
        return new FetchResponseDto(
                response.request().getUrl(),
                response.finalUrl(),
                response.renderer(),
                response.encoding().name(),
                response.text(),
                response.screenshot(),
                null
        );
    }

    public static FetchResponseDto from(FetchOutcome outcome) {
        if (outcome.isSuccess()) {
            return from(outcome.response());
        }
        return new FetchResponseDto(outcome.request().getUrl(), null, null, null, null, null, outcome.error());
    }
}
