package csw.crawler.render.fetch.doc;

import csw.crawler.render.fetch.dto.FetchRequestDto;
import csw.crawler.render.fetch.dto.FetchResponseDto;
import csw.crawler.render.playwright.pool.PoolStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;

import java.util.List;

// Interface-based documentation for the fetch controller
@Tag(name = "Fetch", description = "Page fetching with optional browser rendering")
public interface FetchControllerDoc {

    @Operation(summary = "Fetch one page",
            description = "Renders the page in a pooled browser session when render=true and a session is free within "
                    + "the checkout timeout, otherwise downloads it over plain HTTP.")
    ResponseEntity<FetchResponseDto> fetch(FetchRequestDto request);

    @Operation(summary = "Fetch several pages concurrently",
            description = "Returns one entry per request in request order; failed entries carry an error message.")
    ResponseEntity<List<FetchResponseDto>> fetchAll(List<FetchRequestDto> requests);

    @Operation(summary = "Browser session pool statistics")
    ResponseEntity<PoolStats> poolStats();
}
