package csw.crawler.render.fetch.controller;

import csw.crawler.render.fetch.doc.FetchControllerDoc;
import csw.crawler.render.fetch.dto.FetchRequestDto;
import csw.crawler.render.fetch.dto.FetchResponseDto;
import csw.crawler.render.fetch.model.FetchRequest;
import csw.crawler.render.fetch.service.CrawlFetchService;
import csw.crawler.render.playwright.pool.BrowserSessionPool;
import csw.crawler.render.playwright.pool.PoolStats;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/fetch")
public class FetchController implements FetchControllerDoc {
    // keeps one call from queueing far more work than the pool can render
    static final int MAX_BATCH_SIZE = 100;

    private final CrawlFetchService crawlFetchService;
    private final BrowserSessionPool sessionPool;

    /**
     * Example: POST /fetch {"url": "https://example.com", "render": true}
     */
    @Override
    @PostMapping
    public ResponseEntity<FetchResponseDto> fetch(@Valid @RequestBody FetchRequestDto request) {
        return ResponseEntity.ok(FetchResponseDto.from(crawlFetchService.fetch(request.toRequest())));
    }

    @Override
    @PostMapping("/batch")
    public ResponseEntity<List<FetchResponseDto>> fetchAll(@RequestBody List<@Valid FetchRequestDto> requests) {
        if (requests.isEmpty() || requests.size() > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("Batch must contain between 1 and " + MAX_BATCH_SIZE + " requests");
        }
        List<FetchRequest> fetchRequests = requests.stream()
                .map(FetchRequestDto::toRequest)
                .toList();

        List<FetchResponseDto> responses = crawlFetchService.fetchAll(fetchRequests).stream()
                .map(FetchResponseDto::from)
                .toList();
        return ResponseEntity.ok(responses);
    }

    @Override
    @GetMapping("/pool")
    public ResponseEntity<PoolStats> poolStats() {
        return ResponseEntity.ok(sessionPool.stats());
    }
}
