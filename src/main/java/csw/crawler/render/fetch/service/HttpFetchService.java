package csw.crawler.render.fetch.service;

import csw.crawler.render.fetch.model.FetchRequest;
import csw.crawler.render.fetch.model.RenderedResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Plain HTTP download for requests that are not, or could not be, rendered in a browser.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HttpFetchService {

    private final RestTemplate restTemplate;

    public RenderedResponse fetch(FetchRequest request) {
        HttpHeaders headers = new HttpHeaders();
        request.getHeaders().forEach(headers::add);

        ResponseEntity<byte[]> response = restTemplate.exchange(
                request.getUrl(), HttpMethod.GET, new HttpEntity<>(headers), byte[].class);

        byte[] body = response.getBody() == null ? new byte[0] : response.getBody();
        log.debug("Fetched {} over HTTP: {} ({} bytes)", request.getUrl(), response.getStatusCode(), body.length);
        return new RenderedResponse(request.getUrl(), body, charsetOf(response.getHeaders()), request);
    }

    private static Charset charsetOf(HttpHeaders headers) {
        MediaType contentType = headers.getContentType();
        if (contentType != null && contentType.getCharset() != null) {
            return contentType.getCharset();
        }
        return StandardCharsets.UTF_8;
    }
}
