package com.bank.governance.client;

import com.bank.governance.config.ScannerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Calls {@code POST {url}/classify} with a JSON body {@code {"text": ...}}.
 */
@Service
public class HttpSemanticClassifierClient implements SemanticClassifierClient {

    private static final Logger log = LoggerFactory.getLogger(HttpSemanticClassifierClient.class);

    private final RestTemplate restTemplate;
    private final ScannerConfig config;

    public HttpSemanticClassifierClient(@Qualifier("semanticClassifierRestTemplate") RestTemplate restTemplate,
                                        ScannerConfig config) {
        this.restTemplate = restTemplate;
        this.config = config;
    }

    @Override
    public SemanticVerdict classify(String text) {
        String baseUrl = config.getSemanticClassifier().getUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new SemanticClassifierException("semantic classifier url is not configured");
        }
        String url = baseUrl.endsWith("/") ? baseUrl + "classify" : baseUrl + "/classify";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(new MediaType("application", "json", StandardCharsets.UTF_8));
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        HttpEntity<Map<String, String>> request = new HttpEntity<>(Map.of("text", text), headers);

        SemanticVerdict verdict;
        try {
            verdict = restTemplate.postForObject(url, request, SemanticVerdict.class);
        } catch (RestClientException e) {
            throw new SemanticClassifierException("semantic classifier call failed: " + e.getMessage(), e);
        }
        if (verdict == null) {
            throw new SemanticClassifierException("semantic classifier returned an empty body");
        }
        if (!(verdict.getScore() >= 0.0 && verdict.getScore() <= 1.0)) {
            throw new SemanticClassifierException("semantic classifier score out of range: " + verdict.getScore());
        }
        log.debug("Semantic classifier verdict: malicious={}, score={}, label={}",
                verdict.isMalicious(), verdict.getScore(), verdict.getLabel());
        return verdict;
    }
}
