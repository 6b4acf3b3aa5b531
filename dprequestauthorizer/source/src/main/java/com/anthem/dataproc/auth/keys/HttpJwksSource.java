package com.anthem.dataproc.auth.keys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

/**
 * Fetches the key set from the identity provider's well-known JWKS endpoint
 * (for Cognito: {@code <issuer>/.well-known/jwks.json}).
 */
public class HttpJwksSource implements JwksSource {

    private static final Logger log = LoggerFactory.getLogger(HttpJwksSource.class);

    private final RestTemplate restTemplate;
    private final String jwksUrl;

    public HttpJwksSource(String jwksUrl, Duration timeout) {
        this(restTemplate(timeout), jwksUrl);
    }

    // For testing
    public HttpJwksSource(RestTemplate restTemplate, String jwksUrl) {
        this.restTemplate = restTemplate;
        this.jwksUrl = jwksUrl;
    }

    static RestTemplate restTemplate(Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());
        return new RestTemplate(requestFactory);
    }

    @Override
    public String fetch() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(jwksUrl, HttpMethod.GET, new HttpEntity<>(headers), String.class);
        } catch (RestClientException e) {
            throw new JwksUnavailableException("Failed to fetch JWKS from " + jwksUrl + ": " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new JwksUnavailableException("JWKS endpoint returned HTTP " + response.getStatusCode().value()
                    + " without a key set: " + jwksUrl);
        }
        log.debug("Fetched JWKS: url={}, bytes={}", jwksUrl, response.getBody().length());
        return response.getBody();
    }

    @Override
    public String describe() {
        return jwksUrl;
    }
}
