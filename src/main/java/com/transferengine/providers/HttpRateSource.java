package com.transferengine.providers;

import com.transferengine.common.Currency;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

/**
 * HTTP client for an exchange-rate API.
 *
 * Calls {@code GET {baseUrl}/rate?from=XXX&to=YYY} and expects
 * {@code {"from": "XXX", "to": "YYY", "rate": 1.23, "timestamp": "..."}}.
 * Some upstreams only publish one direction of a pair; when the payload comes
 * back for {@code to -> from} the reciprocal is derived here.
 */
@Slf4j
public class HttpRateSource implements RateSource {

    /** Fractional digits kept when deriving a reciprocal rate. */
    static final int DERIVED_RATE_SCALE = 10;

    /** Integer digits an accepted rate may carry. */
    static final int MAX_RATE_INTEGER_DIGITS = 14;

    private final String name;
    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpRateSource(String name, RestTemplate restTemplate, String baseUrl) {
        this.name = name;
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;

        log.info("Rate source {} initialized: baseUrl={}", name, baseUrl);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public RateQuote fetchRate(Currency from, Currency to) {
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path("/rate")
            .queryParam("from", from.name())
            .queryParam("to", to.name())
            .toUriString();

        log.debug("Fetching rate from {}: {} -> {}", name, from, to);

        ResponseEntity<RateResponse> response;
        try {
            response = restTemplate.exchange(
                url,
                HttpMethod.GET,
                new HttpEntity<>(createHeaders()),
                RateResponse.class
            );
        } catch (RestClientException e) {
            throw new RateSourceException(name, "request for " + from + " -> " + to + " failed", e);
        }

        if (response == null || !response.getStatusCode().is2xxSuccessful()) {
            throw new RateSourceException(name, "unexpected response status "
                + (response == null ? "none" : response.getStatusCode()));
        }
        return toQuote(response.getBody(), from, to);
    }

    private RateQuote toQuote(RateResponse body, Currency from, Currency to) {
        if (body == null || body.getRate() == null || body.getRate().signum() <= 0
                || body.getRate().precision() - body.getRate().scale() > MAX_RATE_INTEGER_DIGITS
                || body.getFrom() == null || body.getTo() == null) {
            throw new RateSourceException(name, "malformed rate payload: " + body);
        }

        Instant quotedAt = body.getTimestamp() != null ? body.getTimestamp() : Instant.now();

        if (from.name().equalsIgnoreCase(body.getFrom()) && to.name().equalsIgnoreCase(body.getTo())) {
            return new RateQuote(from, to, body.getRate(), quotedAt);
        }
        if (to.name().equalsIgnoreCase(body.getFrom()) && from.name().equalsIgnoreCase(body.getTo())) {
            BigDecimal reciprocal = BigDecimal.ONE.divide(body.getRate(), DERIVED_RATE_SCALE, RoundingMode.HALF_EVEN);
            log.debug("Derived {} -> {} rate {} from inverse quote {}", from, to, reciprocal, body.getRate());
            return new RateQuote(from, to, reciprocal, quotedAt);
        }
        throw new RateSourceException(name,
            "payload is for " + body.getFrom() + " -> " + body.getTo() + ", requested " + from + " -> " + to);
    }

    private HttpHeaders createHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    /**
     * Wire shape of a rate API response.
     */
    @Data
    @NoArgsConstructor
    public static class RateResponse {
        private String from;
        private String to;
        private BigDecimal rate;
        private Instant timestamp;
    }
}
