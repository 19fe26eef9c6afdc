package com.marketloop.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.marketloop.config.ExchangeProperties;
import com.marketloop.exception.ExchangeException;
import com.marketloop.exception.ExchangeUnavailableException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Signed HTTP transport for the exchange API.
 *
 * <p>Maps failures onto the exchange exception hierarchy: 429, 5xx and I/O errors
 * become {@link ExchangeUnavailableException}; any other 4xx becomes
 * {@link ExchangeException}.
 */
@Component
public class ExchangeHttpClient {

    private static final Logger log = LoggerFactory.getLogger(ExchangeHttpClient.class);

    private final RestTemplate restTemplate;
    private final ExchangeRequestSigner exchangeRequestSigner;
    private final ExchangeProperties exchangeProperties;

    public ExchangeHttpClient(
            @Qualifier("exchangeRestTemplate") RestTemplate restTemplate,
            ExchangeRequestSigner exchangeRequestSigner,
            ExchangeProperties exchangeProperties) {
        this.restTemplate = restTemplate;
        this.exchangeRequestSigner = exchangeRequestSigner;
        this.exchangeProperties = exchangeProperties;
    }

    public JsonNode get(String path, Map<String, Object> queryParams) {
        return execute(HttpMethod.GET, path, queryParams, null);
    }

    public JsonNode post(String path, Object body) {
        return execute(HttpMethod.POST, path, Map.of(), body);
    }

    public JsonNode delete(String path) {
        return execute(HttpMethod.DELETE, path, Map.of(), null);
    }

    private JsonNode execute(HttpMethod method, String path, Map<String, Object> queryParams, Object body) {
        String fullPath = exchangeProperties.getApiPrefix() + path;
        UriComponentsBuilder uri = UriComponentsBuilder.fromPath(fullPath);
        queryParams.forEach((name, value) -> {
            if (value != null) {
                uri.queryParam(name, value);
            }
        });

        HttpEntity<Object> entity = new HttpEntity<>(body, exchangeRequestSigner.signedHeaders(method, fullPath));
        log.debug("Exchange {} {}", method, fullPath);
        try {
            ResponseEntity<JsonNode> response =
                    restTemplate.exchange(uri.build().toUriString(), method, entity, JsonNode.class);
            JsonNode responseBody = response.getBody();
            return responseBody != null ? responseBody : MissingNode.getInstance();
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            String message = String.format(
                    "Exchange %s %s failed with %d: %s", method, fullPath, status, e.getResponseBodyAsString());
            if (status == 429 || status >= 500) {
                log.warn(message);
                throw new ExchangeUnavailableException(message, status);
            }
            throw new ExchangeException(message, status);
        } catch (ResourceAccessException e) {
            log.warn("Exchange {} {} unreachable: {}", method, fullPath, e.getMessage());
            throw new ExchangeUnavailableException("Exchange unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ExchangeException("Exchange response could not be read: " + e.getMessage(), e);
        }
    }
}
