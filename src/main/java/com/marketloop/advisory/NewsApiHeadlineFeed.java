package com.marketloop.advisory;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketloop.config.AdvisoryProperties;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Reads a NewsAPI-shaped JSON feed: {@code articles[]} with {@code title},
 * {@code description}, {@code url}, {@code publishedAt} and {@code source.name}.
 */
@Component
public class NewsApiHeadlineFeed implements HeadlineFeed {

    private static final Logger log = LoggerFactory.getLogger(NewsApiHeadlineFeed.class);

    private final RestTemplate restTemplate;
    private final AdvisoryProperties advisoryProperties;

    public NewsApiHeadlineFeed(
            @Qualifier("advisoryFeedRestTemplate") RestTemplate restTemplate, AdvisoryProperties advisoryProperties) {
        this.restTemplate = restTemplate;
        this.advisoryProperties = advisoryProperties;
    }

    @Override
    public List<Headline> fetch() {
        if (!advisoryProperties.isConfigured()) {
            return List.of();
        }
        HttpHeaders headers = new HttpHeaders();
        if (advisoryProperties.getApiKey() != null && !advisoryProperties.getApiKey().isBlank()) {
            headers.set("X-Api-Key", advisoryProperties.getApiKey());
        }
        JsonNode body;
        try {
            body = restTemplate
                    .exchange(advisoryProperties.getFeedUrl(), HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class)
                    .getBody();
        } catch (RestClientException e) {
            log.warn("Headline feed fetch failed: {}", e.getMessage());
            return List.of();
        }
        if (body == null || !body.path("articles").isArray()) {
            log.warn("Headline feed returned no articles array");
            return List.of();
        }

        List<Headline> headlines = new ArrayList<>();
        for (JsonNode article : body.path("articles")) {
            String title = article.path("title").asText("").trim();
            String url = article.path("url").asText("").trim();
            String id = !url.isEmpty() ? url : title;
            if (id.isEmpty()) {
                continue;
            }
            headlines.add(Headline.builder()
                    .id(id)
                    .title(title)
                    .summary(article.path("description").asText(""))
                    .source(article.path("source").path("name").asText(""))
                    .publishedAt(parseTime(article.path("publishedAt").asText(null)))
                    .build());
        }
        log.debug("Headline feed returned {} items", headlines.size());
        return headlines;
    }

    private static LocalDateTime parseTime(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable publishedAt '{}'", raw);
            return null;
        }
    }
}
