package io.github.jakubt4.pmfusion.client;

import io.github.jakubt4.pmfusion.dto.CatalogRow;
import io.github.jakubt4.pmfusion.dto.SkyRegion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;

@Slf4j
@Service
public class ArchiveCatalogClient {

    private static final String CATALOG_PATH = "/catalog?ra={ra}&dec={dec}&width={width}&height={height}";
    private static final ParameterizedTypeReference<List<CatalogRow>> ROWS = new ParameterizedTypeReference<>() {
    };

    private final RestClient restClient;

    public ArchiveCatalogClient(final RestClient.Builder restClientBuilder,
                                @Value("${archive.base-url}") final String baseUrl) {
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .build();
    }

    @Retryable(retryFor = RestClientException.class, maxAttempts = 3,
               backoff = @Backoff(delay = 500, maxDelay = 2000))
    public List<CatalogRow> fetchRegion(final SkyRegion region) {
        final var rows = restClient.get()
                .uri(CATALOG_PATH, region.ra(), region.dec(), region.width(), region.height())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(ROWS);
        log.info("Fetched {} catalog rows around ({}, {})", rows == null ? 0 : rows.size(), region.ra(), region.dec());
        return rows == null ? List.of() : rows;
    }

    @Recover
    public List<CatalogRow> recoverFetchRegion(final RestClientException e, final SkyRegion region) {
        log.warn("Failed to fetch catalog region after retries: {}", e.getMessage());
        throw new CatalogUnavailableException("Catalog archive unavailable: " + e.getMessage(), e);
    }
}
