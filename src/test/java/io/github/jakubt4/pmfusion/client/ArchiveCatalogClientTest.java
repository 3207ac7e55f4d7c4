package io.github.jakubt4.pmfusion.client;

import io.github.jakubt4.pmfusion.dto.SkyRegion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ArchiveCatalogClientTest {

    private static final String BASE_URL = "http://localhost:8091";

    private ArchiveCatalogClient client;
    private MockRestServiceServer mockServer;

    @BeforeEach
    void setUp() {
        final var restTemplate = new RestTemplate();
        mockServer = MockRestServiceServer.bindTo(restTemplate).build();

        final var builder = RestClient.builder()
                .requestFactory(restTemplate.getRequestFactory());

        client = new ArchiveCatalogClient(builder, BASE_URL);
    }

    @Test
    void fetchRegionQueriesBoxAndParsesRows() {
        mockServer.expect(requestTo(org.hamcrest.Matchers.startsWith(BASE_URL + "/catalog")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("ra", "150.0"))
                .andExpect(queryParam("dec", "20.0"))
                .andExpect(queryParam("width", "0.1"))
                .andExpect(queryParam("height", "0.2"))
                .andRespond(withSuccess("""
                        [
                          {"source_id": 4295806720, "ra": 150.01, "ra_error": 0.12, "dec": 20.02, "dec_error": 0.11,
                           "pmra": 1.5, "pmra_error": 0.1, "pmdec": -2.5, "pmdec_error": 0.09,
                           "phot_g_mean_mag": 17.2, "ruwe": 1.01, "ipd_gof_harmonic_amplitude": 0.03,
                           "visibility_periods_used": 14, "astrometric_excess_noise_sig": 0.0,
                           "astrometric_params_solved": 31, "parallax": 0.12},
                          {"source_id": 4295806721, "ra": 150.03, "ra_error": 1.2, "dec": 20.04, "dec_error": 1.1}
                        ]
                        """, MediaType.APPLICATION_JSON));

        final var rows = client.fetchRegion(new SkyRegion(150.0, 20.0, 0.1, 0.2));

        mockServer.verify();
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).sourceId()).isEqualTo(4295806720L);
        assertThat(rows.get(0).isFiveParameter()).isTrue();
        assertThat(rows.get(0).hasProperMotion()).isTrue();
        assertThat(rows.get(1).hasProperMotion()).isFalse();
    }

    @Test
    void fetchRegionThrowsOnServerError() {
        mockServer.expect(requestTo(org.hamcrest.Matchers.startsWith(BASE_URL + "/catalog")))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchRegion(new SkyRegion(150.0, 20.0, 0.1, 0.1)))
                .isInstanceOf(HttpServerErrorException.class);
    }
}
