package com.tripmate.routeplanner.routing.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripmate.routeplanner.model.Point;
import com.tripmate.routeplanner.model.ProviderId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class OdsayTransitEstimatorTest {

    private MockRestServiceServer server;
    private OdsayTransitEstimator estimator;

    private final Point from = new Point(37.5, 127.0);
    private final Point to = new Point(37.55, 126.97);

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        estimator = new OdsayTransitEstimator(restTemplate, new ObjectMapper(), "https://odsay.test", 4500);
    }

    @Test
    void testEstimate_metersAndMinutes() throws Exception {
        server.expect(requestTo(startsWith("https://odsay.test/v1/api/searchPubTransPathT")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("SX", "127.0"))
                .andExpect(queryParam("SY", "37.5"))
                .andExpect(queryParam("EX", "126.97"))
                .andExpect(queryParam("EY", "37.55"))
                .andExpect(queryParam("apiKey", "odsaykey123"))
                .andRespond(withSuccess("""
                        {"result":{"path":[{"pathType":1,"info":{"totalDistance":8421,"totalTime":34}}]}}
                        """, MediaType.APPLICATION_JSON));

        RawEstimate estimate = estimator.estimate(from, to, "odsaykey123");

        assertEquals(8.42, estimate.getDistanceKm());
        assertEquals(34.0, estimate.getDurationMin());
        server.verify();
    }

    @Test
    void testEstimate_errorBodyWithOkStatus() {
        server.expect(requestTo(startsWith("https://odsay.test/v1/api/searchPubTransPathT")))
                .andRespond(withSuccess("""
                        {"error":[{"code":"-98","message":"출발지-도착지 간 거리가 가까워서 탐색된 결과 없음"}]}
                        """, MediaType.APPLICATION_JSON));

        ProviderFailureException e = assertThrows(ProviderFailureException.class,
                () -> estimator.estimate(from, to, "odsaykey123"));

        assertTrue(e.getMessage().startsWith("response missing distance/time: "));
        assertEquals(ProviderId.ODSAY, e.getProvider());
    }

    @Test
    void testEstimate_missingTotalTime() {
        server.expect(requestTo(startsWith("https://odsay.test/v1/api/searchPubTransPathT")))
                .andRespond(withSuccess("""
                        {"result":{"path":[{"info":{"totalDistance":1200}}]}}
                        """, MediaType.APPLICATION_JSON));

        ProviderFailureException e = assertThrows(ProviderFailureException.class,
                () -> estimator.estimate(from, to, "odsaykey123"));

        assertEquals("response missing distance/time", e.getMessage());
    }

    @Test
    void testEstimate_serverError() {
        server.expect(requestTo(startsWith("https://odsay.test/v1/api/searchPubTransPathT")))
                .andRespond(withServerError());

        ProviderFailureException e = assertThrows(ProviderFailureException.class,
                () -> estimator.estimate(from, to, "odsaykey123"));

        assertEquals("HTTP 500", e.getMessage());
    }

    @Test
    void testEstimate_negativeValuesRejected() {
        server.expect(requestTo(startsWith("https://odsay.test/v1/api/searchPubTransPathT")))
                .andRespond(withSuccess("""
                        {"result":{"path":[{"info":{"totalDistance":-5,"totalTime":3}}]}}
                        """, MediaType.APPLICATION_JSON));

        assertThrows(ProviderFailureException.class, () -> estimator.estimate(from, to, "odsaykey123"));
    }
}
