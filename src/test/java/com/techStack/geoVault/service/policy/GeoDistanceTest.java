package com.techStack.geoVault.service.policy;

import com.techStack.geoVault.models.policy.AccessPolicy;
import com.techStack.geoVault.models.policy.AccessRequest;
import com.techStack.geoVault.service.policy.rules.LocationPolicyRule;
import com.techStack.geoVault.service.policy.rules.RuleOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeoDistanceTest {

    private static final double OFFICE_LAT = -1.2921;
    private static final double OFFICE_LON = 36.8219;

    @ParameterizedTest
    @CsvSource({
            "0.0, 0.0",
            "-1.2921, 36.8219",
            "89.9, -179.5"
    })
    void haversine_shouldBeZero_forIdenticalPoints(double lat, double lon) {
        assertThat(GeoDistance.haversineMeters(lat, lon, lat, lon)).isEqualTo(0.0);
    }

    @ParameterizedTest
    @CsvSource({
            "-1.2921, 36.8219, -1.2864, 36.8172",
            "51.5074, -0.1278, 48.8566, 2.3522",
            "10.0, 179.9, -10.0, -179.9"
    })
    void haversine_shouldBeSymmetric(double lat1, double lon1, double lat2, double lon2) {
        assertThat(GeoDistance.haversineMeters(lat1, lon1, lat2, lon2))
                .isCloseTo(GeoDistance.haversineMeters(lat2, lon2, lat1, lon1), within(1e-6));
    }

    @Test
    void haversine_shouldUseMeanEarthRadius_forKnownPairs() {
        // one degree of arc on the equator and a quarter meridian, both exact multiples of R
        assertThat(GeoDistance.haversineMeters(0, 0, 0, 1))
                .isCloseTo(6_371_000d * Math.PI / 180, within(1e-3));
        assertThat(GeoDistance.haversineMeters(0, 0, 90, 0))
                .isCloseTo(6_371_000d * Math.PI / 2, within(1e-3));
    }

    @Test
    void haversine_shouldMatchPublishedDistance_londonToParis() {
        assertThat(GeoDistance.haversineMeters(51.5074, -0.1278, 48.8566, 2.3522))
                .isCloseTo(343_556, within(500.0));
    }

    @Test
    void locationRule_shouldPass_whenDistanceEqualsRadius() {
        double lat = -1.2864;
        double lon = 36.8172;
        double distance = GeoDistance.haversineMeters(lat, lon, OFFICE_LAT, OFFICE_LON);

        RuleOutcome atRadius = new LocationPolicyRule()
                .evaluate(new AccessRequest(lat, lon, null), policyWithRadius(distance), LocalTime.NOON);
        RuleOutcome justInside = new LocationPolicyRule()
                .evaluate(new AccessRequest(lat, lon, null), policyWithRadius(distance + 0.01), LocalTime.NOON);
        RuleOutcome justOutside = new LocationPolicyRule()
                .evaluate(new AccessRequest(lat, lon, null), policyWithRadius(distance - 0.01), LocalTime.NOON);

        assertThat(atRadius.passed()).isTrue();
        assertThat(justInside.passed()).isTrue();
        assertThat(justOutside.passed()).isFalse();
        assertThat(justOutside.message()).startsWith("Outside allowed area");
    }

    private static AccessPolicy policyWithRadius(double radiusMeters) {
        return AccessPolicy.builder()
                .latitude(OFFICE_LAT)
                .longitude(OFFICE_LON)
                .radiusMeters(radiusMeters)
                .allowedNetwork("OfficeWiFi")
                .startTime("08:00")
                .endTime("18:00")
                .build();
    }
}
