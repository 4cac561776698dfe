package com.techStack.geoVault.service.policy.rules;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

class TimeWindowPolicyRuleTest {

    @ParameterizedTest(name = "{0} in {1}-{2} -> {3}")
    @CsvSource({
            "09:00, 09:00, 17:00, true",
            "16:59, 09:00, 17:00, true",
            "17:00, 09:00, 17:00, false",
            "08:59, 09:00, 17:00, false",
            "23:30, 22:00, 06:00, true",
            "05:59, 22:00, 06:00, true",
            "06:00, 22:00, 06:00, false",
            "12:00, 22:00, 06:00, false",
            "10:00, 10:00, 10:00, false"
    })
    void isWithin_shouldTreatWindowAsHalfOpenAndWrapMidnight(String now, String start, String end, boolean expected) {
        assertThat(TimeWindowPolicyRule.isWithin(LocalTime.parse(now), LocalTime.parse(start), LocalTime.parse(end)))
                .isEqualTo(expected);
    }
}
