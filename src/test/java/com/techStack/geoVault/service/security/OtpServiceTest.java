package com.techStack.geoVault.service.security;

import com.techStack.geoVault.support.TestSecurity;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class OtpServiceTest {

    private final OtpService otpService = TestSecurity.otpService();

    @Test
    void generateCode_shouldBeSixAsciiDigits() {
        for (int i = 0; i < 200; i++) {
            assertThat(otpService.generateCode()).matches("[0-9]{6}");
        }
    }

    @Test
    void generateCode_shouldStayAscii_whenDefaultLocaleUsesOtherDigits() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("ar-EG-u-nu-arab"));

            for (int i = 0; i < 50; i++) {
                String code = otpService.generateCode();
                assertThat(code).matches("[0-9]{6}");
                assertThat(otpService.matches(code, otpService.hash(code))).isTrue();
            }
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void matches_shouldRejectWrongOrMissingCode() {
        String stored = otpService.hash("123456");

        assertThat(otpService.matches(" 123456 ", stored)).isTrue();
        assertThat(otpService.matches("654321", stored)).isFalse();
        assertThat(otpService.matches(null, stored)).isFalse();
        assertThat(otpService.matches("123456", null)).isFalse();
    }
}
