package com.zerotrust.access.risk.device;

import com.zerotrust.access.domain.DeviceSignature;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for UserAgentParser using the bundled ua-parser regexes.
 */
class UserAgentParserTest {

    private static final String CHROME_WINDOWS = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private static final String SAFARI_IPHONE = "Mozilla/5.0 (iPhone; CPU iPhone OS 17_1 like Mac OS X) "
            + "AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.1 Mobile/15E148 Safari/604.1";
    private static final String SAFARI_IPAD = "Mozilla/5.0 (iPad; CPU OS 17_1 like Mac OS X) "
            + "AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.1 Mobile/15E148 Safari/604.1";

    private static UserAgentParser parser;

    @BeforeAll
    static void setUp() {
        parser = new UserAgentParser();
    }

    @Test
    void desktopChrome() {
        DeviceSignature device = parser.parse(CHROME_WINDOWS);

        assertThat(device.getBrowserFamily()).isEqualTo("Chrome");
        assertThat(device.getOsFamily()).isEqualTo("Windows");
        assertThat(device.getDeviceType()).isEqualTo(DeviceSignature.DESKTOP);
    }

    @Test
    void iphoneIsMobile() {
        DeviceSignature device = parser.parse(SAFARI_IPHONE);

        assertThat(device.getOsFamily()).isEqualTo("iOS");
        assertThat(device.isMobile()).isTrue();
    }

    @Test
    void ipadIsNotMobile() {
        assertThat(parser.parse(SAFARI_IPAD).isMobile()).isFalse();
    }

    @Test
    void fingerprintUsesFamiliesAndFirstFiftyCharacters() {
        DeviceSignature device = parser.parse(CHROME_WINDOWS);

        assertThat(device.getFingerprint()).isEqualTo("Chrome_Windows_" + CHROME_WINDOWS.substring(0, 50));
    }

    @Test
    void emptyUserAgentIsOther() {
        DeviceSignature device = parser.parse(null);

        assertThat(device.getBrowserFamily()).isEqualTo(UserAgentParser.OTHER);
        assertThat(device.getOsFamily()).isEqualTo(UserAgentParser.OTHER);
        assertThat(device.getFingerprint()).isEqualTo("Other_Other_");
    }
}
