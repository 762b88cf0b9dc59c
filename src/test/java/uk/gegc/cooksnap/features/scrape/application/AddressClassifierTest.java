package uk.gegc.cooksnap.features.scrape.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.InetAddress;

import static org.assertj.core.api.Assertions.assertThat;

class AddressClassifierTest {

    private final AddressClassifier classifier = new AddressClassifier();

    @Nested
    @DisplayName("IPv4")
    class Ipv4 {

        @ParameterizedTest
        @ValueSource(strings = {
                "0.0.0.0", "0.255.255.255",
                "10.0.0.0", "10.255.255.255",
                "100.64.0.0", "100.127.255.255",
                "127.0.0.1", "127.255.255.255",
                "169.254.0.0", "169.254.169.254",
                "172.16.0.0", "172.31.255.255",
                "192.0.2.1",
                "192.168.0.0", "192.168.255.255",
                "198.18.0.0", "198.19.255.255",
                "198.51.100.7",
                "203.0.113.9",
                "240.0.0.1", "255.255.255.255"
        })
        @DisplayName("isBlocked: when address is inside a reserved block then true")
        void blockedRanges(String address) {
            assertThat(classifier.isBlocked(address)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "9.255.255.255", "11.0.0.0",
                "100.63.255.255", "100.128.0.0",
                "126.255.255.255", "128.0.0.0",
                "169.253.255.255", "169.255.0.0",
                "172.15.255.255", "172.32.0.0",
                "192.0.1.255", "192.0.3.0",
                "192.167.255.255", "192.169.0.0",
                "198.17.255.255", "198.20.0.0",
                "203.0.112.255", "203.0.114.0",
                "239.255.255.255",
                "8.8.8.8", "93.184.216.34"
        })
        @DisplayName("isBlocked: when address is just outside a reserved block then false")
        void allowedNeighbours(String address) {
            assertThat(classifier.isBlocked(address)).isFalse();
        }

        @Test
        @DisplayName("isBlocked: InetAddress overload agrees with literal overload")
        void inetAddressOverload() throws Exception {
            assertThat(classifier.isBlocked(InetAddress.getByName("10.1.2.3"))).isTrue();
            assertThat(classifier.isBlocked(InetAddress.getByName("1.1.1.1"))).isFalse();
        }
    }

    @Nested
    @DisplayName("IPv6")
    class Ipv6 {

        @ParameterizedTest
        @ValueSource(strings = {
                "::", "::1", "[::1]",
                "fc00::1", "fd12:3456::1",
                "fe80::1", "febf::1", "fe80::1%eth0",
                "fec0::1"
        })
        @DisplayName("isBlocked: when address is loopback, unspecified, ULA or link-local then true")
        void blockedRanges(String address) {
            assertThat(classifier.isBlocked(address)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "::ffff:127.0.0.1",
                "::ffff:10.0.0.1",
                "::ffff:169.254.169.254",
                "::ffff:7f00:1",
                "64:ff9b::a00:1",
                "2002:c0a8:101::1",
                "::127.0.0.1"
        })
        @DisplayName("isBlocked: when IPv6 address embeds a blocked IPv4 address then true")
        void embeddedBlockedIpv4(String address) {
            assertThat(classifier.isBlocked(address)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "2606:4700:4700::1111",
                "2001:4860:4860::8888",
                "::ffff:8.8.8.8",
                "64:ff9b::808:808",
                "fbff::1",
                "fe7f::1"
        })
        @DisplayName("isBlocked: when address is public then false")
        void publicAddresses(String address) {
            assertThat(classifier.isBlocked(address)).isFalse();
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class Malformed {

        @ParameterizedTest
        @ValueSource(strings = {
                "", " ", "not-an-ip", "256.1.1.1", "1.2.3", "1.2.3.4.5",
                "01.2.3.4", "localhost", "::gggg", "1:2:3:4:5:6:7:8:9"
        })
        @DisplayName("isBlocked: when input is not a valid IP literal then true")
        void unparseable(String input) {
            assertThat(classifier.isBlocked(input)).isTrue();
        }

        @Test
        @DisplayName("isBlocked: when input is null then true")
        void nullInput() {
            assertThat(classifier.isBlocked((String) null)).isTrue();
            assertThat(classifier.isBlocked((InetAddress) null)).isTrue();
        }
    }
}
