package io.responseparser.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.responseparser.core.spi.ResponseParser;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for {@link ProtocolRegistry}. */
class ProtocolRegistryTest {

    private ProtocolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ProtocolRegistry();
    }

    @Test
    void emptyRegistryHasNoProtocols() {
        assertThat(registry.size()).isZero();
        assertThat(registry.protocols()).isEmpty();
        assertThat(registry.create("query")).isEmpty();
    }

    @Test
    void defaultsRegisterAllFiveProtocols() {
        ProtocolRegistry defaults = ProtocolRegistry.defaults();

        assertThat(defaults.protocols()).containsExactlyInAnyOrder("ec2", "query", "json", "rest-json", "rest-xml");
        assertThat(defaults.require("ec2")).isInstanceOf(Ec2QueryResponseParser.class);
        assertThat(defaults.require("query")).isExactlyInstanceOf(QueryResponseParser.class);
        assertThat(defaults.require("json")).isInstanceOf(JsonResponseParser.class);
        assertThat(defaults.require("rest-json")).isInstanceOf(RestJsonResponseParser.class);
        assertThat(defaults.require("rest-xml")).isInstanceOf(RestXmlResponseParser.class);
    }

    @Test
    void parsersReportTheirProtocol() {
        ProtocolRegistry defaults = ProtocolRegistry.defaults();

        for (String protocol : defaults.protocols()) {
            assertThat(defaults.require(protocol).protocol()).isEqualTo(protocol);
        }
    }

    @Test
    void createBuildsAFreshParserEachTime() {
        ProtocolRegistry defaults = ProtocolRegistry.defaults();

        assertThat(defaults.require("json")).isNotSameAs(defaults.require("json"));
    }

    @Test
    void sharedParserIsReusedUntilReRegistered() {
        registry.register("json", JsonResponseParser::new);
        ResponseParser first = registry.parser("json");

        assertThat(registry.parser("json")).isSameAs(first);

        registry.register("json", RestJsonResponseParser::new);
        assertThat(registry.parser("json")).isInstanceOf(RestJsonResponseParser.class);
    }

    @Test
    void sharedParserForUnknownProtocolIsRejected() {
        assertThatThrownBy(() -> registry.parser("cbor")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lastRegistrationWins() {
        ResponseParser custom = new JsonResponseParser();
        registry.register("json", QueryResponseParser::new);
        registry.register("json", () -> custom);

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.require("json")).isSameAs(custom);
    }

    @Test
    void unknownProtocolIsRejected() {
        assertThatThrownBy(() -> registry.require("smithy-rpc-v2-cbor"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("smithy-rpc-v2-cbor");
        assertThat(registry.hasProtocol(null)).isFalse();
    }

    @Test
    void invalidRegistrationsAreRejected() {
        assertThatThrownBy(() -> registry.register("", JsonResponseParser::new))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register("json", null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void customTimestampParserReachesEveryProtocol() {
        ProtocolRegistry custom = ProtocolRegistry.defaults(raw -> Instant.EPOCH);

        assertThat(custom.size()).isEqualTo(5);
        assertThatThrownBy(() -> ProtocolRegistry.defaults(null)).isInstanceOf(NullPointerException.class);
    }
}
