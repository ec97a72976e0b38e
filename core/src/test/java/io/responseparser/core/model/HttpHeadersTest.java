package io.responseparser.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link HttpHeaders}. */
class HttpHeadersTest {

    // ── Case-insensitive lookup ──

    @Test
    void firstIsCaseInsensitive() {
        HttpHeaders headers = HttpHeaders.of(Map.of("X-Amzn-RequestId", "abc"));
        assertThat(headers.first("x-amzn-requestid")).isEqualTo("abc");
        assertThat(headers.first("X-AMZN-REQUESTID")).isEqualTo("abc");
    }

    @Test
    void firstReturnsNullForMissingHeader() {
        assertThat(HttpHeaders.of("Accept", "text/xml").first("X-Missing")).isNull();
    }

    @Test
    void firstOrDefaultFallsBackWhenAbsent() {
        assertThat(HttpHeaders.empty().firstOrDefault("x-amz-id-2", "")).isEmpty();
    }

    @Test
    void containsIsCaseInsensitive() {
        HttpHeaders headers = HttpHeaders.of("X-Request-ID", "abc");
        assertThat(headers.contains("x-request-id")).isTrue();
        assertThat(headers.contains("content-type")).isFalse();
    }

    // ── Original spelling ──

    @Test
    void namesKeepServerSpelling() {
        HttpHeaders headers = HttpHeaders.of("x-amz-meta-Color", "blue", "ETag", "\"abc\"");
        assertThat(headers.names()).containsExactlyInAnyOrder("x-amz-meta-Color", "ETag");
    }

    @Test
    void differentSpellingsOfOneNameMergeValues() {
        Map<String, String> raw = new LinkedHashMap<>();
        raw.put("X-Trace", "1");
        raw.put("x-trace", "2");
        HttpHeaders headers = HttpHeaders.of(raw);
        assertThat(headers.names()).containsExactly("X-Trace");
        assertThat(headers.all("X-TRACE")).containsExactly("1", "2");
    }

    // ── Multi-value ──

    @Test
    void ofMultiPreservesAllValues() {
        HttpHeaders headers = HttpHeaders.ofMulti(Map.of("Set-Cookie", List.of("a=1", "b=2")));
        assertThat(headers.all("set-cookie")).containsExactly("a=1", "b=2");
        assertThat(headers.first("set-cookie")).isEqualTo("a=1");
    }

    @Test
    void ofMultiDropsEmptyValueLists() {
        HttpHeaders headers = HttpHeaders.ofMulti(Map.of("X-Empty", List.of()));
        assertThat(headers.isEmpty()).isTrue();
    }

    @Test
    void oddNumberOfPairArgumentsIsRejected() {
        assertThatThrownBy(() -> HttpHeaders.of("only-a-name")).isInstanceOf(IllegalArgumentException.class);
    }

    // ── Immutability ──

    @Test
    void toSingleValueMapIsUnmodifiable() {
        Map<String, String> map = HttpHeaders.of("Accept", "text/xml").toSingleValueMap();
        assertThat(map).containsEntry("Accept", "text/xml");
        assertThatThrownBy(() -> map.put("new", "value")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void namesAreUnmodifiable() {
        HttpHeaders headers = HttpHeaders.of("Accept", "text/xml");
        assertThatThrownBy(() -> headers.names().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void emptyFactoriesReturnEmptyHeaders() {
        assertThat(HttpHeaders.of(Map.of()).isEmpty()).isTrue();
        assertThat(HttpHeaders.of().isEmpty()).isTrue();
        assertThat(HttpHeaders.ofMulti(null).isEmpty()).isTrue();
    }
}
