package io.responseparser.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link ParsedResponse}. */
class ParsedResponseTest {

    @Test
    void successAppendsMetadataAfterMembers() {
        ParsedResponse result = ParsedResponse.success(Map.of("Name", "x"), Map.of("RequestId", "rid"));

        assertThat(result.isError()).isFalse();
        assertThat(result.asMap().keySet()).containsExactly("Name", "ResponseMetadata");
        assertThat(result.requestId()).isEqualTo("rid");
        assertThat(result.error()).isNull();
        assertThat(result.errorCode()).isNull();
    }

    @Test
    void missingRequestIdBecomesEmptyString() {
        ParsedResponse result = ParsedResponse.success(Map.of(), Map.of());

        assertThat(result.asMap()).containsOnlyKeys("ResponseMetadata");
        assertThat(result.responseMetadata()).containsEntry("RequestId", "");
    }

    @Test
    void errorHoldsExactlyErrorAndMetadata() {
        ParsedResponse result =
                ParsedResponse.error(Map.of("Code", "Throttling", "Message", "slow down"), Map.of("RequestId", "r"));

        assertThat(result.isError()).isTrue();
        assertThat(result.asMap()).containsOnlyKeys("Error", "ResponseMetadata");
        assertThat(result.errorCode()).isEqualTo("Throttling");
        assertThat(result.errorMessage()).isEqualTo("slow down");
    }

    @Test
    void successWithErrorNamedMemberIsNotAnError() {
        ParsedResponse result = ParsedResponse.success(Map.of("Error", "none recorded"), Map.of("RequestId", "r"));

        assertThat(result.isError()).isFalse();
        assertThat(result.error()).isNull();
        assertThat(result.get("Error")).isEqualTo("none recorded");
        assertThat(result.responseMetadata()).containsEntry("RequestId", "r");
    }

    @Test
    void errorCodeAndMessageDefaultToEmptyString() {
        Map<String, Object> error = new HashMap<>();
        error.put("Code", null);
        ParsedResponse result = ParsedResponse.error(error, Map.of());

        assertThat(result.error()).containsEntry("Code", "").containsEntry("Message", "");
    }

    @Test
    void resultIsUnmodifiable() {
        ParsedResponse result = ParsedResponse.success(Map.of(), Map.of("RequestId", "r"));

        assertThatThrownBy(() -> result.asMap().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.responseMetadata().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
