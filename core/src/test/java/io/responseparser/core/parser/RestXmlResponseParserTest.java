package io.responseparser.core.parser;

import static io.responseparser.core.testkit.TestResponses.empty;
import static io.responseparser.core.testkit.TestResponses.ok;
import static io.responseparser.core.testkit.TestResponses.response;
import static io.responseparser.core.testkit.TestShapes.flattenedList;
import static io.responseparser.core.testkit.TestShapes.header;
import static io.responseparser.core.testkit.TestShapes.integer;
import static io.responseparser.core.testkit.TestShapes.string;
import static io.responseparser.core.testkit.TestShapes.structure;
import static org.assertj.core.api.Assertions.assertThat;

import io.responseparser.core.model.ParsedResponse;
import io.responseparser.core.model.Serialization;
import io.responseparser.core.model.Shape;
import io.responseparser.core.model.ShapeKind;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RestXmlResponseParser")
class RestXmlResponseParserTest {

    private final RestXmlResponseParser parser = new RestXmlResponseParser();

    @Nested
    @DisplayName("Success responses")
    class Success {

        @Test
        @DisplayName("root element is decoded against the output shape with headers merged")
        void bodyAndHeaders() {
            Shape output = structure(
                    "ETag", header(ShapeKind.STRING, "ETag"),
                    "Name", string(),
                    "MaxKeys", integer(),
                    "Contents", flattenedList(structure("Key", string())));

            ParsedResponse result = parser.parse(ok("""
                    <ListBucketResult xmlns="http://s3.amazonaws.com/doc/2006-03-01/">
                      <Name>bucket</Name>
                      <MaxKeys>1000</MaxKeys>
                      <Contents><Key>a.txt</Key></Contents>
                    </ListBucketResult>""",
                    "ETag", "\"e\"", "x-amz-request-id", "req", "x-amz-id-2", "host"), output);

            assertThat(result.get("ETag")).isEqualTo("\"e\"");
            assertThat(result.get("Name")).isEqualTo("bucket");
            assertThat(result.get("MaxKeys")).isEqualTo(1000L);
            assertThat(result.get("Contents")).isEqualTo(List.of(Map.of("Key", "a.txt")));
            assertThat(result.responseMetadata()).isEqualTo(Map.of("RequestId", "req", "HostId", "host"));
        }

        @Test
        @DisplayName("empty body with header-only output still decodes headers")
        void headersOnly() {
            Shape output = structure("VersionId", header(ShapeKind.STRING, "x-amz-version-id"));

            ParsedResponse result = parser.parse(empty(204, "x-amz-version-id", "v1"), output);

            assertThat(result.get("VersionId")).isEqualTo("v1");
            assertThat(result.requestId()).isEmpty();
        }

        @Test
        @DisplayName("structure payload decodes the root element into one member")
        void structurePayload() {
            Shape output = structure(
                    Serialization.empty().withPayload("Configuration"),
                    "Configuration", structure("Status", string()));

            ParsedResponse result =
                    parser.parse(ok("<VersioningConfiguration><Status>Enabled</Status></VersioningConfiguration>"),
                            output);

            assertThat(result.get("Configuration")).isEqualTo(Map.of("Status", "Enabled"));
        }
    }

    @Nested
    @DisplayName("Error responses")
    class Errors {

        @Test
        @DisplayName("404 with an empty body is described from the status line")
        void emptyNotFound() {
            ParsedResponse result = parser.parse(empty(404), null);

            assertThat(result.error()).isEqualTo(Map.of("Code", "404", "Message", "Not Found"));
            assertThat(result.responseMetadata()).isEqualTo(Map.of("RequestId", "", "HostId", ""));
        }

        @Test
        @DisplayName("empty body with a less common status still gets its reason phrase")
        void emptyMisdirected() {
            ParsedResponse result = parser.parse(empty(421, "x-amz-request-id", "r", "x-amz-id-2", "h"), null);

            assertThat(result.error()).isEqualTo(Map.of("Code", "421", "Message", "Misdirected Request"));
            assertThat(result.responseMetadata()).isEqualTo(Map.of("RequestId", "r", "HostId", "h"));
        }

        @Test
        @DisplayName("repeated Error elements in a wrapped body keep the first one")
        void wrappedRepeatedErrors() {
            ParsedResponse result = parser.parse(response(400, """
                    <ErrorResponse>
                      <Error><Code>First</Code><Message>one</Message></Error>
                      <Error><Code>Second</Code><Message>two</Message></Error>
                    </ErrorResponse>"""), null);

            assertThat(result.errorCode()).isEqualTo("First");
            assertThat(result.errorMessage()).isEqualTo("one");
        }

        @Test
        @DisplayName("bare Error root takes ids from the headers and drops them from the error")
        void bareErrorRoot() {
            ParsedResponse result = parser.parse(response(404, """
                    <Error>
                      <Code>NoSuchKey</Code>
                      <Message>The specified key does not exist.</Message>
                      <Key>missing.txt</Key>
                      <RequestId>body-req</RequestId>
                      <HostId>body-host</HostId>
                    </Error>""", "x-amz-request-id", "hdr-req", "x-amz-id-2", "hdr-host"), null);

            assertThat(result.error())
                    .containsEntry("Code", "NoSuchKey")
                    .containsEntry("Key", "missing.txt")
                    .doesNotContainKeys("RequestId", "HostId");
            assertThat(result.responseMetadata()).isEqualTo(Map.of("RequestId", "hdr-req", "HostId", "hdr-host"));
        }

        @Test
        @DisplayName("bare Error root falls back to body ids when headers lack them")
        void bareErrorRootBodyIds() {
            ParsedResponse result = parser.parse(
                    response(403, "<Error><Code>AccessDenied</Code><RequestId>b</RequestId></Error>"), null);

            assertThat(result.errorCode()).isEqualTo("AccessDenied");
            assertThat(result.errorMessage()).isEmpty();
            assertThat(result.responseMetadata()).isEqualTo(Map.of("RequestId", "b", "HostId", ""));
        }

        @Test
        @DisplayName("wrapped ErrorResponse is read like query")
        void wrappedError() {
            ParsedResponse result = parser.parse(response(400, """
                    <ErrorResponse>
                      <Error><Type>Sender</Type><Code>InvalidChangeBatch</Code><Message>m</Message></Error>
                      <RequestId>wrapped</RequestId>
                    </ErrorResponse>"""), null);

            assertThat(result.error())
                    .isEqualTo(Map.of("Type", "Sender", "Code", "InvalidChangeBatch", "Message", "m"));
            assertThat(result.requestId()).isEqualTo("wrapped");
        }
    }
}
