package io.responseparser.core.shape;

import static io.responseparser.core.testkit.TestResponses.ok;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.responseparser.core.error.ShapeDefinitionException;
import io.responseparser.core.model.HttpHeaders;
import io.responseparser.core.model.HttpResponse;
import io.responseparser.core.model.Location;
import io.responseparser.core.model.ParsedResponse;
import io.responseparser.core.model.Shape;
import io.responseparser.core.model.ShapeKind;
import io.responseparser.core.parser.QueryResponseParser;
import io.responseparser.core.parser.RestXmlResponseParser;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ShapeModelParser")
class ShapeModelParserTest {

    private static final Path S3_MODEL = Path.of("src/test/resources/shapes/s3-get-object.yaml");
    private static final Path SQS_MODEL = Path.of("src/test/resources/shapes/sqs-list-queues.json");

    private ShapeModelParser parser;

    @BeforeEach
    void setUp() {
        parser = new ShapeModelParser();
    }

    @Nested
    @DisplayName("Loading model files")
    class Loading {

        @Test
        @DisplayName("YAML model resolves references and member overlays")
        void yamlModel() {
            ShapeModel model = parser.parse(S3_MODEL);

            Shape output = model.shape("GetObjectOutput");
            assertThat(output.kind()).isEqualTo(ShapeKind.STRUCTURE);
            assertThat(output.serialization().payload()).isEqualTo("Body");
            assertThat(output.members().keySet())
                    .containsExactly("Body", "ContentLength", "ETag", "LastModified", "Metadata");

            Shape length = output.members().get("ContentLength");
            assertThat(length.kind()).isEqualTo(ShapeKind.LONG);
            assertThat(length.serialization().location()).isEqualTo(Location.HEADER);
            assertThat(length.serialization().name()).isEqualTo("Content-Length");
            assertThat(output.members().get("Metadata").serialization().location()).isEqualTo(Location.HEADERS);
            assertThat(model.source()).endsWith("s3-get-object.yaml");
            assertThat(model.names()).contains("GetObjectOutput", "ListObjectsOutput", "Timestamp");
        }

        @Test
        @DisplayName("overlay does not leak into the shared target shape")
        void overlayIsolated() {
            ShapeModel model = parser.parse(S3_MODEL);

            assertThat(model.shape("Long").serialization().location()).isNull();
            assertThat(model.shape("String").serialization().name()).isNull();
        }

        @Test
        @DisplayName("JSON model is accepted and carries result wrapper and flattened list")
        void jsonModel() {
            ShapeModel model = parser.parse(SQS_MODEL);

            Shape output = model.shape("ListQueuesResult");
            assertThat(output.serialization().resultWrapper()).isEqualTo("ListQueuesResult");
            Shape urls = output.members().get("QueueUrls");
            assertThat(urls.isFlattenedList()).isTrue();
            assertThat(urls.member().serialization().name()).isEqualTo("QueueUrl");
        }

        @Test
        @DisplayName("find returns empty and shape throws for an unknown name")
        void unknownShape() {
            ShapeModel model = parser.parse(SQS_MODEL);

            assertThat(model.find("Nope")).isEmpty();
            assertThatThrownBy(() -> model.shape("Nope"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Nope");
        }
    }

    @Nested
    @DisplayName("Loaded shapes drive the parsers")
    class EndToEnd {

        @Test
        @DisplayName("query response decodes with a loaded model")
        void queryWithModel() {
            Shape output = parser.parse(SQS_MODEL).shape("ListQueuesResult");

            ParsedResponse result = new QueryResponseParser().parse(ok("""
                    <ListQueuesResponse>
                      <ListQueuesResult><QueueUrl>https://q/only</QueueUrl></ListQueuesResult>
                      <ResponseMetadata><RequestId>m</RequestId></ResponseMetadata>
                    </ListQueuesResponse>"""), output);

            assertThat(result.get("QueueUrls")).isEqualTo(List.of("https://q/only"));
        }

        @Test
        @DisplayName("rest-xml blob payload keeps raw bytes and reads prefixed metadata")
        void restXmlWithModel() {
            Shape output = parser.parse(S3_MODEL).shape("GetObjectOutput");
            byte[] body = "raw, <not> xml".getBytes(StandardCharsets.UTF_8);
            HttpHeaders headers = HttpHeaders.of(
                    "Content-Length", String.valueOf(body.length), "x-amz-meta-Owner", "ops", "ETag", "\"t\"");

            ParsedResponse result = new RestXmlResponseParser().parse(new HttpResponse(200, headers, body), output);

            assertThat((byte[]) result.get("Body")).isEqualTo(body);
            assertThat(result.get("ContentLength")).isEqualTo((long) body.length);
            assertThat(result.get("Metadata")).isEqualTo(Map.of("Owner", "ops"));
            assertThat(result.containsKey("LastModified")).isFalse();
        }
    }

    @Nested
    @DisplayName("Invalid models")
    class Invalid {

        @Test
        @DisplayName("missing shapes object")
        void missingShapes() {
            assertThatThrownBy(() -> parser.parse("other: {}", "inline"))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("shapes")
                    .extracting(e -> ((ShapeDefinitionException) e).source())
                    .isEqualTo("inline");
        }

        @Test
        @DisplayName("undefined reference")
        void undefinedReference() {
            String yaml = """
                    shapes:
                      Out:
                        type: structure
                        members:
                          A: { shape: Missing }
                    """;

            assertThatThrownBy(() -> parser.parse(yaml, "inline"))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("Missing");
        }

        @Test
        @DisplayName("unknown type name")
        void unknownType() {
            assertThatThrownBy(() -> parser.parse("shapes: { A: { type: union } }", "inline"))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("union");
        }

        @Test
        @DisplayName("unknown member location")
        void unknownLocation() {
            String yaml = """
                    shapes:
                      Out:
                        type: structure
                        members:
                          A: { shape: S, location: querystring }
                      S: { type: string }
                    """;

            assertThatThrownBy(() -> parser.parse(yaml, "inline"))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("querystring");
        }

        @Test
        @DisplayName("payload must name a member")
        void payloadNotMember() {
            String yaml = """
                    shapes:
                      Out:
                        type: structure
                        payload: Body
                        members: {}
                    """;

            assertThatThrownBy(() -> parser.parse(yaml, "inline"))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("payload");
        }

        @Test
        @DisplayName("recursive shapes are rejected")
        void recursive() {
            String yaml = """
                    shapes:
                      Node:
                        type: structure
                        members:
                          Children: { shape: NodeList }
                      NodeList:
                        type: list
                        member: { shape: Node }
                    """;

            assertThatThrownBy(() -> parser.parse(yaml, "inline"))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasMessageContaining("Recursive")
                    .hasMessageContaining("Node -> NodeList -> Node");
        }

        @Test
        @DisplayName("unreadable file")
        void unreadableFile() {
            assertThatThrownBy(() -> parser.parse(Path.of("src/test/resources/shapes/does-not-exist.yaml")))
                    .isInstanceOf(ShapeDefinitionException.class)
                    .hasCauseInstanceOf(java.io.IOException.class);
        }
    }
}
