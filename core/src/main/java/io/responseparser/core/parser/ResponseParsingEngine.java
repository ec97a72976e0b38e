package io.responseparser.core.parser;

import io.responseparser.core.error.ResponseDecodeException;
import io.responseparser.core.model.HttpResponse;
import io.responseparser.core.model.ParsedResponse;
import io.responseparser.core.model.Shape;
import io.responseparser.core.spi.ResponseParser;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for parsing responses by protocol id. Takes the registry's shared parser for the
 * protocol on every call, so re-registering a protocol takes effect immediately, and calls through
 * the {@link ResponseParser} interface, which routes status codes of 301 and above to the error
 * path.
 */
public final class ResponseParsingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseParsingEngine.class);

    private final ProtocolRegistry registry;

    /** Creates an engine over the built-in protocols with the default timestamp parser. */
    public ResponseParsingEngine() {
        this(ProtocolRegistry.defaults());
    }

    public ResponseParsingEngine(ProtocolRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Parses a response for the given protocol.
     *
     * @param protocol protocol id, e.g. {@code "rest-xml"}
     * @param response the buffered response
     * @param shape    the output shape, or {@code null} for operations without output
     * @return the success or error result; API errors are results, not exceptions
     * @throws IllegalArgumentException if the protocol is unknown
     * @throws ResponseDecodeException  if the body is malformed or violates the shape
     */
    public ParsedResponse parse(String protocol, HttpResponse response, Shape shape) {
        Objects.requireNonNull(response, "response must not be null");
        ResponseParser parser = parserFor(protocol);
        try {
            ParsedResponse result = parser.parse(response, shape);
            LOG.debug(
                    "response.parsed protocol={} status={} error={} requestId={}",
                    protocol,
                    response.statusCode(),
                    result.isError(),
                    result.requestId());
            return result;
        } catch (ResponseDecodeException e) {
            LOG.warn("response.decode_failed protocol={} status={}: {}", protocol, response.statusCode(), e.getMessage());
            throw e;
        }
    }

    /** The parser currently serving a protocol. */
    public ResponseParser parserFor(String protocol) {
        return registry.parser(protocol);
    }

    public ProtocolRegistry registry() {
        return registry;
    }
}
