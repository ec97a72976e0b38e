package io.responseparser.core.parser;

import io.responseparser.core.spi.ResponseParser;
import io.responseparser.core.spi.TimestampParser;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry of response parser factories keyed by protocol id. Each {@link #create} call builds a
 * fresh parser; parsers are stateless and may be reused freely. Thread-safe: registration and
 * lookup can happen concurrently.
 */
public final class ProtocolRegistry {

    public static final String EC2 = "ec2";
    public static final String QUERY = "query";
    public static final String JSON = "json";
    public static final String REST_JSON = "rest-json";
    public static final String REST_XML = "rest-xml";

    private final Map<String, Supplier<? extends ResponseParser>> factories = new ConcurrentHashMap<>();
    private final Map<String, ResponseParser> shared = new ConcurrentHashMap<>();

    /** Creates an empty registry. */
    public ProtocolRegistry() {}

    /** A registry holding the five built-in protocols with the default timestamp parser. */
    public static ProtocolRegistry defaults() {
        return defaults(TimestampParsers.defaultParser());
    }

    /** A registry holding the five built-in protocols, all sharing {@code timestampParser}. */
    public static ProtocolRegistry defaults(TimestampParser timestampParser) {
        Objects.requireNonNull(timestampParser, "timestampParser must not be null");
        ProtocolRegistry registry = new ProtocolRegistry();
        registry.register(EC2, () -> new Ec2QueryResponseParser(timestampParser));
        registry.register(QUERY, () -> new QueryResponseParser(timestampParser));
        registry.register(JSON, () -> new JsonResponseParser(timestampParser));
        registry.register(REST_JSON, () -> new RestJsonResponseParser(timestampParser));
        registry.register(REST_XML, () -> new RestXmlResponseParser(timestampParser));
        return registry;
    }

    /**
     * Registers a parser factory. If the protocol is already registered, it is replaced
     * (last-write-wins semantics).
     *
     * @throws NullPointerException     if factory is null
     * @throws IllegalArgumentException if protocol is null or empty
     */
    public void register(String protocol, Supplier<? extends ResponseParser> factory) {
        if (protocol == null || protocol.isEmpty()) {
            throw new IllegalArgumentException("protocol must not be null or empty");
        }
        factories.put(protocol, Objects.requireNonNull(factory, "factory must not be null"));
        shared.remove(protocol);
    }

    /**
     * Builds a new parser for a protocol.
     *
     * @return the parser, or empty if the protocol is not registered
     */
    public Optional<ResponseParser> create(String protocol) {
        Supplier<? extends ResponseParser> factory = protocol != null ? factories.get(protocol) : null;
        return Optional.ofNullable(factory).map(Supplier::get);
    }

    /**
     * Builds a new parser for a protocol, throwing if it is unknown.
     *
     * @throws IllegalArgumentException if no factory is registered for the protocol
     */
    public ResponseParser require(String protocol) {
        return create(protocol)
                .orElseThrow(() ->
                        new IllegalArgumentException("No response parser registered for protocol: '" + protocol + "'"));
    }

    /**
     * The shared parser for a protocol, built from the current factory on first use.
     *
     * @throws IllegalArgumentException if no factory is registered for the protocol
     */
    public ResponseParser parser(String protocol) {
        Objects.requireNonNull(protocol, "protocol must not be null");
        return shared.computeIfAbsent(protocol, this::require);
    }

    public boolean hasProtocol(String protocol) {
        return protocol != null && factories.containsKey(protocol);
    }

    /** Registered protocol ids. */
    public Set<String> protocols() {
        return Set.copyOf(factories.keySet());
    }

    public int size() {
        return factories.size();
    }
}
