package io.github.jbellis.wordguard.dom;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The node types registered with a document host.
 */
public final class NodeTypeRegistry {
    private static final Logger logger = LogManager.getLogger(NodeTypeRegistry.class);

    private final Map<String, NodeType> types;

    private NodeTypeRegistry(Map<String, NodeType> types) {
        this.types = types;
    }

    /**
     * Builds a registry from every {@link NodeType} on the classpath.
     */
    public static NodeTypeRegistry loadDefault() {
        var discovered = ServiceLoader.load(NodeType.class)
                                      .stream()
                                      .map(ServiceLoader.Provider::get)
                                      .collect(Collectors.toMap(NodeType::typeName,
                                                                Function.identity(),
                                                                (a, b) -> a,
                                                                LinkedHashMap::new));
        logger.debug("Discovered node types {}", discovered.keySet());
        return new NodeTypeRegistry(discovered);
    }

    public static NodeTypeRegistry of(NodeType... nodeTypes) {
        var map = new LinkedHashMap<String, NodeType>();
        for (var type : nodeTypes) {
            if (map.putIfAbsent(type.typeName(), type) != null) {
                throw new IllegalArgumentException("Duplicate node type " + type.typeName());
            }
        }
        return new NodeTypeRegistry(map);
    }

    public Optional<NodeType> get(String typeName) {
        return Optional.ofNullable(types.get(typeName));
    }

    /**
     * The first registered type matching {@code node}, if it is an element.
     */
    public Optional<NodeType> typeOf(Node node) {
        if (!(node instanceof Element element)) {
            return Optional.empty();
        }
        return types.values().stream().filter(t -> t.matches(element)).findFirst();
    }
}
