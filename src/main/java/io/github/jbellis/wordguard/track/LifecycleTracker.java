package io.github.jbellis.wordguard.track;

import io.github.jbellis.wordguard.dom.AttributeStores;
import io.github.jbellis.wordguard.dom.NodeMutation;
import io.github.jbellis.wordguard.dom.UpdateEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.nodes.Element;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Detects tracked words that disappear from the document, for one {@link TrackedNamespace}.
 * <p>
 * Two detection paths exist. {@link #onUpdate} diffs the ids present in the previous and current
 * snapshots, which catches words whose text was edited away. {@link #onMutations} looks at
 * destroyed elements, which catches whole elements removed from the tree. The tracker keeps no
 * state between updates; both id sets are recomputed from the snapshots every time.
 */
public final class LifecycleTracker {
    private static final Logger logger = LogManager.getLogger(LifecycleTracker.class);

    private final TrackedNamespace namespace;
    private final WordDeletionSink sink;

    public LifecycleTracker(TrackedNamespace namespace, WordDeletionSink sink) {
        this.namespace = namespace;
        this.sink = sink;
    }

    public TrackedNamespace namespace() {
        return namespace;
    }

    /**
     * Reports every id present in {@code previous} and missing from {@code current}.
     *
     * @return the ids reported
     */
    public Set<String> onUpdate(Element previous, Element current) {
        var deleted = diff(previous, current);
        deleted.forEach(this::report);
        return deleted;
    }

    /**
     * Reports the id of every destroyed element that still resolves in {@code nodeMap}.
     *
     * @return the ids reported, in mutation order
     */
    public Set<String> onMutations(Map<String, NodeMutation> mutations, Map<String, Element> nodeMap) {
        var destroyed = destroyedIds(mutations, nodeMap);
        destroyed.forEach(this::report);
        return destroyed;
    }

    /**
     * Runs both detection paths for one committed update and reports each id at most once.
     *
     * @return the ids reported
     */
    public Set<String> onCommit(UpdateEvent event) {
        var ids = destroyedIds(event.mutations(), event.nodeMap());
        ids.addAll(diff(event.previous(), event.current()));
        ids.forEach(this::report);
        return ids;
    }

    private Set<String> diff(Element previous, Element current) {
        var previousIds = TrackedIds.collect(previous, namespace.attributeName());
        var currentIds = TrackedIds.collect(current, namespace.attributeName());
        return TrackedIds.deleted(previousIds, currentIds);
    }

    private Set<String> destroyedIds(Map<String, NodeMutation> mutations, Map<String, Element> nodeMap) {
        var ids = new LinkedHashSet<String>();
        for (var entry : mutations.entrySet()) {
            if (entry.getValue() != NodeMutation.DESTROYED) {
                continue;
            }
            var node = nodeMap.get(entry.getKey());
            if (node == null) {
                continue;
            }
            var id = AttributeStores.read(node, namespace.attributeName());
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }

    private void report(String id) {
        logger.debug("[{}] word deleted: {}", namespace.name(), id);
        try {
            sink.onWordDeleted(id);
        } catch (RuntimeException e) {
            logger.error("[{}] deletion callback failed for {}", namespace.name(), id, e);
        }
    }
}
