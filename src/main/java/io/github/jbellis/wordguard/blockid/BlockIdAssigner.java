package io.github.jbellis.wordguard.blockid;

import com.vladsch.flexmark.util.data.DataHolder;
import io.github.jbellis.wordguard.dom.AttributeStores;
import io.github.jbellis.wordguard.dom.DocumentTrees;
import io.github.jbellis.wordguard.dom.NodeMutation;
import io.github.jbellis.wordguard.flex.IdProvider;
import io.github.jbellis.wordguard.flex.WordguardOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Gives every top-level block of a document a unique id attribute.
 * <p>
 * A pass walks the blocks in document order with an empty {@code seen} set. The first block
 * carrying a given id keeps it; blocks without an id, or with an id already seen in this pass, get
 * a freshly generated one. Running a pass twice with no change in between changes nothing.
 */
public final class BlockIdAssigner {
    private static final Logger logger = LogManager.getLogger(BlockIdAssigner.class);

    private final String attribute;
    private final String prefix;
    private final IdProvider idProvider;

    public BlockIdAssigner(DataHolder options) {
        this(WordguardOptions.UNIQUE_ATTRIBUTE.get(options),
             WordguardOptions.UNIQUE_PREFIX.get(options),
             IdProvider.ID_PROVIDER.get(options));
    }

    public BlockIdAssigner(String attribute, String prefix, IdProvider idProvider) {
        this.attribute = attribute;
        this.prefix = prefix;
        this.idProvider = idProvider;
    }

    public String attribute() {
        return attribute;
    }

    /**
     * Runs one pass over the top-level blocks of {@code document}.
     */
    public AssignmentResult assign(Document document) {
        Set<String> seen = new HashSet<>();
        int kept = 0;
        int assigned = 0;
        int skipped = 0;

        for (var block : DocumentTrees.blocks(document)) {
            var store = AttributeStores.of(block);
            if (store.isEmpty()) {
                // text or comment at the top level
                skipped++;
                continue;
            }

            // first occurrence of an id keeps it
            var current = store.get().get(attribute);
            if (current != null && seen.add(current)) {
                kept++;
                continue;
            }

            String fresh;
            do {
                // suffixes are random, so a repeat within one pass is possible
                fresh = idProvider.generate(prefix);
            } while (seen.contains(fresh));
            store.get().set(attribute, fresh);
            seen.add(fresh);
            assigned++;
            logger.debug("Assigned {}={} to <{}> (was {})", attribute, fresh, block.nodeName(), current);
        }

        var result = new AssignmentResult(kept, assigned, skipped);
        if (assigned > 0) {
            logger.debug("Block id pass: {}", result);
        }
        return result;
    }

    /**
     * Runs a pass over {@code document} if any created or updated element in {@code nodeMap} is a
     * top-level block. The node map may point into a snapshot rather than into {@code document}.
     *
     * @return the pass result, or {@link AssignmentResult#NONE} when no block was touched
     */
    public AssignmentResult onMutations(Document document, Map<String, NodeMutation> mutations, Map<String, Element> nodeMap) {
        boolean touched = mutations.entrySet().stream()
                                   .filter(e -> e.getValue() != NodeMutation.DESTROYED)
                                   .map(e -> nodeMap.get(e.getKey()))
                                   .anyMatch(BlockIdAssigner::isTopLevel);
        return touched ? assign(document) : AssignmentResult.NONE;
    }

    private static boolean isTopLevel(Element element) {
        return element != null && element.parent() != null && "body".equals(element.parent().normalName());
    }

    /**
     * Counts of one pass. Skipped blocks are top-level nodes that cannot hold attributes.
     */
    public record AssignmentResult(int kept, int assigned, int skipped) {
        public static final AssignmentResult NONE = new AssignmentResult(0, 0, 0);

        public boolean changed() {
            return assigned > 0;
        }
    }
}
