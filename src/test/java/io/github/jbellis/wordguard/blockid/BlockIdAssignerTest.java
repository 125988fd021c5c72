package io.github.jbellis.wordguard.blockid;

import io.github.jbellis.wordguard.TestUtil;
import io.github.jbellis.wordguard.dom.NodeMutation;
import io.github.jbellis.wordguard.flex.IdProvider;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BlockIdAssignerTest {
    private final BlockIdAssigner assigner = new BlockIdAssigner(TestUtil.options());

    @Test
    void everyBlockGetsDistinctId() {
        var document = TestUtil.html("<p>a</p><h1>b</h1><ul><li>c</li></ul>");

        var result = assigner.assign(document);

        assertEquals(3, result.assigned());
        var ids = new HashSet<String>();
        for (var block : document.body().children()) {
            var id = block.attr("data-unique");
            assertTrue(id.matches("unique-" + TestUtil.FIXED_MILLIS + "-[0-9a-z]{9}"), id);
            assertTrue(ids.add(id));
        }
        assertFalse(document.selectFirst("li").hasAttr("data-unique"));
    }

    @Test
    void secondPassIsStable() {
        var document = TestUtil.html("<p>a</p><p>b</p>");
        assigner.assign(document);
        var before = document.body().html();

        var result = assigner.assign(document);

        assertFalse(result.changed());
        assertEquals(2, result.kept());
        assertEquals(before, document.body().html());
    }

    @Test
    void duplicateIdsKeepFirstOccurrence() {
        var document = TestUtil.html("<p data-unique=\"x\">a</p><p data-unique=\"x\">b</p><p data-unique=\"x\">c</p>");

        var result = assigner.assign(document);

        assertEquals(1, result.kept());
        assertEquals(2, result.assigned());
        var blocks = document.body().children();
        assertEquals("x", blocks.get(0).attr("data-unique"));
        assertNotEquals("x", blocks.get(1).attr("data-unique"));
        assertNotEquals(blocks.get(1).attr("data-unique"), blocks.get(2).attr("data-unique"));
    }

    @Test
    void textBlocksAreSkipped() {
        var document = TestUtil.html("loose text<p>a</p>");

        var result = assigner.assign(document);

        assertEquals(1, result.skipped());
        assertEquals(1, result.assigned());
    }

    @Test
    void regeneratesOnCollision() {
        var queue = new ArrayDeque<>(List.of("taken", "taken", "fresh"));
        var provider = new IdProvider() {
            @Override
            public String generate(String prefix) {
                return queue.poll();
            }
        };
        var stubbed = new BlockIdAssigner("data-unique", "unique", provider);
        var document = TestUtil.html("<p data-unique=\"taken\">a</p><p>b</p>");

        stubbed.assign(document);

        assertEquals("fresh", document.body().child(1).attr("data-unique"));
        assertTrue(queue.isEmpty());
    }

    @Test
    void mutationsOnTopLevelBlocksTriggerPass() {
        var document = TestUtil.html("<p>a <b>b</b></p>");
        var p = document.selectFirst("p");
        var b = document.selectFirst("b");

        assertEquals(BlockIdAssigner.AssignmentResult.NONE,
                     assigner.onMutations(document, Map.of("k2", NodeMutation.UPDATED), Map.of("k2", b)));
        assertEquals(BlockIdAssigner.AssignmentResult.NONE,
                     assigner.onMutations(document, Map.of("k1", NodeMutation.DESTROYED), Map.of("k1", p)));
        assertFalse(p.hasAttr("data-unique"));

        var result = assigner.onMutations(document, Map.of("k1", NodeMutation.CREATED), Map.of("k1", p));

        assertTrue(result.changed());
        assertTrue(p.hasAttr("data-unique"));
    }
}
