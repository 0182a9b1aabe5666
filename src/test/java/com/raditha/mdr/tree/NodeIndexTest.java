package com.raditha.mdr.tree;

import com.raditha.mdr.MiningFixtures;
import com.raditha.mdr.model.GNode;
import com.raditha.mdr.model.NodeId;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeIndexTest {

    private JsoupDocumentTree tree;
    private NodeIndex<Element> index;

    @BeforeEach
    void setUp() {
        tree = MiningFixtures.list(3);
        index = new NodeIndex<>(tree);
    }

    @Test
    void testSequencesArePerTag() {
        Element ul = tree.root().selectFirst("ul");
        List<Element> items = tree.childrenOf(ul);

        assertEquals(new NodeId("ul", 0), index.identify(ul));
        assertEquals(new NodeId("li", 0), index.identify(items.get(0)));
        assertEquals(new NodeId("li", 1), index.identify(items.get(1)));
        assertEquals(new NodeId("html", 0), index.identify(tree.root()));
        assertEquals(new NodeId("li", 2), index.identify(items.get(2)));
        assertEquals("li-00002", index.identify(items.get(2)).toString());
    }

    @Test
    void testIdentifyIsIdempotent() {
        Element ul = tree.root().selectFirst("ul");
        NodeId first = index.identify(ul);
        NodeId second = index.identify(ul);

        assertEquals(first, second);
        assertEquals(1, index.size());
    }

    @Test
    void testStructurallyEqualNodesGetDistinctIds() {
        JsoupDocumentTree twins = MiningFixtures.page("<p>same</p><p>same</p>");
        NodeIndex<Element> twinIndex = new NodeIndex<>(twins);
        List<Element> paragraphs = twins.root().select("p");

        NodeId a = twinIndex.identify(paragraphs.get(0));
        NodeId b = twinIndex.identify(paragraphs.get(1));

        assertNotEquals(a, b);
        assertSame(paragraphs.get(0), twinIndex.resolve(a));
        assertSame(paragraphs.get(1), twinIndex.resolve(b));
    }

    @Test
    void testResolveUnknownIdFails() {
        NodeId unknown = new NodeId("table", 42);
        NodeLookupException e = assertThrows(NodeLookupException.class, () -> index.resolve(unknown));
        assertEquals(unknown, e.getNodeId());
        assertFalse(index.contains(unknown));
    }

    @Test
    void testNodesOfGNode() {
        Element ul = tree.root().selectFirst("ul");
        NodeId ulId = index.identify(ul);

        List<Element> nodes = index.nodesOf(new GNode(ulId, 1, 3));

        assertEquals(2, nodes.size());
        assertEquals("<li><a>1</a></li>", nodes.get(0).outerHtml());
        assertEquals("<li><a>2</a></li>", nodes.get(1).outerHtml());
    }

    @Test
    void testIdentityDoesNotTouchNodes() {
        Element ul = tree.root().selectFirst("ul");
        String before = ul.outerHtml();
        index.identify(ul);
        assertEquals(before, ul.outerHtml());
        assertTrue(ul.attributes().isEmpty());
    }
}
