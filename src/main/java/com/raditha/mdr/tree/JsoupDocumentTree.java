package com.raditha.mdr.tree;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link DocumentTree} over a jsoup element tree. Only element children are
 * considered; text and comment nodes are part of their parent's markup.
 */
public class JsoupDocumentTree implements DocumentTree<Element> {

    private final Element root;

    private JsoupDocumentTree(Element root) {
        this.root = root;
    }

    /**
     * Parse an HTML document. The {@code <html>} element becomes the root.
     */
    public static JsoupDocumentTree parse(String html) {
        Document document = Jsoup.parse(html);
        document.outputSettings().prettyPrint(false);
        return new JsoupDocumentTree(document.child(0));
    }

    /**
     * Wrap an already parsed element. Its owner document should have pretty
     * printing disabled, otherwise indentation leaks into the serialized spans.
     */
    public static JsoupDocumentTree of(Element root) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        return new JsoupDocumentTree(root);
    }

    @Override
    public Element root() {
        return root;
    }

    @Override
    public String tagOf(Element node) {
        return node.tagName();
    }

    @Override
    public List<Element> childrenOf(Element node) {
        return node.children();
    }

    @Override
    public String serialize(List<Element> siblings) {
        return siblings.stream()
                .map(element -> element.outerHtml().strip())
                .collect(Collectors.joining(" "));
    }
}
