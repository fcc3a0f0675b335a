package com.eainde.compliance.document;

import lombok.extern.log4j.Log4j2;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts raw HTML into the immutable {@link DocumentNode} tree the scanner walks.
 * jsoup repairs malformed markup, so any string yields a tree rooted at {@code html}.
 * Pages nested deeper than {@link DocumentTree#MAX_DEPTH} elements are rejected.
 */
@Log4j2
@Component
public class HtmlDocumentParser {

    public DocumentNode parse(String html) {
        return parse(html, "");
    }

    /**
     * @throws IllegalArgumentException when the page is nested deeper than {@link DocumentTree#MAX_DEPTH}
     */
    public DocumentNode parse(String html, String baseUri) {
        Document document = Jsoup.parse(html == null ? "" : html, baseUri == null ? "" : baseUri);
        Element root = document.children().first();
        if (root == null) {
            root = document.appendElement("html");
        }
        DocumentNode tree = convert(root, 1);
        log.debug("Parsed document: {} chars, root <{}>", html == null ? 0 : html.length(), tree.tag());
        return tree;
    }

    private static DocumentNode convert(Element element, int depth) {
        if (depth > DocumentTree.MAX_DEPTH) {
            throw new IllegalArgumentException("document nested deeper than " + DocumentTree.MAX_DEPTH + " elements");
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        for (Attribute attribute : element.attributes()) {
            attributes.put(attribute.getKey(), attribute.getValue());
        }
        List<DocumentNode> children = new ArrayList<>();
        for (Element child : element.children()) {
            children.add(convert(child, depth + 1));
        }
        return new DocumentNode(element.normalName(), attributes, children, element.ownText());
    }
}
