package dev.profileextractor.text;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Flattens a captured page DOM into line-oriented text, one line per block element.
 */
@Slf4j
@Component
public class HtmlTextExtractor {

    private static final Pattern HTML_MARKER = Pattern.compile(
            "<\\s*(html|body|main|section|div|li|ul|span|p|h[1-6])\\b", Pattern.CASE_INSENSITIVE);

    // Chrome and screen-reader-only copies (the latter cause text doubling)
    private static final String NOISE_ELEMENTS =
            "script, style, noscript, nav, footer, button, svg, .visually-hidden, .ads";

    /**
     * Check if the captured blob is markup rather than rendered text.
     */
    public boolean looksLikeHtml(String text) {
        return text != null && HTML_MARKER.matcher(text).find();
    }

    /**
     * Convert HTML to newline-separated text.
     *
     * @param html captured markup
     * @return rendered text with block boundaries as line breaks
     */
    public String toText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }

        Document document = Jsoup.parse(html);
        document.select(NOISE_ELEMENTS).remove();
        Element root = document.selectFirst("main");
        if (root == null) {
            root = document.body();
        }

        StringBuilder text = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    text.append(textNode.text());
                } else if (node instanceof Element element
                        && (element.isBlock() || "br".equals(element.normalName()))) {
                    text.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element && element.isBlock()) {
                    text.append('\n');
                }
            }
        }, root);

        log.debug("Flattened {} chars of HTML into {} chars of text", html.length(), text.length());
        return text.toString();
    }
}
