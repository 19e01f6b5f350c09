package com.ofdtext.backend.services.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeFilter;
import org.jsoup.select.NodeTraversor;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Renders a jsoup subtree as plain text.
 *
 * Blocks start on a new line, paragraphs and headings are separated by a blank line, tables come
 * out as aligned columns. Link targets are never printed, only the link text: the useful links
 * are reported separately by {@link ImportantLinkHarvester}.
 *
 * The tree is walked iteratively, so deeply nested markup does not exhaust the stack.
 */
@Component
@RequiredArgsConstructor
public class PlainTextRenderer {

    static final String COLUMN_SEPARATOR = "  ";
    static final String LIST_BULLET = "* ";

    private static final Set<String> NOT_RENDERED = Set.of("head", "title", "script", "style", "template");

    private static final Set<String> PARAGRAPHS = Set.of(
            "p", "h1", "h2", "h3", "h4", "h5", "h6", "blockquote", "pre", "ul", "ol", "dl", "figure"
    );

    private static final Set<String> BLOCKS = Set.of(
            "html", "body", "div", "section", "article", "header", "footer", "nav", "main", "aside",
            "address", "form", "fieldset", "legend", "li", "dt", "dd", "tr", "center", "figcaption",
            "details", "summary", "hr", "caption", "option", "noscript"
    );

    private final HtmlDocumentLoader documentLoader;

    /**
     * @throws HtmlParsingException when the markup cannot be parsed at all
     */
    public String render(String html) {
        return render(documentLoader.load(html));
    }

    public String render(Element root) {
        if (root == null) return "";
        TextCanvas canvas = new TextCanvas();
        NodeTraversor.filter(new RenderingFilter(canvas), root);
        return canvas.toString();
    }

    private final class RenderingFilter implements NodeFilter {

        private final TextCanvas canvas;
        private int preformattedDepth;

        private RenderingFilter(TextCanvas canvas) {
            this.canvas = canvas;
        }

        @Override
        public FilterResult head(Node node, int depth) {
            if (node instanceof TextNode textNode) {
                canvas.text(textNode.getWholeText(), preformattedDepth > 0);
                return FilterResult.CONTINUE;
            }
            if (!(node instanceof Element element)) {
                return FilterResult.CONTINUE;
            }

            String tag = element.normalName();
            if (NOT_RENDERED.contains(tag)) {
                return FilterResult.SKIP_ENTIRELY;
            }
            if ("table".equals(tag)) {
                canvas.blockBreak(1);
                canvas.raw(renderTable(element));
                canvas.blockBreak(1);
                return FilterResult.SKIP_ENTIRELY;
            }
            if ("br".equals(tag)) {
                canvas.lineBreak();
                return FilterResult.CONTINUE;
            }

            if (PARAGRAPHS.contains(tag)) {
                canvas.blockBreak(2);
            } else if (BLOCKS.contains(tag)) {
                canvas.blockBreak(1);
            }
            if ("li".equals(tag)) {
                canvas.raw(LIST_BULLET);
            }
            if ("pre".equals(tag)) {
                preformattedDepth++;
            }
            return FilterResult.CONTINUE;
        }

        @Override
        public FilterResult tail(Node node, int depth) {
            if (!(node instanceof Element element)) {
                return FilterResult.CONTINUE;
            }
            String tag = element.normalName();
            if ("pre".equals(tag)) {
                preformattedDepth--;
            }
            if (PARAGRAPHS.contains(tag)) {
                canvas.blockBreak(2);
            } else if (BLOCKS.contains(tag)) {
                canvas.blockBreak(1);
            }
            return FilterResult.CONTINUE;
        }
    }

    private String renderTable(Element table) {
        List<String> out = new ArrayList<>();

        for (Element child : table.children()) {
            if (!"caption".equals(child.normalName())) continue;
            String captionText = render(child).strip();
            if (!captionText.isEmpty()) out.add(captionText);
        }

        List<List<String[]>> rows = new ArrayList<>();
        int columns = 0;
        for (Element row : rowsOf(table)) {
            List<String[]> cells = new ArrayList<>();
            boolean hasText = false;
            for (Element cell : row.children()) {
                if (!"td".equals(cell.normalName()) && !"th".equals(cell.normalName())) continue;
                String[] lines = cellLines(cell);
                hasText |= lines.length > 0;
                cells.add(lines);
            }
            if (!hasText) continue;
            rows.add(cells);
            columns = Math.max(columns, cells.size());
        }

        int[] widths = new int[columns];
        for (List<String[]> cells : rows) {
            for (int c = 0; c < cells.size(); c++) {
                for (String line : cells.get(c)) {
                    widths[c] = Math.max(widths[c], line.length());
                }
            }
        }

        for (List<String[]> cells : rows) {
            int height = 1;
            for (String[] lines : cells) {
                height = Math.max(height, lines.length);
            }
            for (int i = 0; i < height; i++) {
                StringBuilder line = new StringBuilder();
                for (int c = 0; c < cells.size(); c++) {
                    String[] lines = cells.get(c);
                    String part = i < lines.length ? lines[i] : "";
                    if (c > 0) line.append(COLUMN_SEPARATOR);
                    line.append(part);
                    if (c < cells.size() - 1) {
                        line.append(" ".repeat(widths[c] - part.length()));
                    }
                }
                out.add(line.toString().stripTrailing());
            }
        }
        return String.join("\n", out);
    }

    private String[] cellLines(Element cell) {
        String text = render(cell);
        return text.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toArray(String[]::new);
    }

    // Rows of this table only; rows of nested tables are rendered inside their cell.
    private static List<Element> rowsOf(Element table) {
        List<Element> rows = new ArrayList<>();
        for (Element child : table.children()) {
            if ("tr".equals(child.normalName())) {
                rows.add(child);
            } else if ("thead".equals(child.normalName()) || "tbody".equals(child.normalName()) || "tfoot".equals(child.normalName())) {
                for (Element row : child.children()) {
                    if ("tr".equals(row.normalName())) rows.add(row);
                }
            }
        }
        return rows;
    }

    /**
     * Output buffer that collapses whitespace the way a browser does outside of pre.
     */
    private static final class TextCanvas {

        private final StringBuilder out = new StringBuilder();
        private boolean pendingSpace;

        void text(String text, boolean preformatted) {
            if (text.isEmpty()) return;
            if (preformatted) {
                out.append(text);
                pendingSpace = false;
                return;
            }

            String collapsed = collapseWhitespace(text);
            if (collapsed.startsWith(" ")) pendingSpace = true;
            String words = collapsed.strip();
            if (words.isEmpty()) return;

            if (pendingSpace && !atLineStart() && out.charAt(out.length() - 1) != ' ') {
                out.append(' ');
            }
            out.append(words);
            pendingSpace = collapsed.endsWith(" ");
        }

        void raw(String text) {
            out.append(text);
            pendingSpace = false;
        }

        void lineBreak() {
            trimTrailingSpaces();
            out.append('\n');
            pendingSpace = false;
        }

        void blockBreak(int newlines) {
            pendingSpace = false;
            if (out.length() == 0) return;
            trimTrailingSpaces();
            int existing = 0;
            for (int i = out.length() - 1; i >= 0 && out.charAt(i) == '\n'; i--) {
                existing++;
            }
            for (int i = existing; i < newlines; i++) {
                out.append('\n');
            }
        }

        private boolean atLineStart() {
            return out.length() == 0 || out.charAt(out.length() - 1) == '\n';
        }

        private void trimTrailingSpaces() {
            int end = out.length();
            while (end > 0 && out.charAt(end - 1) == ' ') end--;
            out.setLength(end);
        }

        @Override
        public String toString() {
            return out.toString();
        }
    }

    static String collapseWhitespace(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean lastWasSpace = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
                if (!lastWasSpace) sb.append(' ');
                lastWasSpace = true;
            } else {
                sb.append(c);
                lastWasSpace = false;
            }
        }
        return sb.toString();
    }
}
