package villagecompute.wpautomation.services;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;

import jakarta.enterprise.context.ApplicationScoped;

import villagecompute.wpautomation.api.types.ImageCandidateType;

/**
 * Renders the article body to HTML and places the selected images in it.
 *
 * <p>
 * <b>Selection:</b> the first candidate becomes the featured image and up to {@value #MAX_INLINE_IMAGES} of the
 * following ones become inline images.
 *
 * <p>
 * <b>Placement:</b> the HTML is split on {@code </p>} and an inline figure goes after every {@code interval}-th
 * paragraph, {@code interval = max(2, paragraphs / (images + 1))}, never after the last paragraph. Images that did not
 * fit are appended at the end.
 */
@ApplicationScoped
public class ImagePlacementService {

    static final int MAX_INLINE_IMAGES = 4;

    private static final Pattern PARAGRAPH_END = Pattern.compile("</p>", Pattern.CASE_INSENSITIVE);
    private static final Escaper HTML = HtmlEscapers.htmlEscaper();

    private final Parser parser;
    private final HtmlRenderer renderer;

    public record ImageSelection(ImageCandidateType featured, List<ImageCandidateType> inline) {

        public static ImageSelection none() {
            return new ImageSelection(null, List.of());
        }
    }

    public ImagePlacementService() {
        MutableDataSet options = new MutableDataSet();
        options.set(Parser.EXTENSIONS, List.of(TablesExtension.create()));
        options.set(HtmlRenderer.SOFT_BREAK, "<br />\n");
        this.parser = Parser.builder(options).build();
        this.renderer = HtmlRenderer.builder(options).build();
    }

    public ImageSelection select(List<ImageCandidateType> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return ImageSelection.none();
        }
        int inlineCount = Math.min(MAX_INLINE_IMAGES, candidates.size() - 1);
        return new ImageSelection(candidates.get(0), List.copyOf(candidates.subList(1, 1 + inlineCount)));
    }

    public String renderMarkdown(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return "";
        }
        Node document = parser.parse(markdown);
        return renderer.render(document);
    }

    public String insertInlineImages(String html, List<ImageCandidateType> images) {
        if (images == null || images.isEmpty() || html == null) {
            return html;
        }

        List<String> paragraphs = new ArrayList<>();
        Matcher matcher = PARAGRAPH_END.matcher(html);
        int start = 0;
        while (matcher.find()) {
            String piece = html.substring(start, matcher.start());
            if (!piece.isBlank()) {
                paragraphs.add(piece + matcher.group());
            }
            start = matcher.end();
        }
        String tail = html.substring(start);
        if (!tail.isBlank()) {
            paragraphs.add(tail);
        }
        if (paragraphs.isEmpty()) {
            return html;
        }

        int total = paragraphs.size();
        int interval = Math.max(2, total / (images.size() + 1));
        List<String> result = new ArrayList<>();
        int imageIndex = 0;
        for (int i = 0; i < total; i++) {
            result.add(paragraphs.get(i));
            if (imageIndex < images.size() && (i + 1) % interval == 0 && i < total - 1) {
                result.add(figure(images.get(imageIndex++)));
            }
        }
        while (imageIndex < images.size()) {
            result.add(figure(images.get(imageIndex++)));
        }
        return String.join("\n", result);
    }

    static String figure(ImageCandidateType image) {
        String alt = HTML.escape(image.altText());
        return "<figure class=\"wp-block-image\"><img src=\"" + HTML.escape(image.url()) + "\" alt=\"" + alt
                + "\"/><figcaption>" + alt + "</figcaption></figure>";
    }
}
