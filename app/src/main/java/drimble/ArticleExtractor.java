package drimble;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

// Parses one article page. Every field is extracted on its own; a missing field stays null.
public class ArticleExtractor {

    private static final Logger log = LoggerFactory.getLogger(ArticleExtractor.class);

    // Tried in order; the first match is the content region.
    private static final List<String> CONTENT_SELECTORS = List.of(
            "article",
            "[itemprop=articleBody]",
            "div[class*=article]",
            "div[id*=content]",
            "main"
    );

    private static final String BOILERPLATE = "nav, header, footer, aside, script, style, noscript, form, iframe";

    public ArticleRecord extract(String html, String sourceUrl) {
        Document doc = Jsoup.parse(html == null ? "" : html, sourceUrl);
        Element content = field("content", sourceUrl, () -> contentRegion(doc));

        String fullText = content == null ? "" : field("full_text", sourceUrl, () -> bodyText(content));
        if (fullText == null) fullText = "";

        List<String> tags = field("tags", sourceUrl, () -> tags(doc));

        return new ArticleRecord(
                sourceUrl,
                field("title", sourceUrl, () -> title(doc)),
                field("published_date", sourceUrl, () -> publishedDate(doc)),
                field("author", sourceUrl, () -> author(doc)),
                tags == null ? List.of() : tags,
                field("main_image", sourceUrl, () -> mainImage(doc, content)),
                fullText,
                field("outbound_links", sourceUrl, () -> outboundLinks(doc, sourceUrl)),
                ArticleRecord.countWords(fullText)
        );
    }

    // One field failing must not take the whole record down.
    private static <T> T field(String name, String url, Supplier<T> extractor) {
        try {
            return extractor.get();
        } catch (RuntimeException e) {
            log.debug("Could not extract {} from {}: {}", name, url, e.toString());
            return null;
        }
    }

    static Element contentRegion(Document doc) {
        for (String selector : CONTENT_SELECTORS) {
            Element candidate = doc.selectFirst(selector);
            if (candidate != null) return candidate;
        }
        return null;
    }

    static String bodyText(Element content) {
        Element copy = content.clone();
        copy.select(BOILERPLATE).remove();
        // jsoup's text() already collapses runs of whitespace
        return collapse(copy.text());
    }

    static String title(Document doc) {
        Element h1 = doc.selectFirst("h1");
        if (h1 != null && !h1.text().isBlank()) return collapse(h1.text());
        String og = metaContent(doc, "meta[property=og:title]");
        if (og != null) return og;
        Element title = doc.selectFirst("head > title, title");
        return title == null || title.text().isBlank() ? null : collapse(title.text());
    }

    static String publishedDate(Document doc) {
        Element time = doc.selectFirst("time");
        if (time != null) {
            String datetime = time.attr("datetime").trim();
            if (!datetime.isEmpty()) return datetime;
            if (!time.text().isBlank()) return collapse(time.text());
        }
        String meta = metaContent(doc, "meta[property=article:published_time]");
        if (meta != null) return meta;
        for (Element el : doc.select("span[class], div[class], p[class]")) {
            if (classContains(el, "datum", "date") && !el.text().isBlank()) {
                return collapse(el.text());
            }
        }
        return null;
    }

    static String author(Document doc) {
        String meta = metaContent(doc, "meta[name=author]");
        if (meta == null) meta = metaContent(doc, "meta[property=author]");
        if (meta != null) return meta;

        Element link = doc.selectFirst("link[rel=author][href]");
        if (link != null && !link.attr("href").isBlank()) return link.attr("href").trim();

        for (Element el : doc.select("span[class], div[class], p[class], a[class]")) {
            if (classContains(el, "author") && !el.text().isBlank()) {
                return collapse(el.text());
            }
        }
        return null;
    }

    static List<String> tags(Document doc) {
        Set<String> tags = new LinkedHashSet<>();
        String keywords = metaContent(doc, "meta[name=keywords]");
        if (keywords != null) {
            for (String part : keywords.split(",")) {
                String t = collapse(part);
                if (!t.isEmpty()) tags.add(t);
            }
        } else {
            for (Element el : doc.select("a[class], span[class]")) {
                if (!classContains(el, "tag", "keyword")) continue;
                String t = collapse(el.text());
                if (!t.isEmpty()) tags.add(t);
            }
        }
        return new ArrayList<>(tags);
    }

    static String mainImage(Document doc, Element content) {
        String og = metaContent(doc, "meta[property=og:image]");
        if (og != null) return og;
        Element scope = content != null ? content : doc;
        Element img = scope.selectFirst("img[src]");
        if (img == null) return null;
        String abs = img.absUrl("src");
        return abs.isEmpty() ? img.attr("src").trim() : abs;
    }

    // Same-host http(s) links, normalized, in document order.
    static Set<String> outboundLinks(Document doc, String sourceUrl) {
        Set<String> links = new LinkedHashSet<>();
        for (Element a : doc.select("a[href]")) {
            String resolved = resolve(a, sourceUrl);
            if (resolved == null || !UrlUtil.sameHost(resolved, sourceUrl)) continue;
            String normalized = UrlUtil.normalize(resolved);
            if (!normalized.equals(UrlUtil.normalize(sourceUrl))) {
                links.add(normalized);
            }
        }
        return links;
    }

    static String resolve(Element a, String baseUrl) {
        String href = UrlUtil.cleanHref(a.attr("href"));     // raw href can be malformed
        if (href == null) return null;
        String resolved = UrlUtil.resolveAgainst(baseUrl, href);
        return UrlUtil.isHttpLike(resolved) ? resolved : null;
    }

    private static String metaContent(Document doc, String selector) {
        Element meta = doc.selectFirst(selector);
        if (meta == null) return null;
        String content = collapse(meta.attr("content"));
        return content.isEmpty() ? null : content;
    }

    private static boolean classContains(Element el, String... needles) {
        for (String cls : el.classNames()) {
            String lowered = cls.toLowerCase(Locale.ROOT);
            for (String needle : needles) {
                if (lowered.contains(needle)) return true;
            }
        }
        return false;
    }

    private static String collapse(String s) {
        return s == null ? "" : s.replaceAll("\\s+", " ").trim();
    }
}
