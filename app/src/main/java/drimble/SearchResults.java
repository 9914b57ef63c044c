package drimble;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

// Result links of a search page: same-host anchors whose text contains the keyword.
public final class SearchResults {

    private SearchResults() {
    }

    public static List<String> articleLinks(String html, String pageUrl, String keyword) {
        Document doc = Jsoup.parse(html == null ? "" : html, pageUrl);
        String needle = keyword.toLowerCase(Locale.ROOT);
        String self = UrlUtil.normalize(pageUrl);

        Set<String> links = new LinkedHashSet<>();
        for (Element a : doc.select("a[href]")) {
            String text = a.text().trim();
            if (text.isEmpty() || !text.toLowerCase(Locale.ROOT).contains(needle)) continue;

            String resolved = ArticleExtractor.resolve(a, pageUrl);
            // only Drimble pages, no external sites
            if (resolved == null || !UrlUtil.sameHost(resolved, pageUrl)) continue;

            String normalized = UrlUtil.normalize(resolved);
            if (!normalized.equals(self)) links.add(normalized);
        }
        return new ArrayList<>(links);
    }
}
