package drimble;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** One parsed article page; optional fields are null, {@code fullText} is never null. */
public record ArticleRecord(
        String url,
        String title,
        String publishedDate,
        String author,
        List<String> tags,
        String mainImageUrl,
        String fullText,
        Set<String> outboundLinks,
        int wordCount
) {
    public ArticleRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
        fullText = fullText == null ? "" : fullText;
        // keep discovery order so frontier growth is deterministic
        outboundLinks = outboundLinks == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(outboundLinks));
    }

    public static int countWords(String text) {
        if (text == null || text.isBlank()) return 0;
        return text.trim().split("\\s+").length;
    }
}
