package drimble;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Finds keyword occurrences (case-insensitive, non-overlapping) and the numbers and dates near them.
public class KeywordAnalyzer {

    private static final Pattern NUMBER = Pattern.compile("(?<![\\d.,])\\d+(?:[.,]\\d+)?(?![\\d])");

    private static final String MONTHS =
            "januari|februari|maart|april|mei|juni|juli|augustus|september|oktober|november|december"
            + "|january|february|march|may|june|july|august|october"
            + "|jan|feb|mrt|mar|apr|jun|jul|aug|sept|sep|okt|oct|nov|dec";

    private static final Pattern DATE = Pattern.compile(
            "\\b(?:"
                    + "\\d{4}-\\d{1,2}-\\d{1,2}"                                  // 2024-12-31
                    + "|\\d{1,2}[-/.]\\d{1,2}[-/.]\\d{2,4}"                       // 31-12-2024, 31/12/24
                    + "|\\d{1,2}\\s+(?:" + MONTHS + ")\\.?\\s+\\d{4}"             // 31 december 2024
                    + ")\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );

    private final int contextRadius;
    private final int signalWindow;

    public KeywordAnalyzer(int contextRadius, int signalWindow) {
        if (contextRadius < 0 || signalWindow < 0) {
            throw new IllegalArgumentException("contextRadius and signalWindow must be >= 0");
        }
        this.contextRadius = contextRadius;
        this.signalWindow = signalWindow;
    }

    public static KeywordAnalyzer from(ScraperConfig config) {
        return new KeywordAnalyzer(config.contextRadius(), config.signalWindow());
    }

    public Optional<KeywordAnalysis> analyze(ArticleRecord record, String keyword) {
        return analyzeText(record.fullText(), keyword);
    }

    public Optional<KeywordAnalysis> analyzeText(String text, String keyword) {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("keyword must not be blank");
        }
        if (text == null || text.isEmpty()) return Optional.empty();

        List<Integer> offsets = occurrences(text, keyword);
        if (offsets.isEmpty()) return Optional.empty();

        List<KeywordMatch> matches = new ArrayList<>(offsets.size());
        for (int i = 0; i < offsets.size(); i++) {
            int offset = offsets.get(i);
            matches.add(new KeywordMatch(
                    i,
                    offset,
                    contextWindow(text, offset, keyword.length()),
                    containingSentence(text, offset, keyword.length())
            ));
        }

        List<int[]> dateSpans = spans(DATE, text);
        ContextualSignals signals = new ContextualSignals(
                nearby(NUMBER, text, offsets, keyword.length(), dateSpans),
                nearby(DATE, text, offsets, keyword.length(), List.of())
        );
        return Optional.of(new KeywordAnalysis(matches, signals));
    }

    // regionMatches keeps offsets aligned with the original text, unlike lowercasing it first.
    static List<Integer> occurrences(String text, String keyword) {
        List<Integer> offsets = new ArrayList<>();
        int k = keyword.length();
        int i = 0;
        while (i + k <= text.length()) {
            if (text.regionMatches(true, i, keyword, 0, k)) {
                offsets.add(i);
                i += k;
            } else {
                i++;
            }
        }
        return offsets;
    }

    String contextWindow(String text, int offset, int keywordLength) {
        int start = Math.max(0, offset - contextRadius);
        int end = Math.min(text.length(), offset + keywordLength + contextRadius);
        return text.substring(start, end);
    }

    static String containingSentence(String text, int offset, int keywordLength) {
        int start = 0;
        for (int i = offset - 1; i >= 0; i--) {
            if (isTerminator(text.charAt(i))) {
                start = i + 1;
                break;
            }
        }
        int end = text.length();
        for (int i = offset + keywordLength; i < text.length(); i++) {
            if (isTerminator(text.charAt(i))) {
                end = i + 1;
                break;
            }
        }
        return text.substring(start, end).trim();
    }

    private static boolean isTerminator(char c) {
        return c == '.' || c == '!' || c == '?';
    }

    private static List<int[]> spans(Pattern pattern, String text) {
        List<int[]> spans = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            spans.add(new int[]{m.start(), m.end()});
        }
        return spans;
    }

    // Tokens overlapping [offset - window, offset + len + window) of any occurrence.
    // Tokens lying inside one of the excluded spans (the parts of a date) are not reported.
    private List<String> nearby(Pattern pattern, String text, List<Integer> offsets, int keywordLength,
                                List<int[]> excluded) {
        Set<String> found = new LinkedHashSet<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            if (within(m.start(), m.end(), excluded)) continue;
            if (nearAny(m.start(), m.end(), offsets, keywordLength)) {
                found.add(m.group().replaceAll("\\s+", " "));
            }
        }
        return new ArrayList<>(found);
    }

    private static boolean within(int start, int end, List<int[]> spans) {
        for (int[] span : spans) {
            if (start >= span[0] && end <= span[1]) return true;
        }
        return false;
    }

    private boolean nearAny(int tokenStart, int tokenEnd, List<Integer> offsets, int keywordLength) {
        for (int offset : offsets) {
            int windowStart = offset - signalWindow;
            int windowEnd = offset + keywordLength + signalWindow;
            if (tokenStart < windowEnd && tokenEnd > windowStart) return true;
        }
        return false;
    }
}
