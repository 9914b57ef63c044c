package drimble;

// One occurrence of the keyword in an article's full text.
public record KeywordMatch(
        int occurrenceIndex,
        int charOffset,
        String contextWindow,
        String containingSentence
) { }
