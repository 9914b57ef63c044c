package drimble;

public interface ArticleSink {

    // Prepares the output location. Failure here is fatal for the run.
    void open() throws PersistException;

    void persist(OutputArtifact artifact) throws PersistException;

    // Debug dump of a page that did not mention the keyword (save_json_all).
    void dumpUnmatched(int index, ArticleRecord record) throws PersistException;

    // End of run; nothing is persisted after this.
    default void close() {
    }
}
