package drimble;

// Named entity with its character span [start, end) in the analysed text.
public record Entity(String text, String label, int start, int end) {

    public Entity {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
        }
    }
}
