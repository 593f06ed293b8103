package eu.virtualparadox.documind.rag.index;

/**
 * A vector does not have the dimension the index was created with.
 */
public class DimensionMismatchException extends IllegalArgumentException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(final int expected, final int actual) {
        super("Vector dimension mismatch. Index=" + expected + ", vector=" + actual
                + " (reindex into a fresh index if you changed the embedder)");
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
