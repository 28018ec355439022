package ai.gameadvisor.backend.service.exception;

public class EmbeddingDimensionException extends IllegalArgumentException {

    public EmbeddingDimensionException(int expected, int actual) {
        super("Embedding has " + actual + " dimensions, expected " + expected);
    }
}
