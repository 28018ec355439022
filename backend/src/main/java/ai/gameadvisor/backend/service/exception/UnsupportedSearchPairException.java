package ai.gameadvisor.backend.service.exception;

public class UnsupportedSearchPairException extends IllegalArgumentException {

    public UnsupportedSearchPairException(String message) {
        super(message);
    }
}
