package at.sv.chroma.color;

/**
 * Exception to signal that a palette definition could not be read or contains invalid entries.
 */
public final class InvalidPaletteException extends RuntimeException {

    public InvalidPaletteException(String message) {
        super(message);
    }

    public InvalidPaletteException(String message, Throwable cause) {
        super(message, cause);
    }
}
