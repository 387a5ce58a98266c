package io.symdiff.core.error;

/** Thrown when the input contains a character that is not part of the expression grammar. */
public final class InvalidCharacterException extends ParseException {

    private static final long serialVersionUID = 1L;

    private final char character;

    public InvalidCharacterException(char character, int position) {
        super("Invalid character '" + character + "' at position " + position, ErrorKind.INVALID_CHARACTER, position);
        this.character = character;
    }

    public char character() {
        return character;
    }
}
