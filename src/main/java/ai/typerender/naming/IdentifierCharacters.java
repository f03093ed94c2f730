package ai.typerender.naming;

/**
 * Code point classes used to decide what may appear in an identifier.
 */
public final class IdentifierCharacters {

    private IdentifierCharacters() {
    }

    public static boolean isStartCharacter(int codePoint) {
        return Character.isAlphabetic(codePoint) || codePoint == '_';
    }

    /**
     * Decimal digits, connector punctuation and combining marks, on top of
     * every start character.
     */
    public static boolean isPartCharacter(int codePoint) {
        int category = Character.getType(codePoint);
        return category == Character.DECIMAL_DIGIT_NUMBER
            || category == Character.CONNECTOR_PUNCTUATION
            || isCombiningMark(codePoint)
            || isStartCharacter(codePoint);
    }

    public static boolean isAscii(int codePoint) {
        return codePoint < 128;
    }

    public static boolean isAsciiLetterOrUnderscoreOrDigit(int codePoint) {
        return isAscii(codePoint)
            && (Character.isLetterOrDigit(codePoint) || codePoint == '_');
    }

    static boolean isWordCharacter(int codePoint) {
        return Character.isLetterOrDigit(codePoint);
    }

    static boolean isCombiningMark(int codePoint) {
        int category = Character.getType(codePoint);
        return category == Character.NON_SPACING_MARK || category == Character.COMBINING_SPACING_MARK;
    }
}
