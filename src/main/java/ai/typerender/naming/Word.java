package ai.typerender.naming;

public record Word(String text, WordCasing casing) {

    public static Word of(String text) {
        return new Word(text, WordCasing.of(text));
    }

    /**
     * All-caps words such as {@code URL} keep their casing where the style
     * allows it.
     */
    public boolean isAbbreviation() {
        return casing == WordCasing.ALL_UPPER;
    }
}
