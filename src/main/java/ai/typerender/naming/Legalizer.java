package ai.typerender.naming;

import java.util.function.IntPredicate;

/**
 * Drops every code point the target does not allow inside an identifier.
 * Nothing is substituted, so the result may be empty.
 */
public final class Legalizer {

    private final IntPredicate allowed;

    public Legalizer(IntPredicate allowed) {
        this.allowed = allowed;
    }

    public String legalize(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints()
            .filter(allowed)
            .forEach(sb::appendCodePoint);
        return sb.toString();
    }
}
