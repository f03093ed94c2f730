package ai.typerender.render;

import ai.typerender.naming.IdentifierCharacters;
import ai.typerender.naming.Legalizer;
import ai.typerender.naming.Namer;
import ai.typerender.naming.WordCombiner;
import ai.typerender.naming.WordStyle;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class PythonNames {

    private static final Legalizer LEGALIZER = new Legalizer(IdentifierCharacters::isAsciiLetterOrUnderscoreOrDigit);

    public static final WordCombiner TYPE_STYLE = new WordCombiner(
        LEGALIZER,
        WordStyle.FIRST_UPPER,
        WordStyle.FIRST_UPPER,
        WordStyle.ALL_UPPER,
        WordStyle.ALL_UPPER,
        "",
        IdentifierCharacters::isStartCharacter
    );

    public static final WordCombiner PROPERTY_STYLE = new WordCombiner(
        LEGALIZER,
        WordStyle.ALL_LOWER,
        WordStyle.FIRST_UPPER,
        WordStyle.ALL_LOWER,
        WordStyle.ALL_UPPER,
        "",
        IdentifierCharacters::isStartCharacter
    );

    static final List<String> KEYWORDS = List.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
        "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
        "if", "import", "in", "is", "lambda", "match", "case", "nonlocal", "not", "or", "pass",
        "raise", "return", "try", "while", "with", "yield"
    );

    // Everything a rendered module may import.
    static final List<String> IMPORTED_NAMES = List.of(
        "annotations", "Any", "Dict", "List", "Optional", "Union", "Enum", "date", "datetime", "time"
    );

    static final List<String> RESERVED_NAMES = List.of("type", "id");

    private PythonNames() {
    }

    public static Set<String> globalForbidden() {
        Set<String> forbidden = new HashSet<>(RESERVED_NAMES);
        forbidden.addAll(KEYWORDS);
        forbidden.addAll(IMPORTED_NAMES);
        return forbidden;
    }

    public static Set<String> propertyForbidden() {
        Set<String> forbidden = globalForbidden();
        forbidden.add("self");
        return forbidden;
    }

    public static Set<String> enumCaseForbidden() {
        return globalForbidden();
    }

    static Namer typeNamer() {
        return new Namer("types", TYPE_STYLE, globalForbidden());
    }

    static Namer propertyNamer(String className) {
        return new Namer("properties of " + className, PROPERTY_STYLE, propertyForbidden());
    }

    static Namer enumCaseNamer(String enumName) {
        return new Namer("cases of " + enumName, TYPE_STYLE, enumCaseForbidden());
    }
}
