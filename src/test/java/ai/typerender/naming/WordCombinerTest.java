package ai.typerender.naming;

import ai.typerender.render.PythonNames;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WordCombinerTest {

    private static final WordCombiner TYPES = PythonNames.TYPE_STYLE;
    private static final WordCombiner PROPERTIES = PythonNames.PROPERTY_STYLE;

    @Test
    void stylesTypeNames() {
        assertEquals("PersonName", TYPES.style("person_name"));
        assertEquals("HttpServer", TYPES.style("http_server"));
        assertEquals("HTTPServer", TYPES.style("HTTPServer"));
        assertEquals("OnLeave", TYPES.style("on-leave"));
    }

    @Test
    void stylesPropertyNames() {
        assertEquals("userId", PROPERTIES.style("user_id"));
        assertEquals("userID", PROPERTIES.style("userID"));
        assertEquals("httpServer", PROPERTIES.style("HTTPServer"));
        assertEquals("movedIn", PROPERTIES.style("Moved In"));
    }

    @Test
    void prefixesNamesThatWouldStartWithADigit() {
        assertEquals("The123Abc", TYPES.style("123abc"));
        assertEquals("the123Abc", PROPERTIES.style("123abc"));
        assertEquals("The2", TYPES.style("2"));
    }

    @Test
    void substitutesPlaceholderWhenNothingIsLeft() {
        assertEquals("Empty", TYPES.style("!!!"));
        assertEquals("empty", PROPERTIES.style(""));
        assertEquals("Empty", TYPES.style("数据"));
    }

    @Test
    void legalizesEachWordOnItsOwn() {
        assertEquals("Caf", TYPES.style("café"));
        assertEquals("CafBar", TYPES.style("café bar"));
    }

    @Test
    void combinesWithSeparator() {
        WordCombiner snake = new WordCombiner(
            new Legalizer(IdentifierCharacters::isAsciiLetterOrUnderscoreOrDigit),
            WordStyle.ALL_LOWER, WordStyle.ALL_LOWER, WordStyle.ALL_LOWER, WordStyle.ALL_LOWER,
            "_", IdentifierCharacters::isStartCharacter);
        assertEquals("http_server_name", snake.style("HTTPServerName"));
    }

    @Test
    void stylingIsIdempotentForAsciiInput() {
        List<String> labels = List.of(
            "person_name", "HTTPServer", "userID", "aB1c", "ABc", "a1b", "abC", "1a", "123",
            "URLPath", "McDonald", "x", "ID2", "already_Styled_NAME", "aBCd", "");
        for (String label : labels) {
            for (WordCombiner style : List.of(TYPES, PROPERTIES)) {
                String once = style.style(label);
                assertEquals(once, style.style(once), () -> "not idempotent for '" + label + "'");
            }
        }
    }
}
