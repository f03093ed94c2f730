package ai.typerender.naming;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class WordSplitterTest {

    private static List<String> texts(String label) {
        return WordSplitter.split(label).stream().map(Word::text).collect(Collectors.toList());
    }

    @Test
    void splitsOnSeparators() {
        assertEquals(List.of("person", "name"), texts("person_name"));
        assertEquals(List.of("version", "10", "beta"), texts("version 10 beta"));
        assertEquals(List.of("a", "b", "c"), texts("a-b.c"));
    }

    @Test
    void splitsCamelCase() {
        assertEquals(List.of("first", "Name"), texts("firstName"));
        assertEquals(List.of("Person", "Name"), texts("PersonName"));
    }

    @Test
    void keepsAcronymApartFromFollowingWord() {
        assertEquals(List.of("HTTP", "Server"), texts("HTTPServer"));
        assertEquals(List.of("user", "ID"), texts("userID"));
        assertEquals(List.of("A", "Book"), texts("ABook"));
    }

    @Test
    void digitsStickToPrecedingLettersButStandAloneOtherwise() {
        assertEquals(List.of("item2", "Count"), texts("item2Count"));
        assertEquals(List.of("ID2"), texts("ID2"));
        assertEquals(List.of("123", "abc"), texts("123abc"));
    }

    @Test
    void separatorsOnlyYieldNoWords() {
        assertTrue(WordSplitter.split("  --__ ").isEmpty());
        assertTrue(WordSplitter.split("").isEmpty());
        assertTrue(WordSplitter.split(null).isEmpty());
    }

    @Test
    void handlesNonAsciiInput() {
        assertEquals(List.of("über", "Grund"), texts("überGrund"));
        assertEquals(List.of("数据"), texts("数据"));
        assertEquals(List.of("a", "b"), texts("a😀b"));
    }

    @Test
    void combiningMarksStayInTheirWord() {
        assertEquals(List.of("cafe\u0301", "Menu"), texts("cafe\u0301Menu"));
        assertEquals(List.of("E\u0301cole"), texts("E\u0301cole"));
        assertEquals(List.of("HTTP", "E\u0301cole"), texts("HTTPE\u0301cole"));
        assertEquals(List.of("\u0928\u092e\u0938\u094d\u0924\u0947"), texts("\u0928\u092e\u0938\u094d\u0924\u0947"));
        assertEquals(WordCasing.CAPITALIZED, WordSplitter.split("E\u0301cole").get(0).casing());
    }

    @Test
    void tagsEachWordWithItsCasing() {
        List<Word> words = WordSplitter.split("HTTPServer_name 42");
        assertEquals(WordCasing.ALL_UPPER, words.get(0).casing());
        assertEquals(WordCasing.CAPITALIZED, words.get(1).casing());
        assertEquals(WordCasing.ALL_LOWER, words.get(2).casing());
        assertEquals(WordCasing.UNCASED, words.get(3).casing());
        assertTrue(words.get(0).isAbbreviation());
        assertFalse(words.get(1).isAbbreviation());
    }

    @Test
    void mixedCasingIsDetected() {
        assertEquals(WordCasing.MIXED, WordCasing.of("McDonald"));
        assertEquals(WordCasing.CAPITALIZED, WordCasing.of("Item2"));
        assertEquals(WordCasing.ALL_UPPER, WordCasing.of("A"));
    }
}
