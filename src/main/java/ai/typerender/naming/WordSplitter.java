package ai.typerender.naming;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Breaks a label such as {@code "HTTPServer_config-2"} into words
 * ({@code HTTP}, {@code Server}, {@code config}, {@code 2}). Combining marks
 * stay with the letter they follow; anything else that is neither a letter
 * nor a digit separates words and is dropped.
 */
public final class WordSplitter {

    private WordSplitter() {
    }

    public static List<Word> split(String label) {
        if (label == null || label.isEmpty()) {
            return List.of();
        }
        return new Scanner(label).words();
    }

    private static final class Scanner {
        private final String text;
        private final List<Word> words = new ArrayList<>();
        private int position;
        private int wordStart;

        Scanner(String text) {
            this.text = text;
        }

        List<Word> words() {
            while (true) {
                skipWhile(cp -> !IdentifierCharacters.isWordCharacter(cp));
                if (atEnd()) {
                    return words;
                }

                wordStart = position;
                int cp = current();
                if (Character.isLowerCase(cp)) {
                    skipWhile(withMarks(Character::isLowerCase));
                    skipWhile(Character::isDigit);
                } else if (Character.isDigit(cp)) {
                    skipWhile(Character::isDigit);
                } else if (Character.isUpperCase(cp)) {
                    scanUpperCase();
                } else {
                    skipWhile(Scanner::isUncasedLetter);
                }
                finishWord();
            }
        }

        private void scanUpperCase() {
            int lastUpper = position;
            while (!atEnd() && withMarks(Character::isUpperCase).test(current())) {
                if (Character.isUpperCase(current())) {
                    lastUpper = position;
                }
                advance();
            }
            if (atEnd()) {
                return;
            }
            if (Character.isLowerCase(current())) {
                if (lastUpper > wordStart) {
                    // "HTTPServer": the last capital starts the next word
                    position = lastUpper;
                    finishWord();
                    wordStart = position;
                    advance();
                }
                skipWhile(withMarks(Character::isLowerCase));
            }
            skipWhile(Character::isDigit);
        }

        private void finishWord() {
            if (position > wordStart) {
                words.add(Word.of(text.substring(wordStart, position)));
            }
        }

        private void skipWhile(IntPredicate predicate) {
            while (!atEnd() && predicate.test(current())) {
                advance();
            }
        }

        private boolean atEnd() {
            return position >= text.length();
        }

        private int current() {
            return text.codePointAt(position);
        }

        private void advance() {
            position += Character.charCount(current());
        }

        private static IntPredicate withMarks(IntPredicate letters) {
            return cp -> letters.test(cp) || IdentifierCharacters.isCombiningMark(cp);
        }

        private static boolean isUncasedLetter(int cp) {
            if (IdentifierCharacters.isCombiningMark(cp)) {
                return true;
            }
            return IdentifierCharacters.isWordCharacter(cp)
                && !Character.isUpperCase(cp)
                && !Character.isLowerCase(cp)
                && !Character.isDigit(cp);
        }
    }
}
