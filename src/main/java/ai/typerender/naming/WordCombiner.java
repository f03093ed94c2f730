package ai.typerender.naming;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Joins words back into a single identifier under a case style. The first
 * word and the following words are styled separately, and all-caps words get
 * their own style so acronyms can survive.
 */
public final class WordCombiner {

    static final String EMPTY_PLACEHOLDER = "empty";
    static final String START_PREFIX = "the";

    private final Legalizer legalizer;
    private final WordStyle firstWordStyle;
    private final WordStyle restWordStyle;
    private final WordStyle firstAbbreviationStyle;
    private final WordStyle restAbbreviationStyle;
    private final String separator;
    private final IntPredicate isStartCharacter;

    public WordCombiner(Legalizer legalizer,
                        WordStyle firstWordStyle,
                        WordStyle restWordStyle,
                        WordStyle firstAbbreviationStyle,
                        WordStyle restAbbreviationStyle,
                        String separator,
                        IntPredicate isStartCharacter) {
        this.legalizer = legalizer;
        this.firstWordStyle = firstWordStyle;
        this.restWordStyle = restWordStyle;
        this.firstAbbreviationStyle = firstAbbreviationStyle;
        this.restAbbreviationStyle = restAbbreviationStyle;
        this.separator = separator;
        this.isStartCharacter = isStartCharacter;
    }

    public String combine(List<Word> words) {
        List<Word> legal = new ArrayList<>();
        for (Word word : words) {
            String text = legalizer.legalize(word.text());
            if (!text.isEmpty()) {
                legal.add(new Word(text, word.casing()));
            }
        }

        if (legal.isEmpty()) {
            legal.add(Word.of(requireLegal(EMPTY_PLACEHOLDER)));
        }
        if (!isStartCharacter.test(legal.get(0).text().codePointAt(0))) {
            legal.add(0, Word.of(requireLegal(START_PREFIX)));
        }

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < legal.size(); i++) {
            Word word = legal.get(i);
            if (i == 0) {
                sb.append((word.isAbbreviation() ? firstAbbreviationStyle : firstWordStyle).apply(word.text()));
            } else {
                sb.append(separator);
                sb.append((word.isAbbreviation() ? restAbbreviationStyle : restWordStyle).apply(word.text()));
            }
        }
        return sb.toString();
    }

    public String style(String label) {
        return combine(WordSplitter.split(label));
    }

    private String requireLegal(String word) {
        String legal = legalizer.legalize(word);
        if (legal.isEmpty()) {
            throw new IllegalStateException("Word '" + word + "' is not a legal identifier part");
        }
        return legal;
    }
}
