package ai.typerender.naming;

import java.util.Locale;

public enum WordStyle {
    FIRST_UPPER {
        @Override
        public String apply(String word) {
            if (word.isEmpty()) {
                return word;
            }
            int first = word.codePointAt(0);
            int rest = Character.charCount(first);
            return new StringBuilder()
                .appendCodePoint(Character.toUpperCase(first))
                .append(word.substring(rest).toLowerCase(Locale.ROOT))
                .toString();
        }
    },
    ALL_LOWER {
        @Override
        public String apply(String word) {
            return word.toLowerCase(Locale.ROOT);
        }
    },
    ALL_UPPER {
        @Override
        public String apply(String word) {
            return word.toUpperCase(Locale.ROOT);
        }
    };

    public abstract String apply(String word);
}
