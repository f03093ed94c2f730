package ai.typerender.naming;

public enum WordCasing {
    ALL_UPPER,
    ALL_LOWER,
    CAPITALIZED,
    MIXED,
    UNCASED;

    public static WordCasing of(String word) {
        boolean anyUpper = false;
        boolean anyLower = false;
        boolean lowerAfterFirst = false;
        boolean upperAfterFirst = false;
        boolean firstUpper = false;

        int index = 0;
        for (int i = 0; i < word.length(); ) {
            int cp = word.codePointAt(i);
            if (Character.isUpperCase(cp)) {
                anyUpper = true;
                if (index == 0) {
                    firstUpper = true;
                } else {
                    upperAfterFirst = true;
                }
            } else if (Character.isLowerCase(cp)) {
                anyLower = true;
                if (index > 0) {
                    lowerAfterFirst = true;
                }
            }
            i += Character.charCount(cp);
            index++;
        }

        if (!anyUpper && !anyLower) {
            return UNCASED;
        }
        if (!anyLower) {
            return ALL_UPPER;
        }
        if (!anyUpper) {
            return ALL_LOWER;
        }
        if (firstUpper && !upperAfterFirst && lowerAfterFirst) {
            return CAPITALIZED;
        }
        return MIXED;
    }
}
