package eu.virtualparadox.documind.rag.context;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Languages the assistant is asked to answer in, detected from keywords of the question.
 * <p>
 * Constants are declared in detection priority order. This is a keyword heuristic, so short or
 * mixed-language questions may be misclassified; anything unrecognised is {@link #ENGLISH}.
 */
public enum ELanguage {

    ENGLISH("English", false, "hello", "what", "how", "where", "when", "why", "the", "and", "or", "but"),
    SPANISH("Spanish", false, "hola", "qué", "cómo", "dónde", "cuándo", "por qué", "el", "la", "y", "o", "pero"),
    FRENCH("French", false, "bonjour", "quoi", "comment", "où", "quand", "pourquoi", "le", "la", "et", "ou", "mais"),
    GERMAN("German", false, "hallo", "was", "wie", "wo", "wann", "warum", "der", "die", "und", "oder", "aber"),
    ITALIAN("Italian", false, "ciao", "cosa", "come", "dove", "quando", "perché", "il", "la", "e", "o", "ma"),
    PORTUGUESE("Portuguese", false, "olá", "o que", "como", "onde", "quando", "por que", "o", "a", "e", "ou", "mas"),
    RUSSIAN("Russian", false, "привет", "что", "как", "где", "когда", "почему", "и", "или", "но"),
    CHINESE("Chinese", true, "你好", "什么", "怎么", "哪里", "什么时候", "为什么", "的", "和", "或", "但是"),
    JAPANESE("Japanese", true, "こんにちは", "何", "どう", "どこ", "いつ", "なぜ", "の", "と", "または", "しかし"),
    KOREAN("Korean", true, "안녕하세요", "무엇", "어떻게", "어디", "언제", "왜", "의", "과", "또는", "하지만");

    private static final Pattern NON_LETTERS = Pattern.compile("[^\\p{L}]+");

    private final String displayName;
    private final boolean substringMatch;
    private final List<String> keywords;

    ELanguage(final String displayName, final boolean substringMatch, final String... keywords) {
        this.displayName = displayName;
        this.substringMatch = substringMatch;
        this.keywords = List.of(keywords);
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Returns the first language, in declaration order, with a keyword present in {@code text}.
     * Keywords match whole words, except multi-word keywords and keywords of scripts written
     * without spaces, which match anywhere.
     */
    public static ELanguage detect(final String text) {
        if (text == null || text.isBlank()) {
            return ENGLISH;
        }

        final String lower = text.toLowerCase(Locale.ROOT);
        final Set<String> tokens = Set.copyOf(Arrays.asList(NON_LETTERS.split(lower)));

        for (final ELanguage language : values()) {
            if (language.matches(lower, tokens)) {
                return language;
            }
        }
        return ENGLISH;
    }

    private boolean matches(final String lower, final Set<String> tokens) {
        for (final String keyword : keywords) {
            final boolean found = substringMatch || keyword.indexOf(' ') >= 0
                    ? lower.contains(keyword)
                    : tokens.contains(keyword);
            if (found) {
                return true;
            }
        }
        return false;
    }
}
