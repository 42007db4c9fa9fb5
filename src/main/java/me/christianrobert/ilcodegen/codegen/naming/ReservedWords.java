package me.christianrobert.ilcodegen.codegen.naming;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Reserved-keyword set of one target grammar.
 *
 * <p>Identifiers colliding with a keyword are escaped by appending {@link #ESCAPE_SUFFIX}.</p>
 */
public final class ReservedWords {

    public static final String ESCAPE_SUFFIX = "_";

    private final Set<String> words;
    private final boolean caseInsensitive;

    private ReservedWords(Collection<String> words, boolean caseInsensitive) {
        Set<String> normalized = new HashSet<>();
        for (String word : words) {
            normalized.add(caseInsensitive ? word.toLowerCase(Locale.ROOT) : word);
        }
        this.words = Collections.unmodifiableSet(normalized);
        this.caseInsensitive = caseInsensitive;
    }

    public static ReservedWords caseSensitive(Collection<String> words) {
        return new ReservedWords(words, false);
    }

    public static ReservedWords caseInsensitive(Collection<String> words) {
        return new ReservedWords(words, true);
    }

    public boolean isReserved(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return false;
        }
        return words.contains(caseInsensitive ? identifier.toLowerCase(Locale.ROOT) : identifier);
    }

    /**
     * Returns the identifier, suffixed with {@code _} when it is a keyword.
     */
    public String escape(String identifier) {
        return isReserved(identifier) ? identifier + ESCAPE_SUFFIX : identifier;
    }

    public int size() {
        return words.size();
    }
}
