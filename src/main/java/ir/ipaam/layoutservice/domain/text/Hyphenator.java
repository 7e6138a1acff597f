package ir.ipaam.layoutservice.domain.text;

import java.util.List;
import java.util.Locale;

/** Hyphenation collaborator. */
@FunctionalInterface
public interface Hyphenator {

    /**
     * Valid break offsets inside {@code word}, ascending. An offset {@code n} splits the
     * word into {@code word[0, n)} and {@code word[n, len)}.
     */
    List<Integer> hyphenate(String word, Locale locale);
}
