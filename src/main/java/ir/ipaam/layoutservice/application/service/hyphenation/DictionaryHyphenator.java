package ir.ipaam.layoutservice.application.service.hyphenation;

import ir.ipaam.layoutservice.domain.text.Hyphenator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Hyphenation from a word list for one language. Every entry spells a word with its
 * break points marked by {@code -}, e.g. {@code hy-phen-ation}. Lookups ignore case and
 * any punctuation around the word.
 */
@Slf4j
public class DictionaryHyphenator implements Hyphenator {

    private final Locale locale;
    private final Map<String, List<Integer>> entries = new HashMap<>();

    public DictionaryHyphenator(Locale locale, Collection<String> hyphenatedWords) {
        this.locale = locale;
        for (String entry : hyphenatedWords) {
            add(entry);
        }
        log.debug("Loaded {} hyphenation entries for {}", entries.size(), locale.toLanguageTag());
    }

    private void add(String entry) {
        String trimmed = entry.strip();
        if (trimmed.isEmpty()) {
            return;
        }
        List<Integer> offsets = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c == '-') {
                if (word.length() > 0) {
                    offsets.add(word.length());
                }
            } else {
                word.append(c);
            }
        }
        offsets.removeIf(o -> o >= word.length());
        entries.put(word.toString().toLowerCase(locale), List.copyOf(offsets));
    }

    public Locale getLocale() {
        return locale;
    }

    public int size() {
        return entries.size();
    }

    @Override
    public List<Integer> hyphenate(String word, Locale requested) {
        if (requested != null && !locale.getLanguage().equals(requested.getLanguage())) {
            return List.of();
        }
        int start = 0;
        int end = word.length();
        while (start < end && !Character.isLetter(word.charAt(start))) {
            start++;
        }
        while (end > start && !Character.isLetter(word.charAt(end - 1))) {
            end--;
        }
        List<Integer> offsets = entries.get(word.substring(start, end).toLowerCase(locale));
        if (offsets == null) {
            return List.of();
        }
        int shift = start;
        return offsets.stream().map(o -> o + shift).toList();
    }
}
