package ir.ipaam.layoutservice.domain.text;

import com.ibm.icu.text.BreakIterator;
import ir.ipaam.layoutservice.domain.model.valueobject.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits styled spans into line-breaking units using ICU line-break rules.
 */
public class WordSplitter {

    private final Locale locale;

    public WordSplitter(Locale locale) {
        this.locale = locale == null ? Locale.ROOT : locale;
    }

    public List<StyledWord> split(List<Span> spans) {
        List<StyledWord> words = new ArrayList<>();
        for (Span span : spans) {
            String text = span.text();
            if (text.isEmpty()) continue;
            BreakIterator it = BreakIterator.getLineInstance(locale);
            it.setText(text);
            int start = it.first();
            for (int end = it.next(); end != BreakIterator.DONE; start = end, end = it.next()) {
                words.add(new StyledWord(text.substring(start, end), span.style()));
            }
        }
        return words;
    }
}
