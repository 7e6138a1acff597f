package ir.ipaam.layoutservice.domain.text;

import ir.ipaam.layoutservice.domain.exception.CollaboratorFailureException;
import ir.ipaam.layoutservice.domain.exception.InvalidStyleException;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import ir.ipaam.layoutservice.support.FixedAdvanceFontMetrics;
import ir.ipaam.layoutservice.support.LayoutFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextMeasurerTest {

    private final TextMeasurer measurer = new TextMeasurer(new FixedAdvanceFontMetrics());

    @Test
    void measuresTheSumOfGlyphAdvances() {
        assertThat(measurer.measure("abc", LayoutFixtures.STYLE)).isEqualTo(15.0);
        assertThat(measurer.measure("abc", Style.ofSize(20))).isEqualTo(30.0);
        assertThat(measurer.measure("", LayoutFixtures.STYLE)).isZero();
    }

    @Test
    void lineHeightIsSizeTimesSpacing() {
        Style spaced = LayoutFixtures.STYLE.and(Style.builder().lineSpacing(1.5).build());

        assertThat(measurer.lineHeight(spaced)).isEqualTo(15.0);
        assertThat(measurer.lineMetrics(spaced)).isEqualTo(new LineMetrics(8.0, 2.0));
    }

    @Test
    void unknownFontFamilyIsAnInvalidStyle() {
        Style unknown = Style.builder().fontFamily("Comic Sans").build();

        assertThatThrownBy(() -> measurer.measure("x", unknown))
                .isInstanceOf(InvalidStyleException.class)
                .hasMessageContaining("Comic Sans");
    }

    @Test
    void wrapsFailingFontMetrics() {
        FontMetrics broken = new FixedAdvanceFontMetrics() {
            @Override
            public double glyphWidth(int codePoint, FontHandle font, double size) {
                throw new IllegalStateException("metrics offline");
            }
        };
        TextMeasurer failing = new TextMeasurer(broken);

        assertThatThrownBy(() -> failing.measure("x", Style.empty()))
                .isInstanceOf(CollaboratorFailureException.class)
                .hasRootCauseMessage("metrics offline");
    }

    @Test
    void breakCandidatesAreEmptyWithoutHyphenator() {
        assertThat(measurer.isHyphenationEnabled()).isFalse();
        assertThat(measurer.breakCandidates("hyphenation")).isEmpty();
    }

    @Test
    void breakCandidatesAreSortedDistinctAndInsideTheWord() {
        Hyphenator sloppy = (word, locale) -> List.of(6, 0, 2, 6, 11, 40);
        TextMeasurer hyphenating = new TextMeasurer(new FixedAdvanceFontMetrics(), sloppy, Locale.ENGLISH);

        assertThat(hyphenating.breakCandidates("hyphenation")).containsExactly(2, 6);
    }

    @Test
    void wrapsFailingHyphenator() {
        Hyphenator broken = (word, locale) -> {
            throw new IllegalStateException("dictionary missing");
        };
        TextMeasurer hyphenating = new TextMeasurer(new FixedAdvanceFontMetrics(), broken, Locale.ENGLISH);

        assertThatThrownBy(() -> hyphenating.breakCandidates("word"))
                .isInstanceOf(CollaboratorFailureException.class)
                .satisfies(e -> assertThat(((CollaboratorFailureException) e).getCollaborator()).isEqualTo("hyphenator"));
    }
}
