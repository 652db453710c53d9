package com.eainde.nsgx.chunk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBearingUnitFilterTest {

    private final RuleBearingUnitFilter filter = new RuleBearingUnitFilter();

    @Test
    @DisplayName("should keep a unit stating a prohibition")
    void prohibition() {
        TextUnit unit = TextUnit.of("d", 0,
                "Im Naturschutzgebiet ist es verboten, Drohnen steigen zu lassen oder zu zelten.");

        assertThat(filter.isRuleBearing(unit)).isTrue();
    }

    @Test
    @DisplayName("should keep a unit referencing the prohibition sections")
    void sectionReference() {
        TextUnit unit = TextUnit.of("d", 0,
                "Die Regelungen nach § 4 gelten nicht für die ordnungsgemäße Forstwirtschaft im Gebiet.");

        assertThat(filter.isRuleBearing(unit)).isTrue();
    }

    @Test
    @DisplayName("should drop units that are too short")
    void tooShort() {
        assertThat(filter.isRuleBearing(TextUnit.of("d", 0, "Baden ist verboten."))).isFalse();
    }

    @Test
    @DisplayName("should drop annex and signature blocks even when they mention rules")
    void skipMarkers() {
        TextUnit annex = TextUnit.of("d", 0,
                "Die Anlage 2 zeigt die Bereiche, in denen das Befahren verboten ist, im Maßstab 1:5000.");
        TextUnit signature = TextUnit.of("d", 1,
                "gez. Der Landrat als untere Naturschutzbehörde, Befreiungen sind zulässig nach Antrag.");

        assertThat(filter.isRuleBearing(annex)).isFalse();
        assertThat(filter.isRuleBearing(signature)).isFalse();
    }

    @Test
    @DisplayName("should drop descriptive units without rule markers")
    void descriptive() {
        TextUnit unit = TextUnit.of("d", 0,
                "Das Gebiet umfasst die Flächen entlang des Flusses bis zur Mündung in den See.");

        assertThat(filter.isRuleBearing(unit)).isFalse();
    }

    @Test
    @DisplayName("should keep the original unit ids of retained units")
    void keepsIds() {
        List<TextUnit> units = List.of(
                TextUnit.of("d", 0, "Das Gebiet umfasst die Flächen entlang des Flusses bis zur Mündung."),
                TextUnit.of("d", 1, "Es ist untersagt, im Gebiet Hunde ohne Leine laufen zu lassen oder zu baden."),
                TextUnit.of("d", 2, "Kurz."));

        List<TextUnit> kept = filter.filter(units);

        assertThat(kept).extracting(TextUnit::unitId).containsExactly("chunk_001");
    }
}
