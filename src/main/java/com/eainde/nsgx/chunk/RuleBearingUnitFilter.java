package com.eainde.nsgx.chunk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Keeps only units that look like they state a rule, dropping preambles,
 * signature blocks, annex references and tables of contents.
 *
 * <p>Filtering keeps the unit ids assigned by the segmenter, so ids of retained
 * units are stable whether the filter is on or off.</p>
 */
public class RuleBearingUnitFilter {

    private static final Logger log = LoggerFactory.getLogger(RuleBearingUnitFilter.class);

    static final int MIN_UNIT_CHARS = 50;

    private static final Pattern RULE_MARKERS = Pattern.compile(
            "verboten|untersagt|zulässig"
                    + "|Ausnahme|Genehmigung|Befreiung"
                    + "|Ordnungswidrigkeit"
                    + "|§\\s*[34]",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern SKIP_MARKERS = Pattern.compile(
            "Bekanntmachung|Verkündung|Amtsblatt"
                    + "|Unterschrift|gez\\.|gezeichnet"
                    + "|Anlage|Anhang|Karte|Plan"
                    + "|Inhaltsverzeichnis|Gliederung",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    public boolean isRuleBearing(TextUnit unit) {
        String text = unit.text();
        if (text.length() < MIN_UNIT_CHARS || SKIP_MARKERS.matcher(text).find()) {
            return false;
        }
        return RULE_MARKERS.matcher(text).find();
    }

    public List<TextUnit> filter(List<TextUnit> units) {
        List<TextUnit> kept = units.stream().filter(this::isRuleBearing).toList();
        if (!units.isEmpty()) {
            log.debug("Rule filter kept {}/{} units of {}",
                    kept.size(), units.size(), units.get(0).documentId());
        }
        return kept;
    }
}
