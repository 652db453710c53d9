package com.eainde.nsgx.merge;

import com.eainde.nsgx.model.Condition;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites engine-power limits given in PS into kW so that limits from different
 * paragraphs become comparable. The conversion factor is configurable.
 */
public class ConditionCanonicalizer {

    public static final double DEFAULT_PS_TO_KW = 0.7355;

    static final String PS_TYPE = "motor_leistung_ps";
    static final String KW_TYPE = "motor_leistung_kw";

    private static final Pattern NUMBER = Pattern.compile("\\d+(?:[.,]\\d+)?");

    private final double psToKwFactor;

    public ConditionCanonicalizer(double psToKwFactor) {
        this.psToKwFactor = psToKwFactor;
    }

    public List<Condition> canonicalize(List<Condition> conditions) {
        return conditions.stream().map(this::canonicalize).toList();
    }

    public Condition canonicalize(Condition condition) {
        if (!PS_TYPE.equals(condition.type()) || condition.value() == null || psToKwFactor <= 0) {
            return condition;
        }
        Matcher m = NUMBER.matcher(condition.value());
        if (!m.find()) {
            return condition;
        }
        BigDecimal ps = new BigDecimal(m.group().replace(',', '.'));
        BigDecimal kw = ps.multiply(BigDecimal.valueOf(psToKwFactor))
                .setScale(2, RoundingMode.HALF_UP)
                .stripTrailingZeros();
        return condition.withTypeAndValue(KW_TYPE, kw.toPlainString());
    }
}
