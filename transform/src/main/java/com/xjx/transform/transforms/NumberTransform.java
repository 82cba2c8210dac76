package com.xjx.transform.transforms;

import com.xjx.transform.TransformResult;
import com.xjx.transform.ValueTransformer;
import com.xjx.xnode.context.TransformContext;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parses numeric strings into numbers and formats numbers as strings.
 * Integers parse to {@link Integer}, {@link Long} or {@link BigInteger} by size, anything with a
 * fraction or exponent to {@link BigDecimal}.
 */
public final class NumberTransform implements ValueTransformer {
    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+)");
    private static final Pattern SCIENTIFIC = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)[eE][-+]?\\d+");

    private final boolean integers;
    private final boolean decimals;
    private final boolean scientific;
    private final char decimalSeparator;
    private final Character thousandsSeparator;
    private final Integer precision;
    private final Intent intent;

    private NumberTransform(Builder b) {
        this.integers = b.integers;
        this.decimals = b.decimals;
        this.scientific = b.scientific;
        this.decimalSeparator = b.decimalSeparator;
        this.thousandsSeparator = b.thousandsSeparator;
        this.precision = b.precision;
        this.intent = Objects.requireNonNull(b.intent, "intent");
        if (thousandsSeparator != null && thousandsSeparator == decimalSeparator)
            throw new IllegalArgumentException("Decimal and thousands separators must differ");
    }

    public static NumberTransform defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public TransformResult<Object> transform(Object value, TransformContext context) {
        return switch (intent.resolve(context.format())) {
            case PARSE -> TransformResult.keep(value instanceof String s ? parse(s, value) : value);
            case FORMAT -> TransformResult.keep(value instanceof Number n ? format(n) : value);
            case AUTO -> throw new IllegalStateException("unresolved intent");
        };
    }

    Object parse(String s, Object original) {
        String text = s.trim();
        if (thousandsSeparator != null) text = text.replace(String.valueOf(thousandsSeparator), "");
        if (decimalSeparator != '.') {
            if (text.indexOf('.') >= 0) return original;
            text = text.replace(decimalSeparator, '.');
        }
        if (text.isEmpty()) return original;
        if (integers && INTEGER.matcher(text).matches()) return narrow(new BigInteger(text));
        if (decimals && DECIMAL.matcher(text).matches()) return round(new BigDecimal(text));
        if (scientific && SCIENTIFIC.matcher(text).matches()) return round(new BigDecimal(text));
        return original;
    }

    String format(Number n) {
        BigDecimal bd = n instanceof BigDecimal d ? d
                : n instanceof BigInteger i ? new BigDecimal(i)
                : (n instanceof Double || n instanceof Float) ? new BigDecimal(n.toString())
                : BigDecimal.valueOf(n.longValue());
        bd = round(bd);
        String plain = bd.toPlainString();
        if (decimalSeparator != '.') plain = plain.replace('.', decimalSeparator);
        return plain;
    }

    private BigDecimal round(BigDecimal bd) {
        return precision == null ? bd : bd.setScale(precision, RoundingMode.HALF_UP);
    }

    private static Number narrow(BigInteger bi) {
        if (bi.bitLength() < 32) return bi.intValue();
        if (bi.bitLength() < 64) return bi.longValue();
        return bi;
    }

    public static final class Builder {
        private boolean integers = true;
        private boolean decimals = true;
        private boolean scientific = true;
        private char decimalSeparator = '.';
        private Character thousandsSeparator;
        private Integer precision;
        private Intent intent = Intent.AUTO;

        private Builder() {
        }

        public Builder integers(boolean integers) {
            this.integers = integers;
            return this;
        }

        public Builder decimals(boolean decimals) {
            this.decimals = decimals;
            return this;
        }

        public Builder scientific(boolean scientific) {
            this.scientific = scientific;
            return this;
        }

        public Builder decimalSeparator(char decimalSeparator) {
            this.decimalSeparator = decimalSeparator;
            return this;
        }

        public Builder thousandsSeparator(Character thousandsSeparator) {
            this.thousandsSeparator = thousandsSeparator;
            return this;
        }

        /** Digits after the decimal point for parsed decimals and formatted numbers. */
        public Builder precision(Integer precision) {
            if (precision != null && precision < 0) throw new IllegalArgumentException("precision must be >= 0");
            this.precision = precision;
            return this;
        }

        public Builder intent(Intent intent) {
            this.intent = intent;
            return this;
        }

        public NumberTransform build() {
            return new NumberTransform(this);
        }
    }
}
