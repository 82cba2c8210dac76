package com.xjx.transform.transforms;

import com.xjx.transform.TransformResult;
import com.xjx.transform.ValueTransformer;
import com.xjx.xnode.context.TransformContext;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Maps words such as {@code yes}/{@code off} to booleans and booleans back to words.
 * Only strings are parsed and only booleans are formatted; other values pass through.
 */
public final class BooleanTransform implements ValueTransformer {
    public static final List<String> DEFAULT_TRUE = List.of("true", "yes", "1", "on");
    public static final List<String> DEFAULT_FALSE = List.of("false", "no", "0", "off");

    private final List<String> trueValues;
    private final List<String> falseValues;
    private final boolean ignoreCase;
    private final Intent intent;

    public BooleanTransform(List<String> trueValues, List<String> falseValues, boolean ignoreCase, Intent intent) {
        if (trueValues.isEmpty() || falseValues.isEmpty())
            throw new IllegalArgumentException("BooleanTransform needs at least one true and one false word");
        this.trueValues = List.copyOf(trueValues);
        this.falseValues = List.copyOf(falseValues);
        this.ignoreCase = ignoreCase;
        this.intent = Objects.requireNonNull(intent, "intent");
    }

    public static BooleanTransform defaults() {
        return new BooleanTransform(DEFAULT_TRUE, DEFAULT_FALSE, true, Intent.AUTO);
    }

    public static BooleanTransform withIntent(Intent intent) {
        return new BooleanTransform(DEFAULT_TRUE, DEFAULT_FALSE, true, intent);
    }

    @Override
    public TransformResult<Object> transform(Object value, TransformContext context) {
        return switch (intent.resolve(context.format())) {
            case PARSE -> TransformResult.keep(value instanceof String s ? parse(s, value) : value);
            case FORMAT -> TransformResult.keep(value instanceof Boolean b ? format(b) : value);
            case AUTO -> throw new IllegalStateException("unresolved intent");
        };
    }

    private Object parse(String s, Object original) {
        String trimmed = s.trim();
        if (matches(trimmed, trueValues)) return Boolean.TRUE;
        if (matches(trimmed, falseValues)) return Boolean.FALSE;
        return original;
    }

    /** First word of each list, so the default output is {@code true}/{@code false}. */
    private String format(boolean b) {
        return b ? trueValues.get(0) : falseValues.get(0);
    }

    private boolean matches(String s, List<String> words) {
        for (String w : words) {
            if (ignoreCase ? w.toLowerCase(Locale.ROOT).equals(s.toLowerCase(Locale.ROOT)) : w.equals(s)) return true;
        }
        return false;
    }
}
