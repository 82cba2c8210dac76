package com.xjx.transform.transforms;

import com.xjx.transform.TransformResult;
import com.xjx.transform.ValueTransformer;
import com.xjx.xnode.context.TransformContext;

import java.util.Objects;
import java.util.regex.Pattern;

/** Replaces every match of a regex in string values. Non-string values pass through. */
public final class RegexTransform implements ValueTransformer {
    private final Pattern pattern;
    private final String replacement;

    public RegexTransform(Pattern pattern, String replacement) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.replacement = Objects.requireNonNull(replacement, "replacement");
    }

    public static RegexTransform replace(String regex, String replacement) {
        return new RegexTransform(Pattern.compile(regex), replacement);
    }

    @Override
    public TransformResult<Object> transform(Object value, TransformContext context) {
        if (!(value instanceof String s)) return TransformResult.keep(value);
        return TransformResult.keep(pattern.matcher(s).replaceAll(replacement));
    }
}
