package com.xjx.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

final class Codes {
    private Codes() {
    }

    static <E extends Enum<E>> E fromCode(Class<E> type, E[] values, String code, Function<E, String> codeOf) {
        if (code == null) throw new IllegalArgumentException(type.getSimpleName() + " code must not be null");
        String wanted = code.trim().toLowerCase(Locale.ROOT);
        for (E e : values) {
            if (codeOf.apply(e).equals(wanted)) return e;
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " '" + code + "'. Legal values: "
                + Arrays.stream(values).map(codeOf).collect(Collectors.joining(", ")));
    }
}
