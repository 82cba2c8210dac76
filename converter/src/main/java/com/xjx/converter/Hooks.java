package com.xjx.converter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.UnaryOperator;

/** Runs caller hooks best-effort: a null result or a failure keeps the input. */
final class Hooks {
    private static final Logger log = LoggerFactory.getLogger(Hooks.class);

    private Hooks() {
    }

    static <T> T apply(String name, UnaryOperator<T> hook, T input) {
        if (hook == null) return input;
        try {
            T result = hook.apply(input);
            return result == null ? input : result;
        } catch (RuntimeException e) {
            log.warn("Hook '{}' failed, keeping its input: {}", name, e.toString(), e);
            return input;
        }
    }
}
