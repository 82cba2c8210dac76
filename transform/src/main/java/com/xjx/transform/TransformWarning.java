package com.xjx.transform;

/** A failure that was recovered from, or a hook that failed, recorded instead of aborting. */
public record TransformWarning(Stage stage, String path, String message) {
    @Override
    public String toString() {
        return stage + " " + path + ": " + message;
    }
}
