package io.veraaws.server.spi;

import io.veraaws.core.ValueTree;

import java.util.Objects;

/**
 * Generic handler outcome. The gateway serializes {@link #body()} according to the service's
 * protocol; for {@link Shape#ERROR} the body carries {@code Code} and {@code Message}.
 */
public record ActionResult(Shape shape, ValueTree.Mapping body) {
    public enum Shape {
        RESULT,
        ERROR
    }

    public ActionResult {
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(body, "body");
    }

    public static ActionResult of(ValueTree.Mapping body) {
        return new ActionResult(Shape.RESULT, body);
    }

    public static ActionResult empty() {
        return new ActionResult(Shape.RESULT, ValueTree.Mapping.empty());
    }

    /** Operations that answer only with a success flag, such as {@code DeleteVpc}. */
    public static ActionResult ok() {
        return of(ValueTree.Mapping.builder().put("return", true).build());
    }

    public static ActionResult error(String code, String message) {
        return new ActionResult(Shape.ERROR, ValueTree.Mapping.builder()
                .put("Code", code)
                .put("Message", message)
                .build());
    }
}
