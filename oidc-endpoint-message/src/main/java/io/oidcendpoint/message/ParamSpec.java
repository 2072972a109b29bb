package io.oidcendpoint.message;

import java.util.Objects;

/**
 * Declared type and presence rule of one message parameter.
 */
public record ParamSpec(ParamType type, boolean required) {

    /** Spec applied to parameters a schema does not declare. */
    public static final ParamSpec ANY_OPTIONAL = new ParamSpec(ParamType.ANY, false);

    public ParamSpec {
        Objects.requireNonNull(type, "type");
    }

    public static ParamSpec required(ParamType type) {
        return new ParamSpec(type, true);
    }

    public static ParamSpec optional(ParamType type) {
        return new ParamSpec(type, false);
    }
}
