package io.oidcendpoint.message;

import io.oidcendpoint.json.spi.JsonCodecs;
import io.oidcendpoint.json.spi.JsonException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Value types a message parameter can be declared with.
 *
 * <p>Urlencoded input only carries strings, so every type knows how to coerce a string (or a
 * list of strings, for repeated parameters) into its Java representation.
 */
public enum ParamType {
    STRING {
        @Override
        Object coerce(String name, Object value) {
            if (value instanceof CharSequence s) return s.toString();
            if (value instanceof List<?> list) {
                if (list.size() == 1 && list.get(0) instanceof CharSequence s) return s.toString();
                throw new MessageException.InvalidValue("Too many values for '" + name + "'");
            }
            throw invalid(name, value);
        }
    },
    /** JSON array of strings; space separated on the urlencoded wire. */
    STRING_LIST {
        @Override
        Object coerce(String name, Object value) {
            if (value instanceof CharSequence s) {
                List<String> out = new ArrayList<>();
                for (String part : s.toString().split(" ")) {
                    if (!part.isEmpty()) out.add(part);
                }
                return List.copyOf(out);
            }
            if (value instanceof Collection<?> c) {
                List<String> out = new ArrayList<>(c.size());
                for (Object o : c) {
                    if (!(o instanceof CharSequence s)) throw invalid(name, value);
                    out.add(s.toString());
                }
                return List.copyOf(out);
            }
            throw invalid(name, value);
        }

        @Override
        String toFormValue(Object value) {
            if (value instanceof Collection<?> c) {
                StringBuilder sb = new StringBuilder();
                for (Object o : c) {
                    if (sb.length() > 0) sb.append(' ');
                    sb.append(o);
                }
                return sb.toString();
            }
            return super.toFormValue(value);
        }
    },
    INTEGER {
        @Override
        Object coerce(String name, Object value) {
            Object single = single(name, value);
            if (single instanceof Integer || single instanceof Long || single instanceof Short) {
                return ((Number) single).longValue();
            }
            try {
                if (single instanceof BigInteger b) return b.longValueExact();
                if (single instanceof BigDecimal b) return b.longValueExact();
            } catch (ArithmeticException e) {
                throw invalid(name, value);
            }
            if (single instanceof Number n) {
                double d = n.doubleValue();
                // 2^63 itself is out of range for long
                if (d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63) return (long) d;
                throw invalid(name, value);
            }
            if (single instanceof CharSequence s) {
                try {
                    return Long.parseLong(s.toString().trim());
                } catch (NumberFormatException e) {
                    throw invalid(name, value);
                }
            }
            throw invalid(name, value);
        }
    },
    BOOLEAN {
        @Override
        Object coerce(String name, Object value) {
            Object single = single(name, value);
            if (single instanceof Boolean b) return b;
            if (single instanceof CharSequence s) {
                String v = s.toString().trim().toLowerCase(Locale.ROOT);
                if (v.equals("true")) return Boolean.TRUE;
                if (v.equals("false")) return Boolean.FALSE;
            }
            throw invalid(name, value);
        }
    },
    /** JSON object; serialized JSON text on the urlencoded wire. */
    OBJECT {
        @Override
        Object coerce(String name, Object value) {
            Object single = single(name, value);
            if (single instanceof Map<?, ?>) return single;
            if (single instanceof CharSequence s) {
                try {
                    return JsonCodecs.defaultCodec().readMap(s.toString());
                } catch (JsonException e) {
                    throw new MessageException.InvalidValue("'" + name + "' is not a JSON object");
                }
            }
            throw invalid(name, value);
        }

        @Override
        String toFormValue(Object value) {
            if (value instanceof Map<?, ?>) {
                try {
                    return JsonCodecs.defaultCodec().writeString(value);
                } catch (JsonException e) {
                    throw new IllegalStateException("Cannot serialize parameter value", e);
                }
            }
            return super.toFormValue(value);
        }
    },
    ANY {
        @Override
        Object coerce(String name, Object value) {
            return value;
        }

        @Override
        String toFormValue(Object value) {
            if (value instanceof Collection<?>) return STRING_LIST.toFormValue(value);
            if (value instanceof Map<?, ?>) return OBJECT.toFormValue(value);
            return super.toFormValue(value);
        }
    };

    /**
     * Converts a decoded value to this type's Java representation.
     *
     * @throws MessageException.InvalidValue if the value cannot be represented
     */
    abstract Object coerce(String name, Object value);

    /** Renders a value for the urlencoded wire. */
    String toFormValue(Object value) {
        return String.valueOf(value);
    }

    private static Object single(String name, Object value) {
        if (value instanceof List<?> list) {
            if (list.size() == 1) return list.get(0);
            throw new MessageException.InvalidValue("Too many values for '" + name + "'");
        }
        return value;
    }

    MessageException.InvalidValue invalid(String name, Object value) {
        return new MessageException.InvalidValue(
                "Value '" + value + "' of '" + name + "' is not a valid " + name().toLowerCase(Locale.ROOT).replace('_', ' '));
    }
}
