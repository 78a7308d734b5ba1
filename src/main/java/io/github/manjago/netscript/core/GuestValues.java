package io.github.manjago.netscript.core;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Value semantics of the legacy script language and conversion between guest
 * values and plain Java values.
 * <p>
 * Guest values are: {@code null}, {@link Double}, {@link String},
 * {@link Boolean}, {@code List<Object>} (arrays), {@code Map<String, Object>}
 * (objects), {@link Closure} and {@link NativeFunction}. Anything else passes
 * through as an opaque handle.
 */
public final class GuestValues {

    private GuestValues() {
        // Utility class
    }

    // ========== Conversion ==========

    /**
     * Convert a host value into the guest representation, recursively.
     */
    public static Object toGuest(Object value) {
        if (value == null || value instanceof Double || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof CharSequence cs) {
            return cs.toString();
        }
        if (value instanceof Character c) {
            return String.valueOf(c);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> list = new ArrayList<>(collection.size());
            for (Object element : collection) {
                list.add(toGuest(element));
            }
            return list;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(toGuest(Array.get(value, i)));
            }
            return list;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> object = new LinkedHashMap<>();
            map.forEach((k, v) -> object.put(String.valueOf(k), toGuest(v)));
            return object;
        }
        return value;
    }

    /**
     * Convert a guest value into a plain Java value. Arrays and objects are
     * deep-copied so host code never aliases guest state.
     */
    public static Object toNative(Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(toNative(element));
            }
            return copy;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), toNative(v)));
            return copy;
        }
        return value;
    }

    // ========== Coercion ==========

    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Double d) return d != 0.0 && !d.isNaN();
        if (value instanceof String s) return !s.isEmpty();
        return true;
    }

    public static double toNumber(Object value) {
        if (value == null) return 0.0;
        if (value instanceof Double d) return d;
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof Boolean b) return b ? 1.0 : 0.0;
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.isEmpty()) return 0.0;
            try {
                return Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    /**
     * String form used by concatenation and printing: whole numbers print
     * without a fraction, arrays print comma-joined.
     */
    public static String toDisplayString(Object value) {
        if (value == null) return "null";
        if (value instanceof Double d) {
            if (d.isNaN()) return "NaN";
            if (d.isInfinite()) return d > 0 ? "Infinity" : "-Infinity";
            if (d == Math.rint(d) && Math.abs(d) < 1e15) return String.valueOf(d.longValue());
            return String.valueOf(d);
        }
        if (value instanceof List<?> list) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) sb.append(',');
                Object element = list.get(i);
                if (element != null) sb.append(toDisplayString(element));
            }
            return sb.toString();
        }
        if (value instanceof Map<?, ?>) return "[object Object]";
        return String.valueOf(value);
    }

    // ========== Operators ==========

    public static Object binary(String op, Object a, Object b) {
        return switch (op) {
            case "+" -> (a instanceof String || b instanceof String)
                    ? toDisplayString(a) + toDisplayString(b)
                    : toNumber(a) + toNumber(b);
            case "-" -> toNumber(a) - toNumber(b);
            case "*" -> toNumber(a) * toNumber(b);
            case "/" -> toNumber(a) / toNumber(b);
            case "%" -> toNumber(a) % toNumber(b);
            case "==" -> looseEquals(a, b);
            case "!=" -> !looseEquals(a, b);
            case "<" -> compare(a, b, (c) -> c < 0);
            case "<=" -> compare(a, b, (c) -> c <= 0);
            case ">" -> compare(a, b, (c) -> c > 0);
            case ">=" -> compare(a, b, (c) -> c >= 0);
            default -> throw new ScriptRuntimeException("Unknown operator " + op);
        };
    }

    public static Object unary(String op, Object value) {
        return switch (op) {
            case "-" -> -toNumber(value);
            case "+" -> toNumber(value);
            case "!" -> !isTruthy(value);
            default -> throw new ScriptRuntimeException("Unknown operator " + op);
        };
    }

    public static boolean looseEquals(Object a, Object b) {
        if (a == null || b == null) return a == b;
        if (a instanceof Double || b instanceof Double) {
            if (a instanceof List || a instanceof Map || b instanceof List || b instanceof Map) return a == b;
            return toNumber(a) == toNumber(b);
        }
        if (a instanceof String || a instanceof Boolean) return a.equals(b);
        return a == b;
    }

    private static boolean compare(Object a, Object b, Function<Integer, Boolean> test) {
        if (a instanceof String sa && b instanceof String sb) {
            return test.apply(sa.compareTo(sb));
        }
        double x = toNumber(a);
        double y = toNumber(b);
        if (Double.isNaN(x) || Double.isNaN(y)) return false;
        return test.apply(Double.compare(x, y));
    }

    // ========== Properties ==========

    @SuppressWarnings("unchecked")
    public static Object getMember(Object target, String name) {
        if (target instanceof Map<?, ?> map) {
            return ((Map<String, Object>) map).get(name);
        }
        if (target instanceof List<?> list) {
            List<Object> array = (List<Object>) list;
            return switch (name) {
                case "length" -> (double) array.size();
                case "push" -> new Builtin("push", false, args -> {
                    for (Object arg : args) array.add(toGuest(arg));
                    return (double) array.size();
                });
                case "pop" -> new Builtin("pop", false,
                        args -> array.isEmpty() ? null : array.remove(array.size() - 1));
                case "join" -> new Builtin("join", false, args -> join(array, args));
                case "indexOf" -> new Builtin("indexOf", false, args -> indexOf(array, args));
                default -> null;
            };
        }
        if (target instanceof String s) {
            return switch (name) {
                case "length" -> (double) s.length();
                case "toUpperCase" -> new Builtin("toUpperCase", false, args -> s.toUpperCase());
                case "toLowerCase" -> new Builtin("toLowerCase", false, args -> s.toLowerCase());
                default -> null;
            };
        }
        if (target == null) {
            throw new ScriptRuntimeException("TypeError: Cannot read property '" + name + "' of null");
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    public static void setMember(Object target, String name, Object value) {
        if (target instanceof Map<?, ?> map) {
            ((Map<String, Object>) map).put(name, value);
            return;
        }
        throw new ScriptRuntimeException("TypeError: Cannot set property '" + name + "' of " + toDisplayString(target));
    }

    @SuppressWarnings("unchecked")
    public static Object getIndex(Object target, Object key) {
        if (target instanceof List<?> list) {
            if (key instanceof Double d) {
                int index = d.intValue();
                return (index >= 0 && index < list.size() && index == d) ? list.get(index) : null;
            }
            return getMember(target, toDisplayString(key));
        }
        if (target instanceof String s && key instanceof Double d) {
            int index = d.intValue();
            return (index >= 0 && index < s.length()) ? String.valueOf(s.charAt(index)) : null;
        }
        return getMember(target, toDisplayString(key));
    }

    @SuppressWarnings("unchecked")
    public static void setIndex(Object target, Object key, Object value) {
        if (target instanceof List<?> list && key instanceof Double d) {
            List<Object> array = (List<Object>) list;
            int index = d.intValue();
            if (index < 0 || index != d) {
                throw new ScriptRuntimeException("RangeError: Invalid array index " + toDisplayString(key));
            }
            while (array.size() <= index) {
                array.add(null);
            }
            array.set(index, value);
            return;
        }
        setMember(target, toDisplayString(key), value);
    }

    private static String join(List<Object> array, List<Object> args) {
        String separator = args.isEmpty() || args.get(0) == null ? "," : toDisplayString(args.get(0));
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < array.size(); i++) {
            if (i > 0) sb.append(separator);
            if (array.get(i) != null) sb.append(toDisplayString(array.get(i)));
        }
        return sb.toString();
    }

    private static double indexOf(List<Object> array, List<Object> args) {
        Object needle = args.isEmpty() ? null : toGuest(args.get(0));
        for (int i = 0; i < array.size(); i++) {
            if (looseEquals(array.get(i), needle)) return i;
        }
        return -1;
    }

    /**
     * Built-in method of an array or string value.
     */
    record Builtin(String name, boolean isAsync, Function<List<Object>, Object> body) implements NativeFunction {
        @Override
        public Object call(List<Object> args) {
            return body.apply(args);
        }
    }
}
