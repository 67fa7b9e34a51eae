package com.patina.orchestrator.sandbox.worker;

import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.model.Budget;
import org.graalvm.polyglot.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts script values to plain Java data at the host boundary and
 * enforces size limits on everything that crosses it.
 *
 * Only JSON-shaped data crosses: null, booleans, numbers, strings, arrays
 * and plain objects. Functions and host objects are rejected.
 */
public final class ValueGuard {

    /** A value crossing the boundary broke a size limit. */
    public static final class LimitExceeded extends RuntimeException {
        private final String code;

        LimitExceeded(String code, String message) {
            super(message);
            this.code = code;
        }

        public String code() { return code; }
    }

    private static final int MAX_NESTING = 64;

    private final int maxCollectionSize;
    private final int maxStringLength;

    public ValueGuard(Budget budget) {
        this.maxCollectionSize = budget.maxCollectionSize();
        this.maxStringLength   = budget.maxStringLength();
    }

    public Object toJava(Value value) {
        return toJava(value, 0);
    }

    /** Check plain Java data (tool results, input) against the same limits. */
    public Object check(Object value) {
        check(value, 0);
        return value;
    }

    private Object toJava(Value v, int depth) {
        if (depth > MAX_NESTING) {
            throw new LimitExceeded(ErrorCodes.COLLECTION_LIMIT, "value nested deeper than " + MAX_NESTING);
        }
        if (v == null || v.isNull()) {
            return null;
        }
        if (v.isBoolean()) {
            return v.asBoolean();
        }
        if (v.isNumber()) {
            return v.fitsInLong() ? (Object) v.asLong() : (Object) v.asDouble();
        }
        if (v.isString()) {
            return string(v.asString());
        }
        if (v.canExecute() || v.isHostObject()) {
            throw new IllegalArgumentException("functions and host objects cannot leave the sandbox");
        }
        if (v.hasArrayElements()) {
            long size = v.getArraySize();
            collection(size);
            List<Object> list = new ArrayList<>((int) size);
            for (long i = 0; i < size; i++) {
                list.add(toJava(v.getArrayElement(i), depth + 1));
            }
            return list;
        }
        if (v.hasMembers()) {
            var keys = v.getMemberKeys();
            collection(keys.size());
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : keys) {
                Value member = v.getMember(key);
                if (member != null && member.canExecute()) {
                    continue;
                }
                map.put(string(key), toJava(member, depth + 1));
            }
            return map;
        }
        return string(v.toString());
    }

    private void check(Object value, int depth) {
        if (depth > MAX_NESTING) {
            throw new LimitExceeded(ErrorCodes.COLLECTION_LIMIT, "value nested deeper than " + MAX_NESTING);
        }
        if (value instanceof String s) {
            string(s);
        } else if (value instanceof Map<?, ?> m) {
            collection(m.size());
            for (Map.Entry<?, ?> e : m.entrySet()) {
                string(String.valueOf(e.getKey()));
                check(e.getValue(), depth + 1);
            }
        } else if (value instanceof List<?> l) {
            collection(l.size());
            for (Object o : l) {
                check(o, depth + 1);
            }
        }
    }

    private String string(String s) {
        if (s.length() > maxStringLength) {
            throw new LimitExceeded(ErrorCodes.COLLECTION_LIMIT,
                    "string of " + s.length() + " characters exceeds " + maxStringLength);
        }
        return s;
    }

    private void collection(long size) {
        if (size > maxCollectionSize) {
            throw new LimitExceeded(ErrorCodes.COLLECTION_LIMIT,
                    "collection of " + size + " entries exceeds " + maxCollectionSize);
        }
    }
}
