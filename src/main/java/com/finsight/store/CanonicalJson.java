package com.finsight.store;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Serializes org.json values with sorted object keys so equal payloads produce identical bytes.
 */
public final class CanonicalJson {
    private CanonicalJson() {
    }

    public static String write(Object value) {
        StringBuilder sb = new StringBuilder(1024);
        append(sb, value);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Object value) {
        if (value == null || JSONObject.NULL.equals(value)) {
            sb.append("null");
        } else if (value instanceof JSONObject) {
            JSONObject obj = (JSONObject) value;
            List<String> keys = new ArrayList<>(obj.keySet());
            Collections.sort(keys);
            sb.append('{');
            boolean first = true;
            for (String key : keys) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                sb.append(JSONObject.quote(key)).append(':');
                append(sb, obj.opt(key));
            }
            sb.append('}');
        } else if (value instanceof JSONArray) {
            JSONArray arr = (JSONArray) value;
            sb.append('[');
            for (int i = 0; i < arr.length(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                append(sb, arr.opt(i));
            }
            sb.append(']');
        } else if (value instanceof Number) {
            sb.append(JSONObject.numberToString((Number) value));
        } else if (value instanceof Boolean) {
            sb.append(value);
        } else {
            sb.append(JSONObject.quote(value.toString()));
        }
    }
}
