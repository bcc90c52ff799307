package com.finsight.model;

import com.finsight.config.PipelineConfigurationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 模块说明：Symbol（class）。
 * 主要职责：规范化后的证券代码，去除首尾空白并转为大写。
 * 使用建议：所有存储键、日志与外部请求都应使用 value 字段，避免再次手工大小写转换。
 */
public final class Symbol implements Comparable<Symbol> {
    private static final Pattern ALLOWED = Pattern.compile("[A-Z0-9.^=-]{1,20}");

    public final String value;

    private Symbol(String value) {
        this.value = value;
    }

    public static Symbol of(String raw) {
        String normalized = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        if (!ALLOWED.matcher(normalized).matches()) {
            throw new PipelineConfigurationException("invalid symbol: '" + (raw == null ? "" : raw) + "'");
        }
        return new Symbol(normalized);
    }

    public static boolean isValid(String raw) {
        String normalized = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        return ALLOWED.matcher(normalized).matches();
    }

    @Override
    public int compareTo(Symbol other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Symbol)) {
            return false;
        }
        return value.equals(((Symbol) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
