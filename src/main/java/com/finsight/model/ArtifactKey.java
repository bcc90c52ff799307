package com.finsight.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * 模块说明：ArtifactKey（class）。
 * 主要职责：对象键 {symbol}/{kind}/{version|latest} 的值对象。
 * 使用建议：版本号由运行的 asOf 推导，同一窗口强制重跑时由存储层追加 .1、.2 后缀。
 */
public final class ArtifactKey {
    public static final String LATEST = "latest";
    private static final DateTimeFormatter VERSION_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter VERSION_PARSE = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    public final Symbol symbol;
    public final ArtifactKind kind;
    public final String version;

    public ArtifactKey(Symbol symbol, ArtifactKind kind, String version) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.kind = Objects.requireNonNull(kind, "kind");
        String v = version == null ? "" : version.trim();
        if (v.isEmpty() || v.contains("/")) {
            throw new IllegalArgumentException("invalid artifact version: '" + version + "'");
        }
        this.version = v;
    }

    public static ArtifactKey version(Symbol symbol, ArtifactKind kind, String version) {
        return new ArtifactKey(symbol, kind, version);
    }

    public static ArtifactKey latest(Symbol symbol, ArtifactKind kind) {
        return new ArtifactKey(symbol, kind, LATEST);
    }

    public static String versionFor(Instant asOf) {
        return VERSION_FORMAT.format(asOf);
    }

    /**
     * Run asOf encoded in a version string, ignoring any {@code .N} suffix.
     */
    public static Optional<Instant> asOfOf(String version) {
        if (version == null || version.length() < 16) {
            return Optional.empty();
        }
        try {
            LocalDateTime parsed = LocalDateTime.parse(version.substring(0, 15), VERSION_PARSE);
            return Optional.of(parsed.toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static ArtifactKey parse(String objectKey) {
        String[] parts = objectKey == null ? new String[0] : objectKey.split("/");
        if (parts.length != 3) {
            throw new IllegalArgumentException("invalid artifact key: " + objectKey);
        }
        return new ArtifactKey(Symbol.of(parts[0]), ArtifactKind.fromSegment(parts[1]), parts[2]);
    }

    public boolean isLatest() {
        return LATEST.equals(version);
    }

    public String objectKey() {
        return symbol.value + "/" + kind.segment() + "/" + version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ArtifactKey)) {
            return false;
        }
        ArtifactKey other = (ArtifactKey) o;
        return symbol.equals(other.symbol) && kind == other.kind && version.equals(other.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, kind, version);
    }

    @Override
    public String toString() {
        return objectKey();
    }
}
