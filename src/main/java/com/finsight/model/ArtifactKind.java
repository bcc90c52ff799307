package com.finsight.model;

import java.util.Locale;

public enum ArtifactKind {
    RAW,
    PROCESSED,
    FORECAST,
    INSIGHT,
    MODEL,
    NEWS;

    public String segment() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String schema() {
        return "finsight." + segment() + ".v1";
    }

    public static ArtifactKind fromSegment(String segment) {
        return ArtifactKind.valueOf(segment.trim().toUpperCase(Locale.ROOT));
    }
}
