package org.csu.mathsolve.render;

import java.util.Locale;

/**
 * 调用方可以请求的输出格式
 */
public enum OutputFormat {
    LATEX("latex"),
    MATHML("mathml"),
    PLAIN("plain");

    private final String tag;

    OutputFormat(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * 按标签查找格式，大小写不敏感。标签为空时使用 fallback。
     */
    public static OutputFormat fromTag(String tag, OutputFormat fallback) {
        if (tag == null || tag.isBlank()) {
            return fallback;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (OutputFormat format : values()) {
            if (format.tag.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown output format: '" + tag + "' (expected latex, mathml or plain)");
    }

    public static OutputFormat fromTag(String tag) {
        return fromTag(tag, LATEX);
    }
}
