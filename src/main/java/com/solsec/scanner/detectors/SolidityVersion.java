package com.solsec.scanner.detectors;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Версия компилятора major.minor, объявленная в pragma
 */
public record SolidityVersion(int major, int minor) implements Comparable<SolidityVersion> {

    private static final Pattern MAJOR_MINOR = Pattern.compile("(\\d+)\\.(\\d+)");
    private static final String PRAGMA_PREFIX = "pragma solidity";

    /**
     * Разбор строки вида "0.8" или "0.8.24". Возвращает null, если версия не читается.
     */
    public static SolidityVersion parse(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = MAJOR_MINOR.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        try {
            return new SolidityVersion(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static boolean isPragma(String trimmed) {
        return trimmed.startsWith(PRAGMA_PREFIX);
    }

    /**
     * "pragma solidity ^0.8.24;" → 0.8; берется первая пара чисел. null если пары нет.
     */
    public static SolidityVersion fromPragma(String trimmed) {
        if (!isPragma(trimmed)) {
            return null;
        }
        return parse(trimmed.substring(PRAGMA_PREFIX.length()));
    }

    public boolean isBefore(SolidityVersion other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(SolidityVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        return Integer.compare(minor, other.minor);
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
