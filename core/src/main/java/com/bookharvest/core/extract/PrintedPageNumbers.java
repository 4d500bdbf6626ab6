package com.bookharvest.core.extract;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** &lt;title&gt;의 "ص: 12" / "س ١٢" 형태에서 원본 인쇄 쪽수를 뽑는다. */
public final class PrintedPageNumbers {
    private static final Pattern PRINTED = Pattern.compile("[صس]\\s*[:：]?\\s*([0-9٠-٩]+)");

    private PrintedPageNumbers() {}

    /** @return 쪽수, 없으면 null */
    public static Integer fromTitle(String title) {
        if (title == null || title.isBlank()) return null;
        Matcher m = PRINTED.matcher(title);
        if (!m.find()) return null;
        String digits = toWesternDigits(m.group(1));
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException tooLong) {
            return null;
        }
    }

    /** 아라비아-인도 숫자(٠-٩) → 0-9 */
    static String toWesternDigits(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= '٠' && c <= '٩') sb.append((char) ('0' + (c - '٠')));
            else sb.append(c);
        }
        return sb.toString();
    }
}
