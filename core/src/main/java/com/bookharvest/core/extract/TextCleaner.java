package com.bookharvest.core.extract;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 본문 요소 → 정리된 텍스트.
 * 블록 경계/&lt;br&gt;/&lt;hr&gt;에서 줄을 나누고, 사이트 잡음 줄을 걸러낸다.
 */
public final class TextCleaner {

    /** 본문 추출 전에 제거하는 요소 */
    public static final String UNWANTED_SELECTORS = String.join(", ",
            "script", "style", "nav", ".share", ".social", ".ad",
            ".advertisement", ".menu", ".sidebar", ".header", ".footer",
            "button", ".btn", ".input-group", ".modal", "[id*=modal]",
            ".dropdown", ".navbar");

    /** 이 문구가 들어간 줄은 사이트 UI로 보고 버린다. */
    static final List<String> UNWANTED_PHRASES = List.of(
            "للمساهمة في دعم المكتبة الشاملة",
            "حول المشروع",
            "اتصل بنا",
            "الموقع القديم",
            "المكتبة الشاملة",
            "اذهب",
            "بحث في هذا الكتاب",
            "رقم الجزء",
            "مسار الصفحة الحالية",
            "فهرس الكتاب",
            "التشكيل",
            "نسخ الفقرة ورابط لها",
            "إغلاق",
            "btn",
            "fa fa-");

    static final int MIN_LINE_LENGTH = 10;

    private static final Pattern DIGITS_ONLY = Pattern.compile("^[0-9٠-٩]+$");
    private static final Pattern MANY_NEWLINES = Pattern.compile("\n{3,}");

    private TextCleaner() {}

    /** 요소에서 잡음 요소를 지운 뒤 줄 단위 텍스트를 만들어 정리한다. 요소 자체가 수정된다. */
    public static String clean(Element root) {
        root.select(UNWANTED_SELECTORS).remove();
        return cleanLines(toLines(root));
    }

    static String toLines(Element root) {
        StringBuilder sb = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override public void head(Node node, int depth) {
                if (node instanceof TextNode t) {
                    sb.append(t.text());
                } else if (node instanceof Element e && (e.isBlock() || isBreak(e))) {
                    sb.append('\n');
                }
            }
            @Override public void tail(Node node, int depth) {
                if (node instanceof Element e && e.isBlock()) sb.append('\n');
            }
        }, root);
        return sb.toString();
    }

    private static boolean isBreak(Element e) {
        String n = e.normalName();
        return n.equals("br") || n.equals("hr");
    }

    /** 줄 필터: 짧은 줄, 숫자뿐인 줄(쪽 번호), UI 문구 줄 제거. 3개 이상 연속 개행은 2개로. */
    public static String cleanLines(String raw) {
        List<String> kept = new ArrayList<>();
        for (String line : raw.split("\n")) {
            String p = line.strip();
            if (p.length() < MIN_LINE_LENGTH) continue;
            if (DIGITS_ONLY.matcher(p).matches()) continue;
            if (containsUnwanted(p)) continue;
            kept.add(p);
        }
        String joined = String.join("\n", kept);
        return MANY_NEWLINES.matcher(joined).replaceAll("\n\n").strip();
    }

    private static boolean containsUnwanted(String p) {
        for (String phrase : UNWANTED_PHRASES) {
            if (p.contains(phrase)) return true;
        }
        return false;
    }

    static int wordCount(String text) {
        if (text.isBlank()) return 0;
        return text.strip().split("\\s+").length;
    }
}
