package com.bookharvest.core.support;

/** 가짜 책 리더 페이지 HTML */
public final class FixturePages {
    private FixturePages() {}

    /** div.nass 본문 두 줄 + 인쇄 쪽수 제목. 1쪽에는 마지막 쪽 링크가 붙는다. */
    public static String page(String bookId, int page, int totalPages) {
        StringBuilder sb = new StringBuilder();
        sb.append("<html><head><title>كتاب تجريبي - ص: ").append(page).append("</title></head><body>");
        sb.append("<nav class=\"navbar\">المكتبة الشاملة | حول المشروع</nav>");
        sb.append("<div class=\"nass\">");
        sb.append("<p>").append(expectedFirstLine(page)).append("</p>");
        sb.append("<p>").append(expectedSecondLine(page)).append("</p>");
        sb.append("<p>").append(page).append("</p>");   // 쪽 번호 줄은 정리 단계에서 빠진다
        sb.append("</div>");
        if (page == 1) {
            sb.append("<ul class=\"pagination\">");
            if (totalPages > 1) sb.append("<li><a href=\"/book/").append(bookId).append("/2\">2</a></li>");
            sb.append("<li><a href=\"/book/").append(bookId).append('/').append(totalPages).append("\">&gt;&gt;</a></li>");
            sb.append("</ul>");
        }
        sb.append("</body></html>");
        return sb.toString();
    }

    public static String expectedFirstLine(int page) { return "Fixture page " + page + " opening sentence"; }

    public static String expectedSecondLine(int page) { return "Second paragraph of page " + page + " body"; }

    public static String expectedText(int page) { return expectedFirstLine(page) + "\n" + expectedSecondLine(page); }
}
