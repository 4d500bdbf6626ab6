package com.bookharvest.core.extract;

import com.bookharvest.core.model.ExtractedPage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JsoupPageParser: 알려진 본문 컨테이너만")
class JsoupPageParserTest {

    private final JsoupPageParser parser = new JsoupPageParser();

    @Test
    @DisplayName("div.nass 본문 + 인쇄 쪽수 + 잡음 제거")
    void extractsNassContainer() throws Exception {
        ExtractedPage page = parser.extract(12, Fixtures.html("page-nass.html"));

        assertThat(page.getPageNumber()).isEqualTo(12);
        assertThat(page.getText().split("\n")).containsExactly(
                "حدثنا الحميدي عبد الله بن الزبير قال حدثنا سفيان",
                "قال حدثنا يحيى بن سعيد الأنصاري قال أخبرني محمد بن إبراهيم التيمي",
                "أنه سمع علقمة بن وقاص الليثي يقول");
        assertThat(page.getText()).doesNotContain("نسخ الفقرة", "فيسبوك", "حول المشروع", "فهرس الكتاب");
        assertThat(page.getMetadata().getParser()).isEqualTo(JsoupPageParser.NAME);
        assertThat(page.getMetadata().getContentSelector()).isEqualTo("div.nass");
        assertThat(page.getMetadata().getPrintedPageNumber()).isEqualTo(12);
        assertThat(page.getMetadata().getCharCount()).isEqualTo(page.getText().length());
        assertThat(page.getMetadata().getWordCount()).isGreaterThan(10);
    }

    @Test
    void selectorPriorityFollowsDeclaredOrder() throws Exception {
        String html = "<html><body><main><p>Main region text that is long</p></main>"
                + "<article><p>Article region text that is long</p></article></body></html>";
        ExtractedPage page = parser.extract(1, html);
        assertThat(page.getMetadata().getContentSelector()).isEqualTo("article");
        assertThat(page.getText()).isEqualTo("Article region text that is long");
    }

    @Test
    void emptyContainerFallsThroughToNextSelector() throws Exception {
        String html = "<html><body><div class='nass'><p>short</p></div>"
                + "<div class='page-content'><p>The real content of the page</p></div></body></html>";
        ExtractedPage page = parser.extract(2, html);
        assertThat(page.getMetadata().getContentSelector()).isEqualTo(".page-content");
    }

    @Test
    void unknownLayoutIsParseException() {
        assertThatThrownBy(() -> parser.extract(3, Fixtures.html("page-unstructured.html")))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("page 3");
        assertThatThrownBy(() -> parser.extract(3, "  "))
                .isInstanceOf(ParseException.class);
    }
}
