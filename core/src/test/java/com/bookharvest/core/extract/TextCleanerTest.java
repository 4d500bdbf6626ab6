package com.bookharvest.core.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextCleanerTest {

    @Test
    @DisplayName("짧은 줄, 숫자뿐인 줄(아라비아-인도 숫자 포함), UI 문구 줄은 버린다")
    void dropsNoiseLines() {
        String raw = String.join("\n",
                "  هذا سطر طويل بما يكفي ليبقى  ",
                "قصير",
                "123456789012",
                "١٢٣٤٥٦٧٨٩٠١",
                "للمساهمة في دعم المكتبة الشاملة اضغط هنا",
                "<i class=\"fa fa-copy\"></i> copy this",
                "Another line that is long enough");
        assertThat(TextCleaner.cleanLines(raw))
                .isEqualTo("هذا سطر طويل بما يكفي ليبقى\nAnother line that is long enough");
    }

    @Test
    void blankInputGivesEmptyString() {
        assertThat(TextCleaner.cleanLines("\n\n  \n")).isEmpty();
    }

    @Test
    @DisplayName("블록/br 경계에서 줄이 나뉘고 script/style/.share는 제거된다")
    void splitsOnBlocksAndRemovesChrome() {
        Element root = Jsoup.parse("<div id='x'><p>First paragraph text here</p>"
                + "<script>var a = 'should never appear';</script>"
                + "Inline run that continues<br>after a line break here"
                + "<div class='share'>Share this on social media</div></div>").getElementById("x");

        String text = TextCleaner.clean(root);
        assertThat(text.split("\n")).containsExactly(
                "First paragraph text here",
                "Inline run that continues",
                "after a line break here");
    }

    @Test
    void wordCountSplitsOnWhitespace() {
        assertThat(TextCleaner.wordCount("one two\nthree   four")).isEqualTo(4);
        assertThat(TextCleaner.wordCount("   ")).isZero();
    }
}
