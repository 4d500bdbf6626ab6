package com.bookharvest.core.extract;

import com.bookharvest.core.api.IHtmlExtractor;
import com.bookharvest.core.model.ExtractedPage;
import com.bookharvest.core.model.ExtractionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** primary 실패(예외 또는 빈 본문) 시 fallback. 둘 다 실패하면 ParseException. */
public final class FallbackHtmlExtractor implements IHtmlExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(FallbackHtmlExtractor.class);

    private final IHtmlExtractor primary;
    private final IHtmlExtractor fallback;

    public FallbackHtmlExtractor(IHtmlExtractor primary, IHtmlExtractor fallback) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    /** useFastParser=false면 관대한 파서 단독 */
    public static IHtmlExtractor forConfig(ExtractionConfig cfg) {
        return cfg.isUseFastParser()
                ? new FallbackHtmlExtractor(new JsoupPageParser(), new LenientPageParser())
                : new LenientPageParser();
    }

    @Override
    public ExtractedPage extract(int pageNumber, String html) throws ParseException {
        String primaryError;
        try {
            ExtractedPage page = primary.extract(pageNumber, html);
            if (hasText(page)) return page;
            primaryError = "empty text";
        } catch (ParseException e) {
            primaryError = e.getMessage();
        }
        LOG.debug("Page {}: primary parser gave up ({}), trying fallback", pageNumber, primaryError);

        try {
            ExtractedPage page = fallback.extract(pageNumber, html);
            if (hasText(page)) return page;
            throw new ParseException("page " + pageNumber + ": both parsers produced empty text");
        } catch (ParseException e) {
            throw new ParseException("page " + pageNumber + ": primary=" + primaryError
                    + ", fallback=" + e.getMessage(), e);
        }
    }

    private static boolean hasText(ExtractedPage page) {
        return page != null && !page.getText().isBlank();
    }
}
