package com.bookharvest.core.extract;

import com.bookharvest.core.api.IHttpSession;
import com.bookharvest.core.http.RetryPolicy;
import com.bookharvest.core.model.Book;
import com.bookharvest.core.model.FetchOutcome;
import com.bookharvest.core.util.BookIds;
import com.bookharvest.core.util.Sleeper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 책 ID → Book. 1쪽을 받아 페이지 내비게이션 링크에서 전체 쪽수를 알아낸다.
 * "마지막" 링크(>>, », الأخير, آخر)의 쪽 번호 → 없으면 /book/{id}/{n} 링크 최대값 → 없으면 1.
 */
public final class BookResolver {

    private static final Logger LOG = LoggerFactory.getLogger(BookResolver.class);

    private static final Set<String> LAST_LABELS = Set.of(">>", "»", "الأخير", "آخر");

    private final IHttpSession session;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public BookResolver(IHttpSession session, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.session = Objects.requireNonNull(session, "session");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public Book resolve(String rawBookId, String sourceBaseUrl) throws IOException, InterruptedException {
        String id = BookIds.normalize(rawBookId);
        URI first = BookIds.pageUri(sourceBaseUrl, id, 1);

        FetchOutcome outcome;
        int attempt = 1;
        while (true) {
            outcome = session.fetch(first);
            if (!retryPolicy.shouldRetry(outcome, attempt)) break;
            sleeper.sleep(retryPolicy.nextDelay(outcome, attempt));
            attempt++;
        }
        if (!outcome.isOk()) {
            throw new IOException("Cannot resolve book " + id + ": " + outcome.describe());
        }

        int total = discoverTotalPages(id, outcome.getBody(), first.toString());
        LOG.info("Resolved book {}: {} pages", id, total);
        return new Book(id, total, sourceBaseUrl);
    }

    static int discoverTotalPages(String bookId, String html, String baseUri) {
        Document doc = Jsoup.parse(html == null ? "" : html, baseUri);
        Pattern pagePath = Pattern.compile("/book/" + Pattern.quote(bookId) + "/(\\d+)(?:[/?#].*)?$");

        int navMax = 0;
        int anyMax = 0;
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("abs:href");
            if (href.isEmpty()) href = a.attr("href");
            Matcher m = pagePath.matcher(href);
            if (!m.find()) continue;
            int n;
            try {
                n = Integer.parseInt(m.group(1));
            } catch (NumberFormatException tooLong) {
                continue;
            }
            anyMax = Math.max(anyMax, n);
            String label = a.text().strip();
            if (LAST_LABELS.contains(label)) navMax = Math.max(navMax, n);
        }
        if (navMax > 0) return navMax;
        return Math.max(1, anyMax);
    }
}
