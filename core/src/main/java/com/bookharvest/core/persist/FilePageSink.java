package com.bookharvest.core.persist;

import com.bookharvest.core.api.IPageSink;
import com.bookharvest.core.model.ExtractedPage;
import com.bookharvest.core.model.ResumeCheckpoint;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * 파일 기반 저장소. 책마다 디렉터리 하나:
 * <pre>
 *   {root}/{bookId}/batch-000001.ndjson[.gz]   ← 커밋된 배치(한 줄 = 페이지 JSON)
 *   {root}/{bookId}/checkpoint.yml             ← 마지막 체크포인트
 * </pre>
 * 배치 파일을 임시 이름으로 쓰고 원자적 이동 → 그 다음 체크포인트 교체.
 * 체크포인트 교체가 실패하면 옮긴 배치 파일을 지우고 예외를 던진다.
 * 둘 사이에서 프로세스가 죽으면 체크포인트가 실제보다 낮게 남을 뿐 높게 남지는 않는다.
 */
public final class FilePageSink implements IPageSink {

    private static final Logger LOG = LoggerFactory.getLogger(FilePageSink.class);
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();
    private static final Pattern BATCH_FILE = Pattern.compile("^batch-(\\d{6,})\\.ndjson(\\.gz)?$");
    static final String CHECKPOINT_FILE = "checkpoint.yml";

    private final Path root;
    private final boolean compress;

    private String openBook;                       // 열린 배치의 책, 없으면 null
    private final List<ExtractedPage> pending = new ArrayList<>();

    public FilePageSink(Path root, boolean compress) {
        this.root = Objects.requireNonNull(root, "root");
        this.compress = compress;
    }

    @Override
    public synchronized void beginBatch(String bookId) throws IOException {
        if (openBook != null) throw new IllegalStateException("batch already open for book " + openBook);
        Files.createDirectories(bookDir(bookId));
        openBook = bookId;
        pending.clear();
    }

    @Override
    public synchronized void append(ExtractedPage page) {
        requireOpen();
        pending.add(Objects.requireNonNull(page, "page"));
    }

    @Override
    public synchronized void commit(ResumeCheckpoint checkpoint) throws IOException {
        requireOpen();
        if (!openBook.equals(checkpoint.getBookId())) {
            throw new IllegalArgumentException("checkpoint is for " + checkpoint.getBookId() + ", batch is for " + openBook);
        }
        Path dir = bookDir(openBook);
        int seq = lastBatchNumber(dir) + 1;
        Path target = dir.resolve(String.format("batch-%06d.ndjson%s", seq, compress ? ".gz" : ""));
        Path tmp = dir.resolve(target.getFileName() + ".tmp");
        try {
            try (Writer w = openWriter(tmp)) {
                for (ExtractedPage p : pending) {
                    w.write(GSON.toJson(p));
                    w.write('\n');
                }
            }
            move(tmp, target);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        try {
            writeCheckpoint(dir, checkpoint, seq);
        } catch (IOException e) {
            // 체크포인트 없이 배치만 남기면 안 된다: 배치도 되돌린다
            try {
                Files.deleteIfExists(target);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            LOG.warn("Checkpoint write failed for book {}, discarded {}: {}", openBook, target.getFileName(), e.toString());
            throw e;
        }
        LOG.debug("Committed {} ({} pages)", target, pending.size());
        openBook = null;
        pending.clear();
    }

    @Override
    public synchronized void rollback() {
        openBook = null;
        pending.clear();
    }

    @Override
    public synchronized OptionalInt lastCheckpoint(String bookId) throws IOException {
        Map<?, ?> cp = readCheckpoint(bookDir(bookId));
        if (cp == null) return OptionalInt.empty();
        Object page = cp.get("page");
        if (page instanceof Number n) return OptionalInt.of(n.intValue());
        throw new IOException("checkpoint for book " + bookId + " has no numeric 'page'");
    }

    /** 저장된 페이지 전체(쪽 번호순). 같은 쪽이 여러 번 있으면 나중 배치가 이긴다. */
    public synchronized List<ExtractedPage> readPages(String bookId) throws IOException {
        Path dir = bookDir(bookId);
        TreeMap<Integer, ExtractedPage> byPage = new TreeMap<>();
        for (Path batch : batchFiles(dir).values()) {
            try (BufferedReader r = new BufferedReader(openReader(batch))) {
                String line;
                while ((line = r.readLine()) != null) {
                    if (line.isBlank()) continue;
                    ExtractedPage p;
                    try {
                        p = GSON.fromJson(line, ExtractedPage.class);
                    } catch (JsonParseException e) {
                        throw new IOException("corrupt record in " + batch + ": " + e.getMessage(), e);
                    }
                    byPage.put(p.getPageNumber(), p);
                }
            }
        }
        return new ArrayList<>(byPage.values());
    }

    public synchronized int batchCount(String bookId) throws IOException {
        return batchFiles(bookDir(bookId)).size();
    }

    public Path bookDir(String bookId) {
        return root.resolve(bookId);
    }

    // ------------ helpers ------------

    private void requireOpen() {
        if (openBook == null) throw new IllegalStateException("no open batch");
    }

    private Writer openWriter(Path file) throws IOException {
        OutputStream out = Files.newOutputStream(file);
        if (compress) out = new GZIPOutputStream(out);
        return new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    private static Reader openReader(Path file) throws IOException {
        InputStream in = Files.newInputStream(file);
        if (file.getFileName().toString().endsWith(".gz")) in = new GZIPInputStream(in);
        return new InputStreamReader(in, StandardCharsets.UTF_8);
    }

    /** 번호순 배치 파일 */
    private static TreeMap<Integer, Path> batchFiles(Path dir) throws IOException {
        TreeMap<Integer, Path> out = new TreeMap<>();
        if (!Files.isDirectory(dir)) return out;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, "batch-*")) {
            for (Path p : ds) {
                Matcher m = BATCH_FILE.matcher(p.getFileName().toString());
                if (m.matches()) out.put(Integer.parseInt(m.group(1)), p);
            }
        }
        return out;
    }

    private static int lastBatchNumber(Path dir) throws IOException {
        TreeMap<Integer, Path> files = batchFiles(dir);
        return files.isEmpty() ? 0 : files.lastKey();
    }

    private void writeCheckpoint(Path dir, ResumeCheckpoint cp, int lastBatch) throws IOException {
        // 저장소 수준에서도 감소 금지
        int page = cp.getHighestContiguousPersistedPage();
        Map<?, ?> existing = readCheckpoint(dir);
        if (existing != null && existing.get("page") instanceof Number n && n.intValue() > page) {
            LOG.warn("Refusing to lower checkpoint for book {} from {} to {}", cp.getBookId(), n.intValue(), page);
            page = n.intValue();
        }

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("bookId", cp.getBookId());
        doc.put("page", page);
        doc.put("timestamp", cp.getTimestamp().toString());
        doc.put("lastBatch", lastBatch);

        DumperOptions opts = new DumperOptions();
        opts.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        String yaml = new Yaml(opts).dump(doc);

        Path target = dir.resolve(CHECKPOINT_FILE);
        Path tmp = dir.resolve(CHECKPOINT_FILE + ".tmp");
        try {
            Files.writeString(tmp, yaml, StandardCharsets.UTF_8);
            move(tmp, target);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private static Map<?, ?> readCheckpoint(Path dir) throws IOException {
        Path f = dir.resolve(CHECKPOINT_FILE);
        if (!Files.exists(f)) return null;
        try (InputStream in = Files.newInputStream(f)) {
            Object doc = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
            if (doc instanceof Map<?, ?> m) return m;
            throw new IOException("malformed checkpoint file: " + f);
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported on this filesystem, falling back: {}", e.getMessage());
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
