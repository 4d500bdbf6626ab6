package com.bookharvest.core.tier.multiprocess;

import com.bookharvest.core.model.ExtractedPage;
import com.bookharvest.core.model.FailureKind;
import com.bookharvest.core.model.PageMetadata;

/** 워커 → 부모 stdout 한 줄 메시지. */
public final class ShardMessage {

    public enum Type { PAGE, FAILED, DONE }

    private Type type;
    private int shard;
    private int pageNumber;
    private int attempts;
    private String text;
    private PageMetadata metadata;
    private FailureKind failureKind;
    private String error;
    private String fatal;     // DONE: 워커가 치명 사유로 멈췄으면 그 사유

    private ShardMessage() {}

    public static ShardMessage page(int shard, ExtractedPage page, int attempts) {
        ShardMessage m = new ShardMessage();
        m.type = Type.PAGE;
        m.shard = shard;
        m.pageNumber = page.getPageNumber();
        m.attempts = attempts;
        m.text = page.getText();
        m.metadata = page.getMetadata();
        return m;
    }

    public static ShardMessage failed(int shard, int pageNumber, FailureKind kind, String error, int attempts) {
        ShardMessage m = new ShardMessage();
        m.type = Type.FAILED;
        m.shard = shard;
        m.pageNumber = pageNumber;
        m.failureKind = kind;
        m.error = error;
        m.attempts = attempts;
        return m;
    }

    public static ShardMessage done(int shard, String fatalReason) {
        ShardMessage m = new ShardMessage();
        m.type = Type.DONE;
        m.shard = shard;
        m.fatal = fatalReason;
        return m;
    }

    public Type type() { return type; }
    public int shard() { return shard; }
    public int pageNumber() { return pageNumber; }
    public int attempts() { return attempts; }
    public FailureKind failureKind() { return failureKind; }
    public String error() { return error; }
    public String fatal() { return fatal; }

    public ExtractedPage toPage() {
        return new ExtractedPage(pageNumber, text, metadata);
    }

    @Override public String toString() {
        return "ShardMessage{" + type + ", shard=" + shard + (type == Type.DONE ? "" : ", page=" + pageNumber) + "}";
    }
}
