package com.bookharvest.core.tier;

import java.util.List;

/** MultiProcess 워커 하나에 배정되는 연속 페이지 구간. */
public final class Shard {
    private final int index;
    private final List<Integer> pages;

    public Shard(int index, List<Integer> pages) {
        if (pages.isEmpty()) throw new IllegalArgumentException("empty shard");
        this.index = index;
        this.pages = List.copyOf(pages);
    }

    public int index() { return index; }
    public List<Integer> pages() { return pages; }
    public int firstPage() { return pages.get(0); }
    public int lastPage() { return pages.get(pages.size() - 1); }
    public int size() { return pages.size(); }

    @Override public String toString() {
        return "Shard#" + index + "[" + firstPage() + ".." + lastPage() + ", n=" + pages.size() + "]";
    }
}
