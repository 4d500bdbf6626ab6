package com.bookharvest.core.api;

import com.bookharvest.core.model.ExtractedPage;
import com.bookharvest.core.model.PageTask;

/**
 * PARSED 페이지의 다음 목적지. 같은 프로세스에서는 BatchPersister,
 * 샤드 워커 프로세스에서는 부모로 가는 메시지 채널.
 * 버퍼가 차 있으면 블로킹할 수 있다(역압).
 */
@FunctionalInterface
public interface IPageConsumer {
    void accept(PageTask task, ExtractedPage page) throws InterruptedException;
}
