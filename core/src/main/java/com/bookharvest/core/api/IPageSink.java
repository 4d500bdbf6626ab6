package com.bookharvest.core.api;

import com.bookharvest.core.model.ExtractedPage;
import com.bookharvest.core.model.ResumeCheckpoint;

import java.io.IOException;
import java.util.OptionalInt;

/**
 * 페이지 저장소 계약(파일/압축 아카이브/DB 등).
 * beginBatch → append* → commit 이 하나의 원자 단위. commit이 예외를 던지면 아무것도 반영되지 않은 것으로 본다.
 */
public interface IPageSink {

    void beginBatch(String bookId) throws IOException;

    void append(ExtractedPage page) throws IOException;

    /** 배치와 함께 이 배치가 참으로 만드는 체크포인트를 기록. */
    void commit(ResumeCheckpoint checkpoint) throws IOException;

    /** 진행 중 배치 폐기. 열린 배치가 없으면 no-op. */
    void rollback();

    OptionalInt lastCheckpoint(String bookId) throws IOException;
}
