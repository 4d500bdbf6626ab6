package com.bookharvest.core.tier.multiprocess;

import java.io.BufferedReader;
import java.io.IOException;

/** 샤드 워커 기동 전략. 운영은 자식 JVM, 테스트는 같은 JVM 안의 파이프. */
public interface ShardWorkerLauncher {

    WorkerHandle launch(ShardAssignment assignment) throws IOException;

    /** 실행 중인 워커 하나 */
    interface WorkerHandle {
        /** 워커 stdout(ShardMessage 줄). EOF = 워커 종료. */
        BufferedReader output();

        /** 종료 코드. 0이 아니면 크래시. */
        int waitFor() throws InterruptedException;

        /** 강제 종료(중지/치명 오류 시) */
        void destroy();
    }
}
