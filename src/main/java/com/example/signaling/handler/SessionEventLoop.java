package com.example.signaling.handler;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 단일 스레드 이벤트 루프
 *
 * <p>연결/메시지/종료/오류 이벤트를 도착 순서대로 하나씩 끝까지 실행한다.
 * 레지스트리 변경은 모두 이 스레드에서만 일어나므로 별도의 락이 필요 없다.</p>
 */
@Component
public class SessionEventLoop {

    private static final Logger log = LoggerFactory.getLogger(SessionEventLoop.class);

    private volatile Thread loopThread;

    private final ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "session-event-loop");
        thread.setDaemon(true);
        loopThread = thread;
        return thread;
    });

    /**
     * 이벤트를 큐에 넣는다. 처리 중 예외는 로그만 남기고 루프는 계속 돈다.
     */
    public void execute(Runnable event) {
        executor.execute(() -> {
            try {
                event.run();
            } catch (RuntimeException e) {
                log.error("이벤트 처리 에러", e);
            }
        });
    }

    /**
     * 루프 스레드에서 작업을 실행하고 결과를 기다린다 (조회 API 용).
     */
    public <T> T call(Callable<T> task) {
        if (Thread.currentThread() == loopThread) {
            try {
                return task.call();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }
        Future<T> future = executor.submit(task);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for event loop", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException(e.getCause());
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("이벤트 루프 종료");
    }
}
