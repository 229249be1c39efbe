package com.example.signaling.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.AlternativeJdkIdGenerator;
import org.springframework.util.IdGenerator;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 시그널링 코어가 공유하는 빈 (시계, ID 생성기, 전송 스레드 풀)
 */
@Configuration
public class SignalingConfig {

    @Value("${signaling.delivery.threads:4}")
    private int deliveryThreads;

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public IdGenerator idGenerator() {
        return new AlternativeJdkIdGenerator();
    }

    /**
     * 연결별 송신 큐를 비우는 스레드 풀
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService deliveryExecutor() {
        AtomicInteger sequence = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, deliveryThreads), runnable -> {
            Thread thread = new Thread(runnable, "signaling-delivery-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
