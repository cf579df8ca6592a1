package com.ryuqq.world.adapter.runner;

import com.ryuqq.world.application.heartbeat.Heartbeat;
import com.ryuqq.world.core.statemachine.HeartbeatState;
import com.ryuqq.world.core.statemachine.HeartbeatTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ScheduledExecutorService 기반 Heartbeat 구현체.
 *
 * <p>전용 daemon 스레드 하나에서 tick callback을 고정 주기로 실행합니다.
 * 스레드가 하나이므로 tick은 절대 겹치지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. start(tick): UNINITIALIZED → SCHEDULED
 *    - 초기 지연 계산 (phaseAligned: 다음 주기 경계, 아니면 한 주기)
 *    - scheduleAtFixedRate(tick, initialDelay, periodMs)
 * 2. 첫 tick: SCHEDULED → TICKING
 * 3. 매 tick: callback 실행, 예외 발생 시 로깅 후 계속 진행
 * 4. stop(): → STOPPED, 진행 중 tick 완료 대기 (shutdownTimeoutMs), 초과 시 강제 종료
 * </pre>
 *
 * <p><strong>실패 경계:</strong></p>
 * <ul>
 *   <li>callback이 던진 Throwable은 ERROR로 로깅되고 실패 카운트에 반영</li>
 *   <li>예외가 executor까지 전파되면 이후 tick이 모두 취소되므로 반드시 여기서 처리</li>
 * </ul>
 *
 * @author World Team
 * @since 1.0.0
 */
public final class ScheduledHeartbeat implements Heartbeat {

    private static final Logger log = LoggerFactory.getLogger(ScheduledHeartbeat.class);

    private final HeartbeatConfig config;
    private final PhaseAlignedDelayCalculator delayCalculator;
    private final AtomicReference<HeartbeatState> state = new AtomicReference<>(HeartbeatState.UNINITIALIZED);
    private final AtomicLong tickCount = new AtomicLong();
    private final AtomicLong failedTickCount = new AtomicLong();
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService executor;

    /**
     * 시스템 UTC 시계로 생성.
     *
     * @param config heartbeat 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ScheduledHeartbeat(HeartbeatConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * 커스텀 시계로 생성.
     *
     * @param config heartbeat 설정
     * @param clock 주기 경계 계산에 사용할 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ScheduledHeartbeat(HeartbeatConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.delayCalculator = new PhaseAlignedDelayCalculator(config.periodMs(), clock);
    }

    @Override
    public void start(Runnable tick) {
        if (tick == null) {
            throw new IllegalArgumentException("tick cannot be null");
        }

        synchronized (lifecycleLock) {
            HeartbeatTransition.validate(state.get(), HeartbeatState.SCHEDULED);

            long initialDelayMs = config.phaseAligned()
                ? delayCalculator.calculate()
                : config.periodMs();

            state.set(HeartbeatState.SCHEDULED);
            executor = Executors.newSingleThreadScheduledExecutor(this::newTimerThread);
            executor.scheduleAtFixedRate(
                () -> fire(tick),
                initialDelayMs,
                config.periodMs(),
                TimeUnit.MILLISECONDS
            );

            log.info("Heartbeat scheduled: period={}ms, first tick in {}ms, thread={}",
                config.periodMs(), initialDelayMs, config.threadName());
        }
    }

    /**
     * 단일 tick 실행 (실패 경계).
     *
     * @param tick callback
     */
    private void fire(Runnable tick) {
        if (state.compareAndSet(HeartbeatState.SCHEDULED, HeartbeatState.TICKING)) {
            log.debug("Heartbeat entered {}", HeartbeatState.TICKING);
        } else if (state.get() == HeartbeatState.STOPPED) {
            return;
        }

        try {
            tick.run();
        } catch (Throwable t) {
            failedTickCount.incrementAndGet();
            log.error("Heartbeat tick #{} failed", tickCount.get() + 1, t);
        } finally {
            tickCount.incrementAndGet();
        }
    }

    @Override
    public void stop() {
        ScheduledExecutorService running;
        synchronized (lifecycleLock) {
            HeartbeatState current = state.get();
            if (current == HeartbeatState.STOPPED) {
                return;
            }
            state.set(HeartbeatTransition.transition(current, HeartbeatState.STOPPED));
            running = current.isRunning() ? executor : null;
        }

        if (running == null) {
            log.info("Heartbeat stopped before it was started");
            return;
        }

        running.shutdown();
        try {
            if (!running.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Heartbeat tick still running after {}ms, forcing shutdown",
                    config.shutdownTimeoutMs());
                running.shutdownNow();
            }
        } catch (InterruptedException e) {
            running.shutdownNow();
            Thread.currentThread().interrupt();
        }

        log.info("Heartbeat stopped after {} ticks ({} failed)", tickCount.get(), failedTickCount.get());
    }

    @Override
    public HeartbeatState getState() {
        return state.get();
    }

    @Override
    public long getTickCount() {
        return tickCount.get();
    }

    @Override
    public long getFailedTickCount() {
        return failedTickCount.get();
    }

    /**
     * 설정 조회.
     *
     * @return heartbeat 설정
     */
    public HeartbeatConfig getConfig() {
        return config;
    }

    private Thread newTimerThread(Runnable runnable) {
        Thread thread = new Thread(runnable, config.threadName());
        thread.setDaemon(true);
        return thread;
    }
}
