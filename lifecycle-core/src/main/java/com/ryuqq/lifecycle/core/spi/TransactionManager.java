package com.ryuqq.lifecycle.core.spi;

import java.util.function.Supplier;

/**
 * Ambient 트랜잭션 SPI.
 *
 * <p><strong>재진입(re-entrant) 규약:</strong></p>
 * <ul>
 *   <li>가장 바깥 호출만 트랜잭션을 열고 커밋/롤백합니다</li>
 *   <li>중첩 호출은 이미 열린 트랜잭션에 참여합니다</li>
 *   <li>어느 깊이에서든 예외가 전파되면 전체가 롤백되고 예외는 그대로 다시 던져집니다</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface TransactionManager {

    /**
     * 트랜잭션 안에서 작업 실행.
     *
     * @param work 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     */
    <T> T runInTransaction(Supplier<T> work);

    /**
     * 결과 없는 작업 실행.
     *
     * @param work 실행할 작업
     */
    default void runWithoutResult(Runnable work) {
        runInTransaction(() -> {
            work.run();
            return null;
        });
    }

    /**
     * 현재 스레드에 열린 트랜잭션이 있는지.
     *
     * @return 트랜잭션 안이면 true
     */
    boolean isActive();
}
