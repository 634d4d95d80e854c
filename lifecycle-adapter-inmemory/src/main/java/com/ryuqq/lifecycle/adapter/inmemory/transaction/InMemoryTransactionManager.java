package com.ryuqq.lifecycle.adapter.inmemory.transaction;

import com.ryuqq.lifecycle.adapter.inmemory.store.InMemoryRosterStore;
import com.ryuqq.lifecycle.core.spi.TransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * 스냅샷 기반 트랜잭션 관리자.
 *
 * <p>각 {@link #runInTransaction} 호출은 진입 시 저장소 스냅샷을 뜨고, 작업이 예외로
 * 끝나면 스냅샷으로 되돌린 뒤 예외를 다시 던집니다. 중첩 호출은 같은 스레드의
 * 바깥 트랜잭션에 참여하며 savepoint처럼 자기 범위만 되돌립니다.</p>
 *
 * <p><strong>제약:</strong></p>
 * <ul>
 *   <li>트랜잭션 깊이는 ThreadLocal로 추적</li>
 *   <li>격리 수준 없음 (다른 스레드의 변경이 보임)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class InMemoryTransactionManager implements TransactionManager {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTransactionManager.class);

    private final InMemoryRosterStore store;
    private final ThreadLocal<Integer> depth = ThreadLocal.withInitial(() -> 0);
    private int commitCount;
    private int rollbackCount;

    public InMemoryTransactionManager(InMemoryRosterStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public <T> T runInTransaction(Supplier<T> work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        int outer = depth.get();
        InMemoryRosterStore.Snapshot savepoint = store.snapshot();
        depth.set(outer + 1);
        try {
            T result = work.get();
            if (outer == 0) {
                commitCount++;
            }
            return result;
        } catch (RuntimeException | Error e) {
            store.restore(savepoint);
            if (outer == 0) {
                rollbackCount++;
            }
            log.debug("Rolled back transaction at depth {}: {}", outer + 1, e.toString());
            throw e;
        } finally {
            if (outer == 0) {
                depth.remove();
            } else {
                depth.set(outer);
            }
        }
    }

    @Override
    public boolean isActive() {
        return depth.get() > 0;
    }

    public int commitCount() {
        return commitCount;
    }

    public int rollbackCount() {
        return rollbackCount;
    }
}
