package io.b2mash.b2b.gobdvault.audit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * One in-process lock per tenant serializing ledger appends. Locks live in a Caffeine cache with
 * weak values, so idle tenants do not pin a lock forever.
 *
 * <p>When a transaction is active the lock is held until that transaction completes, otherwise
 * the next writer could read a chain head that is not yet committed.
 */
@Component
public class TenantAppendLocks {

  private final Cache<String, ReentrantLock> locks = Caffeine.newBuilder().weakValues().build();

  public <T> T callLocked(String tenantId, Supplier<T> action) {
    ReentrantLock lock = locks.get(tenantId, key -> new ReentrantLock());
    lock.lock();
    boolean releaseDeferred = false;
    try {
      T result = action.get();
      releaseDeferred = releaseAfterCompletion(lock);
      return result;
    } finally {
      if (!releaseDeferred) {
        lock.unlock();
      }
    }
  }

  /** Whether the calling thread currently holds the append lock of {@code tenantId}. */
  public boolean isHeldByCurrentThread(String tenantId) {
    ReentrantLock lock = locks.getIfPresent(tenantId);
    return lock != null && lock.isHeldByCurrentThread();
  }

  private boolean releaseAfterCompletion(ReentrantLock lock) {
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      return false;
    }
    TransactionSynchronizationManager.registerSynchronization(
        new TransactionSynchronization() {
          @Override
          public void afterCompletion(int status) {
            lock.unlock();
          }
        });
    return true;
  }
}
