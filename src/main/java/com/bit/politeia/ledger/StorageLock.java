package com.bit.politeia.ledger;

import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.PoliteiaException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 后端全局写锁：对账本存储的独占访问，限时获取。
 * 获取后立即检查关闭标志；关闭时等待正在执行的持有者完成。
 */
@Slf4j
@Component
public class StorageLock {

    private final ReentrantLock lock = new ReentrantLock();

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    /**
     * 限时获取写锁，返回的句柄必须在 try-with-resources 中释放
     * @throws PoliteiaException BACKEND_BUSY 超时（可重试）；SHUTDOWN_IN_PROGRESS 后端正在关闭
     */
    public Handle acquire(Duration timeout) {
        boolean locked;
        try {
            locked = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PoliteiaException(ErrorType.BACKEND_BUSY, "等待写锁时被中断", e);
        }
        if (!locked) {
            throw new PoliteiaException(ErrorType.BACKEND_BUSY, "获取写锁超时 " + timeout.toMillis() + "ms，请稍后重试");
        }
        if (shutdown.get()) {
            lock.unlock();
            throw new PoliteiaException(ErrorType.SHUTDOWN_IN_PROGRESS, "后端正在关闭，拒绝新的写入");
        }
        return new Handle();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * 置关闭标志并等待当前持有者退出，之后不会再有新的账本写入
     */
    @PreDestroy
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("写锁进入关闭状态，等待进行中的写入完成");
        lock.lock();
        lock.unlock();
        log.info("写锁已关闭");
    }

    /**
     * 锁句柄，close 幂等
     */
    public class Handle implements AutoCloseable {
        private boolean released;

        private Handle() {
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            lock.unlock();
        }
    }
}
