package com.example.SmartNews.worker;

import com.example.SmartNews.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Fair semaphore bounding how many tasks download and transform at once.
 * Waiters are served in arrival order.
 */
@Component
public class TaskProcessingLock {
    private static final Logger logger = LoggerFactory.getLogger(TaskProcessingLock.class);

    private final Semaphore permits;
    private final int maxPermits;
    private final long timeoutMinutes;

    @Autowired
    public TaskProcessingLock(AppProperties properties) {
        this(properties.getTasks().getMaxConcurrent(), properties.getTasks().getLockTimeoutMinutes());
    }

    public TaskProcessingLock(int maxPermits, long timeoutMinutes) {
        if (maxPermits < 1) {
            throw new IllegalArgumentException("At least one processing permit is required");
        }
        this.maxPermits = maxPermits;
        this.timeoutMinutes = timeoutMinutes;
        this.permits = new Semaphore(maxPermits, true);
    }

    /**
     * Blocks until a permit is free or the timeout passes.
     *
     * @return true if the permit was acquired; the caller must then {@link #release(String)} it in a finally block
     */
    public boolean acquire(String taskId) {
        try {
            int waiting = permits.getQueueLength();
            if (waiting > 0) {
                logger.info("Task [{}] waiting for processing slot ({} tasks ahead)", taskId, waiting);
            }
            boolean acquired = permits.tryAcquire(timeoutMinutes, TimeUnit.MINUTES);
            if (acquired) {
                logger.info("Task [{}] acquired processing slot ({} of {} free)", taskId, permits.availablePermits(), maxPermits);
            } else {
                logger.error("Task [{}] timed out waiting for a processing slot after {} minutes", taskId, timeoutMinutes);
            }
            return acquired;
        } catch (InterruptedException e) {
            logger.error("Task [{}] interrupted while waiting for a processing slot", taskId);
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void release(String taskId) {
        permits.release();
        logger.info("Task [{}] released processing slot ({} tasks waiting)", taskId, permits.getQueueLength());
    }

    public int getQueueLength() {
        return permits.getQueueLength();
    }

    public int getAvailablePermits() {
        return permits.availablePermits();
    }
}
