package com.example.SmartNews.worker;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskProcessingLockTest {

    @Test
    void permitsAreBoundedAndReturned() {
        TaskProcessingLock lock = new TaskProcessingLock(2, 0);

        assertThat(lock.acquire("a")).isTrue();
        assertThat(lock.acquire("b")).isTrue();
        assertThat(lock.acquire("c")).isFalse();
        assertThat(lock.getAvailablePermits()).isZero();

        lock.release("a");
        assertThat(lock.getAvailablePermits()).isEqualTo(1);
        assertThat(lock.acquire("c")).isTrue();
    }

    @Test
    void atLeastOnePermitIsRequired() {
        assertThatThrownBy(() -> new TaskProcessingLock(0, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
