package io.cronos.core.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SyncLoopTest {

    @Test
    void shouldRunSaveAndBackupTicksUntilCancelled() throws Exception {
        CountDownLatch saves = new CountDownLatch(3);
        CountDownLatch backups = new CountDownLatch(1);

        SyncLoop loop = SyncLoop.start(saves::countDown, Duration.ofMillis(20), backups::countDown, Duration.ofMillis(50));

        assertThat(loop.state()).isIn(SyncState.RUNNING, SyncState.STOPPED);
        assertThat(saves.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(backups.await(5, TimeUnit.SECONDS)).isTrue();
        loop.cancelAndJoin();

        assertThat(loop.state()).isEqualTo(SyncState.STOPPED);
        long savesAtStop = loop.saveTicks();
        Thread.sleep(100);
        assertThat(loop.saveTicks()).isEqualTo(savesAtStop);
    }

    @Test
    void missingBackupTaskShouldDisableBackupTick() throws Exception {
        CountDownLatch saves = new CountDownLatch(2);

        SyncLoop loop = SyncLoop.start(saves::countDown, Duration.ofMillis(20), null, null);

        assertThat(saves.await(5, TimeUnit.SECONDS)).isTrue();
        loop.cancelAndJoin();
        assertThat(loop.backupEnabled()).isFalse();
        assertThat(loop.backupTicks()).isZero();
    }

    @Test
    void failingTickShouldBeRetriedOnNextTick() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch retried = new CountDownLatch(3);

        SyncLoop loop = SyncLoop.start(() -> {
            attempts.incrementAndGet();
            retried.countDown();
            throw new IllegalStateException("disk full");
        }, Duration.ofMillis(20), null, null);

        assertThat(retried.await(5, TimeUnit.SECONDS)).isTrue();
        loop.cancelAndJoin();
        assertThat(attempts.get()).isGreaterThanOrEqualTo(3);
    }

    @Test
    void cancelShouldInterruptLongWait() throws Exception {
        SyncLoop loop = SyncLoop.start(() -> { }, Duration.ofHours(1), () -> { }, Duration.ofHours(2));

        long started = System.nanoTime();
        loop.cancelAndJoin();

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
        assertThat(loop.saveTicks()).isZero();
        assertThat(loop.awaitTermination(Duration.ofMillis(1))).isTrue();
    }

    @Test
    void tickInProgressShouldCompleteBeforeStop() throws Exception {
        CountDownLatch inTick = new CountDownLatch(1);
        AtomicInteger completed = new AtomicInteger();
        SyncLoop loop = SyncLoop.start(() -> {
            inTick.countDown();
            Thread.sleep(200);
            completed.incrementAndGet();
        }, Duration.ofMillis(10), null, null);

        assertThat(inTick.await(5, TimeUnit.SECONDS)).isTrue();
        loop.cancel();
        assertThat(loop.state()).isIn(SyncState.STOPPING, SyncState.STOPPED);
        assertThat(loop.awaitTermination(Duration.ofSeconds(5))).isTrue();

        assertThat(completed.get()).isEqualTo(1);
        assertThat(loop.state()).isEqualTo(SyncState.STOPPED);
    }

    @Test
    void nonPositiveIntervalsShouldBeRejected() {
        assertThatThrownBy(() -> SyncLoop.start(() -> { }, Duration.ZERO, null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SyncLoop.start(() -> { }, Duration.ofSeconds(1), () -> { }, Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cancellationTokenShouldStayCancelled() throws Exception {
        CancellationToken token = new CancellationToken();
        assertThat(token.await(10, TimeUnit.MILLISECONDS)).isFalse();

        token.cancel("shutdown");
        token.cancel("again");

        assertThat(token.isCancelled()).isTrue();
        assertThat(token.reason()).isEqualTo("shutdown");
        assertThat(token.await(1, TimeUnit.MILLISECONDS)).isTrue();
    }
}
