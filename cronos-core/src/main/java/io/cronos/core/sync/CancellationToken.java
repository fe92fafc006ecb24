package io.cronos.core.sync;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class CancellationToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile String reason = "";

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public String reason() {
        return reason;
    }

    public void cancel(String reason) {
        if (!isCancelled()) {
            this.reason = reason == null ? "" : reason;
            cancelled.countDown();
        }
    }

    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return cancelled.await(timeout, unit);
    }
}
