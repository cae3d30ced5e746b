package com.delta.pagetracker.crawl.traversal;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class CrawlCancellation {
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public static CrawlCancellation none() {
        return new CrawlCancellation();
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public boolean awaitDelay(long delayMs) {
        if (delayMs <= 0) {
            return isCancelled();
        }
        try {
            return cancelled.await(delayMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
