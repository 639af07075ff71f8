package com.casespace.app.inventory;

import java.time.Instant;
import java.util.concurrent.atomic.LongAdder;

import com.casespace.app.inventory.TreeWalker.WalkMetrics;

public final class SyncMetrics {
    public final WalkMetrics walk = new WalkMetrics();
    public final LongAdder filesClassified = new LongAdder();
    public final LongAdder filesHashed = new LongAdder();
    public final LongAdder renamesDetected = new LongAdder();
    public final LongAdder fileErrors = new LongAdder();

    public volatile Instant start = Instant.EPOCH;
}
