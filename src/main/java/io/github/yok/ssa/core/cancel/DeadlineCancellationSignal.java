package io.github.yok.ssa.core.cancel;

import java.time.Duration;

/**
 * 期限（時間予算）を超えると打ち切りを要求する通知です。
 */
final class DeadlineCancellationSignal implements CancellationSignal {

    /**
     * 期限（System.nanoTime 基準）です。
     */
    private final long deadlineNanos;

    DeadlineCancellationSignal(Duration budget) {
        if (budget == null || budget.isZero() || budget.isNegative()) {
            throw new IllegalArgumentException("budget は正の時間を指定してください: " + budget);
        }
        this.deadlineNanos = System.nanoTime() + budget.toNanos();
    }

    @Override
    public boolean isCancelled() {
        return deadlineNanos - System.nanoTime() <= 0L;
    }
}
