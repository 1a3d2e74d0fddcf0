package io.github.yok.ssa.core.cancel;

import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * 高コストな分解処理を呼び出し元から打ち切るための通知を表すインタフェースです。
 *
 * <p>
 * 各段は新しい不変の結果を返すだけなので、打ち切っても共有状態が中途半端に残ることはありません。
 * </p>
 *
 * <p>
 * 特異値分解の実行中も通知は一定間隔で確認され、打ち切られた呼び出しは計算の完了を待たずに戻ります。
 * ただし EJML の計算自体は割り込みに応じないため、CPU 時間は計算が終わるまで消費されます。
 * </p>
 */
@FunctionalInterface
public interface CancellationSignal {

    /**
     * 打ち切られることのない通知です。
     */
    CancellationSignal NONE = () -> false;

    /**
     * 打ち切りが要求されているかどうかを返します。
     *
     * @return 打ち切る場合は true です
     */
    boolean isCancelled();

    /**
     * 打ち切りが要求されていれば {@link CancellationException} を送出します。
     *
     * @param stage 打ち切り位置を表す段の名前です（メッセージ用）
     * @throws CancellationException 打ち切りが要求されている場合に発生します
     */
    default void throwIfCancelled(String stage) {
        if (isCancelled()) {
            throw new CancellationException("処理が打ち切られました: " + stage);
        }
    }

    /**
     * 打ち切られることのない通知を返します。
     *
     * @return 常に false を返す通知です（常に同じインスタンス）
     */
    static CancellationSignal none() {
        return NONE;
    }

    /**
     * 現在時刻から指定時間が経過すると打ち切りを要求する通知を返します。
     *
     * @param budget 許容時間です（正の値）
     * @return 期限付きの通知です
     * @throws IllegalArgumentException budget が null、または正でない場合に発生します
     */
    static CancellationSignal deadline(Duration budget) {
        return new DeadlineCancellationSignal(budget);
    }
}
