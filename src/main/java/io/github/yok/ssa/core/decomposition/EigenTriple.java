package io.github.yok.ssa.core.decomposition;

import lombok.Getter;

/**
 * 特異値分解の 1 成分（特異値・左ベクトル・因子ベクトル）を保持する不変クラスです。
 *
 * <p>
 * 軌道行列は Σ σ_i · U_i ⊗ V_i と表されます。 インデックスは 1 始まりで、特異値の降順に振られます。
 * </p>
 */
public final class EigenTriple {

    /**
     * 1 始まりのインデックスです。
     */
    @Getter
    private final int index;

    /**
     * 特異値 σ_i（0 以上）です。
     */
    @Getter
    private final double singularValue;

    /**
     * 左ベクトル U_i（長さ L、単位ノルム）です。
     */
    private final double[] leftVector;

    /**
     * 因子ベクトル V_i（長さ K、単位ノルム）です。
     */
    private final double[] factorVector;

    /**
     * 固有三つ組を生成します。
     *
     * @param index 1 始まりのインデックスです
     * @param singularValue 特異値です（0 以上）
     * @param leftVector 左ベクトルです（コピーされます）
     * @param factorVector 因子ベクトルです（コピーされます）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public EigenTriple(int index, double singularValue, double[] leftVector,
            double[] factorVector) {
        if (index < 1) {
            throw new IllegalArgumentException("index は 1 以上が必要です: " + index);
        }
        if (!(singularValue >= 0.0) || Double.isInfinite(singularValue)) {
            throw new IllegalArgumentException("singularValue は 0 以上の有限値が必要です: " + singularValue);
        }
        if (leftVector == null || leftVector.length == 0) {
            throw new IllegalArgumentException("leftVector は空にできません");
        }
        if (factorVector == null || factorVector.length == 0) {
            throw new IllegalArgumentException("factorVector は空にできません");
        }
        this.index = index;
        this.singularValue = singularValue;
        this.leftVector = leftVector.clone();
        this.factorVector = factorVector.clone();
    }

    /**
     * 左ベクトルのコピーを返します。
     *
     * @return 長さ L の配列です
     */
    public double[] getLeftVector() {
        return leftVector.clone();
    }

    /**
     * 因子ベクトルのコピーを返します。
     *
     * @return 長さ K の配列です
     */
    public double[] getFactorVector() {
        return factorVector.clone();
    }

    /**
     * 左ベクトルの第 i 要素を返します（0 始まり）。
     *
     * @param i 要素番号です
     * @return 値です
     */
    public double left(int i) {
        return leftVector[i];
    }

    /**
     * 因子ベクトルの第 j 要素を返します（0 始まり）。
     *
     * @param j 要素番号です
     * @return 値です
     */
    public double factor(int j) {
        return factorVector[j];
    }

    @Override
    public String toString() {
        return "EigenTriple(index=" + index + ", singularValue=" + singularValue + ")";
    }
}
