package io.github.yok.pauli.core.algebra;

import lombok.Value;

/**
 * 単一サイトの Pauli ラベル同士の乗算表を提供するクラスです。
 *
 * <p>
 * 4×4 の全順序対について (結果ラベル, 位相) を事前計算した密な表を引くだけの純関数です。 L1 を先（左）、L2 を後（右）として積 L1·L2 を返します。
 * </p>
 *
 * <pre>
 *   XY = iZ,  YZ = iX,  ZX = iY
 *   YX = -iZ, ZY = -iX, XZ = -iY
 * </pre>
 */
public final class PauliAlgebra {

    /**
     * 乗算表です（[L1.code][L2.code]）。
     */
    private static final FactorProduct[][] TABLE = buildTable();

    private PauliAlgebra() {}

    /**
     * 同一サイト上の 2 つのラベルの積 L1·L2 を返します。
     *
     * @param first 先に書かれる（左の）ラベルです（null 不可）
     * @param second 後に書かれる（右の）ラベルです（null 不可）
     * @return 結果ラベルと位相です
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public static FactorProduct multiply(PauliLabel first, PauliLabel second) {
        if (first == null || second == null) {
            throw new IllegalArgumentException("Pauli ラベルは null 不可です");
        }
        return TABLE[first.code()][second.code()];
    }

    /**
     * 2 つのラベルが可換かどうかを返します。
     *
     * @param first ラベルです
     * @param second ラベルです
     * @return どちらかが I、または同一ラベルの場合は true です
     */
    public static boolean commutes(PauliLabel first, PauliLabel second) {
        return first.isIdentity() || second.isIdentity() || first == second;
    }

    /**
     * 乗算表を構築します。
     *
     * @return 乗算表です
     */
    private static FactorProduct[][] buildTable() {
        PauliLabel[] labels = PauliLabel.values();
        FactorProduct[][] table = new FactorProduct[labels.length][labels.length];
        for (PauliLabel a : labels) {
            for (PauliLabel b : labels) {
                table[a.code()][b.code()] = compute(a, b);
            }
        }
        return table;
    }

    /**
     * 1 つの順序対について積を計算します。
     *
     * @param a 左のラベルです
     * @param b 右のラベルです
     * @return 積です
     */
    private static FactorProduct compute(PauliLabel a, PauliLabel b) {
        if (a.isIdentity()) {
            return new FactorProduct(b, Phase.ONE);
        }
        if (b.isIdentity()) {
            return new FactorProduct(a, Phase.ONE);
        }
        if (a == b) {
            return new FactorProduct(PauliLabel.I, Phase.ONE);
        }
        // X=1, Y=2, Z=3 なので残りの 1 つは 6 - a - b
        PauliLabel third = PauliLabel.fromCode(6 - a.code() - b.code());
        // (X,Y), (Y,Z), (Z,X) が巡回順
        boolean cyclic = Math.floorMod(b.code() - a.code(), 3) == 1;
        return new FactorProduct(third, cyclic ? Phase.I : Phase.MINUS_I);
    }

    /**
     * 単一サイトでのラベル積の結果を保持するクラスです。
     */
    @Value
    public static class FactorProduct {

        /**
         * 結果ラベルです。
         */
        PauliLabel label;

        /**
         * 位相因子です。
         */
        Phase phase;
    }
}
