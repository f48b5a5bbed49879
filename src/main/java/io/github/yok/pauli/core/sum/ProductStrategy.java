package io.github.yok.pauli.core.sum;

/**
 * 和同士の積を計算する方式を表すインタフェースです。
 *
 * <p>
 * 左の各項と右の各項の積（|A|·|B| 個）をすべて求め、台ごとの合流処理で 1 つの和にまとめます。 逐次・並列などの実行方式を差し替えるための境界です。
 * 実装はどの方式でも同じ正準形を返す必要があります。
 * </p>
 */
public interface ProductStrategy {

    /**
     * 積 left·right を返します。
     *
     * @param left 左の和です（null 不可）
     * @param right 右の和です（null 不可）
     * @param tolerance 許容誤差です（null 不可）
     * @return 積です
     */
    OperatorSum multiply(OperatorSum left, OperatorSum right, Tolerance tolerance);
}
