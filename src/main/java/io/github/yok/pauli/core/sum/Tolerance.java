package io.github.yok.pauli.core.sum;

import io.github.yok.pauli.core.algebra.Coefficient;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 係数の打ち消し判定に用いる数値許容誤差です。
 *
 * <p>
 * 同じ台に合流した寄与のうち最大の絶対値を {@code scale} として、 {@code |c| <= max(absolute, relative * scale)}
 * を満たす係数を 0 とみなします。 厳密に 0 の係数は常に除去されます。
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Tolerance {

    /**
     * 既定の相対許容誤差（マシンイプシロンの 8 倍）です。
     */
    public static final double DEFAULT_RELATIVE = 8.0 * Math.ulp(1.0);

    /**
     * 既定の許容誤差です（絶対 0、相対 {@link #DEFAULT_RELATIVE}）。
     */
    public static final Tolerance DEFAULT = new Tolerance(0.0, DEFAULT_RELATIVE);

    /**
     * 厳密に 0 の係数だけを除去する許容誤差です。
     */
    public static final Tolerance EXACT = new Tolerance(0.0, 0.0);

    /**
     * 絶対許容誤差です。
     */
    double absolute;

    /**
     * 相対許容誤差です。
     */
    double relative;

    /**
     * 許容誤差を生成します。
     *
     * @param absolute 絶対許容誤差です（0 以上の有限値）
     * @param relative 相対許容誤差です（0 以上 1 未満）
     * @return 許容誤差です
     * @throws ToleranceConfigurationException 負値・非有限値の場合、または relative が 1 以上の場合に発生します
     */
    public static Tolerance of(double absolute, double relative) {
        requireValid("absolute", absolute);
        requireValid("relative", relative);
        // relative >= 1 では寄与が 1 つだけの項がすべて 0 とみなされる
        if (relative >= 1.0) {
            throw new ToleranceConfigurationException(
                    "許容誤差 relative は 1 未満が必要です: " + relative);
        }
        return new Tolerance(absolute, relative);
    }

    /**
     * 絶対許容誤差のみの許容誤差を生成します。
     *
     * @param absolute 絶対許容誤差です（0 以上の有限値）
     * @return 許容誤差です
     * @throws ToleranceConfigurationException 負値または非有限値の場合に発生します
     */
    public static Tolerance absolute(double absolute) {
        return of(absolute, 0.0);
    }

    /**
     * 寄与の大きさ scale に対する閾値を返します。
     *
     * @param scale 合流した寄与の最大絶対値です
     * @return 閾値です
     */
    public double threshold(double scale) {
        return Math.max(absolute, relative * scale);
    }

    /**
     * 係数を 0 とみなせるかを返します。
     *
     * @param value 係数です
     * @param scale 合流した寄与の最大絶対値です
     * @return 無視できる場合は true です
     */
    public boolean isNegligible(Coefficient value, double scale) {
        return value.isNegligible(threshold(scale));
    }

    private static void requireValid(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new ToleranceConfigurationException(
                    "許容誤差 " + name + " は 0 以上の有限値が必要です: " + value);
        }
    }
}
