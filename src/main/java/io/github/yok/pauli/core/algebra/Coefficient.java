package io.github.yok.pauli.core.algebra;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 項の係数として用いる固定精度の複素数です。
 *
 * <p>
 * 不変オブジェクトであり、演算は常に新しいインスタンスを返します。 equals は実部・虚部の厳密比較です（許容誤差付きの比較は
 * {@link #isNegligible(double)} を使います）。
 * </p>
 *
 * <p>
 * 値は常に有限です。 加減算・乗算の結果が double の範囲を超えた場合は {@link ArithmeticException} を投げます。
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Coefficient {

    /**
     * 0 です。
     */
    public static final Coefficient ZERO = new Coefficient(0.0, 0.0);

    /**
     * 1 です。
     */
    public static final Coefficient ONE = new Coefficient(1.0, 0.0);

    /**
     * 虚数単位 i です。
     */
    public static final Coefficient I = new Coefficient(0.0, 1.0);

    /**
     * 実部です。
     */
    double real;

    /**
     * 虚部です。
     */
    double imaginary;

    /**
     * 複素数を生成します。
     *
     * @param real 実部です（有限値）
     * @param imaginary 虚部です（有限値）
     * @return 係数です
     * @throws IllegalArgumentException 非有限値が含まれる場合に発生します
     */
    public static Coefficient of(double real, double imaginary) {
        if (!Double.isFinite(real) || !Double.isFinite(imaginary)) {
            throw new IllegalArgumentException(
                    "係数は有限値を指定してください: " + real + ", " + imaginary);
        }
        return new Coefficient(real, imaginary);
    }

    /**
     * 実数の係数を生成します。
     *
     * @param real 実部です（有限値）
     * @return 係数です
     */
    public static Coefficient real(double real) {
        return of(real, 0.0);
    }

    /**
     * 位相因子を係数に変換します。
     *
     * @param phase 位相です
     * @return 係数です
     */
    public static Coefficient of(Phase phase) {
        return new Coefficient(phase.real(), phase.imaginary());
    }

    public Coefficient plus(Coefficient other) {
        return checked(real + other.real, imaginary + other.imaginary);
    }

    public Coefficient minus(Coefficient other) {
        return checked(real - other.real, imaginary - other.imaginary);
    }

    public Coefficient times(Coefficient other) {
        return checked(real * other.real - imaginary * other.imaginary,
                real * other.imaginary + imaginary * other.real);
    }

    public Coefficient times(double factor) {
        if (!Double.isFinite(factor)) {
            throw new IllegalArgumentException("倍率は有限値を指定してください: " + factor);
        }
        return checked(real * factor, imaginary * factor);
    }

    /**
     * 位相因子を掛けます。
     *
     * <p>
     * 位相は ±1, ±i のいずれかなので、乗算ではなく成分の入れ替えと符号反転で厳密に計算します。
     * </p>
     *
     * @param phase 位相です
     * @return this · phase です
     */
    public Coefficient times(Phase phase) {
        switch (phase) {
            case ONE:
                return this;
            case I:
                return new Coefficient(-imaginary, real);
            case MINUS_ONE:
                return new Coefficient(-real, -imaginary);
            default:
                return new Coefficient(imaginary, -real);
        }
    }

    /**
     * 演算結果から係数を生成します。
     *
     * @param real 実部です
     * @param imaginary 虚部です
     * @return 係数です
     * @throws ArithmeticException 結果が有限値でない（オーバーフローした）場合に発生します
     */
    private static Coefficient checked(double real, double imaginary) {
        if (!Double.isFinite(real) || !Double.isFinite(imaginary)) {
            throw new ArithmeticException("係数の演算がオーバーフローしました: " + real + ", " + imaginary);
        }
        return new Coefficient(real, imaginary);
    }

    public Coefficient negate() {
        return new Coefficient(-real, -imaginary);
    }

    public Coefficient conjugate() {
        return new Coefficient(real, -imaginary);
    }

    /**
     * 絶対値 |c| を返します。
     *
     * @return 絶対値です
     */
    public double abs() {
        return Math.hypot(real, imaginary);
    }

    /**
     * 厳密に 0 かどうかを返します。
     *
     * @return 実部・虚部がともに 0 の場合は true です
     */
    public boolean isZero() {
        return real == 0.0 && imaginary == 0.0;
    }

    /**
     * 絶対値が閾値以下かどうかを返します。
     *
     * @param threshold 閾値です
     * @return |c| &lt;= threshold の場合は true です
     */
    public boolean isNegligible(double threshold) {
        return isZero() || abs() <= threshold;
    }

    /**
     * 虚部が厳密に 0 かどうかを返します。
     *
     * @return 実数の場合は true です
     */
    public boolean isReal() {
        return imaginary == 0.0;
    }

    /**
     * 実部・虚部の厳密比較です。-0.0 と 0.0 は同一視します。
     *
     * @param o 比較対象です
     * @return 等しい場合は true です
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Coefficient)) {
            return false;
        }
        Coefficient other = (Coefficient) o;
        return real == other.real && imaginary == other.imaginary;
    }

    @Override
    public int hashCode() {
        // + 0.0 で -0.0 を 0.0 に正規化
        return 31 * Double.hashCode(real + 0.0) + Double.hashCode(imaginary + 0.0);
    }

    @Override
    public String toString() {
        String sign = imaginary < 0.0 ? "-" : "+";
        return "(" + real + sign + Math.abs(imaginary) + "i)";
    }
}
