package io.github.yok.pauli.core.algebra;

/**
 * Pauli 演算子の積で現れる位相因子 {1, i, -1, -i} を表す列挙型です。
 *
 * <p>
 * 位相は i の冪 i^k（k = 0..3）として保持し、積は k の加算（mod 4）で厳密に計算します。 浮動小数点への変換は係数に畳み込む時点まで行いません。
 * </p>
 */
public enum Phase {

    /**
     * 1 (= i^0) です。
     */
    ONE(0, 1.0, 0.0),

    /**
     * i (= i^1) です。
     */
    I(1, 0.0, 1.0),

    /**
     * -1 (= i^2) です。
     */
    MINUS_ONE(2, -1.0, 0.0),

    /**
     * -i (= i^3) です。
     */
    MINUS_I(3, 0.0, -1.0);

    /**
     * 指数順に並べた位相配列です。
     */
    private static final Phase[] BY_EXPONENT = {ONE, I, MINUS_ONE, MINUS_I};

    /**
     * i の指数 k です。
     */
    private final int exponent;

    /**
     * 実部です。
     */
    private final double real;

    /**
     * 虚部です。
     */
    private final double imaginary;

    Phase(int exponent, double real, double imaginary) {
        this.exponent = exponent;
        this.real = real;
        this.imaginary = imaginary;
    }

    /**
     * i の指数 k（0..3）を返します。
     *
     * @return 指数です
     */
    public int exponent() {
        return exponent;
    }

    /**
     * 実部を返します。
     *
     * @return 実部です
     */
    public double real() {
        return real;
    }

    /**
     * 虚部を返します。
     *
     * @return 虚部です
     */
    public double imaginary() {
        return imaginary;
    }

    /**
     * 位相同士の積を返します。
     *
     * @param other 右から掛ける位相です
     * @return 積の位相です
     */
    public Phase times(Phase other) {
        return BY_EXPONENT[(exponent + other.exponent) & 3];
    }

    /**
     * 符号を反転した位相を返します。
     *
     * @return -this です
     */
    public Phase negate() {
        return times(MINUS_ONE);
    }

    /**
     * 複素共役の位相を返します。
     *
     * @return 共役位相です
     */
    public Phase conjugate() {
        return BY_EXPONENT[(4 - exponent) & 3];
    }

    /**
     * i^k の位相を返します。
     *
     * @param exponent 指数です（負値も可）
     * @return 位相です
     */
    public static Phase ofExponent(int exponent) {
        return BY_EXPONENT[Math.floorMod(exponent, 4)];
    }
}
