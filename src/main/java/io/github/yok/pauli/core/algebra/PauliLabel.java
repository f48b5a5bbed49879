package io.github.yok.pauli.core.algebra;

/**
 * 1 サイト（1 量子ビット）に作用する要素演算子のラベルを表す列挙型です。
 *
 * <p>
 * 恒等演算子 I と、互いに反交換する 3 つの Pauli 演算子 X, Y, Z からなる閉じた集合です。 {@link #code()}
 * は正準順序の比較キーと乗算表のインデックスを兼ねます。
 * </p>
 */
public enum PauliLabel {

    /**
     * 恒等演算子です。
     */
    I(0),

    /**
     * Pauli X です。
     */
    X(1),

    /**
     * Pauli Y です。
     */
    Y(2),

    /**
     * Pauli Z です。
     */
    Z(3);

    /**
     * code 順に並べたラベル配列です。
     */
    private static final PauliLabel[] BY_CODE = {I, X, Y, Z};

    /**
     * ラベルの数値コードです。
     */
    private final int code;

    PauliLabel(int code) {
        this.code = code;
    }

    /**
     * ラベルの数値コード（0..3）を返します。
     *
     * @return 数値コードです
     */
    public int code() {
        return code;
    }

    /**
     * 恒等演算子かどうかを返します。
     *
     * @return I の場合は true です
     */
    public boolean isIdentity() {
        return this == I;
    }

    /**
     * 数値コードからラベルを返します。
     *
     * @param code 数値コードです（0..3）
     * @return ラベルです
     * @throws IllegalArgumentException code が範囲外の場合に発生します
     */
    public static PauliLabel fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            throw new IllegalArgumentException("Pauli ラベルのコードは 0..3 です: " + code);
        }
        return BY_CODE[code];
    }

    /**
     * 1 文字の記号（I/X/Y/Z、大文字小文字を区別しない）からラベルを返します。
     *
     * @param symbol 記号です
     * @return ラベルです
     * @throws IllegalArgumentException 記号が不正な場合に発生します
     */
    public static PauliLabel fromSymbol(char symbol) {
        switch (Character.toUpperCase(symbol)) {
            case 'I':
                return I;
            case 'X':
                return X;
            case 'Y':
                return Y;
            case 'Z':
                return Z;
            default:
                throw new IllegalArgumentException("Pauli ラベルの記号が不正です: " + symbol);
        }
    }
}
