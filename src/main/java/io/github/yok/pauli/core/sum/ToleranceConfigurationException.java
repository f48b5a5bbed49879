package io.github.yok.pauli.core.sum;

/**
 * 数値許容誤差として負値や非有限値が指定された場合に発生する例外です。
 */
public class ToleranceConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public ToleranceConfigurationException(String message) {
        super(message);
    }
}
