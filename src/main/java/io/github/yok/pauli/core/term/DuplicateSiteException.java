package io.github.yok.pauli.core.term;

import io.github.yok.pauli.core.algebra.PauliLabel;
import lombok.Getter;

/**
 * 1 つの項の構築時に、同じサイトインデックスへ複数の因子が指定された場合に発生する例外です。
 *
 * <p>
 * 呼び出し側の入力誤りであり、構築時点で即座に通知します。
 * </p>
 */
@Getter
public class DuplicateSiteException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 重複したサイトインデックスです。
     */
    private final int site;

    /**
     * 先に現れた因子のラベルです。
     */
    private final PauliLabel firstLabel;

    /**
     * 後に現れた因子のラベルです。
     */
    private final PauliLabel secondLabel;

    /**
     * 例外を生成します。
     *
     * @param site 重複したサイトインデックスです
     * @param firstLabel 先に現れた因子のラベルです
     * @param secondLabel 後に現れた因子のラベルです
     */
    public DuplicateSiteException(int site, PauliLabel firstLabel, PauliLabel secondLabel) {
        super("同一サイトに複数の因子が指定されています: site=" + site + " (" + firstLabel + ", "
                + secondLabel + ")");
        this.site = site;
        this.firstLabel = firstLabel;
        this.secondLabel = secondLabel;
    }
}
