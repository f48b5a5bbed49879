package io.github.yok.pauli.core.term;

import io.github.yok.pauli.core.algebra.PauliLabel;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * サイトインデックスに束縛された要素演算子（例: X3）を表すクラスです。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Factor {

    /**
     * サイトインデックスです（0 以上）。
     */
    int site;

    /**
     * 要素演算子のラベルです。
     */
    PauliLabel label;

    /**
     * 因子を生成します。
     *
     * @param site サイトインデックスです（0 以上）
     * @param label ラベルです（null 不可）
     * @return 因子です
     * @throws IllegalArgumentException site が負、または label が null の場合に発生します
     */
    public static Factor of(int site, PauliLabel label) {
        if (site < 0) {
            throw new IllegalArgumentException("site は 0 以上が必要です: " + site);
        }
        if (label == null) {
            throw new IllegalArgumentException("label は null 不可です");
        }
        return new Factor(site, label);
    }

    @Override
    public String toString() {
        return label.name() + site;
    }
}
