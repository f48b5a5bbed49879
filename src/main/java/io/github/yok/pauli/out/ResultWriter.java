package io.github.yok.pauli.out;

import io.github.yok.pauli.core.sum.OperatorSum;

/**
 * 計算結果（正準形の和）を出力する処理のインタフェースです。
 *
 * <p>
 * 出力は必ず正準順の項リストに基づきます。 外部の読み込み処理で再構築したときに、元の和と正準形として等しくなる必要があります。
 * </p>
 */
public interface ResultWriter {

    /**
     * 計算結果を出力します。
     *
     * @param name 出力名（ファイル名の接頭辞）です
     * @param operation 実行した演算の名前です
     * @param result 計算結果の和です
     * @param hermitian 結果がエルミートかどうかです
     */
    void write(String name, String operation, OperatorSum result, boolean hermitian);
}
