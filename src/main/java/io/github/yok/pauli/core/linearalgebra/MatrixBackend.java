package io.github.yok.pauli.core.linearalgebra;

import io.github.yok.pauli.core.sum.OperatorSum;
import org.ejml.data.ZMatrixRMaj;

/**
 * 正準形の和を数値行列に変換するバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用するライブラリや疎・密の表現を差し替えやすくするためのインタフェースです。 基底の並びは「サイト 0 が最上位ビット」です（|q0 q1 ... q(n-1)&gt;）。
 * </p>
 */
public interface MatrixBackend {

    /**
     * 和を 2^n × 2^n の複素行列に変換します。
     *
     * @param sum 変換する和です（null 不可）
     * @param qubitCount 量子ビット数 n です（sum.qubitCount() 以上）
     * @return 複素行列です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    ZMatrixRMaj toMatrix(OperatorSum sum, int qubitCount);
}
