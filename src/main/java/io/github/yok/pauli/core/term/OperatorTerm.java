package io.github.yok.pauli.core.term;

import io.github.yok.pauli.core.algebra.Coefficient;
import io.github.yok.pauli.core.term.PauliString.PauliProduct;
import java.util.Collection;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 係数付きの Pauli 積 c·P を表す不変クラスです。
 *
 * <p>
 * 台は構築時に正準化され、以後変化しません。積やスカラー倍は新しい項を返します。
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperatorTerm {

    /**
     * 正準形の台です。
     */
    PauliString support;

    /**
     * 係数です。
     */
    Coefficient coefficient;

    /**
     * 台と係数から項を生成します。
     *
     * @param support 台です（null 不可）
     * @param coefficient 係数です（null 不可）
     * @return 項です
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public static OperatorTerm of(PauliString support, Coefficient coefficient) {
        if (support == null) {
            throw new IllegalArgumentException("support は null 不可です");
        }
        if (coefficient == null) {
            throw new IllegalArgumentException("coefficient は null 不可です");
        }
        return new OperatorTerm(support, coefficient);
    }

    /**
     * 因子列と係数から項を生成します。
     *
     * @param factors 因子列です
     * @param coefficient 係数です
     * @return 正準化された項です
     * @throws DuplicateSiteException 同じサイトへの因子が複数ある場合に発生します
     */
    public static OperatorTerm of(Collection<Factor> factors, Coefficient coefficient) {
        return of(PauliString.of(factors), coefficient);
    }

    /**
     * 因子列と係数から項を生成します。
     *
     * @param coefficient 係数です
     * @param factors 因子です
     * @return 正準化された項です
     * @throws DuplicateSiteException 同じサイトへの因子が複数ある場合に発生します
     */
    public static OperatorTerm of(Coefficient coefficient, Factor... factors) {
        return of(PauliString.of(factors), coefficient);
    }

    /**
     * 実数係数の項を生成します。
     *
     * @param coefficient 実数係数です
     * @param factors 因子です
     * @return 正準化された項です
     */
    public static OperatorTerm of(double coefficient, Factor... factors) {
        return of(Coefficient.real(coefficient), factors);
    }

    /**
     * 恒等演算子のスカラー倍 c·I を生成します。
     *
     * @param coefficient 係数です
     * @return 項です
     */
    public static OperatorTerm identity(Coefficient coefficient) {
        return of(PauliString.IDENTITY, coefficient);
    }

    /**
     * 積 this·right を返します。
     *
     * <p>
     * 係数は {@code coeffA * coeffB * Π(phases)} です。 左右を入れ替えると共通サイトの位相が入れ替わるため、一般に非可換です。
     * </p>
     *
     * @param right 右から掛ける項です（null 不可）
     * @return 積の項です
     */
    public OperatorTerm multiply(OperatorTerm right) {
        if (right == null) {
            throw new IllegalArgumentException("right は null 不可です");
        }
        PauliProduct product = support.multiply(right.support);
        Coefficient c = coefficient.times(right.coefficient).times(product.getPhase());
        return new OperatorTerm(product.getSupport(), c);
    }

    public OperatorTerm scale(Coefficient scalar) {
        if (scalar == null) {
            throw new IllegalArgumentException("scalar は null 不可です");
        }
        return new OperatorTerm(support, coefficient.times(scalar));
    }

    public OperatorTerm scale(double scalar) {
        return new OperatorTerm(support, coefficient.times(scalar));
    }

    /**
     * 台が等しいかどうかを返します（係数は無視します）。
     *
     * @param other 比較対象です
     * @return 台が構造的に等しい場合は true です
     */
    public boolean sameSupport(OperatorTerm other) {
        return other != null && support.equals(other.support);
    }

    /**
     * 演算子として可換かどうかを返します（係数は無関係です）。
     *
     * @param other 比較対象です
     * @return 可換の場合は true です
     */
    public boolean commutesWith(OperatorTerm other) {
        return support.commutesWith(other.support);
    }

    /**
     * エルミート共役を返します。Pauli 積はエルミートなので係数の共役だけを取ります。
     *
     * @return 共役な項です
     */
    public OperatorTerm adjoint() {
        return new OperatorTerm(support, coefficient.conjugate());
    }

    /**
     * 非恒等因子の数（Pauli weight）を返します。
     *
     * @return 因子数です
     */
    public int weight() {
        return support.size();
    }

    /**
     * 正準順の因子リストを返します。
     *
     * @return 因子リストです
     */
    public List<Factor> factors() {
        return support.factors();
    }

    @Override
    public String toString() {
        return coefficient + "*" + support;
    }
}
