package housesim.analysis;

/**
 * Результат поиска точки безубыточности.
 *
 * @param parameter        варьируемый параметр
 * @param bracketed        меняет ли преимущество покупки знак на отрезке
 * @param value            найденное значение (NaN, если знак не меняется)
 * @param advantageAtLow   buy − rent на левом конце
 * @param advantageAtHigh  buy − rent на правом конце
 * @param evaluations      число прогонов движка внутри решателя
 */
public record BreakEven(SweepParameter parameter,
                        boolean bracketed,
                        double value,
                        double advantageAtLow,
                        double advantageAtHigh,
                        int evaluations) {

    static BreakEven notBracketed(SweepParameter parameter, double fLo, double fHi) {
        return new BreakEven(parameter, false, Double.NaN, fLo, fHi, 0);
    }
}
