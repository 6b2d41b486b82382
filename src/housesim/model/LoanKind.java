package housesim.model;

/**
 * Виды кредитов в порядке заимствования.
 */
public enum LoanKind {
    SUBSIDIZED,  // беспроцентный льготный кредит, берётся первым
    SECONDARY,   // вторая ипотека
    PRIMARY      // основная ипотека, покрывает остаток
}
