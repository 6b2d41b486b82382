package housesim.config;

/**
 * Условия одного кредита.
 *
 * @param amount       сумма кредита (для основной ипотеки игнорируется, считается как остаток)
 * @param interestRate годовая ставка, %
 * @param termYears    срок, лет
 */
public record LoanTerms(double amount, double interestRate, int termYears) {

    public LoanTerms withAmount(double newAmount) {
        return new LoanTerms(newAmount, interestRate, termYears);
    }

    public LoanTerms withInterestRate(double newRate) {
        return new LoanTerms(amount, newRate, termYears);
    }

    public LoanTerms withTermYears(int newTerm) {
        return new LoanTerms(amount, interestRate, newTerm);
    }
}
