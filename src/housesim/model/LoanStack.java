package housesim.model;

import housesim.config.LoanTerms;
import housesim.config.SimulationParams;

import java.util.List;

/**
 * Распределение необходимой суммы заимствования между тремя кредитами.
 * Порядок: льготный кредит, вторая ипотека, основная ипотека (остаток).
 * Сумма трёх кредитов всегда равна max(0, цена − первоначальный взнос).
 */
public final class LoanStack {

    private final Loan subsidized;
    private final Loan secondary;
    private final Loan primary;

    public LoanStack(Loan subsidized, Loan secondary, Loan primary) {
        this.subsidized = subsidized;
        this.secondary = secondary;
        this.primary = primary;
    }

    public static LoanStack from(SimulationParams p) {
        double residual = Math.max(0.0, p.getHomePrice() - p.getDownPaymentAmount());

        double subsidizedAmount = p.isUseSubsidizedLoan() ? p.getSubsidizedLoanAmount() : 0.0;
        subsidizedAmount = clamp(subsidizedAmount, residual);

        LoanTerms m2 = p.getSecondaryMortgage();
        double secondaryAmount = p.isUseSecondaryMortgage() ? m2.amount() : 0.0;
        secondaryAmount = clamp(secondaryAmount, residual - subsidizedAmount);

        double primaryAmount = Math.max(0.0, residual - subsidizedAmount - secondaryAmount);
        LoanTerms m1 = p.getPrimaryMortgage();

        return new LoanStack(
                new Loan(LoanKind.SUBSIDIZED, subsidizedAmount, 0.0, p.getSubsidizedLoanTermYears()),
                new Loan(LoanKind.SECONDARY, secondaryAmount, m2.interestRate(), m2.termYears()),
                new Loan(LoanKind.PRIMARY, primaryAmount, m1.interestRate(), m1.termYears())
        );
    }

    private static double clamp(double amount, double cap) {
        return Math.max(0.0, Math.min(amount, Math.max(0.0, cap)));
    }

    public Loan getSubsidized() { return subsidized; }
    public Loan getSecondary() { return secondary; }
    public Loan getPrimary() { return primary; }

    public Loan get(LoanKind kind) {
        switch (kind) {
            case SUBSIDIZED: return subsidized;
            case SECONDARY: return secondary;
            default: return primary;
        }
    }

    public List<Loan> all() {
        return List.of(subsidized, secondary, primary);
    }

    public double totalBorrowed() {
        double sum = 0.0;
        for (Loan l : all()) sum += l.getPrincipal();
        return sum;
    }

    /** Сумма аннуитетных платежей всех кредитов. */
    public double totalMonthlyPayment() {
        double sum = 0.0;
        for (Loan l : all()) sum += l.getMonthlyPayment();
        return sum;
    }

    public double totalBalance() {
        double sum = 0.0;
        for (Loan l : all()) sum += l.getBalance();
        return sum;
    }
}
