package housesim.model;

import housesim.config.SimulationConstants;

/**
 * Состояние одного кредита при помесячном моделировании.
 * Платёж фиксируется один раз при создании, остаток уменьшается каждый месяц.
 */
public class Loan {

    private final LoanKind kind;
    private final double principal;
    private final double annualRatePercent;
    private final int termYears;
    private final double monthlyPayment;

    private double balance; // никогда не меньше 0

    public Loan(LoanKind kind, double principal, double annualRatePercent, int termYears) {
        this.kind = kind;
        this.principal = Math.max(0.0, principal);
        this.annualRatePercent = annualRatePercent;
        this.termYears = termYears;
        this.monthlyPayment = Amortization.monthlyPayment(this.principal, annualRatePercent, termYears);
        this.balance = this.principal;
    }

    public LoanKind getKind() { return kind; }
    public double getPrincipal() { return principal; }
    public double getAnnualRatePercent() { return annualRatePercent; }
    public int getTermYears() { return termYears; }
    public double getMonthlyPayment() { return monthlyPayment; }
    public double getBalance() { return balance; }

    public double getMonthlyRate() {
        return SimulationConstants.pct(annualRatePercent) / SimulationConstants.MONTHS_PER_YEAR;
    }

    public boolean isPaidOff() {
        return balance <= 0.0;
    }

    /**
     * Обязательный платёж текущего месяца по текущему остатку.
     * В последнем месяце погашение ограничено остатком.
     */
    public LoanPayment mandatoryPayment() {
        if (isPaidOff()) return LoanPayment.NONE;
        double interest = balance * getMonthlyRate();
        double principalPart = monthlyPayment - interest;
        if (principalPart > balance) principalPart = balance;
        return new LoanPayment(interest, principalPart);
    }

    /**
     * Сколько можно погасить досрочно сверх обязательной части.
     */
    public double extraCapacity(double mandatoryPrincipal) {
        return Math.max(0.0, balance - mandatoryPrincipal);
    }

    /**
     * Уменьшить остаток на погашенный основной долг; остаток меньше
     * {@link SimulationConstants#BALANCE_EPSILON} обнуляется.
     */
    public void repay(double principalPaid) {
        balance -= principalPaid;
        if (balance < SimulationConstants.BALANCE_EPSILON) balance = 0.0;
    }
}
