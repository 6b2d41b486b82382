package housesim.engine;

/**
 * Накопители сумм за весь горизонт и за текущий год.
 */
public final class Totals {
    public double interest;
    public double principal;
    public double rent;

    public double yearInterest;
    public double yearPrincipal;

    public void addMonth(double monthInterest, double monthPrincipal, double monthRent) {
        interest += monthInterest;
        principal += monthPrincipal;
        rent += monthRent;
        yearInterest += monthInterest;
        yearPrincipal += monthPrincipal;
    }

    public void resetYear() {
        yearInterest = 0.0;
        yearPrincipal = 0.0;
    }
}
