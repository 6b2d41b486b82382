package housesim.model;

/**
 * Обязательный платёж за месяц: проценты и погашение основного долга.
 */
public record LoanPayment(double interest, double principal) {

    public static final LoanPayment NONE = new LoanPayment(0.0, 0.0);

    public double total() {
        return interest + principal;
    }
}
