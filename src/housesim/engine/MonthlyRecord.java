package housesim.engine;

/**
 * Одна строка помесячного вывода.
 *
 * @param month                    номер месяца, с 1
 * @param interestPaid             проценты по ипотекам
 * @param principalPaid            погашенный основной долг (обязательный + досрочный, все кредиты)
 * @param balance                  суммарный остаток по трём кредитам на конец месяца
 * @param netBuyCost               чистая стоимость владения
 * @param totalRentCost            аренда + страховка арендатора
 * @param budget                   бюджет месяца
 * @param buySurplus               бюджет − netBuyCost
 * @param extraPrincipalSecondary  досрочное погашение второй ипотеки
 * @param extraPrincipalPrimary    досрочное погашение основной ипотеки
 * @param investedBuySide          взнос в портфель стороны покупки
 */
public record MonthlyRecord(int month,
                            double interestPaid,
                            double principalPaid,
                            double balance,
                            double netBuyCost,
                            double totalRentCost,
                            double budget,
                            double buySurplus,
                            double extraPrincipalSecondary,
                            double extraPrincipalPrimary,
                            double investedBuySide) {
}
