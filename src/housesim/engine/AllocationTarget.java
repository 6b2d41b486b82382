package housesim.engine;

import housesim.model.LoanKind;

/**
 * Получатель досрочного погашения и сколько он может принять в этом месяце.
 */
public record AllocationTarget(LoanKind loan, double capacity) {
}
