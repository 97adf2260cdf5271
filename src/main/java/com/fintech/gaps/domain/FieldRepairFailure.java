package com.fintech.gaps.domain;

/**
 * Non-fatal diagnostic: one field could not be repaired the way the strategy
 * intended and was left unmodified or filled by a simpler fallback.
 *
 * @param field column name
 * @param strategy strategy that was being applied
 * @param message what happened
 */
public record FieldRepairFailure(String field, RepairStrategy strategy, String message) {

    @Override
    public String toString() {
        return field + " [" + strategy.id() + "]: " + message;
    }
}
