package com.cataphract.dto;

/**
 * Upkeep charged for one contract at the end of a day.
 *
 * @param amountDue loot owed for the days since the last settlement
 * @param paid      whether the army's loot covered it
 * @param deserted  whether the company walked out over unpaid wages
 */
public record MercenaryUpkeepResult(int contractId, int armyId, int amountDue, boolean paid, boolean deserted) {
}
