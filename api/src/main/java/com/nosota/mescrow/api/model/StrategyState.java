package com.nosota.mescrow.api.model;

/**
 * State of a whole escrow instance.
 *
 * <pre>
 *   NONE ──open──▶ ACTIVE ──last milestone paid──▶ EXECUTED
 *                    │
 *                    └──abort vote passed──▶ REJECTED
 * </pre>
 *
 * <p>EXECUTED and REJECTED are final: no value-moving operation is legal afterwards.
 */
public enum StrategyState {
    NONE,
    ACTIVE,
    EXECUTED,
    REJECTED
}
