package com.nosota.mescrow.escrow;

import com.nosota.mescrow.api.model.StrategyState;
import com.nosota.mescrow.error.EscrowStateException;
import lombok.Getter;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State of one escrow instance.
 *
 * <pre>
 *   NONE → ACTIVE → EXECUTED
 *            └────→ REJECTED
 * </pre>
 * EXECUTED and REJECTED are final.
 */
public class StrategyStateMachine {

    private static final Map<StrategyState, Set<StrategyState>> ALLOWED_TRANSITIONS = Map.of(
            StrategyState.NONE, EnumSet.of(StrategyState.ACTIVE),
            StrategyState.ACTIVE, EnumSet.of(StrategyState.EXECUTED, StrategyState.REJECTED)
    );

    @Getter
    private StrategyState state = StrategyState.NONE;

    public void activate() {
        transitionTo(StrategyState.ACTIVE);
    }

    public void execute() {
        transitionTo(StrategyState.EXECUTED);
    }

    public void reject() {
        transitionTo(StrategyState.REJECTED);
    }

    public boolean isFinalState() {
        return state == StrategyState.EXECUTED || state == StrategyState.REJECTED;
    }

    /**
     * @throws EscrowStateException if the escrow is not ACTIVE
     */
    public void requireActive(String operation) throws EscrowStateException {
        if (state != StrategyState.ACTIVE) {
            throw new EscrowStateException(
                    String.format("Cannot %s: escrow is %s, expected %s", operation, state, StrategyState.ACTIVE));
        }
    }

    private void transitionTo(StrategyState target) {
        Set<StrategyState> allowedTargets = ALLOWED_TRANSITIONS.getOrDefault(state, Set.of());
        if (!allowedTargets.contains(target)) {
            throw new IllegalStateException(
                    String.format("Invalid strategy state transition: %s → %s. Allowed transitions from %s: %s",
                            state, target, state, allowedTargets));
        }
        state = target;
    }
}
