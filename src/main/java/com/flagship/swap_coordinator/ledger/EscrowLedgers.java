package com.flagship.swap_coordinator.ledger;

import com.flagship.swap_coordinator.session.ChainRole;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The two ledger clients of this deployment, one per role.
 */
public class EscrowLedgers {

    private final Map<ChainRole, EscrowLedgerClient> clients = new EnumMap<>(ChainRole.class);

    public EscrowLedgers(EscrowLedgerClient source, EscrowLedgerClient destination) {
        if (source.role() != ChainRole.SOURCE || destination.role() != ChainRole.DESTINATION) {
            throw new IllegalArgumentException("Ledger clients must be given as (source, destination)");
        }
        clients.put(ChainRole.SOURCE, source);
        clients.put(ChainRole.DESTINATION, destination);
    }

    public EscrowLedgerClient forRole(ChainRole role) {
        return clients.get(role);
    }

    public List<EscrowLedgerClient> all() {
        return List.copyOf(clients.values());
    }
}
