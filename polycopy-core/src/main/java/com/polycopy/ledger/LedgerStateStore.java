package com.polycopy.ledger;

import java.util.Optional;

/**
 * Persists ledger snapshots across restarts.
 */
public interface LedgerStateStore {

  void save(LedgerSnapshot snapshot);

  Optional<LedgerSnapshot> load();
}
