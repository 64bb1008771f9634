package com.regimetrader.oms;

import com.regimetrader.domain.model.Position;
import com.regimetrader.risk.AdmissionDecision;
import java.util.List;

/**
 * Last check before an entry commits. {@link TradeLifecycleManager#submitEntry} runs it under the
 * entry lock, so the active positions it sees cannot change until the entry is committed or refused.
 */
@FunctionalInterface
public interface EntryAdmission {

    EntryAdmission ALWAYS = activePositions -> AdmissionDecision.admit();

    AdmissionDecision check(List<Position> activePositions);
}
