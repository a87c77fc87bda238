package app.taxguide.ask.answer.service;

import app.taxguide.ask.entitlement.domain.type.AccessVia;
import app.taxguide.ask.entitlement.service.EntitlementDecision;

/**
 * Entitlement hook consulted once the resolver knows where the answer will come from.
 */
public interface ResolutionGate {

    EntitlementDecision admit(AccessVia via);

    void release(EntitlementDecision decision);
}
