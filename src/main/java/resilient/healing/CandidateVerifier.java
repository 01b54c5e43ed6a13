package resilient.healing;

import resilient.model.LocatorCandidate;

/** Checks a proposed candidate against the live page the way any declared candidate is checked. */
@FunctionalInterface
public interface CandidateVerifier {

    /** @return the live handle, or the outcome and reason the proposal failed with */
    Verification verify(LocatorCandidate candidate);
}
