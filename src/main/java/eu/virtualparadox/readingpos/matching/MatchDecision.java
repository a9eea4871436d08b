package eu.virtualparadox.readingpos.matching;

public record MatchDecision(EMatchDecision decision, EMatchBasis basis) {

    static final MatchDecision UNDETERMINED = new MatchDecision(EMatchDecision.UNDETERMINED, EMatchBasis.NONE);

    static MatchDecision of(final boolean contained, final EMatchBasis basis) {
        return new MatchDecision(contained ? EMatchDecision.CONTAINED : EMatchDecision.NOT_CONTAINED, basis);
    }
}
