package com.metasrv.statemachine;

/**
 * Precondition on the current sequence number of a key. An absent key has
 * sequence 0.
 *
 * @param kind how to compare
 * @param seq the operand, ignored for {@link Kind#ANY}
 */
public record MatchSeq(Kind kind, long seq) {

    public enum Kind {
        ANY,
        EXACT,
        GREATER_OR_EQUAL
    }

    public static final MatchSeq ANY = new MatchSeq(Kind.ANY, 0);

    public static MatchSeq exact(long seq) {
        return new MatchSeq(Kind.EXACT, seq);
    }

    public static MatchSeq greaterOrEqual(long seq) {
        return new MatchSeq(Kind.GREATER_OR_EQUAL, seq);
    }

    public boolean matches(long currentSeq) {
        return switch (kind) {
            case ANY -> true;
            case EXACT -> currentSeq == seq;
            case GREATER_OR_EQUAL -> currentSeq >= seq;
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ANY -> "any";
            case EXACT -> "==" + seq;
            case GREATER_OR_EQUAL -> ">=" + seq;
        };
    }
}
