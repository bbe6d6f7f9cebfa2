package com.metasrv.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for membership configurations.
 */
class MembershipTest {

    private static final NodeId N0 = NodeId.of(0);
    private static final NodeId N1 = NodeId.of(1);
    private static final NodeId N2 = NodeId.of(2);

    @Test
    @DisplayName("Voters and learners are kept disjoint")
    void testDisjoint() {
        Membership m = new Membership(Set.of(N0, N1), Set.of(N1, N2));

        assertThat(m.voters()).containsExactly(N0, N1);
        assertThat(m.learners()).containsExactly(N2);
        assertThat(m.allMembers()).containsExactly(N0, N1, N2);
    }

    @Test
    @DisplayName("Quorum is a majority of voters")
    void testQuorum() {
        assertThat(Membership.ofVoters(Set.of(N0)).quorum()).isEqualTo(1);
        assertThat(Membership.ofVoters(Set.of(N0, N1)).quorum()).isEqualTo(2);
        assertThat(new Membership(Set.of(N0, N1, N2), Set.of(NodeId.of(9))).quorum()).isEqualTo(2);
    }

    @Test
    @DisplayName("Adding a learner that is already a member changes nothing")
    void testWithLearner() {
        Membership m = Membership.ofVoters(Set.of(N0));

        Membership withLearner = m.withLearner(N1);
        assertThat(withLearner.isLearner(N1)).isTrue();
        assertThat(withLearner.withLearner(N1)).isEqualTo(withLearner);
        assertThat(withLearner.withLearner(N0)).isEqualTo(withLearner);
    }

    @Test
    @DisplayName("without removes from voters and learners")
    void testWithout() {
        Membership m = new Membership(Set.of(N0, N1), Set.of(N2));

        assertThat(m.without(N1)).isEqualTo(new Membership(Set.of(N0), Set.of(N2)));
        assertThat(m.without(N2)).isEqualTo(Membership.ofVoters(Set.of(N0, N1)));
        assertThat(m.without(NodeId.of(7))).isEqualTo(m);
    }

    @Test
    @DisplayName("withVoters demotes other members to learners")
    void testWithVoters() {
        Membership m = new Membership(Set.of(N0), Set.of(N1, N2));

        Membership promoted = m.withVoters(Set.of(N0, N1, N2));
        assertThat(promoted.voters()).containsExactly(N0, N1, N2);
        assertThat(promoted.learners()).isEmpty();

        Membership demoted = promoted.withVoters(Set.of(N1));
        assertThat(demoted.voters()).containsExactly(N1);
        assertThat(demoted.learners()).containsExactly(N0, N2);
    }

    @Test
    @DisplayName("Encoding round trip")
    void testBytes() {
        Membership m = new Membership(Set.of(N0, N2), Set.of(N1));
        assertThat(Membership.fromBytes(m.toBytes())).isEqualTo(m);
        assertThat(Membership.fromBytes(Membership.empty().toBytes()).isEmpty()).isTrue();
    }
}
