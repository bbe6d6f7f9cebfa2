package com.metasrv.meta;

import com.metasrv.core.ForwardToLeaderException;
import com.metasrv.core.Membership;
import com.metasrv.core.MembershipChangeInProgressException;
import com.metasrv.core.NodeId;
import com.metasrv.core.RaftNode;
import com.metasrv.statemachine.AppliedState;
import com.metasrv.statemachine.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.UnaryOperator;

/**
 * Executes forwardable requests on the node that is currently the leader.
 *
 * <p>Every operation proposes one or more entries and blocks until they are
 * applied, bounded by the propose timeout. If this node is not the leader, or
 * loses leadership before the entry is applied, the operation fails with
 * {@link ForwardToLeaderException}. A timeout fails with
 * {@link RetryableException}: the entry may still be applied later.
 */
public class MetaLeader {

    private static final Logger logger = LoggerFactory.getLogger(MetaLeader.class);

    private final MetaNode metaNode;
    private final RaftNode raftNode;
    private final long timeoutMs;

    public MetaLeader(MetaNode metaNode) {
        this.metaNode = metaNode;
        this.raftNode = metaNode.getRaftNode();
        this.timeoutMs = metaNode.getConfig().getProposeTimeoutMs();
    }

    /**
     * Executes the body of a forwarded request.
     */
    public AppliedState handle(ForwardRequest.Body body) {
        if (body instanceof JoinRequest join) {
            return join(join);
        } else if (body instanceof LeaveRequest leave) {
            return leave(leave);
        } else if (body instanceof WriteRequest write) {
            return write(write.command());
        }
        throw new IllegalArgumentException("Unknown request: " + body);
    }

    /**
     * Proposes a command and returns its applied result.
     */
    public AppliedState write(Command command) {
        return await(raftNode.propose(command), "write " + command.cmd());
    }

    /**
     * Registers the node, replacing an existing descriptor, and adds it as a
     * learner unless it is already a member. Joining twice is harmless.
     */
    public AppliedState join(JoinRequest request) {
        NodeId nodeId = request.nodeId();
        logger.info("Join of node {} at {}", nodeId, request.endpoint());

        AppliedState result = write(Command.addNode(request.toNode()));

        changeMembership(m -> m.contains(nodeId) ? m : m.withLearner(nodeId), "add learner " + nodeId);
        return result;
    }

    /**
     * Unregisters the node and removes it from voters and learners. A leader
     * that removes itself steps down once the change is applied.
     */
    public AppliedState leave(LeaveRequest request) {
        NodeId nodeId = request.nodeId();
        logger.info("Leave of node {}", nodeId);

        UnaryOperator<Membership> change = m -> m.contains(nodeId) ? m.without(nodeId) : m;
        checkVoters(change.apply(raftNode.getMembership()), "remove " + nodeId);

        AppliedState result = write(Command.removeNode(nodeId));

        changeMembership(change, "remove " + nodeId);
        return result;
    }

    /**
     * Makes {@code voters} the voter set; every other member becomes a learner.
     */
    public void changeVoters(Set<NodeId> voters) {
        changeMembership(m -> m.withVoters(voters), "set voters " + voters);
    }

    /**
     * Proposes the membership computed from the effective one, retrying while
     * an earlier membership change is still uncommitted.
     */
    private void changeMembership(UnaryOperator<Membership> change, String what) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (true) {
            Membership current = raftNode.getMembership();
            Membership next = change.apply(current);
            if (next.equals(current)) {
                logger.debug("Membership unchanged by {}: {}", what, current);
                return;
            }
            checkVoters(next, what);
            try {
                await(raftNode.changeMembership(next), what);
                logger.info("Membership changed ({}): {}", what, next);
                return;
            } catch (MembershipChangeInProgressException e) {
                logger.debug("Membership change at index {} pending, waiting to {}", e.getIndex(), what);
                awaitApplied(e, deadline, what);
            }
        }
    }

    /**
     * Rejects a membership without voters before anything is written.
     */
    private static void checkVoters(Membership next, String what) {
        if (next.voters().isEmpty()) {
            throw new MetaNodeException("Cannot " + what + ": no voter would remain in " + next);
        }
    }

    /**
     * Waits on the metrics stream until the pending membership entry is
     * applied or this node stops leading.
     */
    private void awaitApplied(MembershipChangeInProgressException pending, long deadline, String what) {
        long remaining = deadline - System.nanoTime();
        try {
            metaNode.metrics().await(m -> m.lastApplied() >= pending.getIndex() || !m.isLeader(),
                    Duration.ofNanos(Math.max(0, remaining)), "membership at " + pending.getIndex() + " applied");
        } catch (TimeoutException e) {
            throw new RetryableException("Cannot " + what + ": " + pending.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryableException("Interrupted waiting to " + what, e);
        }
    }

    private AppliedState await(CompletableFuture<AppliedState> future, String what) {
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new RetryableException("Timed out after " + timeoutMs + "ms waiting for " + what
                    + "; outcome unknown", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryableException("Interrupted waiting for " + what, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new MetaNodeException("Failed to " + what, cause);
        }
    }
}
