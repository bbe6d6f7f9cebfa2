package com.metasrv.statemachine;

/**
 * The replicated state machine driven by the committed log.
 *
 * <h2>Determinism Requirement</h2>
 * <p>Given the same initial state and the same sequence of commands, every
 * replica must reach the same state and produce the same results. Apply must
 * not read the clock, random sources or any local configuration.
 *
 * <h2>Command Processing</h2>
 * <p>{@link #apply(long, Command)} is called once per committed index,
 * strictly in log order, from a single thread. Replaying a suffix of the log
 * on top of a snapshot must give the same state as the original run.
 *
 * @see Command
 * @see MetaStateMachine
 */
public interface StateMachine {

    /**
     * Applies a committed command.
     *
     * @param index log index of the command
     * @param command the command to apply
     * @return the typed result returned to the proposer
     */
    AppliedState apply(long index, Command command);

    /**
     * Serializes the complete state, consistent as of the last applied index.
     */
    byte[] takeSnapshot();

    /**
     * Replaces the complete state with a snapshot. Empty or {@code null} data
     * restores the empty state.
     */
    void restoreSnapshot(byte[] data);
}
