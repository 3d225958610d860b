/**
 * Turn history as seen by the workflow engine: {@link com.pathwise.turn.TurnRecord} entries in order,
 * and {@link com.pathwise.turn.TurnHistories} to find the latest tool output and user message.
 */
package com.pathwise.turn;
