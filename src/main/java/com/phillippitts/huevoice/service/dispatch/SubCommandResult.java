package com.phillippitts.huevoice.service.dispatch;

/**
 * Outcome of dispatching one sub-command of a chain.
 */
public record SubCommandResult(String subCommand, Directive directive, DispatchOutcome outcome) {
}
