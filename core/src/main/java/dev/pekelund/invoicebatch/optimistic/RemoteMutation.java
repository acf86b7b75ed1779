package dev.pekelund.invoicebatch.optimistic;

/**
 * Blocking server call that confirms an optimistic operation. Throwing means the server rejected it.
 */
@FunctionalInterface
public interface RemoteMutation {

    void execute() throws Exception;
}
