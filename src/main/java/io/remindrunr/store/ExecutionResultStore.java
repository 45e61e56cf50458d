package io.remindrunr.store;

import io.remindrunr.prompt.ExecutionResult;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for prompt execution results.
 */
public interface ExecutionResultStore {

    ExecutionResult append(ExecutionResult result);

    /**
     * Returns all results, newest first.
     */
    List<ExecutionResult> findAll();

    Optional<ExecutionResult> findById(String id);

    /**
     * @return false if no result has this id
     */
    boolean delete(String id);
}
