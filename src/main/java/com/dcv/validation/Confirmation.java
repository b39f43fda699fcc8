package com.dcv.validation;

import com.dcv.domain.Domain;

import java.util.List;

/**
 * Operator approval of the candidate domains before any validation is dispatched.
 */
@FunctionalInterface
public interface Confirmation {

    /**
     * Always approves.
     */
    Confirmation ASSUME_YES = domains -> true;

    /**
     * Presents candidates and asks for approval.
     *
     * @param domains Candidate domains.
     * @return True to proceed, false to abort without side effects.
     */
    boolean confirm(List<Domain> domains);
}
