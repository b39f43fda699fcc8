/**
 * Domain control validation renewal.
 *
 * <p>Selects expiring domains, validates each through a
 * {@link com.dcv.validation.DomainValidationWorkflow} and schedules many workflows
 * behind a {@link com.dcv.validation.RateGate}.
 *
 * @see com.dcv.validation.ValidationScheduler
 */
package com.dcv.validation;
