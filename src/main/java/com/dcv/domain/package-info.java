/**
 * Domain control validation data model.
 *
 * <p>Snapshots of certificate authority domains, the token pairs issued for a validation attempt,
 * <br>the temporary DNS records built from them and the per-domain outcome of a workflow run.
 */
package com.dcv.domain;
