package com.dcv.ultradns;

import com.dcv.api.ApiException;
import com.dcv.api.AuthenticationException;

/**
 * DNS provider capability consumed by the validation core.
 *
 * <p>One authenticated instance is shared by all workflows of a run.
 */
public interface DnsProviderClient {

    /**
     * Logs in and keeps the session for subsequent calls.
     *
     * @throws AuthenticationException On any login failure.
     */
    void authenticate() throws AuthenticationException;

    /**
     * Checks if the zone is hosted by the provider.
     *
     * @param zone Zone name.
     * @return True if found.
     * @throws ApiException On transport or status failure other than not found.
     */
    boolean zoneExists(String zone) throws ApiException;

    /**
     * Creates a CNAME record.
     *
     * @param zone   Zone name.
     * @param label  Record label.
     * @param target Record target.
     * @throws ApiException On transport or status failure.
     */
    void createCname(String zone, String label, String target) throws ApiException;

    /**
     * Deletes a CNAME record.
     *
     * @param zone  Zone name.
     * @param label Record label.
     * @throws ApiException NOT_FOUND if the record is already absent, otherwise on transport or status failure.
     */
    void deleteCname(String zone, String label) throws ApiException;
}
