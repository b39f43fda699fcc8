package com.dcv.digicert;

import com.dcv.api.ApiException;
import com.dcv.domain.DcvMethod;
import com.dcv.domain.Domain;
import com.dcv.domain.DomainDetail;
import com.dcv.domain.ValidationStatus;
import com.dcv.domain.ValidationToken;

import java.util.List;

/**
 * Certificate authority capability consumed by the validation core.
 *
 * <p>Implementations must be safe to share between concurrently running workflows.
 */
public interface CertificateAuthorityClient {

    /**
     * Lists all domains.
     *
     * @return List of Domain.
     * @throws ApiException On transport or status failure.
     */
    List<Domain> listDomains() throws ApiException;

    /**
     * Lists at most given number of domains.
     *
     * @param limit Maximum records.
     * @return List of Domain.
     * @throws ApiException On transport or status failure.
     */
    List<Domain> listDomains(int limit) throws ApiException;

    /**
     * Finds domains by exact name.
     *
     * @param name FQDN.
     * @return List of Domain, empty if not found.
     * @throws ApiException On transport or status failure.
     */
    List<Domain> findDomains(String name) throws ApiException;

    /**
     * Gets domain with validation status and expiration.
     *
     * @param id Domain identifier.
     * @return DomainDetail.
     * @throws ApiException On transport or status failure.
     */
    DomainDetail getDomainDetail(String id) throws ApiException;

    /**
     * Changes the domain control validation method.
     *
     * @param id     Domain identifier.
     * @param method New method.
     * @return ValidationToken issued for the new method.
     * @throws ApiException On transport or status failure, or missing token.
     */
    ValidationToken changeValidationMethod(String id, DcvMethod method) throws ApiException;

    /**
     * Submits the domain for OV and EV validation.
     *
     * @param id Domain identifier.
     * @return ValidationToken to be provisioned.
     * @throws ApiException On transport or status failure, or missing token.
     */
    ValidationToken submitForValidation(String id) throws ApiException;

    /**
     * Gets current validation tracks.
     *
     * @param id Domain identifier.
     * @return List of ValidationStatus.
     * @throws ApiException On transport or status failure; DATA if no tracks were reported.
     */
    List<ValidationStatus> checkValidationStatus(String id) throws ApiException;
}
