/**
 * Certificate authority client.
 *
 * <p>{@link com.dcv.digicert.CertificateAuthorityClient} is the capability the validation core consumes.
 * <br>{@link com.dcv.digicert.DigiCertClient} implements it against the DigiCert Services API v2.
 */
package com.dcv.digicert;
