/**
 * Error taxonomy shared by the certificate authority and DNS provider clients.
 */
package com.dcv.api;
