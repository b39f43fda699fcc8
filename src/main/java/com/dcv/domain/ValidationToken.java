package com.dcv.domain;

/**
 * Token pair issued by the certificate authority for one validation attempt.
 *
 * @param token             DNS record label.
 * @param verificationValue DNS record target.
 */
public record ValidationToken(String token, String verificationValue) {
}
