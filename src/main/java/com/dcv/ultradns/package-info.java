/**
 * DNS provider client.
 *
 * <p>{@link com.dcv.ultradns.DnsProviderClient} is the capability the validation core consumes.
 * <br>{@link com.dcv.ultradns.UltraDnsClient} implements it against the UltraDNS REST API.
 */
package com.dcv.ultradns;
