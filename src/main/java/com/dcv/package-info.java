/**
 * Domain control validation renewal using DigiCert and UltraDNS.
 *
 * @see com.dcv.Main
 */
package com.dcv;
