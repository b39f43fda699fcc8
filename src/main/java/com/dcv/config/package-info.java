/**
 * Handles the configuration of the DCV application.
 *
 * <p>Provides the configuration foundation and typed accessors for the run settings,
 * <br>the DigiCert certificate authority client and the UltraDNS provider client.
 *
 * <p>Configuration is read from <i>dcv.json5</i> in the configuration directory.
 * <br>The directory defaults to <i>cfg/</i> and can be given as the first program argument
 * <br>or via a system property called <i>dcv.config</i>.
 * <br><b>Example:</b>
 * <pre>java -jar dcv.jar cfg/</pre>
 *
 * <p>Credentials can be supplied through environment variables instead of the file:
 * <i>DIGICERT_KEY</i>, <i>NEU_USERNAME</i> and <i>NEU_PASSWORD</i>.
 */
package com.dcv.config;
