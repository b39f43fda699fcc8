package com.dcv;

import com.dcv.config.DcvConfig;
import com.dcv.config.DigiCertConfig;
import com.dcv.config.UltraDnsConfig;
import com.dcv.digicert.DigiCertClient;
import com.dcv.main.Runner;
import com.dcv.ultradns.UltraDnsClient;
import com.dcv.validation.Confirmation;
import com.dcv.validation.ConsoleConfirmation;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Main runnable.
 *
 * <p>Reads <i>dcv.json5</i> from the configuration directory given as first argument,
 * the <i>dcv.config</i> system property or <i>cfg/</i>, in that order.
 * <p>Credentials come from configuration or the environment.
 *
 * @see Runner
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Configuration file name.
     */
    public static final String CONFIG_FILE = "dcv.json5";

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Loads configuration and runs the configured mode.
     *
     * @param args String array.
     * @return Exit code.
     */
    static int run(String[] args) {
        String dir = args.length > 0 ? args[0] : System.getProperty("dcv.config", "cfg/");
        Path path = Path.of(dir, CONFIG_FILE);

        DcvConfig config;
        try {
            config = new DcvConfig(path.toString());
        } catch (IOException e) {
            log.error("Unable to load configuration {}: {}", path, e.getMessage());
            return Runner.FAILURE;
        }

        // Credentials.
        if (StringUtils.isBlank(config.getDigiCert().getKey())) {
            log.error("DigiCert API key missing, set digicert.key or {}", DigiCertConfig.KEY_ENV);
            return Runner.FAILURE;
        }
        if (StringUtils.isAnyBlank(config.getUltraDns().getUsername(), config.getUltraDns().getPassword())) {
            log.error("UltraDNS credentials missing, set ultradns.username and ultradns.password or {} and {}",
                    UltraDnsConfig.USERNAME_ENV, UltraDnsConfig.PASSWORD_ENV);
            return Runner.FAILURE;
        }

        DigiCertClient digiCert = DigiCertClient.fromConfig(config.getDigiCert());
        UltraDnsClient ultraDns = UltraDnsClient.fromConfig(config.getUltraDns());

        Confirmation confirmation = config.isAssumeYes() ? Confirmation.ASSUME_YES : new ConsoleConfirmation();
        return new Runner(config, digiCert, ultraDns, confirmation).run();
    }
}
