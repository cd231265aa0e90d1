package com.fixcraft.encfile;

import java.util.Locale;

public final class RuntimeLog {
    private static volatile Boolean cliVerbose;
    private static volatile Boolean cliNoLog;

    private RuntimeLog() {}

    public static void configureFromCli(boolean verbose, boolean noLog) {
        cliVerbose = Boolean.valueOf(verbose);
        cliNoLog = Boolean.valueOf(noLog);
    }

    public static void warn(String message) {
        if (switchedOn(cliNoLog, "encfile.noLog", "ENCFILE_NO_LOG")) {
            return;
        }
        System.err.println("encfile: warning: " + message);
    }

    public static void debug(String message) {
        if (switchedOn(cliNoLog, "encfile.noLog", "ENCFILE_NO_LOG")
            || !switchedOn(cliVerbose, "encfile.verbose", "ENCFILE_VERBOSE")) {
            return;
        }
        System.err.println("encfile[" + Thread.currentThread().getName() + "]: " + message);
    }

    // CLI flag, then system property, then environment.
    private static boolean switchedOn(Boolean cli, String property, String env) {
        if (cli != null) {
            return cli.booleanValue();
        }
        String raw = System.getProperty(property);
        if (raw == null) {
            raw = System.getenv(env);
        }
        if (raw == null) {
            return false;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return "1".equals(value) || "true".equals(value) || "yes".equals(value) || "on".equals(value);
    }
}
