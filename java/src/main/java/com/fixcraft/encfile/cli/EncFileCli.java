package com.fixcraft.encfile.cli;

import com.fixcraft.encfile.Constants;
import com.fixcraft.encfile.CryptoBackends;
import com.fixcraft.encfile.EncryptedFile;
import com.fixcraft.encfile.FileOptions;
import com.fixcraft.encfile.NoncePolicy;
import com.fixcraft.encfile.RuntimeLog;
import com.fixcraft.encfile.StorageStat;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class EncFileCli {

    private static final class GlobalOptions {
        final boolean verbose;
        final boolean noLog;
        final FileOptions file;
        final String[] args;

        GlobalOptions(boolean verbose, boolean noLog, FileOptions file, String[] args) {
            this.verbose = verbose;
            this.noLog = noLog;
            this.file = file;
            this.args = args;
        }
    }

    private EncFileCli() {}

    public static void main(String[] args) {
        int code = run(args, System.out);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out) {
        if (args == null || args.length == 0) {
            usage(out);
            return 2;
        }
        GlobalOptions globals;
        try {
            globals = parseGlobalOptions(args);
        } catch (IllegalArgumentException exc) {
            System.err.println("Error: " + exc.getMessage());
            return 2;
        }
        RuntimeLog.configureFromCli(globals.verbose, globals.noLog);
        args = globals.args;
        if (args.length == 0) {
            usage(out);
            return 2;
        }

        String command = args[0];
        int argc = args.length;
        FileOptions options = globals.file;
        RuntimeLog.debug("op=" + command + " sector=" + options.sectorSize + " kdf=" + options.kdf.label
            + " crypto=" + options.backend.name() + " nonce=" + options.noncePolicy);
        try {
            switch (command) {
                case "create":
                    if (argc < 3) {
                        usage(out);
                        return 2;
                    }
                    try (EncryptedFile ef = EncryptedFile.create(path(args[1]), password(args[2]), options)) {
                        out.println("created " + ef.name() + " (sector size " + ef.sectorSize() + ")");
                    }
                    return 0;
                case "write":
                    if (argc < 5) {
                        usage(out);
                        return 2;
                    }
                    byte[] payload = Files.readAllBytes(path(args[4]));
                    try (EncryptedFile ef = EncryptedFile.open(path(args[1]), password(args[2]), options)) {
                        int n = ef.writeAt(payload, parseLong(args[3], "offset"));
                        ef.sync();
                        out.println("wrote " + n + " bytes");
                    }
                    return 0;
                case "read":
                    if (argc < 6) {
                        usage(out);
                        return 2;
                    }
                    int length;
                    try {
                        length = parseSize(args[4], "length");
                    } catch (IllegalArgumentException exc) {
                        System.err.println("Error: " + exc.getMessage());
                        return 2;
                    }
                    byte[] buf = new byte[length];
                    try (EncryptedFile ef = EncryptedFile.openViewOnly(path(args[1]), password(args[2]), options)) {
                        ef.readAt(buf, parseLong(args[3], "offset"));
                    }
                    if ("-".equals(args[5])) {
                        out.write(buf, 0, buf.length);
                        out.flush();
                    } else {
                        Files.write(path(args[5]), buf);
                    }
                    return 0;
                case "info":
                    if (argc < 3) {
                        usage(out);
                        return 2;
                    }
                    try (EncryptedFile ef = EncryptedFile.openViewOnly(path(args[1]), password(args[2]), options)) {
                        StorageStat stat = ef.stat();
                        out.println("file:        " + stat.name());
                        out.println("size:        " + stat.size());
                        out.println("modified:    " + stat.lastModified());
                        out.println("sector size: " + ef.sectorSize());
                        out.println("sectors:     " + ef.countSectors());
                    }
                    return 0;
                case "passwd":
                    if (argc < 4) {
                        usage(out);
                        return 2;
                    }
                    EncryptedFile.changePassphrase(path(args[1]), password(args[2]), password(args[3]), options);
                    out.println("passphrase changed");
                    return 0;
                case "zero":
                    if (argc < 4) {
                        usage(out);
                        return 2;
                    }
                    try (EncryptedFile ef = EncryptedFile.open(path(args[1]), password(args[2]), options)) {
                        ef.zeroSector(parseLong(args[3], "sector"));
                        ef.sync();
                    }
                    return 0;
                case "delete":
                    if (argc < 3) {
                        usage(out);
                        return 2;
                    }
                    EncryptedFile doomed = EncryptedFile.open(path(args[1]), password(args[2]), options);
                    try {
                        doomed.delete();
                    } finally {
                        doomed.close();
                    }
                    out.println("deleted " + args[1]);
                    return 0;
                default:
                    usage(out);
                    return 2;
            }
        } catch (IOException | RuntimeException exc) {
            System.err.println("Error: " + describe(exc));
            return 1;
        }
    }

    private static GlobalOptions parseGlobalOptions(String[] args) {
        boolean verbose = false;
        boolean noLog = false;
        FileOptions file = new FileOptions();
        List<String> cleaned = new ArrayList<String>(args.length);
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--verbose".equals(arg) || "-v".equals(arg)) {
                verbose = true;
                continue;
            }
            if ("--no-log".equals(arg)) {
                noLog = true;
                continue;
            }
            if ("--sector-size".equals(arg)) {
                file.sectorSize = parseSize(optionValue(args, ++i, arg), arg);
                continue;
            }
            if ("--kdf".equals(arg)) {
                file.kdf.label = optionValue(args, ++i, arg);
                continue;
            }
            if ("--crypto".equals(arg)) {
                file.backend = CryptoBackends.byName(optionValue(args, ++i, arg));
                continue;
            }
            if ("--nonce".equals(arg)) {
                file.noncePolicy = parseNoncePolicy(optionValue(args, ++i, arg));
                continue;
            }
            cleaned.add(arg);
        }
        return new GlobalOptions(verbose, noLog, file, cleaned.toArray(new String[0]));
    }

    private static String optionValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " needs a value");
        }
        return args[index];
    }

    private static NoncePolicy parseNoncePolicy(String raw) {
        String value = raw.trim().toLowerCase(Locale.US);
        if ("fixed".equals(value)) {
            return NoncePolicy.FIXED;
        }
        if ("sector".equals(value) || "sector-index".equals(value)) {
            return NoncePolicy.SECTOR_INDEX;
        }
        throw new IllegalArgumentException("Unknown nonce policy: " + raw);
    }

    private static long parseLong(String raw, String what) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException exc) {
            throw new IllegalArgumentException("Invalid " + what + ": " + raw);
        }
    }

    private static int parseSize(String raw, String what) {
        long value = parseLong(raw, what);
        if (value < 0) {
            throw new IllegalArgumentException("Negative " + what + ": " + raw);
        }
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException exc) {
            throw new IllegalArgumentException(what + " out of range: " + raw);
        }
    }

    private static Path path(String raw) {
        return Paths.get(raw);
    }

    private static byte[] password(String raw) {
        return raw.getBytes(StandardCharsets.UTF_8);
    }

    private static String describe(Exception exc) {
        String message = exc.getMessage();
        String type = exc.getClass().getSimpleName();
        return message == null ? type : type + ": " + message;
    }

    private static void usage(PrintStream out) {
        out.println("encfile " + Constants.ENGINE_VERSION);
        out.println("  [global] --verbose|-v --no-log");
        out.println("  [file]   --sector-size <n> (default " + Constants.DEFAULT_SECTOR_SIZE + ")"
            + " --kdf " + Constants.KDF_SCRYPT + "|" + Constants.KDF_PBKDF2
            + " --crypto jce|bc --nonce fixed|sector");
        out.println("  create <file> <password>");
        out.println("  write <file> <password> <offset> <in>");
        out.println("  read <file> <password> <offset> <length> <out|->");
        out.println("  info <file> <password>");
        out.println("  passwd <file> <old-password> <new-password>");
        out.println("  zero <file> <password> <sector>");
        out.println("  delete <file> <password>");
    }
}
