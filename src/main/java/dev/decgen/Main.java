package dev.decgen;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

import dev.decgen.config.GeneratorConfig;
import dev.decgen.model.DecoratorKind;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path sourceDir = null;
        Path out = null;
        Path configFile = null;
        String interfaceName = null;
        String structName = null;
        String type = null;
        String packageName = null;
        String contextType = null;

        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                printUsage();
                return 0;
            }
            if (arg.startsWith("--interface=")) {
                interfaceName = arg.substring("--interface=".length()).trim();
                continue;
            }
            if (arg.startsWith("--struct=")) {
                structName = arg.substring("--struct=".length()).trim();
                continue;
            }
            if (arg.startsWith("--out=")) {
                out = Paths.get(arg.substring("--out=".length()));
                continue;
            }
            if (arg.startsWith("--type=")) {
                type = arg.substring("--type=".length()).trim();
                continue;
            }
            if (arg.startsWith("--package=")) {
                packageName = arg.substring("--package=".length()).trim();
                continue;
            }
            if (arg.startsWith("--contextType=")) {
                contextType = arg.substring("--contextType=".length()).trim();
                continue;
            }
            if (arg.startsWith("--config=")) {
                configFile = Paths.get(arg.substring("--config=".length()));
                continue;
            }
            if (arg.startsWith("--")) {
                System.err.println("ERROR: unknown argument: " + arg);
                printUsage();
                return 2;
            }
            if (sourceDir == null) {
                sourceDir = Paths.get(arg);
                continue;
            }
            System.err.println("ERROR: unexpected argument: " + arg);
            printUsage();
            return 2;
        }

        if (sourceDir == null) {
            System.err.println("ERROR: source directory is required");
            printUsage();
            return 2;
        }
        if (isBlank(interfaceName) || out == null || isBlank(type)) {
            System.err.println("ERROR: --interface, --out and --type are required");
            printUsage();
            return 2;
        }
        final Optional<DecoratorKind> kind = DecoratorKind.fromLiteral(type);
        if (kind.isEmpty()) {
            System.err.println("ERROR: unknown type '" + type + "', expected one of " + DecoratorKind.literals());
            printUsage();
            return 2;
        }
        if (isBlank(structName)) {
            structName = interfaceName + "Tracer";
        }

        try {
            GeneratorConfig config = configFile == null ? GeneratorConfig.defaults() : GeneratorConfig.load(configFile);
            if (!isBlank(contextType)) {
                config = config.withContextType(contextType);
            }
            if (!isBlank(packageName)) {
                config = config.withPackageName(packageName);
            }

            final Generator generator = new Generator(config);
            final Path written = generator.generate(
                    sourceDir.toAbsolutePath().normalize(), interfaceName, kind.get(), structName, out);
            System.out.println("Decorator written to: " + written);
            return 0;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to generate decorator: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static void printUsage() {
        System.out.println("Usage: decgen <sourceDir> --interface=<Name> --out=<File.java> --type=<kind> [options]");
        System.out.println("Options:");
        System.out.println("  --interface=<Name>      Interface to decorate, declared in sourceDir");
        System.out.println("  --out=<path>            Output file, named <struct>.java");
        System.out.println("  --type=<kind>           One of " + String.join(", ", DecoratorKind.literals()));
        System.out.println("  --struct=<Name>         Generated class name (default: <Interface>Tracer)");
        System.out.println("  --package=<pkg>         Package of the generated class (default: located from --out)");
        System.out.println("  --contextType=<fqcn>    First-parameter type (default: "
                + GeneratorConfig.DEFAULT_CONTEXT_TYPE + ")");
        System.out.println("  --config=<file.json>    JSON config: contextType, readOnlyMethods, packageName");
        System.out.println("  --help, -h              Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
