package com.mimecast.shuttle;

import com.mimecast.shuttle.config.ExcludeList;
import com.mimecast.shuttle.config.MailboxMapping;
import com.mimecast.shuttle.config.MigrationConfig;
import com.mimecast.shuttle.imap.ImapConnector;
import com.mimecast.shuttle.imap.ImapException;
import com.mimecast.shuttle.imap.JakartaImapConnector;
import com.mimecast.shuttle.main.Migrator;
import com.mimecast.shuttle.migrate.MigrationSummary;
import com.mimecast.shuttle.util.Sleeper;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import javax.naming.ConfigurationException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Paths;

/**
 * Main runnable.
 *
 * <p>Parses the command line, configures logging and runs the migration.
 *
 * <p>Exit codes:
 * <ul>
 *     <li><b>0</b> - run finished (individual messages may have failed, see log).</li>
 *     <li><b>1</b> - configuration error or source listing connection failure.</li>
 *     <li><b>2</b> - usage error.</li>
 * </ul>
 *
 * @see Migrator
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Application jar name.
     */
    private static final String NAME = "shuttle.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Resumable IMAP mailbox migration";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final String[] args;
    private final ImapConnector connector;
    private final PrintStream out;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        System.exit(new Main(args, new JakartaImapConnector(), System.out).run());
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args      String array.
     * @param connector ImapConnector instance.
     * @param out       Usage output stream.
     */
    Main(String[] args, ImapConnector connector, PrintStream out) {
        this.args = args;
        this.connector = connector;
        this.out = out;
    }

    /**
     * Runs with the given arguments.
     *
     * @return Exit code.
     */
    int run() {
        Options options = options();

        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            out.println("Options error: " + e.getMessage());
            out.println();
            optionsUsage(options);
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            optionsUsage(options);
            return EXIT_OK;
        }

        if (!cmd.hasOption("config")) {
            out.println("Options error: Missing required option: c");
            out.println();
            optionsUsage(options);
            return EXIT_USAGE;
        }

        Configurator.setRootLevel(cmd.hasOption("verbose") ? Level.DEBUG : Level.INFO);

        try {
            MigrationConfig config = new MigrationConfig(Paths.get(cmd.getOptionValue("config")));
            MailboxMapping mapping = cmd.hasOption("mapping-file") ?
                    MailboxMapping.load(Paths.get(cmd.getOptionValue("mapping-file"))) :
                    MailboxMapping.identity();
            ExcludeList excludeList = cmd.hasOption("exclude-file") ?
                    ExcludeList.load(Paths.get(cmd.getOptionValue("exclude-file"))) :
                    ExcludeList.empty();

            MigrationSummary summary = new Migrator(config, mapping, excludeList, connector, Sleeper.SYSTEM)
                    .run(cmd.hasOption("dry-run"));

            if (!summary.isClean()) {
                log.warn("Some mailboxes or messages were not migrated, run again to retry them");
            }
            return EXIT_OK;

        } catch (ConfigurationException e) {
            log.fatal("Configuration error: {}", e.getMessage());
        } catch (ImapException e) {
            log.fatal("Unable to list source mailboxes: {}", e.getMessage());
        } catch (InterruptedException e) {
            log.error("Interrupted");
            Thread.currentThread().interrupt();
        }
        return EXIT_FAILURE;
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption(Option.builder("c").longOpt("config").hasArg().argName("file")
                .desc("Run configuration file (JSON or YAML)").build());
        options.addOption(Option.builder("m").longOpt("mapping-file").hasArg().argName("file")
                .desc("Source to destination mailbox name mapping (JSON or YAML)").build());
        options.addOption(Option.builder("e").longOpt("exclude-file").hasArg().argName("file")
                .desc("Mailboxes to skip, one per line").build());
        options.addOption("d", "dry-run", false, "Report what would be migrated without changing anything");
        options.addOption("v", "verbose", false, "Debug logging");
        options.addOption("h", "help", false, "Show usage");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    private void optionsUsage(Options options) {
        out.println(USAGE);
        out.println(" " + DESCRIPTION);
        out.println();

        PrintWriter writer = new PrintWriter(out);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, USAGE, "", options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, "", true);
        writer.flush();
    }
}
