package org.calista.chainhal;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.calista.chainhal.core.HalKernel;
import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.think.Conversation;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Scanner;

/**
 * HalApp — command-line runner.
 *
 * <pre>
 *   chainhal [--config FILE] [--brain FILE] [--debug] chat
 *   chainhal [--config FILE] [--brain FILE] [--debug] train FILE...
 * </pre>
 *
 * Exit codes: 0 ok, 1 runtime failure, 2 usage error.
 */
public final class HalApp {

    private static final Logger log = LogManager.getLogger(HalApp.class);

    static final String PROMPT = "> ";
    static final String SPEECHLESS = "i am speechless :(";

    private final InputStream in;
    private final PrintStream out;

    private Path cfgPath = Path.of("config/chainhal.json");
    private Path brainFile;
    private boolean debug;
    private String command;
    private final List<Path> files = new ArrayList<>();

    public static void main(String[] args) {
        int rc = new HalApp(System.in, System.out).run(args);
        if (rc != 0) System.exit(rc);
    }

    public HalApp(InputStream in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public int run(String[] args) {
        try {
            parseArgs(args);
        } catch (IllegalArgumentException e) {
            out.println("error: " + e.getMessage());
            out.println(usage());
            return 2;
        }

        if (debug) Configurator.setLevel("org.calista.chainhal", Level.DEBUG);

        try {
            HalKernel kernel = HalKernel.builder()
                    .configRoot(Path.of("."))
                    .brainFile(brainFile)
                    .requireExistingBrain("chat".equals(command))
                    .build(cfgPath);

            if ("train".equals(command)) {
                kernel.train(files);
            } else {
                runConsoleLoop(kernel);
            }
            return 0;
        } catch (NoSuchFileException e) {
            log.error("Brain file not found: {} (train one first)", e.getFile());
            return 1;
        } catch (IOException | RuntimeException e) {
            log.error("chainhal failed", e);
            return 1;
        }
    }

    void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--config":
                    cfgPath = Path.of(requireValue(args, ++i, a));
                    break;
                case "--brain":
                    brainFile = Path.of(requireValue(args, ++i, a));
                    break;
                case "--debug":
                    debug = true;
                    break;
                default:
                    if (a.startsWith("--")) throw new IllegalArgumentException("unknown option " + a);
                    if (command == null) {
                        command = a;
                    } else {
                        files.add(Path.of(a));
                    }
            }
        }

        if (command == null) throw new IllegalArgumentException("missing command");
        switch (command) {
            case "chat":
                if (!files.isEmpty()) throw new IllegalArgumentException("chat takes no arguments");
                break;
            case "train":
                if (files.isEmpty()) throw new IllegalArgumentException("train needs at least one file");
                break;
            default:
                throw new IllegalArgumentException("unknown command " + command);
        }
    }

    private static String requireValue(String[] args, int i, String opt) {
        if (i >= args.length) throw new IllegalArgumentException(opt + " needs a value");
        return args[i];
    }

    static String usage() {
        return "usage: chainhal [--config FILE] [--brain FILE] [--debug] chat\n"
                + "       chainhal [--config FILE] [--brain FILE] [--debug] train FILE...";
    }

    private void runConsoleLoop(HalKernel kernel) throws IOException {
        Conversation conversation = kernel.conversation();
        long turns = 0;
        int every = kernel.config().chat.saveEveryTurns;

        log.info("chat started. chains={}", kernel.brain().chainCount());

        Sentence opener = conversation.opener();
        out.println(opener.isEmpty() ? "hello!" : "hello! " + opener);

        try (Scanner sc = new Scanner(in)) {
            while (true) {
                out.print(PROMPT);
                out.flush();
                if (!sc.hasNextLine()) break;

                String user = sc.nextLine().trim();
                if (user.equalsIgnoreCase("exit") || user.equalsIgnoreCase("quit")) break;
                if (user.isEmpty()) continue;

                List<Sentence> input = kernel.annotator().annotate(user);
                if (debug) {
                    for (Sentence s : input) out.println("[" + s.toTaggedString() + "]");
                }

                Sentence reply = conversation.respond(input);
                out.println(reply.isEmpty() ? SPEECHLESS : reply.toString());

                turns++;
                if (every > 0 && (turns % every == 0)) kernel.saveBrain();
            }
        }

        kernel.saveBrain();
        out.println("bye!");
    }
}
