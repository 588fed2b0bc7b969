package com.example.fssnapshot;

import com.example.fssnapshot.model.ImportId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final String USAGE = "Usage: java -jar fs-snapshot.jar store <config.json> <spec>\n"
            + "       java -jar fs-snapshot.jar diff <config.json> <spec> <importId>";

    private App() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 3 || !("store".equals(args[0]) || "diff".equals(args[0]))) {
            usage();
        }
        String command = args[0];
        SnapshotConfig config = new ConfigLoader().loadSpec(Path.of(args[1]), args[2]);
        switch (command) {
            case "store" -> {
                ImportSummary summary = new ImportService().store(config);
                System.out.println(summary.id());
            }
            case "diff" -> {
                if (args.length < 4) {
                    usage();
                }
                DiffService service = new DiffService();
                DiffReport report = service.diff(config, ImportId.fromHex(args[3]));
                Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
                service.write(report, out);
                out.flush();
            }
            default -> usage();
        }
    }

    private static void usage() {
        LOGGER.error(USAGE);
        System.exit(1);
    }
}
