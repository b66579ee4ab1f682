package io.relaypipes.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaypipes.config.PipesConfig;
import io.relaypipes.model.Params;
import io.relaypipes.model.PipesMessage;
import io.relaypipes.model.PipesMethod;
import io.relaypipes.reader.MessageLog;
import io.relaypipes.reader.MessageLogReader;
import io.relaypipes.util.Jsons;
import io.relaypipes.util.ParamsCodec;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "relaypipes",
        mixinStandardHelpOptions = true,
        description = "Pipes protocol developer tool: build and inspect params blobs and message logs",
        subcommands = {
                RelayPipesCommand.EncodeCommand.class,
                RelayPipesCommand.DecodeCommand.class,
                RelayPipesCommand.MessagesCommand.class
        }
)
public final class RelayPipesCommand implements Runnable {
    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().getOut().println("Use subcommands: encode | decode | messages");
    }

    @Command(name = "encode", description = "Encode a JSON object as a params blob (JSON -> zlib -> base64)")
    static final class EncodeCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @ArgGroup(exclusive = true, multiplicity = "1")
        Source source;

        @Option(names = {"--env"}, description = "Print as an assignment to the context or messages variable: context|messages")
        String env;

        static final class Source {
            @Option(names = {"--file"}, required = true, description = "JSON file path")
            Path file;

            @Option(names = {"--json"}, required = true, description = "Inline JSON object")
            String json;
        }

        @Override
        public Integer call() throws Exception {
            String raw = source.file != null
                    ? Files.readString(source.file, StandardCharsets.UTF_8)
                    : source.json;
            JsonNode node = Jsons.mapper().readTree(raw);
            PrintWriter out = spec.commandLine().getOut();
            if (node == null || !node.isObject()) {
                spec.commandLine().getErr().println("Input must be a JSON object");
                return 2;
            }
            String blob = ParamsCodec.encode((ObjectNode) node);
            if (env == null || env.isBlank()) {
                out.println(blob);
            } else if ("context".equalsIgnoreCase(env)) {
                out.println(PipesConfig.DEFAULT_CONTEXT_ENV_VAR + "=" + blob);
            } else if ("messages".equalsIgnoreCase(env)) {
                out.println(PipesConfig.DEFAULT_MESSAGES_ENV_VAR + "=" + blob);
            } else {
                spec.commandLine().getErr().println("Unknown --env target: " + env);
                return 2;
            }
            return 0;
        }
    }

    @Command(name = "decode", description = "Decode a params blob and print its JSON")
    static final class DecodeCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Params blob")
        String blob;

        @Override
        public Integer call() {
            Params params = ParamsCodec.decode(blob);
            spec.commandLine().getOut().println(Jsons.toPrettyJson(params.toJson()));
            return 0;
        }
    }

    @Command(name = "messages", description = "Print the messages recovered from a messages file")
    static final class MessagesCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Option(names = {"--file"}, required = true, description = "Newline-delimited messages file")
        Path file;

        @Option(names = {"--summary"}, description = "Print only counts per method")
        boolean summary;

        @Override
        public Integer call() throws Exception {
            MessageLog log = MessageLogReader.read(file);
            PrintWriter out = spec.commandLine().getOut();
            if (!summary) {
                for (PipesMessage message : log.messages()) {
                    out.println(message.toJsonLine());
                }
            }
            Map<PipesMethod, Integer> counts = new EnumMap<>(PipesMethod.class);
            for (PipesMessage message : log.messages()) {
                counts.merge(message.method(), 1, Integer::sum);
            }
            ObjectNode report = Jsons.mapper().createObjectNode();
            report.put("messages", log.messages().size());
            ObjectNode byMethod = report.putObject("by_method");
            counts.forEach((method, count) -> byMethod.put(method.wireName(), count));
            report.put("skipped_tail_lines", log.skippedTail());
            report.put("complete", log.complete());
            out.println(Jsons.toJson(report));
            return log.complete() ? 0 : 1;
        }
    }
}
