package com.questrail.replay.cli;

import com.questrail.replay.ReplayDecoder;
import com.questrail.replay.codec.InvalidFormatException;
import com.questrail.replay.config.ReplayDecoderConfig;
import com.questrail.replay.json.DecodeResultJson;
import com.questrail.replay.model.DecodeResult;
import com.questrail.replay.observability.Slf4jReplayObservabilitySink;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line front end: decodes one replay file and writes its JSON form.
 *
 * <pre>
 * replay-dump --in &lt;file.rep&gt; [--out &lt;file.json&gt;]
 * </pre>
 *
 * Exit codes: {@code 0} success, {@code 1} not a replay, {@code 2} usage,
 * {@code 3} I/O failure.
 */
public final class ReplayDumpCli
{
    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_FORMAT = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    private ReplayDumpCli() {}

    public static void main(String[] args)
    {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err)
    {
        String in = null;
        String outFile = null;
        for (int i = 0; i < args.length; i++) {
            if ("--in".equals(args[i]) && i + 1 < args.length) in = args[++i];
            else if ("--out".equals(args[i]) && i + 1 < args.length) outFile = args[++i];
            else {
                err.println("Unknown argument: " + args[i]);
                in = null;
                break;
            }
        }
        if (in == null) {
            err.println("Usage: replay-dump --in <file.rep> [--out <file.json>]");
            return EXIT_USAGE;
        }

        final ReplayDecoder decoder = new ReplayDecoder(ReplayDecoderConfig.builder()
                .withObservabilitySink(new Slf4jReplayObservabilitySink())
                .build());

        try {
            final DecodeResult result = decoder.decode(Path.of(in));
            final String json = new DecodeResultJson().toPrettyJson(result);
            if (outFile == null) {
                out.println(json);
            }
            else {
                Files.writeString(Path.of(outFile), json, StandardCharsets.UTF_8);
            }
            return EXIT_OK;
        }
        catch (InvalidFormatException e) {
            err.println("Not a replay: " + e.getMessage());
            return EXIT_INVALID_FORMAT;
        }
        catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        }
    }
}
