package com.expressiongraph;

import java.time.Duration;

public final class OptionsParser {

    private OptionsParser() {}

    public static VisualizeOptions parse(String[] args){
        VisualizeOptions.Builder b = new VisualizeOptions.Builder();
        String input = null;

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-i": case "--input": input = value(args, ++i, a); break;
                case "-o": case "--output": b.outputPath(value(args, ++i, a)); break;
                case "-l": case "--log": b.log(true); break;
                case "-d": case "--dark": b.dark(true); break;
                case "-w": case "--weighted": b.weighted(true); break;
                case "-s": case "--seed": b.seed(Long.parseLong(value(args, ++i, a))); break;
                case "--iterations": b.iterations(nonNegative(value(args, ++i, a), a)); break;
                case "--threads": b.threads(Integer.parseInt(value(args, ++i, a))); break;
                case "--size": b.imageSize(Integer.parseInt(value(args, ++i, a))); break;
                case "--time-budget": b.layoutBudget(Duration.ofSeconds(nonNegative(value(args, ++i, a), a))); break;
                case "--json": b.jsonPath(value(args, ++i, a)); break;
                default:
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    // bare path, same as -i
                    if (input != null) throw new IllegalArgumentException("Multiple inputs: " + a);
                    input = a;
            }
        }
        if (input == null) throw new IllegalArgumentException("Missing input file");
        return b.inputPath(input).build();
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + option);
        return args[i];
    }

    private static int nonNegative(String s, String option) {
        int v = Integer.parseInt(s);
        if (v < 0) throw new IllegalArgumentException(option + " must be >= 0: " + v);
        return v;
    }
}
