package io.tongchi;

import io.tongchi.cli.TongchiCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TongchiCommand()).execute(args);
        System.exit(code);
    }
}
